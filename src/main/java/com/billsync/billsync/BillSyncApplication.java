package com.billsync.billsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BillSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(BillSyncApplication.class, args);
    }
}
