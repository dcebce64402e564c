package com.billsync.billsync.sync;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Enables binding of reconciliation configuration properties and shared infrastructure beans.
 */
@Configuration
@EnableConfigurationProperties(SyncProperties.class)
public class SyncConfig {

    @Bean
    Clock syncClock() {
        return Clock.systemDefaultZone();
    }
}
