package com.billsync.billsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the inbox pass on the cron expression in {@code billsync.cron}; "-" disables it.
 */
@Component
public class SyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private final SyncService syncService;

    public SyncScheduler(SyncService syncService) {
        this.syncService = syncService;
    }

    @Scheduled(cron = "${billsync.cron:-}")
    public void scheduledInbox() {
        try {
            InboxRunResult result = syncService.syncInbox();
            log.info("Scheduled inbox pass complete. files={}, documents={}, psids={}, aborted={}",
                    result.runs().size(), result.documentsScanned(), result.psidsExtracted(), result.aborted());
        } catch (SyncRunAbortedException ex) {
            log.error("Scheduled inbox pass stopped: {}", ex.getMessage(), ex);
        }
    }
}
