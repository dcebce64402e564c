package com.billsync.billsync.stats;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Summary of one run against one table. {@code rejected} includes records degraded by failed batch
 * writes ({@code writeFailures}); {@code abortReason} is set whenever the run stopped early.
 */
public record RunStatistics(
        long runId,
        String table,
        String source,
        LocalDateTime startedAt,
        LocalDateTime finishedAt,
        int synced,
        int pending,
        int rejected,
        int writeFailures,
        int issued,
        int listed,
        int batchesCommitted,
        int batchesFailed,
        int unprocessed,
        boolean aborted,
        String abortReason
) {

    public int total() {
        return synced + pending + rejected + unprocessed;
    }

    public long durationMillis() {
        if (startedAt == null || finishedAt == null) {
            return 0L;
        }
        return Duration.between(startedAt, finishedAt).toMillis();
    }
}
