package com.billsync.billsync.stats;

import java.util.List;

/**
 * Current table totals plus the most recent runs, newest first.
 */
public record SyncStatisticsResponse(TableTotals totals, List<RunStatistics> recentRuns) {
}
