package com.billsync.billsync.stats;

import java.util.List;

public interface RunHistoryRepository {

    void record(RunStatistics statistics);

    /**
     * Most recent runs first.
     */
    List<RunStatistics> recentRuns(int limit);
}
