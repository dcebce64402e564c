package com.billsync.billsync.sync;

import com.billsync.billsync.stats.RunStatistics;

import java.util.List;

/**
 * Result of one inbox pass: one entry per processed input file in processing order, plus the PDF scan
 * that supplied issuance evidence.
 */
public record InboxRunResult(List<RunStatistics> runs, int documentsScanned, int psidsExtracted, boolean aborted) {

    public InboxRunResult {
        runs = runs == null ? List.of() : List.copyOf(runs);
    }
}
