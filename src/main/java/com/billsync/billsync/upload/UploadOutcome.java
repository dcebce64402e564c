package com.billsync.billsync.upload;

/**
 * Per-run counts produced by {@link UpsertEngine}. {@code rejected} includes {@code writeFailures};
 * {@code unprocessed} counts eligible records that were read but never sent because the run was aborted.
 */
public record UploadOutcome(
        String table,
        int synced,
        int pending,
        int rejected,
        int writeFailures,
        int issued,
        int listed,
        int batchesCommitted,
        int batchesFailed,
        int unprocessed,
        boolean aborted
) {

    public int total() {
        return synced + pending + rejected + unprocessed;
    }
}
