package com.billsync.billsync.upload;

import java.util.List;

/**
 * Idempotent write surface for one table: records are inserted when their key is absent and overwrite
 * the stored row when it is present. Implementations never delete.
 */
public interface UpsertTarget<T> {

    TargetTable table();

    /**
     * Writes one batch atomically and returns the number of records written.
     */
    int upsertBatch(List<T> records);
}
