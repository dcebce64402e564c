package com.billsync.billsync.upload;

import com.billsync.billsync.sync.SyncConstants;

/**
 * Tables written by the upsert engine.
 */
public enum TargetTable {
    SURVEY_UNITS(SyncConstants.TABLE_SURVEY_UNITS),
    BILLS(SyncConstants.TABLE_BILLS);

    private final String tableName;

    TargetTable(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
