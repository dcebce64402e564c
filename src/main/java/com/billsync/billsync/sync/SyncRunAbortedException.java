package com.billsync.billsync.sync;

/**
 * Raised when a run cannot proceed at all: audit logs cannot be opened or the database is unreachable.
 */
public class SyncRunAbortedException extends RuntimeException {

    public SyncRunAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
