package com.billsync.billsync.classify;

/**
 * Outcome of classifying one incoming record. Only {@link #REJECTED} is an error; {@link #PENDING_SYNC}
 * is a legitimate pre-billing state whose owning survey unit has not been synced yet.
 */
public enum ClassificationState {
    SYNCED,
    PENDING_SYNC,
    REJECTED
}
