package com.billsync.billsync.pdf;

public enum ExtractionStatus {
    SUCCESS,
    NOT_FOUND,
    AMBIGUOUS,
    UNREADABLE
}
