package com.billsync.billsync.ingest;

/**
 * Payment state reported by the billing portal for one monthly bill.
 */
public enum PaymentStatus {
    PAID,
    UNPAID,
    ARREARS
}
