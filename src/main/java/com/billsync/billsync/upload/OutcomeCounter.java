package com.billsync.billsync.upload;

import com.billsync.billsync.classify.IssuanceTier;

import java.util.concurrent.atomic.AtomicInteger;

final class OutcomeCounter {

    private final AtomicInteger synced = new AtomicInteger();
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicInteger rejected = new AtomicInteger();
    private final AtomicInteger writeFailures = new AtomicInteger();
    private final AtomicInteger issued = new AtomicInteger();
    private final AtomicInteger listed = new AtomicInteger();
    private final AtomicInteger batchesCommitted = new AtomicInteger();
    private final AtomicInteger batchesFailed = new AtomicInteger();
    private final AtomicInteger unprocessed = new AtomicInteger();

    void tier(IssuanceTier tier) {
        if (tier == IssuanceTier.ISSUED) {
            issued.incrementAndGet();
        } else if (tier == IssuanceTier.LISTED) {
            listed.incrementAndGet();
        }
    }

    void pending() {
        pending.incrementAndGet();
    }

    void rejected() {
        rejected.incrementAndGet();
    }

    void committed(int records) {
        synced.addAndGet(records);
        batchesCommitted.incrementAndGet();
    }

    void failed(int records) {
        rejected.addAndGet(records);
        writeFailures.addAndGet(records);
        batchesFailed.incrementAndGet();
    }

    void unprocessed(int records) {
        unprocessed.addAndGet(records);
    }

    UploadOutcome toOutcome(String table, boolean aborted) {
        return new UploadOutcome(table, synced.get(), pending.get(), rejected.get(), writeFailures.get(),
                issued.get(), listed.get(), batchesCommitted.get(), batchesFailed.get(), unprocessed.get(), aborted);
    }
}
