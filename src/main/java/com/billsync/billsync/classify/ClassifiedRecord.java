package com.billsync.billsync.classify;

/**
 * A record tagged with its classification. {@code record} is null when the row was rejected before a
 * typed record could be built; {@code reason} is set for pending and rejected rows.
 */
public record ClassifiedRecord<T>(
        ClassificationState state,
        String key,
        T record,
        IssuanceTier tier,
        String reason,
        String location
) {

    public static <T> ClassifiedRecord<T> synced(String key, T record, IssuanceTier tier, String location) {
        return new ClassifiedRecord<>(ClassificationState.SYNCED, key, record, tier, null, location);
    }

    public static <T> ClassifiedRecord<T> pending(String key, T record, IssuanceTier tier, String reason,
                                                  String location) {
        return new ClassifiedRecord<>(ClassificationState.PENDING_SYNC, key, record, tier, reason, location);
    }

    public static <T> ClassifiedRecord<T> rejected(String key, String reason, String location) {
        return new ClassifiedRecord<>(ClassificationState.REJECTED, key, null, null, reason, location);
    }

    /**
     * Re-tags an accepted record as rejected after its batch could not be written.
     */
    public ClassifiedRecord<T> asWriteFailure(String cause) {
        return new ClassifiedRecord<>(ClassificationState.REJECTED, key, record, tier, cause, location);
    }
}
