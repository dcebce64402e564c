package com.billsync.billsync.ingest;

/**
 * Contact details and portal status a biller list row carries for its survey unit. Null fields leave
 * the stored value unchanged.
 */
public record BillerContact(
        String surveyId,
        String consumerName,
        String mobile,
        String address,
        Boolean activePortal
) {
}
