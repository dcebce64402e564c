package com.billsync.billsync.ingest;

import java.time.LocalDateTime;

/**
 * One physical consumer asset collected in the field, keyed by its immutable survey id. The billing
 * contact fields and {@code active} (the portal status) come from the biller list; null means the
 * export did not carry them and the stored values are kept.
 */
public record SurveyUnit(
        String surveyId,
        String surveyorName,
        LocalDateTime surveyTimestamp,
        String cityDistrict,
        String ucName,
        String businessType,
        String surveyCategory,
        String consumerName,
        String mobile,
        String address,
        String billingConsumerName,
        String billingMobile,
        String billingAddress,
        Double gpsLat,
        Double gpsLong,
        Boolean active
) {
}
