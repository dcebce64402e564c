package com.billsync.billsync.stats;

import com.billsync.billsync.ingest.PaymentStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Cumulative table contents. {@code surveyOnlyUnits} are survey units without any bill row.
 */
public record TableTotals(
        long surveyUnits,
        long activeSurveyUnits,
        long bills,
        Map<PaymentStatus, Long> billsByStatus,
        long billedSurveyUnits,
        long surveyOnlyUnits
) {

    public TableTotals {
        Map<PaymentStatus, Long> byStatus = new EnumMap<>(PaymentStatus.class);
        if (billsByStatus != null) {
            byStatus.putAll(billsByStatus);
        }
        billsByStatus = Collections.unmodifiableMap(byStatus);
    }
}
