package com.billsync.billsync.ingest;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One monthly charge, unique on {@code (psid, billMonth)}. {@code surveyIdFk} may be null until the
 * owning survey unit has been synced.
 */
public record BillRecord(
        String psid,
        String billMonth,
        String surveyIdFk,
        BigDecimal monthlyFee,
        BigDecimal arrears,
        BigDecimal amountDue,
        BigDecimal paidAmount,
        BigDecimal fine,
        PaymentStatus paymentStatus,
        LocalDate paymentDate,
        Instant ingestedAt
) {

    public String compositeKey() {
        return psid + "/" + billMonth;
    }
}
