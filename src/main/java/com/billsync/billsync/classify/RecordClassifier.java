package com.billsync.billsync.classify;

import com.billsync.billsync.ingest.BillRecord;
import com.billsync.billsync.ingest.BillerContact;
import com.billsync.billsync.ingest.ColumnAliases;
import com.billsync.billsync.ingest.CsvRow;
import com.billsync.billsync.ingest.FieldNormalizer;
import com.billsync.billsync.ingest.PaymentStatus;
import com.billsync.billsync.ingest.SurveyUnit;
import com.billsync.billsync.sync.SyncConstants;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Turns raw export rows into typed records tagged {@code SYNCED}, {@code PENDING_SYNC} or
 * {@code REJECTED}. Classification never throws: every field failure becomes a rejection reason.
 */
@Component
public class RecordClassifier {

    private final Clock clock;

    public RecordClassifier(Clock clock) {
        this.clock = clock;
    }

    /**
     * Classifies one bill ledger row.
     *
     * @param defaultBillMonth month applied when the row carries none, may be null
     * @param surveyKeys       existing survey unit keys, read-only
     * @param evidence         PSIDs seen in issued bill documents this run
     */
    public ClassifiedRecord<BillRecord> classifyBill(CsvRow row, String defaultBillMonth,
                                                     SurveyKeyLookup surveyKeys, IssuanceEvidence evidence) {
        if (row.readError() != null) {
            return ClassifiedRecord.rejected(row.location(), row.readError(), row.location());
        }

        String key = row.location();
        try {
            Optional<String> psid = FieldNormalizer.identifier(row.get(ColumnAliases.PSID), "psid");
            if (psid.isEmpty()) {
                return ClassifiedRecord.rejected(key, "psid is missing", row.location());
            }
            key = psid.get();

            String rawMonth = row.has(ColumnAliases.BILL_MONTH) ? row.get(ColumnAliases.BILL_MONTH) : defaultBillMonth;
            String billMonth = FieldNormalizer.billMonth(rawMonth);
            key = psid.get() + "/" + billMonth;

            Optional<String> surveyIdFk = FieldNormalizer.identifier(row.get(ColumnAliases.SURVEY_ID_FK), "survey_id_fk");
            BigDecimal monthlyFee = FieldNormalizer.money(row.get(ColumnAliases.MONTHLY_FEE), "monthly_fee");
            BigDecimal arrears = FieldNormalizer.money(row.get(ColumnAliases.ARREARS), "arrears");
            BigDecimal amountDue = FieldNormalizer.money(row.get(ColumnAliases.AMOUNT_DUE), "amount_due");
            BigDecimal paidAmount = FieldNormalizer.money(row.get(ColumnAliases.PAID_AMOUNT), "paid_amount");
            BigDecimal fine = FieldNormalizer.money(row.get(ColumnAliases.FINE), "fine");
            PaymentStatus status = FieldNormalizer.paymentStatus(row.get(ColumnAliases.PAYMENT_STATUS));
            LocalDate paymentDate = FieldNormalizer.date(row.get(ColumnAliases.PAYMENT_DATE), "payment_date");

            BillRecord bill = new BillRecord(
                    psid.get(),
                    billMonth,
                    surveyIdFk.orElse(null),
                    monthlyFee,
                    arrears,
                    amountDue,
                    paidAmount,
                    fine,
                    status,
                    paymentDate,
                    Instant.now(clock)
            );
            IssuanceTier tier = evidence.isIssued(bill.psid()) ? IssuanceTier.ISSUED : IssuanceTier.LISTED;

            if (surveyIdFk.isEmpty()) {
                return ClassifiedRecord.pending(key, bill, tier,
                        "No survey reference yet; unit awaits survey sync", row.location());
            }
            if (!surveyKeys.exists(surveyIdFk.get())) {
                return ClassifiedRecord.pending(key, bill, tier,
                        "Survey ID " + surveyIdFk.get() + " not yet in " + SyncConstants.TABLE_SURVEY_UNITS,
                        row.location());
            }
            return ClassifiedRecord.synced(key, bill, tier, row.location());
        } catch (IllegalArgumentException ex) {
            return ClassifiedRecord.rejected(key, ex.getMessage(), row.location());
        }
    }

    /**
     * Classifies one survey export row. Survey units have no upstream reference, so they are either
     * accepted or rejected.
     */
    public ClassifiedRecord<SurveyUnit> classifySurveyUnit(CsvRow row) {
        if (row.readError() != null) {
            return ClassifiedRecord.rejected(row.location(), row.readError(), row.location());
        }

        String key = row.location();
        try {
            Optional<String> surveyId = FieldNormalizer.identifier(row.get(ColumnAliases.SURVEY_ID), "survey_id");
            if (surveyId.isEmpty()) {
                return ClassifiedRecord.rejected(key, "survey_id is missing", row.location());
            }
            key = surveyId.get();

            String rawLat = row.get(ColumnAliases.GPS_LAT);
            String rawLong = row.get(ColumnAliases.GPS_LONG);
            if (!row.has(ColumnAliases.GPS_LAT) && !row.has(ColumnAliases.GPS_LONG)
                    && row.has(ColumnAliases.GPS_COORDINATES)) {
                String[] parts = FieldNormalizer.splitCoordinates(row.get(ColumnAliases.GPS_COORDINATES));
                rawLat = parts[0];
                rawLong = parts[1];
            }
            LocalDateTime surveyedAt = FieldNormalizer.dateTime(row.get(ColumnAliases.SURVEY_TIMESTAMP), "survey_timestamp");

            SurveyUnit unit = new SurveyUnit(
                    surveyId.get(),
                    FieldNormalizer.text(row.get(ColumnAliases.SURVEYOR_NAME)),
                    surveyedAt,
                    FieldNormalizer.text(row.get(ColumnAliases.CITY_DISTRICT)),
                    FieldNormalizer.text(row.get(ColumnAliases.UC_NAME)),
                    FieldNormalizer.text(row.get(ColumnAliases.BUSINESS_TYPE)),
                    FieldNormalizer.text(row.get(ColumnAliases.SURVEY_CATEGORY)),
                    FieldNormalizer.text(row.get(ColumnAliases.CONSUMER_NAME)),
                    FieldNormalizer.text(row.get(ColumnAliases.MOBILE)),
                    FieldNormalizer.text(row.get(ColumnAliases.ADDRESS)),
                    FieldNormalizer.text(row.get(ColumnAliases.BILLING_CONSUMER_NAME)),
                    FieldNormalizer.text(row.get(ColumnAliases.BILLING_MOBILE)),
                    FieldNormalizer.text(row.get(ColumnAliases.BILLING_ADDRESS)),
                    FieldNormalizer.coordinate(rawLat, "gps_lat", 90.0d),
                    FieldNormalizer.coordinate(rawLong, "gps_long", 180.0d),
                    portalStatus(row)
            );
            return ClassifiedRecord.synced(key, unit, IssuanceTier.SURVEY_ONLY, row.location());
        } catch (IllegalArgumentException ex) {
            return ClassifiedRecord.rejected(key, ex.getMessage(), row.location());
        }
    }

    /**
     * Reads the contact columns of a biller list row whose bill resolved to {@code surveyId}. Empty when
     * the ledger carries none of those columns.
     */
    public Optional<ClassifiedRecord<BillerContact>> classifyBillerContact(CsvRow row, String surveyId) {
        if (surveyId == null || row.readError() != null || !hasContactColumns(row)) {
            return Optional.empty();
        }
        try {
            BillerContact contact = new BillerContact(
                    surveyId,
                    FieldNormalizer.text(row.get(ColumnAliases.BILLING_CONSUMER_NAME)),
                    FieldNormalizer.text(row.get(ColumnAliases.BILLING_MOBILE)),
                    FieldNormalizer.text(row.get(ColumnAliases.BILLING_ADDRESS)),
                    portalStatus(row)
            );
            return Optional.of(ClassifiedRecord.synced(surveyId, contact, IssuanceTier.LISTED, row.location()));
        } catch (IllegalArgumentException ex) {
            return Optional.of(ClassifiedRecord.rejected(surveyId, ex.getMessage(), row.location()));
        }
    }

    private static boolean hasContactColumns(CsvRow row) {
        return row.hasColumn(ColumnAliases.BILLING_CONSUMER_NAME)
                || row.hasColumn(ColumnAliases.BILLING_MOBILE)
                || row.hasColumn(ColumnAliases.BILLING_ADDRESS)
                || row.hasColumn(ColumnAliases.ACTIVE);
    }

    // null when the export has no status column at all
    private static Boolean portalStatus(CsvRow row) {
        return row.hasColumn(ColumnAliases.ACTIVE) ? FieldNormalizer.activeFlag(row.get(ColumnAliases.ACTIVE)) : null;
    }
}
