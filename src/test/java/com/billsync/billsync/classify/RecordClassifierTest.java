package com.billsync.billsync.classify;

import com.billsync.billsync.ingest.BillRecord;
import com.billsync.billsync.ingest.BillerContact;
import com.billsync.billsync.ingest.ColumnAliases;
import com.billsync.billsync.ingest.CsvRow;
import com.billsync.billsync.ingest.PaymentStatus;
import com.billsync.billsync.ingest.SurveyUnit;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecordClassifierTest {

    private static final Instant NOW = Instant.parse("2025-12-01T08:00:00Z");

    private final RecordClassifier classifier = new RecordClassifier(Clock.fixed(NOW, ZoneOffset.UTC));
    private final SurveyKeyLookup surveyKeys = SurveyKeyLookup.of(Set.of("S-100"));

    @Test
    void shouldSyncBillWhoseSurveyExists() {
        ClassifiedRecord<BillRecord> result = classifier.classifyBill(
                bill("1234567890", "Nov-2025", "S-100", "500"), null, surveyKeys, IssuanceEvidence.none());

        assertEquals(ClassificationState.SYNCED, result.state());
        assertEquals("1234567890/Nov-2025", result.key());
        assertEquals(IssuanceTier.LISTED, result.tier());
        assertNull(result.reason());
        BillRecord record = result.record();
        assertEquals("S-100", record.surveyIdFk());
        assertEquals(new BigDecimal("500.00"), record.amountDue());
        assertEquals(PaymentStatus.UNPAID, record.paymentStatus());
        assertEquals(NOW, record.ingestedAt());
    }

    @Test
    void shouldMarkUnknownSurveyReferenceAsPendingNotRejected() {
        ClassifiedRecord<BillRecord> result = classifier.classifyBill(
                bill("1234567890", "Nov-2025", "S-200", "500"), null, surveyKeys, IssuanceEvidence.none());

        assertEquals(ClassificationState.PENDING_SYNC, result.state());
        assertTrue(result.reason().contains("S-200"));
        assertEquals("S-200", result.record().surveyIdFk());
    }

    @Test
    void shouldMarkBlankSurveyReferenceAsPending() {
        ClassifiedRecord<BillRecord> result = classifier.classifyBill(
                bill("1234567890", "Nov-2025", "", "500"), null, surveyKeys, IssuanceEvidence.none());

        assertEquals(ClassificationState.PENDING_SYNC, result.state());
        assertNull(result.record().surveyIdFk());
    }

    @Test
    void shouldRejectUnparseableBillMonthEvenWhenSurveyIsUnknown() {
        ClassifiedRecord<BillRecord> result = classifier.classifyBill(
                bill("1234567890", "Month 13", "S-200", "500"), null, surveyKeys, IssuanceEvidence.none());

        assertEquals(ClassificationState.REJECTED, result.state());
        assertTrue(result.reason().startsWith("bill_month is unparseable"));
        assertNull(result.record());
    }

    @Test
    void shouldRejectScientificNotationPsid() {
        ClassifiedRecord<BillRecord> result = classifier.classifyBill(
                bill("1.23457E+19", "Nov-2025", "S-100", "500"), null, surveyKeys, IssuanceEvidence.none());

        assertEquals(ClassificationState.REJECTED, result.state());
        assertTrue(result.reason().contains("scientific notation"));
        assertEquals("ledger.csv:7", result.location());
    }

    @Test
    void shouldRejectGarbageAmount() {
        ClassifiedRecord<BillRecord> result = classifier.classifyBill(
                bill("1234567890", "Nov-2025", "S-100", "twelve"), null, surveyKeys, IssuanceEvidence.none());

        assertEquals(ClassificationState.REJECTED, result.state());
        assertEquals("1234567890/Nov-2025", result.key());
    }

    @Test
    void shouldUseDefaultMonthWhenRowHasNone() {
        ClassifiedRecord<BillRecord> result = classifier.classifyBill(
                bill("1234567890", "", "S-100", "500"), "november 2025", surveyKeys, IssuanceEvidence.none());

        assertEquals(ClassificationState.SYNCED, result.state());
        assertEquals("Nov-2025", result.record().billMonth());
    }

    @Test
    void shouldTagBillsSeenInPdfsAsIssued() {
        IssuanceEvidence evidence = new IssuanceEvidence(Map.of("1234567890", "bill_001.pdf"));
        ClassifiedRecord<BillRecord> result = classifier.classifyBill(
                bill("1234567890", "Nov-2025", "S-200", "500"), null, surveyKeys, evidence);

        assertEquals(ClassificationState.PENDING_SYNC, result.state());
        assertEquals(IssuanceTier.ISSUED, result.tier());
    }

    @Test
    void shouldRejectUnreadableRows() {
        CsvRow row = CsvRow.unreadable("ledger.csv", 4, "Unreadable CSV content: EOF");
        ClassifiedRecord<BillRecord> result = classifier.classifyBill(row, null, surveyKeys, IssuanceEvidence.none());

        assertEquals(ClassificationState.REJECTED, result.state());
        assertEquals("Unreadable CSV content: EOF", result.reason());
    }

    @Test
    void shouldBuildSurveyUnitFromCombinedCoordinates() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(ColumnAliases.SURVEY_ID, "S-100");
        values.put(ColumnAliases.SURVEY_TIMESTAMP, "2025-10-01 09:30:00");
        values.put(ColumnAliases.GPS_COORDINATES, "31.5204,74.3587");
        values.put(ColumnAliases.ACTIVE, "");
        ClassifiedRecord<SurveyUnit> result = classifier.classifySurveyUnit(new CsvRow("units.csv", 1, values, null));

        assertEquals(ClassificationState.SYNCED, result.state());
        assertEquals(IssuanceTier.SURVEY_ONLY, result.tier());
        SurveyUnit unit = result.record();
        assertEquals(31.5204d, unit.gpsLat());
        assertEquals(74.3587d, unit.gpsLong());
        assertEquals(Boolean.FALSE, unit.active());
    }

    @Test
    void shouldCarryBillingContactAndLeaveStatusUnsetWhenExportHasNoStatusColumn() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(ColumnAliases.SURVEY_ID, "S-100");
        values.put(ColumnAliases.CONSUMER_NAME, "Shop");
        values.put(ColumnAliases.BILLING_CONSUMER_NAME, "Ali Traders");
        values.put(ColumnAliases.BILLING_MOBILE, "03001234567");
        values.put(ColumnAliases.BILLING_ADDRESS, "Mall Road");
        ClassifiedRecord<SurveyUnit> result = classifier.classifySurveyUnit(new CsvRow("units.csv", 1, values, null));

        assertEquals(ClassificationState.SYNCED, result.state());
        SurveyUnit unit = result.record();
        assertEquals("Ali Traders", unit.billingConsumerName());
        assertEquals("03001234567", unit.billingMobile());
        assertEquals("Mall Road", unit.billingAddress());
        assertNull(unit.active());
    }

    @Test
    void shouldReadBillerContactFromLedgerRow() {
        Map<String, String> values = new LinkedHashMap<>(bill("1234567890", "Nov-2025", "S-100", "500").values());
        values.put(ColumnAliases.BILLING_CONSUMER_NAME, "Ali Traders");
        values.put(ColumnAliases.BILLING_MOBILE, "");
        values.put(ColumnAliases.ACTIVE, "Active");
        Optional<ClassifiedRecord<BillerContact>> result =
                classifier.classifyBillerContact(new CsvRow("ledger.csv", 7, values, null), "S-100");

        assertTrue(result.isPresent());
        assertEquals(ClassificationState.SYNCED, result.get().state());
        assertEquals("S-100", result.get().key());
        BillerContact contact = result.get().record();
        assertEquals("Ali Traders", contact.consumerName());
        assertNull(contact.mobile());
        assertNull(contact.address());
        assertEquals(Boolean.TRUE, contact.activePortal());
    }

    @Test
    void shouldRejectBillerContactWithUnknownStatus() {
        Map<String, String> values = new LinkedHashMap<>(bill("1234567890", "Nov-2025", "S-100", "500").values());
        values.put(ColumnAliases.ACTIVE, "sometimes");
        Optional<ClassifiedRecord<BillerContact>> result =
                classifier.classifyBillerContact(new CsvRow("ledger.csv", 7, values, null), "S-100");

        assertTrue(result.isPresent());
        assertEquals(ClassificationState.REJECTED, result.get().state());
        assertNull(result.get().record());
    }

    @Test
    void shouldSkipBillerContactWhenLedgerHasNoContactColumns() {
        CsvRow row = bill("1234567890", "Nov-2025", "S-100", "500");

        assertTrue(classifier.classifyBillerContact(row, "S-100").isEmpty());
        assertTrue(classifier.classifyBillerContact(row, null).isEmpty());
    }

    @Test
    void shouldRejectPsidLongerThanKeyColumn() {
        String psid = "1".repeat(80);
        ClassifiedRecord<BillRecord> result = classifier.classifyBill(
                bill(psid, "Nov-2025", "S-100", "500"), null, surveyKeys, IssuanceEvidence.none());

        assertEquals(ClassificationState.REJECTED, result.state());
        assertTrue(result.reason().startsWith("psid is longer than 64 characters"));
        assertNull(result.record());
    }

    @Test
    void shouldRejectAmountThatOverflowsMoneyColumn() {
        ClassifiedRecord<BillRecord> result = classifier.classifyBill(
                bill("1234567890", "Nov-2025", "S-100", "1e15"), null, surveyKeys, IssuanceEvidence.none());

        assertEquals(ClassificationState.REJECTED, result.state());
        assertEquals("1234567890/Nov-2025", result.key());
        assertEquals("amount_due is too large: 1e15", result.reason());
    }

    @Test
    void shouldRejectSurveyUnitWithoutId() {
        Map<String, String> values = Map.of(ColumnAliases.SURVEY_ID, "nan", ColumnAliases.CONSUMER_NAME, "Shop");
        ClassifiedRecord<SurveyUnit> result = classifier.classifySurveyUnit(new CsvRow("units.csv", 3, values, null));

        assertEquals(ClassificationState.REJECTED, result.state());
        assertEquals("survey_id is missing", result.reason());
        assertEquals("units.csv:3", result.key());
    }

    @Test
    void shouldRejectSurveyUnitWithInvalidActiveFlag() {
        Map<String, String> values = Map.of(ColumnAliases.SURVEY_ID, "S-1", ColumnAliases.ACTIVE, "sometimes");
        ClassifiedRecord<SurveyUnit> result = classifier.classifySurveyUnit(new CsvRow("units.csv", 2, values, null));

        assertEquals(ClassificationState.REJECTED, result.state());
        assertEquals("S-1", result.key());
        assertFalse(result.reason().isBlank());
    }

    @Test
    void shouldKeepPaymentDate() {
        Map<String, String> values = new LinkedHashMap<>(bill("1234567890", "Nov-2025", "S-100", "500").values());
        values.put(ColumnAliases.PAYMENT_STATUS, "paid");
        values.put(ColumnAliases.PAYMENT_DATE, "05/11/2025");
        ClassifiedRecord<BillRecord> result = classifier.classifyBill(new CsvRow("ledger.csv", 7, values, null),
                null, surveyKeys, IssuanceEvidence.none());

        assertEquals(PaymentStatus.PAID, result.record().paymentStatus());
        assertEquals(LocalDate.of(2025, 11, 5), result.record().paymentDate());
    }

    private static CsvRow bill(String psid, String month, String surveyId, String amountDue) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(ColumnAliases.PSID, psid);
        values.put(ColumnAliases.BILL_MONTH, month);
        values.put(ColumnAliases.SURVEY_ID_FK, surveyId);
        values.put(ColumnAliases.AMOUNT_DUE, amountDue);
        values.put(ColumnAliases.ARREARS, "-");
        return new CsvRow("ledger.csv", 7, values, null);
    }
}
