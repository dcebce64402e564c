package com.billsync.billsync.upload;

import com.billsync.billsync.ingest.BillRecord;
import com.billsync.billsync.ingest.BillerContact;
import com.billsync.billsync.ingest.PaymentStatus;
import com.billsync.billsync.ingest.SurveyUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class JdbcBillingStoreTest {

    private static final Instant FIRST_INGEST = Instant.parse("2025-12-01T08:00:00Z");

    @Autowired
    private JdbcBillingStore billingStore;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetTables() {
        jdbcTemplate.execute("DELETE FROM bills");
        jdbcTemplate.execute("DELETE FROM survey_units");
    }

    @Test
    void shouldInsertThenOverwriteSurveyUnits() {
        billingStore.surveyUnits().upsertBatch(List.of(unit("S-100", "Old Shop", true), unit("S-101", "Bakery", true)));
        billingStore.surveyUnits().upsertBatch(List.of(unit("S-100", "New Shop", false)));

        assertEquals(2L, billingStore.countRows(TargetTable.SURVEY_UNITS));
        assertEquals(1L, billingStore.countActiveSurveyUnits());
        assertEquals(Set.of("S-100", "S-101"), billingStore.loadSurveyIds());
        assertEquals("New Shop", jdbcTemplate.queryForObject(
                "SELECT survey_consumer_name FROM survey_units WHERE survey_id = ?", String.class, "S-100"));
    }

    @Test
    void shouldUpsertBillsOnCompositeKeyAndKeepFirstIngestionTime() {
        billingStore.surveyUnits().upsertBatch(List.of(unit("S-100", "Shop", true)));
        billingStore.bills().upsertBatch(List.of(
                bill("1234567890", "Nov-2025", "S-100", "500", PaymentStatus.UNPAID, FIRST_INGEST),
                bill("1234567890", "Dec-2025", "S-100", "500", PaymentStatus.UNPAID, FIRST_INGEST)));

        billingStore.bills().upsertBatch(List.of(
                bill("1234567890", "Nov-2025", "S-100", "750", PaymentStatus.PAID, FIRST_INGEST.plusSeconds(3600))));

        assertEquals(2L, billingStore.countRows(TargetTable.BILLS));
        Map<String, Object> row = jdbcTemplate.queryForMap(
                "SELECT amount_due, payment_status FROM bills WHERE psid = ? AND bill_month = ?",
                "1234567890", "Nov-2025");
        assertEquals(0, new BigDecimal("750.00").compareTo((BigDecimal) row.get("amount_due")));
        assertEquals("PAID", row.get("payment_status"));
        Timestamp ingestedAt = jdbcTemplate.queryForObject(
                "SELECT ingested_at FROM bills WHERE psid = ? AND bill_month = ?", Timestamp.class,
                "1234567890", "Nov-2025");
        assertEquals(FIRST_INGEST, ingestedAt.toInstant());

        Map<PaymentStatus, Long> byStatus = billingStore.countBillsByStatus();
        assertEquals(1L, byStatus.get(PaymentStatus.PAID));
        assertEquals(1L, byStatus.get(PaymentStatus.UNPAID));
        assertEquals(0L, byStatus.get(PaymentStatus.ARREARS));
        assertEquals(1L, billingStore.countBilledSurveyUnits());
    }

    @Test
    void shouldCollapseRepeatedKeyInsideOneBatch() {
        billingStore.bills().upsertBatch(List.of(
                bill("1234567890", "Nov-2025", null, "100", PaymentStatus.UNPAID, FIRST_INGEST),
                bill("1234567890", "Nov-2025", null, "200", PaymentStatus.UNPAID, FIRST_INGEST)));

        assertEquals(1L, billingStore.countRows(TargetTable.BILLS));
        BigDecimal amount = jdbcTemplate.queryForObject(
                "SELECT amount_due FROM bills WHERE psid = ?", BigDecimal.class, "1234567890");
        assertEquals(0, new BigDecimal("200").compareTo(amount));
    }

    @Test
    void shouldRollBackWholeBatchOnConstraintViolation() {
        billingStore.surveyUnits().upsertBatch(List.of(unit("S-100", "Shop", true)));

        assertThrows(DataIntegrityViolationException.class, () -> billingStore.bills().upsertBatch(List.of(
                bill("1111111111", "Nov-2025", "S-100", "500", PaymentStatus.UNPAID, FIRST_INGEST),
                bill("2222222222", "Nov-2025", "S-999", "500", PaymentStatus.UNPAID, FIRST_INGEST))));

        assertEquals(0L, billingStore.countRows(TargetTable.BILLS));
    }

    @Test
    void shouldKeepStoredBillingContactWhenExportOmitsIt() {
        billingStore.surveyUnits().upsertBatch(List.of(
                unit("S-100", "Shop", "Ali Traders", "03111111111", true),
                unit("S-101", "Bakery", null, null, null)));
        billingStore.surveyUnits().upsertBatch(List.of(unit("S-100", "Shop Resurveyed", null, null, null)));

        Map<String, Object> row = jdbcTemplate.queryForMap(
                "SELECT survey_consumer_name, billing_consumer_name, billing_mobile, is_active FROM survey_units WHERE survey_id = ?",
                "S-100");
        assertEquals("Shop Resurveyed", row.get("survey_consumer_name"));
        assertEquals("Ali Traders", row.get("billing_consumer_name"));
        assertEquals("03111111111", row.get("billing_mobile"));
        assertEquals(Boolean.TRUE, row.get("is_active"));
        assertEquals(Boolean.FALSE, jdbcTemplate.queryForObject(
                "SELECT is_active FROM survey_units WHERE survey_id = ?", Boolean.class, "S-101"));
    }

    @Test
    void shouldWriteBillerContactsOntoExistingUnitsOnly() {
        billingStore.surveyUnits().upsertBatch(List.of(unit("S-100", "Shop", null, null, null)));

        int updated = billingStore.billerContacts().upsertBatch(List.of(
                new BillerContact("S-100", "Ali Traders", null, "Shop 4, Main Road", true),
                new BillerContact("S-999", "Nobody", "03000000000", null, true)));

        assertEquals(1, updated);
        assertEquals(1L, billingStore.countRows(TargetTable.SURVEY_UNITS));
        Map<String, Object> row = jdbcTemplate.queryForMap(
                "SELECT billing_consumer_name, billing_mobile, billing_address, is_active FROM survey_units WHERE survey_id = ?",
                "S-100");
        assertEquals("Ali Traders", row.get("billing_consumer_name"));
        assertNull(row.get("billing_mobile"));
        assertEquals("Shop 4, Main Road", row.get("billing_address"));
        assertEquals(Boolean.TRUE, row.get("is_active"));

        billingStore.billerContacts().upsertBatch(List.of(new BillerContact("S-100", null, null, null, false)));
        assertEquals("Ali Traders", jdbcTemplate.queryForObject(
                "SELECT billing_consumer_name FROM survey_units WHERE survey_id = ?", String.class, "S-100"));
        assertEquals(0L, billingStore.countActiveSurveyUnits());
    }

    @Test
    void shouldVerifyConnectionAndIgnoreEmptyBatches() {
        billingStore.verifyConnection();
        assertEquals(0, billingStore.bills().upsertBatch(List.of()));
        assertFalse(billingStore.loadSurveyIds().contains("S-100"));
        assertTrue(billingStore.countBillsByStatus().values().stream().allMatch(count -> count == 0L));
    }

    private static SurveyUnit unit(String surveyId, String consumerName, boolean active) {
        return unit(surveyId, consumerName, null, null, active);
    }

    private static SurveyUnit unit(String surveyId, String consumerName, String billingName, String billingMobile,
                                   Boolean active) {
        return new SurveyUnit(surveyId, "Surveyor", LocalDateTime.of(2025, 10, 1, 9, 30), "Lahore", "UC-12",
                "Shop", "Commercial", consumerName, "03001234567", "Main Road", billingName, billingMobile, null,
                31.52d, 74.35d, active);
    }

    private static BillRecord bill(String psid, String month, String surveyId, String amountDue,
                                   PaymentStatus status, Instant ingestedAt) {
        BigDecimal zero = new BigDecimal("0.00");
        return new BillRecord(psid, month, surveyId, new BigDecimal("500.00"), zero, new BigDecimal(amountDue),
                zero, zero, status, status == PaymentStatus.PAID ? LocalDate.of(2025, 11, 20) : null, ingestedAt);
    }
}
