package com.billsync.billsync.upload;

import com.billsync.billsync.ingest.BillRecord;
import com.billsync.billsync.ingest.BillerContact;
import com.billsync.billsync.ingest.PaymentStatus;
import com.billsync.billsync.ingest.SurveyUnit;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * Map-backed store with failure injection for engine and service tests. A batch is applied all or
 * nothing, like a database transaction.
 */
public class InMemoryBillingStore implements BillingStore {

    private final Map<String, SurveyUnit> surveyUnits = new LinkedHashMap<>();
    private final Map<String, BillRecord> bills = new LinkedHashMap<>();
    private final Set<String> poisonKeys = new HashSet<>();
    private final AtomicInteger transientFailures = new AtomicInteger();
    private final AtomicInteger writeCalls = new AtomicInteger();
    private volatile boolean available = true;

    private final UpsertTarget<SurveyUnit> surveyTarget = new MapTarget<>(TargetTable.SURVEY_UNITS, surveyUnits,
            SurveyUnit::surveyId, InMemoryBillingStore::keepStoredBillingFields);
    private final UpsertTarget<BillRecord> billTarget = new MapTarget<>(TargetTable.BILLS, bills,
            BillRecord::compositeKey, InMemoryBillingStore::keepFirstIngestion);
    private final UpsertTarget<BillerContact> contactTarget = new ContactTarget();

    /**
     * Every batch containing one of these keys fails with a transient error on every attempt.
     */
    public void poison(String key) {
        synchronized (this) {
            poisonKeys.add(key);
        }
    }

    /**
     * The next {@code count} batch writes fail once each with a transient error.
     */
    public void failNextWrites(int count) {
        transientFailures.set(count);
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public int writeCalls() {
        return writeCalls.get();
    }

    public synchronized Map<String, SurveyUnit> surveyUnitRows() {
        return Map.copyOf(surveyUnits);
    }

    public synchronized Map<String, BillRecord> billRows() {
        return Map.copyOf(bills);
    }

    @Override
    public void verifyConnection() {
        if (!available) {
            throw new DataAccessResourceFailureException("Connection refused");
        }
    }

    @Override
    public synchronized Set<String> loadSurveyIds() {
        verifyConnection();
        return new HashSet<>(surveyUnits.keySet());
    }

    @Override
    public UpsertTarget<SurveyUnit> surveyUnits() {
        return surveyTarget;
    }

    @Override
    public UpsertTarget<BillRecord> bills() {
        return billTarget;
    }

    @Override
    public UpsertTarget<BillerContact> billerContacts() {
        return contactTarget;
    }

    @Override
    public synchronized long countRows(TargetTable table) {
        return table == TargetTable.SURVEY_UNITS ? surveyUnits.size() : bills.size();
    }

    @Override
    public synchronized long countActiveSurveyUnits() {
        return surveyUnits.values().stream().filter(unit -> Boolean.TRUE.equals(unit.active())).count();
    }

    @Override
    public synchronized long countBilledSurveyUnits() {
        return bills.values().stream()
                .map(BillRecord::surveyIdFk)
                .filter(surveyId -> surveyId != null)
                .distinct()
                .count();
    }

    @Override
    public synchronized Map<PaymentStatus, Long> countBillsByStatus() {
        Map<PaymentStatus, Long> counts = new EnumMap<>(PaymentStatus.class);
        for (PaymentStatus status : PaymentStatus.values()) {
            counts.put(status, 0L);
        }
        for (BillRecord bill : bills.values()) {
            counts.merge(bill.paymentStatus(), 1L, Long::sum);
        }
        return counts;
    }

    private void beforeWrite(List<String> keys) {
        writeCalls.incrementAndGet();
        if (!available) {
            throw new DataAccessResourceFailureException("Connection refused");
        }
        if (transientFailures.getAndUpdate(remaining -> Math.max(0, remaining - 1)) > 0) {
            throw new CannotAcquireLockException("Lock wait timeout");
        }
        for (String key : keys) {
            if (poisonKeys.contains(key)) {
                throw new TransientDataAccessResourceException("Deadlock on " + key);
            }
        }
    }

    /**
     * Applies one batch; {@code merge} receives the stored row (null when absent) and the incoming one.
     */
    private final class MapTarget<T> implements UpsertTarget<T> {

        private final TargetTable table;
        private final Map<String, T> rows;
        private final Function<T, String> keyOf;
        private final BinaryOperator<T> merge;

        private MapTarget(TargetTable table, Map<String, T> rows, Function<T, String> keyOf, BinaryOperator<T> merge) {
            this.table = table;
            this.rows = rows;
            this.keyOf = keyOf;
            this.merge = merge;
        }

        @Override
        public TargetTable table() {
            return table;
        }

        @Override
        public int upsertBatch(List<T> records) {
            synchronized (InMemoryBillingStore.this) {
                beforeWrite(records.stream().map(keyOf).toList());
                for (T record : records) {
                    String key = keyOf.apply(record);
                    rows.put(key, merge.apply(rows.get(key), record));
                }
            }
            return records.size();
        }
    }

    private final class ContactTarget implements UpsertTarget<BillerContact> {

        @Override
        public TargetTable table() {
            return TargetTable.SURVEY_UNITS;
        }

        @Override
        public int upsertBatch(List<BillerContact> records) {
            int updated = 0;
            synchronized (InMemoryBillingStore.this) {
                beforeWrite(records.stream().map(BillerContact::surveyId).toList());
                for (BillerContact contact : records) {
                    SurveyUnit unit = surveyUnits.get(contact.surveyId());
                    if (unit != null) {
                        surveyUnits.put(unit.surveyId(), withContact(unit, contact));
                        updated++;
                    }
                }
            }
            return updated;
        }
    }

    private static BillRecord keepFirstIngestion(BillRecord stored, BillRecord incoming) {
        if (stored == null) {
            return incoming;
        }
        return new BillRecord(incoming.psid(), incoming.billMonth(), incoming.surveyIdFk(),
                incoming.monthlyFee(), incoming.arrears(), incoming.amountDue(), incoming.paidAmount(),
                incoming.fine(), incoming.paymentStatus(), incoming.paymentDate(), stored.ingestedAt());
    }

    private static SurveyUnit keepStoredBillingFields(SurveyUnit stored, SurveyUnit incoming) {
        SurveyUnit base = stored == null
                ? new SurveyUnit(incoming.surveyId(), null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, false)
                : stored;
        return new SurveyUnit(incoming.surveyId(), incoming.surveyorName(), incoming.surveyTimestamp(),
                incoming.cityDistrict(), incoming.ucName(), incoming.businessType(), incoming.surveyCategory(),
                incoming.consumerName(), incoming.mobile(), incoming.address(),
                keep(incoming.billingConsumerName(), base.billingConsumerName()),
                keep(incoming.billingMobile(), base.billingMobile()),
                keep(incoming.billingAddress(), base.billingAddress()),
                incoming.gpsLat(), incoming.gpsLong(),
                keep(incoming.active(), base.active()));
    }

    private static SurveyUnit withContact(SurveyUnit unit, BillerContact contact) {
        return new SurveyUnit(unit.surveyId(), unit.surveyorName(), unit.surveyTimestamp(), unit.cityDistrict(),
                unit.ucName(), unit.businessType(), unit.surveyCategory(), unit.consumerName(), unit.mobile(),
                unit.address(),
                keep(contact.consumerName(), unit.billingConsumerName()),
                keep(contact.mobile(), unit.billingMobile()),
                keep(contact.address(), unit.billingAddress()),
                unit.gpsLat(), unit.gpsLong(),
                keep(contact.activePortal(), unit.active()));
    }

    private static <V> V keep(V incoming, V stored) {
        return incoming != null ? incoming : stored;
    }
}
