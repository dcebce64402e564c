package com.billsync.billsync.upload;

import com.billsync.billsync.ingest.BillRecord;
import com.billsync.billsync.ingest.BillerContact;
import com.billsync.billsync.ingest.PaymentStatus;
import com.billsync.billsync.ingest.SurveyUnit;

import java.util.Map;
import java.util.Set;

/**
 * Database access used by the pipeline: key lookups for classification, upsert targets for the engine
 * and read-only counts for statistics.
 */
public interface BillingStore {

    /**
     * Fails with a {@link org.springframework.dao.DataAccessException} when no connection can be obtained.
     */
    void verifyConnection();

    Set<String> loadSurveyIds();

    UpsertTarget<SurveyUnit> surveyUnits();

    UpsertTarget<BillRecord> bills();

    /**
     * Writes biller list contacts onto existing survey units. Units are never created from a contact;
     * a contact for an unknown unit changes nothing.
     */
    UpsertTarget<BillerContact> billerContacts();

    long countRows(TargetTable table);

    long countActiveSurveyUnits();

    long countBilledSurveyUnits();

    Map<PaymentStatus, Long> countBillsByStatus();
}
