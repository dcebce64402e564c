package com.billsync.billsync.stats;

import com.billsync.billsync.ingest.PaymentStatus;
import com.billsync.billsync.upload.BillingStore;
import com.billsync.billsync.upload.TargetTable;
import com.billsync.billsync.upload.UploadOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Turns upload outcomes into run statistics and answers cumulative table questions.
 */
@Service
public class StatisticsReporter {

    private static final Logger log = LoggerFactory.getLogger(StatisticsReporter.class);

    private final BillingStore billingStore;
    private final RunHistoryRepository runHistoryRepository;

    public StatisticsReporter(BillingStore billingStore, RunHistoryRepository runHistoryRepository) {
        this.billingStore = billingStore;
        this.runHistoryRepository = runHistoryRepository;
    }

    /**
     * Pure aggregation of one run. A run counts as aborted when the engine stopped early or when the
     * caller supplies a reason.
     */
    public static RunStatistics summarize(long runId,
                                          String source,
                                          UploadOutcome outcome,
                                          LocalDateTime startedAt,
                                          LocalDateTime finishedAt,
                                          String abortReason) {
        return new RunStatistics(
                runId,
                outcome.table(),
                source,
                startedAt,
                finishedAt,
                outcome.synced(),
                outcome.pending(),
                outcome.rejected(),
                outcome.writeFailures(),
                outcome.issued(),
                outcome.listed(),
                outcome.batchesCommitted(),
                outcome.batchesFailed(),
                outcome.unprocessed(),
                outcome.aborted() || abortReason != null,
                abortReason
        );
    }

    /**
     * Statistics for a run that stopped before any record was read.
     */
    public static RunStatistics failedBeforeStart(long runId,
                                                  TargetTable table,
                                                  String source,
                                                  LocalDateTime startedAt,
                                                  LocalDateTime finishedAt,
                                                  String abortReason) {
        return new RunStatistics(runId, table.tableName(), source, startedAt, finishedAt,
                0, 0, 0, 0, 0, 0, 0, 0, 0, true, abortReason);
    }

    /**
     * Logs the run summary and stores it in the run history. A history write failure is logged only.
     */
    public void report(RunStatistics statistics) {
        log.info("Run {} [{}] {}: synced={}, pending={}, rejected={} (write failures={}), issued={}, listed={}, unprocessed={}, {} ms{}",
                statistics.runId(), statistics.table(), statistics.source(), statistics.synced(),
                statistics.pending(), statistics.rejected(), statistics.writeFailures(), statistics.issued(),
                statistics.listed(), statistics.unprocessed(), statistics.durationMillis(),
                statistics.aborted() ? ", aborted: " + statistics.abortReason() : "");
        try {
            runHistoryRepository.record(statistics);
        } catch (DataAccessException ex) {
            log.warn("Unable to store run history for run {} [{}]", statistics.runId(), statistics.table(), ex);
        }
    }

    public TableTotals totals() {
        long surveyUnits = billingStore.countRows(TargetTable.SURVEY_UNITS);
        long billedUnits = billingStore.countBilledSurveyUnits();
        Map<PaymentStatus, Long> byStatus = billingStore.countBillsByStatus();
        return new TableTotals(
                surveyUnits,
                billingStore.countActiveSurveyUnits(),
                billingStore.countRows(TargetTable.BILLS),
                byStatus,
                billedUnits,
                Math.max(0L, surveyUnits - billedUnits)
        );
    }

    public SyncStatisticsResponse snapshot(int recentRunLimit) {
        List<RunStatistics> recentRuns = runHistoryRepository.recentRuns(recentRunLimit);
        return new SyncStatisticsResponse(totals(), recentRuns);
    }
}
