package com.billsync.billsync.sync;

import com.billsync.billsync.audit.AuditLogWriter;
import com.billsync.billsync.classify.ClassificationState;
import com.billsync.billsync.classify.ClassifiedRecord;
import com.billsync.billsync.classify.IssuanceEvidence;
import com.billsync.billsync.classify.RecordClassifier;
import com.billsync.billsync.classify.SurveyKeyLookup;
import com.billsync.billsync.ingest.BillRecord;
import com.billsync.billsync.ingest.BillerContact;
import com.billsync.billsync.ingest.CandidateCsvReader;
import com.billsync.billsync.ingest.ColumnAliases;
import com.billsync.billsync.ingest.CsvRow;
import com.billsync.billsync.ingest.FieldNormalizer;
import com.billsync.billsync.ingest.SurveyUnit;
import com.billsync.billsync.pdf.ExtractionReportWriter;
import com.billsync.billsync.pdf.PdfExtractionReport;
import com.billsync.billsync.pdf.PsidExtractor;
import com.billsync.billsync.stats.RunStatistics;
import com.billsync.billsync.stats.StatisticsReporter;
import com.billsync.billsync.stats.SyncStatisticsResponse;
import com.billsync.billsync.upload.BillingStore;
import com.billsync.billsync.upload.TargetTable;
import com.billsync.billsync.upload.UploadOutcome;
import com.billsync.billsync.upload.UpsertEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Runs the reconciliation pipeline: survey exports into {@code survey_units}, PDF scans into issuance
 * evidence and bill ledgers into {@code bills}. Runs are serialized; an abort request stops the
 * current run between batches.
 */
@Service
public class SyncService {

    private static final Logger log = LoggerFactory.getLogger(SyncService.class);

    private final SyncProperties syncProperties;
    private final BillingStore billingStore;
    private final RecordClassifier recordClassifier;
    private final UpsertEngine upsertEngine;
    private final PsidExtractor psidExtractor;
    private final ExtractionReportWriter extractionReportWriter;
    private final StatisticsReporter statisticsReporter;
    private final Clock clock;

    private final ReentrantLock runLock = new ReentrantLock();
    private final AtomicBoolean abortRequested = new AtomicBoolean();
    private final AtomicLong lastRunId = new AtomicLong();

    public SyncService(SyncProperties syncProperties,
                       BillingStore billingStore,
                       RecordClassifier recordClassifier,
                       UpsertEngine upsertEngine,
                       PsidExtractor psidExtractor,
                       ExtractionReportWriter extractionReportWriter,
                       StatisticsReporter statisticsReporter,
                       Clock clock) {
        this.syncProperties = syncProperties;
        this.billingStore = billingStore;
        this.recordClassifier = recordClassifier;
        this.upsertEngine = upsertEngine;
        this.psidExtractor = psidExtractor;
        this.extractionReportWriter = extractionReportWriter;
        this.statisticsReporter = statisticsReporter;
        this.clock = clock;
    }

    public RunStatistics syncSurveyUnits(Path file) {
        runLock.lock();
        try {
            abortRequested.set(false);
            return surveyRun(file);
        } finally {
            runLock.unlock();
        }
    }

    public RunStatistics syncSurveyUnits(String sourceName, byte[] content) {
        runLock.lock();
        try {
            abortRequested.set(false);
            return surveyRun(sourceName, readerFor(content));
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Loads a bill ledger file.
     *
     * @param billMonth month for rows without one; when null the month in the file name is used
     * @param pdfDir    directory of issued bill PDFs used to tag issued bills, may be null
     */
    public RunStatistics syncBills(Path file, String billMonth, Path pdfDir) {
        runLock.lock();
        try {
            abortRequested.set(false);
            IssuanceEvidence evidence = pdfDir == null ? IssuanceEvidence.none() : scanDocuments(pdfDir).toEvidence();
            return billRun(file, billMonth, evidence);
        } finally {
            runLock.unlock();
        }
    }

    public RunStatistics syncBills(String sourceName, byte[] content, String billMonth, Path pdfDir) {
        runLock.lock();
        try {
            abortRequested.set(false);
            IssuanceEvidence evidence = pdfDir == null ? IssuanceEvidence.none() : scanDocuments(pdfDir).toEvidence();
            return billRun(sourceName, readerFor(content), resolveBillMonth(billMonth, sourceName), evidence);
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Scans a PDF directory and writes the extraction results and summary files.
     */
    public PdfExtractionReport extractPsids(Path pdfDir) {
        runLock.lock();
        try {
            abortRequested.set(false);
            return scanDocuments(pdfDir);
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Processes everything in the configured inbox: survey exports first, then the PDF directory, then
     * bill ledgers, each group in file name order. An unusable file is recorded with its reason and
     * skipped; a fatal error stops the pass.
     */
    public InboxRunResult syncInbox() {
        runLock.lock();
        try {
            abortRequested.set(false);
            Path inputDir = Path.of(syncProperties.getInputDir());
            List<RunStatistics> runs = new ArrayList<>();

            for (Path file : matchingFiles(inputDir, syncProperties.getSurveyFilePattern())) {
                if (abortRequested.get()) {
                    break;
                }
                runs.add(inboxFile(file, TargetTable.SURVEY_UNITS, () -> surveyRun(file)));
            }

            PdfExtractionReport extraction = PdfExtractionReport.empty();
            Path pdfDir = Path.of(syncProperties.getPdfDir());
            if (!abortRequested.get()) {
                if (Files.isDirectory(pdfDir)) {
                    extraction = scanDocuments(pdfDir);
                } else {
                    log.warn("PDF directory {} not found, bills will be tagged without issuance evidence", pdfDir);
                }
            }
            IssuanceEvidence evidence = extraction.toEvidence();

            for (Path file : matchingFiles(inputDir, syncProperties.getBillFilePattern())) {
                if (abortRequested.get()) {
                    break;
                }
                runs.add(inboxFile(file, TargetTable.BILLS, () -> billRun(file, null, evidence)));
            }

            boolean aborted = abortRequested.get();
            log.info("Inbox pass complete. files={}, documents={}, psids={}, aborted={}",
                    runs.size(), extraction.totalDocuments(), extraction.successCount(), aborted);
            return new InboxRunResult(runs, extraction.totalDocuments(), extraction.successCount(), aborted);
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Asks the current run to stop after the batches already in flight.
     *
     * @return true when a run was in progress
     */
    public boolean requestAbort() {
        boolean running = runLock.isLocked();
        abortRequested.set(true);
        log.warn("Abort requested (run in progress={})", running);
        return running;
    }

    public SyncStatisticsResponse statistics() {
        return statisticsReporter.snapshot(SyncConstants.DEFAULT_RECENT_RUNS);
    }

    private RunStatistics inboxFile(Path file, TargetTable table, Supplier<RunStatistics> step) {
        try {
            return step.get();
        } catch (IllegalArgumentException ex) {
            log.error("Skipping {}: {}", file, ex.getMessage());
            LocalDateTime now = LocalDateTime.now(clock);
            RunStatistics skipped = StatisticsReporter.failedBeforeStart(nextRunId(), table,
                    file.getFileName().toString(), now, now, ex.getMessage());
            statisticsReporter.report(skipped);
            return skipped;
        }
    }

    private RunStatistics surveyRun(Path file) {
        return surveyRun(file.getFileName().toString(), readerFor(file));
    }

    private RunStatistics surveyRun(String sourceName, Reader input) {
        long runId = nextRunId();
        LocalDateTime startedAt = LocalDateTime.now(clock);
        try (Reader source = input) {
            verifyDatabase();
            return surveyRun(runId, startedAt, sourceName, source);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to close " + sourceName, ex);
        }
    }

    private RunStatistics surveyRun(long runId, LocalDateTime startedAt, String sourceName, Reader input) {
        try (AuditLogWriter auditLog = openAuditLog();
             CandidateCsvReader rows = CandidateCsvReader.open(input, sourceName, ColumnAliases.SURVEY,
                     ColumnAliases.SURVEY_ID)) {
            Iterator<ClassifiedRecord<SurveyUnit>> records = classifying(rows, recordClassifier::classifySurveyUnit);
            UploadOutcome outcome = upsertEngine.upload(records, billingStore.surveyUnits(), auditLog,
                    abortRequested::get);
            return finish(runId, sourceName, outcome, startedAt);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to close audit logs for " + sourceName, ex);
        }
    }

    private RunStatistics billRun(Path file, String billMonth, IssuanceEvidence evidence) {
        String sourceName = file.getFileName().toString();
        return billRun(sourceName, readerFor(file), resolveBillMonth(billMonth, sourceName), evidence);
    }

    private RunStatistics billRun(String sourceName, Reader input, String defaultBillMonth, IssuanceEvidence evidence) {
        long runId = nextRunId();
        LocalDateTime startedAt = LocalDateTime.now(clock);
        try (Reader source = input) {
            Set<String> surveyIds = loadSurveyKeys();
            log.info("Bill run {} for {}: defaultMonth={}, surveyKeys={}, issuedPsids={}",
                    runId, sourceName, defaultBillMonth, surveyIds.size(), evidence.size());
            return billRun(runId, startedAt, sourceName, source, defaultBillMonth,
                    SurveyKeyLookup.of(surveyIds), evidence);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to close " + sourceName, ex);
        }
    }

    private RunStatistics billRun(long runId, LocalDateTime startedAt, String sourceName, Reader input,
                                  String defaultBillMonth, SurveyKeyLookup surveyKeys, IssuanceEvidence evidence) {
        // one contact per unit, the last biller list row wins
        Map<String, ClassifiedRecord<BillerContact>> contacts = new LinkedHashMap<>();
        try (AuditLogWriter auditLog = openAuditLog();
             CandidateCsvReader rows = CandidateCsvReader.open(input, sourceName, ColumnAliases.BILL,
                     ColumnAliases.PSID)) {
            Iterator<ClassifiedRecord<BillRecord>> records = classifying(rows, row -> {
                ClassifiedRecord<BillRecord> bill = recordClassifier.classifyBill(row, defaultBillMonth, surveyKeys,
                        evidence);
                if (bill.state() == ClassificationState.SYNCED) {
                    recordClassifier.classifyBillerContact(row, bill.record().surveyIdFk())
                            .ifPresent(contact -> {
                                contacts.remove(contact.key());
                                contacts.put(contact.key(), contact);
                            });
                }
                return bill;
            });
            UploadOutcome outcome = upsertEngine.upload(records, billingStore.bills(), auditLog,
                    abortRequested::get);
            RunStatistics statistics = finish(runId, sourceName, outcome, startedAt);
            if (!contacts.isEmpty()) {
                applyBillerContacts(runId, sourceName, contacts, auditLog, outcome.aborted());
            }
            return statistics;
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to close audit logs for " + sourceName, ex);
        }
    }

    /**
     * Writes the contact columns of a biller list onto the survey units its bills resolved to. Recorded
     * in the run history as the {@code survey_units} part of the same run.
     */
    private void applyBillerContacts(long runId, String sourceName, Map<String, ClassifiedRecord<BillerContact>> contacts,
                                     AuditLogWriter auditLog, boolean billsAborted) {
        if (billsAborted) {
            log.warn("Bill run {} aborted, {} biller contacts not applied", runId, contacts.size());
            return;
        }
        LocalDateTime startedAt = LocalDateTime.now(clock);
        UploadOutcome outcome = upsertEngine.upload(contacts.values().iterator(), billingStore.billerContacts(),
                auditLog, abortRequested::get);
        finish(runId, sourceName, outcome, startedAt);
    }

    private RunStatistics finish(long runId, String sourceName, UploadOutcome outcome, LocalDateTime startedAt) {
        RunStatistics statistics = StatisticsReporter.summarize(runId, sourceName, outcome, startedAt,
                LocalDateTime.now(clock), outcome.aborted() ? SyncConstants.MSG_RUN_ABORTED : null);
        statisticsReporter.report(statistics);
        return statistics;
    }

    private PdfExtractionReport scanDocuments(Path pdfDir) {
        PdfExtractionReport report = psidExtractor.extractAll(pdfDir);
        ExtractionReportWriter.ExtractionFiles files = extractionReportWriter.write(report,
                Path.of(syncProperties.getOutputDir()), LocalDateTime.now(clock));
        log.info("Extraction results written to {} and {}", files.results(), files.summary());
        return report;
    }

    private void verifyDatabase() {
        try {
            billingStore.verifyConnection();
        } catch (DataAccessException ex) {
            throw new SyncRunAbortedException(SyncConstants.MSG_DATABASE_UNAVAILABLE, ex);
        }
    }

    private Set<String> loadSurveyKeys() {
        verifyDatabase();
        try {
            return billingStore.loadSurveyIds();
        } catch (DataAccessException ex) {
            throw new SyncRunAbortedException(SyncConstants.MSG_SURVEY_KEYS_UNAVAILABLE, ex);
        }
    }

    private AuditLogWriter openAuditLog() {
        Path logDir = Path.of(syncProperties.getLogDir());
        try {
            return AuditLogWriter.open(logDir, clock);
        } catch (IOException ex) {
            throw new SyncRunAbortedException(String.format(SyncConstants.MSG_LOG_OPEN_FAILED, logDir), ex);
        }
    }

    private long nextRunId() {
        long now = clock.millis();
        return lastRunId.updateAndGet(previous -> Math.max(previous + 1, now));
    }

    private static String resolveBillMonth(String billMonth, String sourceName) {
        if (billMonth != null && !billMonth.isBlank()) {
            return billMonth;
        }
        return FieldNormalizer.billMonthFromName(sourceName).orElse(null);
    }

    private static Reader readerFor(Path file) {
        try {
            return Files.newBufferedReader(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalArgumentException(String.format(SyncConstants.MSG_INPUT_READ_FAILED, file), ex);
        }
    }

    private static Reader readerFor(byte[] content) {
        return new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8);
    }

    private static List<Path> matchingFiles(Path baseDir, String pattern) {
        if (!Files.isDirectory(baseDir)) {
            log.warn("Input directory {} not found", baseDir);
            return List.of();
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        try (Stream<Path> paths = Files.walk(baseDir)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> matcher.matches(baseDir.relativize(path)))
                    .sorted()
                    .toList();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to list input files in " + baseDir, ex);
        }
    }

    private static <T> Iterator<ClassifiedRecord<T>> classifying(Iterator<CsvRow> rows,
                                                                 Function<CsvRow, ClassifiedRecord<T>> classifier) {
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return rows.hasNext();
            }

            @Override
            public ClassifiedRecord<T> next() {
                return classifier.apply(rows.next());
            }
        };
    }
}
