package com.billsync.billsync.upload;

import com.billsync.billsync.audit.AuditLogWriter;
import com.billsync.billsync.classify.ClassifiedRecord;
import com.billsync.billsync.sync.SyncProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.function.BooleanSupplier;

/**
 * Streams classified records into an {@link UpsertTarget}. Pending and rejected records go straight to
 * the audit log; accepted records are grouped into batches that are written by a bounded set of worker
 * lanes. A batch that keeps failing after its retries is logged as rejected and the run moves on.
 * <p>
 * Each record key is routed to one lane by its hash and every lane writes its batches one at a time
 * in input order, so repeated keys never race and the last occurrence of a key is the one stored.
 */
@Component
public class UpsertEngine {

    private static final Logger log = LoggerFactory.getLogger(UpsertEngine.class);

    private final int batchSize;
    private final int workerCount;
    private final int maxAttempts;
    private final RetryTemplate retryTemplate;
    private final List<ExecutorService> lanes;

    public UpsertEngine(SyncProperties properties) {
        this.batchSize = Math.max(1, properties.getBatchSize());
        this.workerCount = Math.max(1, properties.getUploadWorkers());
        this.maxAttempts = Math.max(1, properties.getMaxAttempts());
        this.retryTemplate = buildRetryTemplate(properties, maxAttempts);
        List<ExecutorService> executors = new ArrayList<>(workerCount);
        for (int lane = 1; lane <= workerCount; lane++) {
            String threadName = "billsync-upload-" + lane;
            executors.add(Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, threadName);
                thread.setDaemon(true);
                return thread;
            }));
        }
        this.lanes = List.copyOf(executors);
        log.info("Upsert engine ready: batchSize={}, workers={}, maxAttempts={}", batchSize, workerCount, maxAttempts);
    }

    /**
     * Consumes {@code records} until exhausted or until {@code abortRequested} reports true. The abort
     * flag is checked before each record is read and before each batch is sent; batches already in
     * flight complete normally.
     */
    public <T> UploadOutcome upload(Iterator<ClassifiedRecord<T>> records,
                                    UpsertTarget<T> target,
                                    AuditLogWriter auditLog,
                                    BooleanSupplier abortRequested) {
        String table = target.table().tableName();
        OutcomeCounter counter = new OutcomeCounter();
        Semaphore inFlight = new Semaphore(workerCount * 2);
        List<Future<?>> submitted = new ArrayList<>();
        List<List<ClassifiedRecord<T>>> laneBatches = new ArrayList<>(workerCount);
        for (int lane = 0; lane < workerCount; lane++) {
            laneBatches.add(new ArrayList<>(batchSize));
        }
        boolean aborted = false;

        while (!aborted && records.hasNext()) {
            if (abortRequested.getAsBoolean()) {
                aborted = true;
                break;
            }
            ClassifiedRecord<T> record = records.next();
            switch (record.state()) {
                case SYNCED -> {
                    counter.tier(record.tier());
                    int lane = laneOf(record.key());
                    List<ClassifiedRecord<T>> batch = laneBatches.get(lane);
                    batch.add(record);
                    if (batch.size() >= batchSize) {
                        aborted = !dispatch(batch, lane, submitted.size() + 1, target, auditLog, counter,
                                inFlight, abortRequested, submitted);
                        laneBatches.set(lane, new ArrayList<>(batchSize));
                    }
                }
                case PENDING_SYNC -> {
                    counter.tier(record.tier());
                    counter.pending();
                    auditLog.append(table, record);
                }
                case REJECTED -> {
                    counter.rejected();
                    auditLog.append(table, record);
                }
            }
        }
        for (int lane = 0; lane < workerCount; lane++) {
            List<ClassifiedRecord<T>> batch = laneBatches.get(lane);
            if (batch.isEmpty()) {
                continue;
            }
            if (aborted) {
                counter.unprocessed(batch.size());
            } else {
                aborted = !dispatch(batch, lane, submitted.size() + 1, target, auditLog, counter, inFlight,
                        abortRequested, submitted);
            }
        }

        aborted |= awaitAll(submitted);
        auditLog.flush();
        UploadOutcome outcome = counter.toOutcome(table, aborted);
        log.info("Upload into {} finished: synced={}, pending={}, rejected={} (write failures={}), batches ok={}, failed={}, unprocessed={}, aborted={}",
                table, outcome.synced(), outcome.pending(), outcome.rejected(), outcome.writeFailures(),
                outcome.batchesCommitted(), outcome.batchesFailed(), outcome.unprocessed(), aborted);
        return outcome;
    }

    @PreDestroy
    public void shutdown() {
        for (ExecutorService lane : lanes) {
            lane.shutdownNow();
        }
    }

    private int laneOf(String key) {
        return Math.floorMod(key == null ? 0 : key.hashCode(), workerCount);
    }

    /**
     * Queues one batch on its lane, blocking while too many batches are waiting.
     *
     * @return false when the run was aborted and the batch was not sent
     */
    private <T> boolean dispatch(List<ClassifiedRecord<T>> batch,
                                 int lane,
                                 int batchNumber,
                                 UpsertTarget<T> target,
                                 AuditLogWriter auditLog,
                                 OutcomeCounter counter,
                                 Semaphore inFlight,
                                 BooleanSupplier abortRequested,
                                 List<Future<?>> submitted) {
        if (abortRequested.getAsBoolean()) {
            counter.unprocessed(batch.size());
            return false;
        }
        try {
            inFlight.acquire();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting to send {} batch {}", target.table().tableName(), batchNumber);
            counter.unprocessed(batch.size());
            return false;
        }
        submitted.add(lanes.get(lane).submit(() -> {
            try {
                writeBatch(batch, batchNumber, target, auditLog, counter);
            } finally {
                inFlight.release();
            }
        }));
        return true;
    }

    private <T> void writeBatch(List<ClassifiedRecord<T>> batch,
                                int batchNumber,
                                UpsertTarget<T> target,
                                AuditLogWriter auditLog,
                                OutcomeCounter counter) {
        String table = target.table().tableName();
        List<T> rows = new ArrayList<>(batch.size());
        for (ClassifiedRecord<T> record : batch) {
            rows.add(record.record());
        }
        try {
            retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying {} batch {} (attempt {}/{}) after: {}", table, batchNumber,
                            context.getRetryCount() + 1, maxAttempts, describe(context.getLastThrowable()));
                }
                return target.upsertBatch(rows);
            });
        } catch (RuntimeException ex) {
            log.error("{} batch {} failed, {} records rejected", table, batchNumber, batch.size(), ex);
            String cause = "Batch write failed: " + describe(ex);
            for (ClassifiedRecord<T> record : batch) {
                auditLog.append(table, record.asWriteFailure(cause));
            }
            counter.failed(batch.size());
            return;
        }
        for (ClassifiedRecord<T> record : batch) {
            auditLog.append(table, record);
        }
        counter.committed(batch.size());
        log.debug("{} batch {} committed ({} records)", table, batchNumber, batch.size());
    }

    /**
     * @return true when waiting was interrupted
     */
    private boolean awaitAll(List<Future<?>> submitted) {
        for (Future<?> future : submitted) {
            try {
                future.get();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for upload batches");
                return true;
            } catch (ExecutionException ex) {
                throw new IllegalStateException("Upload worker failed", ex.getCause());
            }
        }
        return false;
    }

    private static RetryTemplate buildRetryTemplate(SyncProperties properties, int maxAttempts) {
        long initialBackoff = Math.max(1L, properties.getInitialBackoffMillis());
        long maxBackoff = Math.max(initialBackoff, properties.getMaxBackoffMillis());
        RetryTemplateBuilder builder = RetryTemplate.builder().maxAttempts(maxAttempts);
        if (properties.getBackoffMultiplier() > 1.0d) {
            builder.exponentialBackoff(initialBackoff, properties.getBackoffMultiplier(), maxBackoff);
        } else {
            builder.fixedBackoff(initialBackoff);
        }
        return builder
                .retryOn(TransientDataAccessException.class)
                .retryOn(RecoverableDataAccessException.class)
                .retryOn(DataAccessResourceFailureException.class)
                .traversingCauses()
                .build();
    }

    private static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown error";
        }
        Throwable root = throwable;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return root.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
