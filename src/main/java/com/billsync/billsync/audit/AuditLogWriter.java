package com.billsync.billsync.audit;

import com.billsync.billsync.classify.ClassificationState;
import com.billsync.billsync.classify.ClassifiedRecord;
import com.billsync.billsync.sync.SyncConstants;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Map;

/**
 * Appends one line per classified record to the log matching its state: synced, pending sync or error.
 * Pending records never reach the error log. One writer per run; appends are serialized so upload
 * workers can share it.
 */
public final class AuditLogWriter implements Closeable {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern(SyncConstants.LOG_TIMESTAMP_PATTERN);

    private final Map<ClassificationState, BufferedWriter> writers;
    private final Map<ClassificationState, Integer> lineCounts = new EnumMap<>(ClassificationState.class);
    private final Clock clock;

    private AuditLogWriter(Map<ClassificationState, BufferedWriter> writers, Clock clock) {
        this.writers = writers;
        this.clock = clock;
        for (ClassificationState state : ClassificationState.values()) {
            lineCounts.put(state, 0);
        }
    }

    /**
     * Opens (creating when absent) the three append-only logs in {@code logDir}.
     *
     * @throws IOException when any log cannot be opened; already opened logs are closed again
     */
    public static AuditLogWriter open(Path logDir, Clock clock) throws IOException {
        Files.createDirectories(logDir);
        Map<ClassificationState, BufferedWriter> writers = new EnumMap<>(ClassificationState.class);
        try {
            for (ClassificationState state : ClassificationState.values()) {
                writers.put(state, Files.newBufferedWriter(logDir.resolve(fileName(state)), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE));
            }
        } catch (IOException ex) {
            for (BufferedWriter writer : writers.values()) {
                closeAfterFailure(writer, ex);
            }
            throw ex;
        }
        return new AuditLogWriter(writers, clock);
    }

    public static String fileName(ClassificationState state) {
        return switch (state) {
            case SYNCED -> SyncConstants.SYNCED_LOG_FILE;
            case PENDING_SYNC -> SyncConstants.PENDING_SYNC_LOG_FILE;
            case REJECTED -> SyncConstants.ERROR_LOG_FILE;
        };
    }

    /**
     * Appends the record to the log of its state.
     */
    public synchronized void append(String table, ClassifiedRecord<?> record) {
        StringBuilder line = new StringBuilder()
                .append(TIMESTAMP.format(LocalDateTime.now(clock)))
                .append(" | ").append(record.state().name())
                .append(" | ").append(table)
                .append(" | ").append(record.key())
                .append(" | tier=").append(record.tier() == null ? "-" : record.tier().name())
                .append(" | file=").append(record.location());
        if (record.reason() != null && record.state() != ClassificationState.SYNCED) {
            line.append(" | reason=").append(record.reason().replace('\n', ' ').replace('\r', ' '));
        }
        try {
            BufferedWriter writer = writers.get(record.state());
            writer.write(line.toString());
            writer.newLine();
            lineCounts.merge(record.state(), 1, Integer::sum);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to append to " + fileName(record.state()), ex);
        }
    }

    public synchronized int linesWritten(ClassificationState state) {
        return lineCounts.get(state);
    }

    public synchronized void flush() {
        try {
            for (BufferedWriter writer : writers.values()) {
                writer.flush();
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to flush audit logs", ex);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        IOException failure = null;
        for (BufferedWriter writer : writers.values()) {
            try {
                writer.close();
            } catch (IOException ex) {
                if (failure == null) {
                    failure = ex;
                } else {
                    failure.addSuppressed(ex);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static void closeAfterFailure(BufferedWriter writer, IOException primary) {
        try {
            writer.close();
        } catch (IOException ex) {
            primary.addSuppressed(ex);
        }
    }
}
