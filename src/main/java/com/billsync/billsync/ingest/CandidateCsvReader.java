package com.billsync.billsync.ingest;

import com.billsync.billsync.sync.SyncConstants;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Streams rows of one input export with headers resolved to canonical column names. Rows are read
 * lazily so arbitrarily large exports are never held in memory. A parse failure part-way through the
 * file yields one row carrying {@link CsvRow#readError()} and ends the iteration.
 */
public final class CandidateCsvReader implements Iterator<CsvRow>, Closeable {

    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    private final String sourceName;
    private final List<String> canonicalByIndex;
    private final Set<String> columns;
    private CsvRow errorRow;
    private boolean finished;
    private long lastRowNumber;

    private CandidateCsvReader(CSVParser parser, String sourceName, Map<String, String> aliases) {
        this.parser = parser;
        this.records = parser.iterator();
        this.sourceName = sourceName;
        List<String> mapped = new ArrayList<>();
        for (String header : parser.getHeaderNames()) {
            String normalized = ColumnAliases.normalizeHeader(header);
            mapped.add(aliases.get(normalized));
        }
        this.canonicalByIndex = Collections.unmodifiableList(mapped);
        Set<String> present = new LinkedHashSet<>();
        for (String column : mapped) {
            if (column != null) {
                present.add(column);
            }
        }
        this.columns = Collections.unmodifiableSet(present);
    }

    /**
     * Opens a reader over the given export. Fails when the content has no header row or when the
     * required key column is absent.
     */
    public static CandidateCsvReader open(Reader reader, String sourceName, Map<String, String> aliases,
                                          String requiredColumn) {
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .setAllowMissingColumnNames(true)
                .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
                .build();
        CSVParser parser;
        try {
            parser = csvFormat.parse(reader);
        } catch (IOException | UncheckedIOException ex) {
            throw new IllegalArgumentException(SyncConstants.MSG_INPUT_READ_FAILED.formatted(sourceName), ex);
        }

        if (parser.getHeaderNames().isEmpty()) {
            closeParser(parser);
            throw new IllegalArgumentException(SyncConstants.MSG_INPUT_NO_HEADER.formatted(sourceName));
        }

        CandidateCsvReader candidateReader = new CandidateCsvReader(parser, sourceName, aliases);
        if (requiredColumn != null && !candidateReader.columns().contains(requiredColumn)) {
            closeParser(parser);
            throw new IllegalArgumentException(
                    SyncConstants.MSG_INPUT_MISSING_KEY_COLUMN.formatted(sourceName, requiredColumn));
        }
        return candidateReader;
    }

    /**
     * Canonical columns present in the file header.
     */
    public Set<String> columns() {
        return columns;
    }

    @Override
    public boolean hasNext() {
        if (errorRow != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        try {
            boolean more = records.hasNext();
            if (!more) {
                finished = true;
            }
            return more;
        } catch (UncheckedIOException | IllegalStateException ex) {
            markUnreadable(ex);
            return true;
        }
    }

    @Override
    public CsvRow next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        if (errorRow != null) {
            CsvRow row = errorRow;
            errorRow = null;
            return row;
        }
        CSVRecord record;
        try {
            record = records.next();
        } catch (UncheckedIOException | IllegalStateException ex) {
            markUnreadable(ex);
            return next();
        }
        lastRowNumber = record.getRecordNumber();
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < canonicalByIndex.size(); i++) {
            String column = canonicalByIndex.get(i);
            if (column == null || !record.isSet(i)) {
                continue;
            }
            String value = record.get(i);
            String existing = values.get(column);
            if (existing == null || existing.isBlank()) {
                values.put(column, value);
            }
        }
        return new CsvRow(sourceName, lastRowNumber, values, null);
    }

    private void markUnreadable(RuntimeException ex) {
        finished = true;
        String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        errorRow = CsvRow.unreadable(sourceName, lastRowNumber + 1, "Unreadable CSV content: " + message);
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }

    private static void closeParser(CSVParser parser) {
        try {
            parser.close();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
