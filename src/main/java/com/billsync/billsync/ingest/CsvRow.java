package com.billsync.billsync.ingest;

import java.util.Map;

/**
 * One data row of an input export with canonical column names. {@code readError} is set when the
 * underlying file could not be parsed past this point.
 */
public record CsvRow(String source, long rowNumber, Map<String, String> values, String readError) {

    public CsvRow {
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    public static CsvRow unreadable(String source, long rowNumber, String readError) {
        return new CsvRow(source, rowNumber, Map.of(), readError);
    }

    public String get(String column) {
        return values.get(column);
    }

    /**
     * True when the export carries the column at all, even if this row leaves it blank.
     */
    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    public boolean has(String column) {
        String value = values.get(column);
        return value != null && !value.isBlank();
    }

    public String location() {
        return source + ":" + rowNumber;
    }
}
