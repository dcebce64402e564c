package com.billsync.billsync.ingest;

import com.billsync.billsync.sync.SyncConstants;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.ParsePosition;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalQuery;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses raw export values at the ingestion boundary. Every parse method throws
 * {@link IllegalArgumentException} with an operator-readable reason when a value is unusable.
 */
public final class FieldNormalizer {

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");
    private static final Pattern SCIENTIFIC_PATTERN = Pattern.compile("[-+]?\\d+(\\.\\d+)?[eE][-+]?\\d+");
    private static final Pattern MONTH_IN_TEXT_PATTERN = Pattern.compile("([A-Za-z]{3,9})[-_ ](\\d{4})");
    private static final Set<String> MISSING_MARKERS = Set.of("nan", "none", "null", "invalid", "n/a");
    private static final Set<String> ZERO_MARKERS = Set.of("-", "--");
    private static final int MAX_MONEY_INTEGER_DIGITS = SyncConstants.MONEY_PRECISION - SyncConstants.MONEY_SCALE;

    private static final DateTimeFormatter CANONICAL_MONTH =
            DateTimeFormatter.ofPattern(SyncConstants.BILL_MONTH_PATTERN, Locale.ENGLISH);
    private static final List<DateTimeFormatter> MONTH_FORMATS = List.of(
            caseInsensitive("MMM-uuuu"),
            caseInsensitive("MMMM-uuuu"),
            caseInsensitive("MMM uuuu"),
            caseInsensitive("MMMM uuuu"),
            caseInsensitive("uuuu-MM")
    );
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("uuuu-MM-dd"),
            DateTimeFormatter.ofPattern("dd-MM-uuuu"),
            DateTimeFormatter.ofPattern("dd/MM/uuuu")
    );
    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("dd/MM/uuuu HH:mm"),
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm")
    );

    private FieldNormalizer() {
    }

    /**
     * Returns the cleaned identifier, or empty when the value is blank or a missing-value marker.
     */
    public static Optional<String> identifier(String raw, String fieldName) {
        String value = text(raw);
        if (value == null) {
            return Optional.empty();
        }
        if (SCIENTIFIC_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(fieldName + " is in scientific notation, digits lost: " + value);
        }
        if (value.endsWith(".0")) {
            value = value.substring(0, value.length() - 2);
        }
        if (MISSING_MARKERS.contains(value.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        if (!IDENTIFIER_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(fieldName + " is malformed: " + value);
        }
        if (value.length() > SyncConstants.MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(fieldName + " is longer than "
                    + SyncConstants.MAX_IDENTIFIER_LENGTH + " characters: " + value);
        }
        return Optional.of(value);
    }

    /**
     * Parses a billing month and returns it in canonical {@code MMM-yyyy} form.
     */
    public static String billMonth(String raw) {
        String value = text(raw);
        if (value == null) {
            throw new IllegalArgumentException("bill_month is missing");
        }
        Optional<String> parsed = tryBillMonth(value);
        if (parsed.isPresent()) {
            return parsed.get();
        }
        throw new IllegalArgumentException("bill_month is unparseable: " + value);
    }

    /**
     * Finds a billing month embedded in a file name such as {@code MASTER_FINANCIALS_Nov-2025_x.csv}.
     */
    public static Optional<String> billMonthFromName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher matcher = MONTH_IN_TEXT_PATTERN.matcher(fileName);
        while (matcher.find()) {
            Optional<String> month = tryBillMonth(matcher.group(1) + "-" + matcher.group(2));
            if (month.isPresent()) {
                return month;
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a currency value; blank and dash mean zero, thousands separators are dropped. The result
     * is rounded to two decimals and must fit {@code NUMERIC(14, 2)}.
     */
    public static BigDecimal money(String raw, String fieldName) {
        String value = text(raw);
        if (value == null || ZERO_MARKERS.contains(value)) {
            return BigDecimal.ZERO.setScale(SyncConstants.MONEY_SCALE);
        }
        String cleaned = value.replace(",", "");
        if (MISSING_MARKERS.contains(cleaned.toLowerCase(Locale.ROOT))) {
            return BigDecimal.ZERO.setScale(SyncConstants.MONEY_SCALE);
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(cleaned).setScale(SyncConstants.MONEY_SCALE, RoundingMode.HALF_UP);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(fieldName + " is not a number: " + value);
        }
        if (amount.precision() - amount.scale() > MAX_MONEY_INTEGER_DIGITS) {
            throw new IllegalArgumentException(fieldName + " is too large: " + value);
        }
        return amount;
    }

    public static PaymentStatus paymentStatus(String raw) {
        String value = text(raw);
        if (value == null) {
            return PaymentStatus.UNPAID;
        }
        try {
            return PaymentStatus.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("payment_status is unknown: " + value);
        }
    }

    public static LocalDate date(String raw, String fieldName) {
        String value = text(raw);
        if (value == null || ZERO_MARKERS.contains(value)) {
            return null;
        }
        String datePart = value.length() > 10 && value.charAt(10) == ' ' ? value.substring(0, 10) : value;
        try {
            Optional<LocalDate> parsed = parseFirst(datePart, DATE_FORMATS, LocalDate::from);
            if (parsed.isPresent()) {
                return parsed.get();
            }
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException(fieldName + " is not a valid date: " + value, ex);
        }
        throw new IllegalArgumentException(fieldName + " is unparseable: " + value);
    }

    public static LocalDateTime dateTime(String raw, String fieldName) {
        String value = text(raw);
        if (value == null) {
            return null;
        }
        try {
            Optional<LocalDateTime> parsed = parseFirst(value, DATE_TIME_FORMATS, LocalDateTime::from);
            if (parsed.isPresent()) {
                return parsed.get();
            }
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException(fieldName + " is not a valid timestamp: " + value, ex);
        }
        throw new IllegalArgumentException(fieldName + " is unparseable: " + value);
    }

    /**
     * Parses a coordinate and checks it against {@code limit} (90 for latitude, 180 for longitude).
     */
    public static Double coordinate(String raw, String fieldName, double limit) {
        String value = text(raw);
        if (value == null) {
            return null;
        }
        double parsed;
        try {
            parsed = Double.parseDouble(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(fieldName + " is not a number: " + value);
        }
        if (Double.isNaN(parsed) || Math.abs(parsed) > limit) {
            throw new IllegalArgumentException(fieldName + " is out of range: " + value);
        }
        return parsed;
    }

    /**
     * Splits a combined {@code "lat,long"} value into its two parts.
     */
    public static String[] splitCoordinates(String raw) {
        String value = text(raw);
        if (value == null) {
            return new String[] {null, null};
        }
        String[] parts = value.split(",");
        if (parts.length < 2) {
            throw new IllegalArgumentException("gps_coordinates is not a lat,long pair: " + value);
        }
        return new String[] {parts[0].trim(), parts[1].trim()};
    }

    /**
     * Parses a portal status flag. Blank means the unit is not active on the portal.
     */
    public static boolean activeFlag(String raw) {
        String value = text(raw);
        if (value == null) {
            return false;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes", "y", "active" -> true;
            case "0", "false", "no", "n", "inactive" -> false;
            default -> throw new IllegalArgumentException("is_active is unknown: " + value);
        };
    }

    /**
     * Trims free text; blank becomes null.
     */
    public static String text(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static Optional<String> tryBillMonth(String value) {
        try {
            return parseFirst(value, MONTH_FORMATS, YearMonth::from).map(month -> month.format(CANONICAL_MONTH));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    /**
     * Applies the first format that consumes the whole value. Resolution errors (month 13, day 32)
     * surface as {@link DateTimeParseException}.
     */
    private static <T> Optional<T> parseFirst(String value, List<DateTimeFormatter> formats, TemporalQuery<T> query) {
        for (DateTimeFormatter format : formats) {
            ParsePosition position = new ParsePosition(0);
            if (format.parseUnresolved(value, position) != null
                    && position.getErrorIndex() < 0
                    && position.getIndex() == value.length()) {
                return Optional.of(format.parse(value, query));
            }
        }
        return Optional.empty();
    }

    private static DateTimeFormatter caseInsensitive(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}
