package io.mustlink.api.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/**
 * Time formatting and parsing helpers for the WebMUST wire formats.
 * The service exchanges UTC wall-clock strings; everything inside the client is an {@link Instant}.
 */
public class MustTimeUtils {

    /** Literal the service reports for a parameter that never recorded a sample. */
    public static final String NO_DATA_SENTINEL = "N/A";

    public static final DateTimeFormatter REQUEST_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    public static final DateTimeFormatter REQUEST_FORMAT_MS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    // Space or 'T' separated, optional fraction of up to nine digits, optional offset
    private static final DateTimeFormatter SERVICE_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd")
            .optionalStart().appendLiteral(' ').optionalEnd()
            .optionalStart().appendLiteral('T').optionalEnd()
            .appendPattern("HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HH:MM", "Z")
            .optionalEnd()
            .toFormatter();

    private MustTimeUtils() {
    }

    public static String formatRequestTime(Instant instant) {
        return REQUEST_FORMAT.format(instant);
    }

    public static String formatRequestTimeMillis(Instant instant) {
        return REQUEST_FORMAT_MS.format(instant);
    }

    public static Instant fromEpochMillis(Object value) {
        if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue());
        }
        if (value instanceof String) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(((String) value).trim()));
            } catch (NumberFormatException e) {
                return parseTimestamp((String) value);
            }
        }
        throw new DateTimeParseException("Not an epoch timestamp: " + value, String.valueOf(value), 0);
    }

    /**
     * Parse a timestamp as rendered by the service. Values without an offset are taken as UTC.
     *
     * @throws DateTimeParseException if no supported layout matches
     */
    public static Instant parseTimestamp(String text) {
        if (text == null) {
            throw new DateTimeParseException("Timestamp is null", "", 0);
        }
        String value = text.trim();
        if (value.length() == 10) {
            return LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        TemporalAccessor parsed = SERVICE_FORMAT.parse(value);
        LocalDateTime local = LocalDateTime.from(parsed);
        if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            return local.toInstant(ZoneOffset.ofTotalSeconds(parsed.get(ChronoField.OFFSET_SECONDS)));
        }
        return local.toInstant(ZoneOffset.UTC);
    }

    /**
     * Parse a sample-bound value, mapping the no-data sentinel (or an empty value) to {@code null}.
     *
     * @throws DateTimeParseException if the value is neither the sentinel nor a timestamp
     */
    public static Instant parseSampleBound(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        if (text.isEmpty() || NO_DATA_SENTINEL.equalsIgnoreCase(text)) {
            return null;
        }
        return parseTimestamp(text);
    }

    /**
     * Parse a cell value, returning {@code null} when the value is missing or not a timestamp.
     */
    public static Instant parseOrNull(Object value) {
        if (value == null) {
            return null;
        }
        try {
            if (value instanceof Number) {
                return fromEpochMillis(value);
            }
            String text = value.toString().trim();
            if (text.isEmpty()) {
                return null;
            }
            return parseTimestamp(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
