package com.fintech.gaps.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;

/**
 * Textual timestamp layouts recognised when reading tables, in detection order.
 * Local date-times and dates carry no zone and are interpreted as UTC.
 *
 * <p>A column remembers the format it was read in so repaired files are written
 * back with the same layout.
 */
public enum TimestampFormat {

    ISO_INSTANT {
        @Override
        Instant parseText(String text) {
            return Instant.parse(text);
        }

        @Override
        public String format(long epochMillis) {
            return DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochMilli(epochMillis));
        }
    },

    ISO_OFFSET_DATE_TIME {
        @Override
        Instant parseText(String text) {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        }

        @Override
        public String format(long epochMillis) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(
                Instant.ofEpochMilli(epochMillis).atOffset(ZoneOffset.UTC));
        }
    },

    ISO_LOCAL_DATE_TIME {
        @Override
        Instant parseText(String text) {
            return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
        }

        @Override
        public String format(long epochMillis) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(
                LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), ZoneOffset.UTC));
        }
    },

    SPACE_LOCAL_DATE_TIME {
        @Override
        Instant parseText(String text) {
            return LocalDateTime.parse(text, SPACE_SEPARATED).toInstant(ZoneOffset.UTC);
        }

        @Override
        public String format(long epochMillis) {
            return SPACE_SEPARATED.format(
                LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), ZoneOffset.UTC));
        }
    },

    ISO_LOCAL_DATE {
        @Override
        Instant parseText(String text) {
            return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay().toInstant(ZoneOffset.UTC);
        }

        @Override
        public String format(long epochMillis) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(
                LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), ZoneOffset.UTC));
        }
    },

    EPOCH_MILLIS {
        @Override
        Instant parseText(String text) {
            return Instant.ofEpochMilli(Long.parseLong(text));
        }

        @Override
        public String format(long epochMillis) {
            return Long.toString(epochMillis);
        }
    };

    // "2024-01-01 13:00:00" as written by pandas to_csv
    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .appendLiteral(' ')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .toFormatter();

    abstract Instant parseText(String text);

    /** Renders epoch millis in this layout. */
    public abstract String format(long epochMillis);

    /**
     * Parses text in this layout.
     *
     * @return epoch millis, or null if the text does not match this layout
     */
    public Long parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return parseText(text.trim()).toEpochMilli();
        } catch (DateTimeParseException | NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    /**
     * Finds the first textual layout that parses the given text. Plain integers are
     * not treated as timestamps here; numeric columns stay numeric when read.
     *
     * @return matching layout, or null if none matches
     */
    public static TimestampFormat detect(String text) {
        for (TimestampFormat format : values()) {
            if (format != EPOCH_MILLIS && format.parse(text) != null) {
                return format;
            }
        }
        return null;
    }

    /**
     * Converts a cell value of any column type to epoch millis.
     * Numbers are read as epoch millis, strings through {@link #detect(String)}.
     *
     * @return epoch millis, or null if the value is null or not a timestamp
     */
    public static Long toEpochMillis(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long longValue) {
            return longValue;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? (long) d : null;
        }
        if (value instanceof Instant instant) {
            return instant.toEpochMilli();
        }
        if (value instanceof String text) {
            TimestampFormat format = detect(text);
            return format != null ? format.parse(text) : null;
        }
        return null;
    }
}
