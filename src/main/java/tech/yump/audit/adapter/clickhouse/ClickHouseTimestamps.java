package tech.yump.audit.adapter.clickhouse;

import tech.yump.audit.adapter.CorruptRowException;
import tech.yump.audit.adapter.UnsupportedMethodException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/**
 * Conversion between Java time values and the engine's {@code DateTime64(3)} text form,
 * {@code 2025-12-07 23:33:54.493}. Values are always expressed in UTC.
 */
final class ClickHouseTimestamps {

    static final DateTimeFormatter ENGINE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS")
            .withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter ENGINE_PARSER = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();

    private ClickHouseTimestamps() {
    }

    static String format(Instant instant) {
        return ENGINE_FORMAT.format(instant);
    }

    /**
     * Formats a query operand compared against a datetime column.
     * Accepts {@link Instant}, {@link OffsetDateTime}, {@link ZonedDateTime}, {@link LocalDateTime} (taken as
     * UTC) and ISO-8601 strings with or without an offset.
     */
    static String formatOperand(Object value) {
        if (value instanceof Instant instant) {
            return format(instant);
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return format(offsetDateTime.toInstant());
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return format(zonedDateTime.toInstant());
        }
        if (value instanceof LocalDateTime localDateTime) {
            return format(localDateTime.toInstant(ZoneOffset.UTC));
        }
        if (value instanceof String text) {
            return format(parseOperand(text));
        }
        throw new UnsupportedMethodException("Invalid datetime value: " + value);
    }

    static Instant parse(String value) {
        try {
            return LocalDateTime.parse(value, ENGINE_PARSER).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new CorruptRowException("Invalid datetime in result row: " + value, e);
        }
    }

    private static Instant parseOperand(String text) {
        try {
            if (text.indexOf('T') < 0) {
                return LocalDateTime.parse(text, ENGINE_PARSER).toInstant(ZoneOffset.UTC);
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            return parsed instanceof OffsetDateTime offsetDateTime
                    ? offsetDateTime.toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new UnsupportedMethodException("Invalid datetime string: " + text, e);
        }
    }
}
