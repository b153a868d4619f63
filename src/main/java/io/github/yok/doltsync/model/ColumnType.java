package io.github.yok.doltsync.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Logical column types shared by all dialects.
 *
 * <p>
 * Used in two places: schema inference when a missing target table is created from the rows of a
 * batch, and explicit decoding of values that a dialect had to transcode (JSON text, Oracle
 * {@code DATE} at midnight, {@code NUMBER(1)} booleans).
 * </p>
 */
public enum ColumnType {
    STRING, INTEGER, BIGINT, DECIMAL, DOUBLE, BOOLEAN, DATE, TIMESTAMP, TIME, BINARY, JSON, ARRAY;

    private static final Set<ColumnType> NUMERIC = EnumSet.of(INTEGER, BIGINT, DECIMAL, DOUBLE);

    /**
     * Infers the logical type of a single Java value as returned by a JDBC driver.
     *
     * @param value value (may be {@code null})
     * @return inferred type, or {@code null} when the value is {@code null}
     */
    public static ColumnType infer(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String || value instanceof Character || value instanceof Enum) {
            return STRING;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return INTEGER;
        }
        if (value instanceof Long || value instanceof BigInteger) {
            return BIGINT;
        }
        if (value instanceof BigDecimal) {
            return DECIMAL;
        }
        if (value instanceof Double || value instanceof Float) {
            return DOUBLE;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof LocalDate || value instanceof java.sql.Date) {
            return DATE;
        }
        if (value instanceof LocalDateTime || value instanceof Timestamp
                || value instanceof OffsetDateTime) {
            return TIMESTAMP;
        }
        if (value instanceof LocalTime || value instanceof Time) {
            return TIME;
        }
        if (value instanceof byte[]) {
            return BINARY;
        }
        if (value instanceof Map) {
            return JSON;
        }
        if (value instanceof Collection || value instanceof java.sql.Array
                || value.getClass().isArray()) {
            return ARRAY;
        }
        return STRING;
    }

    /**
     * Returns the narrowest type able to hold values of both types.
     *
     * <p>
     * Numeric types widen ({@code INTEGER → BIGINT → DECIMAL → DOUBLE}), {@code DATE} widens to
     * {@code TIMESTAMP}; any other mix falls back to {@link #STRING}. {@code null} acts as the
     * identity.
     * </p>
     *
     * @param a first type (may be {@code null})
     * @param b second type (may be {@code null})
     * @return widened type, or {@code null} when both are {@code null}
     */
    public static ColumnType widen(ColumnType a, ColumnType b) {
        if (a == null) {
            return b;
        }
        if (b == null || a == b) {
            return a;
        }
        if (NUMERIC.contains(a) && NUMERIC.contains(b)) {
            return a.ordinal() > b.ordinal() ? a : b;
        }
        if ((a == DATE && b == TIMESTAMP) || (a == TIMESTAMP && b == DATE)) {
            return TIMESTAMP;
        }
        return STRING;
    }

    /**
     * Parses a configuration value such as {@code "date"} or {@code "ARRAY"}.
     *
     * @param value raw value
     * @return type
     * @throws IllegalArgumentException if the value is not a known type
     */
    public static ColumnType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("column type must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
