package io.github.yok.doltsync.db;

import io.github.yok.doltsync.model.ColumnType;
import io.github.yok.doltsync.util.JsonSupport;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.Generated;

/**
 * Decoding of values read back from a target into their declared logical type.
 *
 * <p>
 * Shared by all dialects. Only the conversions that adapters introduce when writing are reversed:
 * JSON text back to lists and maps, midnight timestamps back to dates, numeric booleans back to
 * booleans, ISO text back to times, and LOBs back to strings and byte arrays.
 * </p>
 */
public final class ValueCodec {

    /**
     * Prevents instantiation.
     */
    @Generated
    private ValueCodec() {}

    /**
     * Decodes a value into the given logical type.
     *
     * @param value value read from a target (may be {@code null})
     * @param type declared logical type, or {@code null} to return the value unchanged
     * @return decoded value
     * @throws IllegalArgumentException if the value cannot be decoded as the type
     */
    public static Object decode(Object value, ColumnType type) {
        if (value == null || type == null) {
            return value;
        }
        try {
            return decodeNonNull(readLob(value), type);
        } catch (SQLException e) {
            throw new IllegalArgumentException("Failed to read LOB value for type " + type, e);
        }
    }

    private static Object decodeNonNull(Object value, ColumnType type) {
        switch (type) {
            case JSON:
                return value instanceof Map ? value : JsonSupport.parseMap(value.toString());
            case ARRAY:
                return decodeArray(value);
            case DATE:
                return decodeDate(value);
            case TIMESTAMP:
                return value instanceof Timestamp ? ((Timestamp) value).toLocalDateTime() : value;
            case TIME:
                return decodeTime(value);
            case BOOLEAN:
                return decodeBoolean(value);
            case INTEGER:
                return value instanceof Number ? Integer.valueOf(((Number) value).intValue())
                        : Integer.valueOf(value.toString().trim());
            case BIGINT:
                return value instanceof Number ? Long.valueOf(((Number) value).longValue())
                        : Long.valueOf(value.toString().trim());
            case DECIMAL:
                return value instanceof BigDecimal ? value : new BigDecimal(value.toString().trim());
            case DOUBLE:
                return value instanceof Number ? Double.valueOf(((Number) value).doubleValue())
                        : Double.valueOf(value.toString().trim());
            case BINARY:
                return value;
            default:
                return value instanceof String ? value : value.toString();
        }
    }

    private static Object decodeArray(Object value) {
        if (value instanceof List) {
            return value;
        }
        if (value instanceof Collection || value instanceof java.sql.Array
                || (value.getClass().isArray() && !(value instanceof byte[]))) {
            return JsonSupport.parseList(JsonSupport.toJson(value));
        }
        return JsonSupport.parseList(value.toString());
    }

    private static Object decodeDate(Object value) {
        if (value instanceof LocalDate) {
            return value;
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toLocalDate();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        return LocalDate.parse(value.toString().trim());
    }

    private static Object decodeTime(Object value) {
        if (value instanceof LocalTime) {
            return value;
        }
        if (value instanceof Time) {
            return ((Time) value).toLocalTime();
        }
        return LocalTime.parse(value.toString().trim());
    }

    private static Object decodeBoolean(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        if ("1".equals(text) || "true".equals(text) || "t".equals(text)) {
            return Boolean.TRUE;
        }
        if ("0".equals(text) || "false".equals(text) || "f".equals(text)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Not a boolean: " + value);
    }

    /**
     * Reads a LOB into a string or byte array and widens {@link BigInteger} to
     * {@link BigDecimal}; other values are returned unchanged.
     *
     * @param value value read from a result set (may be {@code null})
     * @return detached value
     * @throws SQLException if the LOB cannot be read
     */
    public static Object readLob(Object value) throws SQLException {
        if (value instanceof Clob) {
            Clob clob = (Clob) value;
            return clob.getSubString(1, (int) clob.length());
        }
        if (value instanceof Blob) {
            Blob blob = (Blob) value;
            return blob.getBytes(1, (int) blob.length());
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        return value;
    }
}
