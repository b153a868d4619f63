package io.github.yok.doltsync.core;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import io.github.yok.doltsync.util.JsonSupport;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Generated;
import org.apache.commons.codec.binary.Hex;

/**
 * Deterministic hashing of row values.
 *
 * <p>
 * A fingerprint identifies a row by its primary-key values and must be equal for the same logical
 * key no matter which system the row was read from. Values are therefore canonicalized before they
 * are hashed:
 * </p>
 * <ul>
 * <li>numbers: plain decimal string without trailing zeros ({@code 1}, {@code 1.0} and
 * {@code 1L} are equal)</li>
 * <li>booleans: {@code 1} / {@code 0}, so that {@code TINYINT(1)} and {@code NUMBER(1)} columns
 * agree with native booleans</li>
 * <li>dates, date-times and times: ISO-8601 with trailing zero fractions removed; offset
 * date-times are converted to UTC</li>
 * <li>{@code byte[]}: lower-case hex</li>
 * <li>collections, arrays and maps: JSON with sorted keys</li>
 * </ul>
 *
 * <p>
 * Each component is hashed as its length followed by its tagged text, so adjacent values can never
 * run into each other.
 * </p>
 */
public final class RowFingerprinter {

    private static final String NULL_MARKER = "\u0000";

    /**
     * Prevents instantiation.
     */
    @Generated
    private RowFingerprinter() {}

    /**
     * Hashes the primary-key values of a row.
     *
     * @param row row values keyed by column name
     * @param primaryKeyColumns ordered primary-key columns
     * @return 256-bit fingerprint
     * @throws IllegalArgumentException if a primary-key column is missing from the row
     */
    public static HashCode fingerprint(Map<String, Object> row, List<String> primaryKeyColumns) {
        return hash(row, primaryKeyColumns);
    }

    /**
     * Hashes all mapped column values of a row. Two rows with equal content hashes carry the same
     * data in every mapped column.
     *
     * @param row row values keyed by column name
     * @param columns ordered columns
     * @return 256-bit content hash
     * @throws IllegalArgumentException if a column is missing from the row
     */
    public static HashCode contentHash(Map<String, Object> row, List<String> columns) {
        return hash(row, columns);
    }

    /**
     * Builds a fingerprint index over rows in a single pass.
     *
     * @param rows rows
     * @param primaryKeyColumns ordered primary-key columns
     * @return fingerprint to row map
     * @throws IllegalStateException if two rows share the same primary key
     */
    public static Map<HashCode, Map<String, Object>> index(Iterable<Map<String, Object>> rows,
            List<String> primaryKeyColumns) {
        Map<HashCode, Map<String, Object>> index = new HashMap<>();
        for (Map<String, Object> row : rows) {
            HashCode fp = fingerprint(row, primaryKeyColumns);
            if (index.put(fp, row) != null) {
                throw new IllegalStateException("Duplicate primary key " + primaryKeyColumns
                        + " in row " + row);
            }
        }
        return index;
    }

    /**
     * Returns the canonical text of a single value, prefixed with its type tag.
     *
     * @param value value (may be {@code null})
     * @return canonical text
     */
    public static String canonicalize(Object value) {
        if (value == null) {
            return "z" + NULL_MARKER;
        }
        if (value instanceof Boolean) {
            return "n" + (((Boolean) value) ? "1" : "0");
        }
        if (value instanceof Number) {
            BigDecimal decimal = toDecimal((Number) value);
            return decimal == null ? "f" + value : "n" + decimal.toPlainString();
        }
        if (value instanceof LocalDate) {
            return "d" + DateTimeFormatter.ISO_LOCAL_DATE.format((LocalDate) value);
        }
        if (value instanceof java.sql.Date) {
            return canonicalize(((java.sql.Date) value).toLocalDate());
        }
        if (value instanceof LocalDateTime) {
            return "t" + DateTimeFormatter.ISO_LOCAL_DATE_TIME.format((LocalDateTime) value);
        }
        if (value instanceof Timestamp) {
            return canonicalize(((Timestamp) value).toLocalDateTime());
        }
        if (value instanceof LocalTime) {
            return "h" + DateTimeFormatter.ISO_LOCAL_TIME.format((LocalTime) value);
        }
        if (value instanceof Time) {
            return canonicalize(((Time) value).toLocalTime());
        }
        if (value instanceof OffsetDateTime) {
            return canonicalize(((OffsetDateTime) value).toInstant());
        }
        if (value instanceof ZonedDateTime) {
            return canonicalize(((ZonedDateTime) value).toInstant());
        }
        if (value instanceof Instant) {
            return "i" + value;
        }
        if (value instanceof byte[]) {
            return "x" + Hex.encodeHexString((byte[]) value);
        }
        if (JsonSupport.isJsonLike(value)) {
            return "j" + JsonSupport.toJson(value);
        }
        return "s" + value;
    }

    private static HashCode hash(Map<String, Object> row, List<String> columns) {
        Hasher hasher = Hashing.sha256().newHasher();
        for (String column : columns) {
            if (!row.containsKey(column)) {
                throw new IllegalArgumentException(
                        "Column '" + column + "' is missing from row " + row.keySet());
            }
            String text = canonicalize(row.get(column));
            hasher.putInt(text.length());
            hasher.putString(text, StandardCharsets.UTF_8);
        }
        return hasher.hash();
    }

    /**
     * Converts a number to a normalized decimal.
     *
     * @param number number
     * @return normalized decimal, or {@code null} for NaN and infinities
     */
    private static BigDecimal toDecimal(Number number) {
        BigDecimal decimal;
        if (number instanceof BigDecimal) {
            decimal = (BigDecimal) number;
        } else if (number instanceof BigInteger) {
            decimal = new BigDecimal((BigInteger) number);
        } else if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            decimal = new BigDecimal(number.toString());
        } else {
            decimal = BigDecimal.valueOf(number.longValue());
        }
        decimal = decimal.stripTrailingZeros();
        return decimal.signum() == 0 ? BigDecimal.ZERO : decimal;
    }
}
