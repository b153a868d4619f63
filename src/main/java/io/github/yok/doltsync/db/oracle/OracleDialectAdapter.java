package io.github.yok.doltsync.db.oracle;

import io.github.yok.doltsync.db.ColumnDefinition;
import io.github.yok.doltsync.db.DialectAdapter;
import io.github.yok.doltsync.db.DialectType;
import io.github.yok.doltsync.model.TableMapping;
import io.github.yok.doltsync.util.JsonSupport;
import java.io.StringReader;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Dialect adapter for Oracle Database.
 *
 * <p>
 * Oracle has no boolean, date-only or JSON column type that round-trips through JDBC unchanged,
 * so values are transcoded before binding:
 * </p>
 * <ul>
 * <li>{@link LocalDate} becomes a {@code DATE} at midnight</li>
 * <li>{@link Boolean} becomes {@code NUMBER(1)} ({@code 1} / {@code 0})</li>
 * <li>{@link LocalTime} becomes ISO text</li>
 * <li>arrays and JSON documents become JSON text in a {@code CLOB}</li>
 * </ul>
 *
 * <p>
 * Writes use {@code MERGE INTO ... USING (SELECT ? AS c ... FROM DUAL)}.
 * </p>
 */
@Getter
@RequiredArgsConstructor
public class OracleDialectAdapter implements DialectAdapter {

    // Longest string bound with setString; longer values are streamed
    private static final int MAX_INLINE_STRING = 4000;
    private static final int MAX_PRECISION = 38;

    private final int statementBatchSize;

    @Override
    public DialectType getType() {
        return DialectType.ORACLE;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String sqlType(ColumnDefinition column) {
        String type;
        switch (column.getType()) {
            case INTEGER:
                type = "NUMBER(10)";
                break;
            case BIGINT:
                type = "NUMBER(19)";
                break;
            case DECIMAL:
                type = column.getPrecision() > 0
                        ? "NUMBER(" + Math.min(Math.max(column.getPrecision(), column.getScale()),
                                MAX_PRECISION) + ", " + column.getScale() + ")"
                        : "NUMBER";
                break;
            case DOUBLE:
                type = "BINARY_DOUBLE";
                break;
            case BOOLEAN:
                type = "NUMBER(1)";
                break;
            case DATE:
                type = "DATE";
                break;
            case TIMESTAMP:
                type = "TIMESTAMP";
                break;
            case TIME:
                type = "VARCHAR2(32 CHAR)";
                break;
            case BINARY:
                type = column.isPrimaryKey() ? "RAW(2000)" : "BLOB";
                break;
            case JSON:
            case ARRAY:
                type = "CLOB";
                break;
            default:
                type = column.isPrimaryKey() ? "VARCHAR2(255 CHAR)" : "VARCHAR2(4000 CHAR)";
        }
        return column.isPrimaryKey() ? type + " NOT NULL" : type;
    }

    @Override
    public String buildUpsertSql(TableMapping mapping) {
        List<String> nonKey = mapping.nonKeyColumns();
        StringBuilder sql = new StringBuilder(mergeHead(mapping));
        if (!nonKey.isEmpty()) {
            sql.append(" WHEN MATCHED THEN UPDATE SET ").append(nonKey.stream()
                    .map(c -> "tgt." + quoteIdentifier(c) + " = src." + quoteIdentifier(c))
                    .collect(Collectors.joining(", ")));
        }
        return sql.append(mergeInsert(mapping)).toString();
    }

    @Override
    public String buildInsertIfAbsentSql(TableMapping mapping) {
        return mergeHead(mapping) + mergeInsert(mapping);
    }

    @Override
    public Object coerceValue(Object value) {
        if (JsonSupport.isJsonLike(value)) {
            return JsonSupport.toJson(value);
        }
        if (value instanceof LocalDate) {
            return Timestamp.valueOf(((LocalDate) value).atStartOfDay());
        }
        if (value instanceof java.sql.Date) {
            return Timestamp.valueOf(((java.sql.Date) value).toLocalDate().atStartOfDay());
        }
        if (value instanceof LocalDateTime) {
            return Timestamp.valueOf((LocalDateTime) value);
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        if (value instanceof LocalTime) {
            return DateTimeFormatter.ISO_LOCAL_TIME.format((LocalTime) value);
        }
        if (value instanceof Time) {
            return DateTimeFormatter.ISO_LOCAL_TIME.format(((Time) value).toLocalTime());
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof UUID) {
            return value.toString();
        }
        return value;
    }

    @Override
    public void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
        Object coerced = coerceValue(value);
        if (coerced == null) {
            ps.setNull(index, Types.VARCHAR);
        } else if (coerced instanceof String && ((String) coerced).length() > MAX_INLINE_STRING) {
            String text = (String) coerced;
            ps.setCharacterStream(index, new StringReader(text), text.length());
        } else if (coerced instanceof byte[]) {
            ps.setBytes(index, (byte[]) coerced);
        } else {
            ps.setObject(index, coerced);
        }
    }

    private String mergeHead(TableMapping mapping) {
        String select = mapping.getColumns().stream().map(c -> "? AS " + quoteIdentifier(c))
                .collect(Collectors.joining(", "));
        String on = mapping.getPrimaryKeyColumns().stream()
                .map(c -> "tgt." + quoteIdentifier(c) + " = src." + quoteIdentifier(c))
                .collect(Collectors.joining(" AND "));
        return "MERGE INTO " + quoteIdentifier(mapping.getTargetTable()) + " tgt USING (SELECT "
                + select + " FROM DUAL) src ON (" + on + ")";
    }

    private String mergeInsert(TableMapping mapping) {
        return " WHEN NOT MATCHED THEN INSERT (" + quotedList(mapping.getColumns())
                + ") VALUES (" + mapping.getColumns().stream()
                        .map(c -> "src." + quoteIdentifier(c)).collect(Collectors.joining(", "))
                + ")";
    }
}
