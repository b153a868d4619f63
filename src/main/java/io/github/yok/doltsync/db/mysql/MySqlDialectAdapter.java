package io.github.yok.doltsync.db.mysql;

import io.github.yok.doltsync.db.ColumnDefinition;
import io.github.yok.doltsync.db.DialectAdapter;
import io.github.yok.doltsync.db.DialectType;
import io.github.yok.doltsync.model.TableMapping;
import io.github.yok.doltsync.util.JsonSupport;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Dialect adapter for MySQL and for Dolt, which speaks the same wire protocol and SQL grammar.
 *
 * <ul>
 * <li>Upsert: {@code INSERT ... ON DUPLICATE KEY UPDATE `c` = VALUES(`c`)}</li>
 * <li>Insert-if-absent: {@code ON DUPLICATE KEY UPDATE `pk` = `pk`}, which unlike
 * {@code INSERT IGNORE} does not hide other errors</li>
 * <li>Arrays and JSON documents are stored as JSON text in {@code LONGTEXT}</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public class MySqlDialectAdapter implements DialectAdapter {

    // MySQL limits for DECIMAL(p, s)
    private static final int MAX_PRECISION = 65;
    private static final int MAX_SCALE = 30;

    private final int statementBatchSize;

    @Override
    public DialectType getType() {
        return DialectType.MYSQL;
    }

    /**
     * Quotes an identifier (table/column name) using backticks.
     *
     * @param identifier identifier to quote
     * @return quoted identifier
     */
    @Override
    public String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    @Override
    public String sqlType(ColumnDefinition column) {
        String type;
        switch (column.getType()) {
            case INTEGER:
                type = "INT";
                break;
            case BIGINT:
                type = "BIGINT";
                break;
            case DECIMAL:
                type = decimalType(column.getPrecision(), column.getScale());
                break;
            case DOUBLE:
                type = "DOUBLE";
                break;
            case BOOLEAN:
                type = "BOOLEAN";
                break;
            case DATE:
                type = "DATE";
                break;
            case TIMESTAMP:
                type = "DATETIME(6)";
                break;
            case TIME:
                type = "TIME(6)";
                break;
            case BINARY:
                type = column.isPrimaryKey() ? "VARBINARY(255)" : "LONGBLOB";
                break;
            case JSON:
            case ARRAY:
                type = "LONGTEXT";
                break;
            default:
                type = column.isPrimaryKey() ? "VARCHAR(255)" : "TEXT";
        }
        return column.isPrimaryKey() ? type + " NOT NULL" : type;
    }

    @Override
    public String buildUpsertSql(TableMapping mapping) {
        List<String> nonKey = mapping.nonKeyColumns();
        if (nonKey.isEmpty()) {
            return buildInsertIfAbsentSql(mapping);
        }
        return buildInsertSql(mapping) + " ON DUPLICATE KEY UPDATE " + nonKey.stream()
                .map(c -> quoteIdentifier(c) + " = VALUES(" + quoteIdentifier(c) + ")")
                .collect(Collectors.joining(", "));
    }

    @Override
    public String buildInsertIfAbsentSql(TableMapping mapping) {
        String pk = quoteIdentifier(mapping.getPrimaryKeyColumns().get(0));
        return buildInsertSql(mapping) + " ON DUPLICATE KEY UPDATE " + pk + " = " + pk;
    }

    @Override
    public Object coerceValue(Object value) {
        if (JsonSupport.isJsonLike(value)) {
            return JsonSupport.toJson(value);
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof UUID) {
            return value.toString();
        }
        return value;
    }

    private static String decimalType(int precision, int scale) {
        if (precision <= 0) {
            return "DECIMAL(38, 10)";
        }
        int s = Math.min(scale, MAX_SCALE);
        int p = Math.min(Math.max(precision, s + 1), MAX_PRECISION);
        return "DECIMAL(" + p + ", " + s + ")";
    }
}
