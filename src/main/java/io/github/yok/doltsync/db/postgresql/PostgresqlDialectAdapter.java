package io.github.yok.doltsync.db.postgresql;

import io.github.yok.doltsync.db.ColumnDefinition;
import io.github.yok.doltsync.db.DialectAdapter;
import io.github.yok.doltsync.db.DialectType;
import io.github.yok.doltsync.model.TableMapping;
import io.github.yok.doltsync.util.JsonSupport;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Dialect adapter for PostgreSQL.
 *
 * <p>
 * Uses {@code INSERT ... ON CONFLICT (pk) DO UPDATE SET c = EXCLUDED.c} and {@code DO NOTHING}.
 * Arrays and JSON documents are written as {@code JSONB}: the JSON text is bound with
 * {@link Types#OTHER} so that the server casts it. {@link java.util.UUID} values are bound natively.
 * </p>
 */
@Getter
@RequiredArgsConstructor
public class PostgresqlDialectAdapter implements DialectAdapter {

    private final int statementBatchSize;

    @Override
    public DialectType getType() {
        return DialectType.POSTGRESQL;
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
                type = "INTEGER";
                break;
            case BIGINT:
                type = "BIGINT";
                break;
            case DECIMAL:
                type = "NUMERIC";
                break;
            case DOUBLE:
                type = "DOUBLE PRECISION";
                break;
            case BOOLEAN:
                type = "BOOLEAN";
                break;
            case DATE:
                type = "DATE";
                break;
            case TIMESTAMP:
                type = "TIMESTAMP";
                break;
            case TIME:
                type = "TIME";
                break;
            case BINARY:
                type = "BYTEA";
                break;
            case JSON:
            case ARRAY:
                type = "JSONB";
                break;
            default:
                type = "TEXT";
        }
        return column.isPrimaryKey() ? type + " NOT NULL" : type;
    }

    @Override
    public String buildUpsertSql(TableMapping mapping) {
        List<String> nonKey = mapping.nonKeyColumns();
        if (nonKey.isEmpty()) {
            return buildInsertIfAbsentSql(mapping);
        }
        return buildInsertSql(mapping) + " ON CONFLICT ("
                + quotedList(mapping.getPrimaryKeyColumns()) + ") DO UPDATE SET "
                + nonKey.stream().map(c -> quoteIdentifier(c) + " = EXCLUDED." + quoteIdentifier(c))
                        .collect(Collectors.joining(", "));
    }

    @Override
    public String buildInsertIfAbsentSql(TableMapping mapping) {
        return buildInsertSql(mapping) + " ON CONFLICT ("
                + quotedList(mapping.getPrimaryKeyColumns()) + ") DO NOTHING";
    }

    @Override
    public Object coerceValue(Object value) {
        if (JsonSupport.isJsonLike(value)) {
            return JsonSupport.toJson(value);
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        return value;
    }

    @Override
    public void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
        if (JsonSupport.isJsonLike(value)) {
            ps.setObject(index, JsonSupport.toJson(value), Types.OTHER);
            return;
        }
        DialectAdapter.super.bindValue(ps, index, value);
    }
}
