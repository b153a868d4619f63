package io.github.yok.doltsync.db;

import io.github.yok.doltsync.model.TableMapping;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * SQL grammar of a target database.
 *
 * <p>
 * All write statements bind {@link TableMapping#getColumns()} in mapping order, except
 * {@code DELETE}, which binds the primary-key columns in key order.
 * </p>
 */
public interface DialectSqlOperations {

    /**
     * Quotes identifier in dialect style.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Returns the column type used when a table is created.
     *
     * @param column column definition
     * @return SQL type, including {@code NOT NULL} where needed
     */
    String sqlType(ColumnDefinition column);

    /**
     * Builds a plain {@code INSERT} into the target table.
     *
     * @param mapping table mapping
     * @return SQL
     */
    default String buildInsertSql(TableMapping mapping) {
        return "INSERT INTO " + quoteIdentifier(mapping.getTargetTable()) + " ("
                + quotedList(mapping.getColumns()) + ") VALUES ("
                + placeholders(mapping.getColumns().size()) + ")";
    }

    /**
     * Builds an insert that overwrites the non-key columns of an existing row.
     *
     * @param mapping table mapping
     * @return SQL
     */
    String buildUpsertSql(TableMapping mapping);

    /**
     * Builds an insert that leaves an existing row untouched.
     *
     * @param mapping table mapping
     * @return SQL
     */
    String buildInsertIfAbsentSql(TableMapping mapping);

    /**
     * Builds a {@code DELETE} by primary key.
     *
     * @param mapping table mapping
     * @return SQL
     */
    default String buildDeleteSql(TableMapping mapping) {
        return "DELETE FROM " + quoteIdentifier(mapping.getTargetTable()) + " WHERE "
                + mapping.getPrimaryKeyColumns().stream()
                        .map(c -> quoteIdentifier(c) + " = ?")
                        .collect(Collectors.joining(" AND "));
    }

    /**
     * Builds the statement for a write kind.
     *
     * @param kind write kind
     * @param mapping table mapping
     * @return SQL
     */
    default String buildSql(WriteKind kind, TableMapping mapping) {
        switch (kind) {
            case INSERT:
                return buildInsertSql(mapping);
            case UPSERT:
                return buildUpsertSql(mapping);
            case INSERT_IF_ABSENT:
                return buildInsertIfAbsentSql(mapping);
            default:
                return buildDeleteSql(mapping);
        }
    }

    /**
     * Joins quoted identifiers with commas.
     *
     * @param identifiers identifiers
     * @return comma-separated quoted identifiers
     */
    default String quotedList(List<String> identifiers) {
        return identifiers.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
    }

    /**
     * Returns {@code count} comma-separated placeholders.
     *
     * @param count number of placeholders
     * @return placeholders
     */
    static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
