package io.github.yok.doltsync.db;

import io.github.yok.doltsync.model.Batch;
import io.github.yok.doltsync.model.TableMapping;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Table existence checks and creation of missing target tables.
 */
public interface DialectSchemaOperations extends DialectSqlOperations {

    /**
     * Checks whether a table exists in the connection's current catalog and schema. The name is
     * tried as given, in upper case and in lower case.
     *
     * @param connection connection
     * @param table table name
     * @return {@code true} if the table exists
     * @throws SQLException on metadata failure
     */
    default boolean tableExists(Connection connection, String table) throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        Set<String> candidates = new LinkedHashSet<>(List.of(table,
                table.toUpperCase(Locale.ROOT), table.toLowerCase(Locale.ROOT)));
        for (String candidate : candidates) {
            try (ResultSet rs = meta.getTables(connection.getCatalog(), connection.getSchema(),
                    candidate, new String[] {"TABLE"})) {
                if (rs.next()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Creates the target table with column types inferred from the batch.
     *
     * @param connection connection
     * @param mapping table mapping
     * @param batch rows used for inference (may be empty)
     * @throws SQLException on DDL failure
     */
    default void createTable(Connection connection, TableMapping mapping, Batch batch)
            throws SQLException {
        String sql = buildCreateTableSql(mapping,
                TableSchemaInference.infer(mapping, batch.getRecords()));
        try (Statement st = connection.createStatement()) {
            st.execute(sql);
        }
    }

    /**
     * Creates the target table when it does not exist.
     *
     * @param connection connection
     * @param mapping table mapping
     * @param batch rows used for inference (may be empty)
     * @return {@code true} if the table was created
     * @throws SQLException on metadata or DDL failure
     */
    default boolean createIfNotExists(Connection connection, TableMapping mapping, Batch batch)
            throws SQLException {
        if (tableExists(connection, mapping.getTargetTable())) {
            return false;
        }
        createTable(connection, mapping, batch);
        return true;
    }

    /**
     * Builds {@code CREATE TABLE} for the given column definitions.
     *
     * @param mapping table mapping
     * @param columns column definitions in mapping order
     * @return SQL
     */
    default String buildCreateTableSql(TableMapping mapping, List<ColumnDefinition> columns) {
        String body = columns.stream().map(c -> quoteIdentifier(c.getName()) + " " + sqlType(c))
                .collect(Collectors.joining(", "));
        return "CREATE TABLE " + quoteIdentifier(mapping.getTargetTable()) + " (" + body
                + ", PRIMARY KEY (" + quotedList(mapping.getPrimaryKeyColumns()) + "))";
    }
}
