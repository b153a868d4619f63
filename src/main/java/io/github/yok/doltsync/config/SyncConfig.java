package io.github.yok.doltsync.config;

import io.github.yok.doltsync.model.ColumnType;
import io.github.yok.doltsync.model.CommitWalk;
import io.github.yok.doltsync.model.OnConflictPolicy;
import io.github.yok.doltsync.model.TableMapping;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code sync} section of {@code application.yml}.
 *
 * <pre>
 * sync:
 *   batch-size: 100000
 *   on-conflict: UPDATE
 *   tables:
 *     - name: orders
 *       columns: [id, customer, amount, tags, shipped_on]
 *       primary-keys: [id]
 *       column-types:
 *         tags: array
 *         shipped_on: date
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "sync")
@Data
public class SyncConfig {

    /**
     * Maximum number of change records applied in one target transaction.
     */
    private int batchSize = 100_000;

    /**
     * Behavior when a written row already exists on the target.
     */
    private OnConflictPolicy onConflict = OnConflictPolicy.UPDATE;

    /**
     * Create missing target tables from the rows of the first batch.
     */
    private boolean createIfNotExists = true;

    /**
     * Number of statements sent per JDBC batch inside one transaction.
     */
    private int statementBatchSize = 100;

    /**
     * How the commit range is walked.
     */
    private CommitWalk commitWalk = CommitWalk.PER_COMMIT;

    /**
     * Name of the cursor table.
     */
    private String stateTable = "dolt_sync_cursor";

    /**
     * Number of jobs run concurrently.
     */
    private int parallelism = 1;

    private List<TableEntry> tables = new ArrayList<>();

    /**
     * Checks value ranges.
     *
     * @throws IllegalStateException naming the offending property
     */
    public void validate() {
        if (batchSize <= 0) {
            throw new IllegalStateException("sync.batch-size must be positive: " + batchSize);
        }
        if (statementBatchSize <= 0) {
            throw new IllegalStateException(
                    "sync.statement-batch-size must be positive: " + statementBatchSize);
        }
        if (parallelism <= 0) {
            throw new IllegalStateException("sync.parallelism must be positive: " + parallelism);
        }
        if (stateTable == null || !stateTable.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalStateException("sync.state-table is not a plain identifier: "
                    + stateTable);
        }
        for (int i = 0; i < tables.size(); i++) {
            try {
                tables.get(i).toMapping();
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("sync.tables[" + i + "]: " + e.getMessage(), e);
            }
        }
    }

    /**
     * Looks up a table entry by name.
     *
     * @param name source table name
     * @return entry, or empty when the table is not configured
     */
    public Optional<TableEntry> findTable(String name) {
        return tables.stream().filter(t -> t.getName().equals(name)).findFirst();
    }

    /**
     * One synchronized table.
     */
    @Data
    public static class TableEntry {
        // Table name on the Dolt side
        private String name;
        // Table name on the RDBMS side (defaults to name)
        private String targetTable;
        private List<String> columns = new ArrayList<>();
        private List<String> primaryKeys = new ArrayList<>();
        // column -> logical type (string, integer, date, array, json, ...)
        private Map<String, String> columnTypes = new LinkedHashMap<>();

        /**
         * Converts the entry into an immutable mapping.
         *
         * @return mapping
         * @throws IllegalArgumentException if the entry is inconsistent
         */
        public TableMapping toMapping() {
            Map<String, ColumnType> types = new LinkedHashMap<>();
            columnTypes.forEach((column, type) -> types.put(column, ColumnType.parse(type)));
            return new TableMapping(name, targetTable, columns, primaryKeys, types);
        }
    }
}
