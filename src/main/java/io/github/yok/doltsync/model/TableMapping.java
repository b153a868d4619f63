package io.github.yok.doltsync.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable description of how one table is mirrored between source and target.
 *
 * <p>
 * Column names are identical on both sides. The primary-key columns are a non-empty subset of the
 * columns and keep the order in which they are hashed and bound. Declared column types are optional;
 * when present they take precedence over inference and enable decoding of transcoded values.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TableMapping {

    private final String sourceTable;
    private final String targetTable;
    private final List<String> columns;
    private final List<String> primaryKeyColumns;
    private final Map<String, ColumnType> columnTypes;

    /**
     * Creates a mapping.
     *
     * @param sourceTable table read from the source system
     * @param targetTable table written on the target system
     * @param columns ordered column names
     * @param primaryKeyColumns ordered primary-key columns (subset of {@code columns})
     * @param columnTypes declared logical types (may be empty)
     * @throws IllegalArgumentException if the primary key is empty or not a subset of the columns
     */
    public TableMapping(String sourceTable, String targetTable, List<String> columns,
            List<String> primaryKeyColumns, Map<String, ColumnType> columnTypes) {
        Preconditions.checkArgument(sourceTable != null && !sourceTable.isBlank(),
                "source table must not be blank");
        Preconditions.checkArgument(columns != null && !columns.isEmpty(),
                "columns must not be empty (table=%s)", sourceTable);
        Preconditions.checkArgument(primaryKeyColumns != null && !primaryKeyColumns.isEmpty(),
                "primary-key columns must not be empty (table=%s)", sourceTable);
        Set<String> unique = new HashSet<>(columns);
        Preconditions.checkArgument(unique.size() == columns.size(),
                "duplicate column names (table=%s): %s", sourceTable, columns);
        Preconditions.checkArgument(unique.containsAll(primaryKeyColumns),
                "primary-key columns %s are not a subset of %s (table=%s)", primaryKeyColumns,
                columns, sourceTable);
        if (columnTypes != null) {
            Preconditions.checkArgument(unique.containsAll(columnTypes.keySet()),
                    "column-types %s reference unknown columns (table=%s)",
                    columnTypes.keySet(), sourceTable);
        }
        this.sourceTable = sourceTable;
        this.targetTable =
                targetTable == null || targetTable.isBlank() ? sourceTable : targetTable;
        this.columns = ImmutableList.copyOf(columns);
        this.primaryKeyColumns = ImmutableList.copyOf(primaryKeyColumns);
        this.columnTypes = columnTypes == null ? ImmutableMap.of()
                : ImmutableMap.copyOf(columnTypes);
    }

    /**
     * Creates a mapping whose target table has the same name as the source table.
     *
     * @param table table name
     * @param columns ordered column names
     * @param primaryKeyColumns ordered primary-key columns
     * @return mapping
     */
    public static TableMapping of(String table, List<String> columns,
            List<String> primaryKeyColumns) {
        return new TableMapping(table, table, columns, primaryKeyColumns, ImmutableMap.of());
    }

    /**
     * Returns the mapping with source and target tables swapped, as used by reverse sync.
     *
     * @return reversed mapping
     */
    public TableMapping reversed() {
        return new TableMapping(targetTable, sourceTable, columns, primaryKeyColumns,
                columnTypes);
    }

    /**
     * Returns the columns that are not part of the primary key.
     *
     * @return non-key columns in mapping order
     */
    public List<String> nonKeyColumns() {
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (String column : columns) {
            if (!primaryKeyColumns.contains(column)) {
                builder.add(column);
            }
        }
        return builder.build();
    }

    /**
     * Returns the declared type of a column.
     *
     * @param column column name
     * @return declared type, or {@code null} when the column has none
     */
    public ColumnType declaredType(String column) {
        return columnTypes.get(column);
    }
}
