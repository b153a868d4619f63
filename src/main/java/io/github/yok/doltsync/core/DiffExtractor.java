package io.github.yok.doltsync.core;

import io.github.yok.doltsync.dolt.RowDiff;
import io.github.yok.doltsync.dolt.VersionControl;
import io.github.yok.doltsync.exception.SchemaMismatchException;
import io.github.yok.doltsync.model.ChangeRecord;
import io.github.yok.doltsync.model.TableMapping;
import io.github.yok.doltsync.util.CloseableIterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns version-control diffs and snapshots into {@link ChangeRecord}s for one table mapping.
 *
 * <p>
 * Rows are projected onto the mapped columns; values of other columns are dropped. Before a diff
 * is opened the columns of the table are checked at both commits: every mapped column must exist
 * wherever the table exists. A table that does not yet exist at the from-commit is accepted, since
 * all of its rows appear as additions.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class DiffExtractor {

    private final VersionControl versionControl;

    /**
     * Streams the row-level changes of a table between two commits.
     *
     * @param mapping table mapping
     * @param fromCommit from-commit hash
     * @param toCommit to-commit hash
     * @return lazy, single-pass change records in diff order
     * @throws SchemaMismatchException if a mapped column is missing at either commit
     * @throws io.github.yok.doltsync.exception.RefNotFoundException if a commit does not resolve
     */
    public CloseableIterator<ChangeRecord> diff(TableMapping mapping, String fromCommit,
            String toCommit) {
        checkColumns(mapping, fromCommit, false);
        checkColumns(mapping, toCommit, true);
        log.debug("Extracting diff of {} {}..{}", mapping.getSourceTable(), fromCommit, toCommit);
        CloseableIterator<RowDiff> rows =
                versionControl.diffRows(mapping.getSourceTable(), fromCommit, toCommit);
        return new MappingIterator<>(rows, diff -> toRecord(mapping, diff));
    }

    /**
     * Streams all rows of a table at a commit as INSERT records, ordered by primary key.
     *
     * @param mapping table mapping
     * @param commit commit hash
     * @return lazy, single-pass INSERT records
     * @throws SchemaMismatchException if the table or a mapped column is missing at the commit
     */
    public CloseableIterator<ChangeRecord> snapshot(TableMapping mapping, String commit) {
        checkColumns(mapping, commit, true);
        log.debug("Extracting snapshot of {} at {}", mapping.getSourceTable(), commit);
        CloseableIterator<Map<String, Object>> rows = versionControl
                .snapshotRows(mapping.getSourceTable(), commit, mapping.getPrimaryKeyColumns());
        return new MappingIterator<>(rows, row -> {
            Map<String, Object> projected = project(mapping, row);
            return ChangeRecord.insert(mapping.getSourceTable(),
                    RowFingerprinter.fingerprint(projected, mapping.getPrimaryKeyColumns()),
                    projected);
        });
    }

    /**
     * Verifies that the table carries every mapped column at a commit.
     *
     * @param mapping table mapping
     * @param commit commit hash
     * @param tableRequired whether a missing table is an error
     * @throws SchemaMismatchException on a missing table (when required) or column
     */
    void checkColumns(TableMapping mapping, String commit, boolean tableRequired) {
        Optional<List<String>> columns =
                versionControl.tableColumns(mapping.getSourceTable(), commit);
        if (columns.isEmpty()) {
            if (tableRequired) {
                throw new SchemaMismatchException(mapping.getSourceTable(),
                        new LinkedHashSet<>(mapping.getColumns()), "Table "
                                + mapping.getSourceTable() + " does not exist at commit " + commit);
            }
            return;
        }
        Set<String> missing = new LinkedHashSet<>(mapping.getColumns());
        missing.removeAll(columns.get());
        if (!missing.isEmpty()) {
            throw new SchemaMismatchException(mapping.getSourceTable(), missing,
                    "Mapped columns " + missing + " of " + mapping.getSourceTable()
                            + " are missing at commit " + commit);
        }
    }

    private static ChangeRecord toRecord(TableMapping mapping, RowDiff diff) {
        Map<String, Object> oldRow = diff.getFromRow() == null ? null : project(mapping,
                diff.getFromRow());
        Map<String, Object> newRow = diff.getToRow() == null ? null : project(mapping,
                diff.getToRow());
        Map<String, Object> keyRow = newRow != null ? newRow : oldRow;
        return ChangeRecord.of(mapping.getSourceTable(), diff.getOperation(),
                RowFingerprinter.fingerprint(keyRow, mapping.getPrimaryKeyColumns()), oldRow,
                newRow);
    }

    /**
     * Keeps only the mapped columns, in mapping order.
     *
     * @param mapping table mapping
     * @param row source row
     * @return projected row
     * @throws SchemaMismatchException if a mapped column is absent from the row
     */
    static Map<String, Object> project(TableMapping mapping, Map<String, Object> row) {
        Map<String, Object> projected = new LinkedHashMap<>();
        for (String column : mapping.getColumns()) {
            if (!row.containsKey(column)) {
                throw new SchemaMismatchException(mapping.getSourceTable(), Set.of(column),
                        "Column " + column + " is missing from extracted row of "
                                + mapping.getSourceTable());
            }
            projected.put(column, row.get(column));
        }
        return projected;
    }

    /**
     * Applies a conversion to each element of a closeable iterator.
     */
    static final class MappingIterator<S, T> implements CloseableIterator<T> {

        private final CloseableIterator<S> delegate;
        private final Function<S, T> converter;

        MappingIterator(CloseableIterator<S> delegate, Function<S, T> converter) {
            this.delegate = delegate;
            this.converter = converter;
        }

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public T next() {
            return converter.apply(delegate.next());
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
