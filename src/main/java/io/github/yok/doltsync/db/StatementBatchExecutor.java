package io.github.yok.doltsync.db;

import io.github.yok.doltsync.exception.ApplyException;
import io.github.yok.doltsync.exception.SyncConnectionException;
import io.github.yok.doltsync.model.Batch;
import io.github.yok.doltsync.model.ChangeRecord;
import io.github.yok.doltsync.model.OnConflictPolicy;
import io.github.yok.doltsync.model.TableMapping;
import java.sql.BatchUpdateException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends the records of a {@link Batch} as JDBC statement batches.
 *
 * <p>
 * Consecutive records that resolve to the same {@link WriteKind} share one prepared statement and
 * are flushed every {@code statementBatchSize} records, so the order of changes within the batch is
 * preserved. Nothing is committed here.
 * </p>
 */
@Slf4j
public class StatementBatchExecutor {

    private final DialectAdapter adapter;
    private final int statementBatchSize;

    /**
     * Creates an executor.
     *
     * @param adapter dialect adapter supplying SQL and binding
     * @param statementBatchSize statements per JDBC batch
     */
    public StatementBatchExecutor(DialectAdapter adapter, int statementBatchSize) {
        this.adapter = adapter;
        this.statementBatchSize = Math.max(1, statementBatchSize);
    }

    /**
     * Applies all records of the batch.
     *
     * @param connection connection with auto-commit disabled
     * @param batch batch
     * @param mapping table mapping
     * @param policy conflict policy
     * @return number of records applied
     * @throws ApplyException carrying the index of the failing record within the batch
     * @throws SyncConnectionException if the connection is lost
     */
    public long execute(Connection connection, Batch batch, TableMapping mapping,
            OnConflictPolicy policy) {
        Map<WriteKind, String> sqlCache = new EnumMap<>(WriteKind.class);
        int index = 0;
        while (index < batch.size()) {
            WriteKind kind = WriteKind.resolve(batch.get(index).getOperation(), policy,
                    batch.isSnapshot());
            int groupEnd = index + 1;
            while (groupEnd < batch.size()
                    && WriteKind.resolve(batch.get(groupEnd).getOperation(), policy,
                            batch.isSnapshot()) == kind) {
                groupEnd++;
            }
            String sql = sqlCache.computeIfAbsent(kind, k -> adapter.buildSql(k, mapping));
            executeGroup(connection, sql, kind, batch, mapping, index, groupEnd);
            index = groupEnd;
        }
        return batch.size();
    }

    private void executeGroup(Connection connection, String sql, WriteKind kind, Batch batch,
            TableMapping mapping, int start, int end) {
        log.debug("{} x{} on {}: {}", kind, end - start, mapping.getTargetTable(), sql);
        List<String> bindColumns =
                kind == WriteKind.DELETE ? mapping.getPrimaryKeyColumns() : mapping.getColumns();
        int chunkStart = start;
        int current = start;
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (; current < end; current++) {
                ChangeRecord record = batch.get(current);
                Map<String, Object> row =
                        kind == WriteKind.DELETE ? record.getOldRow() : record.getNewRow();
                for (int i = 0; i < bindColumns.size(); i++) {
                    adapter.bindValue(ps, i + 1, row.get(bindColumns.get(i)));
                }
                ps.addBatch();
                if (current + 1 - chunkStart == statementBatchSize) {
                    ps.executeBatch();
                    chunkStart = current + 1;
                }
            }
            if (chunkStart < end) {
                ps.executeBatch();
            }
        } catch (BatchUpdateException e) {
            int failed = Math.min(chunkStart + firstFailure(e.getUpdateCounts()), end - 1);
            throw failure(e, failed, batch);
        } catch (SQLException e) {
            throw failure(e, Math.min(current, end - 1), batch);
        }
    }

    private static int firstFailure(int[] updateCounts) {
        if (updateCounts == null) {
            return 0;
        }
        for (int i = 0; i < updateCounts.length; i++) {
            if (updateCounts[i] == Statement.EXECUTE_FAILED) {
                return i;
            }
        }
        return updateCounts.length;
    }

    private static RuntimeException failure(SQLException e, int index, Batch batch) {
        if (SyncConnectionException.isConnectionFailure(e)) {
            return new SyncConnectionException("Connection lost while applying batch", e);
        }
        ChangeRecord record = batch.get(index);
        return new ApplyException("Failed to apply record #" + index + " " + record + ": "
                + e.getMessage(), index, record, e);
    }
}
