package io.github.yok.doltsync.state;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.yok.doltsync.db.DialectAdapter;
import io.github.yok.doltsync.exception.SyncConnectionException;
import io.github.yok.doltsync.model.Batch;
import io.github.yok.doltsync.model.ColumnType;
import io.github.yok.doltsync.model.CursorKey;
import io.github.yok.doltsync.model.SyncCursor;
import io.github.yok.doltsync.model.TableMapping;
import io.github.yok.doltsync.util.JdbcConnections;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link SyncStateStore} backed by a table on a JDBC connection.
 *
 * <p>
 * The table is keyed by {@code (table_name, target_id, direction)} and written with the upsert of
 * the connection's dialect, so concurrent jobs for different keys never block each other. The
 * store uses the connection it was given and never opens or closes connections.
 * </p>
 */
@Slf4j
public class JdbcSyncStateStore implements SyncStateStore {

    static final String TABLE_NAME = "table_name";
    static final String TARGET_ID = "target_id";
    static final String DIRECTION = "direction";
    static final String SOURCE_ID = "source_id";
    static final String LAST_COMMIT = "last_commit";
    static final String IN_FLIGHT_COMMIT = "in_flight_commit";
    static final String IN_FLIGHT_OFFSET = "in_flight_offset";
    static final String UPDATED_AT = "updated_at";

    private static final List<String> COLUMNS = ImmutableList.of(TABLE_NAME, TARGET_ID, DIRECTION,
            SOURCE_ID, LAST_COMMIT, IN_FLIGHT_COMMIT, IN_FLIGHT_OFFSET, UPDATED_AT);
    private static final List<String> KEY = ImmutableList.of(TABLE_NAME, TARGET_ID, DIRECTION);

    private final Connection connection;
    private final DialectAdapter adapter;
    private final TableMapping mapping;
    private final Clock clock;

    /**
     * Creates a store.
     *
     * @param connection connection holding the cursor table
     * @param adapter dialect of the connection
     * @param stateTable cursor table name
     * @param clock clock for {@code updated_at}
     */
    public JdbcSyncStateStore(Connection connection, DialectAdapter adapter, String stateTable,
            Clock clock) {
        this.connection = connection;
        this.adapter = adapter;
        this.clock = clock;
        Map<String, ColumnType> types = new LinkedHashMap<>();
        COLUMNS.forEach(c -> types.put(c, ColumnType.STRING));
        types.put(IN_FLIGHT_OFFSET, ColumnType.BIGINT);
        types.put(UPDATED_AT, ColumnType.TIMESTAMP);
        this.mapping = new TableMapping(stateTable, stateTable, COLUMNS, KEY, types);
    }

    @Override
    public void ensureTable() {
        try {
            if (adapter.createIfNotExists(connection, mapping,
                    new Batch(ImmutableList.of(), null, 0))) {
                log.info("Created cursor table {}", mapping.getTargetTable());
            }
            connection.commit();
        } catch (SQLException e) {
            JdbcConnections.rollbackQuietly(connection, mapping.getTargetTable());
            throw failure("creating cursor table", e);
        }
    }

    @Override
    public Optional<SyncCursor> get(CursorKey key) {
        String sql = "SELECT " + adapter.quotedList(COLUMNS) + " FROM "
                + adapter.quoteIdentifier(mapping.getTargetTable()) + " WHERE "
                + adapter.quoteIdentifier(TABLE_NAME) + " = ? AND "
                + adapter.quoteIdentifier(TARGET_ID) + " = ? AND "
                + adapter.quoteIdentifier(DIRECTION) + " = ?";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bindKey(ps, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                Timestamp updatedAt = rs.getTimestamp(column(UPDATED_AT));
                return Optional.of(SyncCursor.builder().key(key)
                        .sourceId(rs.getString(column(SOURCE_ID)))
                        .lastCommit(rs.getString(column(LAST_COMMIT)))
                        .inFlightCommit(rs.getString(column(IN_FLIGHT_COMMIT)))
                        .inFlightOffset(rs.getLong(column(IN_FLIGHT_OFFSET)))
                        .updatedAt(updatedAt == null ? null
                                : updatedAt.toLocalDateTime().toInstant(ZoneOffset.UTC))
                        .build());
            }
        } catch (SQLException e) {
            throw failure("reading cursor " + key, e);
        }
    }

    @Override
    public void advance(CursorKey key, String sourceId, String commit) {
        write(key, sourceId, commit, null, 0L);
        log.debug("[{}] Cursor advanced to {}", key, commit);
    }

    @Override
    public void markInFlight(CursorKey key, String sourceId, String lastCommit,
            String inFlightCommit, long offset) {
        write(key, sourceId, lastCommit, inFlightCommit, offset);
        log.debug("[{}] Cursor in flight: {} -> {} at offset {}", key, lastCommit, inFlightCommit,
                offset);
    }

    @Override
    public boolean reset(CursorKey key) {
        try (PreparedStatement ps = connection.prepareStatement(adapter.buildDeleteSql(mapping))) {
            bindKey(ps, key);
            int deleted = ps.executeUpdate();
            connection.commit();
            log.info("[{}] Cursor reset ({} row(s) deleted)", key, deleted);
            return deleted > 0;
        } catch (SQLException e) {
            JdbcConnections.rollbackQuietly(connection, key.toString());
            throw failure("resetting cursor " + key, e);
        }
    }

    /**
     * Returns the mapping that describes the cursor table.
     *
     * @return cursor table mapping
     */
    TableMapping getMapping() {
        return mapping;
    }

    private void write(CursorKey key, String sourceId, String lastCommit, String inFlightCommit,
            long offset) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(TABLE_NAME, key.getTableName());
        row.put(TARGET_ID, key.getTargetId());
        row.put(DIRECTION, key.getDirection().name());
        row.put(SOURCE_ID, sourceId);
        row.put(LAST_COMMIT, lastCommit);
        row.put(IN_FLIGHT_COMMIT, inFlightCommit);
        row.put(IN_FLIGHT_OFFSET, offset);
        row.put(UPDATED_AT, LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
        try (PreparedStatement ps = connection.prepareStatement(adapter.buildUpsertSql(mapping))) {
            for (int i = 0; i < COLUMNS.size(); i++) {
                adapter.bindValue(ps, i + 1, row.get(COLUMNS.get(i)));
            }
            ps.executeUpdate();
        } catch (SQLException e) {
            throw failure("writing cursor " + key, e);
        }
    }

    // 1-based position in the SELECT list
    private static int column(String name) {
        return COLUMNS.indexOf(name) + 1;
    }

    private void bindKey(PreparedStatement ps, CursorKey key) throws SQLException {
        Map<String, Object> keyRow = ImmutableMap.of(TABLE_NAME, key.getTableName(), TARGET_ID,
                key.getTargetId(), DIRECTION, key.getDirection().name());
        for (int i = 0; i < KEY.size(); i++) {
            adapter.bindValue(ps, i + 1, keyRow.get(KEY.get(i)));
        }
    }

    private static RuntimeException failure(String what, SQLException e) {
        if (SyncConnectionException.isConnectionFailure(e)) {
            return new SyncConnectionException("Connection lost while " + what, e);
        }
        return new IllegalStateException("Failed " + what + ": " + e.getMessage(), e);
    }
}
