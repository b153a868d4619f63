package io.github.yok.doltsync.core;

import io.github.yok.doltsync.config.ConnectionConfig;
import io.github.yok.doltsync.config.DoltConfig;
import io.github.yok.doltsync.config.SyncConfig;
import io.github.yok.doltsync.db.DialectAdapter;
import io.github.yok.doltsync.db.DialectAdapterFactory;
import io.github.yok.doltsync.db.DialectType;
import io.github.yok.doltsync.dolt.DoltSqlClient;
import io.github.yok.doltsync.model.CursorKey;
import io.github.yok.doltsync.model.SyncDirection;
import io.github.yok.doltsync.model.SyncResult;
import io.github.yok.doltsync.model.TableMapping;
import io.github.yok.doltsync.state.JdbcSyncStateStore;
import io.github.yok.doltsync.util.JdbcConnections;
import java.sql.Connection;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Entry point for synchronizing configured tables.
 *
 * <p>
 * Every call opens its own {@link SyncSession}, so calls for different tables or targets can run
 * concurrently.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncService {

    private final DoltConfig doltConfig;
    private final ConnectionConfig connectionConfig;
    private final SyncConfig syncConfig;
    private final DialectAdapterFactory adapterFactory;

    /**
     * Synchronizes one configured table with one target.
     *
     * @param table Dolt table name as configured in {@code sync.tables}
     * @param targetId connection id of the RDBMS side
     * @param direction sync direction
     * @param toRef ref the forward sync stops at or branch the reverse sync writes to
     *        ({@code null} for {@code HEAD})
     * @param batchSize batch size override ({@code null} for {@code sync.batch-size})
     * @return outcome
     * @throws IllegalStateException if the table or target is not configured
     * @throws io.github.yok.doltsync.exception.SyncException on sync failure
     */
    public SyncResult syncTable(String table, String targetId, SyncDirection direction,
            String toRef, Integer batchSize) {
        SyncRequest request = buildRequest(table, targetId, direction, toRef, batchSize);
        log.info("[{}] Sync requested (to={}, batchSize={}, onConflict={}, walk={})",
                new CursorKey(table, targetId, direction), request.getToRef(),
                request.getBatchSize(), request.getOnConflict(), request.getCommitWalk());
        try (SyncSession session = openSession(targetId)) {
            return new SyncOrchestrator(session, doltConfig.getId()).sync(request);
        }
    }

    /**
     * Deletes the cursor of a table so that the next sync starts over.
     *
     * @param table Dolt table name
     * @param targetId connection id of the RDBMS side
     * @param direction sync direction
     * @return {@code true} if a cursor existed
     */
    public boolean resetCursor(String table, String targetId, SyncDirection direction) {
        ConnectionConfig.Entry entry = connectionConfig.require(targetId);
        Connection connection = JdbcConnections.open(entry);
        try {
            JdbcSyncStateStore store = new JdbcSyncStateStore(connection,
                    adapterFactory.create(entry), syncConfig.getStateTable(), Clock.systemUTC());
            store.ensureTable();
            return store.reset(new CursorKey(table, targetId, direction));
        } finally {
            JdbcConnections.closeQuietly(connection, targetId);
        }
    }

    /**
     * Builds a request from configuration and overrides.
     *
     * @param table Dolt table name
     * @param targetId connection id of the RDBMS side
     * @param direction sync direction
     * @param toRef ref override (may be {@code null})
     * @param batchSize batch size override (may be {@code null})
     * @return request
     * @throws IllegalStateException if the table or target is not configured
     */
    SyncRequest buildRequest(String table, String targetId, SyncDirection direction,
            String toRef, Integer batchSize) {
        connectionConfig.require(targetId);
        TableMapping mapping = syncConfig.findTable(table)
                .orElseThrow(() -> new IllegalStateException(
                        "sync.tables: no entry with name=" + table))
                .toMapping();
        return SyncRequest.builder().mapping(mapping).targetId(targetId).direction(direction)
                .toRef(toRef == null || toRef.isBlank() ? "HEAD" : toRef)
                .batchSize(batchSize == null ? syncConfig.getBatchSize() : batchSize)
                .onConflict(syncConfig.getOnConflict())
                .createIfNotExists(syncConfig.isCreateIfNotExists())
                .commitWalk(syncConfig.getCommitWalk()).build();
    }

    /**
     * Opens the connections and collaborators of one job.
     *
     * @param targetId connection id of the RDBMS side
     * @return session; the caller closes it
     */
    SyncSession openSession(String targetId) {
        ConnectionConfig.Entry targetEntry = connectionConfig.require(targetId);
        Connection dolt = JdbcConnections.open(doltConfig.toEntry());
        Connection target = null;
        try {
            target = JdbcConnections.open(targetEntry);
            DialectAdapter targetAdapter = adapterFactory.create(targetEntry);
            return SyncSession.builder().targetId(targetId).doltConnection(dolt)
                    .targetConnection(target)
                    .versionControl(new DoltSqlClient(dolt, doltConfig.getAuthor(),
                            doltConfig.isStreamingResults()))
                    .doltAdapter(adapterFactory.create(DialectType.MYSQL))
                    .targetAdapter(targetAdapter)
                    .stateStore(new JdbcSyncStateStore(target, targetAdapter,
                            syncConfig.getStateTable(), Clock.systemUTC()))
                    .build();
        } catch (RuntimeException e) {
            JdbcConnections.closeQuietly(target, targetId);
            JdbcConnections.closeQuietly(dolt, "dolt");
            throw e;
        }
    }
}
