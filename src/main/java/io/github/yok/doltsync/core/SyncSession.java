package io.github.yok.doltsync.core;

import io.github.yok.doltsync.db.DialectAdapter;
import io.github.yok.doltsync.dolt.VersionControl;
import io.github.yok.doltsync.state.SyncStateStore;
import io.github.yok.doltsync.util.JdbcConnections;
import java.sql.Connection;
import lombok.Builder;
import lombok.Getter;

/**
 * Resources of one sync job: the Dolt connection, the connection of the RDBMS side and the
 * collaborators bound to them.
 *
 * <p>
 * The session owns both connections and closes them in {@link #close()}. The cursor store is bound
 * to the RDBMS connection in both directions.
 * </p>
 */
@Getter
@Builder
public class SyncSession implements AutoCloseable {

    private final String targetId;
    private final Connection doltConnection;
    private final Connection targetConnection;
    private final VersionControl versionControl;
    // MySQL-compatible adapter used to write into Dolt
    private final DialectAdapter doltAdapter;
    private final DialectAdapter targetAdapter;
    private final SyncStateStore stateStore;

    @Override
    public void close() {
        JdbcConnections.closeQuietly(targetConnection, targetId);
        JdbcConnections.closeQuietly(doltConnection, "dolt");
    }
}
