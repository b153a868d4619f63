package io.github.yok.doltsync.core;

import io.github.yok.doltsync.model.SyncDirection;
import lombok.Value;

/**
 * One (table, target, direction) unit of work for {@link SyncJobRunner}.
 */
@Value
public class SyncJob {
    String table;
    String targetId;
    SyncDirection direction;
    // null for HEAD
    String toRef;
    // null for the configured batch size
    Integer batchSize;

    @Override
    public String toString() {
        return table + "->" + targetId + "/" + direction;
    }
}
