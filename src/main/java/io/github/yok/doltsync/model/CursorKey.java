package io.github.yok.doltsync.model;

import java.util.Locale;
import lombok.NonNull;
import lombok.Value;

/**
 * Identity of a sync cursor: one cursor exists per (table, target, direction).
 */
@Value
public class CursorKey {

    @NonNull
    String tableName;

    @NonNull
    String targetId;

    @NonNull
    SyncDirection direction;

    @Override
    public String toString() {
        return tableName + "->" + targetId + "/" + direction.name().toLowerCase(Locale.ROOT);
    }
}
