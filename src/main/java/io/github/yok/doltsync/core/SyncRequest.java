package io.github.yok.doltsync.core;

import io.github.yok.doltsync.model.CommitWalk;
import io.github.yok.doltsync.model.OnConflictPolicy;
import io.github.yok.doltsync.model.SyncDirection;
import io.github.yok.doltsync.model.TableMapping;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Parameters of one sync invocation for one table.
 */
@Value
@Builder(toBuilder = true)
public class SyncRequest {

    @NonNull
    TableMapping mapping;

    // Connection id of the RDBMS side
    @NonNull
    String targetId;

    @NonNull
    @Builder.Default
    SyncDirection direction = SyncDirection.FORWARD;

    // Ref the forward sync stops at; branch the reverse sync writes to
    @NonNull
    @Builder.Default
    String toRef = "HEAD";

    @Builder.Default
    int batchSize = 100_000;

    @NonNull
    @Builder.Default
    OnConflictPolicy onConflict = OnConflictPolicy.UPDATE;

    @Builder.Default
    boolean createIfNotExists = true;

    @NonNull
    @Builder.Default
    CommitWalk commitWalk = CommitWalk.PER_COMMIT;
}
