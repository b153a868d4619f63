package io.github.yok.doltsync.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a successful (or cancelled) sync invocation.
 */
@Value
@Builder
public class SyncResult {

    CursorKey key;

    // Rows written to the target during this invocation
    long rowsApplied;

    // Batches committed during this invocation
    int batchesApplied;

    // Commit the invocation was asked to reach
    String finalCommit;

    // Commit the cursor points at after the invocation
    String cursorAdvancedTo;

    // DONE or CANCELLED
    SyncPhase phase;

    /**
     * Returns whether the invocation reached the requested commit.
     *
     * @return {@code true} if finished
     */
    public boolean isComplete() {
        return phase == SyncPhase.DONE;
    }
}
