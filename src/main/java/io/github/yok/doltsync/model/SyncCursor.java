package io.github.yok.doltsync.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Durable pointer to the last commit synchronized for a {@link CursorKey}.
 *
 * <p>
 * When a commit step spans several batches, {@code inFlightCommit} names the step's target commit
 * and {@code inFlightOffset} the number of its records already applied. Both are cleared when the
 * step completes and {@code lastCommit} moves to {@code inFlightCommit}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class SyncCursor {

    CursorKey key;

    // Identifier of the source system (Dolt database or connection id)
    String sourceId;

    // Last fully synchronized commit
    String lastCommit;

    // Commit of a partially applied step (null when none)
    String inFlightCommit;

    // Records of the in-flight step already applied
    long inFlightOffset;

    Instant updatedAt;

    /**
     * Returns whether a commit step was left partially applied.
     *
     * @return {@code true} if an in-flight commit is recorded
     */
    public boolean hasInFlightStep() {
        return inFlightCommit != null;
    }
}
