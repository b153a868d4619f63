package io.github.yok.doltsync.model;

/**
 * Phases of a single sync invocation.
 *
 * <pre>
 * INIT → RESOLVE_RANGE → EXTRACT → BATCH_APPLY (loop) → ADVANCE_CURSOR → DONE
 *                          └──────────┴──→ FAILED
 * </pre>
 *
 * <p>
 * {@link #CANCELLED} is reached when the job thread is interrupted between two batches.
 * </p>
 */
public enum SyncPhase {
    INIT, RESOLVE_RANGE, EXTRACT, BATCH_APPLY, ADVANCE_CURSOR, DONE, FAILED, CANCELLED
}
