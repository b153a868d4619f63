package io.github.yok.doltsync.state;

import io.github.yok.doltsync.model.CursorKey;
import io.github.yok.doltsync.model.SyncCursor;
import java.util.Optional;

/**
 * Durable storage of sync cursors, one per (table, target, direction).
 *
 * <p>
 * {@link #advance} and {@link #markInFlight} write inside the caller's transaction and do not
 * commit, so that a cursor move commits or rolls back together with the batch it describes.
 * {@link #ensureTable} and {@link #reset} are administrative and commit on their own.
 * </p>
 */
public interface SyncStateStore {

    /**
     * Creates the cursor table when it does not exist.
     */
    void ensureTable();

    /**
     * Reads the cursor for a key.
     *
     * @param key cursor key
     * @return cursor, or empty before the first sync
     */
    Optional<SyncCursor> get(CursorKey key);

    /**
     * Moves the cursor to a fully synchronized commit and clears any in-flight step.
     *
     * @param key cursor key
     * @param sourceId identifier of the source system
     * @param commit synchronized commit
     */
    void advance(CursorKey key, String sourceId, String commit);

    /**
     * Records progress inside a commit step that spans several batches.
     *
     * @param key cursor key
     * @param sourceId identifier of the source system
     * @param lastCommit last fully synchronized commit ({@code null} during a full sync)
     * @param inFlightCommit to-commit of the partially applied step
     * @param offset records of the step applied so far
     */
    void markInFlight(CursorKey key, String sourceId, String lastCommit, String inFlightCommit,
            long offset);

    /**
     * Deletes the cursor so that the next sync starts with a full snapshot.
     *
     * @param key cursor key
     * @return {@code true} if a cursor existed
     */
    boolean reset(CursorKey key);
}
