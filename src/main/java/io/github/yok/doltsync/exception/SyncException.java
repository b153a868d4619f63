package io.github.yok.doltsync.exception;

import lombok.Getter;

/**
 * Base class of all failures raised by the sync engine.
 *
 * <p>
 * The orchestrator attaches the progress reached before the failure (rows applied during the
 * invocation and the commit the cursor points at) so callers can report it and re-run safely.
 * </p>
 */
@Getter
public abstract class SyncException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // Rows committed before the failure; -1 until attached by the orchestrator
    private long rowsApplied = -1;

    // Commit the cursor points at after the failure; null when no cursor exists
    private String cursorCommit;

    /**
     * Creates an exception.
     *
     * @param message detail message
     */
    protected SyncException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    protected SyncException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Records the progress reached before this failure.
     *
     * @param rowsApplied rows committed during the invocation
     * @param cursorCommit commit the cursor points at
     * @return this exception
     */
    public SyncException attachProgress(long rowsApplied, String cursorCommit) {
        this.rowsApplied = rowsApplied;
        this.cursorCommit = cursorCommit;
        return this;
    }

    /**
     * Returns whether re-invoking the sync may succeed without caller intervention.
     *
     * @return {@code true} when retryable
     */
    public abstract boolean isRetryable();
}
