package io.github.yok.doltsync.util;

import io.github.yok.doltsync.exception.SyncException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Logs a fatal error and echoes a concise message to {@code System.err}.
 *
 * <p>
 * Intended for the CLI, where a failed sync must report how far it got. For
 * {@link SyncException}s the message includes the rows applied and the commit the cursor stopped
 * at, and whether a re-run can resume.
 * </p>
 *
 * <p>
 * Does not terminate the JVM; the caller decides the exit code. In tests, the behavior can be
 * switched to throwing {@link IllegalStateException} for the current thread.
 * </p>
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Switch to "throw exception instead of reporting" for the current thread (useful for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the message and root cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     */
    public static void errorAndExit(String message, Throwable cause) {
        String detail = describe(cause);
        log.error("{} {}\n{}", message, detail, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + cause.getMessage()
                + (detail.isEmpty() ? "" : "\n" + detail));
    }

    /**
     * Logs the message at error level and prints it to {@code System.err}.
     *
     * @param message message to log
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }

    /**
     * Renders the progress carried by a sync failure.
     *
     * @param cause failure
     * @return progress description, or an empty string for other exceptions
     */
    static String describe(Throwable cause) {
        if (!(cause instanceof SyncException)) {
            return "";
        }
        SyncException e = (SyncException) cause;
        if (e.getRowsApplied() < 0) {
            return "(retryable=" + e.isRetryable() + ")";
        }
        return "(rowsApplied=" + e.getRowsApplied() + ", cursor=" + e.getCursorCommit()
                + ", retryable=" + e.isRetryable() + ")";
    }
}
