package io.github.yok.doltsync.exception;

import java.sql.SQLException;

/**
 * The source or target database is unreachable. Retryable with backoff by the caller.
 */
public class SyncConnectionException extends SyncException {

    private static final long serialVersionUID = 1L;

    // SQLState class for connection exceptions
    private static final String CONNECTION_STATE_CLASS = "08";

    /**
     * Creates an exception.
     *
     * @param message detail message
     * @param cause driver error
     */
    public SyncConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns whether a driver error denotes a lost or refused connection.
     *
     * @param e driver error
     * @return {@code true} for SQLState class {@code 08}
     */
    public static boolean isConnectionFailure(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            String state = current.getSQLState();
            if (state != null && state.startsWith(CONNECTION_STATE_CLASS)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
