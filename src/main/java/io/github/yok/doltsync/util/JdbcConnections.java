package io.github.yok.doltsync.util;

import io.github.yok.doltsync.config.ConnectionConfig;
import io.github.yok.doltsync.exception.SyncConnectionException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;

/**
 * Opens JDBC connections for configured entries.
 *
 * <p>
 * When a driver class name is configured it is loaded explicitly via {@link Class#forName}; a
 * blank value relies on JDBC 4 auto-loading. Failures are reported as
 * {@link SyncConnectionException} and credentials never reach the log.
 * </p>
 */
@Slf4j
public final class JdbcConnections {

    // Embedded credentials in authority-style JDBC URLs
    private static final Pattern JDBC_AUTH_PATTERN =
            Pattern.compile("(jdbc:[^:]+://[^:/?#]+:)([^@/]+)(@.*)", Pattern.CASE_INSENSITIVE);
    // password=... query parameters
    private static final Pattern PASSWORD_QUERY_PATTERN =
            Pattern.compile("(?i)(password=)([^;&]+)");

    /**
     * Prevents instantiation.
     */
    @Generated
    private JdbcConnections() {}

    /**
     * Loads the driver (if configured) and opens a connection with auto-commit disabled.
     *
     * @param entry connection entry
     * @return open connection; the caller owns and closes it
     * @throws SyncConnectionException if the driver is missing or the database is unreachable
     */
    public static Connection open(ConnectionConfig.Entry entry) {
        try {
            loadIfConfigured(entry.getDriverClass());
            log.debug("[{}] Opening JDBC connection: {}", entry.getId(),
                    maskJdbcUrl(entry.getUrl()));
            Connection connection =
                    DriverManager.getConnection(entry.getUrl(), entry.getUser(), entry.getPassword());
            connection.setAutoCommit(false);
            return connection;
        } catch (ClassNotFoundException e) {
            throw new SyncConnectionException(
                    "JDBC driver not found for connection id=" + entry.getId() + ": "
                            + entry.getDriverClass(), e);
        } catch (SQLException e) {
            throw new SyncConnectionException("Failed to connect (id=" + entry.getId() + ", url="
                    + maskJdbcUrl(entry.getUrl()) + "): " + maskJdbcUrl(e.getMessage()), e);
        }
    }

    /**
     * Loads the JDBC driver class only when the class name is configured.
     *
     * @param driverClass fully qualified driver class name, or {@code null}/blank
     * @throws ClassNotFoundException when the class cannot be found
     */
    public static void loadIfConfigured(String driverClass) throws ClassNotFoundException {
        if (driverClass == null || driverClass.isBlank()) {
            return;
        }
        Class.forName(driverClass);
    }

    /**
     * Masks password-like fragments in a JDBC URL.
     *
     * @param url JDBC URL
     * @return masked URL, or {@code null} when input is {@code null}
     */
    public static String maskJdbcUrl(String url) {
        if (url == null) {
            return null;
        }
        String masked = url;
        Matcher authMatcher = JDBC_AUTH_PATTERN.matcher(masked);
        if (authMatcher.find()) {
            masked = authMatcher.replaceFirst("$1***$3");
        }
        return PASSWORD_QUERY_PATTERN.matcher(masked).replaceAll("$1***");
    }

    /**
     * Closes a connection, logging instead of throwing.
     *
     * @param connection connection (may be {@code null})
     * @param label label used in the log
     */
    public static void closeQuietly(Connection connection, String label) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("[{}] Failed to close connection: {}", label, e.getMessage(), e);
        }
    }

    /**
     * Rolls back the current transaction, logging instead of throwing.
     *
     * @param connection connection
     * @param label label used in the log
     */
    public static void rollbackQuietly(Connection connection, String label) {
        try {
            connection.rollback();
            log.warn("[{}] Transaction rolled back.", label);
        } catch (SQLException e) {
            log.warn("[{}] Rollback failed: {}", label, e.getMessage(), e);
        }
    }
}
