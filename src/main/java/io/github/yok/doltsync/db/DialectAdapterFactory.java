package io.github.yok.doltsync.db;

import io.github.yok.doltsync.config.ConnectionConfig;
import io.github.yok.doltsync.config.SyncConfig;
import io.github.yok.doltsync.db.mysql.MySqlDialectAdapter;
import io.github.yok.doltsync.db.oracle.OracleDialectAdapter;
import io.github.yok.doltsync.db.postgresql.PostgresqlDialectAdapter;
import io.github.yok.doltsync.util.JdbcConnections;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates the {@link DialectAdapter} for a connection entry.
 *
 * <p>
 * The dialect is resolved from {@code connections[].driver-class} first and from the JDBC URL as a
 * fallback. Dolt connections resolve to MySQL.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DialectAdapterFactory {

    // Statement batch size passed to every adapter
    private final SyncConfig syncConfig;

    /**
     * Creates the adapter for a connection entry.
     *
     * @param entry connection entry
     * @return adapter
     * @throws IllegalStateException if the dialect cannot be determined
     */
    public DialectAdapter create(ConnectionConfig.Entry entry) {
        DialectType type = resolveType(entry);
        log.debug("[{}] Dialect resolved: {}", entry.getId(), type);
        return create(type);
    }

    /**
     * Creates the adapter for a dialect type.
     *
     * @param type dialect type
     * @return adapter
     */
    public DialectAdapter create(DialectType type) {
        int statementBatchSize = syncConfig.getStatementBatchSize();
        switch (type) {
            case ORACLE:
                return new OracleDialectAdapter(statementBatchSize);
            case POSTGRESQL:
                return new PostgresqlDialectAdapter(statementBatchSize);
            default:
                return new MySqlDialectAdapter(statementBatchSize);
        }
    }

    /**
     * Resolves the dialect for a connection entry.
     *
     * <p>
     * Resolution priority is {@code driver-class} first, then JDBC URL.
     * </p>
     *
     * @param entry connection entry
     * @return resolved dialect
     * @throws IllegalStateException if the dialect cannot be determined
     */
    DialectType resolveType(ConnectionConfig.Entry entry) {
        DialectType fromDriverClass = resolveFromDriverClass(entry.getDriverClass());
        if (fromDriverClass != null) {
            return fromDriverClass;
        }
        DialectType fromUrl = resolveFromJdbcUrl(entry.getUrl());
        if (fromUrl != null) {
            return fromUrl;
        }
        throw new IllegalStateException("Unsupported database dialect for connection id="
                + entry.getId() + " (driver-class=" + entry.getDriverClass() + ", url="
                + JdbcConnections.maskJdbcUrl(entry.getUrl()) + ")");
    }

    private DialectType resolveFromDriverClass(String driverClass) {
        String normalized = normalizeLower(driverClass);
        if (normalized == null) {
            return null;
        }
        if ("oracle.jdbc.oracledriver".equals(normalized)
                || "oracle.jdbc.driver.oracledriver".equals(normalized)) {
            return DialectType.ORACLE;
        }
        if ("org.postgresql.driver".equals(normalized)) {
            return DialectType.POSTGRESQL;
        }
        if ("com.mysql.cj.jdbc.driver".equals(normalized)
                || "com.mysql.jdbc.driver".equals(normalized)
                || "org.mariadb.jdbc.driver".equals(normalized)) {
            return DialectType.MYSQL;
        }
        return null;
    }

    private DialectType resolveFromJdbcUrl(String jdbcUrl) {
        String normalized = normalizeLower(jdbcUrl);
        if (normalized == null) {
            return null;
        }
        if (normalized.startsWith("jdbc:oracle:")) {
            return DialectType.ORACLE;
        }
        if (normalized.startsWith("jdbc:postgresql:")) {
            return DialectType.POSTGRESQL;
        }
        if (normalized.startsWith("jdbc:mysql:") || normalized.startsWith("jdbc:mariadb:")) {
            return DialectType.MYSQL;
        }
        return null;
    }

    private String normalizeLower(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
