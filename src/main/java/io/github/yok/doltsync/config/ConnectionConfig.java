package io.github.yok.doltsync.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code connections} list of {@code application.yml}: the RDBMS systems that take part
 * in synchronization.
 *
 * <pre>
 * connections:
 *   - id: warehouse
 *     url: jdbc:postgresql://localhost:5432/warehouse
 *     user: sync
 *     password: secret
 *     driver-class: org.postgresql.Driver
 * </pre>
 */
@Component
@ConfigurationProperties
@Data
public class ConnectionConfig {

    /**
     * List of connection entries.
     */
    private List<Entry> connections = new ArrayList<>();

    /**
     * Looks up an entry by its logical ID.
     *
     * @param id connection ID
     * @return entry, or empty when no entry has this ID
     */
    public Optional<Entry> find(String id) {
        return connections.stream().filter(e -> e.getId().equals(id)).findFirst();
    }

    /**
     * Returns the entry with the given ID.
     *
     * @param id connection ID
     * @return entry
     * @throws IllegalStateException if the ID is not configured
     */
    public Entry require(String id) {
        return find(id).orElseThrow(
                () -> new IllegalStateException("connections: no entry with id=" + id));
    }

    /**
     * One JDBC connection setting.
     */
    @Data
    @ToString(exclude = "password")
    public static class Entry {
        // Logical ID of the connection, also stored as target_id / source_id in the cursor table
        private String id;
        // JDBC connection URL
        private String url;
        // Database user name
        private String user;
        // Database password
        private String password;
        // Fully qualified JDBC driver class name; blank relies on JDBC 4 auto-loading
        private String driverClass;
    }
}
