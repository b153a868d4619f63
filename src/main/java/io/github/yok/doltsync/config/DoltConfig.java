package io.github.yok.doltsync.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code dolt} section of {@code application.yml}.
 *
 * <p>
 * Dolt is reached through a running {@code dolt sql-server}, which speaks the MySQL wire protocol,
 * so the URL is a MySQL JDBC URL.
 * </p>
 */
@Component
@ConfigurationProperties(prefix = "dolt")
@Data
@ToString(exclude = "password")
public class DoltConfig {

    /**
     * Logical ID of the Dolt database, stored as {@code source_id} of forward cursors.
     */
    private String id = "dolt";

    /**
     * JDBC URL of the Dolt SQL server (e.g. {@code jdbc:mysql://localhost:3306/mydb}).
     */
    private String url;

    private String user = "root";

    private String password;

    private String driverClass = "com.mysql.cj.jdbc.Driver";

    /**
     * Author used for commits created by reverse sync, in {@code Name <email>} form.
     */
    private String author = "doltsync <doltsync@localhost>";

    /**
     * When {@code true}, diff and snapshot queries stream rows instead of buffering the whole
     * result set in the driver.
     */
    private boolean streamingResults = true;

    /**
     * Returns these settings as a connection entry.
     *
     * @return connection entry
     * @throws IllegalStateException if {@code dolt.url} is not set
     */
    public ConnectionConfig.Entry toEntry() {
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("dolt.url must be set");
        }
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setId(id);
        entry.setUrl(url);
        entry.setUser(user);
        entry.setPassword(password);
        entry.setDriverClass(driverClass);
        return entry;
    }
}
