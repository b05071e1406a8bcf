package io.github.yok.cdflib.config;

import java.util.Map;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials and session options of one MySQL connection.
 *
 * <p>
 * Bound from {@code cdf.mysql.*} properties when used inside a Spring Boot application:
 * </p>
 *
 * <pre>
 * cdf:
 *   mysql:
 *     hostname: localhost
 *     port: 3306
 *     username: app
 *     password: secret
 *     database: shop
 * </pre>
 *
 * <p>
 * Or built from a section of an {@code .ini} file with {@link #fromSection(Map)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "cdf.mysql")
@Data
public class ConnectionSettings {

    // Host name or address of the MySQL server
    private String hostname;
    // TCP port
    private int port = 3306;
    // Login user
    private String username;
    // Login password (may be empty)
    private String password;
    // Schema selected after connecting
    private String database;
    // Connection character set (SET NAMES)
    private String charset = "utf8mb4";
    // Connect timeout in milliseconds; 0 leaves the driver default
    private int connectTimeoutMillis;

    /**
     * Builds settings from an {@code .ini} section holding {@code hostname}, {@code username},
     * {@code password}, {@code database} and optionally {@code port} and {@code charset}.
     *
     * @param section key/value pairs of the section; {@code null} is treated as empty
     * @return settings (not yet validated)
     */
    public static ConnectionSettings fromSection(Map<String, String> section) {
        ConnectionSettings settings = new ConnectionSettings();
        if (section == null) {
            return settings;
        }
        settings.setHostname(section.get("hostname"));
        settings.setUsername(section.get("username"));
        settings.setPassword(section.get("password"));
        settings.setDatabase(section.get("database"));
        if (StringUtils.isNotBlank(section.get("port"))) {
            settings.setPort(Integer.parseInt(section.get("port").trim()));
        }
        if (StringUtils.isNotBlank(section.get("charset"))) {
            settings.setCharset(section.get("charset").trim());
        }
        return settings;
    }

    /**
     * Checks that the settings are usable to connect.
     *
     * @throws IllegalArgumentException if host, user or database is missing
     */
    public void validate() {
        if (StringUtils.isAnyBlank(hostname, username, database)) {
            throw new IllegalArgumentException("Missing SQL credentials");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid SQL port: " + port);
        }
    }

    /**
     * Returns the Connector/J URL for these settings.
     *
     * @return JDBC URL, e.g. {@code jdbc:mysql://localhost:3306/shop?connectTimeout=5000}
     */
    public String toJdbcUrl() {
        StringBuilder url = new StringBuilder("jdbc:mysql://").append(hostname).append(':')
                .append(port).append('/').append(database);
        if (connectTimeoutMillis > 0) {
            url.append("?connectTimeout=").append(connectTimeoutMillis);
        }
        return url.toString();
    }

    @Override
    public String toString() {
        // password is never rendered
        return String.format("ConnectionSettings(%s@%s:%d/%s)", username, hostname, port,
                database);
    }
}
