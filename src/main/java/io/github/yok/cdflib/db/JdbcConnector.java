package io.github.yok.cdflib.db;

import io.github.yok.cdflib.config.ConnectionSettings;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens raw JDBC connections for {@link MySqlClient}.
 */
@FunctionalInterface
public interface JdbcConnector {

    /**
     * Connector backed by {@link DriverManager}.
     */
    JdbcConnector DRIVER_MANAGER = settings -> DriverManager.getConnection(settings.toJdbcUrl(),
            settings.getUsername(), settings.getPassword());

    /**
     * Opens a connection.
     *
     * @param settings validated connection settings
     * @return live connection
     * @throws SQLException if the server refuses or cannot be reached
     */
    Connection connect(ConnectionSettings settings) throws SQLException;
}
