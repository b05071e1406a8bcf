package io.github.yok.cdflib.db;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.cdflib.config.ConnectionSettings;
import io.github.yok.cdflib.core.DataHelper;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * MySQL implementation of {@link DataConnection} on top of JDBC.
 *
 * <p>
 * Statements are rendered client side by {@link SqlTemplate} and sent as plain text, exactly as
 * they appear in {@link SqlExecutionException#getSql()} when something fails. The connection is
 * opened lazily by the first statement and reopened whenever it has been closed.
 * </p>
 *
 * <p>
 * After connecting, the session time zone is set to UTC and the configured character set is
 * selected, matching the GMT normalization done by {@link SqlValueFormatter}.
 * </p>
 *
 * <p>
 * Not thread-safe: pending parameters and the open cursor belong to the instance.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MySqlClient implements DataConnection {

    private final ConnectionSettings settings;
    private final JdbcConnector connector;
    private final SqlValueFormatter formatter;
    private final SqlTemplate template;

    // Pending parameters, in binding order
    private final List<QueryParameter> params = new ArrayList<>();
    // Live connection; null while closed
    private Connection connection;
    // Statement and cursor left open by beginQuery/beginProcedure
    private Statement cursorStatement;
    private ResultSet cursor;
    // Rows returned or affected by the previous statement
    private int lastRowCount;

    /**
     * Creates a client that connects through {@link java.sql.DriverManager}.
     *
     * @param settings connection credentials
     * @throws IllegalArgumentException if the credentials are incomplete
     */
    public MySqlClient(ConnectionSettings settings) {
        this(settings, JdbcConnector.DRIVER_MANAGER);
    }

    /**
     * Creates a client with a custom connector.
     *
     * @param settings connection credentials
     * @param connector function opening raw JDBC connections
     * @throws IllegalArgumentException if the credentials are incomplete
     */
    public MySqlClient(ConnectionSettings settings, JdbcConnector connector) {
        if (settings == null) {
            throw new IllegalArgumentException("Missing SQL credentials");
        }
        settings.validate();
        this.settings = settings;
        this.connector = Preconditions.checkNotNull(connector, "connector must not be null");
        this.formatter = new SqlValueFormatter();
        this.template = new SqlTemplate(formatter);
    }

    @Override
    public void open() throws SqlExecutionException {
        close();
        Connection conn;
        try {
            conn = connector.connect(settings);
        } catch (SQLException e) {
            throw new SqlExecutionException(e.getMessage(), null, e.getErrorCode(), e);
        }
        try {
            prepareConnection(conn);
        } catch (SQLException e) {
            closeQuietly(conn);
            throw new SqlExecutionException(e.getMessage(), null, e.getErrorCode(), e);
        }
        connection = conn;
        log.debug("Connected. settings={}", settings);
    }

    /**
     * Sets the session time zone and character set.
     *
     * @param conn freshly opened connection
     * @throws SQLException if any statement fails
     */
    protected void prepareConnection(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("SET time_zone = '+00:00'");
            st.execute("SET NAMES " + settings.getCharset());
        }
    }

    @Override
    public void close() {
        closeCursor();
        closeConnection();
    }

    @Override
    public boolean hasConnection() {
        return connection != null;
    }

    @Override
    public void newQuery() {
        params.clear();
        lastRowCount = 0;
        closeCursor();
    }

    @Override
    public void addParameter(SqlDataType type, Object value) {
        if (type == null) {
            throw new IllegalArgumentException("MySqlClient: invalid data type");
        }
        params.add(new QueryParameter(type, coerce(type, value)));
    }

    @Override
    public List<QueryParameter> getParameters() {
        return ImmutableList.copyOf(params);
    }

    @Override
    public List<Map<String, Object>> query(String sql, boolean skipParameters)
            throws SqlExecutionException {
        return execute(skipParameters ? sql : renderPending(sql), false);
    }

    @Override
    public void beginQuery(String sql) throws SqlExecutionException {
        execute(renderPending(sql), true);
    }

    @Override
    public Optional<Map<String, Object>> nextRow() throws SqlExecutionException {
        if (cursor == null) {
            return Optional.empty();
        }
        try {
            if (cursor.next()) {
                lastRowCount++;
                return Optional.of(readRow(cursor));
            }
        } catch (SQLException e) {
            closeCursor();
            throw new SqlExecutionException(e.getMessage(), null, e.getErrorCode(), e);
        }
        closeCursor();
        return Optional.empty();
    }

    @Override
    public List<Map<String, Object>> procedure(String name) throws SqlExecutionException {
        return execute(renderPendingCall(name), false);
    }

    @Override
    public void beginProcedure(String name) throws SqlExecutionException {
        execute(renderPendingCall(name), true);
    }

    @Override
    public long lastId() throws SqlExecutionException {
        String sql = "select last_insert_id() as Id";
        try {
            if (connection == null || connection.isClosed()) {
                // a new session would only ever report 0
                throw new IllegalStateException(
                        "Cannot read last insert id as connection not open");
            }
            // own statement, so an open cursor and the row count survive
            try (Statement st = connection.createStatement();
                    ResultSet rs = st.executeQuery(sql)) {
                return rs.next() ? DataHelper.asInt(rs.getObject(1)) : 0L;
            }
        } catch (SQLException e) {
            throw new SqlExecutionException(e.getMessage(), sql, e.getErrorCode(), e);
        }
    }

    @Override
    public int getAffectedRowCount() {
        return lastRowCount;
    }

    @Override
    public String escapeVariable(String value) {
        if (!hasConnection()) {
            throw new IllegalStateException("Cannot escape input as connection not open");
        }
        return formatter.escape(value);
    }

    private Object coerce(SqlDataType type, Object value) {
        if (value == null) {
            return null;
        }
        switch (type) {
            case STRING:
                return DataHelper.asStringSafe(value, true);
            case TEXT:
                // markup is kept for text blocks
                return DataHelper.asStringSafe(value, false);
            case INTEGER:
                return DataHelper.asInt(value);
            case FLOAT:
                return DataHelper.asFloat(value);
            case TIMESTAMP:
                return DataHelper.asDateTime(value);
            case BOOL:
                return DataHelper.asBool(value);
            case DATA:
                return value instanceof byte[] ? value
                        : DataHelper.asString(value).getBytes(StandardCharsets.UTF_8);
            default:
                throw new IllegalArgumentException("MySqlClient: invalid data type " + type);
        }
    }

    private String renderPending(String sql) throws ParameterCountException {
        try {
            return template.render(sql, params);
        } finally {
            params.clear();
        }
    }

    private String renderPendingCall(String name) {
        try {
            return template.renderCall(name, params);
        } finally {
            params.clear();
        }
    }

    private List<Map<String, Object>> execute(String sql, boolean keepCursor)
            throws SqlExecutionException {
        closeCursor();
        ensureConnection(sql);
        log.debug("Executing SQL: {}", sql);

        Statement st = null;
        boolean cursorKept = false;
        try {
            st = connection.createStatement();
            if (!st.execute(sql)) {
                lastRowCount = Math.max(st.getUpdateCount(), 0);
                return Collections.emptyList();
            }
            ResultSet rs = st.getResultSet();
            if (keepCursor) {
                cursorStatement = st;
                cursor = rs;
                cursorKept = true;
                lastRowCount = 0;
                return Collections.emptyList();
            }
            List<Map<String, Object>> rows = new ArrayList<>();
            try (rs) {
                while (rs.next()) {
                    rows.add(readRow(rs));
                }
            }
            lastRowCount = rows.size();
            return rows;
        } catch (SQLException e) {
            throw new SqlExecutionException(e.getMessage(), sql, e.getErrorCode(), e);
        } finally {
            if (st != null && !cursorKept) {
                closeQuietly(st);
            }
        }
    }

    private void ensureConnection(String sql) throws SqlExecutionException {
        try {
            if (connection != null && !connection.isClosed()) {
                return;
            }
        } catch (SQLException e) {
            throw new SqlExecutionException(e.getMessage(), sql, e.getErrorCode(), e);
        }
        open();
    }

    private static Map<String, Object> readRow(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= md.getColumnCount(); i++) {
            row.put(md.getColumnLabel(i), rs.getObject(i));
        }
        return row;
    }

    private void closeCursor() {
        if (cursor != null) {
            closeQuietly(cursor);
            cursor = null;
        }
        if (cursorStatement != null) {
            closeQuietly(cursorStatement);
            cursorStatement = null;
        }
    }

    private void closeConnection() {
        if (connection != null) {
            closeQuietly(connection);
            connection = null;
            log.debug("Disconnected. settings={}", settings);
        }
    }

    private static void closeQuietly(AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Failed to release JDBC resource: {}", resource, e);
        }
    }
}
