package io.github.yok.cdflib.db;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single, blocking connection to a data store with positional parameter binding.
 *
 * <p>
 * Parameters added with {@link #addParameter(SqlDataType, Object)} accumulate until the next
 * statement executes or {@link #newQuery()} is called. Each {@code ?} in a statement consumes one
 * parameter, left to right.
 * </p>
 *
 * <pre>
 * db.newQuery();
 * db.addParameter(SqlDataType.STRING, "foo");
 * db.addParameter(SqlDataType.INTEGER, 12345);
 * List&lt;Map&lt;String, Object&gt;&gt; rows =
 *         db.query("select * from Users where Username=? AND Type=?");
 * </pre>
 *
 * <p>
 * Implementations hold mutable session state and are not thread-safe.
 * </p>
 */
public interface DataConnection extends AutoCloseable {

    /**
     * Opens the connection. Reopens it if it is already open.
     *
     * @throws SqlExecutionException if the connection cannot be established
     */
    void open() throws SqlExecutionException;

    /**
     * Releases the connection and any open cursor. Safe to call when not connected.
     */
    @Override
    void close();

    /**
     * Returns {@code true} if a live connection is held.
     *
     * @return connection state
     */
    boolean hasConnection();

    /**
     * Clears pending parameters, the last row count and any open cursor.
     */
    void newQuery();

    /**
     * Coerces a value to the declared type and appends it to the pending parameters.
     *
     * @param type declared type
     * @param value raw value; {@code null} binds SQL {@code NULL}
     * @throws IllegalArgumentException if {@code type} is {@code null} or the value cannot be
     *         coerced
     */
    void addParameter(SqlDataType type, Object value);

    /**
     * Returns a snapshot of the pending parameters.
     *
     * @return pending parameters in binding order
     */
    List<QueryParameter> getParameters();

    /**
     * Executes a statement after placeholder substitution.
     *
     * @param sql statement template
     * @return all rows; empty for statements that return no rows
     * @throws SqlExecutionException if substitution or execution fails
     */
    default List<Map<String, Object>> query(String sql) throws SqlExecutionException {
        return query(sql, false);
    }

    /**
     * Executes a statement.
     *
     * @param sql statement template
     * @param skipParameters {@code true} to send {@code sql} verbatim
     * @return all rows; empty for statements that return no rows
     * @throws SqlExecutionException if substitution or execution fails
     */
    List<Map<String, Object>> query(String sql, boolean skipParameters)
            throws SqlExecutionException;

    /**
     * Executes a statement and keeps its cursor open for {@link #nextRow()}.
     *
     * @param sql statement template
     * @throws SqlExecutionException if substitution or execution fails
     */
    void beginQuery(String sql) throws SqlExecutionException;

    /**
     * Reads the next row of the cursor opened by {@link #beginQuery(String)} or
     * {@link #beginProcedure(String)}.
     *
     * @return next row, or empty when exhausted (the cursor is then released)
     * @throws SqlExecutionException if reading fails
     */
    Optional<Map<String, Object>> nextRow() throws SqlExecutionException;

    /**
     * Calls a stored procedure with the pending parameters as arguments.
     *
     * @param name procedure name
     * @return all rows of the first result
     * @throws SqlExecutionException if the call fails
     */
    List<Map<String, Object>> procedure(String name) throws SqlExecutionException;

    /**
     * Calls a stored procedure and keeps its cursor open for {@link #nextRow()}.
     *
     * @param name procedure name
     * @throws SqlExecutionException if the call fails
     */
    void beginProcedure(String name) throws SqlExecutionException;

    /**
     * Returns the last auto-increment value generated on this connection.
     *
     * @return last insert id
     * @throws SqlExecutionException if the lookup fails
     * @throws IllegalStateException if not connected
     */
    long lastId() throws SqlExecutionException;

    /**
     * Returns the rows returned or affected by the previous statement.
     *
     * @return row count
     */
    int getAffectedRowCount();

    /**
     * Escapes a string for hand-built SQL that does not use parameters.
     *
     * @param value raw string
     * @return escaped string, without quotes
     * @throws IllegalStateException if not connected
     */
    String escapeVariable(String value);
}
