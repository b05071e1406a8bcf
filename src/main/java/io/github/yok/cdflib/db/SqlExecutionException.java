package io.github.yok.cdflib.db;

import java.sql.SQLException;
import lombok.Getter;

/**
 * Raised when the database, or the statement sent to it, fails.
 *
 * <p>
 * Carries the driver message, the vendor error code and the SQL text that was executed (or about
 * to be executed) so the failing statement can be diagnosed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class SqlExecutionException extends SQLException {

    private static final long serialVersionUID = 1L;

    // SQL text that failed; null when the failure is not tied to a statement (e.g. connect)
    private final String sql;

    /**
     * Creates an exception without a vendor code.
     *
     * @param message failure description
     * @param sql statement text, may be {@code null}
     */
    public SqlExecutionException(String message, String sql) {
        this(message, sql, -1, null);
    }

    /**
     * Creates an exception wrapping a driver failure.
     *
     * @param message failure description
     * @param sql statement text, may be {@code null}
     * @param errorCode vendor error code, {@code -1} if unknown
     * @param cause driver exception, may be {@code null}
     */
    public SqlExecutionException(String message, String sql, int errorCode, Throwable cause) {
        super(message, cause instanceof SQLException ? ((SQLException) cause).getSQLState() : null,
                errorCode, cause);
        this.sql = sql;
    }

    @Override
    public String toString() {
        return String.format("%s (%s)", super.toString(), sql == null ? "???" : sql);
    }
}
