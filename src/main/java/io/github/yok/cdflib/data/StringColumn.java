package io.github.yok.cdflib.data;

import io.github.yok.cdflib.db.SqlDataType;

/**
 * Fixed size string column (VARCHAR, CHAR).
 */
public final class StringColumn extends StringLikeColumn {

    /**
     * Creates an unconstrained column without a value.
     *
     * @param name column name
     */
    public StringColumn(String name) {
        this(name, null, null);
    }

    /**
     * Creates a column.
     *
     * @param name column name
     * @param defaultValue initial value or {@code null}
     * @param options constraints or {@code null}
     */
    public StringColumn(String name, String defaultValue, ColumnOptions options) {
        super(SqlDataType.STRING, name, defaultValue, options);
    }
}
