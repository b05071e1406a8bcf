package io.github.yok.cdflib.data;

import io.github.yok.cdflib.db.SqlDataType;

/**
 * Large text column (TEXT). Markup is kept.
 */
public final class TextColumn extends StringLikeColumn {

    /**
     * Creates an unconstrained column without a value.
     *
     * @param name column name
     */
    public TextColumn(String name) {
        this(name, null, null);
    }

    /**
     * Creates a column.
     *
     * @param name column name
     * @param defaultValue initial value or {@code null}
     * @param options constraints or {@code null}
     */
    public TextColumn(String name, String defaultValue, ColumnOptions options) {
        super(SqlDataType.TEXT, name, defaultValue, options);
    }
}
