package io.github.yok.cdflib.data;

import io.github.yok.cdflib.db.SqlDataType;

/**
 * Boolean column (BIT, TINYINT(1)).
 */
public final class BoolColumn extends DataColumn<Boolean> {

    /**
     * Creates an unconstrained column without a value.
     *
     * @param name column name
     */
    public BoolColumn(String name) {
        this(name, null, null);
    }

    /**
     * Creates a column.
     *
     * @param name column name
     * @param defaultValue initial value or {@code null}
     * @param options constraints or {@code null}
     */
    public BoolColumn(String name, Boolean defaultValue, ColumnOptions options) {
        super(SqlDataType.BOOL, name, defaultValue, options);
    }

    @Override
    protected Boolean convert(Object raw) {
        if (!(raw instanceof Boolean)) {
            throw mismatch(raw, "boolean");
        }
        return (Boolean) raw;
    }
}
