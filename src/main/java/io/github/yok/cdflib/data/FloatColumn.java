package io.github.yok.cdflib.data;

import io.github.yok.cdflib.db.SqlDataType;

/**
 * Floating point column (FLOAT, DOUBLE). Holds {@link Double}; {@link Float} is widened.
 */
public final class FloatColumn extends DataColumn<Double> {

    /**
     * Creates an unconstrained column without a value.
     *
     * @param name column name
     */
    public FloatColumn(String name) {
        this(name, null, null);
    }

    /**
     * Creates a column.
     *
     * @param name column name
     * @param defaultValue initial value or {@code null}
     * @param options constraints or {@code null}
     */
    public FloatColumn(String name, Double defaultValue, ColumnOptions options) {
        super(SqlDataType.FLOAT, name, defaultValue, options);
    }

    @Override
    protected Double convert(Object raw) {
        if (raw instanceof Double) {
            return (Double) raw;
        }
        if (raw instanceof Float) {
            return ((Float) raw).doubleValue();
        }
        throw mismatch(raw, "float");
    }

    @Override
    public double numericValue() {
        Double v = getValue();
        return v == null ? 0.0 : v;
    }
}
