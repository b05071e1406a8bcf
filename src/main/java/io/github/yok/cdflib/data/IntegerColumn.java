package io.github.yok.cdflib.data;

import io.github.yok.cdflib.db.SqlDataType;

/**
 * Integer column (INT, BIGINT). Holds {@link Long}; {@link Integer}, {@link Short} and
 * {@link Byte} are widened.
 */
public final class IntegerColumn extends DataColumn<Long> {

    /**
     * Creates an unconstrained column without a value.
     *
     * @param name column name
     */
    public IntegerColumn(String name) {
        this(name, null, null);
    }

    /**
     * Creates a column.
     *
     * @param name column name
     * @param defaultValue initial value or {@code null}
     * @param options constraints or {@code null}
     */
    public IntegerColumn(String name, Long defaultValue, ColumnOptions options) {
        super(SqlDataType.INTEGER, name, defaultValue, options);
    }

    @Override
    protected Long convert(Object raw) {
        if (raw instanceof Long) {
            return (Long) raw;
        }
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        throw mismatch(raw, "integer");
    }

    @Override
    public double numericValue() {
        Long v = getValue();
        return v == null ? 0.0 : v.doubleValue();
    }
}
