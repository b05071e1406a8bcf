package io.github.yok.cdflib.data;

import io.github.yok.cdflib.db.SqlDataType;

/**
 * Binary column (BLOB, VARBINARY). Holds {@code byte[]}.
 */
public final class BinaryColumn extends DataColumn<byte[]> {

    /**
     * Creates an unconstrained column without a value.
     *
     * @param name column name
     */
    public BinaryColumn(String name) {
        this(name, null, null);
    }

    /**
     * Creates a column.
     *
     * @param name column name
     * @param defaultValue initial value or {@code null}
     * @param options constraints or {@code null}
     */
    public BinaryColumn(String name, byte[] defaultValue, ColumnOptions options) {
        super(SqlDataType.DATA, name, defaultValue, options);
    }

    @Override
    protected byte[] convert(Object raw) {
        if (!(raw instanceof byte[])) {
            throw mismatch(raw, "binary");
        }
        return (byte[]) raw;
    }

    /**
     * Returns the number of bytes held.
     */
    @Override
    public int valueLength() {
        byte[] v = getValue();
        return v == null ? 0 : v.length;
    }
}
