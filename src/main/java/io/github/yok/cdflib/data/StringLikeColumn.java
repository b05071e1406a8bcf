package io.github.yok.cdflib.data;

import io.github.yok.cdflib.db.SqlDataType;

/**
 * Base of the character columns ({@link StringColumn}, {@link TextColumn}).
 */
public abstract class StringLikeColumn extends DataColumn<String> {

    /**
     * Initializes the column.
     *
     * @param dataType {@link SqlDataType#STRING} or {@link SqlDataType#TEXT}
     * @param name column name
     * @param defaultValue initial value or {@code null}
     * @param options constraints
     */
    protected StringLikeColumn(SqlDataType dataType, String name, String defaultValue,
            ColumnOptions options) {
        super(dataType, name, defaultValue, options);
    }

    @Override
    protected String convert(Object raw) {
        if (!(raw instanceof CharSequence)) {
            throw mismatch(raw, "string");
        }
        return raw.toString();
    }

    /**
     * Returns the number of characters (code points) held.
     */
    @Override
    public int valueLength() {
        String v = getValue();
        return v == null ? 0 : v.codePointCount(0, v.length());
    }
}
