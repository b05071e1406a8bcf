package io.github.yok.cdflib.data;

import io.github.yok.cdflib.db.SqlDataType;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * One typed column of a {@link DataRowMapper}: name, declared type, current value and validation
 * constraints.
 *
 * <p>
 * {@link #setValue(Object)} enforces the declared type; a value of the wrong Java type raises
 * {@link ColumnDataException}. Subclasses define which Java types are accepted.
 * </p>
 *
 * @param <T> Java type of the value
 * @author Yasuharu.Okawauchi
 */
@Getter
public abstract class DataColumn<T> {

    /**
     * Name of the identity (auto-increment primary key) column, compared case-insensitively.
     */
    public static final String IDENTITY_COLUMN = "Id";

    private final SqlDataType dataType;
    private final String name;
    private final ColumnOptions options;
    private T value;

    /**
     * Initializes the column.
     *
     * @param dataType declared type
     * @param name column name as used in SQL
     * @param defaultValue initial value or {@code null}
     * @param options constraints; {@code null} for none
     * @throws IllegalArgumentException if the type or name is missing
     */
    protected DataColumn(SqlDataType dataType, String name, T defaultValue,
            ColumnOptions options) {
        if (dataType == null || StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("Column needs a data type and a name");
        }
        this.dataType = dataType;
        this.name = name;
        this.options = options == null ? ColumnOptions.NONE : options;
        if (defaultValue != null) {
            setValue(defaultValue);
        }
    }

    /**
     * Replaces the value.
     *
     * @param newValue new value, may be {@code null}
     * @throws ColumnDataException if the value is not of an accepted type
     */
    public final void setValue(Object newValue) {
        this.value = newValue == null ? nullValue() : convert(newValue);
    }

    /**
     * Converts a non-null value to the column type.
     *
     * @param raw value to store
     * @return value to store
     * @throws ColumnDataException if {@code raw} is not of an accepted type
     */
    protected abstract T convert(Object raw);

    /**
     * Returns what {@code null} is stored as.
     *
     * @return stored value for {@code null}
     */
    protected T nullValue() {
        return null;
    }

    /**
     * Returns the length of the held value, as checked by the length constraints.
     *
     * @return length, {@code 0} for {@code null} or non-length types
     */
    public int valueLength() {
        return 0;
    }

    /**
     * Returns the held value as a number, as checked by the range constraints.
     *
     * @return numeric value, {@code 0} for {@code null} or non-numeric types
     */
    public double numericValue() {
        return 0.0;
    }

    /**
     * Returns {@code true} if this is the identity column.
     *
     * @return {@code true} if the name is {@code Id} in any case
     */
    public boolean isIdentity() {
        return IDENTITY_COLUMN.equalsIgnoreCase(name);
    }

    /**
     * Builds the exception for a value of the wrong type.
     *
     * @param raw rejected value
     * @param expected expected type description
     * @return exception to throw
     */
    protected ColumnDataException mismatch(Object raw, String expected) {
        return new ColumnDataException(name, String.format("Column is not %s (got %s)", expected,
                raw.getClass().getSimpleName()));
    }

    @Override
    public String toString() {
        return String.format("%s(%s %s)", getClass().getSimpleName(), name, dataType);
    }
}
