package io.github.yok.cdflib.data;

import io.github.yok.cdflib.core.DataHelper;
import io.github.yok.cdflib.db.SqlDataType;
import java.time.ZonedDateTime;

/**
 * Date/time column (DATETIME, TIMESTAMP).
 *
 * <p>
 * Unlike the other columns, any non-null input is accepted and coerced with
 * {@link DataHelper#asDateTime(Object)}, so the stored value is always in GMT. Input that cannot be
 * read as a date/time becomes the epoch.
 * </p>
 */
public final class TimestampColumn extends DataColumn<ZonedDateTime> {

    /**
     * Creates an unconstrained column without a value.
     *
     * @param name column name
     */
    public TimestampColumn(String name) {
        this(name, null, null);
    }

    /**
     * Creates a column.
     *
     * @param name column name
     * @param defaultValue initial value or {@code null}
     * @param options constraints or {@code null}
     */
    public TimestampColumn(String name, ZonedDateTime defaultValue, ColumnOptions options) {
        super(SqlDataType.TIMESTAMP, name, defaultValue, options);
    }

    @Override
    protected ZonedDateTime convert(Object raw) {
        return DataHelper.asDateTime(raw);
    }

    /**
     * Returns the held instant in Unix seconds.
     */
    @Override
    public double numericValue() {
        ZonedDateTime v = getValue();
        return v == null ? 0.0 : v.toEpochSecond();
    }
}
