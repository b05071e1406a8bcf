package io.github.yok.cdflib.db;

/**
 * Data types known to the query layer.
 *
 * <p>
 * Every bound parameter and every {@link io.github.yok.cdflib.data.DataColumn} carries exactly one
 * of these for its whole lifetime. The type drives both the coercion of incoming values and the SQL
 * literal produced by {@link SqlValueFormatter}.
 * </p>
 */
public enum SqlDataType {

    /** Fixed size string (VARCHAR, CHAR). */
    STRING,
    /** Integer (INT, BIGINT). */
    INTEGER,
    /** Floating point number (FLOAT, DOUBLE). */
    FLOAT,
    /** Large amount of text (TEXT). Markup is preserved. */
    TEXT,
    /** Date and time, stored in GMT (DATETIME, TIMESTAMP). */
    TIMESTAMP,
    /** Boolean or bit (BIT, TINYINT(1)). */
    BOOL,
    /** Binary data (BLOB, VARBINARY). */
    DATA;

    /**
     * Returns {@code true} for the types whose values are measured by length.
     *
     * @return {@code true} for {@link #STRING}, {@link #TEXT} and {@link #DATA}
     */
    public boolean isStringLike() {
        return this == STRING || this == TEXT || this == DATA;
    }

    /**
     * Returns {@code true} for the numeric types.
     *
     * @return {@code true} for {@link #INTEGER} and {@link #FLOAT}
     */
    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }
}
