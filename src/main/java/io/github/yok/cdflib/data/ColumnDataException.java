package io.github.yok.cdflib.data;

import lombok.Getter;

/**
 * Raised when a column value does not match the column's declared type, or when a column that
 * does not exist is read.
 */
@Getter
public class ColumnDataException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // Name of the offending column
    private final String columnKey;

    /**
     * Creates the exception.
     *
     * @param columnKey column name
     * @param message description
     */
    public ColumnDataException(String columnKey, String message) {
        super(String.format("%s [column=%s]", message, columnKey));
        this.columnKey = columnKey;
    }
}
