package io.github.yok.cdflib.db;

import lombok.Getter;

/**
 * Raised when the placeholders of a statement and the pending parameters do not pair up.
 *
 * <p>
 * Substitution is all or nothing: when this is thrown, nothing has been sent to the database.
 * </p>
 */
@Getter
public class ParameterCountException extends SqlExecutionException {

    private static final long serialVersionUID = 1L;

    /**
     * Which side ran out first.
     */
    public enum Kind {
        /** More placeholders than pending parameters. */
        MISSING_PARAMETER,
        /** Pending parameters left after the last placeholder. */
        TOO_MANY_PARAMETERS
    }

    private final Kind kind;
    // Number of pending parameters
    private final int parameterCount;
    // Number of placeholders consumed before the failure was detected
    private final int placeholderCount;

    /**
     * Creates the exception.
     *
     * @param kind mismatch kind
     * @param parameterCount pending parameters
     * @param placeholderCount placeholders seen
     * @param sql statement template
     */
    public ParameterCountException(Kind kind, int parameterCount, int placeholderCount,
            String sql) {
        super(describe(kind, parameterCount, placeholderCount), sql);
        this.kind = kind;
        this.parameterCount = parameterCount;
        this.placeholderCount = placeholderCount;
    }

    private static String describe(Kind kind, int parameterCount, int placeholderCount) {
        if (kind == Kind.MISSING_PARAMETER) {
            return String.format("Not enough parameters passed to query (only %d supplied)",
                    parameterCount);
        }
        return String.format("Too many parameters passed to query (expecting %d, got %d)",
                placeholderCount, parameterCount);
    }
}
