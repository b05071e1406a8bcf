package io.github.yok.cdflib.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Operator joining several values given for the same column of a {@link WhereClause}.
 */
@Getter
@RequiredArgsConstructor
public enum WhereComparison {

    AND(" and ", "!AND"),

    OR(" or ", "!OR");

    // SQL text placed between the conditions of one group
    private final String separator;
    // Value selecting this operator under the control key of a map-style clause
    private final String controlValue;

    /**
     * Looks up the operator selected by a control value.
     *
     * @param controlValue {@code !AND} or {@code !OR}
     * @return operator
     * @throws IllegalArgumentException for any other value
     */
    public static WhereComparison fromControlValue(Object controlValue) {
        for (WhereComparison c : values()) {
            if (c.controlValue.equals(controlValue)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Invalid where comparison value: " + controlValue);
    }
}
