package io.github.yok.cdflib.db;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * One pending parameter: a declared type and its already coerced value.
 */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode
@ToString
public final class QueryParameter {

    private final SqlDataType type;
    // Coerced value; null is bound as SQL NULL
    private final Object value;
}
