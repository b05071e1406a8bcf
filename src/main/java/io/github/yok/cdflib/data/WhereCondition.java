package io.github.yok.cdflib.data;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Equality test of one column; a {@code null} value tests {@code is NULL}.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(staticName = "eq")
public final class WhereCondition {

    private final String column;
    private final Object value;
}
