package io.github.yok.cdflib.data;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Validation constraints of a {@link DataColumn}.
 *
 * <p>
 * Length limits apply to string, text and binary columns; range limits apply to integer, float and
 * timestamp columns (timestamps compare by Unix seconds). A limit of {@code 0} is not checked, and
 * range checking is skipped entirely when both range limits are {@code 0}.
 * </p>
 *
 * <pre>
 * ColumnOptions.builder().required(true).maxLength(250).build();
 * </pre>
 */
@Getter
@Builder
@ToString
public final class ColumnOptions {

    /**
     * Options with no constraint at all.
     */
    public static final ColumnOptions NONE = ColumnOptions.builder().build();

    // Value may not be null
    private final boolean notNull;
    // Value must be set: non-empty string/text, timestamp after the epoch
    private final boolean required;
    private final int minLength;
    private final int maxLength;
    private final double minRange;
    private final double maxRange;
}
