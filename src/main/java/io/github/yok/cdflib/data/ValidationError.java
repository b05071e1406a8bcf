package io.github.yok.cdflib.data;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * One failed check of {@link DataRowMapper#doValidation}.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public final class ValidationError {

    private final String columnKey;
    private final ValidationErrorCode code;
    // Replaces the code's default message when not blank
    private final String customMessage;

    /**
     * Creates an error reported with the code's default message.
     *
     * @param columnKey column name
     * @param code reason
     */
    public ValidationError(String columnKey, ValidationErrorCode code) {
        this(columnKey, code, null);
    }

    /**
     * Returns the message to show for this error.
     *
     * @return custom message if set, otherwise the code's default message
     */
    public String getErrorDescription() {
        return StringUtils.isNotBlank(customMessage) ? customMessage : code.getDefaultMessage();
    }
}
