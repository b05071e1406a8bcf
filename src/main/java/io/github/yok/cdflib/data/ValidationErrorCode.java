package io.github.yok.cdflib.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Reasons a column can fail validation, each with the message shown when no custom message is
 * given.
 */
@Getter
@RequiredArgsConstructor
public enum ValidationErrorCode {

    UNDEFINED("Undefined validation error."),

    COLUMN_NOT_SPECIFIED("The specified column has not been defined."),

    VALUE_CANNOT_BE_NULL("Value must be set."),

    VALUE_IS_NOT_SET("Value has not been specified."),

    VALUE_OUT_OF_RANGE("Value is out of the allowed range."),

    VALUE_RANGE_TOO_HIGH("Value is out of the allowed range."),

    VALUE_RANGE_TOO_LOW("Value is out of the allowed range."),

    VALUE_LENGTH_TOO_SHORT("Value is too short."),

    VALUE_LENGTH_TOO_LONG("Value has too many characters."),

    CUSTOM_ERROR("Undefined validation error.");

    private final String defaultMessage;
}
