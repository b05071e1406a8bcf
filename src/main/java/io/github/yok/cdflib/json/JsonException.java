package io.github.yok.cdflib.json;

import lombok.Getter;

/**
 * Raised when a JSON request cannot be accepted.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class JsonException extends Exception {

    private static final long serialVersionUID = 1L;

    private final JsonErrorCode errorCode;

    public JsonException(String message, JsonErrorCode errorCode) {
        this(message, errorCode, null);
    }

    /**
     * Creates an exception with its cause.
     *
     * @param message failure description
     * @param errorCode reason category
     * @param cause underlying failure, may be {@code null}
     */
    public JsonException(String message, JsonErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
