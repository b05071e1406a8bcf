package io.github.yok.cdflib.json;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Reasons a JSON request is rejected. The numeric codes are stable and may be sent back to
 * clients.
 */
@Getter
@RequiredArgsConstructor
public enum JsonErrorCode {

    /** The request cannot be understood, e.g. wrong method or content type. */
    INVALID_REQUEST(1),

    /** The body is not well-formed JSON. */
    PARSE_ERROR(2);

    private final int code;
}
