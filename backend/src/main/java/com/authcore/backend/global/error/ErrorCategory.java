package com.authcore.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Outward error taxonomy. The {@code code} is what clients see in the {@code error} field.
 */
public enum ErrorCategory {

    INVALID_INPUT(HttpStatus.BAD_REQUEST, "invalid_input"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "unauthorized"),
    CONFLICT(HttpStatus.CONFLICT, "conflict"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "rate_limited"),
    UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "unavailable");

    private final HttpStatus status;
    private final String code;

    ErrorCategory(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return code;
    }
}
