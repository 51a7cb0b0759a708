package com.authcore.backend.global.error;

/**
 * Wire shape of every error body: {@code {"error": <category>, "message": <text>}}.
 */
public record ErrorResponse(String error, String message) {

    public static final String INTERNAL_ERROR = "internal_error";

    public static ErrorResponse of(ErrorCategory category, String message) {
        String safeMessage = (message != null && !message.isBlank()) ? message : category.status().getReasonPhrase();
        return new ErrorResponse(category.code(), safeMessage);
    }
}
