package com.authcore.backend.global.error;

import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private final ErrorCategory category;
    private final String detail;

    public ProblemException(ErrorCategory category, String detail) {
        this(category, detail, null);
    }

    public ProblemException(ErrorCategory category, String detail, Throwable cause) {
        super(category.status(), detail, cause);
        if (detail == null || detail.isBlank()) {
            throw new IllegalArgumentException("ProblemException detail must not be blank");
        }
        this.category = category;
        this.detail = detail;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getDetailMessage() {
        return detail;
    }
}
