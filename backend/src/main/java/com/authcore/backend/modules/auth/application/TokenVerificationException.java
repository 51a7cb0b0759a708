package com.authcore.backend.modules.auth.application;

public class TokenVerificationException extends RuntimeException {

    public enum Reason {
        MALFORMED,
        EXPIRED,
        INVALID_SIGNATURE,
        UNSUPPORTED_ALGORITHM,
        WRONG_TYPE
    }

    private final Reason reason;

    public TokenVerificationException(Reason reason, String message) {
        this(reason, message, null);
    }

    public TokenVerificationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
