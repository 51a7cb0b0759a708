package com.authcore.backend.global.store;

/**
 * Base type for failures reported by a store adapter. Callers never see the
 * driver-specific exception except as the cause.
 */
public abstract class StoreException extends RuntimeException {

    protected StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
