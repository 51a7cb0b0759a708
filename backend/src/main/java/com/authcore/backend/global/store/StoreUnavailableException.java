package com.authcore.backend.global.store;

public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String operation, Throwable cause) {
        super(operation + " failed", cause);
    }
}
