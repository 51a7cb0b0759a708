package com.authcore.backend.global.store;

/**
 * A write was rejected by a uniqueness constraint.
 */
public class DuplicateRecordException extends StoreException {

    private final String field;

    public DuplicateRecordException(String entity, String field, Throwable cause) {
        super(entity + " with this " + field + " already exists", cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
