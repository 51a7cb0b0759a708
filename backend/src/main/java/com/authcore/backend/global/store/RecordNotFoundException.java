package com.authcore.backend.global.store;

/**
 * An update or delete addressed a record that does not exist. Reads signal absence with
 * {@link java.util.Optional} instead.
 */
public class RecordNotFoundException extends StoreException {

    public RecordNotFoundException(String entity, Object key) {
        super(entity + " " + key + " not found", null);
    }
}
