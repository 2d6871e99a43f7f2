package com.attribute.resolution.store;

/**
 * Runtime exception raised when the data store cannot be queried,
 * e.g. lost connectivity or a missing table.
 */
public class DataStoreException extends RuntimeException {

    public DataStoreException(String message) {
        super(message);
    }

    public DataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
