package com.openapi.mockserver.store;

/**
 * Runtime exception thrown when a {@link DataStore} cannot read or write its data.
 */
public class DataStoreException extends RuntimeException {

    public DataStoreException(String message) {
        super(message);
    }

    public DataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
