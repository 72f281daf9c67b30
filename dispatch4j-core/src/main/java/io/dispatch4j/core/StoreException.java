package io.dispatch4j.core;

/**
 * The persistence layer is unavailable or rejected an operation.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
