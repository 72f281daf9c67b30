package io.dispatch4j.core;

/**
 * A callback to the downstream receiver failed: non-200 status or transport error.
 */
public class CallbackException extends Exception {
    private final int statusCode;

    public CallbackException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public CallbackException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status returned by the receiver, or -1 when no response was received.
     */
    public int statusCode() {
        return statusCode;
    }
}
