package io.relay4j.core;

/**
 * The persistence layer is unavailable or failed mid-operation.
 */
public class StoreException extends RelayException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
