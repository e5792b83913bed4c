package io.relay4j.core;

/**
 * Base type of every error raised by the dispatch engine.
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
