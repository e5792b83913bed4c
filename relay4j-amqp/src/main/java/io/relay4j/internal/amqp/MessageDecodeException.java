package io.relay4j.internal.amqp;

import io.relay4j.core.RelayException;

/**
 * A result message that can never be applied: not JSON, or missing required fields.
 */
public class MessageDecodeException extends RelayException {

    public MessageDecodeException(String message) {
        super(message);
    }

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
