package io.relay4j;

import io.relay4j.core.DispatchEnvelope;

/**
 * Client side of the message broker: publishes dispatch messages and consumes results.
 */
public interface BrokerGateway {

    /**
     * Publish one dispatch message.
     *
     * @throws io.relay4j.core.PublishException when the broker is unreachable, disconnected or
     *                                          rejects the message
     */
    void publish(DispatchEnvelope envelope);

    /**
     * Start delivering result messages to {@code handler}. A message is acknowledged only after
     * the handler returns normally.
     */
    void consume(ResultHandler handler);

    boolean isConnected();

    void stop();
}
