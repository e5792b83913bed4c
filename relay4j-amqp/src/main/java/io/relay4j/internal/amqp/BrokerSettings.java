package io.relay4j.internal.amqp;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Broker topology and consumer tuning.
 *
 * @param exchange                durable topic exchange for dispatch and result messages
 * @param resultQueue             durable queue the result consumer reads
 * @param resultRoutingKeys       routing keys bound to {@code resultQueue}
 * @param dispatchRoutingPrefix   dispatch routing key is this prefix plus the job type
 * @param prefetch                unacknowledged result messages allowed in flight
 * @param recoveryInitialInterval first consumer reconnect delay
 * @param recoveryMaxInterval     reconnect delay cap
 * @param confirmTimeout          publisher confirm wait; zero disables confirms
 */
public record BrokerSettings(
        String exchange,
        String resultQueue,
        List<String> resultRoutingKeys,
        String dispatchRoutingPrefix,
        int prefetch,
        Duration recoveryInitialInterval,
        Duration recoveryMaxInterval,
        Duration confirmTimeout
) {
    public BrokerSettings {
        requireText(exchange, "exchange");
        requireText(resultQueue, "resultQueue");
        Objects.requireNonNull(resultRoutingKeys, "resultRoutingKeys must not be null");
        if (resultRoutingKeys.isEmpty()) {
            throw new IllegalArgumentException("resultRoutingKeys must not be empty");
        }
        resultRoutingKeys = List.copyOf(resultRoutingKeys);
        Objects.requireNonNull(dispatchRoutingPrefix, "dispatchRoutingPrefix must not be null");
        if (prefetch <= 0) {
            throw new IllegalArgumentException("prefetch must be a positive number");
        }
        Objects.requireNonNull(recoveryInitialInterval, "recoveryInitialInterval must not be null");
        Objects.requireNonNull(recoveryMaxInterval, "recoveryMaxInterval must not be null");
        Objects.requireNonNull(confirmTimeout, "confirmTimeout must not be null");
        if (confirmTimeout.isNegative()) {
            throw new IllegalArgumentException("confirmTimeout must not be negative");
        }
    }

    public static BrokerSettings defaults() {
        return new BrokerSettings(
                "jobs",
                "job_scheduler.results",
                List.of("jobs.completed", "jobs.failed", "jobs.result"),
                "jobs.execute.",
                10,
                Duration.ofSeconds(1),
                Duration.ofSeconds(60),
                Duration.ofSeconds(5)
        );
    }

    public String dispatchRoutingKey(String jobType) {
        return dispatchRoutingPrefix + jobType;
    }

    public String deadLetterExchange() {
        return exchange + ".dlx";
    }

    public String deadLetterQueue() {
        return resultQueue + ".dlq";
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
