package io.relay4j.core;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a caller or a periodic job factory asks the executor to dispatch.
 *
 * @param jobType     opaque discriminator the worker routes on
 * @param payload     opaque document handed to the worker unchanged (never null, may be empty)
 * @param maxAttempts dispatch ceiling, at least 1
 * @param timeout     acknowledgment timeout for each attempt
 */
public record JobRequest(
        String jobType,
        Map<String, Object> payload,
        int maxAttempts,
        Duration timeout
) {
    public JobRequest {
        Objects.requireNonNull(jobType, "jobType must not be null");
        if (jobType.isBlank()) {
            throw new IllegalArgumentException("jobType must not be blank");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
