package io.relay4j.core;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Fallback attempt ceiling and timeout applied when a request does not name its own.
 */
public record JobDefaults(int maxAttempts, Duration timeout) {

    public JobDefaults {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Objects.requireNonNull(timeout, "timeout must not be null");
    }

    public static JobDefaults defaults() {
        return new JobDefaults(3, Duration.ofMinutes(5));
    }

    public JobRequest request(String jobType, Map<String, Object> payload) {
        return new JobRequest(jobType, payload, maxAttempts, timeout);
    }

    public JobRequest request(String jobType, Map<String, Object> payload, Integer maxAttemptsOrNull, Duration timeoutOrNull) {
        return new JobRequest(
                jobType,
                payload,
                maxAttemptsOrNull != null ? maxAttemptsOrNull : maxAttempts,
                timeoutOrNull != null ? timeoutOrNull : timeout
        );
    }
}
