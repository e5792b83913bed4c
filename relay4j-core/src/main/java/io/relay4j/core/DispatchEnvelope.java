package io.relay4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Dispatch message handed to the broker.
 *
 * <p>{@code attemptCount} is the number of the attempt being published, so the first publish
 * carries 1.
 */
public record DispatchEnvelope(
        String jobId,
        String jobType,
        Map<String, Object> payload,
        int attemptCount,
        Duration timeout,
        Instant sentAt
) {
    public static DispatchEnvelope of(Job job, Instant sentAt) {
        return new DispatchEnvelope(
                job.id(),
                job.jobType(),
                job.payload(),
                job.attemptCount() + 1,
                job.timeout(),
                sentAt
        );
    }
}
