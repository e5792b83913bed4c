package io.relay4j.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Inbound result for one dispatch attempt, as decoded from the broker.
 *
 * @param jobId               job the worker ran
 * @param outcome             success or failure
 * @param errorDetail         failure detail; null on success
 * @param emittedAt           when the worker emitted the result
 * @param result              optional outcome document
 * @param executionDurationMs optional worker-side duration
 * @param retryRequested      the worker asked for another attempt after a failure
 */
public record ResultEvent(
        String jobId,
        Outcome outcome,
        String errorDetail,
        Instant emittedAt,
        Map<String, Object> result,
        Long executionDurationMs,
        boolean retryRequested
) {
    public ResultEvent {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public static ResultEvent success(String jobId, Instant emittedAt) {
        return new ResultEvent(jobId, Outcome.SUCCESS, null, emittedAt, null, null, false);
    }

    public static ResultEvent failure(String jobId, String errorDetail, Instant emittedAt) {
        return new ResultEvent(jobId, Outcome.FAILURE, errorDetail, emittedAt, null, null, false);
    }
}
