package io.relay4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of one tracked job row.
 *
 * <p>Every transition method validates the move against {@link JobStatus} and returns the next
 * snapshot with {@code version + 1}. Stores persist the result with a compare-and-set on the
 * version they read, so two writers can never both commit a change to the same snapshot.
 */
public record Job(

        // identity
        String id,
        String jobType,
        Map<String, Object> payload,

        // lifecycle
        JobStatus status,
        int attemptCount,
        int maxAttempts,
        Duration timeout,

        // dispatch bookkeeping
        Instant dispatchedAt,
        Instant ackDeadline,
        Instant nextAttemptAt,

        // outcome
        Map<String, Object> result,
        String errorDetail,
        Instant completedAt,
        Long executionDurationMs,

        // audit
        Instant createdAt,
        Instant updatedAt,
        long version
) {

    public Job {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(jobType, "jobType must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        result = result == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    /**
     * A fresh PENDING row. {@code nextAttemptAt} is when the recovery sweep may first publish it.
     */
    public static Job pending(String id, JobRequest request, Instant now, Instant nextAttemptAt) {
        Objects.requireNonNull(request, "request must not be null");
        return new Job(
                id,
                request.jobType(),
                request.payload(),
                JobStatus.PENDING,
                0,
                request.maxAttempts(),
                request.timeout(),
                null,
                null,
                nextAttemptAt,
                null,
                null,
                null,
                null,
                now,
                now,
                0L
        );
    }

    public boolean hasAttemptsRemaining() {
        return attemptCount < maxAttempts;
    }

    public boolean isOverdue(Instant now) {
        return status == JobStatus.DISPATCHED && ackDeadline != null && ackDeadline.isBefore(now);
    }

    public boolean isDueForPublish(Instant now) {
        return status.isDispatchable() && nextAttemptAt != null && !nextAttemptAt.isAfter(now);
    }

    public Job dispatched(Instant now, Duration ackTimeout) {
        Objects.requireNonNull(ackTimeout, "ackTimeout must not be null");
        requireTransition(JobStatus.DISPATCHED);
        if (!hasAttemptsRemaining()) {
            throw new InvalidJobStateException(id, status,
                    "attempts exhausted (" + attemptCount + "/" + maxAttempts + ")");
        }
        return new Job(id, jobType, payload,
                JobStatus.DISPATCHED, attemptCount + 1, maxAttempts, ackTimeout,
                now, now.plus(ackTimeout), null,
                result, errorDetail, null, null,
                createdAt, now, version + 1);
    }

    public Job completed(Outcome outcome, Map<String, Object> outcomeResult, String detail, Instant now) {
        return completed(outcome, outcomeResult, detail, null, now);
    }

    /**
     * Terminal outcome reported by the worker.
     *
     * @param durationMs worker-side execution time, if reported
     */
    public Job completed(Outcome outcome, Map<String, Object> outcomeResult, String detail, Long durationMs, Instant now) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        JobStatus target = outcome.terminalStatus();
        requireTransition(target);
        return new Job(id, jobType, payload,
                target, attemptCount, maxAttempts, timeout,
                dispatchedAt, null, null,
                outcomeResult, detail, now, durationMs,
                createdAt, now, version + 1);
    }

    /**
     * Deadline elapsed without a result: RETRYING while attempts remain, EXPIRED otherwise.
     *
     * @param claimUntil publish claim held by the caller for the immediate redispatch
     */
    public Job retriedOrExpired(Instant now, Instant claimUntil) {
        if (status != JobStatus.DISPATCHED) {
            throw new InvalidJobStateException(id, status, "only DISPATCHED jobs can time out");
        }
        if (hasAttemptsRemaining()) {
            return new Job(id, jobType, payload,
                    JobStatus.RETRYING, attemptCount, maxAttempts, timeout,
                    dispatchedAt, null, claimUntil,
                    result, errorDetail, null, null,
                    createdAt, now, version + 1);
        }
        return new Job(id, jobType, payload,
                JobStatus.EXPIRED, attemptCount, maxAttempts, timeout,
                dispatchedAt, null, null,
                result, "acknowledgment deadline elapsed after " + attemptCount + " attempt(s)", now, null,
                createdAt, now, version + 1);
    }

    /**
     * Worker-reported failure that asked for another attempt.
     */
    public Job requeued(Instant now, Instant notBefore, String detail) {
        requireTransition(JobStatus.RETRYING);
        if (!hasAttemptsRemaining()) {
            throw new InvalidJobStateException(id, status,
                    "no attempts left to requeue (" + attemptCount + "/" + maxAttempts + ")");
        }
        return new Job(id, jobType, payload,
                JobStatus.RETRYING, attemptCount, maxAttempts, timeout,
                dispatchedAt, null, notBefore,
                result, detail, null, null,
                createdAt, now, version + 1);
    }

    /**
     * Take the publish claim on a PENDING/RETRYING row until {@code until}.
     */
    public Job claimed(Instant now, Instant until) {
        if (!status.isDispatchable()) {
            throw new InvalidJobStateException(id, status, "only PENDING or RETRYING jobs can be claimed");
        }
        return new Job(id, jobType, payload,
                status, attemptCount, maxAttempts, timeout,
                dispatchedAt, ackDeadline, until,
                result, errorDetail, completedAt, executionDurationMs,
                createdAt, now, version + 1);
    }

    private void requireTransition(JobStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidJobStateException(id, status, "cannot move to " + target);
        }
    }
}
