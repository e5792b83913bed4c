package io.relay4j;

import io.relay4j.core.Job;
import io.relay4j.core.JobRequest;
import io.relay4j.core.JobStatus;
import io.relay4j.core.Outcome;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Durable job rows and their state transitions.
 *
 * <p>Every mutation is atomic per row: the store reads the row, validates the transition, and
 * commits it only if the row is unchanged since the read. Losing that race raises
 * {@link io.relay4j.core.JobConflictException}; a missing row raises
 * {@link io.relay4j.core.JobNotFoundException}; an illegal transition raises
 * {@link io.relay4j.core.InvalidJobStateException}; infrastructure failures raise
 * {@link io.relay4j.core.StoreException}.
 */
public interface JobStore {

    /**
     * Insert a PENDING row whose first publish is owned by the caller for one publish lease.
     */
    Job create(JobRequest request);

    /**
     * Insert a PENDING row that the recovery sweep publishes once {@code at} has passed.
     */
    Job schedule(JobRequest request, Instant at);

    Optional<Job> findById(String id);

    /**
     * PENDING/RETRYING to DISPATCHED: one more attempt, {@code ackDeadline = now + timeout}.
     */
    Job markDispatched(String id, Duration timeout);

    /**
     * Commit a worker outcome, only if the row is still in {@code expectedStatus}.
     */
    Job markTerminal(String id, JobStatus expectedStatus, Outcome outcome, Map<String, Object> result,
                     String errorDetail, Long executionDurationMs);

    default Job markTerminal(String id, JobStatus expectedStatus, Outcome outcome, Map<String, Object> result, String errorDetail) {
        return markTerminal(id, expectedStatus, outcome, result, errorDetail, null);
    }

    default Job markTerminal(String id, Outcome outcome, Map<String, Object> result, String errorDetail) {
        return markTerminal(id, JobStatus.DISPATCHED, outcome, result, errorDetail);
    }

    /**
     * DISPATCHED jobs whose acknowledgment deadline is before {@code now}, oldest deadline first.
     *
     * <p>The stream is lazy and may hold a cursor; close it.
     */
    Stream<Job> findOverdue(Instant now);

    /**
     * An overdue DISPATCHED job goes to RETRYING when attempts remain, EXPIRED otherwise.
     * Fails with a conflict if the job is no longer DISPATCHED or no longer overdue.
     */
    Job markRetryOrExpire(String id);

    /**
     * DISPATCHED to RETRYING for a failure the worker asked to retry; republished after
     * {@code notBefore}.
     */
    Job requeue(String id, JobStatus expectedStatus, Instant notBefore, String errorDetail);

    /**
     * Claim up to {@code limit} PENDING/RETRYING rows that are due for publishing.
     */
    List<Job> claimDispatchable(Instant now, int limit);

    /**
     * Hand back the publish claim held on {@code job} after a failed publish, so the next recovery
     * pass can take the row. Fails with a conflict if the row changed since {@code job} was read.
     */
    Job releaseClaim(Job job);

    boolean isReachable();
}
