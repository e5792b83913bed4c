package io.relay4j.internal;

import io.relay4j.JobStore;
import io.relay4j.core.Job;
import io.relay4j.core.JobConflictException;
import io.relay4j.core.JobNotFoundException;
import io.relay4j.core.JobRequest;
import io.relay4j.core.JobStatus;
import io.relay4j.core.Outcome;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link JobStore} transitions built on three row primitives: insert, load and a
 * compare-and-set keyed on {@link Job#version()}.
 *
 * <p>Each transition reads the row, lets {@link Job} validate the move, and commits with the
 * version it read. Whoever commits first wins; the other writer gets a
 * {@link JobConflictException}.
 */
public abstract class AbstractJobStore implements JobStore {

    private final Clock clock;
    private final Duration publishLease;

    protected AbstractJobStore(Clock clock, Duration publishLease) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.publishLease = Objects.requireNonNull(publishLease, "publishLease must not be null");
        if (publishLease.isZero() || publishLease.isNegative()) {
            throw new IllegalArgumentException("publishLease must be a positive duration");
        }
    }

    protected abstract void insert(Job job);

    protected abstract Optional<Job> load(String id);

    /**
     * Replace the stored row with {@code updated} only if it still has {@code current.version()}.
     */
    protected abstract boolean compareAndSet(Job current, Job updated);

    /**
     * PENDING/RETRYING rows with {@code nextAttemptAt <= now}, earliest first.
     */
    protected abstract List<Job> findDueForPublish(Instant now, int limit);

    @Override
    public Job create(JobRequest request) {
        Instant now = now();
        Job job = Job.pending(newId(), request, now, now.plus(publishLease));
        insert(job);
        return job;
    }

    @Override
    public Job schedule(JobRequest request, Instant at) {
        Objects.requireNonNull(at, "at must not be null");
        Job job = Job.pending(newId(), request, now(), at.truncatedTo(ChronoUnit.MILLIS));
        insert(job);
        return job;
    }

    @Override
    public Optional<Job> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return load(id);
    }

    @Override
    public Job markDispatched(String id, Duration timeout) {
        Job current = require(id);
        return commit(current, current.dispatched(now(), timeout));
    }

    @Override
    public Job markTerminal(String id, JobStatus expectedStatus, Outcome outcome, Map<String, Object> result,
                            String errorDetail, Long executionDurationMs) {
        Objects.requireNonNull(expectedStatus, "expectedStatus must not be null");
        Job current = require(id);
        if (current.status() != expectedStatus) {
            throw new JobConflictException(id, "expected " + expectedStatus + " but found " + current.status());
        }
        return commit(current, current.completed(outcome, result, errorDetail, executionDurationMs, now()));
    }

    @Override
    public Job markRetryOrExpire(String id) {
        Instant now = now();
        Job current = require(id);
        if (!current.isOverdue(now)) {
            throw new JobConflictException(id, "no longer an overdue DISPATCHED job (status=" + current.status() + ")");
        }
        return commit(current, current.retriedOrExpired(now, now.plus(publishLease)));
    }

    @Override
    public Job requeue(String id, JobStatus expectedStatus, Instant notBefore, String errorDetail) {
        Objects.requireNonNull(expectedStatus, "expectedStatus must not be null");
        Objects.requireNonNull(notBefore, "notBefore must not be null");
        Job current = require(id);
        if (current.status() != expectedStatus) {
            throw new JobConflictException(id, "expected " + expectedStatus + " but found " + current.status());
        }
        return commit(current, current.requeued(now(), notBefore.truncatedTo(ChronoUnit.MILLIS), errorDetail));
    }

    @Override
    public List<Job> claimDispatchable(Instant now, int limit) {
        Objects.requireNonNull(now, "now must not be null");
        if (limit <= 0) {
            return List.of();
        }
        Instant claimedAt = now();
        List<Job> claimed = new ArrayList<>(Math.min(limit, 64));
        for (Job candidate : findDueForPublish(now, limit)) {
            Job next = candidate.claimed(claimedAt, claimedAt.plus(publishLease));
            if (compareAndSet(candidate, next)) {
                claimed.add(next);
            }
        }
        return claimed;
    }

    @Override
    public Job releaseClaim(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        Instant now = now();
        return commit(job, job.claimed(now, now));
    }

    protected Job require(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return load(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    protected Job commit(Job current, Job updated) {
        if (compareAndSet(current, updated)) {
            return updated;
        }
        if (load(current.id()).isEmpty()) {
            throw new JobNotFoundException(current.id());
        }
        throw new JobConflictException(current.id(), "row changed since version " + current.version());
    }

    // Millisecond precision so snapshots compare equal after a round trip through BSON dates.
    protected Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    protected Duration publishLease() {
        return publishLease;
    }

    protected String newId() {
        return UUID.randomUUID().toString();
    }
}
