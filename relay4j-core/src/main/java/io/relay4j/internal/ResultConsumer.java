package io.relay4j.internal;

import io.relay4j.JobStore;
import io.relay4j.ResultHandler;
import io.relay4j.core.Job;
import io.relay4j.core.JobConflictException;
import io.relay4j.core.JobNotFoundException;
import io.relay4j.core.JobStatus;
import io.relay4j.core.Outcome;
import io.relay4j.core.ResultDisposition;
import io.relay4j.core.ResultEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies worker results to job rows.
 *
 * <p>Only a DISPATCHED row accepts a result. Anything else (unknown id, already terminal, already
 * retried, or a conditional update lost to the periodic checker) is discarded without touching the
 * row, so redelivered and late messages are harmless.
 */
public class ResultConsumer implements ResultHandler {
    private static final Logger log = LoggerFactory.getLogger(ResultConsumer.class);

    private final JobStore jobStore;
    private final Clock clock;
    private final Duration failureRetryDelay;

    public ResultConsumer(JobStore jobStore, Clock clock, Duration failureRetryDelay) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.failureRetryDelay = Objects.requireNonNull(failureRetryDelay, "failureRetryDelay must not be null");
        if (failureRetryDelay.isNegative()) {
            throw new IllegalArgumentException("failureRetryDelay must not be negative");
        }
    }

    @Override
    public void onResult(ResultEvent event) {
        apply(event);
    }

    public ResultDisposition apply(ResultEvent event) {
        Objects.requireNonNull(event, "event must not be null");

        Optional<Job> found = jobStore.findById(event.jobId());
        if (found.isEmpty()) {
            log.info("relay result for unknown job discarded id={} outcome={}", event.jobId(), event.outcome());
            return ResultDisposition.UNKNOWN_JOB;
        }

        Job job = found.get();
        if (job.status() != JobStatus.DISPATCHED) {
            log.debug("relay duplicate or late result discarded id={} status={} outcome={}",
                    job.id(), job.status(), event.outcome());
            return ResultDisposition.DUPLICATE;
        }

        try {
            if (event.outcome() == Outcome.FAILURE && event.retryRequested() && job.hasAttemptsRemaining()) {
                Job requeued = jobStore.requeue(job.id(), JobStatus.DISPATCHED,
                        clock.instant().plus(failureRetryDelay), event.errorDetail());
                log.warn("relay job failed, retry requested id={} type={} attempt={}/{} retryAt={} error={}",
                        requeued.id(), requeued.jobType(), requeued.attemptCount(), requeued.maxAttempts(),
                        requeued.nextAttemptAt(), event.errorDetail());
                return ResultDisposition.REQUEUED;
            }

            Job done = jobStore.markTerminal(job.id(), JobStatus.DISPATCHED,
                    event.outcome(), event.result(), event.errorDetail(), event.executionDurationMs());
            if (done.status() == JobStatus.ACKNOWLEDGED) {
                log.info("relay job acknowledged id={} type={} attempt={} durationMs={}",
                        done.id(), done.jobType(), done.attemptCount(), done.executionDurationMs());
                return ResultDisposition.ACKNOWLEDGED;
            }
            log.warn("relay job failed id={} type={} attempt={} error={}",
                    done.id(), done.jobType(), done.attemptCount(), event.errorDetail());
            return ResultDisposition.FAILED;
        } catch (JobConflictException e) {
            log.debug("relay result lost race, discarded id={} msg={}", job.id(), e.getMessage());
            return ResultDisposition.STALE;
        } catch (JobNotFoundException e) {
            log.info("relay job vanished before result was applied id={}", job.id());
            return ResultDisposition.UNKNOWN_JOB;
        }
    }
}
