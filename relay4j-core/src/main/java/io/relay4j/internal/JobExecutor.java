package io.relay4j.internal;

import io.relay4j.BrokerGateway;
import io.relay4j.JobStore;
import io.relay4j.core.DispatchEnvelope;
import io.relay4j.core.InvalidJobStateException;
import io.relay4j.core.Job;
import io.relay4j.core.JobRequest;
import io.relay4j.core.PublishException;
import io.relay4j.core.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Creates job rows and publishes them.
 *
 * <p>The row is written before the publish and marked DISPATCHED only after the broker took the
 * message, so a publish failure always leaves a PENDING/RETRYING row for the recovery sweep. On a
 * failed publish the executor hands its publish claim back, so the next sweep retries at once.
 */
public class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final JobStore jobStore;
    private final BrokerGateway broker;
    private final Clock clock;

    public JobExecutor(JobStore jobStore, BrokerGateway broker, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.broker = Objects.requireNonNull(broker, "broker must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Create and publish a new job.
     *
     * <p>Once the row is written, broker or store failures no longer escape: the row is returned
     * PENDING and the recovery sweep owns it from there.
     *
     * @return the DISPATCHED job, or the PENDING job when the publish or the dispatch mark failed
     * @throws StoreException when the row itself could not be written
     */
    public Job dispatch(JobRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        Job job = jobStore.create(request);
        log.debug("relay job created id={} type={} maxAttempts={} timeout={}",
                job.id(), job.jobType(), job.maxAttempts(), job.timeout());

        try {
            publish(job);
        } catch (PublishException e) {
            log.warn("relay publish failed; job left PENDING for recovery id={} type={} msg={}",
                    job.id(), job.jobType(), e.getMessage());
            return releaseClaim(job);
        }

        try {
            return markDispatched(job);
        } catch (StoreException e) {
            // published but not recorded; the sweep republishes once the claim lapses
            log.warn("relay job published but not marked dispatched id={} type={} msg={}",
                    job.id(), job.jobType(), e.getMessage());
            return job;
        }
    }

    /**
     * Create a job that the recovery sweep publishes once {@code at} has passed.
     */
    public Job schedule(JobRequest request, Instant at) {
        Objects.requireNonNull(request, "request must not be null");
        Job job = jobStore.schedule(request, at);
        log.debug("relay job scheduled id={} type={} at={}", job.id(), job.jobType(), job.nextAttemptAt());
        return job;
    }

    /**
     * Publish an existing PENDING or RETRYING job again.
     *
     * @throws PublishException when the broker refused the message; the row is left as it was
     */
    public Job redispatch(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        if (!job.status().isDispatchable()) {
            throw new InvalidJobStateException(job.id(), job.status(), "only PENDING or RETRYING jobs can be redispatched");
        }
        try {
            publish(job);
        } catch (PublishException e) {
            releaseClaim(job);
            throw e;
        }
        return markDispatched(job);
    }

    private void publish(Job job) {
        broker.publish(DispatchEnvelope.of(job, clock.instant()));
    }

    private Job markDispatched(Job job) {
        Job dispatched = jobStore.markDispatched(job.id(), job.timeout());
        log.info("relay job dispatched id={} type={} attempt={}/{} ackDeadline={}",
                dispatched.id(),
                dispatched.jobType(),
                dispatched.attemptCount(),
                dispatched.maxAttempts(),
                dispatched.ackDeadline());
        return dispatched;
    }

    /**
     * Best effort: if the release fails the claim simply lapses after the publish lease.
     */
    private Job releaseClaim(Job job) {
        try {
            return jobStore.releaseClaim(job);
        } catch (RuntimeException e) {
            log.warn("relay publish claim not released id={} kind={} msg={}",
                    job.id(), e.getClass().getSimpleName(), e.getMessage());
            return job;
        }
    }
}
