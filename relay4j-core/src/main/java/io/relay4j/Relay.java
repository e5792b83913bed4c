package io.relay4j;

import io.relay4j.core.Job;
import io.relay4j.core.JobRequest;
import io.relay4j.core.PeriodicDefinition;

import java.time.Instant;
import java.util.Map;

/**
 * Main dispatch API.
 *
 * <p>Jobs are fire-and-forget: dispatch never reports a worker failure to the caller. Outcomes
 * are visible through the stored job rows and the {@link ExpiredJobListener}.
 */
public interface Relay {
    void start();

    void stop();

    /**
     * Create and publish a job now, with the configured attempt ceiling and timeout.
     */
    Job dispatch(String jobType, Map<String, Object> payload);

    Job dispatch(JobRequest request);

    /**
     * Create a job that is published once {@code at} has passed.
     */
    Job schedule(JobRequest request, Instant at);

    /**
     * Register (or replace) a periodic definition.
     */
    void every(PeriodicDefinition definition);

    void every(String name, TriggerRule trigger, JobFactory factory);

    /**
     * Remove a periodic definition. Jobs it already created are not affected.
     */
    boolean cancel(String name);

    /**
     * Liveness predicate: broker connected and store reachable.
     */
    boolean isLive();
}
