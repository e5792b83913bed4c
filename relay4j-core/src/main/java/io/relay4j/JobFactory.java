package io.relay4j;

import io.relay4j.core.JobRequest;

import java.time.Instant;

/**
 * Produces the job to dispatch each time a periodic definition fires.
 */
@FunctionalInterface
public interface JobFactory {

    JobRequest create(Instant fireTime);
}
