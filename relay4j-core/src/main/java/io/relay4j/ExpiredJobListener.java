package io.relay4j;

import io.relay4j.core.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notified once a job has used all of its attempts without an acknowledgment.
 */
@FunctionalInterface
public interface ExpiredJobListener {

    void onExpired(Job job);

    static ExpiredJobListener logging() {
        Logger log = LoggerFactory.getLogger(ExpiredJobListener.class);
        return job -> log.warn("relay job expired id={} type={} attempts={}/{} lastDispatchedAt={}",
                job.id(), job.jobType(), job.attemptCount(), job.maxAttempts(), job.dispatchedAt());
    }
}
