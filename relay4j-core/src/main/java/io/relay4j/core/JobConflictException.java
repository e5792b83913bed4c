package io.relay4j.core;

/**
 * Lost the race for a conditional update: the row changed since it was read.
 *
 * <p>Expected under concurrency. Callers discard their action as stale.
 */
public class JobConflictException extends RelayException {

    private final String jobId;

    public JobConflictException(String jobId, String message) {
        super("Conflicting update for job " + jobId + ": " + message);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
