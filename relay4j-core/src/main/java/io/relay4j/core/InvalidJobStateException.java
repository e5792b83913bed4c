package io.relay4j.core;

/**
 * A requested transition is not an edge of the job state machine.
 *
 * <p>Seeing this at runtime means a caller asked for something the lifecycle forbids; the
 * operation is aborted and the row is left untouched.
 */
public class InvalidJobStateException extends RelayException {

    private final String jobId;
    private final JobStatus currentStatus;

    public InvalidJobStateException(String jobId, JobStatus currentStatus, String message) {
        super("Invalid transition for job " + jobId + " in " + currentStatus + ": " + message);
        this.jobId = jobId;
        this.currentStatus = currentStatus;
    }

    public String jobId() {
        return jobId;
    }

    public JobStatus currentStatus() {
        return currentStatus;
    }
}
