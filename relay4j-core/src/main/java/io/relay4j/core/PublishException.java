package io.relay4j.core;

/**
 * The broker was unreachable or refused a dispatch message. The job stays eligible for the
 * recovery sweep.
 */
public class PublishException extends RelayException {

    private final String jobId;

    public PublishException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public PublishException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
