package io.relay4j.core;

/**
 * The referenced job row does not exist. Treated as non-fatal by the loops.
 */
public class JobNotFoundException extends RelayException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
