package io.relay4j.core;

import java.util.Locale;

/**
 * Outcome reported by a worker for one dispatch attempt.
 */
public enum Outcome {
    SUCCESS("success", JobStatus.ACKNOWLEDGED),
    FAILURE("failure", JobStatus.FAILED);

    private final String wireName;
    private final JobStatus terminalStatus;

    Outcome(String wireName, JobStatus terminalStatus) {
        this.wireName = wireName;
        this.terminalStatus = terminalStatus;
    }

    public String wireName() {
        return wireName;
    }

    public JobStatus terminalStatus() {
        return terminalStatus;
    }

    public static Outcome fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("outcome must not be blank");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (Outcome o : values()) {
            if (o.wireName.equals(v)) {
                return o;
            }
        }
        throw new IllegalArgumentException("Unsupported outcome: " + value);
    }
}
