package io.relay4j.core;

/**
 * Counters of one periodic checker sweep.
 *
 * overdue   : DISPATCHED jobs found past their acknowledgment deadline
 * retried   : overdue jobs moved to RETRYING and published again
 * expired   : overdue jobs that had no attempts left
 * recovered : PENDING/RETRYING jobs republished by the recovery pass
 * conflicts : transitions lost to a concurrent writer
 * failures  : jobs whose processing failed and was skipped
 */
public record SweepReport(
        int overdue,
        int retried,
        int expired,
        int recovered,
        int conflicts,
        int failures
) {

    public static SweepReport empty() {
        return new SweepReport(0, 0, 0, 0, 0, 0);
    }

    public boolean hasEffect() {
        return retried > 0 || expired > 0 || recovered > 0;
    }
}
