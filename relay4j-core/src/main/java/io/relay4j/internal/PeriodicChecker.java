package io.relay4j.internal;

import io.relay4j.ExpiredJobListener;
import io.relay4j.JobStore;
import io.relay4j.core.Job;
import io.relay4j.core.JobConflictException;
import io.relay4j.core.JobNotFoundException;
import io.relay4j.core.JobStatus;
import io.relay4j.core.PublishException;
import io.relay4j.core.SweepReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * One sweep over the store: time out overdue DISPATCHED jobs, then republish PENDING/RETRYING
 * jobs whose publish claim has lapsed.
 *
 * <p>Every overdue job is handled in the sweep that first sees it; the recovery pass takes at
 * most {@code batchSize} claims per sweep.
 *
 * <p>Each job is processed on its own. A failure on one job is logged and counted and the sweep
 * moves on. Only a failure to read the overdue set escapes {@link #sweep()}.
 */
public class PeriodicChecker {
    private static final Logger log = LoggerFactory.getLogger(PeriodicChecker.class);

    private final JobStore jobStore;
    private final JobExecutor executor;
    private final ExpiredJobListener expiredListener;
    private final Clock clock;
    private final int batchSize;

    public PeriodicChecker(JobStore jobStore,
                           JobExecutor executor,
                           ExpiredJobListener expiredListener,
                           Clock clock,
                           int batchSize) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.expiredListener = Objects.requireNonNull(expiredListener, "expiredListener must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be a positive number");
        }
        this.batchSize = batchSize;
    }

    public SweepReport sweep() {
        Instant now = clock.instant();
        Tally tally = new Tally();

        try (Stream<Job> overdue = jobStore.findOverdue(now)) {
            Iterator<Job> it = overdue.iterator();
            while (it.hasNext()) {
                tally.overdue++;
                handleOverdue(it.next(), tally);
            }
        }

        List<Job> claimed = jobStore.claimDispatchable(now, batchSize);
        for (Job job : claimed) {
            handleRecovery(job, tally);
        }

        SweepReport report = tally.toReport();
        if (report.hasEffect() || report.failures() > 0) {
            log.info("relay sweep finished overdue={} retried={} expired={} recovered={} conflicts={} failures={}",
                    report.overdue(), report.retried(), report.expired(), report.recovered(),
                    report.conflicts(), report.failures());
        } else {
            log.debug("relay sweep finished with nothing to do");
        }
        return report;
    }

    private void handleOverdue(Job job, Tally tally) {
        Job next;
        try {
            next = jobStore.markRetryOrExpire(job.id());
        } catch (JobConflictException e) {
            // a result or another sweep got there first
            tally.conflicts++;
            log.debug("relay overdue job changed concurrently id={} msg={}", job.id(), e.getMessage());
            return;
        } catch (JobNotFoundException e) {
            tally.failures++;
            log.warn("relay overdue job vanished id={}", job.id());
            return;
        } catch (RuntimeException e) {
            tally.failures++;
            log.error("relay timeout transition failed id={} kind={} msg={}",
                    job.id(), e.getClass().getSimpleName(), e.getMessage(), e);
            return;
        }

        if (next.status() == JobStatus.EXPIRED) {
            tally.expired++;
            log.warn("relay job expired id={} type={} attempts={}/{}",
                    next.id(), next.jobType(), next.attemptCount(), next.maxAttempts());
            notifyExpired(next);
            return;
        }

        log.info("relay job timed out, retrying id={} type={} attempt={}/{}",
                next.id(), next.jobType(), next.attemptCount(), next.maxAttempts());
        if (republish(next, tally)) {
            tally.retried++;
        }
    }

    private void handleRecovery(Job job, Tally tally) {
        log.info("relay republishing id={} type={} status={} attempt={}/{}",
                job.id(), job.jobType(), job.status(), job.attemptCount(), job.maxAttempts());
        if (republish(job, tally)) {
            tally.recovered++;
        }
    }

    private boolean republish(Job job, Tally tally) {
        try {
            executor.redispatch(job);
            return true;
        } catch (PublishException e) {
            // claim was handed back; the next recovery pass tries again
            tally.failures++;
            log.warn("relay republish failed id={} status={} msg={}", job.id(), job.status(), e.getMessage());
        } catch (JobConflictException e) {
            tally.conflicts++;
            log.debug("relay republish lost race id={} msg={}", job.id(), e.getMessage());
        } catch (RuntimeException e) {
            tally.failures++;
            log.error("relay republish failed id={} kind={} msg={}",
                    job.id(), e.getClass().getSimpleName(), e.getMessage(), e);
        }
        return false;
    }

    private void notifyExpired(Job job) {
        try {
            expiredListener.onExpired(job);
        } catch (RuntimeException e) {
            log.error("relay expired-job listener failed id={} msg={}", job.id(), e.getMessage(), e);
        }
    }

    private static final class Tally {
        int overdue;
        int retried;
        int expired;
        int recovered;
        int conflicts;
        int failures;

        SweepReport toReport() {
            return new SweepReport(overdue, retried, expired, recovered, conflicts, failures);
        }
    }
}
