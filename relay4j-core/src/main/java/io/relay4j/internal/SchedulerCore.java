package io.relay4j.internal;

import io.relay4j.TriggerRule;
import io.relay4j.core.Job;
import io.relay4j.core.JobRequest;
import io.relay4j.core.PeriodicDefinition;
import io.relay4j.core.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives periodic definitions and the periodic checker.
 *
 * <p>Two daemon threads, neither blocking the other:
 * <ul>
 *   <li>{@code relay.scheduler}: ticks every {@code tickInterval}, fires due definitions through the
 *   {@link JobExecutor} and moves their next fire time forward</li>
 *   <li>{@code relay.checker}: runs {@link PeriodicChecker#sweep()} every {@code checkInterval}</li>
 * </ul>
 *
 * <p>A definition whose fire time was missed (tick delayed, process paused) fires once on the next
 * tick; missed occurrences are not backfilled.
 */
public class SchedulerCore {
    private static final Logger log = LoggerFactory.getLogger(SchedulerCore.class);

    private final JobExecutor executor;
    private final PeriodicChecker checker;
    private final Clock clock;
    private final Duration tickInterval;
    private final Duration checkInterval;

    private final ConcurrentHashMap<String, TriggerEntry> triggers = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private Thread tickThread;
    private Thread checkerThread;

    private record TriggerEntry(PeriodicDefinition definition, Instant nextFireAt) {
    }

    public SchedulerCore(JobExecutor executor,
                         PeriodicChecker checker,
                         Clock clock,
                         Duration tickInterval,
                         Duration checkInterval) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.checker = Objects.requireNonNull(checker, "checker must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.tickInterval = requirePositive(tickInterval, "tickInterval");
        this.checkInterval = requirePositive(checkInterval, "checkInterval");
    }

    /**
     * Add or replace a definition. Its first fire time is computed from now.
     */
    public Instant register(PeriodicDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        Instant first = definition.trigger().nextFireAfter(clock.instant());
        if (first == null) {
            throw new IllegalArgumentException("trigger of " + definition.name() + " produced no fire time");
        }
        TriggerEntry previous = triggers.put(definition.name(), new TriggerEntry(definition, first));
        log.info("relay periodic {} name={} nextFireAt={}",
                previous == null ? "registered" : "replaced", definition.name(), first);
        return first;
    }

    public boolean unregister(String name) {
        boolean removed = triggers.remove(name) != null;
        if (removed) {
            log.info("relay periodic unregistered name={}", name);
        }
        return removed;
    }

    /**
     * Snapshot of the trigger table, ordered by name.
     */
    public Map<String, Instant> nextFireTimes() {
        Map<String, Instant> snapshot = new TreeMap<>();
        triggers.forEach((name, entry) -> snapshot.put(name, entry.nextFireAt()));
        return snapshot;
    }

    /**
     * Fire every definition that is due and advance its trigger.
     *
     * @return number of definitions fired
     * @throws StoreException when the store is down; the failing definition stays due
     */
    public int tickOnce() {
        Instant now = clock.instant();
        int fired = 0;

        for (TriggerEntry entry : triggers.values()) {
            if (entry.nextFireAt().isAfter(now)) {
                continue;
            }
            fire(entry);
            fired++;

            PeriodicDefinition def = entry.definition();
            Instant next = nextFireTime(def.trigger(), entry.nextFireAt(), now);
            if (next == null) {
                triggers.remove(def.name(), entry);
                log.info("relay periodic exhausted its trigger and was removed name={}", def.name());
            } else {
                triggers.replace(def.name(), entry, new TriggerEntry(def, next));
            }
        }
        return fired;
    }

    private void fire(TriggerEntry entry) {
        PeriodicDefinition def = entry.definition();
        try {
            JobRequest request = def.factory().create(entry.nextFireAt());
            Job job = executor.dispatch(request);
            log.debug("relay periodic fired name={} scheduledFor={} jobId={} status={}",
                    def.name(), entry.nextFireAt(), job.id(), job.status());
        } catch (StoreException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("relay periodic fire failed name={} kind={} msg={}",
                    def.name(), e.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    static Instant nextFireTime(TriggerRule trigger, Instant scheduled, Instant now) {
        Instant next = trigger.nextFireAfter(scheduled);
        if (next != null && !next.isAfter(now)) {
            // behind schedule: skip the missed occurrences
            next = trigger.nextFireAfter(now);
        }
        return next;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("relay scheduler starting tickInterval={} checkInterval={} periodic={}",
                tickInterval, checkInterval, triggers.size());

        tickThread = newDaemon("relay.scheduler", this::tickLoop);
        checkerThread = newDaemon("relay.checker", this::checkLoop);
        tickThread.start();
        checkerThread.start();
    }

    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("relay scheduler stopping...");
        stopThread(tickThread);
        stopThread(checkerThread);
        tickThread = null;
        checkerThread = null;
        log.info("relay scheduler stopped");
    }

    public boolean isRunning() {
        return started.get();
    }

    private void tickLoop() {
        int failures = 0;
        while (started.get()) {
            try {
                tickOnce();
                failures = 0;
            } catch (Exception e) {
                failures++;
                log.error("relay tick failed failures={} msg={}", failures, e.getMessage(), e);
                if (!pause(backoff(failures))) {
                    break;
                }
                continue;
            }
            if (!pause(tickInterval)) {
                break;
            }
        }
    }

    private void checkLoop() {
        int failures = 0;
        while (started.get()) {
            try {
                checker.sweep();
                failures = 0;
            } catch (Exception e) {
                failures++;
                log.error("relay sweep failed failures={} msg={}", failures, e.getMessage(), e);
                if (!pause(backoff(failures))) {
                    break;
                }
                continue;
            }
            if (!pause(checkInterval)) {
                break;
            }
        }
    }

    // Exponential backoff for repeated loop failures: 1s, 2s, 4s ... capped at 60s.
    public static Duration backoff(int failures) {
        int exp = Math.max(0, Math.min(failures - 1, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private boolean pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return started.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Thread newDaemon(String name, Runnable body) {
        Thread t = new Thread(body);
        t.setName(name);
        t.setDaemon(true);
        return t;
    }

    private static void stopThread(Thread t) {
        if (t == null) {
            return;
        }
        t.interrupt();
        try {
            t.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
        return d;
    }
}
