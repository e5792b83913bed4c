package io.relay4j.internal.memory;

import io.relay4j.core.Job;
import io.relay4j.core.StoreException;
import io.relay4j.internal.AbstractJobStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Process-local job store. Row atomicity comes from {@link ConcurrentHashMap#computeIfPresent}.
 *
 * <p>Nothing survives a restart; use it for tests and single-process embedding.
 */
public class InMemoryJobStore extends AbstractJobStore {

    private final ConcurrentMap<String, Job> rows = new ConcurrentHashMap<>();

    public InMemoryJobStore(Clock clock, Duration publishLease) {
        super(clock, publishLease);
    }

    @Override
    protected void insert(Job job) {
        if (rows.putIfAbsent(job.id(), job) != null) {
            throw new StoreException("Duplicate job id: " + job.id());
        }
    }

    @Override
    protected Optional<Job> load(String id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    protected boolean compareAndSet(Job current, Job updated) {
        AtomicBoolean swapped = new AtomicBoolean(false);
        rows.computeIfPresent(current.id(), (id, row) -> {
            if (row.version() != current.version()) {
                return row;
            }
            swapped.set(true);
            return updated;
        });
        return swapped.get();
    }

    @Override
    protected List<Job> findDueForPublish(Instant now, int limit) {
        return rows.values().stream()
                .filter(job -> job.isDueForPublish(now))
                .sorted(Comparator.comparing(Job::nextAttemptAt))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public Stream<Job> findOverdue(Instant now) {
        List<Job> snapshot = rows.values().stream()
                .filter(job -> job.isOverdue(now))
                .sorted(Comparator.comparing(Job::ackDeadline))
                .collect(Collectors.toList());
        return snapshot.stream();
    }

    @Override
    public boolean isReachable() {
        return true;
    }

    public int size() {
        return rows.size();
    }
}
