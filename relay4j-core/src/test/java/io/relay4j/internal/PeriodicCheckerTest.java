package io.relay4j.internal;

import io.relay4j.ExpiredJobListener;
import io.relay4j.core.DispatchEnvelope;
import io.relay4j.core.Job;
import io.relay4j.core.JobRequest;
import io.relay4j.core.JobStatus;
import io.relay4j.core.ResultDisposition;
import io.relay4j.core.ResultEvent;
import io.relay4j.core.StoreException;
import io.relay4j.core.SweepReport;
import io.relay4j.internal.memory.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class PeriodicCheckerTest {

    private static final Duration LEASE = Duration.ofSeconds(30);
    private static final Duration INTERVAL = Duration.ofSeconds(10);
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private MutableClock clock;
    private InMemoryJobStore store;
    private RecordingBrokerGateway broker;
    private JobExecutor executor;
    private ResultConsumer consumer;
    private List<Job> expired;
    private PeriodicChecker checker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new InMemoryJobStore(clock, LEASE);
        broker = new RecordingBrokerGateway();
        executor = new JobExecutor(store, broker, clock);
        consumer = new ResultConsumer(store, clock, Duration.ofSeconds(30));
        expired = new CopyOnWriteArrayList<>();
        checker = new PeriodicChecker(store, executor, expired::add, clock, 100);
    }

    @Test
    void unacknowledgedJobIsRetriedThenExpires() {
        Job job = executor.dispatch(new JobRequest("notify", Map.of("user", 7), 2, TIMEOUT));

        clock.advance(TIMEOUT);
        assertThat(checker.sweep().overdue()).isZero();

        clock.advance(INTERVAL);
        SweepReport first = checker.sweep();
        assertThat(first.retried()).isEqualTo(1);
        Job second = store.findById(job.id()).orElseThrow();
        assertThat(second.status()).isEqualTo(JobStatus.DISPATCHED);
        assertThat(second.attemptCount()).isEqualTo(2);

        clock.advance(TIMEOUT.plus(INTERVAL));
        SweepReport last = checker.sweep();
        assertThat(last.expired()).isEqualTo(1);

        Job done = store.findById(job.id()).orElseThrow();
        assertThat(done.status()).isEqualTo(JobStatus.EXPIRED);
        assertThat(done.attemptCount()).isEqualTo(2);
        assertThat(expired).extracting(Job::id).containsExactly(job.id());
        assertThat(broker.publishedFor(job.id())).extracting(DispatchEnvelope::attemptCount).containsExactly(1, 2);
    }

    @Test
    void threeAttemptJobIsPublishedExactlyThreeTimes() {
        Job job = executor.dispatch(new JobRequest("notify", Map.of(), 3, TIMEOUT));

        for (int i = 0; i < 60; i++) {
            clock.advance(INTERVAL);
            checker.sweep();
            Job current = store.findById(job.id()).orElseThrow();
            if (current.status() == JobStatus.DISPATCHED) {
                assertThat(current.attemptCount()).isLessThanOrEqualTo(current.maxAttempts());
            }
        }

        assertThat(store.findById(job.id())).get().extracting(Job::status).isEqualTo(JobStatus.EXPIRED);
        assertThat(broker.publishedFor(job.id())).hasSize(3);
        assertThat(expired).hasSize(1);
    }

    @Test
    void overdueJobLeavesDispatchedWithinOneInterval() {
        Job job = executor.dispatch(new JobRequest("notify", Map.of(), 1, TIMEOUT));

        Instant deadline = job.ackDeadline();
        Instant sweepAt = clock.instant();
        while (store.findById(job.id()).orElseThrow().status() == JobStatus.DISPATCHED) {
            clock.advance(INTERVAL);
            sweepAt = clock.instant();
            checker.sweep();
        }

        assertThat(Duration.between(deadline, sweepAt)).isLessThanOrEqualTo(INTERVAL);
    }

    @Test
    void earlySuccessIsKeptAndLaterDuplicateIgnored() {
        Job job = executor.dispatch(new JobRequest("notify", Map.of(), 2, TIMEOUT));

        clock.advance(Duration.ofSeconds(5));
        assertThat(consumer.apply(ResultEvent.success(job.id(), clock.instant())))
                .isEqualTo(ResultDisposition.ACKNOWLEDGED);
        Job acknowledged = store.findById(job.id()).orElseThrow();

        clock.advance(Duration.ofSeconds(1));
        assertThat(consumer.apply(ResultEvent.success(job.id(), clock.instant())))
                .isEqualTo(ResultDisposition.DUPLICATE);

        clock.advance(Duration.ofMinutes(5));
        assertThat(checker.sweep().hasEffect()).isFalse();

        Job after = store.findById(job.id()).orElseThrow();
        assertThat(after).isEqualTo(acknowledged);
        assertThat(after.attemptCount()).isEqualTo(1);
        assertThat(broker.publishedFor(job.id())).hasSize(1);
    }

    @Test
    void failedPublishIsRecoveredOnNextSweep() {
        broker.setFailing(true);
        Job job = executor.dispatch(new JobRequest("notify", Map.of(), 2, TIMEOUT));
        assertThat(job.status()).isEqualTo(JobStatus.PENDING);

        broker.setFailing(false);
        clock.advance(INTERVAL);
        SweepReport report = checker.sweep();

        assertThat(report.recovered()).isEqualTo(1);
        Job dispatched = store.findById(job.id()).orElseThrow();
        assertThat(dispatched.status()).isEqualTo(JobStatus.DISPATCHED);
        assertThat(dispatched.attemptCount()).isEqualTo(1);
        assertThat(broker.publishedFor(job.id())).extracting(DispatchEnvelope::attemptCount).containsExactly(1);
    }

    @Test
    void publishedButUnmarkedJobWaitsForItsClaimToLapse() {
        InMemoryJobStore forgetful = new InMemoryJobStore(clock, LEASE) {
            private boolean failed;

            @Override
            public Job markDispatched(String id, Duration timeout) {
                if (!failed) {
                    failed = true;
                    throw new StoreException("write timed out");
                }
                return super.markDispatched(id, timeout);
            }
        };
        JobExecutor forgetfulExecutor = new JobExecutor(forgetful, broker, clock);
        PeriodicChecker forgetfulChecker = new PeriodicChecker(forgetful, forgetfulExecutor, expired::add, clock, 100);

        Job job = forgetfulExecutor.dispatch(new JobRequest("notify", Map.of(), 2, TIMEOUT));
        assertThat(job.status()).isEqualTo(JobStatus.PENDING);

        clock.advance(INTERVAL);
        assertThat(forgetfulChecker.sweep().recovered()).isZero();

        clock.advance(LEASE);
        assertThat(forgetfulChecker.sweep().recovered()).isEqualTo(1);
        assertThat(broker.publishedFor(job.id())).hasSize(2);
    }

    @Test
    void retryWhoseRepublishFailsIsPickedUpByRecovery() {
        Job job = executor.dispatch(new JobRequest("notify", Map.of(), 3, TIMEOUT));

        broker.setFailing(true);
        clock.advance(TIMEOUT.plus(INTERVAL));
        SweepReport failed = checker.sweep();
        assertThat(failed.failures()).isEqualTo(1);
        assertThat(store.findById(job.id())).get().extracting(Job::status).isEqualTo(JobStatus.RETRYING);

        broker.setFailing(false);
        clock.advance(LEASE);
        SweepReport recovered = checker.sweep();

        assertThat(recovered.recovered()).isEqualTo(1);
        Job current = store.findById(job.id()).orElseThrow();
        assertThat(current.status()).isEqualTo(JobStatus.DISPATCHED);
        assertThat(current.attemptCount()).isEqualTo(2);
    }

    @Test
    void oneFailingJobDoesNotStopTheSweep() {
        Job poisoned = executor.dispatch(new JobRequest("notify", Map.of(), 3, TIMEOUT));
        Job healthy = executor.dispatch(new JobRequest("notify", Map.of(), 3, TIMEOUT));

        InMemoryJobStore flaky = new InMemoryJobStore(clock, LEASE) {
            @Override
            public Job markRetryOrExpire(String id) {
                if (id.equals(poisoned.id())) {
                    throw new IllegalStateException("disk on fire");
                }
                return store.markRetryOrExpire(id);
            }

            @Override
            public java.util.stream.Stream<Job> findOverdue(Instant now) {
                return store.findOverdue(now);
            }

            @Override
            public Job markDispatched(String id, Duration timeout) {
                return store.markDispatched(id, timeout);
            }
        };
        PeriodicChecker flakyChecker = new PeriodicChecker(flaky, new JobExecutor(flaky, broker, clock),
                expired::add, clock, 100);

        clock.advance(TIMEOUT.plus(INTERVAL));
        SweepReport report = flakyChecker.sweep();

        assertThat(report.overdue()).isEqualTo(2);
        assertThat(report.failures()).isEqualTo(1);
        assertThat(report.retried()).isEqualTo(1);
        assertThat(store.findById(healthy.id())).get().extracting(Job::attemptCount).isEqualTo(2);
        assertThat(store.findById(poisoned.id())).get().extracting(Job::status).isEqualTo(JobStatus.DISPATCHED);
    }

    @Test
    void listenerFailureDoesNotUndoExpiry() {
        ExpiredJobListener exploding = job -> {
            throw new IllegalStateException("pager down");
        };
        PeriodicChecker noisy = new PeriodicChecker(store, executor, exploding, clock, 100);
        Job job = executor.dispatch(new JobRequest("notify", Map.of(), 1, TIMEOUT));

        clock.advance(TIMEOUT.plus(INTERVAL));
        SweepReport report = noisy.sweep();

        assertThat(report.expired()).isEqualTo(1);
        assertThat(store.findById(job.id())).get().extracting(Job::status).isEqualTo(JobStatus.EXPIRED);
    }

    @Test
    void recoveryTakesAtMostBatchSizeClaims() {
        broker.setFailing(true);
        for (int i = 0; i < 5; i++) {
            executor.dispatch(new JobRequest("notify", Map.of("n", i), 1, TIMEOUT));
        }
        broker.setFailing(false);
        clock.advance(LEASE);

        PeriodicChecker small = new PeriodicChecker(store, executor, expired::add, clock, 2);

        assertThat(small.sweep().recovered()).isEqualTo(2);
        assertThat(small.sweep().recovered()).isEqualTo(2);
        assertThat(small.sweep().recovered()).isEqualTo(1);
        assertThat(broker.published()).hasSize(5);
    }
}
