package io.relay4j.internal.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.relay4j.core.Job;
import io.relay4j.core.JobConflictException;
import io.relay4j.core.JobNotFoundException;
import io.relay4j.core.JobRequest;
import io.relay4j.core.JobStatus;
import io.relay4j.core.Outcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Duration LEASE = Duration.ofSeconds(30);
    private static final Duration TIMEOUT = Duration.ofSeconds(20);

    private MongoClient client;
    private MongoTemplate mongoTemplate;
    private SteppingClock clock;
    private MongoJobStore jobStore;

    @BeforeEach
    void setUp() {
        client = MongoClients.create(MONGO.getReplicaSetUrl());
        mongoTemplate = new MongoTemplate(client, "relay4j_test");
        mongoTemplate.dropCollection(JobDocument.class);
        clock = new SteppingClock(Instant.parse("2026-02-01T10:00:00Z"));
        jobStore = new MongoJobStore(mongoTemplate, clock, LEASE);
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(JobDocument.class);
        client.close();
    }

    @Test
    void createdJobRoundTripsThroughMongo() {
        Job created = jobStore.create(new JobRequest("email.send", Map.of("to", "ops@example.com", "retries", 2), 3, TIMEOUT));

        Job loaded = jobStore.findById(created.id()).orElseThrow();

        assertEquals(JobStatus.PENDING, loaded.status());
        assertEquals("email.send", loaded.jobType());
        assertEquals("ops@example.com", loaded.payload().get("to"));
        assertEquals(2, loaded.payload().get("retries"));
        assertEquals(TIMEOUT, loaded.timeout());
        assertEquals(created.nextAttemptAt(), loaded.nextAttemptAt());
        assertEquals(created.createdAt(), loaded.createdAt());
        assertEquals(0L, loaded.version());
    }

    @Test
    void lifecycleTransitionsArePersisted() {
        Job job = jobStore.create(request(2));

        Job dispatched = jobStore.markDispatched(job.id(), TIMEOUT);
        assertEquals(1, dispatched.attemptCount());
        assertEquals(clock.instant().plus(TIMEOUT), dispatched.ackDeadline());

        Job done = jobStore.markTerminal(job.id(), JobStatus.DISPATCHED, Outcome.SUCCESS, Map.of("rows", 5), null, 1250L);

        Job stored = jobStore.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.ACKNOWLEDGED, stored.status());
        assertEquals(5, stored.result().get("rows"));
        assertEquals(1250L, stored.executionDurationMs());
        assertNull(stored.ackDeadline());
        assertEquals(done.version(), stored.version());

        assertThrows(JobConflictException.class,
                () -> jobStore.markTerminal(job.id(), Outcome.FAILURE, null, "late"));
    }

    @Test
    void staleSnapshotCannotOverwriteNewerRow() {
        Job job = jobStore.create(request(2));
        jobStore.markDispatched(job.id(), TIMEOUT);

        // job still holds version 0; the row is at version 1
        assertFalse(jobStore.compareAndSet(job, job.dispatched(clock.instant(), TIMEOUT)));
        assertEquals(1L, jobStore.findById(job.id()).orElseThrow().version());
        assertThrows(JobNotFoundException.class, () -> jobStore.markDispatched("missing", TIMEOUT));
    }

    @Test
    void overdueJobWithNoAttemptsLeftExpires() {
        Job job = jobStore.create(request(1));
        jobStore.markDispatched(job.id(), TIMEOUT);

        clock.advance(TIMEOUT.plusSeconds(1));
        List<Job> overdue;
        try (Stream<Job> s = jobStore.findOverdue(clock.instant())) {
            overdue = s.collect(Collectors.toList());
        }
        assertEquals(1, overdue.size());

        Job expired = jobStore.markRetryOrExpire(job.id());
        assertEquals(JobStatus.EXPIRED, expired.status());
        assertEquals(JobStatus.EXPIRED, jobStore.findById(job.id()).orElseThrow().status());
        assertNotNull(jobStore.findById(job.id()).orElseThrow().completedAt());
    }

    @Test
    void claimDispatchableShouldPreventDoubleClaim() {
        Job job = jobStore.create(request(3));
        clock.advance(LEASE);

        List<Job> first = jobStore.claimDispatchable(clock.instant(), 10);
        assertEquals(1, first.size());
        assertEquals(job.id(), first.get(0).id());
        assertEquals(clock.instant().plus(LEASE), first.get(0).nextAttemptAt());
        assertEquals(1L, first.get(0).version());

        assertTrue(jobStore.claimDispatchable(clock.instant(), 10).isEmpty());

        Job dispatched = jobStore.markDispatched(job.id(), TIMEOUT);
        assertEquals(JobStatus.DISPATCHED, dispatched.status());
        assertNull(dispatched.nextAttemptAt());
    }

    @Test
    void releasedClaimIsPersistedAndClaimable() {
        Job job = jobStore.create(request(3));

        Job released = jobStore.releaseClaim(job);
        assertEquals(released, jobStore.findById(job.id()).orElseThrow());

        List<Job> claimed = jobStore.claimDispatchable(clock.instant(), 10);
        assertEquals(1, claimed.size());
        assertEquals(job.id(), claimed.get(0).id());
        assertThrows(JobConflictException.class, () -> jobStore.releaseClaim(job));
    }

    @Test
    void concurrentResultAndTimeoutCommitOnce() throws Exception {
        Job job = jobStore.create(request(3));
        jobStore.markDispatched(job.id(), TIMEOUT);
        clock.advance(TIMEOUT.plusSeconds(1));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CountDownLatch go = new CountDownLatch(1);
            List<Future<Job>> futures = new ArrayList<>();
            futures.add(pool.submit(() -> {
                go.await();
                return jobStore.markTerminal(job.id(), Outcome.SUCCESS, null, null);
            }));
            futures.add(pool.submit(() -> {
                go.await();
                return jobStore.markRetryOrExpire(job.id());
            }));
            go.countDown();

            int committed = 0;
            for (Future<Job> f : futures) {
                try {
                    f.get(10, TimeUnit.SECONDS);
                    committed++;
                } catch (ExecutionException e) {
                    assertInstanceOf(JobConflictException.class, e.getCause());
                }
            }
            assertEquals(1, committed);
            assertEquals(2L, jobStore.findById(job.id()).orElseThrow().version());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void pingReportsReachable() {
        assertTrue(jobStore.isReachable());
    }

    private static JobRequest request(int maxAttempts) {
        return new JobRequest("report.build", Map.of("id", 9), maxAttempts, TIMEOUT);
    }

    private static final class SteppingClock extends Clock {
        private volatile Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
