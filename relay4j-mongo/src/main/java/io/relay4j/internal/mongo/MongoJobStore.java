package io.relay4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.relay4j.core.Job;
import io.relay4j.core.JobStatus;
import io.relay4j.core.StoreException;
import io.relay4j.internal.AbstractJobStore;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>Every transition is an {@code updateFirst} guarded by {@code {_id, version}}: the update only
 * matches the row the caller read, so a concurrent writer that got there first makes it match
 * nothing. Recovery claims use {@code findAndModify}, one row per round trip, which is safe with
 * several relay processes sharing the collection.
 */
public class MongoJobStore extends AbstractJobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private static final List<JobStatus> DISPATCHABLE = List.of(JobStatus.PENDING, JobStatus.RETRYING);

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate, Clock clock, Duration publishLease) {
        super(clock, publishLease);
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    protected void insert(Job job) {
        translate("insert " + job.id(), () -> {
            try {
                return mongoTemplate.insert(JobDocument.from(job));
            } catch (DuplicateKeyException e) {
                throw new StoreException("Duplicate job id: " + job.id(), e);
            }
        });
    }

    @Override
    protected Optional<Job> load(String id) {
        JobDocument doc = translate("load " + id, () -> mongoTemplate.findById(id, JobDocument.class));
        return Optional.ofNullable(doc).map(JobDocument::toJob);
    }

    @Override
    protected boolean compareAndSet(Job current, Job updated) {
        Query q = new Query(
                Criteria.where("_id").is(current.id())
                        .and("version").is(current.version())
        );

        Update u = new Update()
                .set("status", updated.status())
                .set("attemptCount", updated.attemptCount())
                .set("timeoutMillis", updated.timeout().toMillis())
                .set("dispatchedAt", updated.dispatchedAt())
                .set("ackDeadline", updated.ackDeadline())
                .set("nextAttemptAt", updated.nextAttemptAt())
                .set("result", updated.result())
                .set("errorDetail", updated.errorDetail())
                .set("completedAt", updated.completedAt())
                .set("executionDurationMs", updated.executionDurationMs())
                .set("updatedAt", updated.updatedAt())
                .set("version", updated.version());

        UpdateResult r = translate("update " + current.id(),
                () -> mongoTemplate.updateFirst(q, u, JobDocument.class));
        return r.getMatchedCount() == 1;
    }

    @Override
    protected List<Job> findDueForPublish(Instant now, int limit) {
        Query q = dueQuery(now).limit(limit);
        List<JobDocument> docs = translate("find due", () -> mongoTemplate.find(q, JobDocument.class));
        return docs.stream().map(JobDocument::toJob).collect(Collectors.toList());
    }

    /**
     * Atomically claims at most {@code limit} due PENDING/RETRYING rows.
     *
     * <p>Each claim is a {@code findAndModify} that pushes {@code nextAttemptAt} one publish lease
     * ahead and bumps the version, so a row claimed here is invisible to every other claimer until
     * the lease lapses.
     */
    @Override
    public List<Job> claimDispatchable(Instant now, int limit) {
        Objects.requireNonNull(now, "now must not be null");
        if (limit <= 0) {
            return List.of();
        }

        Instant claimedAt = now();
        Update claim = new Update()
                .set("nextAttemptAt", claimedAt.plus(publishLease()))
                .set("updatedAt", claimedAt)
                .inc("version", 1);

        Query q = dueQuery(now);
        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        List<Job> claimed = new ArrayList<>(Math.min(limit, 64));
        for (int i = 0; i < limit; i++) {
            JobDocument doc = translate("claim due",
                    () -> mongoTemplate.findAndModify(q, claim, options, JobDocument.class));
            if (doc == null) {
                break;
            }
            claimed.add(doc.toJob());
        }
        return claimed;
    }

    @Override
    public Stream<Job> findOverdue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        Query q = new Query(
                Criteria.where("status").is(JobStatus.DISPATCHED)
                        .and("ackDeadline").lt(now)
        ).with(Sort.by(Sort.Order.asc("ackDeadline")));

        Stream<JobDocument> cursor = translate("find overdue", () -> mongoTemplate.stream(q, JobDocument.class));
        return cursor.map(JobDocument::toJob);
    }

    @Override
    public boolean isReachable() {
        try {
            Document reply = mongoTemplate.executeCommand(new Document("ping", 1));
            Number ok = reply == null ? null : reply.get("ok", Number.class);
            return ok != null && ok.doubleValue() == 1.0;
        } catch (RuntimeException e) {
            log.debug("relay mongo ping failed msg={}", e.getMessage());
            return false;
        }
    }

    private static Query dueQuery(Instant now) {
        return new Query(
                Criteria.where("status").in(DISPATCHABLE)
                        .and("nextAttemptAt").ne(null).lte(now)
        ).with(Sort.by(Sort.Order.asc("nextAttemptAt")));
    }

    private static <T> T translate(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new StoreException("mongo " + action + " failed: " + e.getMessage(), e);
        }
    }
}
