package io.relay4j.config;

import io.relay4j.internal.mongo.JobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

/**
 * MongoDB index definitions for the job collection.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code relay.ensure-indexes-on-startup=true};
 * production deployments usually manage them with migrations or ops scripts.
 *
 * <h3>Required indexes (collection: {@code relay_jobs})</h3>
 * <ul>
 *   <li><b>idx_status_ackDeadline</b>: { status: 1, ackDeadline: 1 }
 *       <br/>Used by the periodic checker to find overdue DISPATCHED jobs.</li>
 *   <li><b>idx_status_nextAttemptAt</b>: { status: 1, nextAttemptAt: 1 }
 *       <br/>Used by the recovery pass to claim PENDING/RETRYING jobs due for publishing.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.relay_jobs.createIndex({ status: 1, ackDeadline: 1 }, { name: "idx_status_ackDeadline" });
 * db.relay_jobs.createIndex({ status: 1, nextAttemptAt: 1 }, { name: "idx_status_nextAttemptAt" });
 * </pre>
 */
public class RelayMongoIndexConfig {

    public static final String IDX_STATUS_ACK_DEADLINE = "idx_status_ackDeadline";
    public static final String IDX_STATUS_NEXT_ATTEMPT = "idx_status_nextAttemptAt";

    private final MongoTemplate mongoTemplate;

    public RelayMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Create the required indexes. Idempotent.
     */
    public void ensureIndexes() {
        IndexOperations ops = mongoTemplate.indexOps(JobDocument.class);
        ops.createIndex(overdueIndex());
        ops.createIndex(dispatchableIndex());
    }

    /**
     * Keys: status ASC, ackDeadline ASC
     */
    public static Index overdueIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("ackDeadline", Sort.Direction.ASC)
                .named(IDX_STATUS_ACK_DEADLINE);
    }

    /**
     * Keys: status ASC, nextAttemptAt ASC
     */
    public static Index dispatchableIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("nextAttemptAt", Sort.Direction.ASC)
                .named(IDX_STATUS_NEXT_ATTEMPT);
    }
}
