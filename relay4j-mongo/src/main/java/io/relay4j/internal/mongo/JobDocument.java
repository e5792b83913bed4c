package io.relay4j.internal.mongo;

import io.relay4j.core.Job;
import io.relay4j.core.JobStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for tracked jobs.
 */
@Document(collection = JobDocument.COLLECTION)
public class JobDocument {

    public static final String COLLECTION = "relay_jobs";

    @Id
    private String id;

    private String jobType;
    private Map<String, Object> payload;

    private JobStatus status;
    private int attemptCount;
    private int maxAttempts;
    private long timeoutMillis;

    private Instant dispatchedAt;

    @Field(write = Field.Write.ALWAYS)
    private Instant ackDeadline;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextAttemptAt;

    private Map<String, Object> result;
    private String errorDetail;
    private Instant completedAt;
    private Long executionDurationMs;

    private Instant createdAt;
    private Instant updatedAt;
    private long version;

    public JobDocument() {
    }

    public static JobDocument from(Job job) {
        JobDocument doc = new JobDocument();
        doc.setId(job.id());
        doc.setJobType(job.jobType());
        doc.setPayload(job.payload());
        doc.setStatus(job.status());
        doc.setAttemptCount(job.attemptCount());
        doc.setMaxAttempts(job.maxAttempts());
        doc.setTimeoutMillis(job.timeout().toMillis());
        doc.setDispatchedAt(job.dispatchedAt());
        doc.setAckDeadline(job.ackDeadline());
        doc.setNextAttemptAt(job.nextAttemptAt());
        doc.setResult(job.result());
        doc.setErrorDetail(job.errorDetail());
        doc.setCompletedAt(job.completedAt());
        doc.setExecutionDurationMs(job.executionDurationMs());
        doc.setCreatedAt(job.createdAt());
        doc.setUpdatedAt(job.updatedAt());
        doc.setVersion(job.version());
        return doc;
    }

    public Job toJob() {
        return new Job(
                id,
                jobType,
                payload,
                status,
                attemptCount,
                maxAttempts,
                Duration.ofMillis(timeoutMillis),
                dispatchedAt,
                ackDeadline,
                nextAttemptAt,
                result,
                errorDetail,
                completedAt,
                executionDurationMs,
                createdAt,
                updatedAt,
                version
        );
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getJobType() {
        return jobType;
    }

    public void setJobType(String jobType) {
        this.jobType = jobType;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        this.payload = payload;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public void setAttemptCount(int attemptCount) {
        this.attemptCount = attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public void setTimeoutMillis(long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public void setDispatchedAt(Instant dispatchedAt) {
        this.dispatchedAt = dispatchedAt;
    }

    public Instant getAckDeadline() {
        return ackDeadline;
    }

    public void setAckDeadline(Instant ackDeadline) {
        this.ackDeadline = ackDeadline;
    }

    public Instant getNextAttemptAt() {
        return nextAttemptAt;
    }

    public void setNextAttemptAt(Instant nextAttemptAt) {
        this.nextAttemptAt = nextAttemptAt;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public void setResult(Map<String, Object> result) {
        this.result = result;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public void setErrorDetail(String errorDetail) {
        this.errorDetail = errorDetail;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Long getExecutionDurationMs() {
        return executionDurationMs;
    }

    public void setExecutionDurationMs(Long executionDurationMs) {
        this.executionDurationMs = executionDurationMs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }
}
