package io.relay4j.internal.amqp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relay4j.core.DispatchEnvelope;
import io.relay4j.core.Outcome;
import io.relay4j.core.ResultEvent;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;

/**
 * JSON wire format of dispatch and result messages.
 *
 * <p>Dispatch:
 * <pre>
 * { "event_type": "jobs.execute", "job_id": "...", "job_type": "...", "payload": {...},
 *   "attempt_count": 1, "timeout_seconds": 300, "sent_at": "2026-01-01T00:00:00Z" }
 * </pre>
 *
 * <p>Result, either form:
 * <pre>
 * { "job_id": "...", "outcome": "success" | "failure", "error_detail": "...", "emitted_at": "..." }
 * { "event_type": "jobs.completed", "job_id": "...", "completed_at": "...", "result": {...},
 *   "execution_duration_ms": 120 }
 * { "event_type": "jobs.failed", "job_id": "...", "failed_at": "...", "error_message": "...",
 *   "should_retry": true }
 * </pre>
 */
public class RelayMessageCodec {

    public static final String EXECUTE_EVENT = "jobs.execute";
    public static final String COMPLETED_EVENT = "jobs.completed";
    public static final String FAILED_EVENT = "jobs.failed";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public RelayMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public byte[] encodeDispatch(DispatchEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope must not be null");

        ObjectNode root = objectMapper.createObjectNode();
        root.put("event_type", EXECUTE_EVENT);
        root.put("job_id", envelope.jobId());
        root.put("job_type", envelope.jobType());
        root.set("payload", objectMapper.valueToTree(envelope.payload()));
        root.put("attempt_count", envelope.attemptCount());
        root.put("timeout_seconds", envelope.timeout().toSeconds());
        root.put("sent_at", envelope.sentAt().toString());

        try {
            return objectMapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload of job " + envelope.jobId() + " is not serializable", e);
        }
    }

    public ResultEvent decodeResult(byte[] body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new MessageDecodeException("result message is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MessageDecodeException("result message must be a JSON object");
        }

        String jobId = text(root, "job_id");
        if (jobId == null || jobId.isBlank()) {
            throw new MessageDecodeException("result message has no job_id");
        }

        String eventType = text(root, "event_type");
        Outcome outcome = outcome(root, eventType);

        String errorDetail = firstText(root, "error_detail", "error_message");
        Instant emittedAt = timestamp(root, outcome == Outcome.SUCCESS
                ? new String[]{"emitted_at", "completed_at"}
                : new String[]{"emitted_at", "failed_at"});

        Map<String, Object> result = null;
        JsonNode resultNode = root.get("result");
        if (resultNode != null && resultNode.isObject()) {
            result = objectMapper.convertValue(resultNode, MAP_TYPE);
        }

        Long durationMs = null;
        JsonNode durationNode = root.get("execution_duration_ms");
        if (durationNode != null && durationNode.canConvertToLong()) {
            durationMs = durationNode.asLong();
        }

        // jobs.failed events ask for a retry unless they say otherwise
        boolean retryDefault = FAILED_EVENT.equals(eventType);
        JsonNode retryNode = root.get("should_retry");
        boolean retryRequested = outcome == Outcome.FAILURE
                && (retryNode != null && retryNode.isBoolean() ? retryNode.booleanValue() : retryDefault);

        return new ResultEvent(jobId, outcome, errorDetail, emittedAt, result, durationMs, retryRequested);
    }

    private static Outcome outcome(JsonNode root, String eventType) {
        String wire = text(root, "outcome");
        if (wire != null) {
            try {
                return Outcome.fromWire(wire);
            } catch (IllegalArgumentException e) {
                throw new MessageDecodeException(e.getMessage(), e);
            }
        }
        if (COMPLETED_EVENT.equals(eventType)) {
            return Outcome.SUCCESS;
        }
        if (FAILED_EVENT.equals(eventType)) {
            return Outcome.FAILURE;
        }
        throw new MessageDecodeException("result message has neither outcome nor a known event_type: " + eventType);
    }

    private static Instant timestamp(JsonNode root, String[] fields) {
        String raw = firstText(root, fields);
        if (raw == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(raw);
            } catch (DateTimeParseException notInstant) {
                throw new MessageDecodeException("unparseable timestamp: " + raw, notInstant);
            }
        }
    }

    private static String firstText(JsonNode root, String... fields) {
        for (String f : fields) {
            String v = text(root, f);
            if (v != null) {
                return v;
            }
        }
        return null;
    }

    private static String text(JsonNode root, String field) {
        JsonNode n = root.get(field);
        return n == null || n.isNull() ? null : n.asText();
    }
}
