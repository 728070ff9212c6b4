package com.jobpulse.ingestion.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobpulse.common.EventRejectedException;
import com.jobpulse.domain.JobResult;
import com.jobpulse.ingestion.event.ClassifiedEvent;
import com.jobpulse.ingestion.event.EventKind;
import com.jobpulse.ingestion.event.JobEndEvent;
import com.jobpulse.ingestion.event.JobStartEvent;
import com.jobpulse.ingestion.event.LifecycleEvent;
import com.jobpulse.ingestion.event.TaskEndEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a raw event envelope into a typed {@link LifecycleEvent} plus its idempotency key.
 * Fails with UNRECOGNIZED_EVENT_KIND for an unknown "event" value and MALFORMED_EVENT for missing or mistyped
 * required fields.
 */
@Component
@RequiredArgsConstructor
public class EventClassifier {

    static final String EVENT = "event";
    static final String JOB_ID = "job_id";
    static final String EVENT_ID = "event_id";
    static final String TIMESTAMP = "timestamp";
    static final String COMPLETION_TIME = "completion_time";
    static final String USER = "user";
    static final String TASK_ID = "task_id";
    static final String DURATION_MS = "duration_ms";
    static final String SUCCESSFUL = "successful";
    static final String JOB_RESULT = "job_result";

    private static final Set<String> SUCCESS_RESULTS = Set.of("jobsucceeded", "succeeded", "success");

    private final ObjectMapper objectMapper;

    public ClassifiedEvent classify(String payloadJson) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(payloadJson);
        } catch (JsonProcessingException e) {
            throw EventRejectedException.malformed("Envelope is not valid JSON: " + e.getOriginalMessage());
        }
        return classify(envelope);
    }

    public ClassifiedEvent classify(JsonNode envelope) {
        if (envelope == null || !envelope.isObject()) {
            throw EventRejectedException.malformed("Envelope must be a JSON object");
        }
        String discriminator = requiredText(envelope, EVENT);
        EventKind kind = EventKind.fromDiscriminator(discriminator)
                .orElseThrow(() -> EventRejectedException.unrecognized(discriminator));
        String jobId = requiredId(envelope, JOB_ID);

        LifecycleEvent event = switch (kind) {
            case JOB_START -> new JobStartEvent(jobId, requiredTimestamp(envelope, TIMESTAMP), requiredText(envelope, USER));
            case TASK_END -> new TaskEndEvent(
                    jobId,
                    requiredTimestamp(envelope, TIMESTAMP),
                    requiredId(envelope, TASK_ID),
                    requiredLong(envelope, DURATION_MS),
                    requiredBoolean(envelope, SUCCESSFUL));
            case JOB_END -> new JobEndEvent(jobId, completionTime(envelope), jobResult(envelope));
        };
        String explicitId = envelope.hasNonNull(EVENT_ID) ? envelope.get(EVENT_ID).asText() : null;
        return new ClassifiedEvent(event, IdempotencyKeys.of(event, explicitId));
    }

    private static Instant completionTime(JsonNode envelope) {
        if (envelope.hasNonNull(COMPLETION_TIME)) {
            return requiredTimestamp(envelope, COMPLETION_TIME);
        }
        return requiredTimestamp(envelope, TIMESTAMP);
    }

    private static JobResult jobResult(JsonNode envelope) {
        String value = requiredText(envelope, JOB_RESULT);
        return SUCCESS_RESULTS.contains(value.toLowerCase(Locale.ROOT)) ? JobResult.SUCCEEDED : JobResult.FAILED;
    }

    private static String requiredText(JsonNode envelope, String field) {
        JsonNode node = envelope.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw EventRejectedException.malformed("Missing or non-text field: " + field);
        }
        return node.asText().trim();
    }

    /** Identifiers may be sent as text or integers. */
    private static String requiredId(JsonNode envelope, String field) {
        JsonNode node = envelope.get(field);
        if (node != null && node.isIntegralNumber()) {
            return node.asText();
        }
        return requiredText(envelope, field);
    }

    private static Instant requiredTimestamp(JsonNode envelope, String field) {
        return EventTimestamps.parse(envelope.get(field))
                .orElseThrow(() -> EventRejectedException.malformed("Missing or unparseable timestamp: " + field));
    }

    private static long requiredLong(JsonNode envelope, String field) {
        JsonNode node = envelope.get(field);
        if (node == null || !node.isIntegralNumber() || !node.canConvertToLong()) {
            throw EventRejectedException.malformed("Missing or non-integer field: " + field);
        }
        return node.asLong();
    }

    private static boolean requiredBoolean(JsonNode envelope, String field) {
        JsonNode node = envelope.get(field);
        if (node == null || !node.isBoolean()) {
            throw EventRejectedException.malformed("Missing or non-boolean field: " + field);
        }
        return node.asBoolean();
    }
}
