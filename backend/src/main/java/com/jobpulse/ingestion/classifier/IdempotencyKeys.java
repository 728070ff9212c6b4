package com.jobpulse.ingestion.classifier;

import com.jobpulse.ingestion.event.JobEndEvent;
import com.jobpulse.ingestion.event.JobStartEvent;
import com.jobpulse.ingestion.event.LifecycleEvent;
import com.jobpulse.ingestion.event.TaskEndEvent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable event fingerprint: SHA-256 over kind, jobId, taskId (TaskEnd only) and either the envelope's explicit
 * event_id or the typed content. Computed from typed fields, so JSON key order and formatting do not matter.
 */
public final class IdempotencyKeys {

    private static final char SEP = '\u001f';

    private IdempotencyKeys() {
    }

    public static String of(LifecycleEvent event, String explicitEventId) {
        StringBuilder sb = new StringBuilder()
                .append(event.kind().name()).append(SEP)
                .append(event.jobId()).append(SEP);
        if (event instanceof TaskEndEvent task) {
            sb.append(task.taskId());
        }
        sb.append(SEP);
        if (explicitEventId != null && !explicitEventId.isBlank()) {
            sb.append("id:").append(explicitEventId.trim());
        } else {
            sb.append("content:").append(content(event));
        }
        return sha256Hex(sb.toString());
    }

    private static String content(LifecycleEvent event) {
        String ts = String.valueOf(event.timestamp());
        if (event instanceof JobStartEvent start) {
            return ts + SEP + start.user();
        }
        if (event instanceof TaskEndEvent task) {
            return ts + SEP + task.durationMs() + SEP + task.successful();
        }
        if (event instanceof JobEndEvent end) {
            return ts + SEP + end.result();
        }
        throw new IllegalArgumentException("Unsupported event type: " + event.getClass().getName());
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
