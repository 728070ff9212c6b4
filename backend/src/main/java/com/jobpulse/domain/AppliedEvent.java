package com.jobpulse.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Idempotency record: an event key that has been successfully reconciled. Written once, never updated.
 * There is no expiry, so the collection grows with every distinct event.
 */
@Document(collection = "applied_events")
@NoArgsConstructor
@Getter
@Setter
public class AppliedEvent {

    @Id
    private String eventKey;
    private String eventKind;
    private String jobId;
    private Instant appliedAt;

    public AppliedEvent(String eventKey, String eventKind, String jobId, Instant appliedAt) {
        this.eventKey = eventKey;
        this.eventKind = eventKind;
        this.jobId = jobId;
        this.appliedAt = appliedAt;
    }
}
