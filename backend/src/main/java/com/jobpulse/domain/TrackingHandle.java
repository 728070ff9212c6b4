package com.jobpulse.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Correlates one submitted envelope with its asynchronous reconciliation outcome. Created PENDING at submission
 * (or FAILED when classification already rejected it) and completed exactly once via
 * {@link TrackingHandleRepositoryCustom#completeIfPending}. Not part of job analytics.
 */
@Document(collection = "tracking_handles")
@CompoundIndex(name = "status_created", def = "{'status': 1, 'createdAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TrackingHandle {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private HandleState status;
    /** Error kind name when FAILED. */
    private String failureReason;
    private String failureMessage;
    private String eventKind;
    private String jobId;
    private String eventKey;
    /** Submitted envelope as JSON text; re-read by the worker and by redelivery. */
    private String payload;
    private int dispatchCount;
    private Instant createdAt;
    private Instant lastDispatchedAt;
    private Instant completedAt;

    public enum HandleState {
        PENDING,
        SUCCEEDED,
        FAILED
    }
}
