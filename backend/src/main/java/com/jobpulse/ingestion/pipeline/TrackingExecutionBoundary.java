package com.jobpulse.ingestion.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.jobpulse.common.EventRejectedException;
import com.jobpulse.domain.EventSubmittedEvent;
import com.jobpulse.domain.TrackingHandle;
import com.jobpulse.domain.TrackingHandleRepository;
import com.jobpulse.ingestion.classifier.EventClassifier;
import com.jobpulse.ingestion.event.ClassifiedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Execution boundary backed by tracking_handles and the reconcile-executor pool. Submission persists the envelope
 * on a PENDING handle and publishes {@link EventSubmittedEvent}; ReconciliationWorker picks it up asynchronously.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingExecutionBoundary implements ExecutionBoundary {

    private final TrackingHandleRepository trackingHandleRepository;
    private final EventClassifier eventClassifier;
    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    public String submit(JsonNode envelope) {
        Instant now = Instant.now();
        TrackingHandle handle = new TrackingHandle();
        handle.setId(UUID.randomUUID().toString());
        handle.setPayload(envelope.toString());
        handle.setCreatedAt(now);
        try {
            ClassifiedEvent classified = eventClassifier.classify(envelope);
            handle.setEventKind(classified.kind().name());
            handle.setJobId(classified.jobId());
            handle.setEventKey(classified.idempotencyKey());
            handle.setStatus(TrackingHandle.HandleState.PENDING);
            handle.setDispatchCount(1);
            handle.setLastDispatchedAt(now);
        } catch (EventRejectedException e) {
            handle.setJobId(envelope.hasNonNull("job_id") ? envelope.get("job_id").asText() : null);
            handle.setStatus(TrackingHandle.HandleState.FAILED);
            handle.setFailureReason(e.getErrorKind().name());
            handle.setFailureMessage(e.getMessage());
            handle.setCompletedAt(now);
            log.warn("Event rejected at submission (handle {}): {} {}", handle.getId(), e.getErrorKind(), e.getMessage());
        }
        trackingHandleRepository.save(handle);
        if (handle.getStatus() == TrackingHandle.HandleState.PENDING) {
            try {
                applicationEventPublisher.publishEvent(new EventSubmittedEvent(handle.getId()));
                log.info("Submitted {} for job {} (handle {})", handle.getEventKind(), handle.getJobId(), handle.getId());
            } catch (TaskRejectedException e) {
                log.warn("Reconcile pool saturated, handle {} left PENDING for redelivery: {}", handle.getId(), e.getMessage());
            }
        }
        return handle.getId();
    }

    @Override
    public Optional<HandleStatus> poll(String handleId) {
        return trackingHandleRepository.findById(handleId).map(HandleStatus::of);
    }
}
