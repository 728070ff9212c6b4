package com.jobpulse.ingestion.pipeline;

import com.jobpulse.common.ErrorKind;
import com.jobpulse.common.EventRejectedException;
import com.jobpulse.config.AsyncConfig;
import com.jobpulse.domain.EventSubmittedEvent;
import com.jobpulse.domain.ReconciliationCompleteEvent;
import com.jobpulse.domain.TrackingHandle;
import com.jobpulse.domain.TrackingHandleRepository;
import com.jobpulse.ingestion.classifier.EventClassifier;
import com.jobpulse.ingestion.config.IngestionConfig;
import com.jobpulse.ingestion.event.ClassifiedEvent;
import com.jobpulse.ingestion.reconcile.JobStateReconciler;
import com.jobpulse.ingestion.reconcile.ReconcileResult;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Consumes EventSubmittedEvent on reconcile-executor: classifies the stored envelope, reconciles it with storage
 * retries, completes the handle (SUCCEEDED / FAILED(kind)) and publishes ReconciliationCompleteEvent.
 */
@Service
@Slf4j
public class ReconciliationWorker {

    private final TrackingHandleRepository trackingHandleRepository;
    private final EventClassifier eventClassifier;
    private final JobStateReconciler jobStateReconciler;
    private final Retry storageRetry;
    private final ApplicationEventPublisher applicationEventPublisher;

    public ReconciliationWorker(TrackingHandleRepository trackingHandleRepository,
                                EventClassifier eventClassifier,
                                JobStateReconciler jobStateReconciler,
                                @Qualifier(IngestionConfig.STORAGE_RETRY) Retry storageRetry,
                                ApplicationEventPublisher applicationEventPublisher) {
        this.trackingHandleRepository = trackingHandleRepository;
        this.eventClassifier = eventClassifier;
        this.jobStateReconciler = jobStateReconciler;
        this.storageRetry = storageRetry;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @EventListener
    @Async(AsyncConfig.RECONCILE_EXECUTOR)
    public void onEventSubmitted(EventSubmittedEvent event) {
        process(event.handleId());
    }

    public void process(String handleId) {
        TrackingHandle handle;
        try {
            handle = storageRetry.executeSupplier(() -> trackingHandleRepository.findById(handleId).orElse(null));
        } catch (RuntimeException e) {
            log.error("Handle {} could not be loaded, left for redelivery: {}", handleId, e.getMessage(), e);
            return;
        }
        if (handle == null) {
            log.warn("Tracking handle not found: {}", handleId);
            return;
        }
        if (handle.getStatus() != TrackingHandle.HandleState.PENDING) {
            log.debug("Handle {} already completed: {}", handleId, handle.getStatus());
            return;
        }

        try {
            ClassifiedEvent classified = eventClassifier.classify(handle.getPayload());
            ReconcileResult result = storageRetry.executeSupplier(() -> jobStateReconciler.apply(classified));
            complete(handle, TrackingHandle.HandleState.SUCCEEDED, null, null);
            log.info("Handle {} SUCCEEDED: {} job {} -> {}", handleId, result.kind(), result.jobId(), result.effect());
        } catch (EventRejectedException e) {
            log.warn("Handle {} rejected: {} {}", handleId, e.getErrorKind(), e.getMessage());
            complete(handle, TrackingHandle.HandleState.FAILED, e.getErrorKind(), e.getMessage());
        } catch (RuntimeException e) {
            if (IngestionConfig.isStorageTransient(e)) {
                log.error("Handle {} storage unavailable after {} attempts: {}",
                        handleId, storageRetry.getRetryConfig().getMaxAttempts(), e.getMessage());
                complete(handle, TrackingHandle.HandleState.FAILED, ErrorKind.STORAGE_UNAVAILABLE, e.getMessage());
            } else {
                log.error("Handle {} failed: {}", handleId, e.getMessage(), e);
                complete(handle, TrackingHandle.HandleState.FAILED, ErrorKind.UNEXPECTED_FAILURE, e.getMessage());
            }
        }
    }

    private void complete(TrackingHandle handle, TrackingHandle.HandleState status, ErrorKind reason, String message) {
        String reasonName = reason != null ? reason.name() : null;
        boolean updated;
        try {
            updated = storageRetry.executeSupplier(
                    () -> trackingHandleRepository.completeIfPending(handle.getId(), status, reasonName, message));
        } catch (RuntimeException e) {
            log.error("Handle {} could not be completed, left PENDING for redelivery: {}", handle.getId(), e.getMessage(), e);
            return;
        }
        if (!updated) {
            log.debug("Handle {} was completed concurrently", handle.getId());
            return;
        }
        applicationEventPublisher.publishEvent(new ReconciliationCompleteEvent(handle.getId(), handle.getJobId(), status));
    }
}
