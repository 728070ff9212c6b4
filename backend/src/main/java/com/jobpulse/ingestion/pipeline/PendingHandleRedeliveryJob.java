package com.jobpulse.ingestion.pipeline;

import com.jobpulse.domain.EventSubmittedEvent;
import com.jobpulse.domain.TrackingHandle;
import com.jobpulse.domain.TrackingHandleRepository;
import com.jobpulse.ingestion.config.RedeliveryProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Re-dispatches handles still PENDING long after their last dispatch (worker crash, lost async task).
 * Safe because reconciliation is idempotent and handle completion is conditional on PENDING.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PendingHandleRedeliveryJob {

    private final TrackingHandleRepository trackingHandleRepository;
    private final RedeliveryProperties redeliveryProperties;
    private final ApplicationEventPublisher applicationEventPublisher;

    @Scheduled(fixedDelayString = "${jobpulse.ingestion.redelivery.interval-ms:60000}",
            initialDelayString = "${jobpulse.ingestion.redelivery.interval-ms:60000}")
    public void runScheduled() {
        if (!redeliveryProperties.isEnabled()) {
            return;
        }
        redeliverStale();
    }

    /**
     * @return number of handles re-dispatched
     */
    public int redeliverStale() {
        Instant cutoff = Instant.now().minusMillis(redeliveryProperties.getStaleAfterMs());
        List<TrackingHandle> stale = trackingHandleRepository.findByStatusAndLastDispatchedAtBeforeOrderByCreatedAtAsc(
                TrackingHandle.HandleState.PENDING, cutoff, PageRequest.of(0, Math.max(1, redeliveryProperties.getBatchSize())));
        int dispatched = 0;
        for (TrackingHandle handle : stale) {
            if (trackingHandleRepository.markDispatched(handle.getId())) {
                applicationEventPublisher.publishEvent(new EventSubmittedEvent(handle.getId()));
                dispatched++;
            }
        }
        if (dispatched > 0) {
            log.info("Re-dispatched {} stale PENDING handles (cutoff {})", dispatched, cutoff);
        }
        return dispatched;
    }
}
