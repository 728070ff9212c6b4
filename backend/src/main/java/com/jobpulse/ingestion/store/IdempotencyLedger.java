package com.jobpulse.ingestion.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.jobpulse.config.CaffeineConfig;
import com.jobpulse.domain.AppliedEvent;
import com.jobpulse.domain.AppliedEventRepository;
import com.jobpulse.ingestion.event.ClassifiedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Records which event keys have been reconciled. Marked only after a successful merge, so a crash between merge
 * and mark leads to a harmless re-merge rather than a lost event. Positive answers are cached in-process.
 */
@Service
@Slf4j
public class IdempotencyLedger {

    private final AppliedEventRepository repository;
    private final Cache<String, Boolean> appliedKeyCache;

    public IdempotencyLedger(AppliedEventRepository repository,
                             @Qualifier(CaffeineConfig.APPLIED_EVENT_KEY_CACHE) Cache<String, Boolean> appliedKeyCache) {
        this.repository = repository;
        this.appliedKeyCache = appliedKeyCache;
    }

    public boolean hasBeenApplied(String eventKey) {
        if (appliedKeyCache.getIfPresent(eventKey) != null) {
            return true;
        }
        boolean applied = repository.existsById(eventKey);
        if (applied) {
            appliedKeyCache.put(eventKey, Boolean.TRUE);
        }
        return applied;
    }

    public void markApplied(ClassifiedEvent event) {
        String key = event.idempotencyKey();
        try {
            repository.insert(new AppliedEvent(key, event.kind().name(), event.jobId(), Instant.now()));
        } catch (DuplicateKeyException e) {
            log.debug("Event key {} already marked applied", key);
        }
        appliedKeyCache.put(key, Boolean.TRUE);
    }
}
