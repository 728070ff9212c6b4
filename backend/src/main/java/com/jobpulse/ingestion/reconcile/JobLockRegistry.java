package com.jobpulse.ingestion.reconcile;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per jobId within this process. Values are weakly held: a lock lives as long as some thread references it,
 * so idle jobs do not accumulate locks. Cross-process exclusion comes from the job version check and unique indexes.
 */
@Component
public class JobLockRegistry {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(jobId -> new ReentrantLock());

    public ReentrantLock lockFor(String jobId) {
        return locks.get(jobId);
    }
}
