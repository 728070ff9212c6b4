package com.jobpulse.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine in-process caches.
 * appliedEventKeyCache only ever holds positive answers: an applied key never becomes un-applied.
 */
@Configuration
public class CaffeineConfig {

    public static final String APPLIED_EVENT_KEY_CACHE = "appliedEventKeyCache";

    @Bean(name = APPLIED_EVENT_KEY_CACHE)
    public Cache<String, Boolean> appliedEventKeyCache(
            @Value("${jobpulse.cache.applied-event-keys.maximum-size:100000}") long maximumSize) {
        return Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }
}
