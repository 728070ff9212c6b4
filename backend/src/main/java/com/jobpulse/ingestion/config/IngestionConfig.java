package com.jobpulse.ingestion.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Ingestion pipeline wiring: properties and the storage retry used by ReconciliationWorker.
 */
@Configuration
@EnableConfigurationProperties({ IngestionRetryProperties.class, RedeliveryProperties.class, ReconcileProperties.class })
public class IngestionConfig {

    public static final String STORAGE_RETRY = "storageRetry";

    /**
     * Retries only storage transients; EventRejectedException and programming errors fail on first attempt.
     */
    @Bean(name = STORAGE_RETRY)
    public Retry storageRetry(IngestionRetryProperties properties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        Math.max(1L, properties.getBaseDelayMs()),
                        properties.getMultiplier(),
                        properties.getJitterFactor()))
                .retryOnException(IngestionConfig::isStorageTransient)
                .build();
        return Retry.of(STORAGE_RETRY, config);
    }

    public static boolean isStorageTransient(Throwable t) {
        return t instanceof TransientDataAccessException || t instanceof DataAccessResourceFailureException;
    }
}
