package com.jobpulse.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Storage-transient retry for reconciliation (exponential backoff ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "jobpulse.ingestion.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Total attempts including the first one. Default 5. */
    private int maxAttempts = 5;

    /** Delay before the first retry in ms. Default 200. */
    private long baseDelayMs = 200L;

    /** Backoff multiplier per attempt. Default 2.0. */
    private double multiplier = 2.0;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;
}
