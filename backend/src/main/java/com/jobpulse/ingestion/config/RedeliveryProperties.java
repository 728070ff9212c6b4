package com.jobpulse.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sweep that re-dispatches tracking handles left PENDING (e.g. worker crashed mid-reconciliation).
 */
@ConfigurationProperties(prefix = "jobpulse.ingestion.redelivery")
@NoArgsConstructor
@Getter
@Setter
public class RedeliveryProperties {

    private boolean enabled = true;

    /** How often (ms) the sweep runs. */
    private long intervalMs = 60_000;

    /** A handle is stale when its last dispatch is older than this. */
    private long staleAfterMs = 300_000;

    /** Max handles re-dispatched per sweep. */
    private int batchSize = 100;
}
