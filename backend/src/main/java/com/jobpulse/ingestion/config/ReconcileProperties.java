package com.jobpulse.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "jobpulse.ingestion.reconcile")
@NoArgsConstructor
@Getter
@Setter
public class ReconcileProperties {

    /**
     * Re-read and re-merge attempts when a concurrent writer (another process) wins the version check
     * or the unique index on a job. Default 5.
     */
    private int mergeMaxAttempts = 5;
}
