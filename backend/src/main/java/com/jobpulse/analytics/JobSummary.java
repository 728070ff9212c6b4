package com.jobpulse.analytics;

import com.jobpulse.domain.JobStatus;

import java.time.Instant;

/**
 * Analytics of one completed job. successRate is a fraction in [0, 1]; 0.0 when the job has no tasks.
 */
public record JobSummary(String jobId,
                         String user,
                         Instant startTime,
                         Instant endTime,
                         JobStatus status,
                         long totalTasks,
                         long failedTasks,
                         double successRate,
                         long durationSeconds) {
}
