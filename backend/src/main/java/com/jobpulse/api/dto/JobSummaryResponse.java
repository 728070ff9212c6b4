package com.jobpulse.api.dto;

import com.jobpulse.analytics.JobSummary;

import java.time.Instant;
import java.util.Locale;

public record JobSummaryResponse(String jobId,
                                 String user,
                                 Instant startTime,
                                 Instant endTime,
                                 String status,
                                 long totalTasks,
                                 long failedTasks,
                                 double successRate,
                                 long durationSeconds) {

    public static JobSummaryResponse from(JobSummary s) {
        return new JobSummaryResponse(
                s.jobId(),
                s.user(),
                s.startTime(),
                s.endTime(),
                s.status().name().toLowerCase(Locale.ROOT),
                s.totalTasks(),
                s.failedTasks(),
                s.successRate(),
                s.durationSeconds());
    }
}
