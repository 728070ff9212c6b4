package com.jobpulse.analytics;

import java.time.LocalDate;
import java.util.List;

/**
 * Fleet-wide analytics for jobs started on one UTC day. Pending jobs are not part of it.
 * avgSuccessRate is the unweighted mean of per-job success rates.
 */
public record DailySummary(LocalDate date,
                           long totalJobs,
                           long totalTasks,
                           long failedTasks,
                           double avgSuccessRate,
                           double avgDurationSeconds,
                           List<JobSummary> jobs) {

    public static DailySummary empty(LocalDate date) {
        return new DailySummary(date, 0, 0, 0, 0.0, 0.0, List.of());
    }
}
