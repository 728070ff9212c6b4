package com.jobpulse.api.dto;

import com.jobpulse.analytics.DailySummary;

import java.time.LocalDate;
import java.util.List;

public record DailySummaryResponse(LocalDate date, Totals summary, List<JobSummaryResponse> jobs) {

    public record Totals(long totalJobs, long totalTasks, long failedTasks, double avgSuccessRate, double avgDurationSeconds) {
    }

    public static DailySummaryResponse from(DailySummary s) {
        return new DailySummaryResponse(
                s.date(),
                new Totals(s.totalJobs(), s.totalTasks(), s.failedTasks(), s.avgSuccessRate(), s.avgDurationSeconds()),
                s.jobs().stream().map(JobSummaryResponse::from).toList());
    }
}
