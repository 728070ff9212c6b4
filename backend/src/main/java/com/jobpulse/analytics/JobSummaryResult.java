package com.jobpulse.analytics;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of {@link JobAnalyticsService#jobSummary}: either pending (start or end not yet reconciled) or a summary.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class JobSummaryResult {

    private final String jobId;
    private final JobSummary summary;

    public static JobSummaryResult pending(String jobId) {
        return new JobSummaryResult(jobId, null);
    }

    public static JobSummaryResult of(JobSummary summary) {
        return new JobSummaryResult(summary.jobId(), summary);
    }

    public boolean isPending() {
        return summary == null;
    }
}
