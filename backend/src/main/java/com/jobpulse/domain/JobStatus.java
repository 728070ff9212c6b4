package com.jobpulse.domain;

/**
 * Derived from {@link JobRecord#getResult()} and presence of endTime; never stored.
 */
public enum JobStatus {
    PENDING,
    SUCCESS,
    FAILURE;

    public static JobStatus of(JobRecord job) {
        if (job.getEndTime() == null || job.getResult() == null) {
            return PENDING;
        }
        return switch (job.getResult()) {
            case SUCCEEDED -> SUCCESS;
            case FAILED -> FAILURE;
            case UNKNOWN -> PENDING;
        };
    }
}
