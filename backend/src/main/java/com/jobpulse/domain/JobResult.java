package com.jobpulse.domain;

public enum JobResult {
    UNKNOWN,
    SUCCEEDED,
    FAILED
}
