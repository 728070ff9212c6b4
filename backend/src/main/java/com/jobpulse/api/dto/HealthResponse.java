package com.jobpulse.api.dto;

public record HealthResponse(String status) {
}
