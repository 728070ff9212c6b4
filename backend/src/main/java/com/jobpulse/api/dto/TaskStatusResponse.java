package com.jobpulse.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * GET /tasks/{taskId}: status is processing, success or failed. result is set on success
 * (a {@link JobSummaryResponse} or a {@link JobProcessingResponse}); error and message on failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatusResponse(String taskId, String status, Object result, String error, String message) {

    public static TaskStatusResponse processing(String taskId) {
        return new TaskStatusResponse(taskId, "processing", null, null, null);
    }

    public static TaskStatusResponse success(String taskId, Object result) {
        return new TaskStatusResponse(taskId, "success", result, null, null);
    }

    public static TaskStatusResponse failed(String taskId, String error, String message) {
        return new TaskStatusResponse(taskId, "failed", null, error, message);
    }
}
