package com.jobpulse.api.controller;

import com.jobpulse.analytics.JobAnalyticsService;
import com.jobpulse.api.dto.ErrorBody;
import com.jobpulse.api.dto.JobProcessingResponse;
import com.jobpulse.api.dto.JobSummaryResponse;
import com.jobpulse.api.dto.TaskStatusResponse;
import com.jobpulse.domain.TrackingHandle;
import com.jobpulse.ingestion.pipeline.ExecutionBoundary;
import com.jobpulse.ingestion.pipeline.HandleStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /tasks/{taskId}: polls a tracking handle. 202 while processing, 200 once completed.
 */
@RestController
@RequestMapping("/api/v1/tasks")
@RequiredArgsConstructor
public class TaskStatusController {

    private final ExecutionBoundary executionBoundary;
    private final JobAnalyticsService jobAnalyticsService;

    @GetMapping("/{taskId}")
    public ResponseEntity<?> getStatus(@PathVariable String taskId) {
        return executionBoundary.poll(taskId)
                .<ResponseEntity<?>>map(this::toResponse)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of("HANDLE_NOT_FOUND", "Unknown task id: " + taskId)));
    }

    private ResponseEntity<?> toResponse(HandleStatus status) {
        if (status.isPending()) {
            return ResponseEntity.accepted().body(TaskStatusResponse.processing(status.handleId()));
        }
        if (status.state() == TrackingHandle.HandleState.FAILED) {
            return ResponseEntity.ok(TaskStatusResponse.failed(status.handleId(), status.failureReason(), status.failureMessage()));
        }
        Object result = jobAnalyticsService.jobSummary(status.jobId())
                .filter(r -> !r.isPending())
                .<Object>map(r -> JobSummaryResponse.from(r.getSummary()))
                .orElseGet(() -> JobProcessingResponse.of(status.jobId()));
        return ResponseEntity.ok(TaskStatusResponse.success(status.handleId(), result));
    }
}
