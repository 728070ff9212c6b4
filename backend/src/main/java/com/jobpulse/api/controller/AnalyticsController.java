package com.jobpulse.api.controller;

import com.jobpulse.analytics.JobAnalyticsService;
import com.jobpulse.api.dto.DailySummaryResponse;
import com.jobpulse.api.dto.ErrorBody;
import com.jobpulse.api.dto.JobProcessingResponse;
import com.jobpulse.api.dto.JobSummaryResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * GET /jobs/{jobId}, GET /summary?date=YYYY-MM-DD.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalyticsController {

    private final JobAnalyticsService jobAnalyticsService;

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<?> getJob(@PathVariable String jobId) {
        return jobAnalyticsService.jobSummary(jobId)
                .<ResponseEntity<?>>map(r -> r.isPending()
                        ? ResponseEntity.accepted().body(JobProcessingResponse.of(jobId))
                        : ResponseEntity.ok(JobSummaryResponse.from(r.getSummary())))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of("JOB_NOT_FOUND", "No events recorded for job " + jobId)));
    }

    @GetMapping("/summary")
    public ResponseEntity<?> getDailySummary(@RequestParam String date) {
        LocalDate day;
        try {
            day = LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_DATE", "Invalid date format. Use YYYY-MM-DD"));
        }
        return ResponseEntity.ok(DailySummaryResponse.from(jobAnalyticsService.dailySummary(day)));
    }
}
