package com.jobpulse.analytics;

import com.jobpulse.domain.JobRecord;
import com.jobpulse.domain.JobRecordRepository;
import com.jobpulse.domain.JobResult;
import com.jobpulse.domain.JobStatus;
import com.jobpulse.domain.TaskOutcome;
import com.jobpulse.domain.TaskOutcomeRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobAnalyticsServiceTest {

    private static final LocalDate DAY = LocalDate.of(2025, 1, 15);
    private static final Instant T0 = Instant.parse("2025-01-15T10:00:00Z");

    @Mock
    JobRecordRepository jobRecordRepository;
    @Mock
    TaskOutcomeRepository taskOutcomeRepository;

    @InjectMocks
    JobAnalyticsService service;

    @Nested
    @DisplayName("jobSummary")
    class JobSummaryTests {

        @Test
        @DisplayName("completed job: duration, counts and success ratio")
        void completedJob() {
            when(jobRecordRepository.findByJobId("7")).thenReturn(Optional.of(job("7", T0, T0.plusSeconds(90), JobResult.FAILED)));
            when(taskOutcomeRepository.countByJobId("7")).thenReturn(4L);
            when(taskOutcomeRepository.countByJobIdAndSuccessfulFalse("7")).thenReturn(1L);

            JobSummary summary = service.jobSummary("7").orElseThrow().getSummary();

            assertThat(summary.status()).isEqualTo(JobStatus.FAILURE);
            assertThat(summary.durationSeconds()).isEqualTo(90);
            assertThat(summary.totalTasks()).isEqualTo(4);
            assertThat(summary.failedTasks()).isEqualTo(1);
            assertThat(summary.successRate()).isEqualTo(0.75);
        }

        @Test
        @DisplayName("zero tasks gives success rate 0.0")
        void zeroTasks() {
            when(jobRecordRepository.findByJobId("7")).thenReturn(Optional.of(job("7", T0, T0.plusSeconds(1), JobResult.SUCCEEDED)));
            when(taskOutcomeRepository.countByJobId("7")).thenReturn(0L);
            when(taskOutcomeRepository.countByJobIdAndSuccessfulFalse("7")).thenReturn(0L);

            assertThat(service.jobSummary("7").orElseThrow().getSummary().successRate()).isEqualTo(0.0);
        }

        @Test
        @DisplayName("missing start or end yields pending without reading tasks")
        void pending() {
            when(jobRecordRepository.findByJobId("99")).thenReturn(Optional.of(job("99", null, null, JobResult.UNKNOWN)));
            when(jobRecordRepository.findByJobId("98")).thenReturn(Optional.of(job("98", T0, null, JobResult.UNKNOWN)));
            when(jobRecordRepository.findByJobId("97")).thenReturn(Optional.of(job("97", null, T0, JobResult.SUCCEEDED)));

            assertThat(service.jobSummary("99")).hasValueSatisfying(r -> assertThat(r.isPending()).isTrue());
            assertThat(service.jobSummary("98")).hasValueSatisfying(r -> assertThat(r.isPending()).isTrue());
            assertThat(service.jobSummary("97")).hasValueSatisfying(r -> assertThat(r.isPending()).isTrue());
            verify(taskOutcomeRepository, never()).countByJobId("99");
        }

        @Test
        @DisplayName("duration truncates toward zero when the end precedes the start")
        void durationTruncatesTowardZero() {
            JobRecord halfSecondEarly = job("7", T0, T0.minusMillis(500), JobResult.SUCCEEDED);
            JobRecord oneAndAHalfEarly = job("8", T0, T0.minusMillis(1500), JobResult.SUCCEEDED);
            JobRecord oneAndAHalfLater = job("9", T0, T0.plusMillis(1500), JobResult.SUCCEEDED);

            assertThat(JobAnalyticsService.summarize(halfSecondEarly, 0, 0).durationSeconds()).isZero();
            assertThat(JobAnalyticsService.summarize(oneAndAHalfEarly, 0, 0).durationSeconds()).isEqualTo(-1);
            assertThat(JobAnalyticsService.summarize(oneAndAHalfLater, 0, 0).durationSeconds()).isEqualTo(1);
        }

        @Test
        void unknownJob() {
            when(jobRecordRepository.findByJobId("x")).thenReturn(Optional.empty());

            assertThat(service.jobSummary("x")).isEmpty();
        }
    }

    @Nested
    @DisplayName("dailySummary")
    class DailySummaryTests {

        @Test
        @DisplayName("average success rate is the unweighted mean of per-job rates")
        void unweightedMean() {
            when(jobRecordRepository.findByStartDateOrderByStartTimeAsc("2025-01-15")).thenReturn(List.of(
                    job("1", T0, T0.plusSeconds(100), JobResult.SUCCEEDED),
                    job("2", T0.plusSeconds(10), T0.plusSeconds(310), JobResult.FAILED)));
            when(taskOutcomeRepository.findByJobIdIn(anyCollection())).thenReturn(List.of(
                    task("1", "a", true),
                    task("2", "a", false),
                    task("2", "b", false),
                    task("2", "c", false)));

            DailySummary summary = service.dailySummary(DAY);

            assertThat(summary.totalJobs()).isEqualTo(2);
            assertThat(summary.totalTasks()).isEqualTo(4);
            assertThat(summary.failedTasks()).isEqualTo(3);
            assertThat(summary.avgSuccessRate()).isEqualTo(0.5);
            assertThat(summary.avgDurationSeconds()).isEqualTo(200.0);
            assertThat(summary.jobs()).extracting(JobSummary::jobId).containsExactly("1", "2");
        }

        @Test
        @DisplayName("pending jobs are excluded, not counted as zero")
        void pendingExcluded() {
            when(jobRecordRepository.findByStartDateOrderByStartTimeAsc("2025-01-15")).thenReturn(List.of(
                    job("1", T0, T0.plusSeconds(60), JobResult.SUCCEEDED),
                    job("99", T0, null, JobResult.UNKNOWN)));
            when(taskOutcomeRepository.findByJobIdIn(List.of("1"))).thenReturn(List.of(task("1", "a", true)));

            DailySummary summary = service.dailySummary(DAY);

            assertThat(summary.totalJobs()).isEqualTo(1);
            assertThat(summary.avgSuccessRate()).isEqualTo(1.0);
            assertThat(summary.jobs()).extracting(JobSummary::jobId).containsExactly("1");
        }

        @Test
        @DisplayName("no completed jobs gives an all-zero summary")
        void emptyDay() {
            when(jobRecordRepository.findByStartDateOrderByStartTimeAsc("2025-01-15")).thenReturn(List.of());

            DailySummary summary = service.dailySummary(DAY);

            assertThat(summary).isEqualTo(DailySummary.empty(DAY));
            verify(taskOutcomeRepository, never()).findByJobIdIn(anyCollection());
        }
    }

    private static JobRecord job(String jobId, Instant start, Instant end, JobResult result) {
        JobRecord job = new JobRecord(jobId);
        job.setUser("alice");
        job.setStartTime(start);
        job.setStartDate(start != null ? "2025-01-15" : null);
        job.setEndTime(end);
        job.setResult(result);
        return job;
    }

    private static TaskOutcome task(String jobId, String taskId, boolean successful) {
        TaskOutcome t = new TaskOutcome();
        t.setJobId(jobId);
        t.setTaskId(taskId);
        t.setDurationMs(100);
        t.setSuccessful(successful);
        return t;
    }
}
