package com.jobpulse.analytics;

import com.jobpulse.domain.JobRecord;
import com.jobpulse.domain.JobRecordRepository;
import com.jobpulse.domain.TaskOutcome;
import com.jobpulse.domain.TaskOutcomeRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only analytics over reconciled jobs and task outcomes. Never writes; safe to run while reconciliation is
 * in progress (a summary reflects whatever has been committed so far).
 */
@Service
@RequiredArgsConstructor
public class JobAnalyticsService {

    private final JobRecordRepository jobRecordRepository;
    private final TaskOutcomeRepository taskOutcomeRepository;

    /**
     * @return empty when no event for the job was ever reconciled
     */
    public Optional<JobSummaryResult> jobSummary(String jobId) {
        return jobRecordRepository.findByJobId(jobId).map(job -> {
            if (!job.isComplete()) {
                return JobSummaryResult.pending(jobId);
            }
            long total = taskOutcomeRepository.countByJobId(jobId);
            long failed = taskOutcomeRepository.countByJobIdAndSuccessfulFalse(jobId);
            return JobSummaryResult.of(summarize(job, total, failed));
        });
    }

    /**
     * Summary of completed jobs whose start time falls on the given UTC day. Task rows are loaded in one query.
     */
    public DailySummary dailySummary(LocalDate date) {
        List<JobRecord> completed = jobRecordRepository.findByStartDateOrderByStartTimeAsc(date.toString()).stream()
                .filter(JobRecord::isComplete)
                .toList();
        if (completed.isEmpty()) {
            return DailySummary.empty(date);
        }
        Map<String, List<TaskOutcome>> tasksByJob = taskOutcomeRepository
                .findByJobIdIn(completed.stream().map(JobRecord::getJobId).toList())
                .stream()
                .collect(Collectors.groupingBy(TaskOutcome::getJobId));

        List<JobSummary> jobs = completed.stream()
                .map(job -> {
                    List<TaskOutcome> tasks = tasksByJob.getOrDefault(job.getJobId(), List.of());
                    long failed = tasks.stream().filter(t -> !t.isSuccessful()).count();
                    return summarize(job, tasks.size(), failed);
                })
                .toList();

        long totalTasks = jobs.stream().mapToLong(JobSummary::totalTasks).sum();
        long failedTasks = jobs.stream().mapToLong(JobSummary::failedTasks).sum();
        double avgSuccessRate = jobs.stream().mapToDouble(JobSummary::successRate).average().orElse(0.0);
        double avgDuration = jobs.stream().mapToLong(JobSummary::durationSeconds).average().orElse(0.0);
        return new DailySummary(date, jobs.size(), totalTasks, failedTasks, avgSuccessRate, avgDuration, jobs);
    }

    static JobSummary summarize(JobRecord job, long totalTasks, long failedTasks) {
        double successRate = totalTasks == 0 ? 0.0 : (double) (totalTasks - failedTasks) / totalTasks;
        // truncated toward zero, also for an end before the start
        long durationSeconds = Duration.between(job.getStartTime(), job.getEndTime()).toMillis() / 1000;
        return new JobSummary(
                job.getJobId(),
                job.getUser(),
                job.getStartTime(),
                job.getEndTime(),
                job.getStatus(),
                totalTasks,
                failedTasks,
                successRate,
                durationSeconds);
    }
}
