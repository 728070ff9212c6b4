package com.jobpulse.ingestion.reconcile;

import com.jobpulse.domain.JobRecord;
import com.jobpulse.domain.JobResult;
import com.jobpulse.domain.MergeAnomaly;
import com.jobpulse.domain.TaskOutcome;
import com.jobpulse.ingestion.event.JobEndEvent;
import com.jobpulse.ingestion.event.JobStartEvent;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Merge rules for a single job record. Pure functions over the in-memory record; persistence and locking are
 * the caller's concern.
 * <p>
 * Conflicting values of the same kind resolve to the one carried by the earlier event timestamp, so any
 * application order converges. On equal timestamps the stored value stays and a {@link MergeAnomaly} is recorded.
 * Anomalies on a field only describe conflicts at its current winning timestamp; they are cleared when an earlier
 * event takes over the field.
 */
public final class JobMergeRules {

    private JobMergeRules() {
    }

    public static MergeEffect applyStart(JobRecord job, JobStartEvent event) {
        if (job.getStartTime() == null) {
            setStart(job, event);
            return MergeEffect.CHANGED;
        }
        int cmp = event.timestamp().compareTo(job.getStartTime());
        if (cmp < 0) {
            setStart(job, event);
            return MergeEffect.CHANGED;
        }
        if (cmp == 0 && !Objects.equals(job.getUser(), event.user())) {
            return recordAnomaly(job, "user", job.getUser(), event.user());
        }
        return MergeEffect.UNCHANGED;
    }

    public static MergeEffect applyEnd(JobRecord job, JobEndEvent event) {
        if (job.getEndTime() == null || job.getResult() == null || job.getResult() == JobResult.UNKNOWN) {
            setEnd(job, event);
            return MergeEffect.CHANGED;
        }
        int cmp = event.timestamp().compareTo(job.getEndTime());
        if (cmp < 0) {
            setEnd(job, event);
            return MergeEffect.CHANGED;
        }
        if (cmp == 0 && job.getResult() != event.result()) {
            return recordAnomaly(job, "result", job.getResult().name(), event.result().name());
        }
        return MergeEffect.UNCHANGED;
    }

    /** A second TaskEnd for the same task with different content; the stored row was kept. */
    public static MergeEffect applyTaskConflict(JobRecord job, TaskOutcome stored, TaskOutcome rejected) {
        return recordAnomaly(job, "task:" + stored.getTaskId(), describe(stored), describe(rejected));
    }

    public static String startDateOf(Instant startTime) {
        return LocalDate.ofInstant(startTime, ZoneOffset.UTC).toString();
    }

    private static void setStart(JobRecord job, JobStartEvent event) {
        clearAnomalies(job, "user");
        job.setStartTime(event.timestamp());
        job.setStartDate(startDateOf(event.timestamp()));
        job.setUser(event.user());
    }

    private static void setEnd(JobRecord job, JobEndEvent event) {
        clearAnomalies(job, "result");
        job.setEndTime(event.timestamp());
        job.setResult(event.result());
    }

    private static MergeEffect recordAnomaly(JobRecord job, String field, String kept, String rejected) {
        boolean known = job.getAnomalies().stream()
                .anyMatch(a -> a.field().equals(field)
                        && Objects.equals(a.keptValue(), kept)
                        && Objects.equals(a.rejectedValue(), rejected));
        if (!known) {
            job.getAnomalies().add(new MergeAnomaly(field, kept, rejected, Instant.now()));
        }
        return MergeEffect.ANOMALY;
    }

    private static void clearAnomalies(JobRecord job, String field) {
        job.getAnomalies().removeIf(a -> a.field().equals(field));
    }

    private static String describe(TaskOutcome task) {
        return "durationMs=" + task.getDurationMs() + ",successful=" + task.isSuccessful();
    }
}
