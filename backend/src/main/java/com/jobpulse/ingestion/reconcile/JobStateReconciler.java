package com.jobpulse.ingestion.reconcile;

import com.jobpulse.common.ErrorKind;
import com.jobpulse.common.EventRejectedException;
import com.jobpulse.domain.JobRecord;
import com.jobpulse.domain.JobRecordRepository;
import com.jobpulse.domain.TaskOutcome;
import com.jobpulse.ingestion.config.ReconcileProperties;
import com.jobpulse.ingestion.event.ClassifiedEvent;
import com.jobpulse.ingestion.event.JobEndEvent;
import com.jobpulse.ingestion.event.JobStartEvent;
import com.jobpulse.ingestion.event.LifecycleEvent;
import com.jobpulse.ingestion.event.TaskEndEvent;
import com.jobpulse.ingestion.store.IdempotencyLedger;
import com.jobpulse.ingestion.store.TaskLedger;
import com.jobpulse.ingestion.store.TaskRecordOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Applies one classified event to the reconciled state of its job. Applying an event again, or a set of events in
 * any order, converges to the same job record and task rows.
 * <p>
 * Ledger check, merge and ledger mark run under the per-job lock. Writes to a job are version-checked; a lost race
 * against another process is re-read and re-merged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobStateReconciler {

    private final JobRecordRepository jobRecordRepository;
    private final TaskLedger taskLedger;
    private final IdempotencyLedger idempotencyLedger;
    private final JobLockRegistry jobLockRegistry;
    private final ReconcileProperties reconcileProperties;

    /**
     * @throws EventRejectedException INVALID_EVENT_DATA when the event fails validation; nothing is written
     */
    public ReconcileResult apply(ClassifiedEvent classified) {
        LifecycleEvent event = classified.event();
        validate(event);

        ReentrantLock lock = jobLockRegistry.lockFor(event.jobId());
        lock.lock();
        try {
            if (idempotencyLedger.hasBeenApplied(classified.idempotencyKey())) {
                log.debug("{}: {} for job {} already applied (key {})",
                        ErrorKind.DUPLICATE_EVENT, event.kind(), event.jobId(), classified.idempotencyKey());
                return new ReconcileResult(event.jobId(), event.kind(), MergeEffect.DUPLICATE);
            }
            MergeEffect effect;
            if (event instanceof JobStartEvent start) {
                effect = mergeJob(start.jobId(), job -> JobMergeRules.applyStart(job, start));
            } else if (event instanceof JobEndEvent end) {
                effect = mergeJob(end.jobId(), job -> JobMergeRules.applyEnd(job, end));
            } else if (event instanceof TaskEndEvent task) {
                effect = applyTask(task);
            } else {
                throw new IllegalArgumentException("Unsupported event type: " + event.getClass().getName());
            }
            if (effect == MergeEffect.ANOMALY) {
                log.warn("{} on job {} from {}: kept stored value, event key {}",
                        ErrorKind.CONFLICTING_MERGE_ANOMALY, event.jobId(), event.kind(), classified.idempotencyKey());
            }
            idempotencyLedger.markApplied(classified);
            return new ReconcileResult(event.jobId(), event.kind(), effect);
        } finally {
            lock.unlock();
        }
    }

    private MergeEffect applyTask(TaskEndEvent task) {
        // task row first: a rejected insert leaves no job record behind
        TaskRecordOutcome outcome = taskLedger.record(task);
        if (outcome.kind() == TaskRecordOutcome.Kind.CONFLICT) {
            log.warn("Task {} of job {} re-delivered with different content; first-applied kept",
                    task.taskId(), task.jobId());
            TaskOutcome rejected = toRow(task);
            return mergeJob(task.jobId(), job -> JobMergeRules.applyTaskConflict(job, outcome.stored(), rejected));
        }
        // the job record exists once any event for it was processed
        mergeJob(task.jobId(), job -> MergeEffect.UNCHANGED);
        return outcome.kind() == TaskRecordOutcome.Kind.RECORDED ? MergeEffect.CHANGED : MergeEffect.DUPLICATE;
    }

    private MergeEffect mergeJob(String jobId, Function<JobRecord, MergeEffect> mutation) {
        int maxAttempts = Math.max(1, reconcileProperties.getMergeMaxAttempts());
        for (int attempt = 1; ; attempt++) {
            JobRecord job = jobRecordRepository.findByJobId(jobId).orElseGet(() -> newJob(jobId));
            boolean isNew = job.getVersion() == null;
            MergeEffect effect = mutation.apply(job);
            if (effect == MergeEffect.UNCHANGED && !isNew) {
                return effect;
            }
            job.setUpdatedAt(Instant.now());
            try {
                jobRecordRepository.save(job);
                return effect;
            } catch (OptimisticLockingFailureException | DuplicateKeyException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                log.debug("Concurrent write on job {} (attempt {}/{}), re-merging", jobId, attempt, maxAttempts);
            }
        }
    }

    private static JobRecord newJob(String jobId) {
        JobRecord job = new JobRecord(jobId);
        job.setCreatedAt(Instant.now());
        return job;
    }

    private static TaskOutcome toRow(TaskEndEvent task) {
        TaskOutcome row = new TaskOutcome();
        row.setJobId(task.jobId());
        row.setTaskId(task.taskId());
        row.setDurationMs(task.durationMs());
        row.setSuccessful(task.successful());
        row.setObservedAt(task.timestamp());
        return row;
    }

    static void validate(LifecycleEvent event) {
        if (event instanceof TaskEndEvent task && task.durationMs() < 0) {
            throw EventRejectedException.invalidData(
                    "Negative duration_ms " + task.durationMs() + " for task " + task.taskId() + " of job " + event.jobId());
        }
    }
}
