package com.jobpulse.ingestion.store;

import com.jobpulse.domain.TaskOutcome;
import com.jobpulse.domain.TaskOutcomeRepository;
import com.jobpulse.ingestion.event.TaskEndEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Append-only task outcomes keyed by (jobId, taskId). The unique index is the authority on whether a task was
 * already recorded, independent of the idempotency ledger: an insert that loses a race reads the winner back.
 */
@Service
@RequiredArgsConstructor
public class TaskLedger {

    private final TaskOutcomeRepository repository;

    public TaskRecordOutcome record(TaskEndEvent event) {
        TaskOutcome candidate = toOutcome(event);
        Optional<TaskOutcome> existing = repository.findByJobIdAndTaskId(event.jobId(), event.taskId());
        if (existing.isPresent()) {
            return compare(existing.get(), candidate);
        }
        try {
            return new TaskRecordOutcome(TaskRecordOutcome.Kind.RECORDED, repository.insert(candidate));
        } catch (DuplicateKeyException e) {
            TaskOutcome winner = repository.findByJobIdAndTaskId(event.jobId(), event.taskId())
                    .orElseThrow(() -> e);
            return compare(winner, candidate);
        }
    }

    public Optional<TaskOutcome> find(String jobId, String taskId) {
        return repository.findByJobIdAndTaskId(jobId, taskId);
    }

    private static TaskRecordOutcome compare(TaskOutcome stored, TaskOutcome candidate) {
        TaskRecordOutcome.Kind kind = stored.sameContentAs(candidate)
                ? TaskRecordOutcome.Kind.DUPLICATE
                : TaskRecordOutcome.Kind.CONFLICT;
        return new TaskRecordOutcome(kind, stored);
    }

    private static TaskOutcome toOutcome(TaskEndEvent event) {
        TaskOutcome outcome = new TaskOutcome();
        outcome.setJobId(event.jobId());
        outcome.setTaskId(event.taskId());
        outcome.setDurationMs(event.durationMs());
        outcome.setSuccessful(event.successful());
        outcome.setObservedAt(event.timestamp());
        outcome.setRecordedAt(Instant.now());
        return outcome;
    }
}
