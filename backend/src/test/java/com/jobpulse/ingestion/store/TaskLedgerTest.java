package com.jobpulse.ingestion.store;

import com.jobpulse.domain.TaskOutcome;
import com.jobpulse.domain.TaskOutcomeRepository;
import com.jobpulse.ingestion.event.TaskEndEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskLedgerTest {

    private static final TaskEndEvent EVENT =
            new TaskEndEvent("7", Instant.parse("2025-01-15T10:01:00Z"), "t1", 1500, true);

    @Mock
    TaskOutcomeRepository repository;

    @InjectMocks
    TaskLedger ledger;

    @Test
    @DisplayName("first delivery inserts a row")
    void firstDeliveryRecorded() {
        when(repository.findByJobIdAndTaskId("7", "t1")).thenReturn(Optional.empty());
        when(repository.insert(any(TaskOutcome.class))).thenAnswer(inv -> inv.getArgument(0));

        TaskRecordOutcome outcome = ledger.record(EVENT);

        assertThat(outcome.kind()).isEqualTo(TaskRecordOutcome.Kind.RECORDED);
        ArgumentCaptor<TaskOutcome> captor = ArgumentCaptor.forClass(TaskOutcome.class);
        verify(repository).insert(captor.capture());
        assertThat(captor.getValue().getDurationMs()).isEqualTo(1500);
        assertThat(captor.getValue().getObservedAt()).isEqualTo(EVENT.timestamp());
    }

    @Test
    @DisplayName("identical existing row is a duplicate; nothing is written")
    void identicalRowIsDuplicate() {
        when(repository.findByJobIdAndTaskId("7", "t1")).thenReturn(Optional.of(row(1500, true)));

        assertThat(ledger.record(EVENT).kind()).isEqualTo(TaskRecordOutcome.Kind.DUPLICATE);
        verify(repository, never()).insert(any(TaskOutcome.class));
    }

    @Test
    @DisplayName("existing row with other content is a conflict and survives")
    void differingRowIsConflict() {
        TaskOutcome stored = row(10, false);
        when(repository.findByJobIdAndTaskId("7", "t1")).thenReturn(Optional.of(stored));

        TaskRecordOutcome outcome = ledger.record(EVENT);

        assertThat(outcome.kind()).isEqualTo(TaskRecordOutcome.Kind.CONFLICT);
        assertThat(outcome.stored()).isSameAs(stored);
    }

    @Test
    @DisplayName("insert losing a unique-index race reads the winner back")
    void lostInsertRace() {
        when(repository.findByJobIdAndTaskId("7", "t1"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(row(1500, true)));
        when(repository.insert(any(TaskOutcome.class))).thenThrow(new DuplicateKeyException("job_task_uniq"));

        assertThat(ledger.record(EVENT).kind()).isEqualTo(TaskRecordOutcome.Kind.DUPLICATE);
    }

    private static TaskOutcome row(long durationMs, boolean successful) {
        TaskOutcome t = new TaskOutcome();
        t.setId("row-1");
        t.setJobId("7");
        t.setTaskId("t1");
        t.setDurationMs(durationMs);
        t.setSuccessful(successful);
        return t;
    }
}
