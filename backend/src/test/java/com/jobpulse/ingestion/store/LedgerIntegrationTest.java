package com.jobpulse.ingestion.store;

import com.jobpulse.domain.AppliedEventRepository;
import com.jobpulse.domain.TaskOutcomeRepository;
import com.jobpulse.ingestion.event.ClassifiedEvent;
import com.jobpulse.ingestion.event.TaskEndEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "jobpulse.ingestion.redelivery.enabled=false")
@Testcontainers(disabledWithoutDocker = true)
class LedgerIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    TaskLedger taskLedger;
    @Autowired
    IdempotencyLedger idempotencyLedger;
    @Autowired
    TaskOutcomeRepository taskOutcomeRepository;
    @Autowired
    AppliedEventRepository appliedEventRepository;

    @Test
    @DisplayName("concurrent records of one task leave a single row; the unique index decides")
    void uniqueIndexAnchorsTaskRows() throws Exception {
        TaskEndEvent event = new TaskEndEvent("ledger-1", Instant.parse("2025-01-15T10:01:00Z"), "t1", 1500, true);
        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<TaskRecordOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                return taskLedger.record(event);
            }));
        }
        start.countDown();

        List<TaskRecordOutcome.Kind> kinds = futures.stream().map(CompletableFuture::join).map(TaskRecordOutcome::kind).toList();

        assertThat(kinds).containsOnlyOnce(TaskRecordOutcome.Kind.RECORDED);
        assertThat(kinds).doesNotContain(TaskRecordOutcome.Kind.CONFLICT);
        assertThat(taskOutcomeRepository.countByJobId("ledger-1")).isEqualTo(1);
    }

    @Test
    @DisplayName("differing re-delivery keeps the first row")
    void conflictKeepsFirst() {
        Instant ts = Instant.parse("2025-01-15T10:01:00Z");
        taskLedger.record(new TaskEndEvent("ledger-2", ts, "t1", 100, true));

        TaskRecordOutcome outcome = taskLedger.record(new TaskEndEvent("ledger-2", ts, "t1", 900, false));

        assertThat(outcome.kind()).isEqualTo(TaskRecordOutcome.Kind.CONFLICT);
        assertThat(taskLedger.find("ledger-2", "t1")).hasValueSatisfying(t -> {
            assertThat(t.getDurationMs()).isEqualTo(100);
            assertThat(t.isSuccessful()).isTrue();
        });
    }

    @Test
    @DisplayName("marking a key twice keeps one applied record")
    void markAppliedTwice() {
        ClassifiedEvent event = new ClassifiedEvent(
                new TaskEndEvent("ledger-3", Instant.parse("2025-01-15T10:01:00Z"), "t1", 1, true), "ledger-3-key");

        assertThat(idempotencyLedger.hasBeenApplied("ledger-3-key")).isFalse();
        idempotencyLedger.markApplied(event);
        idempotencyLedger.markApplied(event);

        assertThat(idempotencyLedger.hasBeenApplied("ledger-3-key")).isTrue();
        assertThat(appliedEventRepository.findById("ledger-3-key")).isPresent();
    }
}
