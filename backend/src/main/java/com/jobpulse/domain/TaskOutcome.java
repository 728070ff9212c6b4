package com.jobpulse.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One task-end outcome within a job. Unique on (jobId, taskId): at most one row per task survives.
 * observedAt is the timestamp the event carried and plays no part in merging.
 */
@Document(collection = "task_events")
@CompoundIndexes({
        @CompoundIndex(name = "job_task_uniq", def = "{'jobId': 1, 'taskId': 1}", unique = true),
        @CompoundIndex(name = "job_successful", def = "{'jobId': 1, 'successful': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TaskOutcome {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String jobId;
    private String taskId;
    private long durationMs;
    private boolean successful;
    private Instant observedAt;
    private Instant recordedAt;

    public boolean sameContentAs(TaskOutcome other) {
        return durationMs == other.durationMs && successful == other.successful;
    }
}
