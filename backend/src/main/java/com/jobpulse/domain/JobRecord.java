package com.jobpulse.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reconciled state of one upstream job. Created by the first event that references the job; JobStart and JobEnd
 * fields fill in independently of arrival order. Written only by JobStateReconciler.
 * startDate (UTC yyyy-MM-dd of startTime) backs the daily summary query.
 */
@Document(collection = "jobs")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class JobRecord {

    @Id
    private String id;
    @Indexed(unique = true)
    @EqualsAndHashCode.Include
    private String jobId;
    private String user;
    private Instant startTime;
    @Indexed
    private String startDate;
    private Instant endTime;
    private JobResult result = JobResult.UNKNOWN;
    private List<MergeAnomaly> anomalies = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;
    @Version
    private Long version;

    public JobRecord(String jobId) {
        this.jobId = jobId;
    }

    /** Both start and end observed. */
    public boolean isComplete() {
        return startTime != null && endTime != null && result != JobResult.UNKNOWN;
    }

    public JobStatus getStatus() {
        return JobStatus.of(this);
    }
}
