package com.jobpulse.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface JobRecordRepository extends MongoRepository<JobRecord, String> {

    Optional<JobRecord> findByJobId(String jobId);

    /** Jobs started on a UTC calendar day (startDate = yyyy-MM-dd). Indexed. */
    List<JobRecord> findByStartDateOrderByStartTimeAsc(String startDate);
}
