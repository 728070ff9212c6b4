package com.jobpulse.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TaskOutcomeRepository extends MongoRepository<TaskOutcome, String> {

    Optional<TaskOutcome> findByJobIdAndTaskId(String jobId, String taskId);

    long countByJobId(String jobId);

    long countByJobIdAndSuccessfulFalse(String jobId);

    List<TaskOutcome> findByJobIdIn(Collection<String> jobIds);
}
