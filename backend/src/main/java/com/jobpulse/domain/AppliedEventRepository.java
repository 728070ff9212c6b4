package com.jobpulse.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface AppliedEventRepository extends MongoRepository<AppliedEvent, String> {
}
