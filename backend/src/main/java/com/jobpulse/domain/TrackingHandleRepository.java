package com.jobpulse.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface TrackingHandleRepository extends MongoRepository<TrackingHandle, String>, TrackingHandleRepositoryCustom {

    /** Handles still pending since before the cutoff (redelivery candidates). */
    List<TrackingHandle> findByStatusAndLastDispatchedAtBeforeOrderByCreatedAtAsc(TrackingHandle.HandleState status,
                                                                                  Instant cutoff,
                                                                                  Pageable pageable);
}
