package com.jobpulse.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
@RequiredArgsConstructor
public class TrackingHandleRepositoryImpl implements TrackingHandleRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean completeIfPending(String handleId, TrackingHandle.HandleState status,
                                     String failureReason, String failureMessage) {
        Update update = new Update()
                .set("status", status)
                .set("completedAt", Instant.now());
        if (failureReason != null) {
            update.set("failureReason", failureReason);
        }
        if (failureMessage != null) {
            update.set("failureMessage", failureMessage);
        }
        return mongoTemplate.updateFirst(pendingById(handleId), update, TrackingHandle.class).getModifiedCount() > 0;
    }

    @Override
    public boolean markDispatched(String handleId) {
        Update update = new Update()
                .inc("dispatchCount", 1)
                .set("lastDispatchedAt", Instant.now());
        return mongoTemplate.updateFirst(pendingById(handleId), update, TrackingHandle.class).getModifiedCount() > 0;
    }

    private static Query pendingById(String handleId) {
        return Query.query(Criteria.where("_id").is(handleId).and("status").is(TrackingHandle.HandleState.PENDING));
    }
}
