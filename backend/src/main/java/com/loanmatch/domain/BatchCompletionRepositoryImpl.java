package com.loanmatch.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed completion marker transitions (upsert and findAndModify).
 */
@Repository
@RequiredArgsConstructor
public class BatchCompletionRepositoryImpl implements BatchCompletionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public void recordStarted(String batchId, Instant now) {
        Query query = new Query(where("_id").is(batchId));
        mongoTemplate.upsert(query, new Update().min("startedAt", now), BatchCompletion.class);
    }

    @Override
    public void recordDrained(String batchId, Instant now) {
        Query query = new Query(where("_id").is(batchId));
        // $min sets a missing field and otherwise keeps the earlier value
        mongoTemplate.upsert(query, new Update().min("drainedAt", now), BatchCompletion.class);
    }

    @Override
    public Optional<BatchCompletion> acquireNotifyLease(String batchId, String owner, Instant now, Instant leaseExpiredBefore) {
        Query query = new Query(new Criteria().andOperator(
                where("_id").is(batchId),
                where("notifiedAt").is(null),
                leaseFree(leaseExpiredBefore)));
        Update update = new Update()
                .set("notifyingOwner", owner)
                .set("notifyingSince", now)
                .inc("notificationAttempts", 1);
        BatchCompletion leased = mongoTemplate.findAndModify(
                query, update, FindAndModifyOptions.options().returnNew(true), BatchCompletion.class);
        return Optional.ofNullable(leased);
    }

    @Override
    public boolean markNotified(String batchId, String owner, Instant now) {
        Query query = new Query(where("_id").is(batchId).and("notifyingOwner").is(owner));
        Update update = new Update()
                .set("notifiedAt", now)
                .unset("notifyingSince");
        return mongoTemplate.updateFirst(query, update, BatchCompletion.class).getModifiedCount() == 1;
    }

    @Override
    public void releaseNotifyLease(String batchId, String owner) {
        Query query = new Query(where("_id").is(batchId)
                .and("notifyingOwner").is(owner)
                .and("notifiedAt").is(null));
        mongoTemplate.updateFirst(query, new Update().unset("notifyingSince").unset("notifyingOwner"), BatchCompletion.class);
    }

    @Override
    public List<String> findBatchIdsAwaitingNotification(Instant leaseExpiredBefore) {
        Query query = new Query(new Criteria().andOperator(
                where("drainedAt").ne(null),
                where("notifiedAt").is(null),
                leaseFree(leaseExpiredBefore)));
        return mongoTemplate.findDistinct(query, "_id", BatchCompletion.class, String.class);
    }

    @Override
    public List<String> findStartedBatchIds(Collection<String> batchIds) {
        if (batchIds.isEmpty()) {
            return List.of();
        }
        Query query = new Query(where("_id").in(batchIds).and("startedAt").ne(null));
        return mongoTemplate.findDistinct(query, "_id", BatchCompletion.class, String.class);
    }

    private static Criteria leaseFree(Instant leaseExpiredBefore) {
        return new Criteria().orOperator(
                where("notifyingSince").is(null),
                where("notifyingSince").lt(leaseExpiredBefore));
    }
}
