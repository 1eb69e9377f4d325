package com.loanmatch.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Single $inc upsert per chunk so concurrent workers never overwrite each other's counts.
 */
@Repository
@RequiredArgsConstructor
public class BatchStatsRepositoryImpl implements BatchStatsRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public void increment(String batchId, BatchStatsIncrement increment, Instant now) {
        Update update = new Update()
                .inc("applicantsProcessed", increment.applicantsProcessed())
                .inc("applicantsSkipped", increment.applicantsSkipped())
                .inc("autoApproved", increment.autoApproved())
                .inc("escalated", increment.escalated())
                .inc("approvedAfterEscalation", increment.approvedAfterEscalation())
                .inc("autoRejected", increment.autoRejected())
                .inc("rejectedAfterEscalation", increment.rejectedAfterEscalation())
                .inc("matchesCreated", increment.matchesCreated())
                .inc("matchesAlreadyPresent", increment.matchesAlreadyPresent())
                .inc("chunksProcessed", 1)
                .setOnInsert("firstChunkAt", now)
                .set("updatedAt", now);
        mongoTemplate.upsert(new Query(where("_id").is(batchId)), update, BatchStats.class);
    }
}
