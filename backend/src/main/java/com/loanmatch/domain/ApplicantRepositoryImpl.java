package com.loanmatch.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed claim queries for applicants. A claim is a compare-and-set on claimToken/claimedAt
 * guarded by processed=false, so no row-level lock is ever held.
 */
@Repository
@RequiredArgsConstructor
public class ApplicantRepositoryImpl implements ApplicantRepositoryCustom {

    /** Rounds of "find candidates, claim them" before contention is reported as a retryable failure. */
    static final int MAX_CLAIM_ROUNDS = 16;

    private final MongoTemplate mongoTemplate;

    @Override
    public List<Applicant> claimChunk(String batchId, int maxSize, String claimToken, Instant now, Instant leaseExpiredBefore) {
        for (int round = 0; round < MAX_CLAIM_ROUNDS; round++) {
            Query candidates = new Query(claimable(batchId, leaseExpiredBefore))
                    .with(Sort.by(Sort.Direction.ASC, "_id"))
                    .limit(maxSize);
            candidates.fields().include("_id");
            List<String> ids = mongoTemplate.find(candidates, Applicant.class).stream()
                    .map(Applicant::getId)
                    .toList();
            if (ids.isEmpty()) {
                return List.of();
            }
            Query claim = new Query(new Criteria().andOperator(
                    where("_id").in(ids),
                    claimable(batchId, leaseExpiredBefore)));
            Update update = new Update()
                    .set("claimToken", claimToken)
                    .set("claimedAt", now);
            long claimed = mongoTemplate.updateMulti(claim, update, Applicant.class).getModifiedCount();
            if (claimed > 0) {
                Query owned = new Query(where("claimToken").is(claimToken).and("processed").is(false))
                        .with(Sort.by(Sort.Direction.ASC, "_id"));
                return mongoTemplate.find(owned, Applicant.class);
            }
            // every candidate went to a concurrent claimer between find and update
        }
        throw new CannotAcquireLockException("Claim contention on batch " + batchId + " after " + MAX_CLAIM_ROUNDS + " rounds");
    }

    @Override
    public long releaseClaim(String claimToken) {
        Query query = new Query(where("claimToken").is(claimToken).and("processed").is(false));
        Update update = new Update().unset("claimToken").unset("claimedAt");
        return mongoTemplate.updateMulti(query, update, Applicant.class).getModifiedCount();
    }

    @Override
    public boolean markProcessed(String applicantId, String claimToken, Instant now, String skipReason) {
        Query query = new Query(where("_id").is(applicantId)
                .and("claimToken").is(claimToken)
                .and("processed").is(false));
        Update update = new Update()
                .set("processed", true)
                .set("processedAt", now);
        if (skipReason != null) {
            update.set("skipReason", skipReason);
        }
        return mongoTemplate.updateFirst(query, update, Applicant.class).getModifiedCount() == 1;
    }

    @Override
    public List<String> findBatchIdsWithClaimableWork(Instant leaseExpiredBefore) {
        Query query = new Query(new Criteria().andOperator(
                where("processed").is(false),
                unclaimedOrExpired(leaseExpiredBefore)));
        return mongoTemplate.findDistinct(query, "batchId", Applicant.class, String.class);
    }

    private static Criteria claimable(String batchId, Instant leaseExpiredBefore) {
        return new Criteria().andOperator(
                where("batchId").is(batchId),
                where("processed").is(false),
                unclaimedOrExpired(leaseExpiredBefore));
    }

    private static Criteria unclaimedOrExpired(Instant leaseExpiredBefore) {
        return new Criteria().orOperator(
                where("claimToken").is(null),
                where("claimedAt").lt(leaseExpiredBefore));
    }
}
