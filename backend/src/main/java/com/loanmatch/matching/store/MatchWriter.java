package com.loanmatch.matching.store;

import com.loanmatch.domain.Match;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.bulk.BulkWriteResult;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.BulkOperationException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Idempotent match persistence. _id is the natural key (applicantId:productId:batchId) and every field is written
 * with $setOnInsert, so re-submitting a decision never creates a second document or overwrites the first.
 * Concurrent inserts of the same key that lose the race surface as duplicate-key errors and count as already present.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MatchWriter {

    private static final int DUPLICATE_KEY = 11000;

    private final MongoTemplate mongoTemplate;

    public PersistOutcome persist(Match match) {
        ensureId(match);
        try {
            UpdateResult result = mongoTemplate.upsert(byId(match), insertOnly(match), Match.class);
            return result.getUpsertedId() != null ? PersistOutcome.CREATED : PersistOutcome.ALREADY_EXISTS;
        } catch (DuplicateKeyException e) {
            return PersistOutcome.ALREADY_EXISTS;
        }
    }

    public PersistSummary persistAll(List<Match> matches) {
        if (matches.isEmpty()) {
            return PersistSummary.EMPTY;
        }
        BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, Match.class);
        for (Match match : matches) {
            ensureId(match);
            ops.upsert(byId(match), insertOnly(match));
        }
        try {
            BulkWriteResult result = ops.execute();
            long created = result.getUpserts().size();
            return new PersistSummary(created, matches.size() - created);
        } catch (BulkOperationException e) {
            List<BulkWriteError> errors = e.getErrors();
            boolean onlyDuplicates = errors.stream().allMatch(err -> err.getCode() == DUPLICATE_KEY);
            if (!onlyDuplicates) {
                throw e;
            }
            long created = e.getResult().getUpserts().size();
            log.debug("Match bulk upsert lost {} insert race(s); counted as already present", errors.size());
            return new PersistSummary(created, matches.size() - created);
        }
    }

    private static void ensureId(Match match) {
        if (match.getId() == null || match.getId().isBlank()) {
            match.setId(Match.naturalKey(match.getApplicantId(), match.getProductId(), match.getBatchId()));
        }
    }

    private static Query byId(Match match) {
        return Query.query(Criteria.where("_id").is(match.getId()));
    }

    private static Update insertOnly(Match match) {
        return new Update()
                .setOnInsert("applicantId", match.getApplicantId())
                .setOnInsert("productId", match.getProductId())
                .setOnInsert("batchId", match.getBatchId())
                .setOnInsert("score", match.getScore())
                .setOnInsert("matchType", match.getMatchType())
                .setOnInsert("rationale", match.getRationale())
                .setOnInsert("notificationSent", false)
                .setOnInsert("createdAt", match.getCreatedAt());
    }
}
