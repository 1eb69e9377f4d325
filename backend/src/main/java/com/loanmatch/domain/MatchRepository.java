package com.loanmatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for matches. Writes go through the idempotent upsert in the matching store.
 */
public interface MatchRepository extends MongoRepository<Match, String> {

    List<Match> findTop100ByBatchIdOrderByScoreDesc(String batchId);

    List<Match> findTop100ByApplicantIdOrderByScoreDesc(String applicantId);

    List<Match> findTop100ByBatchIdAndApplicantIdOrderByScoreDesc(String batchId, String applicantId);

    List<Match> findTop100ByOrderByCreatedAtDesc();

    List<Match> findByBatchId(String batchId);

    long countByBatchId(String batchId);

    long countByApplicantIdAndProductIdAndBatchId(String applicantId, String productId, String batchId);
}
