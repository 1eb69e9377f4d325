package com.loanmatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for batch_stats.
 */
public interface BatchStatsRepository extends MongoRepository<BatchStats, String>, BatchStatsRepositoryCustom {
}
