package com.loanmatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for batch_completions.
 */
public interface BatchCompletionRepository extends MongoRepository<BatchCompletion, String>, BatchCompletionRepositoryCustom {
}
