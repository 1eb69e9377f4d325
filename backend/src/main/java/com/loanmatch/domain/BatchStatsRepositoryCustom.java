package com.loanmatch.domain;

import java.time.Instant;

/**
 * Atomic counter increments on batch_stats.
 */
public interface BatchStatsRepositoryCustom {

    void increment(String batchId, BatchStatsIncrement increment, Instant now);
}
