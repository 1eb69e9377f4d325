package com.loanmatch.domain;

/**
 * Counter deltas produced by one processed chunk.
 */
public record BatchStatsIncrement(
        long applicantsProcessed,
        long applicantsSkipped,
        long autoApproved,
        long escalated,
        long approvedAfterEscalation,
        long autoRejected,
        long rejectedAfterEscalation,
        long matchesCreated,
        long matchesAlreadyPresent
) {

    public boolean isEmpty() {
        return applicantsProcessed == 0 && applicantsSkipped == 0;
    }
}
