package com.loanmatch.matching.pipeline;

import com.loanmatch.domain.BatchStatsIncrement;
import com.loanmatch.matching.store.PersistSummary;

/**
 * Accumulates counters for the applicants of a chunk that this worker actually flipped to processed.
 */
class ChunkTally {

    private long processed;
    private long skipped;
    private long autoApproved;
    private long escalated;
    private long approvedAfterEscalation;
    private long autoRejected;
    private long rejectedAfterEscalation;

    void add(ApplicantDecision decision) {
        if (decision.isSkipped()) {
            skipped++;
            return;
        }
        processed++;
        autoApproved += decision.autoApproved();
        escalated += decision.escalated();
        approvedAfterEscalation += decision.approvedAfterEscalation();
        autoRejected += decision.autoRejected();
        rejectedAfterEscalation += decision.rejectedAfterEscalation();
    }

    long processed() {
        return processed;
    }

    long skipped() {
        return skipped;
    }

    BatchStatsIncrement toIncrement(PersistSummary persisted) {
        return new BatchStatsIncrement(processed, skipped, autoApproved, escalated, approvedAfterEscalation,
                autoRejected, rejectedAfterEscalation, persisted.created(), persisted.alreadyPresent());
    }
}
