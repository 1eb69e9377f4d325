package com.loanmatch.matching.query;

import java.time.Instant;

/**
 * Snapshot of a batch's matching progress. Applicant counts are authoritative; the decision counters come from
 * batch_stats and may lag or over-count after a retried chunk.
 */
public record BatchMatchingStatus(
        String batchId,
        boolean running,
        long totalApplicants,
        long unprocessedApplicants,
        long matchesStored,
        long applicantsProcessed,
        long applicantsSkipped,
        long autoApproved,
        long escalated,
        long approvedAfterEscalation,
        long autoRejected,
        long rejectedAfterEscalation,
        Instant drainedAt,
        Instant notifiedAt
) {
}
