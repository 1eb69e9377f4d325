package com.loanmatch.api.dto;

import java.time.Instant;

/**
 * GET /batches/{batchId}/matching. {@code counters} are best-effort; applicant and match counts are exact.
 */
public record BatchMatchingStatusResponse(
        String batchId,
        String state,
        long totalApplicants,
        long unprocessedApplicants,
        long matchesStored,
        Counters counters,
        Instant drainedAt,
        Instant notifiedAt
) {

    public record Counters(
            long applicantsProcessed,
            long applicantsSkipped,
            long autoApproved,
            long escalated,
            long approvedAfterEscalation,
            long autoRejected,
            long rejectedAfterEscalation
    ) {
    }
}
