package com.loanmatch.matching.claim;

import com.loanmatch.domain.Applicant;

import java.time.Instant;
import java.util.List;

/**
 * Applicants held by one claim token. Empty means the batch has nothing claimable right now.
 */
public record ClaimedChunk(String batchId, String claimToken, Instant claimedAt, List<Applicant> applicants) {

    public boolean isEmpty() {
        return applicants.isEmpty();
    }

    public int size() {
        return applicants.size();
    }
}
