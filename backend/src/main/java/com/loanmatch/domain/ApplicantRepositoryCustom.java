package com.loanmatch.domain;

import java.time.Instant;
import java.util.List;

/**
 * Atomic claim operations on applicants.
 */
public interface ApplicantRepositoryCustom {

    /**
     * Claims up to {@code maxSize} unprocessed applicants of the batch that are unclaimed or whose claim is older
     * than {@code leaseExpiredBefore}. Each document is claimed with a conditional update, so concurrent callers
     * receive disjoint sets and never wait on each other. Returns an empty list only when nothing is claimable.
     */
    List<Applicant> claimChunk(String batchId, int maxSize, String claimToken, Instant now, Instant leaseExpiredBefore);

    /** Drops the claim held by {@code claimToken} on applicants that are still unprocessed. */
    long releaseClaim(String claimToken);

    /**
     * Flips processed=true if the applicant is still held by {@code claimToken}. False when the claim was lost.
     */
    boolean markProcessed(String applicantId, String claimToken, Instant now, String skipReason);

    /** Batches with unprocessed applicants that are unclaimed or whose lease expired. */
    List<String> findBatchIdsWithClaimableWork(Instant leaseExpiredBefore);
}
