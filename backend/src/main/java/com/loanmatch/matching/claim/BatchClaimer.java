package com.loanmatch.matching.claim;

import com.loanmatch.domain.Applicant;
import com.loanmatch.domain.ApplicantRepository;
import com.loanmatch.matching.config.MatchingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Claims chunks of unprocessed applicants for one worker. Concurrent claimers get disjoint chunks; a claim older than
 * the lease is treated as abandoned and may be taken again. A claim that fails partway is released before the error
 * propagates, so a failed claim holds no applicants.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchClaimer {

    private final ApplicantRepository applicantRepository;
    private final MatchingProperties matchingProperties;
    private final Clock clock;

    public ClaimedChunk claim(String batchId) {
        String token = UUID.randomUUID().toString();
        Instant now = clock.instant();
        Instant leaseExpiredBefore = now.minus(matchingProperties.getClaimLease());
        List<Applicant> applicants;
        try {
            applicants = applicantRepository.claimChunk(
                    batchId, matchingProperties.getChunkSize(), token, now, leaseExpiredBefore);
        } catch (RuntimeException e) {
            // the conditional update may already have stamped rows with this token
            releaseAfterFailedClaim(batchId, token, e);
            throw e;
        }
        if (!applicants.isEmpty()) {
            log.debug("Claimed {} applicants of batch {} with token {}", applicants.size(), batchId, token);
        }
        return new ClaimedChunk(batchId, token, now, applicants);
    }

    /** Returns unprocessed applicants of the chunk to the pool. */
    public void release(ClaimedChunk chunk) {
        long released = applicantRepository.releaseClaim(chunk.claimToken());
        if (released > 0) {
            log.info("Released {} unprocessed applicants of batch {} (token {})", released, chunk.batchId(), chunk.claimToken());
        }
    }

    private void releaseAfterFailedClaim(String batchId, String token, RuntimeException cause) {
        try {
            long released = applicantRepository.releaseClaim(token);
            if (released > 0) {
                log.warn("Claim on batch {} failed after marking {} applicants; released token {}: {}",
                        batchId, released, token, cause.getMessage());
            }
        } catch (RuntimeException releaseError) {
            cause.addSuppressed(releaseError);
            log.warn("Could not release failed claim {} of batch {}; it frees up when the lease expires: {}",
                    token, batchId, releaseError.getMessage());
        }
    }
}
