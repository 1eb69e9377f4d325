package com.loanmatch.matching.query;

import com.loanmatch.domain.ApplicantRepository;
import com.loanmatch.domain.BatchCompletion;
import com.loanmatch.domain.BatchCompletionRepository;
import com.loanmatch.domain.BatchStats;
import com.loanmatch.domain.BatchStatsRepository;
import com.loanmatch.domain.LoanProduct;
import com.loanmatch.domain.LoanProductRepository;
import com.loanmatch.domain.Match;
import com.loanmatch.domain.MatchRepository;
import com.loanmatch.matching.job.MatchingRunLauncher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read side for the API: batch status, stored matches and the active product catalogue.
 */
@Service
@RequiredArgsConstructor
public class MatchingQueryService {

    private final ApplicantRepository applicantRepository;
    private final MatchRepository matchRepository;
    private final LoanProductRepository loanProductRepository;
    private final BatchStatsRepository batchStatsRepository;
    private final BatchCompletionRepository batchCompletionRepository;
    private final MatchingRunLauncher matchingRunLauncher;

    public boolean batchExists(String batchId) {
        return applicantRepository.existsByBatchId(batchId);
    }

    public Optional<BatchMatchingStatus> findStatus(String batchId) {
        long total = applicantRepository.countByBatchId(batchId);
        if (total == 0) {
            return Optional.empty();
        }
        BatchStats stats = batchStatsRepository.findById(batchId).orElseGet(BatchStats::new);
        Optional<BatchCompletion> completion = batchCompletionRepository.findById(batchId);
        return Optional.of(new BatchMatchingStatus(
                batchId,
                matchingRunLauncher.isRunning(batchId),
                total,
                applicantRepository.countByBatchIdAndProcessedFalse(batchId),
                matchRepository.countByBatchId(batchId),
                stats.getApplicantsProcessed(),
                stats.getApplicantsSkipped(),
                stats.getAutoApproved(),
                stats.getEscalated(),
                stats.getApprovedAfterEscalation(),
                stats.getAutoRejected(),
                stats.getRejectedAfterEscalation(),
                completion.map(BatchCompletion::getDrainedAt).orElse(null),
                completion.map(BatchCompletion::getNotifiedAt).orElse(null)));
    }

    /**
     * Up to 100 matches, highest score first. Both filters optional; with neither, the 100 most recent matches.
     */
    public List<Match> findMatches(String batchId, String applicantId) {
        boolean byBatch = batchId != null && !batchId.isBlank();
        boolean byApplicant = applicantId != null && !applicantId.isBlank();
        if (byBatch && byApplicant) {
            return matchRepository.findTop100ByBatchIdAndApplicantIdOrderByScoreDesc(batchId, applicantId);
        }
        if (byBatch) {
            return matchRepository.findTop100ByBatchIdOrderByScoreDesc(batchId);
        }
        if (byApplicant) {
            return matchRepository.findTop100ByApplicantIdOrderByScoreDesc(applicantId);
        }
        return matchRepository.findTop100ByOrderByCreatedAtDesc();
    }

    public List<LoanProduct> findActiveProducts() {
        return loanProductRepository.findByActiveTrueOrderByProviderNameAscIdAsc();
    }
}
