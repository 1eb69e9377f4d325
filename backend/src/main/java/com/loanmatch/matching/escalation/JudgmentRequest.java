package com.loanmatch.matching.escalation;

import java.math.BigDecimal;
import java.util.List;

/**
 * Bounded feature summary sent to the judgment service. Carries derived features only, never the raw applicant record.
 *
 * @param incomeToLoanRatio annual income over the product's max loan amount; null when the product has no amount
 * @param creditTier        credit bucket label, e.g. "[650,750)"
 * @param employmentStability STABLE for salaried applicants, VARIABLE otherwise
 */
public record JudgmentRequest(
        String applicantId,
        String productId,
        String batchId,
        int score,
        BigDecimal incomeToLoanRatio,
        String creditTier,
        String employmentStability,
        ProductFit productFit
) {

    public record ProductFit(String productName, String providerName, List<String> passedChecks, List<String> failedChecks) {
    }
}
