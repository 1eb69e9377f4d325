package com.loanmatch.matching.escalation;

import com.loanmatch.domain.LoanProduct;
import com.loanmatch.matching.index.ProductIndex;
import com.loanmatch.matching.scoring.ApplicantProfile;
import com.loanmatch.matching.scoring.ScoreBreakdown;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Component
public class FeatureSummaryBuilder {

    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);
    private static final int RATIO_SCALE = 4;

    public JudgmentRequest build(ApplicantProfile applicant, LoanProduct product, ScoreBreakdown breakdown,
                                 ProductIndex index) {
        return new JudgmentRequest(
                applicant.applicantId(),
                product.getId(),
                applicant.batchId(),
                breakdown.total(),
                incomeToLoanRatio(applicant, product),
                index.creditTier(applicant.creditScore()),
                applicant.employmentStatus().isStable() ? "STABLE" : "VARIABLE",
                new JudgmentRequest.ProductFit(product.getProductName(), product.getProviderName(),
                        breakdown.passedChecks(), breakdown.failedChecks()));
    }

    static BigDecimal incomeToLoanRatio(ApplicantProfile applicant, LoanProduct product) {
        BigDecimal amount = product.getMaxLoanAmount() != null ? product.getMaxLoanAmount() : product.getMinLoanAmount();
        if (amount == null || amount.signum() <= 0) {
            return null;
        }
        return applicant.monthlyIncome().multiply(MONTHS_PER_YEAR).divide(amount, RATIO_SCALE, RoundingMode.HALF_UP);
    }
}
