package com.loanmatch.matching.index;

import com.loanmatch.domain.LoanProduct;
import com.loanmatch.matching.scoring.ApplicantProfile;
import com.loanmatch.matching.scoring.EligibilityScorer;

/**
 * Cheap elimination of pairs that cannot reach the review band. Assumes the credit check passes (bucket narrowing
 * already placed the applicant in a compatible range) and adds the points of the other checks that pass; a pair is
 * dropped only when even that optimistic total stays below the review threshold. Never drops a pair the scorer would
 * keep for a credit-compatible product.
 */
public class CandidatePreFilter {

    private final int reviewThreshold;

    public CandidatePreFilter(int reviewThreshold) {
        this.reviewThreshold = reviewThreshold;
    }

    public boolean admits(ApplicantProfile applicant, LoanProduct product) {
        int reachable = EligibilityScorer.CREDIT_POINTS;
        if (EligibilityScorer.incomeSatisfied(applicant, product)) {
            reachable += EligibilityScorer.INCOME_POINTS;
        }
        if (EligibilityScorer.ageSatisfied(applicant, product)) {
            reachable += EligibilityScorer.AGE_POINTS;
        }
        if (EligibilityScorer.employmentSatisfied(applicant, product)) {
            reachable += EligibilityScorer.EMPLOYMENT_POINTS;
        }
        return reachable >= reviewThreshold;
    }
}
