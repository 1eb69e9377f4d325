package com.loanmatch.matching.scoring;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-check outcome of one (applicant, product) evaluation.
 */
public record ScoreBreakdown(boolean income, boolean credit, boolean age, boolean employment) {

    public int total() {
        return (income ? EligibilityScorer.INCOME_POINTS : 0)
                + (credit ? EligibilityScorer.CREDIT_POINTS : 0)
                + (age ? EligibilityScorer.AGE_POINTS : 0)
                + (employment ? EligibilityScorer.EMPLOYMENT_POINTS : 0);
    }

    public List<String> passedChecks() {
        return checks(true);
    }

    public List<String> failedChecks() {
        return checks(false);
    }

    private List<String> checks(boolean outcome) {
        List<String> names = new ArrayList<>(4);
        if (income == outcome) names.add("INCOME");
        if (credit == outcome) names.add("CREDIT");
        if (age == outcome) names.add("AGE");
        if (employment == outcome) names.add("EMPLOYMENT");
        return names;
    }
}
