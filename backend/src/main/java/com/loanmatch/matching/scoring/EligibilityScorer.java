package com.loanmatch.matching.scoring;

import com.loanmatch.domain.LoanProduct;
import org.springframework.stereotype.Component;

/**
 * Additive eligibility score in [0, 100]. Pure: same inputs, same score; no I/O.
 * <ul>
 *   <li>income &gt;= product min monthly income: 30</li>
 *   <li>credit score within [min, max] inclusive: 30</li>
 *   <li>age within [min, max] inclusive: 20</li>
 *   <li>employment status allowed (or product accepts any): 20</li>
 * </ul>
 */
@Component
public class EligibilityScorer {

    public static final int INCOME_POINTS = 30;
    public static final int CREDIT_POINTS = 30;
    public static final int AGE_POINTS = 20;
    public static final int EMPLOYMENT_POINTS = 20;

    public int score(ApplicantProfile applicant, LoanProduct product) {
        return breakdown(applicant, product).total();
    }

    public ScoreBreakdown breakdown(ApplicantProfile applicant, LoanProduct product) {
        return new ScoreBreakdown(
                incomeSatisfied(applicant, product),
                creditSatisfied(applicant, product),
                ageSatisfied(applicant, product),
                employmentSatisfied(applicant, product));
    }

    public static boolean incomeSatisfied(ApplicantProfile applicant, LoanProduct product) {
        return applicant.monthlyIncome().compareTo(product.effectiveMinMonthlyIncome()) >= 0;
    }

    public static boolean creditSatisfied(ApplicantProfile applicant, LoanProduct product) {
        int score = applicant.creditScore();
        return score >= product.effectiveMinCreditScore() && score <= product.effectiveMaxCreditScore();
    }

    public static boolean ageSatisfied(ApplicantProfile applicant, LoanProduct product) {
        int age = applicant.age();
        return age >= product.effectiveMinAge() && age <= product.effectiveMaxAge();
    }

    public static boolean employmentSatisfied(ApplicantProfile applicant, LoanProduct product) {
        return product.acceptsAnyEmploymentStatus()
                || product.parsedEmploymentStatuses().contains(applicant.employmentStatus());
    }
}
