package com.loanmatch.matching.scoring;

import com.loanmatch.domain.Applicant;
import com.loanmatch.domain.EmploymentStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Rejects applicant records the scorer cannot evaluate. Malformed records are skipped, never retried.
 */
@Component
public class ApplicantValidator {

    public static final int MIN_CREDIT_SCORE = 300;
    public static final int MAX_CREDIT_SCORE = 900;
    public static final int MIN_AGE = 18;
    public static final int MAX_AGE = 100;

    public Result validate(Applicant applicant) {
        if (applicant.getId() == null || applicant.getId().isBlank()) {
            return Result.invalid("missing applicant id");
        }
        BigDecimal income = applicant.getMonthlyIncome();
        if (income == null || income.signum() < 0) {
            return Result.invalid("monthly income missing or negative");
        }
        Integer score = applicant.getCreditScore();
        if (score == null || score < MIN_CREDIT_SCORE || score > MAX_CREDIT_SCORE) {
            return Result.invalid("credit score outside " + MIN_CREDIT_SCORE + "-" + MAX_CREDIT_SCORE + ": " + score);
        }
        Integer age = applicant.getAge();
        if (age == null || age < MIN_AGE || age > MAX_AGE) {
            return Result.invalid("age outside " + MIN_AGE + "-" + MAX_AGE + ": " + age);
        }
        Optional<EmploymentStatus> status = EmploymentStatus.parse(applicant.getEmploymentStatus());
        if (status.isEmpty()) {
            return Result.invalid("unknown employment status: " + applicant.getEmploymentStatus());
        }
        return Result.valid(new ApplicantProfile(
                applicant.getId(), applicant.getBatchId(), income, score, age, status.get()));
    }

    /** Either a profile or the reason the record was rejected. */
    public record Result(ApplicantProfile profile, String skipReason) {

        static Result valid(ApplicantProfile profile) {
            return new Result(profile, null);
        }

        static Result invalid(String reason) {
            return new Result(null, reason);
        }

        public boolean isValid() {
            return profile != null;
        }
    }
}
