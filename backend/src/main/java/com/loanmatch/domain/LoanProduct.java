package com.loanmatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/**
 * Loan product discovered by the crawler. Read-only for the engine; only active products are matched.
 * Missing eligibility fields fall back to: min income 0, credit [300, 900], age [21, 60].
 */
@Document(collection = "loan_products")
@CompoundIndex(name = "credit_range", def = "{'minCreditScore': 1, 'maxCreditScore': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LoanProduct {

    public static final int DEFAULT_MIN_CREDIT_SCORE = 300;
    public static final int DEFAULT_MAX_CREDIT_SCORE = 900;
    public static final int DEFAULT_MIN_AGE = 21;
    public static final int DEFAULT_MAX_AGE = 60;

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String productName;
    private String providerName;
    private BigDecimal interestRateMin;
    private BigDecimal interestRateMax;
    private BigDecimal minLoanAmount;
    private BigDecimal maxLoanAmount;
    private Integer minTenureMonths;
    private Integer maxTenureMonths;

    private BigDecimal minMonthlyIncome;
    private Integer minCreditScore;
    private Integer maxCreditScore;
    /** Raw employment labels; empty means any status is accepted. */
    private Set<String> allowedEmploymentStatuses = new HashSet<>();
    private Integer minAge;
    private Integer maxAge;

    private String sourceUrl;
    private String sourceWebsite;
    private Instant lastUpdated;
    @Indexed
    private boolean active = true;

    public BigDecimal effectiveMinMonthlyIncome() {
        return minMonthlyIncome != null ? minMonthlyIncome : BigDecimal.ZERO;
    }

    public int effectiveMinCreditScore() {
        return minCreditScore != null ? minCreditScore : DEFAULT_MIN_CREDIT_SCORE;
    }

    public int effectiveMaxCreditScore() {
        return maxCreditScore != null ? maxCreditScore : DEFAULT_MAX_CREDIT_SCORE;
    }

    public int effectiveMinAge() {
        return minAge != null ? minAge : DEFAULT_MIN_AGE;
    }

    public int effectiveMaxAge() {
        return maxAge != null ? maxAge : DEFAULT_MAX_AGE;
    }

    /**
     * Parsed allowed statuses. Unknown labels are dropped; an empty result means every status is accepted
     * only when no labels were configured at all.
     */
    public Set<EmploymentStatus> parsedEmploymentStatuses() {
        Set<EmploymentStatus> parsed = EnumSet.noneOf(EmploymentStatus.class);
        if (allowedEmploymentStatuses != null) {
            for (String label : allowedEmploymentStatuses) {
                EmploymentStatus.parse(label).ifPresent(parsed::add);
            }
        }
        return parsed;
    }

    public boolean acceptsAnyEmploymentStatus() {
        return allowedEmploymentStatuses == null
                || allowedEmploymentStatuses.stream().allMatch(s -> s == null || s.isBlank());
    }
}
