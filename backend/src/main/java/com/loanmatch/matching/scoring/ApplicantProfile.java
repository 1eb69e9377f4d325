package com.loanmatch.matching.scoring;

import com.loanmatch.domain.EmploymentStatus;

import java.math.BigDecimal;

/**
 * Validated, immutable view of an applicant used by the index, scorer and escalation.
 */
public record ApplicantProfile(
        String applicantId,
        String batchId,
        BigDecimal monthlyIncome,
        int creditScore,
        int age,
        EmploymentStatus employmentStatus
) {
}
