package com.loanmatch.api.dto;

import java.math.BigDecimal;
import java.util.Set;

public record ProductResponse(
        String id,
        String productName,
        String providerName,
        BigDecimal interestRateMin,
        BigDecimal interestRateMax,
        BigDecimal minLoanAmount,
        BigDecimal maxLoanAmount,
        BigDecimal minMonthlyIncome,
        int minCreditScore,
        int maxCreditScore,
        int minAge,
        int maxAge,
        Set<String> allowedEmploymentStatuses,
        String sourceUrl
) {
}
