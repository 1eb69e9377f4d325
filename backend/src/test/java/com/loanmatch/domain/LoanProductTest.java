package com.loanmatch.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class LoanProductTest {

    @Test
    void missingEligibilityFields_fallBackToDefaults() {
        LoanProduct p = new LoanProduct();

        assertThat(p.effectiveMinMonthlyIncome()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(p.effectiveMinCreditScore()).isEqualTo(300);
        assertThat(p.effectiveMaxCreditScore()).isEqualTo(900);
        assertThat(p.effectiveMinAge()).isEqualTo(21);
        assertThat(p.effectiveMaxAge()).isEqualTo(60);
        assertThat(p.acceptsAnyEmploymentStatus()).isTrue();
    }

    @Test
    void parsedEmploymentStatuses_dropsUnknownLabels() {
        LoanProduct p = new LoanProduct();
        p.setAllowedEmploymentStatuses(Set.of("salaried", "Self-Employed", "astronaut"));

        assertThat(p.acceptsAnyEmploymentStatus()).isFalse();
        assertThat(p.parsedEmploymentStatuses())
                .containsExactlyInAnyOrder(EmploymentStatus.SALARIED, EmploymentStatus.SELF_EMPLOYED);
    }
}
