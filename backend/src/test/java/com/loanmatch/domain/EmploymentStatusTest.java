package com.loanmatch.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class EmploymentStatusTest {

    @ParameterizedTest
    @CsvSource({
            "salaried, SALARIED",
            "Salaried, SALARIED",
            "employed, SALARIED",
            "self-employed, SELF_EMPLOYED",
            "Self Employed, SELF_EMPLOYED",
            "SELF_EMPLOYED, SELF_EMPLOYED",
            "selfemployed, SELF_EMPLOYED",
            "business, BUSINESS",
            "' professional ', PROFESSIONAL"
    })
    void parse_acceptsLabelsAndAliases(String raw, EmploymentStatus expected) {
        assertThat(EmploymentStatus.parse(raw)).contains(expected);
    }

    @Test
    @DisplayName("unknown or blank labels do not parse")
    void parse_unknown() {
        assertThat(EmploymentStatus.parse("retired")).isEmpty();
        assertThat(EmploymentStatus.parse("  ")).isEmpty();
        assertThat(EmploymentStatus.parse(null)).isEmpty();
    }

    @Test
    void onlySalariedIsStable() {
        assertThat(EmploymentStatus.SALARIED.isStable()).isTrue();
        assertThat(EmploymentStatus.SELF_EMPLOYED.isStable()).isFalse();
        assertThat(EmploymentStatus.BUSINESS.isStable()).isFalse();
    }
}
