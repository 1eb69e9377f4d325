package com.loanmatch.domain;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Employment categories used by product eligibility. Raw labels are case-insensitive and accept aliases.
 */
public enum EmploymentStatus {
    SALARIED,
    SELF_EMPLOYED,
    BUSINESS,
    PROFESSIONAL;

    private static final Map<String, EmploymentStatus> LABELS = Map.of(
            "salaried", SALARIED,
            "employed", SALARIED,
            "self_employed", SELF_EMPLOYED,
            "selfemployed", SELF_EMPLOYED,
            "business", BUSINESS,
            "professional", PROFESSIONAL
    );

    /**
     * Parses a raw label ("Self-Employed", "salaried", "employed", ...). Empty when blank or unknown.
     */
    public static Optional<EmploymentStatus> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String key = raw.strip().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return Optional.ofNullable(LABELS.get(key));
    }

    /** True when employment income is expected to be regular month to month. */
    public boolean isStable() {
        return this == SALARIED;
    }
}
