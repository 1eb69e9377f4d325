package com.loanmatch.matching.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * External judgment service client settings. Documented in application.yml under loanmatch.escalation.
 */
@ConfigurationProperties(prefix = "loanmatch.escalation")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class EscalationProperties {

    /** Judgment service base URL. Blank: every escalation fails open to REJECT. */
    private String baseUrl = "";

    private String judgePath = "/v1/judgments";

    /** Hard timeout per call attempt. */
    @NotNull
    private Duration timeout = Duration.ofSeconds(5);

    /** Concurrency cap across all workers; sizes the escalation executor and bulkhead. */
    @Min(1)
    private int maxConcurrentCalls = 4;

    /** How long a call may wait for a bulkhead slot before failing open. */
    @NotNull
    private Duration maxQueueWait = Duration.ofSeconds(10);

    /** Total attempts per escalation, including the first. */
    @Min(1)
    private int maxAttempts = 3;

    private Duration initialBackoff = Duration.ofMillis(200);

    private double backoffMultiplier = 2.0;

    /** Rationale text longer than this is truncated before it is stored. */
    @Min(1)
    private int maxRationaleLength = 2000;

    private CircuitBreakerSettings circuitBreaker = new CircuitBreakerSettings();

    public void validate() {
        List<String> problems = new ArrayList<>();
        if (MatchingProperties.isNotPositive(timeout)) {
            problems.add("escalation.timeout must be positive");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            problems.add("escalation.initial-backoff must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            problems.add("escalation.backoff-multiplier must be >= 1.0 (was " + backoffMultiplier + ")");
        }
        if (!problems.isEmpty()) {
            throw new InvalidMatchingConfigurationException(problems);
        }
    }

    @Getter
    @Setter
    public static class CircuitBreakerSettings {
        /** Failure rate (percent) that opens the circuit. */
        private float failureRateThreshold = 50f;
        private int slidingWindowSize = 20;
        private int minimumNumberOfCalls = 10;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
    }
}
