package com.loanmatch.matching.config;

import jakarta.validation.Valid;
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
 * Matching pipeline controls. Documented in application.yml under loanmatch.matching. Field bounds are checked on
 * binding; cross-field rules by {@link #validate()} at startup.
 */
@ConfigurationProperties(prefix = "loanmatch.matching")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class MatchingProperties {

    /** Max applicants claimed per chunk. */
    @Min(1)
    private int chunkSize = 100;

    /** Concurrent orchestrator loops per batch in this instance. */
    @Min(1)
    private int workers = 4;

    /** Age after which a claimed but unprocessed applicant may be claimed again. */
    @NotNull
    private Duration claimLease = Duration.ofMinutes(10);

    /** Lease on the right to deliver the completion notification. */
    @NotNull
    private Duration notifyLease = Duration.ofMinutes(5);

    /** Max matches persisted per applicant; 0 = unlimited. */
    @Min(0)
    private int maxMatchesPerApplicant = 10;

    /** Credit-score bucket edges: [e0,e1), [e1,e2), ..., [en-1,en]. */
    @NotNull
    private List<Integer> bucketBoundaries = new ArrayList<>(List.of(300, 500, 650, 750, 900));

    /** score >= approveThreshold is auto-approved. */
    private int approveThreshold = 70;

    /** reviewThreshold <= score < approveThreshold is escalated; below is auto-rejected. */
    private int reviewThreshold = 50;

    /** TTL of the cached product index snapshot. */
    @NotNull
    private Duration productIndexTtl = Duration.ofMinutes(5);

    @Valid
    private StorageRetry storageRetry = new StorageRetry();

    private Resume resume = new Resume();

    /**
     * Cross-field and duration checks. Collects every problem so an operator sees them all at once.
     *
     * @throws InvalidMatchingConfigurationException when any rule is violated
     */
    public void validate() {
        List<String> problems = new ArrayList<>();
        if (reviewThreshold < 0 || approveThreshold > 100 || reviewThreshold >= approveThreshold) {
            problems.add("thresholds must satisfy 0 <= review-threshold < approve-threshold <= 100 (was review="
                    + reviewThreshold + ", approve=" + approveThreshold + ")");
        }
        if (bucketBoundaries == null || bucketBoundaries.size() < 2) {
            problems.add("bucket-boundaries needs at least two edges");
        } else {
            for (int i = 1; i < bucketBoundaries.size(); i++) {
                Integer prev = bucketBoundaries.get(i - 1);
                Integer next = bucketBoundaries.get(i);
                if (prev == null || next == null || prev >= next) {
                    problems.add("bucket-boundaries must be strictly increasing (was " + bucketBoundaries + ")");
                    break;
                }
            }
        }
        if (isNotPositive(claimLease)) {
            problems.add("claim-lease must be positive");
        }
        if (isNotPositive(notifyLease)) {
            problems.add("notify-lease must be positive");
        }
        if (isNotPositive(productIndexTtl)) {
            problems.add("product-index-ttl must be positive");
        }
        if (!problems.isEmpty()) {
            throw new InvalidMatchingConfigurationException(problems);
        }
    }

    static boolean isNotPositive(Duration d) {
        return d == null || d.isZero() || d.isNegative();
    }

    @Getter
    @Setter
    public static class StorageRetry {
        /** Base delay in ms; doubles each attempt. */
        private long baseDelayMs = 500L;
        /** Backoff ceiling in ms. */
        private long maxDelayMs = 10_000L;
        /** Jitter factor 0..1 (0.2 = ±20%). */
        private double jitterFactor = 0.2;
        /** Total attempts per chunk step, including the first. */
        @Min(1)
        private int maxAttempts = 4;
    }

    @Getter
    @Setter
    public static class Resume {
        /** Periodically relaunch batches with claimable work or a missing notification. */
        private boolean enabled = true;
        /** Sweep interval in ms. */
        private long intervalMs = 60_000L;
    }
}
