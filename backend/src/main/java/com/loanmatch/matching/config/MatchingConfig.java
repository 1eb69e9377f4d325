package com.loanmatch.matching.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.loanmatch.common.RetryPolicy;
import com.loanmatch.matching.index.CandidatePreFilter;
import com.loanmatch.matching.index.CreditScoreBuckets;
import com.loanmatch.matching.index.ProductIndex;
import com.loanmatch.matching.scoring.ScoreClassifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Matching module configuration: validated properties and the funnel's shared, immutable collaborators.
 */
@Configuration
@EnableConfigurationProperties({ MatchingProperties.class, EscalationProperties.class })
public class MatchingConfig {

    public static final String PRODUCT_INDEX_CACHE = "productIndexCache";
    public static final String STORAGE_RETRY_POLICY = "storageRetryPolicy";

    private final MatchingProperties matchingProperties;

    public MatchingConfig(MatchingProperties matchingProperties, EscalationProperties escalationProperties) {
        matchingProperties.validate();
        escalationProperties.validate();
        this.matchingProperties = matchingProperties;
    }

    @Bean
    public CreditScoreBuckets creditScoreBuckets() {
        return new CreditScoreBuckets(matchingProperties.getBucketBoundaries());
    }

    @Bean
    public ScoreClassifier scoreClassifier() {
        return new ScoreClassifier(matchingProperties.getApproveThreshold(), matchingProperties.getReviewThreshold());
    }

    @Bean
    public CandidatePreFilter candidatePreFilter() {
        return new CandidatePreFilter(matchingProperties.getReviewThreshold());
    }

    @Bean(name = PRODUCT_INDEX_CACHE)
    public Cache<String, ProductIndex> productIndexCache() {
        return Caffeine.newBuilder()
                .expireAfterWrite(matchingProperties.getProductIndexTtl())
                .maximumSize(1)
                .build();
    }

    @Bean(name = STORAGE_RETRY_POLICY)
    public RetryPolicy storageRetryPolicy() {
        MatchingProperties.StorageRetry retry = matchingProperties.getStorageRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
    }

    @Bean
    public Clock matchingClock() {
        return Clock.systemUTC();
    }
}
