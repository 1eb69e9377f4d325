package com.loanmatch.matching.config;

import com.loanmatch.matching.escalation.JudgmentClient;
import com.loanmatch.matching.escalation.MalformedJudgmentException;
import com.loanmatch.matching.escalation.UnavailableJudgmentClient;
import com.loanmatch.matching.escalation.WebClientJudgmentClient;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Escalation client and its Resilience4j guards: bulkhead (concurrency cap), retry (bounded exponential backoff)
 * and circuit breaker.
 */
@Configuration
@Slf4j
public class EscalationConfig {

    public static final String JUDGMENT_BULKHEAD = "judgmentBulkhead";
    public static final String JUDGMENT_RETRY = "judgmentRetry";
    public static final String JUDGMENT_CIRCUIT_BREAKER = "judgmentCircuitBreaker";

    @Bean
    @ConditionalOnMissingBean(JudgmentClient.class)
    public JudgmentClient judgmentClient(EscalationProperties properties, WebClient.Builder webClientBuilder) {
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            log.warn("loanmatch.escalation.base-url is not set: every Review-band pair will fail open to REJECT");
            return new UnavailableJudgmentClient();
        }
        return new WebClientJudgmentClient(webClientBuilder, properties.getBaseUrl(), properties.getJudgePath());
    }

    @Bean(name = JUDGMENT_BULKHEAD)
    public Bulkhead judgmentBulkhead(EscalationProperties properties) {
        BulkheadConfig config = BulkheadConfig.custom()
                .maxConcurrentCalls(properties.getMaxConcurrentCalls())
                .maxWaitDuration(properties.getMaxQueueWait())
                .build();
        return Bulkhead.of("judgment", config);
    }

    @Bean(name = JUDGMENT_RETRY)
    public Retry judgmentRetry(EscalationProperties properties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(properties.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        properties.getInitialBackoff(), properties.getBackoffMultiplier()))
                .retryOnException(e -> !(e instanceof MalformedJudgmentException)
                        && !(e instanceof CallNotPermittedException))
                .build();
        return Retry.of("judgment", config);
    }

    @Bean(name = JUDGMENT_CIRCUIT_BREAKER)
    public CircuitBreaker judgmentCircuitBreaker(EscalationProperties properties) {
        EscalationProperties.CircuitBreakerSettings settings = properties.getCircuitBreaker();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(settings.getFailureRateThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.getSlidingWindowSize())
                .minimumNumberOfCalls(settings.getMinimumNumberOfCalls())
                .waitDurationInOpenState(settings.getWaitDurationInOpenState())
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();
        return CircuitBreaker.of("judgment", config);
    }
}
