package com.loanmatch.matching.escalation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loanmatch.domain.LoanProduct;
import com.loanmatch.matching.config.EscalationConfig;
import com.loanmatch.matching.config.EscalationProperties;
import com.loanmatch.matching.index.ProductIndex;
import com.loanmatch.matching.scoring.ApplicantProfile;
import com.loanmatch.matching.scoring.ScoreBreakdown;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Asks the judgment service to decide a Review-band pair. Each attempt has a hard timeout; attempts are retried with
 * exponential backoff, gated by a circuit breaker, and capped by a bulkhead shared across workers. Any failure after
 * that resolves to REJECT (fail open); this never throws.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Escalator {

    private final JudgmentClient judgmentClient;
    private final FeatureSummaryBuilder featureSummaryBuilder;
    private final EscalationProperties properties;
    private final ObjectMapper objectMapper;
    @Qualifier(EscalationConfig.JUDGMENT_BULKHEAD)
    private final Bulkhead bulkhead;
    @Qualifier(EscalationConfig.JUDGMENT_CIRCUIT_BREAKER)
    private final CircuitBreaker circuitBreaker;
    @Qualifier(EscalationConfig.JUDGMENT_RETRY)
    private final Retry retry;

    public Judgment judge(ApplicantProfile applicant, LoanProduct product, ScoreBreakdown breakdown, ProductIndex index) {
        JudgmentRequest request = featureSummaryBuilder.build(applicant, product, breakdown, index);
        Supplier<Judgment> attempt = CircuitBreaker.decorateSupplier(circuitBreaker, () -> callOnce(request));
        Supplier<Judgment> guarded = Bulkhead.decorateSupplier(bulkhead, Retry.decorateSupplier(retry, attempt));
        try {
            return guarded.get();
        } catch (RuntimeException e) {
            String reason = describe(e);
            log.warn("Escalation failed open to REJECT: applicant={} product={} batch={} reason={}",
                    applicant.applicantId(), product.getId(), applicant.batchId(), reason);
            return Judgment.failOpen(reason);
        }
    }

    Judgment callOnce(JudgmentRequest request) {
        String body = judgmentClient.judge(request)
                .timeout(properties.getTimeout())
                .onErrorMap(TimeoutException.class,
                        e -> new JudgmentException("Judgment timed out after " + properties.getTimeout().toMillis() + "ms", e))
                .block();
        return parse(body);
    }

    /**
     * Expects {"decision": "APPROVE"|"REJECT", "rationale": "..."}; decision is case-insensitive.
     */
    Judgment parse(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedJudgmentException("Empty judgment response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new MalformedJudgmentException("Judgment response is not JSON", e);
        }
        JsonNode decisionNode = root.get("decision");
        if (decisionNode == null || !decisionNode.isTextual()) {
            throw new MalformedJudgmentException("Judgment response has no decision");
        }
        JudgmentDecision decision;
        try {
            decision = JudgmentDecision.valueOf(decisionNode.asText().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedJudgmentException("Unknown decision: " + decisionNode.asText(), e);
        }
        JsonNode rationaleNode = root.get("rationale");
        String rationale = rationaleNode != null && !rationaleNode.isNull() ? rationaleNode.asText() : "";
        return new Judgment(decision, truncate(rationale), false);
    }

    private String truncate(String rationale) {
        int max = properties.getMaxRationaleLength();
        return rationale.length() <= max ? rationale : rationale.substring(0, max);
    }

    private static String describe(RuntimeException e) {
        if (e instanceof CallNotPermittedException) {
            return "circuit open";
        }
        if (e instanceof BulkheadFullException) {
            return "concurrency limit reached";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
