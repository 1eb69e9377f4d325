package com.loanmatch.matching.escalation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loanmatch.domain.EmploymentStatus;
import com.loanmatch.domain.LoanProduct;
import com.loanmatch.matching.config.EscalationConfig;
import com.loanmatch.matching.config.EscalationProperties;
import com.loanmatch.matching.index.CandidatePreFilter;
import com.loanmatch.matching.index.CreditScoreBuckets;
import com.loanmatch.matching.index.ProductIndex;
import com.loanmatch.matching.scoring.ApplicantProfile;
import com.loanmatch.matching.scoring.EligibilityScorer;
import com.loanmatch.matching.scoring.ScoreBreakdown;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.loanmatch.matching.TestFixtures.product;
import static com.loanmatch.matching.TestFixtures.profile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EscalatorTest {

    @Mock
    private JudgmentClient judgmentClient;

    private EscalationProperties properties;
    private CircuitBreaker circuitBreaker;
    private Escalator escalator;

    private final LoanProduct product = product("HDFC_PL", "50000", 700, 900, 21, 60, "salaried");
    private final ApplicantProfile applicant = profile("U1", "B1", "40000", 690, 30, EmploymentStatus.SALARIED);
    private final ScoreBreakdown breakdown = new EligibilityScorer().breakdown(applicant, product);
    private final ProductIndex index = ProductIndex.build(List.of(product), CreditScoreBuckets.defaults(),
            new CandidatePreFilter(50), Instant.parse("2025-03-01T10:00:00Z"));

    @BeforeEach
    void setUp() {
        properties = new EscalationProperties();
        properties.setTimeout(Duration.ofMillis(100));
        properties.setMaxAttempts(2);
        properties.setInitialBackoff(Duration.ofMillis(10));
        properties.setMaxRationaleLength(2000);
        EscalationConfig config = new EscalationConfig();
        circuitBreaker = config.judgmentCircuitBreaker(properties);
        escalator = new Escalator(judgmentClient, new FeatureSummaryBuilder(), properties, new ObjectMapper(),
                config.judgmentBulkhead(properties), circuitBreaker, config.judgmentRetry(properties));
    }

    @Test
    void approve_isReturnedWithRationale() {
        when(judgmentClient.judge(any())).thenReturn(Mono.just("{\"decision\":\"approve\",\"rationale\":\"stable income\"}"));

        Judgment judgment = escalator.judge(applicant, product, breakdown, index);

        assertThat(judgment.approved()).isTrue();
        assertThat(judgment.failedOpen()).isFalse();
        assertThat(judgment.rationale()).isEqualTo("stable income");
    }

    @Test
    void reject_isReturned() {
        when(judgmentClient.judge(any())).thenReturn(Mono.just("{\"decision\":\"REJECT\",\"rationale\":\"thin file\"}"));

        Judgment judgment = escalator.judge(applicant, product, breakdown, index);

        assertThat(judgment.decision()).isEqualTo(JudgmentDecision.REJECT);
        assertThat(judgment.failedOpen()).isFalse();
    }

    @Test
    @DisplayName("service that never answers: every attempt times out, pair fails open to REJECT")
    void timeout_failsOpenAfterRetries() {
        when(judgmentClient.judge(any())).thenReturn(Mono.never());

        Judgment judgment = escalator.judge(applicant, product, breakdown, index);

        assertThat(judgment.decision()).isEqualTo(JudgmentDecision.REJECT);
        assertThat(judgment.failedOpen()).isTrue();
        verify(judgmentClient, times(2)).judge(any());
    }

    @Test
    void transientError_isRetried() {
        when(judgmentClient.judge(any()))
                .thenReturn(Mono.error(new JudgmentException("Judgment service returned 503")))
                .thenReturn(Mono.just("{\"decision\":\"APPROVE\"}"));

        Judgment judgment = escalator.judge(applicant, product, breakdown, index);

        assertThat(judgment.approved()).isTrue();
        assertThat(judgment.rationale()).isEmpty();
        verify(judgmentClient, times(2)).judge(any());
    }

    @Test
    @DisplayName("malformed response is not retried and fails open")
    void malformed_failsOpenWithoutRetry() {
        when(judgmentClient.judge(any())).thenReturn(Mono.just("{\"verdict\":\"maybe\"}"));

        Judgment judgment = escalator.judge(applicant, product, breakdown, index);

        assertThat(judgment.failedOpen()).isTrue();
        verify(judgmentClient, times(1)).judge(any());
    }

    @Test
    void openCircuit_failsOpenWithoutCalling() {
        circuitBreaker.transitionToOpenState();

        Judgment judgment = escalator.judge(applicant, product, breakdown, index);

        assertThat(judgment.failedOpen()).isTrue();
        assertThat(judgment.rationale()).contains("circuit open");
        verify(judgmentClient, never()).judge(any());
    }

    @Test
    void longRationale_isTruncated() {
        properties.setMaxRationaleLength(5);
        when(judgmentClient.judge(any())).thenReturn(Mono.just("{\"decision\":\"APPROVE\",\"rationale\":\"abcdefghij\"}"));

        assertThat(escalator.judge(applicant, product, breakdown, index).rationale()).isEqualTo("abcde");
    }

    @Test
    void unavailableClient_failsOpen() {
        EscalationConfig config = new EscalationConfig();
        Escalator unconfigured = new Escalator(new UnavailableJudgmentClient(), new FeatureSummaryBuilder(), properties,
                new ObjectMapper(), config.judgmentBulkhead(properties), config.judgmentCircuitBreaker(properties),
                config.judgmentRetry(properties));

        Judgment judgment = unconfigured.judge(applicant, product, breakdown, index);

        assertThat(judgment.failedOpen()).isTrue();
        assertThat(judgment.rationale()).contains("not configured");
    }
}
