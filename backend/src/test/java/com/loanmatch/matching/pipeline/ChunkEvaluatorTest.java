package com.loanmatch.matching.pipeline;

import com.loanmatch.domain.LoanProduct;
import com.loanmatch.domain.Match;
import com.loanmatch.domain.MatchType;
import com.loanmatch.matching.config.MatchingProperties;
import com.loanmatch.matching.escalation.Escalator;
import com.loanmatch.matching.escalation.Judgment;
import com.loanmatch.matching.escalation.JudgmentDecision;
import com.loanmatch.matching.index.CandidatePreFilter;
import com.loanmatch.matching.index.CreditScoreBuckets;
import com.loanmatch.matching.index.ProductIndex;
import com.loanmatch.matching.scoring.ApplicantValidator;
import com.loanmatch.matching.scoring.EligibilityScorer;
import com.loanmatch.matching.scoring.ScoreClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.loanmatch.matching.TestFixtures.applicant;
import static com.loanmatch.matching.TestFixtures.product;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChunkEvaluatorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private Escalator escalator;

    private MatchingProperties properties;
    private ChunkEvaluator evaluator;

    // applicant U1: income 60000, credit 720, age 30, salaried
    private final LoanProduct fullA = rate(product("A_PL", "0", 300, 900, 21, 60), "12.00");
    private final LoanProduct fullB = rate(product("B_PL", "0", 300, 900, 21, 60), "10.00");
    private final LoanProduct fullC = rate(product("C_PL", "0", 300, 900, 21, 60), "11.00");
    /** income + credit pass → 60 */
    private final LoanProduct review60 = product("D_PL", "0", 300, 900, 40, 60, "business");
    /** credit + employment pass → 50 */
    private final LoanProduct review50 = product("E_PL", "100000", 300, 900, 40, 60, "salaried");

    @BeforeEach
    void setUp() {
        properties = new MatchingProperties();
        evaluator = new ChunkEvaluator(new ApplicantValidator(), new EligibilityScorer(), new ScoreClassifier(70, 50),
                escalator, properties, Runnable::run, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("cap keeps the best auto-approved pairs by score, then lower rate; no review pair is escalated without a free slot")
    void capAndTieBreak_autoOnly() {
        properties.setMaxMatchesPerApplicant(2);

        List<ApplicantDecision> decisions = evaluator.evaluate(
                List.of(applicant("U1", "B1", "60000", 720, 30, "salaried")),
                index(fullA, fullB, fullC, review60));

        ApplicantDecision d = decisions.get(0);
        assertThat(d.matches()).extracting(Match::getProductId).containsExactly("B_PL", "C_PL");
        assertThat(d.autoApproved()).isEqualTo(3);
        assertThat(d.escalated()).isZero();
        verify(escalator, never()).judge(any(), any(), any(), any());
    }

    @Test
    @DisplayName("only the preferred review pairs are escalated while slots remain")
    void reviewPairsFillFreeSlots() {
        properties.setMaxMatchesPerApplicant(2);
        when(escalator.judge(any(), any(), any(), any()))
                .thenReturn(new Judgment(JudgmentDecision.APPROVE, "fits", false));

        ApplicantDecision d = evaluator.evaluate(
                List.of(applicant("U1", "B1", "60000", 720, 30, "salaried")),
                index(fullA, review60, review50)).get(0);

        verify(escalator, times(1)).judge(any(), argThat(p -> p.getId().equals("D_PL")), any(), any());
        assertThat(d.matches()).extracting(Match::getProductId).containsExactly("A_PL", "D_PL");
        assertThat(d.matches()).extracting(Match::getMatchType).containsExactly(MatchType.AUTO, MatchType.ESCALATED);
        assertThat(d.matches().get(1).getRationale()).isEqualTo("fits");
        assertThat(d.escalated()).isEqualTo(1);
        assertThat(d.approvedAfterEscalation()).isEqualTo(1);
    }

    @Test
    @DisplayName("failed-open escalations produce no match")
    void failOpenRejects() {
        properties.setMaxMatchesPerApplicant(0);
        when(escalator.judge(any(), any(), any(), any())).thenReturn(Judgment.failOpen("timed out"));

        ApplicantDecision d = evaluator.evaluate(
                List.of(applicant("U1", "B1", "60000", 720, 30, "salaried")),
                index(fullA, review60, review50)).get(0);

        assertThat(d.matches()).extracting(Match::getProductId).containsExactly("A_PL");
        assertThat(d.escalated()).isEqualTo(2);
        assertThat(d.rejectedAfterEscalation()).isEqualTo(2);
    }

    @Test
    void matchCarriesNaturalKeyAndScore() {
        Match m = evaluator.evaluate(List.of(applicant("U1", "B1", "60000", 720, 30, "salaried")), index(fullA))
                .get(0).matches().get(0);

        assertThat(m.getId()).isEqualTo("U1:A_PL:B1");
        assertThat(m.getScore()).isEqualTo(100);
        assertThat(m.getBatchId()).isEqualTo("B1");
        assertThat(m.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void malformedApplicant_isSkipped() {
        List<ApplicantDecision> decisions = evaluator.evaluate(
                List.of(applicant("U9", "B1", "60000", 950, 30, "salaried")), index(fullA));

        assertThat(decisions.get(0).isSkipped()).isTrue();
        assertThat(decisions.get(0).matches()).isEmpty();
    }

    private static ProductIndex index(LoanProduct... products) {
        return ProductIndex.build(List.of(products), CreditScoreBuckets.defaults(), new CandidatePreFilter(50), NOW);
    }

    private static LoanProduct rate(LoanProduct p, String rate) {
        p.setInterestRateMin(new BigDecimal(rate));
        return p;
    }
}
