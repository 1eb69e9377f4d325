package com.loanmatch.matching.pipeline;

import com.loanmatch.matching.config.AsyncConfig;
import com.loanmatch.domain.Applicant;
import com.loanmatch.domain.LoanProduct;
import com.loanmatch.domain.Match;
import com.loanmatch.domain.MatchType;
import com.loanmatch.matching.config.MatchingProperties;
import com.loanmatch.matching.escalation.Escalator;
import com.loanmatch.matching.escalation.Judgment;
import com.loanmatch.matching.index.ProductIndex;
import com.loanmatch.matching.scoring.ApplicantProfile;
import com.loanmatch.matching.scoring.ApplicantValidator;
import com.loanmatch.matching.scoring.Classification;
import com.loanmatch.matching.scoring.EligibilityScorer;
import com.loanmatch.matching.scoring.ScoreBreakdown;
import com.loanmatch.matching.scoring.ScoreClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Decides every applicant of a claimed chunk: validate, narrow to candidate products, score, classify, and escalate
 * Review-band pairs. Escalations of the whole chunk run concurrently on the escalation executor and are all resolved
 * before any decision is returned. No storage writes happen here. At most max-matches-per-applicant pairs are kept
 * per applicant; Review pairs are escalated only while free slots remain.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChunkEvaluator {

    /** Highest score first, then AUTO before ESCALATED, then cheaper rate, then product id. */
    static final Comparator<Candidate> PREFERENCE = Comparator
            .comparingInt(Candidate::score).reversed()
            .thenComparing(c -> c.matchType() == MatchType.AUTO ? 0 : 1)
            .thenComparing(c -> c.product().getInterestRateMin(), Comparator.nullsLast(Comparator.<BigDecimal>naturalOrder()))
            .thenComparing(c -> c.product().getId());

    private final ApplicantValidator applicantValidator;
    private final EligibilityScorer eligibilityScorer;
    private final ScoreClassifier scoreClassifier;
    private final Escalator escalator;
    private final MatchingProperties matchingProperties;
    @Qualifier(AsyncConfig.ESCALATION_EXECUTOR)
    private final Executor escalationExecutor;
    private final Clock clock;

    /** Validates, narrows and scores every applicant; Review-band pairs are queued, not yet judged. */
    ChunkPlan score(List<Applicant> applicants, ProductIndex index) {
        List<Plan> plans = new ArrayList<>(applicants.size());
        for (Applicant applicant : applicants) {
            plans.add(plan(applicant, index));
        }
        return new ChunkPlan(plans);
    }

    /** Judges all queued Review-band pairs concurrently, waits for every one, then builds the decisions. */
    List<ApplicantDecision> escalateAndResolve(ChunkPlan chunkPlan, ProductIndex index) {
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (Plan plan : chunkPlan.plans) {
            for (Review review : plan.reviews) {
                pending.add(CompletableFuture
                        .supplyAsync(() -> escalator.judge(plan.profile, review.candidate.product(), review.breakdown, index),
                                escalationExecutor)
                        .thenAccept(judgment -> review.judgment = judgment));
            }
        }
        CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();

        Instant now = clock.instant();
        List<ApplicantDecision> decisions = new ArrayList<>(chunkPlan.plans.size());
        for (Plan plan : chunkPlan.plans) {
            decisions.add(plan.skipReason != null
                    ? ApplicantDecision.skipped(plan.applicantId, plan.skipReason)
                    : resolve(plan, now));
        }
        return decisions;
    }

    public List<ApplicantDecision> evaluate(List<Applicant> applicants, ProductIndex index) {
        return escalateAndResolve(score(applicants, index), index);
    }

    private Plan plan(Applicant applicant, ProductIndex index) {
        ApplicantValidator.Result validation = applicantValidator.validate(applicant);
        if (!validation.isValid()) {
            log.warn("Skipping malformed applicant {} in batch {}: {}", applicant.getId(), applicant.getBatchId(), validation.skipReason());
            return new Plan(applicant.getId(), null, validation.skipReason());
        }
        ApplicantProfile profile = validation.profile();
        Plan plan = new Plan(profile.applicantId(), profile, null);
        List<Review> reviews = new ArrayList<>();
        for (LoanProduct product : index.candidatesFor(profile)) {
            ScoreBreakdown breakdown = eligibilityScorer.breakdown(profile, product);
            int score = breakdown.total();
            Classification classification = scoreClassifier.classify(score);
            switch (classification) {
                case AUTO_APPROVE -> plan.autos.add(new Candidate(product, score, MatchType.AUTO,
                        "Auto-approved with score " + score + "; passed " + breakdown.passedChecks()));
                case REVIEW -> reviews.add(new Review(new Candidate(product, score, MatchType.ESCALATED, null), breakdown));
                case AUTO_REJECT -> plan.autoRejected++;
            }
        }
        plan.autos.sort(PREFERENCE);
        reviews.sort(Comparator.comparing((Review r) -> r.candidate, PREFERENCE));
        int cap = matchingProperties.getMaxMatchesPerApplicant();
        if (cap > 0) {
            int freeSlots = Math.max(0, cap - plan.autos.size());
            if (reviews.size() > freeSlots) {
                log.debug("Applicant {}: {} review pairs beyond the match cap are not escalated",
                        profile.applicantId(), reviews.size() - freeSlots);
                reviews = reviews.subList(0, freeSlots);
            }
        }
        plan.reviews.addAll(reviews);
        return plan;
    }

    private ApplicantDecision resolve(Plan plan, Instant now) {
        List<Candidate> approved = new ArrayList<>(plan.autos);
        int approvedAfterEscalation = 0;
        int rejectedAfterEscalation = 0;
        for (Review review : plan.reviews) {
            Judgment judgment = review.judgment;
            if (judgment != null && judgment.approved()) {
                approvedAfterEscalation++;
                Candidate c = review.candidate;
                approved.add(new Candidate(c.product(), c.score(), MatchType.ESCALATED, judgment.rationale()));
            } else {
                rejectedAfterEscalation++;
            }
        }
        approved.sort(PREFERENCE);
        int cap = matchingProperties.getMaxMatchesPerApplicant();
        if (cap > 0 && approved.size() > cap) {
            approved = approved.subList(0, cap);
        }
        List<Match> matches = new ArrayList<>(approved.size());
        for (Candidate c : approved) {
            matches.add(toMatch(plan.profile, c, now));
        }
        return new ApplicantDecision(plan.applicantId, null, matches, plan.autos.size(), plan.reviews.size(),
                approvedAfterEscalation, plan.autoRejected, rejectedAfterEscalation);
    }

    private static Match toMatch(ApplicantProfile profile, Candidate candidate, Instant now) {
        Match match = new Match();
        match.setId(Match.naturalKey(profile.applicantId(), candidate.product().getId(), profile.batchId()));
        match.setApplicantId(profile.applicantId());
        match.setProductId(candidate.product().getId());
        match.setBatchId(profile.batchId());
        match.setScore(candidate.score());
        match.setMatchType(candidate.matchType());
        match.setRationale(candidate.rationale());
        match.setCreatedAt(now);
        return match;
    }

    record Candidate(LoanProduct product, int score, MatchType matchType, String rationale) {
    }

    private static final class Review {
        private final Candidate candidate;
        private final ScoreBreakdown breakdown;
        private volatile Judgment judgment;

        private Review(Candidate candidate, ScoreBreakdown breakdown) {
            this.candidate = candidate;
            this.breakdown = breakdown;
        }
    }

    static final class ChunkPlan {
        private final List<Plan> plans;

        private ChunkPlan(List<Plan> plans) {
            this.plans = plans;
        }

        int pendingEscalations() {
            int n = 0;
            for (Plan plan : plans) {
                n += plan.reviews.size();
            }
            return n;
        }
    }

    private static final class Plan {
        private final String applicantId;
        private final ApplicantProfile profile;
        private final String skipReason;
        private final List<Candidate> autos = new ArrayList<>();
        private final List<Review> reviews = new ArrayList<>();
        private int autoRejected;

        private Plan(String applicantId, ApplicantProfile profile, String skipReason) {
            this.applicantId = applicantId;
            this.profile = profile;
            this.skipReason = skipReason;
        }
    }
}
