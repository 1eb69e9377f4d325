package com.loanmatch.matching.pipeline;

import com.loanmatch.domain.Applicant;
import com.loanmatch.domain.ApplicantRepository;
import com.loanmatch.domain.BatchStats;
import com.loanmatch.domain.BatchStatsRepository;
import com.loanmatch.domain.LoanProductRepository;
import com.loanmatch.domain.Match;
import com.loanmatch.domain.MatchRepository;
import com.loanmatch.matching.index.ProductIndex;
import com.loanmatch.matching.index.ProductIndexProvider;
import com.loanmatch.matching.job.LaunchOutcome;
import com.loanmatch.matching.job.MatchingRunLauncher;
import com.loanmatch.matching.scoring.ApplicantValidator;
import com.loanmatch.matching.scoring.EligibilityScorer;
import com.loanmatch.notification.BatchMatchedNotification;
import com.loanmatch.notification.NotificationClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static com.loanmatch.matching.TestFixtures.applicant;
import static com.loanmatch.matching.TestFixtures.product;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@SpringBootTest(properties = {
        "loanmatch.matching.resume.enabled=false",
        "loanmatch.matching.chunk-size=7",
        "loanmatch.matching.workers=4",
        "loanmatch.escalation.max-attempts=1"
})
@Testcontainers
class PipelineIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    private static final String[] EMPLOYMENT = {"salaried", "self-employed", "employed", "business", "professional"};

    @MockBean
    NotificationClient notificationClient;

    @Autowired
    MatchingRunLauncher launcher;
    @Autowired
    ProductIndexProvider productIndexProvider;
    @Autowired
    ApplicantValidator applicantValidator;
    @Autowired
    EligibilityScorer eligibilityScorer;
    @Autowired
    ApplicantRepository applicantRepository;
    @Autowired
    LoanProductRepository loanProductRepository;
    @Autowired
    MatchRepository matchRepository;
    @Autowired
    BatchStatsRepository batchStatsRepository;

    @Test
    @DisplayName("four workers drain a batch exactly once and notify once; a rerun adds nothing")
    void fullBatch_processedOnce_notifiedOnce() throws Exception {
        String batchId = "e2e-" + UUID.randomUUID().toString().substring(0, 8);
        loanProductRepository.saveAll(List.of(
                product("HDFC_PL", "25000", 750, 900, 21, 60, "salaried"),
                product("ICICI_PL", "20000", 700, 900, 23, 58, "salaried", "self-employed"),
                product("SBI_PL", "15000", 650, 900, 21, 58, "salaried")));
        List<Applicant> applicants = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            applicants.add(applicant("U" + i + "-" + batchId, batchId, String.valueOf(10000 + 1000 * i),
                    300 + (i * 37) % 600, 19 + (i * 7) % 50, EMPLOYMENT[i % EMPLOYMENT.length]));
        }
        Applicant invalid = applicant("BAD-" + batchId, batchId, "50000", 950, 30, "salaried");
        applicants.add(invalid);
        applicantRepository.saveAll(applicants);
        ProductIndex index = productIndexProvider.refresh();

        assertThat(launcher.launch(batchId)).isEqualTo(LaunchOutcome.STARTED);
        awaitIdle(batchId);

        assertThat(applicantRepository.countByBatchIdAndProcessedFalse(batchId)).isZero();
        assertThat(applicantRepository.findById(invalid.getId())).get()
                .extracting(Applicant::getSkipReason).isNotNull();

        long expectedMatches = applicants.stream()
                .map(applicantValidator::validate)
                .filter(ApplicantValidator.Result::isValid)
                .mapToLong(r -> Math.min(10, index.candidatesFor(r.profile()).stream()
                        .filter(p -> eligibilityScorer.score(r.profile(), p) >= 70)
                        .count()))
                .sum();
        List<Match> matches = matchRepository.findByBatchId(batchId);
        assertThat(matches).hasSize((int) expectedMatches);
        Set<String> keys = new HashSet<>();
        matches.forEach(m -> keys.add(m.getApplicantId() + "|" + m.getProductId()));
        assertThat(keys).hasSize(matches.size());

        ArgumentCaptor<BatchMatchedNotification> sent = ArgumentCaptor.forClass(BatchMatchedNotification.class);
        verify(notificationClient, times(1)).batchMatched(sent.capture());
        assertThat(sent.getValue().batchId()).isEqualTo(batchId);

        BatchStats stats = batchStatsRepository.findById(batchId).orElseThrow();
        assertThat(stats.getApplicantsProcessed()).isEqualTo(60);
        assertThat(stats.getApplicantsSkipped()).isEqualTo(1);

        assertThat(launcher.launch(batchId)).isEqualTo(LaunchOutcome.STARTED);
        awaitIdle(batchId);
        assertThat(matchRepository.countByBatchId(batchId)).isEqualTo(expectedMatches);
        verify(notificationClient, times(1)).batchMatched(any());
    }

    private void awaitIdle(String batchId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 60_000;
        while (launcher.isRunning(batchId)) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Matching run for " + batchId + " did not finish in time");
            }
            Thread.sleep(100);
        }
    }
}
