package com.loanmatch.matching.job;

import com.loanmatch.domain.ApplicantRepository;
import com.loanmatch.domain.BatchCompletionRepository;
import com.loanmatch.matching.config.MatchingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class StaleBatchResumeJobTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock private ApplicantRepository applicantRepository;
    @Mock private BatchCompletionRepository batchCompletionRepository;
    @Mock private MatchingRunLauncher launcher;

    private MatchingProperties properties;
    private StaleBatchResumeJob job;

    @BeforeEach
    void setUp() {
        properties = new MatchingProperties();
        job = new StaleBatchResumeJob(applicantRepository, batchCompletionRepository, launcher, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
        when(launcher.launch(any())).thenReturn(LaunchOutcome.STARTED);
    }

    @Test
    void relaunchesClaimableAndUnnotifiedBatches_once() {
        when(applicantRepository.findBatchIdsWithClaimableWork(NOW.minus(properties.getClaimLease())))
                .thenReturn(List.of("B1", "B2"));
        when(batchCompletionRepository.findStartedBatchIds(List.of("B1", "B2"))).thenReturn(List.of("B1", "B2"));
        when(batchCompletionRepository.findBatchIdsAwaitingNotification(NOW.minus(properties.getNotifyLease())))
                .thenReturn(List.of("B2", "B3"));
        when(launcher.isRunning("B1")).thenReturn(true);

        job.resumeStaleBatches();

        verify(launcher, never()).launch("B1");
        verify(launcher, times(1)).launch("B2");
        verify(launcher, times(1)).launch("B3");
    }

    @Test
    @DisplayName("claimable batch that was never launched is left alone")
    void claimableButNeverStarted_isNotLaunched() {
        when(applicantRepository.findBatchIdsWithClaimableWork(NOW.minus(properties.getClaimLease())))
                .thenReturn(List.of("INGESTING", "CRASHED"));
        when(batchCompletionRepository.findStartedBatchIds(List.of("INGESTING", "CRASHED"))).thenReturn(List.of("CRASHED"));
        when(batchCompletionRepository.findBatchIdsAwaitingNotification(NOW.minus(properties.getNotifyLease())))
                .thenReturn(List.of());

        job.resumeStaleBatches();

        verify(launcher, never()).launch("INGESTING");
        verify(launcher, times(1)).launch("CRASHED");
    }

    @Test
    void disabled_doesNothing() {
        properties.getResume().setEnabled(false);

        job.resumeStaleBatches();

        verifyNoInteractions(applicantRepository, batchCompletionRepository, launcher);
    }
}
