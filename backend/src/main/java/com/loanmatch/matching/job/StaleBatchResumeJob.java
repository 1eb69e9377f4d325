package com.loanmatch.matching.job;

import com.loanmatch.domain.ApplicantRepository;
import com.loanmatch.domain.BatchCompletionRepository;
import com.loanmatch.matching.config.MatchingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Relaunches batches left behind by crashed or failed runs: started batches with claimable applicants (unclaimed or
 * lease expired) and drained batches whose completion notification never went out. A batch nobody launched is never
 * started here, since ingestion may still be writing it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaleBatchResumeJob {

    private final ApplicantRepository applicantRepository;
    private final BatchCompletionRepository batchCompletionRepository;
    private final MatchingRunLauncher matchingRunLauncher;
    private final MatchingProperties matchingProperties;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        resumeStaleBatches();
    }

    @Scheduled(initialDelayString = "${loanmatch.matching.resume.interval-ms:60000}",
            fixedDelayString = "${loanmatch.matching.resume.interval-ms:60000}")
    public void resumeStaleBatches() {
        if (!matchingProperties.getResume().isEnabled()) {
            return;
        }
        Instant now = clock.instant();
        List<String> claimable = applicantRepository.findBatchIdsWithClaimableWork(now.minus(matchingProperties.getClaimLease()));
        Set<String> batchIds = new LinkedHashSet<>(claimable);
        batchIds.retainAll(batchCompletionRepository.findStartedBatchIds(claimable));
        batchIds.addAll(batchCompletionRepository.findBatchIdsAwaitingNotification(now.minus(matchingProperties.getNotifyLease())));
        int launched = 0;
        for (String batchId : batchIds) {
            if (batchId == null || matchingRunLauncher.isRunning(batchId)) {
                continue;
            }
            try {
                if (matchingRunLauncher.launch(batchId) == LaunchOutcome.STARTED) {
                    launched++;
                }
            } catch (RuntimeException e) {
                log.warn("Could not resume batch {}: {}", batchId, e.getMessage());
            }
        }
        if (launched > 0) {
            log.info("Resumed {} batch(es) with pending matching work or notification", launched);
        }
    }
}
