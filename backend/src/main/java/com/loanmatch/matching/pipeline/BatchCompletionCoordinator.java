package com.loanmatch.matching.pipeline;

import com.loanmatch.domain.ApplicantRepository;
import com.loanmatch.domain.BatchCompletion;
import com.loanmatch.domain.BatchCompletionRepository;
import com.loanmatch.domain.MatchRepository;
import com.loanmatch.matching.config.MatchingProperties;
import com.loanmatch.notification.BatchMatchedNotification;
import com.loanmatch.notification.NotificationClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Turns "my claim came back empty" into exactly one completion notification per batch. A batch counts as drained only
 * when no applicant is left unprocessed; the notify lease keeps concurrent drainers from both sending.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchCompletionCoordinator {

    private final ApplicantRepository applicantRepository;
    private final MatchRepository matchRepository;
    private final BatchCompletionRepository batchCompletionRepository;
    private final NotificationClient notificationClient;
    private final MatchingProperties matchingProperties;
    private final Clock clock;

    public CompletionOutcome onDrained(String batchId, String owner) {
        long remaining = applicantRepository.countByBatchIdAndProcessedFalse(batchId);
        if (remaining > 0) {
            log.debug("Batch {} has {} applicants held by other workers; not complete yet", batchId, remaining);
            return CompletionOutcome.WORK_IN_FLIGHT;
        }
        Instant now = clock.instant();
        batchCompletionRepository.recordDrained(batchId, now);
        Optional<BatchCompletion> lease = batchCompletionRepository.acquireNotifyLease(
                batchId, owner, now, now.minus(matchingProperties.getNotifyLease()));
        if (lease.isEmpty()) {
            return CompletionOutcome.HANDLED_ELSEWHERE;
        }
        BatchMatchedNotification notification = new BatchMatchedNotification(
                batchId,
                applicantRepository.countByBatchId(batchId),
                matchRepository.countByBatchId(batchId),
                now);
        try {
            notificationClient.batchMatched(notification);
        } catch (RuntimeException e) {
            log.error("Completion notification failed for batch {} (attempt {}): {}",
                    batchId, lease.get().getNotificationAttempts(), e.getMessage());
            batchCompletionRepository.releaseNotifyLease(batchId, owner);
            return CompletionOutcome.NOTIFICATION_FAILED;
        }
        if (!batchCompletionRepository.markNotified(batchId, owner, clock.instant())) {
            log.warn("Notify lease for batch {} expired during delivery; notification may be repeated", batchId);
        }
        log.info("Batch {} complete: {} applicants, {} matches; notification sent",
                batchId, notification.applicantsProcessed(), notification.matchesCreated());
        return CompletionOutcome.NOTIFIED;
    }
}
