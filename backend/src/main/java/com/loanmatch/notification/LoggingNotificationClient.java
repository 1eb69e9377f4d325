package com.loanmatch.notification;

import lombok.extern.slf4j.Slf4j;

/**
 * Used when no webhook is configured: the completion is only logged.
 */
@Slf4j
public class LoggingNotificationClient implements NotificationClient {

    @Override
    public void batchMatched(BatchMatchedNotification notification) {
        log.info("Batch {} matched: {} applicants processed, {} matches created (no webhook configured)",
                notification.batchId(), notification.applicantsProcessed(), notification.matchesCreated());
    }
}
