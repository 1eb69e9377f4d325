package com.loanmatch.notification;

import java.time.Instant;

/**
 * Payload of the batch completion notification.
 */
public record BatchMatchedNotification(
        String batchId,
        long applicantsProcessed,
        long matchesCreated,
        Instant completedAt
) {
}
