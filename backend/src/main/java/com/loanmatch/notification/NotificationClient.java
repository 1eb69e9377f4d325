package com.loanmatch.notification;

/**
 * Delivers the "batch matched" signal. Delivery is at-least-once: a crash between delivery and bookkeeping may repeat it.
 */
public interface NotificationClient {

    /**
     * @throws NotificationException when delivery failed
     */
    void batchMatched(BatchMatchedNotification notification);
}
