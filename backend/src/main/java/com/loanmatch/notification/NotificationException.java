package com.loanmatch.notification;

/**
 * Thrown when the completion notification could not be delivered.
 */
public class NotificationException extends RuntimeException {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
