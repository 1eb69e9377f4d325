package com.loanmatch.matching.escalation;

/**
 * Thrown when a judgment call fails (transport, HTTP status, timeout or unusable response).
 */
public class JudgmentException extends RuntimeException {

    public JudgmentException(String message) {
        super(message);
    }

    public JudgmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
