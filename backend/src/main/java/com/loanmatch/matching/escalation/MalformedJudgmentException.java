package com.loanmatch.matching.escalation;

/**
 * The service answered but the body is not a usable judgment. Not retried.
 */
public class MalformedJudgmentException extends JudgmentException {

    public MalformedJudgmentException(String message) {
        super(message);
    }

    public MalformedJudgmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
