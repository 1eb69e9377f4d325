package com.loanmatch.matching.pipeline;

public enum CompletionOutcome {
    /** This worker delivered the notification. */
    NOTIFIED,
    /** Another worker still holds unprocessed applicants of the batch. */
    WORK_IN_FLIGHT,
    /** Already notified, or another drainer holds the notify lease. */
    HANDLED_ELSEWHERE,
    /** Delivery failed; the lease was released for the resume sweep. */
    NOTIFICATION_FAILED
}
