package com.loanmatch.matching.escalation;

/**
 * Outcome of one escalation. failedOpen is true when the service could not be consulted and the pair was rejected.
 */
public record Judgment(JudgmentDecision decision, String rationale, boolean failedOpen) {

    public static Judgment failOpen(String reason) {
        return new Judgment(JudgmentDecision.REJECT, "Escalation unavailable: " + reason, true);
    }

    public boolean approved() {
        return decision == JudgmentDecision.APPROVE;
    }
}
