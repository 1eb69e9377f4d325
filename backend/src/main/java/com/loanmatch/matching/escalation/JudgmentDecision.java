package com.loanmatch.matching.escalation;

public enum JudgmentDecision {
    APPROVE,
    REJECT
}
