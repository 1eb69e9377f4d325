package com.loanmatch.domain;

/**
 * Decision provenance of a persisted match.
 */
public enum MatchType {
    /** Score reached the approve threshold. */
    AUTO,
    /** Review-band score approved by the external judgment service. */
    ESCALATED,
    /** Created by an operator outside the engine. */
    MANUAL
}
