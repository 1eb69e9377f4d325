package com.loanmatch.matching.scoring;

public enum Classification {
    AUTO_APPROVE,
    REVIEW,
    AUTO_REJECT
}
