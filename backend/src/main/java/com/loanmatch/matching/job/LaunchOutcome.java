package com.loanmatch.matching.job;

public enum LaunchOutcome {
    STARTED,
    ALREADY_RUNNING
}
