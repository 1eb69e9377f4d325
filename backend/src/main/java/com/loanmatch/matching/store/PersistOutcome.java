package com.loanmatch.matching.store;

public enum PersistOutcome {
    CREATED,
    ALREADY_EXISTS
}
