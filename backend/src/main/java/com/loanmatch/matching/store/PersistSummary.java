package com.loanmatch.matching.store;

/**
 * Result of persisting a set of matches: how many documents were inserted and how many were already present.
 */
public record PersistSummary(long created, long alreadyPresent) {

    public static final PersistSummary EMPTY = new PersistSummary(0, 0);

    public PersistSummary plus(PersistSummary other) {
        return new PersistSummary(created + other.created, alreadyPresent + other.alreadyPresent);
    }
}
