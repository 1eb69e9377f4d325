package com.loanmatch.matching.pipeline;

/**
 * Storage kept failing after the retry budget was spent. Aborts the run; unprocessed applicants stay claimable.
 */
public class MatchingStorageException extends RuntimeException {

    public MatchingStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
