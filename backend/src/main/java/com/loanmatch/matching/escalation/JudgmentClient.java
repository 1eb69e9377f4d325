package com.loanmatch.matching.escalation;

import reactor.core.publisher.Mono;

/**
 * External judgment service. Returns the raw JSON response body; parsing and timeouts are the caller's concern.
 */
public interface JudgmentClient {

    Mono<String> judge(JudgmentRequest request);
}
