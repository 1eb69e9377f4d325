package com.loanmatch.matching.escalation;

import reactor.core.publisher.Mono;

/**
 * Used when no judgment service is configured. Every call fails, so escalation fails open to REJECT.
 */
public class UnavailableJudgmentClient implements JudgmentClient {

    @Override
    public Mono<String> judge(JudgmentRequest request) {
        return Mono.error(new JudgmentException("Judgment service not configured"));
    }
}
