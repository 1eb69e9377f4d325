package com.loanmatch.api.dto;

import java.time.Instant;

public record MatchResponse(
        String id,
        String applicantId,
        String productId,
        String batchId,
        int score,
        String matchType,
        String rationale,
        boolean notificationSent,
        Instant createdAt
) {
}
