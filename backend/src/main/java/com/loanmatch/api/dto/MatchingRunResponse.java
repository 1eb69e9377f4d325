package com.loanmatch.api.dto;

public record MatchingRunResponse(String batchId, String status, String message) {
}
