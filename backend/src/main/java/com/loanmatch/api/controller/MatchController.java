package com.loanmatch.api.controller;

import com.loanmatch.api.dto.MatchResponse;
import com.loanmatch.matching.query.MatchingQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /matches: up to 100 stored matches, highest score first, optionally filtered by batch and applicant.
 */
@RestController
@RequestMapping("/api/v1/matches")
@RequiredArgsConstructor
public class MatchController {

    private final MatchingQueryService matchingQueryService;

    @GetMapping
    public ResponseEntity<List<MatchResponse>> getMatches(
            @RequestParam(required = false) String batchId,
            @RequestParam(required = false) String applicantId
    ) {
        return ResponseEntity.ok(matchingQueryService.findMatches(batchId, applicantId).stream()
                .map(m -> new MatchResponse(
                        m.getId(),
                        m.getApplicantId(),
                        m.getProductId(),
                        m.getBatchId(),
                        m.getScore(),
                        m.getMatchType() != null ? m.getMatchType().name() : null,
                        m.getRationale(),
                        m.isNotificationSent(),
                        m.getCreatedAt()))
                .toList());
    }
}
