package com.loanmatch.api.controller;

import com.loanmatch.api.dto.BatchMatchingStatusResponse;
import com.loanmatch.api.dto.ErrorBody;
import com.loanmatch.api.dto.MatchingRunResponse;
import com.loanmatch.api.validation.BatchIdValidator;
import com.loanmatch.matching.job.LaunchOutcome;
import com.loanmatch.matching.job.MatchingRunLauncher;
import com.loanmatch.matching.query.BatchMatchingStatus;
import com.loanmatch.matching.query.MatchingQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST/DELETE/GET /batches/{batchId}/matching: start, cancel and inspect a batch's matching run.
 */
@RestController
@RequestMapping("/api/v1/batches")
@RequiredArgsConstructor
public class MatchingController {

    private final BatchIdValidator batchIdValidator;
    private final MatchingRunLauncher matchingRunLauncher;
    private final MatchingQueryService matchingQueryService;

    @PostMapping("/{batchId}/matching")
    public ResponseEntity<?> start(@PathVariable String batchId) {
        if (!batchIdValidator.isValid(batchId)) {
            return invalidBatchId();
        }
        String id = batchId.trim();
        if (!matchingQueryService.batchExists(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorBody.of("BATCH_NOT_FOUND", "No applicants found for batch " + id));
        }
        LaunchOutcome outcome = matchingRunLauncher.launch(id);
        String message = outcome == LaunchOutcome.STARTED ? "Matching started" : "Matching already running";
        return ResponseEntity.accepted().body(new MatchingRunResponse(id, outcome.name(), message));
    }

    @DeleteMapping("/{batchId}/matching")
    public ResponseEntity<?> cancel(@PathVariable String batchId) {
        if (!batchIdValidator.isValid(batchId)) {
            return invalidBatchId();
        }
        String id = batchId.trim();
        if (!matchingRunLauncher.cancel(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorBody.of("NOT_RUNNING", "No matching run in progress for batch " + id));
        }
        return ResponseEntity.accepted().body(new MatchingRunResponse(id, "CANCELLING", "Cancellation requested"));
    }

    @GetMapping("/{batchId}/matching")
    public ResponseEntity<?> status(@PathVariable String batchId) {
        if (!batchIdValidator.isValid(batchId)) {
            return invalidBatchId();
        }
        return matchingQueryService.findStatus(batchId.trim())
                .<ResponseEntity<?>>map(s -> ResponseEntity.ok(toResponse(s)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of("BATCH_NOT_FOUND", "No applicants found for batch " + batchId.trim())));
    }

    private static ResponseEntity<ErrorBody> invalidBatchId() {
        return ResponseEntity.badRequest()
                .body(ErrorBody.of("INVALID_BATCH_ID", "Batch id must be 1-50 letters, digits, '_' or '-'"));
    }

    static String stateOf(BatchMatchingStatus s) {
        if (s.notifiedAt() != null) return "COMPLETED";
        if (s.running()) return "RUNNING";
        if (s.unprocessedApplicants() == 0) return "DRAINED";
        return s.unprocessedApplicants() < s.totalApplicants() ? "PARTIAL" : "PENDING";
    }

    private static BatchMatchingStatusResponse toResponse(BatchMatchingStatus s) {
        return new BatchMatchingStatusResponse(
                s.batchId(),
                stateOf(s),
                s.totalApplicants(),
                s.unprocessedApplicants(),
                s.matchesStored(),
                new BatchMatchingStatusResponse.Counters(
                        s.applicantsProcessed(),
                        s.applicantsSkipped(),
                        s.autoApproved(),
                        s.escalated(),
                        s.approvedAfterEscalation(),
                        s.autoRejected(),
                        s.rejectedAfterEscalation()),
                s.drainedAt(),
                s.notifiedAt());
    }
}
