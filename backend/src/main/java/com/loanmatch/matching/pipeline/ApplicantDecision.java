package com.loanmatch.matching.pipeline;

import com.loanmatch.domain.Match;

import java.util.List;

/**
 * Everything decided for one applicant in a chunk. Either skipReason is set (malformed record, no matches)
 * or matches holds the approved pairs after the per-applicant cap.
 */
public record ApplicantDecision(
        String applicantId,
        String skipReason,
        List<Match> matches,
        int autoApproved,
        int escalated,
        int approvedAfterEscalation,
        int autoRejected,
        int rejectedAfterEscalation
) {

    public static ApplicantDecision skipped(String applicantId, String reason) {
        return new ApplicantDecision(applicantId, reason, List.of(), 0, 0, 0, 0, 0);
    }

    public boolean isSkipped() {
        return skipReason != null;
    }
}
