package com.loanmatch.matching.scoring;

import lombok.Getter;

/**
 * Maps a score to a band: score &gt;= approve is AUTO_APPROVE, review &lt;= score &lt; approve is REVIEW,
 * anything lower is AUTO_REJECT.
 */
@Getter
public class ScoreClassifier {

    private final int approveThreshold;
    private final int reviewThreshold;

    public ScoreClassifier(int approveThreshold, int reviewThreshold) {
        if (reviewThreshold < 0 || approveThreshold > 100 || reviewThreshold >= approveThreshold) {
            throw new IllegalArgumentException("Require 0 <= review < approve <= 100, got review="
                    + reviewThreshold + " approve=" + approveThreshold);
        }
        this.approveThreshold = approveThreshold;
        this.reviewThreshold = reviewThreshold;
    }

    public Classification classify(int score) {
        if (score >= approveThreshold) {
            return Classification.AUTO_APPROVE;
        }
        if (score >= reviewThreshold) {
            return Classification.REVIEW;
        }
        return Classification.AUTO_REJECT;
    }
}
