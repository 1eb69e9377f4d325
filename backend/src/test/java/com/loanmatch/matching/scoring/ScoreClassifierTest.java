package com.loanmatch.matching.scoring;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoreClassifierTest {

    private final ScoreClassifier classifier = new ScoreClassifier(70, 50);

    @Test
    void classify_bandsAtBoundaries() {
        assertThat(classifier.classify(100)).isEqualTo(Classification.AUTO_APPROVE);
        assertThat(classifier.classify(70)).isEqualTo(Classification.AUTO_APPROVE);
        assertThat(classifier.classify(69)).isEqualTo(Classification.REVIEW);
        assertThat(classifier.classify(50)).isEqualTo(Classification.REVIEW);
        assertThat(classifier.classify(49)).isEqualTo(Classification.AUTO_REJECT);
        assertThat(classifier.classify(0)).isEqualTo(Classification.AUTO_REJECT);
    }

    @Test
    void rejectsReviewNotBelowApprove() {
        assertThatThrownBy(() -> new ScoreClassifier(50, 50)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScoreClassifier(60, 70)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsOutOfRangeThresholds() {
        assertThatThrownBy(() -> new ScoreClassifier(101, 50)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScoreClassifier(70, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
