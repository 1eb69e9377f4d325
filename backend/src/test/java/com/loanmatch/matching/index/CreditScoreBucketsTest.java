package com.loanmatch.matching.index;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CreditScoreBucketsTest {

    private final CreditScoreBuckets buckets = CreditScoreBuckets.defaults();

    @Test
    void bucketOf_halfOpenWithClosedTop() {
        assertThat(buckets.size()).isEqualTo(4);
        assertThat(buckets.bucketOf(300)).isZero();
        assertThat(buckets.bucketOf(499)).isZero();
        assertThat(buckets.bucketOf(500)).isEqualTo(1);
        assertThat(buckets.bucketOf(649)).isEqualTo(1);
        assertThat(buckets.bucketOf(650)).isEqualTo(2);
        assertThat(buckets.bucketOf(700)).isEqualTo(2);
        assertThat(buckets.bucketOf(750)).isEqualTo(3);
        assertThat(buckets.bucketOf(900)).isEqualTo(3);
    }

    @Test
    void bucketOf_outsideEdges() {
        assertThat(buckets.bucketOf(299)).isEqualTo(CreditScoreBuckets.NO_BUCKET);
        assertThat(buckets.bucketOf(901)).isEqualTo(CreditScoreBuckets.NO_BUCKET);
    }

    @Test
    void overlaps_respectsInclusiveProductRange() {
        // product [650, 749] lives only in [650,750)
        assertThat(buckets.overlaps(1, 650, 749)).isFalse();
        assertThat(buckets.overlaps(2, 650, 749)).isTrue();
        assertThat(buckets.overlaps(3, 650, 749)).isFalse();
        // product [700, 900] spans two buckets
        assertThat(buckets.overlaps(2, 700, 900)).isTrue();
        assertThat(buckets.overlaps(3, 700, 900)).isTrue();
        // product exactly at the top edge
        assertThat(buckets.overlaps(3, 900, 900)).isTrue();
    }

    @Test
    void labels() {
        assertThat(buckets.label(2)).isEqualTo("[650,750)");
        assertThat(buckets.label(3)).isEqualTo("[750,900]");
        assertThat(buckets.label(CreditScoreBuckets.NO_BUCKET)).isEqualTo("UNBUCKETED");
    }

    @Test
    void rejectsNonIncreasingEdges() {
        assertThatThrownBy(() -> new CreditScoreBuckets(List.of(300, 300, 900)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CreditScoreBuckets(List.of(300)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
