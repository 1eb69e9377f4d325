package com.loanmatch.matching.index;

import java.util.List;

/**
 * Credit-score buckets from strictly increasing edges e0..en: [e0,e1), [e1,e2), ..., [en-1,en].
 * The last bucket is closed so the top edge (900) is addressable.
 */
public final class CreditScoreBuckets {

    public static final int NO_BUCKET = -1;

    private final int[] edges;

    public CreditScoreBuckets(List<Integer> boundaries) {
        if (boundaries == null || boundaries.size() < 2) {
            throw new IllegalArgumentException("At least two bucket edges are required");
        }
        this.edges = new int[boundaries.size()];
        for (int i = 0; i < edges.length; i++) {
            Integer edge = boundaries.get(i);
            if (edge == null || (i > 0 && edge <= edges[i - 1])) {
                throw new IllegalArgumentException("Bucket edges must be strictly increasing: " + boundaries);
            }
            edges[i] = edge;
        }
    }

    public static CreditScoreBuckets defaults() {
        return new CreditScoreBuckets(List.of(300, 500, 650, 750, 900));
    }

    public int size() {
        return edges.length - 1;
    }

    /** Bucket holding the score, or {@link #NO_BUCKET} outside [e0, en]. */
    public int bucketOf(int score) {
        if (score < edges[0] || score > edges[edges.length - 1]) {
            return NO_BUCKET;
        }
        int lo = 0;
        int hi = size() - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (edges[mid] <= score) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    /** Whether the inclusive credit range [min, max] intersects the bucket. */
    public boolean overlaps(int bucket, int min, int max) {
        int lower = edges[bucket];
        int upper = edges[bucket + 1];
        boolean last = bucket == size() - 1;
        boolean belowUpper = last ? min <= upper : min < upper;
        return belowUpper && max >= lower;
    }

    public String label(int bucket) {
        if (bucket == NO_BUCKET) {
            return "UNBUCKETED";
        }
        boolean last = bucket == size() - 1;
        return "[" + edges[bucket] + "," + edges[bucket + 1] + (last ? "]" : ")");
    }
}
