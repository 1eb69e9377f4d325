package com.loanmatch.matching.index;

import com.loanmatch.domain.LoanProduct;
import com.loanmatch.matching.scoring.ApplicantProfile;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of active products bucketed by credit range. A product sits in every bucket its inclusive
 * [minCreditScore, maxCreditScore] range overlaps. Candidate lists are ordered by product id.
 * <p>
 * Bucket narrowing makes credit a hard gate at bucket granularity: a product whose credit range misses the
 * applicant's bucket is never offered, even when income, age and employment alone would score 70. Such a pair is
 * AutoApprove for {@link com.loanmatch.matching.scoring.EligibilityScorer} but never becomes a match. The
 * {@link CandidatePreFilter} that follows only drops pairs that cannot reach the review band.
 */
public final class ProductIndex {

    private final CreditScoreBuckets buckets;
    private final CandidatePreFilter preFilter;
    private final List<List<LoanProduct>> byBucket;
    private final int productCount;
    private final List<String> rejected;
    private final Instant builtAt;

    private ProductIndex(CreditScoreBuckets buckets, CandidatePreFilter preFilter, List<List<LoanProduct>> byBucket,
                         int productCount, List<String> rejected, Instant builtAt) {
        this.buckets = buckets;
        this.preFilter = preFilter;
        this.byBucket = byBucket;
        this.productCount = productCount;
        this.rejected = rejected;
        this.builtAt = builtAt;
    }

    public static ProductIndex build(Collection<LoanProduct> products, CreditScoreBuckets buckets,
                                     CandidatePreFilter preFilter, Instant builtAt) {
        List<List<LoanProduct>> byBucket = new ArrayList<>(buckets.size());
        for (int i = 0; i < buckets.size(); i++) {
            byBucket.add(new ArrayList<>());
        }
        List<String> rejected = new ArrayList<>();
        int count = 0;
        List<LoanProduct> sorted = products.stream()
                .sorted(Comparator.comparing(LoanProduct::getId, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
        for (LoanProduct product : sorted) {
            Optional<String> problem = malformation(product);
            if (problem.isPresent()) {
                rejected.add(product.getId() + ": " + problem.get());
                continue;
            }
            count++;
            for (int b = 0; b < buckets.size(); b++) {
                if (buckets.overlaps(b, product.effectiveMinCreditScore(), product.effectiveMaxCreditScore())) {
                    byBucket.get(b).add(product);
                }
            }
        }
        List<List<LoanProduct>> frozen = byBucket.stream().map(List::copyOf).toList();
        return new ProductIndex(buckets, preFilter, frozen, count, List.copyOf(rejected), builtAt);
    }

    /**
     * Products in the applicant's credit bucket that pass the pre-filter, ordered by product id.
     * Empty when the score falls outside every bucket.
     */
    public List<LoanProduct> candidatesFor(ApplicantProfile applicant) {
        int bucket = buckets.bucketOf(applicant.creditScore());
        if (bucket == CreditScoreBuckets.NO_BUCKET) {
            return List.of();
        }
        List<LoanProduct> candidates = new ArrayList<>();
        for (LoanProduct product : byBucket.get(bucket)) {
            if (preFilter.admits(applicant, product)) {
                candidates.add(product);
            }
        }
        return candidates;
    }

    public String creditTier(int creditScore) {
        return buckets.label(buckets.bucketOf(creditScore));
    }

    public int productCount() {
        return productCount;
    }

    /** "id: reason" for each product left out of the index. */
    public List<String> rejectedProducts() {
        return rejected;
    }

    public Instant builtAt() {
        return builtAt;
    }

    static Optional<String> malformation(LoanProduct product) {
        if (product.getId() == null || product.getId().isBlank()) {
            return Optional.of("missing id");
        }
        if (product.effectiveMinCreditScore() > product.effectiveMaxCreditScore()) {
            return Optional.of("inverted credit range " + product.effectiveMinCreditScore() + ".." + product.effectiveMaxCreditScore());
        }
        if (product.effectiveMinAge() > product.effectiveMaxAge()) {
            return Optional.of("inverted age range " + product.effectiveMinAge() + ".." + product.effectiveMaxAge());
        }
        if (product.effectiveMinMonthlyIncome().signum() < 0) {
            return Optional.of("negative min monthly income");
        }
        return Optional.empty();
    }
}
