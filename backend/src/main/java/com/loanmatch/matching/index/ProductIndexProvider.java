package com.loanmatch.matching.index;

import com.github.benmanes.caffeine.cache.Cache;
import com.loanmatch.domain.LoanProduct;
import com.loanmatch.domain.LoanProductRepository;
import com.loanmatch.matching.config.MatchingConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Serves the product index snapshot, rebuilding it from active products when the cached copy expires.
 * Callers keep the snapshot they got for the whole run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProductIndexProvider {

    static final String ACTIVE_KEY = "active";

    private final LoanProductRepository loanProductRepository;
    private final CreditScoreBuckets creditScoreBuckets;
    private final CandidatePreFilter candidatePreFilter;
    @Qualifier(MatchingConfig.PRODUCT_INDEX_CACHE)
    private final Cache<String, ProductIndex> productIndexCache;
    private final Clock clock;

    public ProductIndex current() {
        return productIndexCache.get(ACTIVE_KEY, k -> build());
    }

    public ProductIndex refresh() {
        productIndexCache.invalidate(ACTIVE_KEY);
        return current();
    }

    ProductIndex build() {
        List<LoanProduct> products = loanProductRepository.findByActiveTrue();
        ProductIndex index = ProductIndex.build(products, creditScoreBuckets, candidatePreFilter, clock.instant());
        for (String rejected : index.rejectedProducts()) {
            log.warn("Product excluded from index: {}", rejected);
        }
        log.info("Product index built: {} products indexed, {} excluded", index.productCount(), index.rejectedProducts().size());
        return index;
    }
}
