package com.loanmatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Read access to the product catalog maintained by the crawler.
 */
public interface LoanProductRepository extends MongoRepository<LoanProduct, String> {

    List<LoanProduct> findByActiveTrue();

    List<LoanProduct> findByActiveTrueOrderByProviderNameAscIdAsc();
}
