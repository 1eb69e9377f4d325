package com.loanmatch.api.controller;

import com.loanmatch.api.dto.ProductResponse;
import com.loanmatch.matching.query.MatchingQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /products: active loan products with defaults applied to missing eligibility fields.
 */
@RestController
@RequestMapping("/api/v1/products")
@RequiredArgsConstructor
public class ProductController {

    private final MatchingQueryService matchingQueryService;

    @GetMapping
    public ResponseEntity<List<ProductResponse>> getProducts() {
        return ResponseEntity.ok(matchingQueryService.findActiveProducts().stream()
                .map(p -> new ProductResponse(
                        p.getId(),
                        p.getProductName(),
                        p.getProviderName(),
                        p.getInterestRateMin(),
                        p.getInterestRateMax(),
                        p.getMinLoanAmount(),
                        p.getMaxLoanAmount(),
                        p.effectiveMinMonthlyIncome(),
                        p.effectiveMinCreditScore(),
                        p.effectiveMaxCreditScore(),
                        p.effectiveMinAge(),
                        p.effectiveMaxAge(),
                        p.getAllowedEmploymentStatuses(),
                        p.getSourceUrl()))
                .toList());
    }
}
