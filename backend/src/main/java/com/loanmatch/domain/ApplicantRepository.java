package com.loanmatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for applicants. Claiming is in {@link ApplicantRepositoryCustom}; ingestion owns inserts.
 */
public interface ApplicantRepository extends MongoRepository<Applicant, String>, ApplicantRepositoryCustom {

    boolean existsByBatchId(String batchId);

    long countByBatchId(String batchId);

    long countByBatchIdAndProcessedFalse(String batchId);

    List<Applicant> findByBatchId(String batchId);
}
