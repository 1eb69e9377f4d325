package com.loanmatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Applicant uploaded by ingestion. The engine only touches claimToken, claimedAt, processed, processedAt and skipReason;
 * processed=true is terminal for the batch.
 */
@Document(collection = "applicants")
@CompoundIndex(name = "batch_processed_claimed", def = "{'batchId': 1, 'processed': 1, 'claimedAt': 1}")
@CompoundIndex(name = "claim_token", def = "{'claimToken': 1}", sparse = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Applicant {

    /** Applicant identifier, unique across batches. */
    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String email;
    private BigDecimal monthlyIncome;
    private Integer creditScore;
    /** Raw label as ingested; see {@link EmploymentStatus#parse(String)}. */
    private String employmentStatus;
    private Integer age;
    private String batchId;
    private boolean processed;
    /** Set by the claim that currently owns this applicant; null when unclaimed. */
    private String claimToken;
    private Instant claimedAt;
    private Instant processedAt;
    /** Set when the record was skipped as malformed. */
    private String skipReason;
    private Instant createdAt;
}
