package com.loanmatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Operational counters per batch, incremented once per chunk. Not authoritative: matches is the record of truth.
 */
@Document(collection = "batch_stats")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BatchStats {

    /** Batch id. */
    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long applicantsProcessed;
    private long applicantsSkipped;
    private long autoApproved;
    private long escalated;
    private long approvedAfterEscalation;
    private long autoRejected;
    private long rejectedAfterEscalation;
    private long matchesCreated;
    private long matchesAlreadyPresent;
    private long chunksProcessed;
    private Instant firstChunkAt;
    private Instant updatedAt;
}
