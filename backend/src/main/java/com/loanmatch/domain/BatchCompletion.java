package com.loanmatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Per-batch run marker. startedAt is stamped when the engine is first launched on the batch and is what makes the
 * batch eligible for resumption. notifyingSince is a lease held by the drainer that delivers the notification;
 * notifiedAt is set once delivery succeeded and makes later drain detections no-ops.
 */
@Document(collection = "batch_completions")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BatchCompletion {

    /** Batch id. */
    @Id
    @EqualsAndHashCode.Include
    private String id;
    private Instant startedAt;
    private Instant drainedAt;
    private String notifyingOwner;
    private Instant notifyingSince;
    private Instant notifiedAt;
    private int notificationAttempts;
}
