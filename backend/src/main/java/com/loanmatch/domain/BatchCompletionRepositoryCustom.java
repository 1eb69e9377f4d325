package com.loanmatch.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Atomic transitions of the per-batch completion marker.
 */
public interface BatchCompletionRepositoryCustom {

    /** Stamps startedAt on the first launch of the batch; relaunches keep the earliest start. */
    void recordStarted(String batchId, Instant now);

    /** Stamps drainedAt on first drain; later calls keep the earliest drain time. */
    void recordDrained(String batchId, Instant now);

    /**
     * Takes the notify lease if the batch is not yet notified and no live lease exists. Empty when another drainer
     * holds the lease or the batch was already notified.
     */
    Optional<BatchCompletion> acquireNotifyLease(String batchId, String owner, Instant now, Instant leaseExpiredBefore);

    /** Stamps notifiedAt if {@code owner} still holds the lease. */
    boolean markNotified(String batchId, String owner, Instant now);

    /** Gives the lease back after a failed delivery so the next sweep can retry. */
    void releaseNotifyLease(String batchId, String owner);

    /** Drained batches with no successful notification and no live lease. */
    List<String> findBatchIdsAwaitingNotification(Instant leaseExpiredBefore);

    /** The subset of {@code batchIds} that has been launched at least once. */
    List<String> findStartedBatchIds(Collection<String> batchIds);
}
