package com.loanmatch.matching.pipeline;

import com.loanmatch.common.RetryPolicy;
import com.loanmatch.domain.ApplicantRepository;
import com.loanmatch.domain.BatchStatsIncrement;
import com.loanmatch.domain.BatchStatsRepository;
import com.loanmatch.domain.Match;
import com.loanmatch.matching.claim.BatchClaimer;
import com.loanmatch.matching.claim.ClaimedChunk;
import com.loanmatch.matching.config.MatchingConfig;
import com.loanmatch.matching.index.ProductIndex;
import com.loanmatch.matching.index.ProductIndexProvider;
import com.loanmatch.matching.store.MatchWriter;
import com.loanmatch.matching.store.PersistSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * One worker's loop over a batch: claim a chunk, decide it, persist matches, mark applicants processed, repeat until
 * the claim comes back empty, then hand over to completion. Several loops may run on the same batch; claims keep
 * them disjoint. Storage steps are retried with backoff; when the budget is spent the run fails and the chunk's
 * claim is released so another worker can pick it up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineOrchestrator {

    private final BatchClaimer batchClaimer;
    private final ChunkEvaluator chunkEvaluator;
    private final MatchWriter matchWriter;
    private final ApplicantRepository applicantRepository;
    private final BatchStatsRepository batchStatsRepository;
    private final BatchCompletionCoordinator completionCoordinator;
    private final ProductIndexProvider productIndexProvider;
    @Qualifier(MatchingConfig.STORAGE_RETRY_POLICY)
    private final RetryPolicy storageRetryPolicy;
    private final Clock clock;

    public BatchRunResult run(String batchId, BooleanSupplier cancelled) {
        RunState run = new RunState(batchId, "worker-" + UUID.randomUUID().toString().substring(0, 8));
        log.info("Matching run started: batch={} worker={}", batchId, run.workerId);
        try {
            ProductIndex index = productIndexProvider.current();
            while (true) {
                if (cancelled.getAsBoolean()) {
                    run.transition(PipelineState.CANCELLED);
                    log.info("Matching run cancelled: batch={} worker={} after {} chunks", batchId, run.workerId, run.chunks);
                    return run.result(null, null);
                }
                run.transition(PipelineState.CLAIMING_BATCH);
                ClaimedChunk chunk = withStorageRetry("claim", batchId, () -> batchClaimer.claim(batchId));
                if (chunk.isEmpty()) {
                    run.transition(PipelineState.DRAINED);
                    run.transition(PipelineState.NOTIFYING_COMPLETE);
                    CompletionOutcome completion = completionCoordinator.onDrained(batchId, run.workerId);
                    run.transition(PipelineState.IDLE);
                    log.info("Matching run finished: batch={} worker={} chunks={} processed={} skipped={} matchesCreated={} completion={}",
                            batchId, run.workerId, run.chunks, run.processed, run.skipped, run.matchesCreated, completion);
                    return run.result(completion, null);
                }
                processChunk(run, chunk, index);
            }
        } catch (RuntimeException e) {
            PipelineState failedIn = run.previous;
            run.transition(PipelineState.FAILED);
            log.error("Matching run failed: batch={} worker={} state={} error={}", batchId, run.workerId, failedIn, e.getMessage(), e);
            return run.result(null, e.getMessage());
        }
    }

    private void processChunk(RunState run, ClaimedChunk chunk, ProductIndex index) {
        try {
            run.transition(PipelineState.SCORING);
            ChunkEvaluator.ChunkPlan plan = chunkEvaluator.score(chunk.applicants(), index);
            if (plan.pendingEscalations() > 0) {
                run.transition(PipelineState.ESCALATING);
            }
            List<ApplicantDecision> decisions = chunkEvaluator.escalateAndResolve(plan, index);

            run.transition(PipelineState.PERSISTING);
            List<Match> matches = new ArrayList<>();
            for (ApplicantDecision decision : decisions) {
                matches.addAll(decision.matches());
            }
            PersistSummary persisted = withStorageRetry("persist matches", chunk.batchId(), () -> matchWriter.persistAll(matches));

            ChunkTally tally = new ChunkTally();
            Set<String> done = new HashSet<>();
            withStorageRetry("mark processed", chunk.batchId(), () -> {
                for (ApplicantDecision decision : decisions) {
                    if (done.contains(decision.applicantId())) {
                        continue;
                    }
                    boolean flipped = applicantRepository.markProcessed(
                            decision.applicantId(), chunk.claimToken(), clock.instant(), decision.skipReason());
                    done.add(decision.applicantId());
                    if (flipped) {
                        tally.add(decision);
                    } else {
                        log.info("Applicant {} of batch {} was no longer held by this claim; left to its new owner",
                                decision.applicantId(), chunk.batchId());
                    }
                }
                return null;
            });

            BatchStatsIncrement increment = tally.toIncrement(persisted);
            if (!increment.isEmpty()) {
                withStorageRetry("record stats", chunk.batchId(), () -> {
                    batchStatsRepository.increment(chunk.batchId(), increment, clock.instant());
                    return null;
                });
            }
            run.chunks++;
            run.processed += tally.processed();
            run.skipped += tally.skipped();
            run.matchesCreated += persisted.created();
            log.debug("Chunk done: batch={} worker={} applicants={} matches={} created={}",
                    chunk.batchId(), run.workerId, chunk.size(), matches.size(), persisted.created());
        } catch (RuntimeException e) {
            releaseQuietly(chunk);
            throw e;
        }
    }

    private void releaseQuietly(ClaimedChunk chunk) {
        try {
            batchClaimer.release(chunk);
        } catch (RuntimeException e) {
            log.warn("Could not release claim {} of batch {}; it frees up when the lease expires: {}",
                    chunk.claimToken(), chunk.batchId(), e.getMessage());
        }
    }

    <T> T withStorageRetry(String step, String batchId, Supplier<T> operation) {
        DataAccessException lastException = null;
        for (int attempt = 0; attempt < storageRetryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                log.warn("Storage step '{}' failed for batch {} (attempt {}/{}): {}", step, batchId, attempt,
                        storageRetryPolicy.getMaxAttempts(), lastException.getMessage());
                if (!storageRetryPolicy.pause(attempt - 1)) {
                    throw new MatchingStorageException("Interrupted during retry of " + step, lastException);
                }
            }
            try {
                return operation.get();
            } catch (DataAccessException e) {
                lastException = e;
            }
        }
        throw new MatchingStorageException("Storage step '" + step + "' failed for batch " + batchId
                + " after " + storageRetryPolicy.getMaxAttempts() + " attempts", lastException);
    }

    private static final class RunState {
        private final String batchId;
        private final String workerId;
        private PipelineState previous = PipelineState.IDLE;
        private int chunks;
        private long processed;
        private long skipped;
        private long matchesCreated;

        private RunState(String batchId, String workerId) {
            this.batchId = batchId;
            this.workerId = workerId;
        }

        private void transition(PipelineState next) {
            if (previous != next) {
                log.trace("batch={} worker={} {} -> {}", batchId, workerId, previous, next);
            }
            previous = next;
        }

        private BatchRunResult result(CompletionOutcome completion, String failure) {
            return new BatchRunResult(batchId, workerId, previous, chunks, processed, skipped, matchesCreated, completion, failure);
        }
    }
}
