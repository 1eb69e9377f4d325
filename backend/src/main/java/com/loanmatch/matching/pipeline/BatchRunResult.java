package com.loanmatch.matching.pipeline;

/**
 * Outcome of one orchestrator loop over a batch. Counters cover only this worker's chunks.
 */
public record BatchRunResult(
        String batchId,
        String workerId,
        PipelineState finalState,
        int chunksProcessed,
        long applicantsProcessed,
        long applicantsSkipped,
        long matchesCreated,
        CompletionOutcome completion,
        String failure
) {
}
