package com.loanmatch.matching.pipeline;

/**
 * Orchestrator loop states. CLAIMING_BATCH → SCORING → ESCALATING → PERSISTING repeats per chunk until a claim
 * comes back empty (DRAINED), then NOTIFYING_COMPLETE and back to IDLE. CANCELLED and FAILED end a run early.
 */
public enum PipelineState {
    IDLE,
    CLAIMING_BATCH,
    SCORING,
    ESCALATING,
    PERSISTING,
    DRAINED,
    NOTIFYING_COMPLETE,
    CANCELLED,
    FAILED
}
