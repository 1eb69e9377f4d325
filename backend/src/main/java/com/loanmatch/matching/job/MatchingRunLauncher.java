package com.loanmatch.matching.job;

import com.loanmatch.domain.BatchCompletionRepository;
import com.loanmatch.matching.config.AsyncConfig;
import com.loanmatch.matching.config.MatchingProperties;
import com.loanmatch.matching.pipeline.BatchRunResult;
import com.loanmatch.matching.pipeline.PipelineOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts matching runs: one run per batch at a time in this instance, each fanned out to {@code workers} orchestrator
 * loops on the matching worker pool. Other instances may run the same batch concurrently; claims keep them disjoint.
 * Every launch stamps the batch's start marker first; only started batches are picked up by the resume sweep.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MatchingRunLauncher {

    private final Map<String, RunHandle> inFlight = new ConcurrentHashMap<>();

    private final PipelineOrchestrator pipelineOrchestrator;
    private final BatchCompletionRepository batchCompletionRepository;
    private final MatchingProperties matchingProperties;
    @Qualifier(AsyncConfig.MATCHING_WORKER_EXECUTOR)
    private final Executor matchingWorkerExecutor;
    private final Clock clock;

    public LaunchOutcome launch(String batchId) {
        RunHandle handle = new RunHandle();
        if (inFlight.putIfAbsent(batchId, handle) != null) {
            return LaunchOutcome.ALREADY_RUNNING;
        }
        int workers = Math.max(1, matchingProperties.getWorkers());
        List<CompletableFuture<BatchRunResult>> loops = new ArrayList<>(workers);
        try {
            batchCompletionRepository.recordStarted(batchId, clock.instant());
            for (int i = 0; i < workers; i++) {
                loops.add(CompletableFuture.supplyAsync(
                        () -> pipelineOrchestrator.run(batchId, handle.cancelled::get), matchingWorkerExecutor));
            }
        } catch (RuntimeException e) {
            inFlight.remove(batchId, handle);
            throw e;
        }
        CompletableFuture.allOf(loops.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, error) -> {
                    inFlight.remove(batchId, handle);
                    if (error != null) {
                        log.error("Matching run for batch {} ended abnormally", batchId, error);
                        return;
                    }
                    long processed = loops.stream().mapToLong(f -> f.join().applicantsProcessed()).sum();
                    long created = loops.stream().mapToLong(f -> f.join().matchesCreated()).sum();
                    log.info("Matching run for batch {} finished: {} workers, {} applicants processed, {} matches created",
                            batchId, loops.size(), processed, created);
                });
        log.info("Matching run launched for batch {} with {} workers", batchId, workers);
        return LaunchOutcome.STARTED;
    }

    /**
     * Asks the batch's loops to stop after their current chunk. False when nothing is running for the batch here.
     */
    public boolean cancel(String batchId) {
        RunHandle handle = inFlight.get(batchId);
        if (handle == null) {
            return false;
        }
        handle.cancelled.set(true);
        log.info("Cancellation requested for batch {}", batchId);
        return true;
    }

    public boolean isRunning(String batchId) {
        return inFlight.containsKey(batchId);
    }

    private static final class RunHandle {
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
    }
}
