package com.driftmonitor.service;

import com.driftmonitor.client.TrainingEntryPoint;
import com.driftmonitor.dto.RetrainStatusResponse;
import com.driftmonitor.exception.TrainingInvocationException;
import com.driftmonitor.model.CycleToken;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fires the training entry point in the background. At most one training run is in
 * flight at any time; a request while one is running is declined, not queued.
 */
@Slf4j
@Service
public class RetrainTrigger {

    public enum Decision {
        TRIGGERED,
        ALREADY_RUNNING
    }

    private final TrainingEntryPoint trainingEntryPoint;
    private final AtomicReference<RetrainRun> current = new AtomicReference<>();
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "drift-retrain");
        t.setDaemon(true);
        return t;
    });

    public RetrainTrigger(TrainingEntryPoint trainingEntryPoint) {
        this.trainingEntryPoint = trainingEntryPoint;
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
    }

    public Decision trigger(CycleToken token) {
        RetrainRun previous = current.get();
        if (previous != null && previous.isRunning()) {
            log.info("Retrain skipped, already running | runKey={} | runningSince={} | triggeredBy={}",
                     token.runKey(), previous.startedAt, previous.runKey);
            return Decision.ALREADY_RUNNING;
        }
        RetrainRun run = new RetrainRun(token.runKey(), Instant.now());
        if (!current.compareAndSet(previous, run)) {
            return Decision.ALREADY_RUNNING;
        }
        try {
            CompletableFuture.runAsync(() -> execute(run), executor);
        } catch (RejectedExecutionException ex) {
            current.compareAndSet(run, previous);
            log.error("Retrain not started, executor rejected the run | runKey={}", token.runKey());
            throw new TrainingInvocationException("Training executor rejected run '" + token.runKey() + "'", ex);
        }
        log.info("Retrain triggered | runKey={} | token={}", token.runKey(), token.id());
        return Decision.TRIGGERED;
    }

    public boolean isRunning() {
        RetrainRun run = current.get();
        return run != null && run.isRunning();
    }

    public RetrainStatusResponse status() {
        RetrainRun run = current.get();
        if (run == null) {
            return RetrainStatusResponse.builder().state(RetrainStatusResponse.State.IDLE).build();
        }
        return run.toResponse();
    }

    private void execute(RetrainRun run) {
        try {
            trainingEntryPoint.train();
            run.finish(RetrainStatusResponse.State.SUCCEEDED, "Training completed");
            log.info("Retrain finished | runKey={} | durationMs={}", run.runKey,
                     run.finishedAt.toEpochMilli() - run.startedAt.toEpochMilli());
        } catch (Throwable ex) {
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            run.finish(RetrainStatusResponse.State.FAILED, message);
            log.error("Retrain failed | runKey={} | reason={}", run.runKey, message, ex);
        }
    }

    private static final class RetrainRun {
        private final String runKey;
        private final Instant startedAt;
        private volatile RetrainStatusResponse.State state = RetrainStatusResponse.State.RUNNING;
        private volatile Instant finishedAt;
        private volatile String message;

        private RetrainRun(String runKey, Instant startedAt) {
            this.runKey = runKey;
            this.startedAt = startedAt;
        }

        private boolean isRunning() {
            return state == RetrainStatusResponse.State.RUNNING;
        }

        private synchronized void finish(RetrainStatusResponse.State state, String message) {
            this.finishedAt = Instant.now();
            this.message = message;
            this.state = state;
        }

        private RetrainStatusResponse toResponse() {
            return RetrainStatusResponse.builder()
                .state(state)
                .runKey(runKey)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .message(message)
                .build();
        }
    }
}
