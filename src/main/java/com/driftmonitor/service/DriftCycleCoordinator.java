package com.driftmonitor.service;

import com.driftmonitor.entity.CycleOutcomeRecord;
import com.driftmonitor.exception.AllSourcesExhaustedException;
import com.driftmonitor.exception.DriftMonitorException;
import com.driftmonitor.model.Baseline;
import com.driftmonitor.model.CyclePhase;
import com.driftmonitor.model.CycleStage;
import com.driftmonitor.model.CycleStatus;
import com.driftmonitor.model.CycleToken;
import com.driftmonitor.model.DriftResult;
import com.driftmonitor.model.SourceAttempt;
import com.driftmonitor.source.DataSourceResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Runs one drift cycle: load baseline, resolve observations, score, and trigger
 * retraining when drift is detected. A cycle never throws; every run ends in a
 * persisted outcome record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriftCycleCoordinator {

    private final BaselineStore baselineStore;
    private final DataSourceResolver resolver;
    private final DriftScorer scorer;
    private final RetrainTrigger retrainTrigger;
    private final CycleLockService lockService;
    private final CycleOutcomeService outcomeService;

    private final AtomicReference<CyclePhase> phase = new AtomicReference<>(CyclePhase.IDLE);
    private final ReentrantLock localLock = new ReentrantLock();

    @Value("${drift.cycle.enabled:true}")
    private boolean enabled;

    @Value("${drift.cycle.interval-ms:604800000}")
    private long intervalMs;

    @Scheduled(fixedRateString = "${drift.cycle.interval-ms:604800000}",
               initialDelayString = "${drift.cycle.initial-delay-ms:60000}")
    public void scheduledCycle() {
        if (!enabled) {
            return;
        }
        runCycle(slotKey(Instant.now()));
    }

    public CycleOutcomeRecord runManualCycle(String runKey) {
        return runCycle(runKey != null && !runKey.isBlank() ? runKey : "manual-" + UUID.randomUUID());
    }

    public CyclePhase currentPhase() {
        return phase.get();
    }

    /** Nominal run identity: the start of the schedule slot {@code at} falls into. */
    public String slotKey(Instant at) {
        long slotStart = Math.floorDiv(at.toEpochMilli(), intervalMs) * intervalMs;
        return "cycle-" + Instant.ofEpochMilli(slotStart);
    }

    public CycleOutcomeRecord runCycle(String runKey) {
        CycleToken token = CycleToken.issue(runKey);
        MDC.put("runKey", runKey);
        try {
            CycleOutcomeRecord outcome = CycleOutcomeRecord.builder()
                .runKey(runKey)
                .token(token.id())
                .status(CycleStatus.RUNNING)
                .startedAt(token.issuedAt())
                .build();

            if (!localLock.tryLock()) {
                log.warn("Cycle skipped, another cycle is running in this process | runKey={}", runKey);
                return finish(outcome.toBuilder(), CycleStatus.SKIPPED_CONCURRENT_CYCLE,
                              "Another cycle is running in this process");
            }
            try {
                boolean acquired;
                try {
                    acquired = lockService.tryAcquire(token);
                } catch (RuntimeException ex) {
                    log.error("Cycle failed, run claim unavailable | runKey={} | reason={}", runKey, ex.getMessage());
                    return finish(outcome.toBuilder().errorCode("CYCLE_LOCK_UNAVAILABLE"), CycleStatus.FAILED,
                                  "Could not claim run: " + ex.getMessage());
                }
                if (!acquired) {
                    log.warn("Cycle skipped, run already claimed | runKey={}", runKey);
                    return finish(outcome.toBuilder(), CycleStatus.SKIPPED_CONCURRENT_CYCLE,
                                  "Run '" + runKey + "' is already claimed by another instance");
                }
                try {
                    return execute(token, outcome);
                } finally {
                    lockService.release(token);
                }
            } finally {
                phase.set(CyclePhase.IDLE);
                localLock.unlock();
            }
        } finally {
            MDC.remove("runKey");
        }
    }

    private CycleOutcomeRecord execute(CycleToken token, CycleOutcomeRecord outcome) {
        CycleOutcomeRecord.CycleOutcomeRecordBuilder result = outcome.toBuilder();
        CycleStage stage = CycleStage.BASELINE;
        log.info("Cycle started | runKey={} | token={}", token.runKey(), token.id());
        try {
            phase.set(CyclePhase.RESOLVING);
            Baseline baseline = baselineStore.load();

            stage = CycleStage.RESOLVING;
            DataSourceResolver.Resolution resolution = resolver.resolve(baseline.classCount(), baseline.dimension());
            result.source(resolution.batch().source())
                  .sourceAttempts(summarize(resolution.attempts()));

            stage = CycleStage.SCORING;
            phase.set(CyclePhase.SCORING);
            DriftResult drift = scorer.score(baseline, resolution.batch());
            result.labelScore(drift.labelScore())
                  .embeddingScore(drift.embeddingScore())
                  .driftDetected(drift.driftDetected());

            phase.set(CyclePhase.DECIDING);
            if (!drift.driftDetected()) {
                log.info("Cycle finished, no drift | runKey={}", token.runKey());
                return finish(result, CycleStatus.NO_DRIFT, "No drift detected");
            }

            stage = CycleStage.TRIGGERING;
            phase.set(CyclePhase.TRIGGERING);
            RetrainTrigger.Decision decision = retrainTrigger.trigger(token);
            if (decision == RetrainTrigger.Decision.ALREADY_RUNNING) {
                return finish(result, CycleStatus.SKIPPED_RETRAIN_IN_PROGRESS, "Skipped: retrain in progress");
            }
            log.info("Cycle finished, retrain triggered | runKey={}", token.runKey());
            return finish(result, CycleStatus.RETRAIN_TRIGGERED, "Drift detected, retraining triggered");

        } catch (AllSourcesExhaustedException ex) {
            result.sourceAttempts(summarize(ex.getAttempts()));
            return fail(result, token, stage, ex.getErrorCode(), ex);
        } catch (DriftMonitorException ex) {
            return fail(result, token, stage, ex.getErrorCode(), ex);
        } catch (RuntimeException ex) {
            return fail(result, token, stage, "INTERNAL_ERROR", ex);
        }
    }

    private CycleOutcomeRecord fail(CycleOutcomeRecord.CycleOutcomeRecordBuilder result, CycleToken token,
                                    CycleStage stage, String errorCode, RuntimeException ex) {
        log.error("Cycle failed | runKey={} | stage={} | errorCode={} | reason={}",
                  token.runKey(), stage, errorCode, ex.getMessage());
        result.failedStage(stage).errorCode(errorCode);
        return finish(result, CycleStatus.FAILED, ex.getMessage());
    }

    private CycleOutcomeRecord finish(CycleOutcomeRecord.CycleOutcomeRecordBuilder result,
                                      CycleStatus status, String message) {
        CycleOutcomeRecord outcome = result
            .status(status)
            .message(truncate(message))
            .finishedAt(Instant.now())
            .build();
        try {
            return outcomeService.record(outcome);
        } catch (RuntimeException ex) {
            log.error("Cycle outcome could not be persisted | runKey={} | status={} | reason={}",
                      outcome.getRunKey(), status, ex.getMessage(), ex);
            return outcome;
        }
    }

    private static String summarize(List<SourceAttempt> attempts) {
        return truncate(attempts.stream().map(SourceAttempt::summary).collect(Collectors.joining("; ")));
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= 2000) {
            return value;
        }
        return value.substring(0, 1997) + "...";
    }
}
