package com.driftmonitor.service;

import com.driftmonitor.client.TrainingEntryPoint;
import com.driftmonitor.dto.RetrainStatusResponse;
import com.driftmonitor.exception.TrainingInvocationException;
import com.driftmonitor.model.CycleToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetrainTriggerTest {

    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);
    private final AtomicInteger invocations = new AtomicInteger();

    private RetrainTrigger trigger;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (trigger != null) {
            trigger.shutdown();
        }
    }

    private TrainingEntryPoint blockingTraining() {
        return () -> {
            invocations.incrementAndGet();
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        };
    }

    private static void awaitState(RetrainTrigger trigger, RetrainStatusResponse.State state) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (trigger.status().getState() != state && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    @Test
    void status_beforeAnyTrigger_isIdle() {
        trigger = new RetrainTrigger(blockingTraining());
        assertThat(trigger.status().getState()).isEqualTo(RetrainStatusResponse.State.IDLE);
        assertThat(trigger.isRunning()).isFalse();
    }

    @Test
    void trigger_whileTrainingRuns_isSkippedWithoutSecondInvocation() throws Exception {
        trigger = new RetrainTrigger(blockingTraining());

        assertThat(trigger.trigger(CycleToken.issue("cycle-1"))).isEqualTo(RetrainTrigger.Decision.TRIGGERED);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(trigger.isRunning()).isTrue();

        assertThat(trigger.trigger(CycleToken.issue("cycle-2"))).isEqualTo(RetrainTrigger.Decision.ALREADY_RUNNING);
        assertThat(trigger.status().getRunKey()).isEqualTo("cycle-1");

        release.countDown();
        awaitState(trigger, RetrainStatusResponse.State.SUCCEEDED);
        assertThat(trigger.status().getState()).isEqualTo(RetrainStatusResponse.State.SUCCEEDED);
        assertThat(invocations).hasValue(1);
    }

    @Test
    void trigger_afterTrainingCompleted_startsNewRun() throws Exception {
        trigger = new RetrainTrigger(invocations::incrementAndGet);

        assertThat(trigger.trigger(CycleToken.issue("cycle-1"))).isEqualTo(RetrainTrigger.Decision.TRIGGERED);
        awaitState(trigger, RetrainStatusResponse.State.SUCCEEDED);
        assertThat(trigger.trigger(CycleToken.issue("cycle-2"))).isEqualTo(RetrainTrigger.Decision.TRIGGERED);
        awaitState(trigger, RetrainStatusResponse.State.SUCCEEDED);

        assertThat(invocations).hasValue(2);
        assertThat(trigger.status().getRunKey()).isEqualTo("cycle-2");
    }

    @Test
    void trigger_trainingFails_recordsFailureAndAllowsRetry() throws Exception {
        trigger = new RetrainTrigger(() -> {
            throw new TrainingInvocationException("Training endpoint returned 500: boom");
        });

        trigger.trigger(CycleToken.issue("cycle-1"));
        awaitState(trigger, RetrainStatusResponse.State.FAILED);

        RetrainStatusResponse status = trigger.status();
        assertThat(status.getState()).isEqualTo(RetrainStatusResponse.State.FAILED);
        assertThat(status.getMessage()).contains("500");
        assertThat(status.getFinishedAt()).isNotNull();
        assertThat(trigger.isRunning()).isFalse();
    }

    @Test
    void trigger_trainingThrowsError_recordsFailureAndAllowsRetry() throws Exception {
        trigger = new RetrainTrigger(() -> {
            invocations.incrementAndGet();
            throw new StackOverflowError("training recursed");
        });

        trigger.trigger(CycleToken.issue("cycle-1"));
        awaitState(trigger, RetrainStatusResponse.State.FAILED);

        assertThat(trigger.status().getState()).isEqualTo(RetrainStatusResponse.State.FAILED);
        assertThat(trigger.status().getMessage()).contains("training recursed");
        assertThat(trigger.trigger(CycleToken.issue("cycle-2"))).isEqualTo(RetrainTrigger.Decision.TRIGGERED);
    }

    @Test
    void trigger_executorRejectsRun_failsAndLeavesNoRunInFlight() {
        trigger = new RetrainTrigger(invocations::incrementAndGet);
        trigger.shutdown();

        assertThatThrownBy(() -> trigger.trigger(CycleToken.issue("cycle-1")))
            .isInstanceOf(TrainingInvocationException.class)
            .hasMessageContaining("cycle-1");

        assertThat(trigger.isRunning()).isFalse();
        assertThat(trigger.status().getState()).isEqualTo(RetrainStatusResponse.State.IDLE);
        assertThat(invocations).hasValue(0);
    }
}
