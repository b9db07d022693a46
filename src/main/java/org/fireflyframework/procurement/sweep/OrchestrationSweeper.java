/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.procurement.sweep;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.procurement.dlq.DeadLetterService;
import org.fireflyframework.procurement.phase.PhaseStateMachine;
import org.fireflyframework.procurement.scheduler.WorkItemScheduler;
import org.springframework.beans.factory.DisposableBean;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Periodic ticker for everything the orchestration core never waits for:
 * due retries, items that found no executor, phase timeouts and dead-letter
 * monitoring.
 * <p>
 * Each sweep step is isolated, so a failure in one does not skip the others,
 * and errors never terminate the loop.
 */
@Slf4j
@RequiredArgsConstructor
public class OrchestrationSweeper implements DisposableBean {

    private final WorkItemScheduler scheduler;
    private final PhaseStateMachine stateMachine;
    private final DeadLetterService deadLetterService;
    private final Duration sweepInterval;
    private final Duration dlqMonitorInterval;
    private final Clock clock;

    private volatile Disposable sweepSubscription;
    private volatile Disposable dlqSubscription;

    /**
     * Starts both polling loops. Calling it twice is a no-op.
     */
    public synchronized void start() {
        if (sweepSubscription != null && !sweepSubscription.isDisposed()) {
            log.warn("Orchestration sweeper is already running");
            return;
        }

        log.info("Starting orchestration sweeper with interval={}, dlqMonitorInterval={}",
                sweepInterval, dlqMonitorInterval);

        sweepSubscription = Flux.interval(sweepInterval)
                .concatMap(tick -> Mono.fromRunnable(() -> sweep(clock.instant()))
                        .onErrorResume(error -> {
                            log.error("Error during orchestration sweep", error);
                            return Mono.empty();
                        }))
                .subscribe();

        dlqSubscription = Flux.interval(dlqMonitorInterval)
                .concatMap(tick -> deadLetterService.monitor(clock.instant())
                        .onErrorResume(error -> {
                            log.error("Error during dead-letter monitoring", error);
                            return Mono.empty();
                        }))
                .subscribe();
    }

    /**
     * Stops both loops. Safe to call multiple times or before {@link #start()}.
     */
    public synchronized void stop() {
        if (sweepSubscription != null && !sweepSubscription.isDisposed()) {
            log.info("Stopping orchestration sweeper");
            sweepSubscription.dispose();
        }
        if (dlqSubscription != null && !dlqSubscription.isDisposed()) {
            dlqSubscription.dispose();
        }
        sweepSubscription = null;
        dlqSubscription = null;
    }

    public boolean isRunning() {
        Disposable subscription = sweepSubscription;
        return subscription != null && !subscription.isDisposed();
    }

    /**
     * Runs one sweep.
     *
     * @param now the sweep time
     * @return what the sweep did
     */
    public SweepResult sweep(Instant now) {
        int retried = step("processScheduledRetries", () -> scheduler.processScheduledRetries(now), 0);
        int assigned = step("retryPendingAssignments", scheduler::retryPendingAssignments, 0);
        List<String> timedOut = step("checkPhaseTimeouts", () -> stateMachine.checkPhaseTimeouts(now), List.of());

        if (retried > 0 || assigned > 0 || !timedOut.isEmpty()) {
            log.info("SWEEP_COMPLETED: retried={}, assigned={}, timedOut={}", retried, assigned, timedOut.size());
        }
        return new SweepResult(retried, assigned, timedOut);
    }

    @Override
    public void destroy() {
        stop();
    }

    private <T> T step(String name, Supplier<T> action, T fallback) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            log.error("SWEEP_STEP_FAILED: step={}, error={}", name, e.getMessage(), e);
            return fallback;
        }
    }

    /**
     * Outcome of one sweep.
     *
     * @param retriesRequeued failed items put back into play
     * @param itemsAssigned waiting items that found an executor
     * @param timedOutWorkflows workflows newly flagged for a phase timeout
     */
    public record SweepResult(int retriesRequeued, int itemsAssigned, List<String> timedOutWorkflows) {
    }
}
