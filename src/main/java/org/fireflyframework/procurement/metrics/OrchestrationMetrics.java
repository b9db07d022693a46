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

package org.fireflyframework.procurement.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.procurement.model.TransitionKind;
import org.fireflyframework.procurement.retry.FailureDisposition;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the orchestration core.
 * All metrics are prefixed with {@code procurement.*}.
 */
@Slf4j
public class OrchestrationMetrics {

    private static final String PREFIX = "procurement.";

    private final MeterRegistry meterRegistry;
    private final AtomicInteger activeWorkflows = new AtomicInteger();

    public OrchestrationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        Gauge.builder(PREFIX + "workflows.active", activeWorkflows, AtomicInteger::get)
                .description("Workflows that have not reached a terminal phase")
                .register(meterRegistry);
        log.info("OrchestrationMetrics initialized");
    }

    // ==================== Workflow Metrics ====================

    public void recordWorkflowCreated(String initialPhase) {
        counter("workflows.created", "phase", initialPhase).increment();
        activeWorkflows.incrementAndGet();
        log.debug("METRIC: workflows.created phase={}", initialPhase);
    }

    public void recordWorkflowTerminated(String phase) {
        counter("workflows.terminated", "phase", phase).increment();
        if (activeWorkflows.get() > 0) {
            activeWorkflows.decrementAndGet();
        }
        log.debug("METRIC: workflows.terminated phase={}", phase);
    }

    public void recordTransition(String fromPhase, String toPhase, TransitionKind kind, String outcome) {
        counter("transitions",
                "from", normalizeTag(fromPhase),
                "to", normalizeTag(toPhase),
                "kind", kind.name().toLowerCase(),
                "outcome", outcome)
                .increment();
        log.debug("METRIC: transitions from={}, to={}, kind={}, outcome={}", fromPhase, toPhase, kind, outcome);
    }

    public void recordPhaseDuration(String phase, Duration duration) {
        timer("phase.duration", "phase", phase).record(duration);
    }

    public int getActiveWorkflows() {
        return activeWorkflows.get();
    }

    // ==================== Work Item Metrics ====================

    public void recordWorkItemReleased(String taskType) {
        counter("work_items.released", "task.type", normalizeTag(taskType)).increment();
    }

    public void recordWorkItemAssigned(String taskType) {
        counter("work_items.assigned", "task.type", normalizeTag(taskType)).increment();
    }

    public void recordNoCapacity(String taskType) {
        counter("work_items.no_capacity", "task.type", normalizeTag(taskType)).increment();
    }

    public void recordWorkItemCompleted(String taskType) {
        counter("work_items.completed", "task.type", normalizeTag(taskType)).increment();
    }

    public void recordWorkItemFailed(String taskType, FailureDisposition disposition) {
        counter("work_items.failed",
                "task.type", normalizeTag(taskType),
                "disposition", disposition.name().toLowerCase())
                .increment();
        log.debug("METRIC: work_items.failed taskType={}, disposition={}", taskType, disposition);
    }

    // ==================== Dead Letter Metrics ====================

    public void recordDeadLettered(String taskType) {
        counter("dlq.entries", "task.type", normalizeTag(taskType)).increment();
    }

    public void recordEscalated(String taskType) {
        counter("dlq.escalations", "task.type", normalizeTag(taskType)).increment();
    }

    // ==================== Helper Methods ====================

    private Counter counter(String name, String... tags) {
        return Counter.builder(PREFIX + name).tags(tags).register(meterRegistry);
    }

    private Timer timer(String name, String... tags) {
        return Timer.builder(PREFIX + name).tags(tags).register(meterRegistry);
    }

    private String normalizeTag(String value) {
        if (value == null || value.isEmpty()) {
            return "none";
        }
        return value;
    }
}
