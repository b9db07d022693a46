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

package org.fireflyframework.procurement.assignment;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.procurement.metrics.OrchestrationMetrics;
import org.fireflyframework.procurement.model.WorkItem;
import org.fireflyframework.procurement.phase.PhaseRegistry;
import org.springframework.lang.Nullable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps work items to the capabilities they need and asks the
 * {@link AgentRegistry} for a matching executor.
 * <p>
 * Capabilities come from the process definition's task-type table; task types
 * without an entry fall back to the phase's required capabilities.
 */
@Slf4j
public class WorkItemAssigner {

    private final AgentRegistry agentRegistry;
    private final PhaseRegistry phaseRegistry;
    private final OrchestrationMetrics metrics;

    public WorkItemAssigner(AgentRegistry agentRegistry, PhaseRegistry phaseRegistry,
                            @Nullable OrchestrationMetrics metrics) {
        this.agentRegistry = agentRegistry;
        this.phaseRegistry = phaseRegistry;
        this.metrics = metrics;
    }

    public Set<String> requiredCapabilities(WorkItem item) {
        List<String> byTaskType = phaseRegistry.getTaskCapabilities(item.taskType());
        if (!byTaskType.isEmpty()) {
            return new LinkedHashSet<>(byTaskType);
        }
        return phaseRegistry.findPhase(item.phase())
                .map(phase -> (Set<String>) new LinkedHashSet<>(phase.requiredCapabilities()))
                .orElseGet(Set::of);
    }

    public AssignmentResult assign(WorkItem item) {
        Set<String> required = requiredCapabilities(item);
        AssignmentRequest request = new AssignmentRequest(item.workflowId(), item.id(), item.taskType(), required);

        return agentRegistry.findExecutor(request)
                .map(executor -> {
                    if (metrics != null) {
                        metrics.recordWorkItemAssigned(item.taskType());
                    }
                    return AssignmentResult.assigned(executor, required);
                })
                .orElseGet(() -> {
                    log.info("NO_CAPACITY_AVAILABLE: workItemId={}, taskType={}, capabilities={}",
                            item.id(), item.taskType(), required);
                    if (metrics != null) {
                        metrics.recordNoCapacity(item.taskType());
                    }
                    return AssignmentResult.noCapacity(required);
                });
    }

    /**
     * Frees the executor slot an item held.
     */
    public void release(String executorId) {
        if (executorId != null) {
            agentRegistry.release(executorId);
        }
    }
}
