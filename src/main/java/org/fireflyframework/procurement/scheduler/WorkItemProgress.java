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

package org.fireflyframework.procurement.scheduler;

import java.util.Map;

/**
 * Work-item progress of a workflow's current phase.
 *
 * @param workflowId the workflow
 * @param phase the phase measured
 * @param total items in the phase
 * @param completed completed items
 * @param failed items that finally failed or were dead-lettered
 * @param inFlight items assigned or running
 * @param pending items not yet released or waiting for assignment or retry
 * @param byStatus item count per status
 * @param phaseComplete whether every item is completed or failed without blocking
 */
public record WorkItemProgress(
        String workflowId,
        String phase,
        int total,
        int completed,
        int failed,
        int inFlight,
        int pending,
        Map<String, Integer> byStatus,
        boolean phaseComplete
) {

    public double completionRatio() {
        return total == 0 ? 0.0 : (double) completed / total;
    }

    public Map<String, Object> toMetadata() {
        return Map.of(
                "phase", phase,
                "total", total,
                "completed", completed,
                "failed", failed,
                "inFlight", inFlight,
                "pending", pending,
                "progress", completionRatio(),
                "phaseComplete", phaseComplete);
    }
}
