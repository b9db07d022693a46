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

package org.fireflyframework.procurement.dispatch;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The hand-off of one work item to an executor. Payloads are opaque to the
 * orchestration core.
 *
 * @param workItemId the item
 * @param workflowId the owning workflow
 * @param phase the item's phase
 * @param taskType what the executor should do
 * @param executorId the chosen executor
 * @param inputs task inputs
 * @param deadline optional deadline
 * @param attempt 1 for the first run, incremented per retry
 */
public record TaskAssignment(
        String workItemId,
        String workflowId,
        String phase,
        String taskType,
        String executorId,
        Map<String, Object> inputs,
        Instant deadline,
        int attempt
) {

    public TaskAssignment {
        inputs = inputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs)) : Map.of();
    }
}
