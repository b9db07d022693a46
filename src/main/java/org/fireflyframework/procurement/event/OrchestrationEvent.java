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

package org.fireflyframework.procurement.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fire-and-forget notification about an orchestration change, published for
 * operator visibility.
 *
 * @param type the event type
 * @param workflowId the workflow concerned
 * @param workItemId the work item concerned, null for workflow-level events
 * @param phase the phase the workflow or item is in
 * @param payload event details
 * @param timestamp when the event happened
 */
public record OrchestrationEvent(
        OrchestrationEventType type,
        String workflowId,
        String workItemId,
        String phase,
        Map<String, Object> payload,
        Instant timestamp
) {

    public OrchestrationEvent {
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    public static OrchestrationEvent workflow(OrchestrationEventType type, String workflowId, String phase,
                                              Map<String, Object> payload, Instant timestamp) {
        return new OrchestrationEvent(type, workflowId, null, phase, payload, timestamp);
    }

    public static OrchestrationEvent workItem(OrchestrationEventType type, String workflowId, String workItemId,
                                              String phase, Map<String, Object> payload, Instant timestamp) {
        return new OrchestrationEvent(type, workflowId, workItemId, phase, payload, timestamp);
    }
}
