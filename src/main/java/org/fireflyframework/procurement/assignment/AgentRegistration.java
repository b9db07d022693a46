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

import java.time.Instant;
import java.util.Set;

/**
 * An executor known to {@link InMemoryAgentRegistry}.
 *
 * @param executorId the executor id
 * @param capabilities what the executor can do
 * @param maxConcurrentItems how many items it accepts at once
 * @param activeItems items currently handed to it
 * @param lastHeartbeatAt last liveness signal
 * @param lastAssignedAt last time an item was handed to it, {@code null} if never
 */
public record AgentRegistration(
        String executorId,
        Set<String> capabilities,
        int maxConcurrentItems,
        int activeItems,
        Instant lastHeartbeatAt,
        Instant lastAssignedAt
) {

    public AgentRegistration {
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
    }

    public boolean hasCapacity() {
        return activeItems < maxConcurrentItems;
    }

    public boolean canHandle(Set<String> required) {
        return capabilities.containsAll(required);
    }

    AgentRegistration withHeartbeat(Instant now) {
        return new AgentRegistration(executorId, capabilities, maxConcurrentItems, activeItems, now, lastAssignedAt);
    }

    AgentRegistration withAssignment(Instant now) {
        return new AgentRegistration(executorId, capabilities, maxConcurrentItems, activeItems + 1, lastHeartbeatAt, now);
    }

    AgentRegistration withRelease() {
        return new AgentRegistration(executorId, capabilities, maxConcurrentItems, Math.max(0, activeItems - 1),
                lastHeartbeatAt, lastAssignedAt);
    }
}
