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

import java.util.Optional;

/**
 * Source of executors for work items.
 * <p>
 * Implementations must not block for long: lookups happen while the owning
 * workflow is locked.
 */
public interface AgentRegistry {

    /**
     * Finds an executor holding every required capability.
     *
     * @param request the assignment request
     * @return the executor, or empty when no capacity is available
     */
    Optional<ExecutorCandidate> findExecutor(AssignmentRequest request);

    /**
     * Signals that an executor no longer holds an item it was given.
     */
    default void release(String executorId) {
    }
}
