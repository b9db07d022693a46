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

package org.fireflyframework.procurement.model;

/**
 * Status of a single work item.
 */
public enum WorkItemStatus {

    /**
     * Waiting for dependencies, or released and waiting for an executor.
     */
    PENDING,

    /**
     * Handed to an executor.
     */
    ASSIGNED,

    /**
     * The executor reported that it started.
     */
    RUNNING,

    /**
     * Finished successfully.
     */
    COMPLETED,

    /**
     * Failed; retried later if the item is flagged {@code canRetry}.
     */
    FAILED,

    /**
     * Quarantined in the dead-letter queue.
     */
    DLQ;

    /**
     * Checks if the executor side is currently responsible for the item.
     */
    public boolean isInFlight() {
        return this == ASSIGNED || this == RUNNING;
    }
}
