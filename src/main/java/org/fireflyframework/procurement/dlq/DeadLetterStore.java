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

package org.fireflyframework.procurement.dlq;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Storage for Dead Letter Queue (DLQ) entries.
 */
public interface DeadLetterStore {

    /**
     * Saves a DLQ entry, replacing any entry with the same id.
     *
     * @param entry the entry to save
     * @return the saved entry
     */
    Mono<DeadLetterEntry> save(DeadLetterEntry entry);

    /**
     * Finds a DLQ entry by ID.
     *
     * @param id the entry ID
     * @return the entry if found
     */
    Mono<DeadLetterEntry> findById(String id);

    /**
     * Finds all DLQ entries.
     *
     * @return flux of all entries
     */
    Flux<DeadLetterEntry> findAll();

    /**
     * Finds DLQ entries by workflow ID.
     *
     * @param workflowId the workflow ID
     * @return flux of matching entries
     */
    Flux<DeadLetterEntry> findByWorkflowId(String workflowId);

    /**
     * Finds DLQ entries by work item ID.
     *
     * @param workItemId the work item ID
     * @return flux of matching entries
     */
    Flux<DeadLetterEntry> findByWorkItemId(String workItemId);

    /**
     * Deletes a DLQ entry.
     *
     * @param id the entry ID
     * @return true if deleted
     */
    Mono<Boolean> delete(String id);

    /**
     * Counts all DLQ entries.
     *
     * @return the count
     */
    Mono<Long> count();
}
