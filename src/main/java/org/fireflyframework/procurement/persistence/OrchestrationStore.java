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

package org.fireflyframework.procurement.persistence;

import org.fireflyframework.procurement.dlq.DeadLetterEntry;
import org.fireflyframework.procurement.model.PhaseTransitionRecord;
import org.fireflyframework.procurement.model.WorkItem;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable store the orchestration core writes its audit trail to.
 * <p>
 * The core keeps its working state in memory and treats these writes as
 * advisory: a failed write is logged and never undoes the in-memory change.
 * Implementations backed by a database are provided by the host application.
 */
public interface OrchestrationStore {

    /**
     * Persists a newly submitted work item.
     */
    Mono<WorkItem> createWorkItem(WorkItem item);

    /**
     * Persists the latest version of a work item.
     */
    Mono<WorkItem> updateWorkItem(WorkItem item);

    /**
     * Returns all stored work items of a workflow.
     */
    Flux<WorkItem> getWorkItemsByWorkflow(String workflowId);

    /**
     * Appends a transition record to a workflow's audit history.
     */
    Mono<PhaseTransitionRecord> createPhaseTransitionRecord(PhaseTransitionRecord record);

    /**
     * Persists a dead-letter entry.
     */
    Mono<DeadLetterEntry> createDeadLetterEntry(DeadLetterEntry entry);

    /**
     * Checks if the store is reachable.
     */
    Mono<Boolean> isHealthy();
}
