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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.procurement.dlq.DeadLetterEntry;
import org.fireflyframework.procurement.model.PhaseTransitionRecord;
import org.fireflyframework.procurement.model.WorkItem;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link OrchestrationStore}.
 * <p>
 * Used when the host application does not provide a durable store, and in tests.
 */
@Slf4j
public class InMemoryOrchestrationStore implements OrchestrationStore {

    private final Map<String, WorkItem> workItems = new ConcurrentHashMap<>();
    private final Map<String, List<PhaseTransitionRecord>> transitionRecords = new ConcurrentHashMap<>();
    private final Map<String, DeadLetterEntry> deadLetterEntries = new ConcurrentHashMap<>();

    public InMemoryOrchestrationStore() {
        log.info("InMemoryOrchestrationStore initialized");
    }

    @Override
    public Mono<WorkItem> createWorkItem(WorkItem item) {
        return Mono.fromCallable(() -> {
            workItems.put(item.id(), item);
            return item;
        });
    }

    @Override
    public Mono<WorkItem> updateWorkItem(WorkItem item) {
        return Mono.fromCallable(() -> {
            workItems.put(item.id(), item);
            return item;
        });
    }

    @Override
    public Flux<WorkItem> getWorkItemsByWorkflow(String workflowId) {
        return Flux.defer(() -> Flux.fromIterable(workItems.values()))
                .filter(item -> workflowId.equals(item.workflowId()))
                .sort(Comparator.comparing(WorkItem::createdAt));
    }

    @Override
    public Mono<PhaseTransitionRecord> createPhaseTransitionRecord(PhaseTransitionRecord record) {
        return Mono.fromCallable(() -> {
            transitionRecords.computeIfAbsent(record.workflowId(), id -> new CopyOnWriteArrayList<>()).add(record);
            return record;
        });
    }

    @Override
    public Mono<DeadLetterEntry> createDeadLetterEntry(DeadLetterEntry entry) {
        return Mono.fromCallable(() -> {
            deadLetterEntries.put(entry.id(), entry);
            return entry;
        });
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    /**
     * Returns the stored transition records of a workflow, oldest first.
     */
    public Flux<PhaseTransitionRecord> getPhaseTransitionRecords(String workflowId) {
        return Flux.defer(() -> Flux.fromIterable(transitionRecords.getOrDefault(workflowId, List.of())));
    }

    /**
     * Returns a stored dead-letter entry.
     */
    public Mono<DeadLetterEntry> getDeadLetterEntry(String id) {
        return Mono.justOrEmpty(deadLetterEntries.get(id));
    }
}
