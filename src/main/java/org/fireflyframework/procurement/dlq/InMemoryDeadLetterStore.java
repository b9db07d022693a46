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

import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link DeadLetterStore}.
 */
public class InMemoryDeadLetterStore implements DeadLetterStore {

    private final Map<String, DeadLetterEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Mono<DeadLetterEntry> save(DeadLetterEntry entry) {
        return Mono.fromCallable(() -> {
            entries.put(entry.id(), entry);
            return entry;
        });
    }

    @Override
    public Mono<DeadLetterEntry> findById(String id) {
        return Mono.defer(() -> Mono.justOrEmpty(entries.get(id)));
    }

    @Override
    public Flux<DeadLetterEntry> findAll() {
        return Flux.defer(() -> Flux.fromIterable(entries.values()))
                .sort(Comparator.comparing(DeadLetterEntry::createdAt));
    }

    @Override
    public Flux<DeadLetterEntry> findByWorkflowId(String workflowId) {
        return findAll().filter(entry -> workflowId.equals(entry.workflowId()));
    }

    @Override
    public Flux<DeadLetterEntry> findByWorkItemId(String workItemId) {
        return findAll().filter(entry -> workItemId.equals(entry.workItemId()));
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return Mono.fromCallable(() -> entries.remove(id) != null);
    }

    @Override
    public Mono<Long> count() {
        return Mono.fromCallable(() -> (long) entries.size());
    }
}
