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

import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declaration of one work item inside a {@link WorkItemSequence}.
 *
 * @param sequenceId stable id used for dependency matching
 * @param taskType what the executor should do
 * @param name human readable name, defaults to the sequence id
 * @param phase the phase the item belongs to, defaults to the workflow's current phase
 * @param inputs opaque task inputs
 * @param dependencies sequence ids that must complete first
 * @param priority higher runs first when several items are released together
 * @param deadline optional deadline
 * @param blocking whether a final failure of this item blocks the workflow
 * @param metadata extra item metadata
 */
@Builder
public record WorkItemSpec(
        String sequenceId,
        String taskType,
        String name,
        String phase,
        Map<String, Object> inputs,
        List<String> dependencies,
        int priority,
        Instant deadline,
        boolean blocking,
        Map<String, Object> metadata
) {

    public WorkItemSpec {
        if (sequenceId == null || sequenceId.isBlank()) {
            throw new IllegalArgumentException("sequenceId is required");
        }
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType is required for item " + sequenceId);
        }
        name = name != null ? name : sequenceId;
        inputs = inputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs)) : Map.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static WorkItemSpec of(String sequenceId, String taskType, String... dependencies) {
        return WorkItemSpec.builder()
                .sequenceId(sequenceId)
                .taskType(taskType)
                .dependencies(List.of(dependencies))
                .build();
    }
}
