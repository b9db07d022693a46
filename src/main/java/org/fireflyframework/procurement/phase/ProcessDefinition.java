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

package org.fireflyframework.procurement.phase;

import org.fireflyframework.procurement.model.PhaseDefinition;
import org.fireflyframework.procurement.model.PhaseTransition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The shape of the procurement process: its phases, the guarded edges between
 * them, and the capabilities each task type needs.
 *
 * @param initialPhase phase new workflows start in
 * @param phases phase definitions by name, in declaration order
 * @param transitions guarded edges
 * @param taskCapabilities capability tags required per task type
 */
public record ProcessDefinition(
        String initialPhase,
        Map<String, PhaseDefinition> phases,
        List<PhaseTransition> transitions,
        Map<String, List<String>> taskCapabilities
) {

    public ProcessDefinition {
        phases = phases != null ? Collections.unmodifiableMap(new LinkedHashMap<>(phases)) : Map.of();
        transitions = transitions != null ? List.copyOf(transitions) : List.of();
        taskCapabilities = taskCapabilities != null ? Map.copyOf(taskCapabilities) : Map.of();
    }
}
