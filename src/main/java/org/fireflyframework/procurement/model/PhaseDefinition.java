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

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Static definition of one phase of the procurement process.
 *
 * @param name the phase name
 * @param displayName human-readable label
 * @param description what happens in this phase
 * @param allowedTransitions phases reachable from this one
 * @param entryHooks hooks run after the phase is entered, in order
 * @param exitHooks hooks run before the phase is left, in order
 * @param timeout advisory time limit for the phase, null if none
 * @param requiredCapabilities capability tags an executor needs to work this phase
 * @param nextPhase successor used for automatic progression, null to infer it
 */
public record PhaseDefinition(
        String name,
        String displayName,
        String description,
        List<String> allowedTransitions,
        List<String> entryHooks,
        List<String> exitHooks,
        Duration timeout,
        List<String> requiredCapabilities,
        String nextPhase
) {

    public PhaseDefinition {
        allowedTransitions = allowedTransitions != null ? List.copyOf(allowedTransitions) : List.of();
        entryHooks = entryHooks != null ? List.copyOf(entryHooks) : List.of();
        exitHooks = exitHooks != null ? List.copyOf(exitHooks) : List.of();
        requiredCapabilities = requiredCapabilities != null ? List.copyOf(requiredCapabilities) : List.of();
    }

    /**
     * Creates a terminal phase definition with no outgoing transitions.
     */
    public static PhaseDefinition terminal(String name, String displayName) {
        return new PhaseDefinition(name, displayName, null, List.of(), List.of(), List.of(), null, List.of(), null);
    }

    public boolean isTerminal() {
        return Phases.isTerminal(name);
    }

    public boolean allows(String phase) {
        return allowedTransitions.contains(phase);
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }
}
