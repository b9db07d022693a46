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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.procurement.exception.ProcessDefinitionException;
import org.fireflyframework.procurement.exception.UnknownPhaseException;
import org.fireflyframework.procurement.model.PhaseDefinition;
import org.fireflyframework.procurement.model.PhaseTransition;
import org.fireflyframework.procurement.model.Phases;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated, read-only view of the process definition.
 * <p>
 * Validation happens once, at construction: unknown phase references, a
 * {@code nextPhase} outside the allowed transitions, duplicate edges and missing
 * terminal phases are rejected with {@link ProcessDefinitionException}.
 */
@Slf4j
public class PhaseRegistry {

    private final ProcessDefinition definition;
    private final Map<String, PhaseTransition> transitionsByKey = new HashMap<>();

    public PhaseRegistry(ProcessDefinition definition) {
        this.definition = definition;
        validate();
        log.info("PhaseRegistry initialized: {} phases, {} transitions, initialPhase={}",
                definition.phases().size(), definition.transitions().size(), definition.initialPhase());
    }

    private void validate() {
        Map<String, PhaseDefinition> phases = definition.phases();
        if (phases.isEmpty()) {
            throw new ProcessDefinitionException("Process declares no phases");
        }
        for (String terminal : List.of(Phases.COMPLETED, Phases.FAILED, Phases.CANCELLED)) {
            if (!phases.containsKey(terminal)) {
                throw new ProcessDefinitionException("Process must declare the terminal phase '" + terminal + "'");
            }
        }
        if (!phases.containsKey(definition.initialPhase())) {
            throw new ProcessDefinitionException("Initial phase '" + definition.initialPhase() + "' is not declared");
        }

        for (PhaseDefinition phase : phases.values()) {
            for (String target : phase.allowedTransitions()) {
                if (!phases.containsKey(target)) {
                    throw new ProcessDefinitionException(String.format(
                            "Phase '%s' allows a transition to undeclared phase '%s'", phase.name(), target));
                }
            }
            if (phase.nextPhase() != null && !phase.allows(phase.nextPhase())) {
                throw new ProcessDefinitionException(String.format(
                        "Phase '%s' declares nextPhase '%s' which is not an allowed transition",
                        phase.name(), phase.nextPhase()));
            }
            if (phase.isTerminal() && !phase.allowedTransitions().isEmpty()) {
                throw new ProcessDefinitionException("Terminal phase '" + phase.name() + "' must not have transitions");
            }
        }

        for (PhaseTransition transition : definition.transitions()) {
            if (!phases.containsKey(transition.fromPhase()) || !phases.containsKey(transition.toPhase())) {
                throw new ProcessDefinitionException("Transition " + transition.key() + " references an undeclared phase");
            }
            if (transitionsByKey.put(transition.key(), transition) != null) {
                throw new ProcessDefinitionException("Duplicate transition " + transition.key());
            }
        }

        for (PhaseDefinition phase : phases.values()) {
            for (String target : phase.allowedTransitions()) {
                if (!transitionsByKey.containsKey(PhaseTransition.key(phase.name(), target))) {
                    log.warn("PROCESS_DEFINITION_GAP: phase '{}' allows '{}' but no transition edge is defined",
                            phase.name(), target);
                }
            }
        }
    }

    /**
     * Gets a phase definition.
     *
     * @throws UnknownPhaseException if the phase is not declared
     */
    public PhaseDefinition getPhase(String name) {
        PhaseDefinition phase = definition.phases().get(name);
        if (phase == null) {
            throw new UnknownPhaseException(name);
        }
        return phase;
    }

    public Optional<PhaseDefinition> findPhase(String name) {
        return Optional.ofNullable(definition.phases().get(name));
    }

    public boolean isRegistered(String name) {
        return definition.phases().containsKey(name);
    }

    public Optional<PhaseTransition> findTransition(String fromPhase, String toPhase) {
        return Optional.ofNullable(transitionsByKey.get(PhaseTransition.key(fromPhase, toPhase)));
    }

    public String getInitialPhase() {
        return definition.initialPhase();
    }

    public Collection<PhaseDefinition> getPhases() {
        return definition.phases().values();
    }

    /**
     * Capabilities required for a task type, empty if the process does not list the task type.
     */
    public List<String> getTaskCapabilities(String taskType) {
        return definition.taskCapabilities().getOrDefault(taskType, List.of());
    }

    public ProcessDefinition getDefinition() {
        return definition;
    }
}
