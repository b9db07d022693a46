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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.procurement.condition.ConditionParser;
import org.fireflyframework.procurement.exception.ProcessDefinitionException;
import org.fireflyframework.procurement.model.PhaseDefinition;
import org.fireflyframework.procurement.model.PhaseTransition;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a {@link ProcessDefinition} from JSON.
 * <p>
 * Transition conditions are parsed into condition trees while loading, so a
 * malformed condition fails the application at startup.
 * <pre>
 * {
 *   "initialPhase": "discovery",
 *   "ordinalScales": { "riskLevel": ["low", "medium", "high"] },
 *   "phases": [ { "name": "discovery", "allowedTransitions": ["analysis", "cancelled"], ... } ],
 *   "transitions": [ { "from": "discovery", "to": "analysis", "conditions": { "rfpCount": { "min": 1 } } } ],
 *   "taskCapabilities": { "portal_scan": ["portal_scanning"] }
 * }
 * </pre>
 */
@Slf4j
public class ProcessDefinitionLoader {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public ProcessDefinitionLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    /**
     * Loads the definition from a Spring resource location such as
     * {@code classpath:procurement/default-process.json}.
     */
    public ProcessDefinition load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ProcessDefinitionException("Process definition not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            ProcessDefinition definition = toDefinition(objectMapper.readValue(in, ProcessDocument.class));
            log.info("Loaded process definition from {}: phases={}", location, definition.phases().keySet());
            return definition;
        } catch (IOException e) {
            throw new ProcessDefinitionException("Failed to read process definition " + location, e);
        }
    }

    /**
     * Parses a definition from a JSON string.
     */
    public ProcessDefinition parse(String json) {
        try {
            return toDefinition(objectMapper.readValue(json, ProcessDocument.class));
        } catch (IOException e) {
            throw new ProcessDefinitionException("Failed to parse process definition", e);
        }
    }

    private ProcessDefinition toDefinition(ProcessDocument document) {
        if (document.getPhases() == null || document.getPhases().isEmpty()) {
            throw new ProcessDefinitionException("Process definition declares no phases");
        }

        ConditionParser conditionParser = new ConditionParser(
                document.getOrdinalScales() != null ? document.getOrdinalScales() : Map.of());

        Map<String, PhaseDefinition> phases = new LinkedHashMap<>();
        for (PhaseDocument phase : document.getPhases()) {
            if (phase.getName() == null || phase.getName().isBlank()) {
                throw new ProcessDefinitionException("Phase without a name");
            }
            PhaseDefinition previous = phases.put(phase.getName(), new PhaseDefinition(
                    phase.getName(),
                    phase.getDisplayName() != null ? phase.getDisplayName() : phase.getName(),
                    phase.getDescription(),
                    phase.getAllowedTransitions(),
                    phase.getEntryHooks(),
                    phase.getExitHooks(),
                    phase.getTimeoutMinutes() != null ? Duration.ofMinutes(phase.getTimeoutMinutes()) : null,
                    phase.getRequiredCapabilities(),
                    phase.getNextPhase()));
            if (previous != null) {
                throw new ProcessDefinitionException("Duplicate phase '" + phase.getName() + "'");
            }
        }

        List<PhaseTransition> transitions = new ArrayList<>();
        if (document.getTransitions() != null) {
            for (TransitionDocument transition : document.getTransitions()) {
                try {
                    transitions.add(new PhaseTransition(
                            transition.getFrom(),
                            transition.getTo(),
                            conditionParser.parse(transition.getConditions()),
                            transition.getHooks()));
                } catch (ProcessDefinitionException e) {
                    throw new ProcessDefinitionException(String.format("Invalid condition on transition %s: %s",
                            PhaseTransition.key(transition.getFrom(), transition.getTo()), e.getMessage()), e);
                }
            }
        }

        String initialPhase = document.getInitialPhase() != null
                ? document.getInitialPhase()
                : document.getPhases().get(0).getName();

        return new ProcessDefinition(initialPhase, phases, transitions, document.getTaskCapabilities());
    }

    @Data
    @NoArgsConstructor
    static class ProcessDocument {
        private String initialPhase;
        private Map<String, List<String>> ordinalScales;
        private List<PhaseDocument> phases;
        private List<TransitionDocument> transitions;
        private Map<String, List<String>> taskCapabilities;
    }

    @Data
    @NoArgsConstructor
    static class PhaseDocument {
        private String name;
        private String displayName;
        private String description;
        private List<String> allowedTransitions;
        private List<String> entryHooks;
        private List<String> exitHooks;
        private Long timeoutMinutes;
        private List<String> requiredCapabilities;
        private String nextPhase;
    }

    @Data
    @NoArgsConstructor
    static class TransitionDocument {
        private String from;
        private String to;
        private Map<String, Object> conditions;
        private List<String> hooks;
    }
}
