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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.procurement.exception.CycleDetectedException;
import org.fireflyframework.procurement.exception.SequenceValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a {@link WorkItemSequence} and orders it into layers.
 * <p>
 * <b>Layers:</b>
 * <ul>
 *   <li>Layer 0 holds items whose dependencies are all outside the sequence</li>
 *   <li>Each later layer holds items whose in-sequence dependencies sit in earlier layers</li>
 * </ul>
 * Dependencies may point at items submitted earlier for the same workflow.
 */
@Slf4j
public class SequenceTopology {

    private final WorkItemSequence sequence;
    private final Set<String> existingSequenceIds;
    private final Map<String, WorkItemSpec> specs = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependencyGraph = new HashMap<>();
    private final Map<String, Set<String>> reverseDependencyGraph = new HashMap<>();

    /**
     * @param sequence the sequence to validate
     * @param existingSequenceIds sequence ids already submitted for the workflow
     */
    public SequenceTopology(WorkItemSequence sequence, Set<String> existingSequenceIds) {
        this.sequence = sequence;
        this.existingSequenceIds = Set.copyOf(existingSequenceIds);
        buildGraph();
    }

    private void buildGraph() {
        for (WorkItemSpec spec : sequence.items()) {
            if (specs.putIfAbsent(spec.sequenceId(), spec) != null) {
                throw new SequenceValidationException(String.format(
                        "Duplicate sequenceId '%s' in sequence for workflow '%s'",
                        spec.sequenceId(), sequence.workflowId()));
            }
            if (existingSequenceIds.contains(spec.sequenceId())) {
                throw new SequenceValidationException(String.format(
                        "sequenceId '%s' was already submitted for workflow '%s'",
                        spec.sequenceId(), sequence.workflowId()));
            }
            dependencyGraph.put(spec.sequenceId(), new LinkedHashSet<>());
            reverseDependencyGraph.put(spec.sequenceId(), new LinkedHashSet<>());
        }

        for (WorkItemSpec spec : sequence.items()) {
            for (String dependency : spec.dependencies()) {
                if (specs.containsKey(dependency)) {
                    dependencyGraph.get(spec.sequenceId()).add(dependency);
                    reverseDependencyGraph.get(dependency).add(spec.sequenceId());
                } else if (!existingSequenceIds.contains(dependency)) {
                    throw new SequenceValidationException(String.format(
                            "Item '%s' depends on unknown item '%s' in workflow '%s'",
                            spec.sequenceId(), dependency, sequence.workflowId()));
                }
            }
        }
    }

    /**
     * Rejects cyclic sequences.
     *
     * @throws CycleDetectedException naming one cycle
     */
    public void validate() {
        Set<String> visited = new HashSet<>();
        for (String sequenceId : specs.keySet()) {
            List<String> cycle = findCycle(sequenceId, visited, new LinkedHashSet<>());
            if (cycle != null) {
                log.error("CYCLE_DETECTED: workflowId={}, cycle={}", sequence.workflowId(), String.join(" -> ", cycle));
                throw new CycleDetectedException(sequence.workflowId(), cycle);
            }
        }
    }

    private List<String> findCycle(String sequenceId, Set<String> visited, LinkedHashSet<String> path) {
        if (path.contains(sequenceId)) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String id : path) {
                inCycle = inCycle || id.equals(sequenceId);
                if (inCycle) {
                    cycle.add(id);
                }
            }
            cycle.add(sequenceId);
            return cycle;
        }
        if (!visited.add(sequenceId)) {
            return null;
        }

        path.add(sequenceId);
        for (String dependency : dependencyGraph.getOrDefault(sequenceId, Collections.emptySet())) {
            List<String> cycle = findCycle(dependency, visited, path);
            if (cycle != null) {
                return cycle;
            }
        }
        path.remove(sequenceId);
        return null;
    }

    /**
     * Orders the sequence into layers with Kahn's algorithm. Within a layer items
     * are sorted by descending priority, then by declaration order.
     */
    public List<List<WorkItemSpec>> buildLayers() {
        validate();

        List<String> declarationOrder = new ArrayList<>(specs.keySet());
        Comparator<WorkItemSpec> layerOrder = Comparator
                .comparingInt(WorkItemSpec::priority).reversed()
                .thenComparingInt(spec -> declarationOrder.indexOf(spec.sequenceId()));

        Map<String, Integer> inDegree = new HashMap<>();
        dependencyGraph.forEach((id, deps) -> inDegree.put(id, deps.size()));

        List<List<WorkItemSpec>> layers = new ArrayList<>();
        Set<String> processed = new HashSet<>();
        while (processed.size() < specs.size()) {
            List<WorkItemSpec> layer = new ArrayList<>();
            for (String id : declarationOrder) {
                if (inDegree.get(id) == 0 && !processed.contains(id)) {
                    layer.add(specs.get(id));
                }
            }
            if (layer.isEmpty()) {
                throw new IllegalStateException("Unable to build layers for workflow " + sequence.workflowId());
            }
            layer.sort(layerOrder);
            layers.add(layer);

            for (WorkItemSpec spec : layer) {
                processed.add(spec.sequenceId());
                for (String dependent : reverseDependencyGraph.get(spec.sequenceId())) {
                    inDegree.merge(dependent, -1, Integer::sum);
                }
            }
        }
        return layers;
    }

    public Set<String> getDependents(String sequenceId) {
        return Collections.unmodifiableSet(reverseDependencyGraph.getOrDefault(sequenceId, Collections.emptySet()));
    }
}
