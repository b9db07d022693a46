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

import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of one workflow's phase state.
 * <p>
 * The state machine replaces the whole snapshot on every mutation, so readers
 * always observe either the old or the new phase together with its metadata
 * and history, never a mix of both.
 *
 * @param workflowId the workflow id
 * @param currentPhase the phase the workflow occupies
 * @param status the lifecycle status
 * @param phaseHistory transition records, oldest first
 * @param canTransitionTo phases the workflow may legally move to next
 * @param blockedReasons why the workflow cannot currently advance
 * @param metadata workflow context and hook scratch space
 * @param childWorkflowIds workflows cancelled together with this one
 * @param phaseEnteredAt when the current phase was entered
 * @param createdAt when the workflow was created
 * @param updatedAt when the snapshot was produced
 */
@Builder(toBuilder = true)
public record WorkflowPhaseState(
        String workflowId,
        String currentPhase,
        WorkflowStatus status,
        List<PhaseTransitionRecord> phaseHistory,
        List<String> canTransitionTo,
        List<String> blockedReasons,
        Map<String, Object> metadata,
        List<String> childWorkflowIds,
        Instant phaseEnteredAt,
        Instant createdAt,
        Instant updatedAt
) {

    public WorkflowPhaseState {
        phaseHistory = phaseHistory != null ? List.copyOf(phaseHistory) : List.of();
        canTransitionTo = canTransitionTo != null ? List.copyOf(canTransitionTo) : List.of();
        blockedReasons = blockedReasons != null ? List.copyOf(blockedReasons) : List.of();
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
        childWorkflowIds = childWorkflowIds != null ? List.copyOf(childWorkflowIds) : List.of();
    }

    /**
     * Returns the history extended by one record, for use with {@link #toBuilder()}.
     */
    public List<PhaseTransitionRecord> historyWith(PhaseTransitionRecord record) {
        List<PhaseTransitionRecord> history = new ArrayList<>(phaseHistory);
        history.add(record);
        return history;
    }

    /**
     * Returns a mutable copy of the metadata, for use with {@link #toBuilder()}.
     */
    public Map<String, Object> metadataCopy() {
        return new LinkedHashMap<>(metadata);
    }

    public Optional<PhaseTransitionRecord> lastTransition() {
        return phaseHistory.isEmpty()
                ? Optional.empty()
                : Optional.of(phaseHistory.get(phaseHistory.size() - 1));
    }

    public boolean isBlocked() {
        return !blockedReasons.isEmpty();
    }
}
