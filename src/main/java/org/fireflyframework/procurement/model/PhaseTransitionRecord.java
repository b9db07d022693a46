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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit entry describing one change of a workflow's phase or status.
 *
 * @param id unique record id
 * @param workflowId the workflow
 * @param fromPhase phase before the change, null for the initial record
 * @param toPhase phase after the change
 * @param fromStatus status before the change, null for the initial record
 * @param toStatus status after the change
 * @param kind how the change was triggered
 * @param triggeredBy actor that triggered the change
 * @param reason optional human-readable reason
 * @param durationSeconds seconds spent in {@code fromPhase}
 * @param timestamp when the change was applied
 * @param metadata snapshot of relevant metadata
 */
public record PhaseTransitionRecord(
        String id,
        String workflowId,
        String fromPhase,
        String toPhase,
        WorkflowStatus fromStatus,
        WorkflowStatus toStatus,
        TransitionKind kind,
        String triggeredBy,
        String reason,
        long durationSeconds,
        Instant timestamp,
        Map<String, Object> metadata
) {

    public PhaseTransitionRecord {
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    /**
     * Creates a record for a change that happens now.
     */
    public static PhaseTransitionRecord of(
            String workflowId,
            String fromPhase,
            String toPhase,
            WorkflowStatus fromStatus,
            WorkflowStatus toStatus,
            TransitionKind kind,
            String triggeredBy,
            String reason,
            long durationSeconds,
            Instant timestamp,
            Map<String, Object> metadata) {

        return new PhaseTransitionRecord(
                UUID.randomUUID().toString(),
                workflowId,
                fromPhase,
                toPhase,
                fromStatus,
                toStatus,
                kind,
                triggeredBy,
                reason,
                durationSeconds,
                timestamp,
                metadata
        );
    }

    public boolean isPhaseChange() {
        return fromPhase == null || !fromPhase.equals(toPhase);
    }
}
