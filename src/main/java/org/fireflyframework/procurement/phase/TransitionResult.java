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

import org.fireflyframework.procurement.model.PhaseTransitionRecord;
import org.fireflyframework.procurement.model.WorkflowPhaseState;

import java.util.List;

/**
 * Structured result of a state machine operation. Expected runtime outcomes,
 * such as unmet conditions, are reported here rather than thrown.
 *
 * @param outcome the outcome
 * @param state the workflow state after the operation, null if the workflow is unknown
 * @param record the transition record appended, null if nothing was recorded
 * @param unmetConditions why the conditions were not met
 * @param message human-readable detail
 */
public record TransitionResult(
        TransitionOutcome outcome,
        WorkflowPhaseState state,
        PhaseTransitionRecord record,
        List<String> unmetConditions,
        String message
) {

    public TransitionResult {
        unmetConditions = unmetConditions != null ? List.copyOf(unmetConditions) : List.of();
    }

    public static TransitionResult success(WorkflowPhaseState state, PhaseTransitionRecord record) {
        return new TransitionResult(TransitionOutcome.SUCCESS, state, record, List.of(), null);
    }

    public static TransitionResult workflowNotFound(String workflowId) {
        return new TransitionResult(TransitionOutcome.WORKFLOW_NOT_FOUND, null, null, List.of(),
                "Workflow not found: " + workflowId);
    }

    public static TransitionResult invalidTransition(WorkflowPhaseState state, String toPhase) {
        return new TransitionResult(TransitionOutcome.INVALID_TRANSITION, state, null, List.of(),
                String.format("Cannot transition from '%s' to '%s'; allowed: %s",
                        state.currentPhase(), toPhase, state.canTransitionTo()));
    }

    public static TransitionResult invalidTransition(WorkflowPhaseState state, String toPhase, String message) {
        return new TransitionResult(TransitionOutcome.INVALID_TRANSITION, state, null, List.of(), message);
    }

    public static TransitionResult conditionsNotMet(WorkflowPhaseState state, List<String> unmet) {
        return new TransitionResult(TransitionOutcome.CONDITIONS_NOT_MET, state, null, unmet,
                "Transition conditions not met: " + String.join("; ", unmet));
    }

    public static TransitionResult invalidState(WorkflowPhaseState state, String message) {
        return new TransitionResult(TransitionOutcome.INVALID_STATE, state, null, List.of(), message);
    }

    public static TransitionResult failed(WorkflowPhaseState state, PhaseTransitionRecord record, String message) {
        return new TransitionResult(TransitionOutcome.TRANSITION_FAILED, state, record, List.of(), message);
    }

    public boolean isSuccess() {
        return outcome == TransitionOutcome.SUCCESS;
    }
}
