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

import java.util.Optional;

/**
 * Lifecycle status of a procurement workflow.
 */
public enum WorkflowStatus {

    /**
     * Created, no work submitted yet.
     */
    PENDING,

    /**
     * Work is being executed in the current phase.
     */
    IN_PROGRESS,

    /**
     * Paused by an operator; no new work is dispatched.
     */
    SUSPENDED,

    /**
     * Reached the {@code completed} phase.
     */
    COMPLETED,

    /**
     * Reached the {@code failed} phase, or a transition was rolled back.
     */
    FAILED,

    /**
     * Cancelled by an operator or by a cancelled parent.
     */
    CANCELLED;

    /**
     * Checks if this is a terminal status.
     *
     * @return true if terminal
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Checks if work may be released for a workflow in this status.
     *
     * @return true if work items can be dispatched
     */
    public boolean acceptsWork() {
        return this == PENDING || this == IN_PROGRESS;
    }

    /**
     * Resolves the status implied by entering a phase. Terminal phases share
     * their name with the status; every other phase means work is in progress.
     *
     * @param phase the phase being entered
     * @return the status for that phase
     */
    public static WorkflowStatus forPhase(String phase) {
        return terminalFor(phase).orElse(IN_PROGRESS);
    }

    /**
     * Returns the terminal status named after the given phase, if any.
     */
    public static Optional<WorkflowStatus> terminalFor(String phase) {
        if (phase == null) {
            return Optional.empty();
        }
        return switch (phase) {
            case "completed" -> Optional.of(COMPLETED);
            case "failed" -> Optional.of(FAILED);
            case "cancelled" -> Optional.of(CANCELLED);
            default -> Optional.empty();
        };
    }
}
