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

import org.fireflyframework.procurement.model.WorkflowPhaseState;

/**
 * Observer of workflow state changes.
 * <p>
 * {@link #beforeCommit} takes part in the transition: throwing from it rolls the
 * transition back. {@link #afterCommit} is notified once the new state is visible;
 * its failures are logged and ignored.
 */
public interface PhaseTransitionListener {

    /**
     * Called with the workflow lock held, before a phase transition is committed.
     *
     * @param current the state before the transition
     * @param next the state about to be committed
     */
    default void beforeCommit(WorkflowPhaseState current, WorkflowPhaseState next) {
    }

    /**
     * Called with the workflow lock held, after a phase or status change was committed.
     *
     * @param previous the state before the change
     * @param current the committed state
     */
    default void afterCommit(WorkflowPhaseState previous, WorkflowPhaseState current) {
    }
}
