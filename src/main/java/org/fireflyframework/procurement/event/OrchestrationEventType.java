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

package org.fireflyframework.procurement.event;

/**
 * Types of orchestration notifications.
 */
public enum OrchestrationEventType {
    WORKFLOW_CREATED,
    WORKFLOW_ACTIVATED,
    PHASE_TRANSITIONED,
    TRANSITION_ROLLED_BACK,
    WORKFLOW_PAUSED,
    WORKFLOW_RESUMED,
    WORKFLOW_CANCELLED,
    WORKFLOW_FAILED,
    WORKFLOW_BLOCKED,
    PHASE_TIMED_OUT,
    WORK_ITEM_RELEASED,
    WORK_ITEM_COMPLETED,
    WORK_ITEM_FAILED,
    WORK_ITEM_DEAD_LETTERED,
    DEAD_LETTER_ESCALATED
}
