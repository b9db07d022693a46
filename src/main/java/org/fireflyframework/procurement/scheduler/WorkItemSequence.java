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

import java.util.List;

/**
 * The declarative dependency graph of work items for one workflow, built before
 * anything is submitted.
 */
public record WorkItemSequence(String workflowId, List<WorkItemSpec> items) {

    public WorkItemSequence {
        if (workflowId == null || workflowId.isBlank()) {
            throw new IllegalArgumentException("workflowId is required");
        }
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static WorkItemSequence of(String workflowId, WorkItemSpec... items) {
        return new WorkItemSequence(workflowId, List.of(items));
    }
}
