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

package org.fireflyframework.procurement.dlq;

import org.fireflyframework.procurement.model.RetryAttempt;
import org.fireflyframework.procurement.model.WorkItem;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A work item quarantined in the Dead Letter Queue (DLQ), with its failure history.
 *
 * @param id unique identifier for this DLQ entry
 * @param workItemId the quarantined work item
 * @param workflowId the workflow the item belongs to
 * @param taskType the item's task type
 * @param workItem snapshot of the item when it was quarantined
 * @param failureReason the error code that caused the quarantine
 * @param failureMessage the last error message
 * @param failureCount number of failed attempts
 * @param retryHistory retries scheduled before the quarantine
 * @param recoverable whether an operator may reprocess the item
 * @param escalated whether the entry was escalated
 * @param escalationReason why the entry was escalated
 * @param reprocessAttempts operator reprocess attempts so far
 * @param maxReprocessAttempts reprocess attempts allowed
 * @param metadata diagnostic metadata
 * @param createdAt when the entry was created
 * @param lastFailureAt when the last failure happened
 * @param updatedAt when the entry last changed
 */
public record DeadLetterEntry(
        String id,
        String workItemId,
        String workflowId,
        String taskType,
        WorkItem workItem,
        String failureReason,
        String failureMessage,
        int failureCount,
        List<RetryAttempt> retryHistory,
        boolean recoverable,
        boolean escalated,
        String escalationReason,
        int reprocessAttempts,
        int maxReprocessAttempts,
        Map<String, Object> metadata,
        Instant createdAt,
        Instant lastFailureAt,
        Instant updatedAt
) {

    public DeadLetterEntry {
        retryHistory = retryHistory != null ? List.copyOf(retryHistory) : List.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    /**
     * Creates a new DLQ entry for a failed work item.
     */
    public static DeadLetterEntry forWorkItem(
            WorkItem item,
            String failureReason,
            String failureMessage,
            int failureCount,
            List<RetryAttempt> retryHistory,
            boolean recoverable,
            int maxReprocessAttempts,
            Map<String, Object> metadata,
            Instant now) {

        Map<String, Object> enriched = new LinkedHashMap<>(metadata != null ? metadata : Map.of());
        enriched.put("movedToDLQAt", now.toString());

        return new DeadLetterEntry(
                UUID.randomUUID().toString(),
                item.id(),
                item.workflowId(),
                item.taskType(),
                item,
                failureReason,
                failureMessage,
                failureCount,
                retryHistory,
                recoverable,
                false,
                null,
                0,
                recoverable ? maxReprocessAttempts : 0,
                enriched,
                now,
                now,
                now
        );
    }

    /**
     * Creates an updated entry marked as escalated.
     */
    public DeadLetterEntry withEscalation(String reason, Instant now) {
        Map<String, Object> updated = new LinkedHashMap<>(metadata);
        updated.put("escalatedAt", now.toString());
        return new DeadLetterEntry(
                id, workItemId, workflowId, taskType, workItem, failureReason, failureMessage, failureCount,
                retryHistory, recoverable, true, reason, reprocessAttempts, maxReprocessAttempts,
                updated, createdAt, lastFailureAt, now);
    }

    /**
     * Creates an updated entry after an operator reprocess attempt.
     */
    public DeadLetterEntry withReprocessAttempt(String triggeredBy, Instant now) {
        Map<String, Object> updated = new LinkedHashMap<>(metadata);
        updated.put("lastReprocessedAt", now.toString());
        updated.put("lastReprocessedBy", triggeredBy);
        return new DeadLetterEntry(
                id, workItemId, workflowId, taskType, workItem, failureReason, failureMessage, failureCount,
                retryHistory, recoverable, escalated, escalationReason, reprocessAttempts + 1,
                maxReprocessAttempts, updated, createdAt, lastFailureAt, now);
    }

    /**
     * Checks if an operator may still reprocess this entry.
     */
    public boolean canReprocess() {
        return recoverable && reprocessAttempts < maxReprocessAttempts;
    }
}
