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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One schedulable unit of work inside a workflow phase.
 * <p>
 * Dependencies are expressed as {@code sequenceId}s, which are assigned when the
 * sequence is declared and stay stable regardless of the storage id.
 * Items are never deleted; they only move to a terminal status.
 *
 * @param id storage id
 * @param workflowId owning workflow
 * @param phase phase the item belongs to
 * @param sequenceId stable id used for dependency matching
 * @param taskType task type, used for capability lookup and retry policy
 * @param name human-readable name
 * @param inputs opaque executor inputs
 * @param dependencies sequence ids that must complete first
 * @param assignedExecutorId executor the item was handed to, null until assigned
 * @param priority higher values are released first among ready items
 * @param deadline optional deadline passed to the executor
 * @param status current status
 * @param blocking whether a final failure blocks the workflow
 * @param retryCount number of retries scheduled so far
 * @param canRetry whether a failed item is waiting for a retry
 * @param nextRetryAt when a failed item becomes eligible for its retry
 * @param lastError last error code reported
 * @param lastErrorMessage last error message reported
 * @param result opaque result reported on completion
 * @param releasedAt when the dependencies were satisfied and the item was released
 * @param metadata item metadata, always carrying {@code sequenceId}
 * @param createdAt creation time
 * @param updatedAt last modification time
 */
@Builder(toBuilder = true)
public record WorkItem(
        String id,
        String workflowId,
        String phase,
        String sequenceId,
        String taskType,
        String name,
        Map<String, Object> inputs,
        List<String> dependencies,
        String assignedExecutorId,
        int priority,
        Instant deadline,
        WorkItemStatus status,
        boolean blocking,
        int retryCount,
        boolean canRetry,
        Instant nextRetryAt,
        String lastError,
        String lastErrorMessage,
        Map<String, Object> result,
        Instant releasedAt,
        Map<String, Object> metadata,
        Instant createdAt,
        Instant updatedAt
) {

    public static final String SEQUENCE_ID_KEY = "sequenceId";
    public static final String DEPENDENCY_FAILED = "DEPENDENCY_FAILED";
    public static final String FAILED_DEPENDENCY_KEY = "failedDependency";

    public WorkItem {
        inputs = inputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs)) : Map.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        result = result != null ? Collections.unmodifiableMap(new LinkedHashMap<>(result)) : null;
        Map<String, Object> meta = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        if (sequenceId != null) {
            meta.put(SEQUENCE_ID_KEY, sequenceId);
        }
        metadata = Collections.unmodifiableMap(meta);
    }

    /**
     * Checks if the item has reached a status it will never leave on its own.
     * Failed items waiting for a retry are not terminal.
     */
    public boolean isTerminal() {
        return status == WorkItemStatus.COMPLETED
                || status == WorkItemStatus.DLQ
                || (status == WorkItemStatus.FAILED && !canRetry);
    }

    public boolean isReleased() {
        return releasedAt != null;
    }

    /**
     * Checks if the item is released but no executor holds it yet.
     */
    public boolean isAwaitingAssignment() {
        return status == WorkItemStatus.PENDING && releasedAt != null && assignedExecutorId == null;
    }

    /**
     * Checks if the item counts as resolved for phase progress: completed, or
     * finally failed without blocking the workflow.
     */
    public boolean isResolvedForPhase() {
        if (status == WorkItemStatus.COMPLETED) {
            return true;
        }
        return isTerminal() && !blocking;
    }

    /**
     * Checks if the item was failed because a dependency failed for good, rather
     * than by its own executor.
     */
    public boolean isFailedByDependency() {
        return status == WorkItemStatus.FAILED && metadata.containsKey(FAILED_DEPENDENCY_KEY);
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    // ==================== Transitions ====================

    public WorkItem released(Instant now) {
        return toBuilder().releasedAt(now).updatedAt(now).build();
    }

    public WorkItem assigned(String executorId, Instant now) {
        return toBuilder()
                .status(WorkItemStatus.ASSIGNED)
                .assignedExecutorId(executorId)
                .updatedAt(now)
                .build();
    }

    public WorkItem unassigned(Instant now) {
        return toBuilder()
                .status(WorkItemStatus.PENDING)
                .assignedExecutorId(null)
                .updatedAt(now)
                .build();
    }

    public WorkItem running(Instant now) {
        return toBuilder().status(WorkItemStatus.RUNNING).updatedAt(now).build();
    }

    public WorkItem completed(Map<String, Object> result, Instant now) {
        return toBuilder()
                .status(WorkItemStatus.COMPLETED)
                .result(result != null ? result : Map.of())
                .canRetry(false)
                .nextRetryAt(null)
                .updatedAt(now)
                .build();
    }

    public WorkItem scheduledForRetry(String errorCode, String message, Instant nextRetryAt, Instant now) {
        return toBuilder()
                .status(WorkItemStatus.FAILED)
                .retryCount(retryCount + 1)
                .canRetry(true)
                .nextRetryAt(nextRetryAt)
                .lastError(errorCode)
                .lastErrorMessage(message)
                .updatedAt(now)
                .build();
    }

    public WorkItem failedPermanently(String errorCode, String message, Instant now) {
        return toBuilder()
                .status(WorkItemStatus.FAILED)
                .canRetry(false)
                .nextRetryAt(null)
                .lastError(errorCode)
                .lastErrorMessage(message)
                .updatedAt(now)
                .build();
    }

    public WorkItem dependencyFailed(String dependencySequenceId, String dependencyError, Instant now) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(FAILED_DEPENDENCY_KEY, dependencySequenceId);
        return failedPermanently(DEPENDENCY_FAILED,
                String.format("Dependency '%s' failed: %s", dependencySequenceId, dependencyError), now)
                .toBuilder()
                .metadata(merged)
                .build();
    }

    public WorkItem deadLettered(String errorCode, String message, Instant now) {
        return toBuilder()
                .status(WorkItemStatus.DLQ)
                .canRetry(false)
                .nextRetryAt(null)
                .lastError(errorCode)
                .lastErrorMessage(message)
                .updatedAt(now)
                .build();
    }

    /**
     * Returns the item reset to {@code PENDING} and unreleased, ready to be
     * released again.
     */
    public WorkItem requeued(Instant now) {
        Map<String, Object> cleared = new LinkedHashMap<>(metadata);
        cleared.remove(FAILED_DEPENDENCY_KEY);
        return toBuilder()
                .metadata(cleared)
                .status(WorkItemStatus.PENDING)
                .assignedExecutorId(null)
                .canRetry(false)
                .nextRetryAt(null)
                .releasedAt(null)
                .updatedAt(now)
                .build();
    }

    public WorkItem withMetadata(Map<String, Object> additions, Instant now) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(additions);
        return toBuilder().metadata(merged).updatedAt(now).build();
    }
}
