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
import org.fireflyframework.procurement.assignment.AssignmentResult;
import org.fireflyframework.procurement.assignment.WorkItemAssigner;
import org.fireflyframework.procurement.concurrent.WorkflowLocks;
import org.fireflyframework.procurement.dispatch.DispatchQueues;
import org.fireflyframework.procurement.dispatch.TaskAssignment;
import org.fireflyframework.procurement.dlq.DeadLetterEntry;
import org.fireflyframework.procurement.dlq.DeadLetterService;
import org.fireflyframework.procurement.event.OrchestrationEvent;
import org.fireflyframework.procurement.event.OrchestrationEventPublisher;
import org.fireflyframework.procurement.event.OrchestrationEventType;
import org.fireflyframework.procurement.exception.WorkItemNotFoundException;
import org.fireflyframework.procurement.metrics.OrchestrationMetrics;
import org.fireflyframework.procurement.model.WorkItem;
import org.fireflyframework.procurement.model.WorkItemStatus;
import org.fireflyframework.procurement.model.WorkflowPhaseState;
import org.fireflyframework.procurement.model.WorkflowStatus;
import org.fireflyframework.procurement.persistence.AuditTrail;
import org.fireflyframework.procurement.phase.PhaseStateMachine;
import org.fireflyframework.procurement.phase.PhaseTransitionListener;
import org.fireflyframework.procurement.phase.TransitionResult;
import org.fireflyframework.procurement.properties.OrchestrationProperties;
import org.fireflyframework.procurement.retry.ErrorCodes;
import org.fireflyframework.procurement.retry.FailureDisposition;
import org.fireflyframework.procurement.retry.RetryBackoffService;
import org.fireflyframework.procurement.retry.RetryDecision;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Turns declarative work-item sequences into a live execution order.
 * <p>
 * Items are released once every dependency, matched by {@code sequenceId}, has
 * completed. All decisions about a workflow's items are made under that
 * workflow's lock, which is also the lock the {@link PhaseStateMachine} uses, so
 * a dependent is released exactly once even when its dependencies complete on
 * different threads at the same instant.
 * <p>
 * Hand-off to executors is fire-and-forget through {@link DispatchQueues}.
 * Executors report back through {@link #onItemStarted}, {@link #onItemCompleted}
 * and {@link #onItemFailed}; all three tolerate repeated delivery.
 */
@Slf4j
public class WorkItemScheduler implements PhaseTransitionListener {

    private static final Comparator<WorkItem> ASSIGNMENT_ORDER = Comparator
            .comparingInt(WorkItem::priority).reversed()
            .thenComparing(WorkItem::createdAt);

    private final PhaseStateMachine stateMachine;
    private final WorkflowLocks locks;
    private final RetryBackoffService retryService;
    private final DeadLetterService deadLetterService;
    private final WorkItemAssigner assigner;
    private final DispatchQueues dispatchQueues;
    private final AuditTrail auditTrail;
    private final OrchestrationEventPublisher eventPublisher;
    private final OrchestrationMetrics metrics;
    private final OrchestrationProperties.SchedulerConfig config;
    private final Clock clock;

    private final Map<String, WorkItem> items = new ConcurrentHashMap<>();
    // workflowId -> (sequenceId -> itemId); inner maps are only touched under the workflow lock
    private final Map<String, Map<String, String>> sequenceIndex = new ConcurrentHashMap<>();

    public WorkItemScheduler(
            PhaseStateMachine stateMachine,
            WorkflowLocks locks,
            RetryBackoffService retryService,
            DeadLetterService deadLetterService,
            WorkItemAssigner assigner,
            DispatchQueues dispatchQueues,
            AuditTrail auditTrail,
            @Nullable OrchestrationEventPublisher eventPublisher,
            @Nullable OrchestrationMetrics metrics,
            OrchestrationProperties.SchedulerConfig config,
            Clock clock) {
        this.stateMachine = stateMachine;
        this.locks = locks;
        this.retryService = retryService;
        this.deadLetterService = deadLetterService;
        this.assigner = assigner;
        this.dispatchQueues = dispatchQueues;
        this.auditTrail = auditTrail;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;

        stateMachine.addListener(this);
        dispatchQueues.onFailure((assignment, error) -> revertAssignment(assignment));
    }

    // ==================== Submission ====================

    /**
     * Validates and persists a sequence, then releases every item whose
     * dependencies are already satisfied. A {@code PENDING} workflow becomes
     * {@code IN_PROGRESS}.
     *
     * @param sequence the sequence to submit
     * @return the created items, in their state after release
     * @throws org.fireflyframework.procurement.exception.WorkflowNotFoundException if the workflow is unknown
     * @throws org.fireflyframework.procurement.exception.CycleDetectedException if the sequence is cyclic; nothing is persisted
     * @throws org.fireflyframework.procurement.exception.SequenceValidationException for unknown dependencies or duplicate ids
     * @throws IllegalStateException if the workflow no longer accepts work
     */
    public List<WorkItem> submit(WorkItemSequence sequence) {
        String workflowId = sequence.workflowId();
        return locks.withLock(workflowId, () -> {
            WorkflowPhaseState state = stateMachine.getState(workflowId);
            if (state.status().isTerminal()) {
                throw new IllegalStateException(String.format(
                        "Workflow %s is %s and accepts no new work", workflowId, state.status()));
            }

            Map<String, String> index = sequenceIndex.computeIfAbsent(workflowId, id -> new LinkedHashMap<>());
            List<List<WorkItemSpec>> layers = new SequenceTopology(sequence, index.keySet()).buildLayers();
            sequence.items().forEach(spec -> stateMachine.getPhaseRegistry()
                    .getPhase(spec.phase() != null ? spec.phase() : state.currentPhase()));

            Instant now = clock.instant();
            List<String> createdIds = new ArrayList<>();
            for (List<WorkItemSpec> layer : layers) {
                for (WorkItemSpec spec : layer) {
                    WorkItem item = toWorkItem(spec, workflowId, state.currentPhase(), now);
                    items.put(item.id(), item);
                    index.put(item.sequenceId(), item.id());
                    auditTrail.workItemCreated(item);
                    createdIds.add(item.id());
                }
            }
            log.info("SEQUENCE_SUBMITTED: workflowId={}, items={}, layers={}",
                    workflowId, createdIds.size(), layers.size());

            if (state.status() == WorkflowStatus.PENDING) {
                stateMachine.activate(workflowId, PhaseStateMachine.SYSTEM_ACTOR);
            }
            releaseReady(workflowId, clock.instant());

            return createdIds.stream().map(items::get).toList();
        });
    }

    // ==================== Executor callbacks ====================

    /**
     * Records that an executor started an item. Repeated or late reports are ignored.
     */
    public WorkItem onItemStarted(String workItemId, String executorId) {
        WorkItem item = requireItem(workItemId);
        return locks.withLock(item.workflowId(), () -> {
            WorkItem current = items.get(workItemId);
            if (current.status() != WorkItemStatus.ASSIGNED) {
                log.debug("WORK_ITEM_START_IGNORED: workItemId={}, status={}", workItemId, current.status());
                return current;
            }
            if (executorId != null && !executorId.equals(current.assignedExecutorId())) {
                log.warn("WORK_ITEM_EXECUTOR_MISMATCH: workItemId={}, assigned={}, reported={}",
                        workItemId, current.assignedExecutorId(), executorId);
            }
            return save(current.running(clock.instant()));
        });
    }

    /**
     * Marks an item completed, releases the dependents that became ready and,
     * once the current phase has no unresolved items left, attempts the phase's
     * automatic transition.
     * <p>
     * Repeated reports are a no-op. Results for a workflow that is already
     * terminal are recorded on the item and otherwise discarded.
     *
     * @param workItemId the item
     * @param result the opaque executor result
     * @return the item after the report
     * @throws WorkItemNotFoundException if the item is unknown
     */
    public WorkItem onItemCompleted(String workItemId, Map<String, Object> result) {
        WorkItem item = requireItem(workItemId);
        String workflowId = item.workflowId();

        return locks.withLock(workflowId, () -> {
            WorkItem current = items.get(workItemId);
            if (current.isTerminal()) {
                log.debug("WORK_ITEM_COMPLETION_IGNORED: workItemId={}, status={}", workItemId, current.status());
                return current;
            }
            if (current.status() == WorkItemStatus.PENDING && !current.isReleased()) {
                log.warn("WORK_ITEM_COMPLETION_REJECTED: workItemId={}, workflowId={}, dependencies={}",
                        workItemId, workflowId, current.dependencies());
                return current;
            }

            Instant now = clock.instant();
            WorkItem completed = save(current.completed(result, now));
            assigner.release(current.assignedExecutorId());
            retryService.clearRetryHistory(workItemId);
            if (metrics != null) {
                metrics.recordWorkItemCompleted(completed.taskType());
            }
            log.info("WORK_ITEM_COMPLETED: workItemId={}, workflowId={}, sequenceId={}, taskType={}",
                    workItemId, workflowId, completed.sequenceId(), completed.taskType());
            publish(OrchestrationEventType.WORK_ITEM_COMPLETED, completed, Map.of("sequenceId", completed.sequenceId()));

            Optional<WorkflowPhaseState> state = stateMachine.findState(workflowId);
            if (state.isEmpty() || state.get().status().isTerminal()) {
                log.info("WORK_ITEM_RESULT_DISCARDED: workItemId={}, workflowId={}, workflowStatus={}",
                        workItemId, workflowId, state.map(WorkflowPhaseState::status).orElse(null));
                return completed;
            }

            releaseReady(workflowId, now);
            checkPhaseCompletion(workflowId);
            return items.get(workItemId);
        });
    }

    /**
     * Applies the retry subsystem's disposition to a failed item.
     * <p>
     * A blocking item that will not be retried blocks the workflow. A small set
     * of critical error codes fails the workflow outright instead.
     *
     * @param workItemId the item
     * @param errorCode the executor's error code
     * @param message the executor's error message
     * @return what the report did
     * @throws WorkItemNotFoundException if the item is unknown
     */
    public FailureReport onItemFailed(String workItemId, String errorCode, @Nullable String message) {
        WorkItem item = requireItem(workItemId);
        String workflowId = item.workflowId();

        return locks.withLock(workflowId, () -> {
            WorkItem current = items.get(workItemId);
            if (!current.status().isInFlight() && !current.isAwaitingAssignment()) {
                log.debug("WORK_ITEM_FAILURE_IGNORED: workItemId={}, status={}", workItemId, current.status());
                return FailureReport.ignored(current);
            }

            Instant now = clock.instant();
            assigner.release(current.assignedExecutorId());

            Optional<WorkflowPhaseState> state = stateMachine.findState(workflowId);
            if (state.isEmpty() || state.get().status().isTerminal()) {
                WorkItem failed = save(current.failedPermanently(errorCode, message, now));
                log.info("WORK_ITEM_FAILURE_DISCARDED: workItemId={}, workflowId={}, error={}",
                        workItemId, workflowId, errorCode);
                return FailureReport.applied(failed, null);
            }

            Map<String, Object> context = new LinkedHashMap<>();
            context.put("workflowId", workflowId);
            context.put("phase", current.phase());
            context.put("executorId", current.assignedExecutorId());
            context.put("message", message);
            RetryDecision decision = retryService.shouldRetry(
                    workItemId, current.taskType(), errorCode, current.retryCount(), context);

            WorkItem updated = save(switch (decision.disposition()) {
                case RETRY -> current.scheduledForRetry(errorCode, message, decision.nextRetryAt(), now);
                case PERMANENT -> current.failedPermanently(errorCode, message, now);
                case DEAD_LETTER -> current.deadLettered(errorCode, message, now);
            });

            log.warn("WORK_ITEM_FAILED: workItemId={}, workflowId={}, error={}, disposition={}, attempt={}",
                    workItemId, workflowId, errorCode, decision.disposition(), decision.attempt());
            if (metrics != null) {
                metrics.recordWorkItemFailed(updated.taskType(), decision.disposition());
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("errorCode", errorCode);
            payload.put("disposition", decision.disposition());
            payload.put("attempt", decision.attempt());
            payload.put("reason", decision.reason());
            publish(OrchestrationEventType.WORK_ITEM_FAILED, updated, payload);

            if (decision.moveToDeadLetter()) {
                quarantine(updated, errorCode, decision);
            }
            if (!decision.shouldRetry()) {
                List<WorkItem> stranded = failDependents(updated, now);
                Optional<WorkItem> strandedBlocking = stranded.stream().filter(WorkItem::blocking).findFirst();
                if (updated.blocking()) {
                    handleBlockingFailure(updated, errorCode, message, now);
                } else if (strandedBlocking.isPresent()) {
                    blockOnStrandedItem(strandedBlocking.get(), updated, now);
                } else {
                    checkPhaseCompletion(workflowId);
                }
            }
            return FailureReport.applied(items.get(workItemId), decision);
        });
    }

    // ==================== Sweeps ====================

    /**
     * Requeues failed items whose retry is due and releases them again.
     *
     * @return the number of items requeued
     */
    public int processScheduledRetries(Instant now) {
        Map<String, List<String>> dueByWorkflow = items.values().stream()
                .filter(item -> isRetryDue(item, now))
                .collect(Collectors.groupingBy(WorkItem::workflowId,
                        Collectors.mapping(WorkItem::id, Collectors.toList())));

        int requeued = 0;
        for (Map.Entry<String, List<String>> entry : dueByWorkflow.entrySet()) {
            requeued += locks.withLock(entry.getKey(), () -> {
                int count = 0;
                boolean acceptsWork = stateMachine.findState(entry.getKey())
                        .map(state -> !state.status().isTerminal())
                        .orElse(false);
                for (String itemId : entry.getValue()) {
                    WorkItem current = items.get(itemId);
                    if (!isRetryDue(current, now)) {
                        continue;
                    }
                    if (!acceptsWork) {
                        save(current.failedPermanently(current.lastError(), current.lastErrorMessage(), now));
                        continue;
                    }
                    log.info("RETRY_DUE: workItemId={}, attempt={}", itemId, current.retryCount() + 1);
                    release(save(current.requeued(now)), now);
                    count++;
                }
                return count;
            });
        }
        return requeued;
    }

    /**
     * Retries assignment of released items that found no executor, no queue
     * space, or a suspended workflow.
     *
     * @return the number of items assigned
     */
    public int retryPendingAssignments() {
        Set<String> workflowIds = items.values().stream()
                .filter(WorkItem::isAwaitingAssignment)
                .map(WorkItem::workflowId)
                .collect(Collectors.toSet());
        int assigned = 0;
        for (String workflowId : workflowIds) {
            assigned += retryPendingAssignments(workflowId);
        }
        return assigned;
    }

    public int retryPendingAssignments(String workflowId) {
        return locks.withLock(workflowId, () -> {
            List<WorkItem> waiting = itemsOf(workflowId).stream()
                    .filter(WorkItem::isAwaitingAssignment)
                    .sorted(ASSIGNMENT_ORDER)
                    .toList();
            int assigned = 0;
            for (WorkItem item : waiting) {
                if (tryAssign(item, clock.instant())) {
                    assigned++;
                }
            }
            if (!waiting.isEmpty()) {
                log.debug("PENDING_ASSIGNMENTS_RETRIED: workflowId={}, waiting={}, assigned={}",
                        workflowId, waiting.size(), assigned);
            }
            return assigned;
        });
    }

    // ==================== Dead letters ====================

    /**
     * Puts a quarantined item back into play: the item is reset to pending with a
     * fresh retry budget and released again.
     *
     * @param entryId the dead-letter entry
     * @param triggeredBy the operator
     * @param reason why the item is reprocessed
     * @return the requeued item
     */
    public Mono<WorkItem> reprocessDeadLetter(String entryId, String triggeredBy, @Nullable String reason) {
        return deadLetterService.markReprocessed(entryId, triggeredBy)
                .map(entry -> requeueFromDeadLetter(entry, triggeredBy, reason));
    }

    private WorkItem requeueFromDeadLetter(DeadLetterEntry entry, String triggeredBy, String reason) {
        WorkItem item = requireItem(entry.workItemId());
        return locks.withLock(item.workflowId(), () -> {
            WorkItem current = items.get(item.id());
            if (current.status() != WorkItemStatus.DLQ) {
                throw new IllegalStateException(String.format(
                        "Work item %s is %s, not quarantined", current.id(), current.status()));
            }
            WorkflowPhaseState state = stateMachine.getState(current.workflowId());
            if (state.status().isTerminal()) {
                throw new IllegalStateException(String.format(
                        "Workflow %s is %s; its items cannot be reprocessed", state.workflowId(), state.status()));
            }

            Instant now = clock.instant();
            Map<String, Object> reprocess = new LinkedHashMap<>();
            reprocess.put("reprocessedFrom", entry.id());
            reprocess.put("reprocessedBy", triggeredBy);
            reprocess.put("reprocessedAt", now.toString());
            reprocess.put("reprocessReason", reason);

            retryService.clearRetryHistory(current.id());
            WorkItem requeued = save(current.requeued(now).toBuilder().retryCount(0).build()
                    .withMetadata(reprocess, now));
            log.info("DLQ_ITEM_REQUEUED: workItemId={}, entryId={}, by={}", current.id(), entry.id(), triggeredBy);
            restoreDependents(requeued, now);
            release(requeued, now);
            return items.get(current.id());
        });
    }

    // ==================== Queries ====================

    /**
     * Computes progress of the workflow's current phase.
     *
     * @throws org.fireflyframework.procurement.exception.WorkflowNotFoundException if the workflow is unknown
     */
    public WorkItemProgress getProgress(String workflowId) {
        WorkflowPhaseState state = stateMachine.getState(workflowId);
        return locks.withLock(workflowId, () -> progressFor(workflowId, state.currentPhase()));
    }

    /**
     * Gets a workflow's items in submission order.
     */
    public List<WorkItem> getWorkItems(String workflowId) {
        return locks.withLock(workflowId, () -> itemsOf(workflowId));
    }

    public Optional<WorkItem> getWorkItem(String workItemId) {
        return Optional.ofNullable(items.get(workItemId));
    }

    // ==================== Phase listener ====================

    @Override
    public void afterCommit(WorkflowPhaseState previous, WorkflowPhaseState current) {
        if (current.status().isTerminal()) {
            dispatchQueues.close(current.workflowId());
            locks.retire(current.workflowId());
        } else if (previous.status() == WorkflowStatus.SUSPENDED && current.status() == WorkflowStatus.IN_PROGRESS) {
            retryPendingAssignments(current.workflowId());
        }
    }

    // ==================== Internals ====================

    private void releaseReady(String workflowId, Instant now) {
        for (WorkItem item : itemsOf(workflowId)) {
            if (!item.isReleased() && item.status() == WorkItemStatus.PENDING && dependenciesCompleted(item)) {
                release(item, now);
            }
        }
    }

    private void release(WorkItem item, Instant now) {
        if (item.isReleased()) {
            return;
        }
        WorkItem released = save(item.released(now));
        log.info("WORK_ITEM_RELEASED: workItemId={}, workflowId={}, sequenceId={}, taskType={}",
                released.id(), released.workflowId(), released.sequenceId(), released.taskType());
        if (metrics != null) {
            metrics.recordWorkItemReleased(released.taskType());
        }
        publish(OrchestrationEventType.WORK_ITEM_RELEASED, released, Map.of("sequenceId", released.sequenceId()));
        tryAssign(released, now);
    }

    private boolean tryAssign(WorkItem item, Instant now) {
        boolean acceptsWork = stateMachine.findState(item.workflowId())
                .map(state -> state.status().acceptsWork())
                .orElse(false);
        if (!acceptsWork) {
            log.debug("ASSIGNMENT_DEFERRED: workItemId={}, workflowId={}", item.id(), item.workflowId());
            return false;
        }

        AssignmentResult assignment = assigner.assign(item);
        if (!assignment.isAssigned()) {
            return false;
        }

        String executorId = assignment.executor().executorId();
        WorkItem assigned = save(item.assigned(executorId, now));
        TaskAssignment handOff = new TaskAssignment(
                assigned.id(), assigned.workflowId(), assigned.phase(), assigned.taskType(), executorId,
                assigned.inputs(), assigned.deadline(), assigned.retryCount() + 1);

        if (!dispatchQueues.offer(handOff)) {
            save(items.get(assigned.id()).unassigned(clock.instant()));
            assigner.release(executorId);
            return false;
        }
        log.info("WORK_ITEM_ASSIGNED: workItemId={}, executorId={}, attempt={}",
                assigned.id(), executorId, handOff.attempt());
        return true;
    }

    private void revertAssignment(TaskAssignment assignment) {
        locks.runLocked(assignment.workflowId(), () -> {
            WorkItem current = items.get(assignment.workItemId());
            if (current == null
                    || current.status() != WorkItemStatus.ASSIGNED
                    || !assignment.executorId().equals(current.assignedExecutorId())) {
                return;
            }
            save(current.unassigned(clock.instant()));
            assigner.release(assignment.executorId());
            log.info("ASSIGNMENT_REVERTED: workItemId={}, executorId={}",
                    assignment.workItemId(), assignment.executorId());
        });
    }

    private void checkPhaseCompletion(String workflowId) {
        WorkflowPhaseState state = stateMachine.getState(workflowId);
        WorkItemProgress progress = progressFor(workflowId, state.currentPhase());
        stateMachine.updateMetadata(workflowId, Map.of("workItemProgress", progress.toMetadata()));

        if (!progress.phaseComplete() || !config.isAutoTransitionEnabled()
                || state.status() != WorkflowStatus.IN_PROGRESS) {
            return;
        }

        Map<String, Object> context = new LinkedHashMap<>();
        itemsOf(workflowId).stream()
                .filter(item -> item.phase().equals(state.currentPhase()))
                .filter(item -> item.status() == WorkItemStatus.COMPLETED)
                .forEach(item -> context.putAll(item.result()));
        context.put("autoTransition", true);
        context.put("phaseProgress", progress.toMetadata());

        log.info("PHASE_WORK_COMPLETE: workflowId={}, phase={}, items={}",
                workflowId, state.currentPhase(), progress.total());
        TransitionResult result = stateMachine.attemptAutomaticTransition(workflowId, context);
        if (!result.isSuccess()) {
            log.info("AUTO_TRANSITION_NOT_APPLIED: workflowId={}, phase={}, outcome={}, message={}",
                    workflowId, state.currentPhase(), result.outcome(), result.message());
        }
    }

    private void handleBlockingFailure(WorkItem item, String errorCode, String message, Instant now) {
        String workflowId = item.workflowId();
        if (ErrorCodes.matchesAny(errorCode, config.getCriticalFailureCodes())) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("failedWorkItemId", item.id());
            context.put("criticalFailure", true);
            context.put("blockingFailure", true);
            log.error("CRITICAL_WORK_ITEM_FAILURE: workItemId={}, workflowId={}, error={}",
                    item.id(), workflowId, errorCode);
            stateMachine.fail(workflowId, PhaseStateMachine.SYSTEM_ACTOR,
                    String.format("Critical failure in work item '%s': %s", item.name(), errorCode), context);
            return;
        }

        Map<String, Object> failure = new LinkedHashMap<>();
        failure.put("workItemId", item.id());
        failure.put("error", errorCode);
        failure.put("message", message != null ? message : "");
        failure.put("timestamp", now.toString());
        stateMachine.markBlocked(workflowId,
                String.format("Blocking work item '%s' failed: %s", item.name(), errorCode), failure);
    }

    /**
     * Fails every item that transitively depends on an item that failed for
     * good. Such items can never be released, so leaving them pending would
     * keep the phase from ever resolving.
     *
     * @return the items failed here, in discovery order
     */
    private List<WorkItem> failDependents(WorkItem failed, Instant now) {
        List<WorkItem> stranded = new ArrayList<>();
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(failed.sequenceId());
        while (!frontier.isEmpty()) {
            String failedSequenceId = frontier.poll();
            for (WorkItem candidate : itemsOf(failed.workflowId())) {
                if (candidate.status() != WorkItemStatus.PENDING || candidate.isReleased()
                        || !candidate.dependencies().contains(failedSequenceId)) {
                    continue;
                }
                WorkItem dependent = save(candidate.dependencyFailed(failed.sequenceId(), failed.lastError(), now));
                log.warn("WORK_ITEM_DEPENDENCY_FAILED: workItemId={}, workflowId={}, sequenceId={}, failedDependency={}",
                        dependent.id(), dependent.workflowId(), dependent.sequenceId(), failed.sequenceId());
                if (metrics != null) {
                    metrics.recordWorkItemFailed(dependent.taskType(), FailureDisposition.PERMANENT);
                }
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("errorCode", WorkItem.DEPENDENCY_FAILED);
                payload.put("disposition", FailureDisposition.PERMANENT);
                payload.put("failedDependency", failed.sequenceId());
                publish(OrchestrationEventType.WORK_ITEM_FAILED, dependent, payload);
                stranded.add(dependent);
                frontier.add(dependent.sequenceId());
            }
        }
        return stranded;
    }

    /**
     * Puts the items failed on behalf of a reprocessed item back to pending, so
     * they are released again once it completes.
     */
    private void restoreDependents(WorkItem requeued, Instant now) {
        List<WorkItem> restored = itemsOf(requeued.workflowId()).stream()
                .filter(WorkItem::isFailedByDependency)
                .filter(item -> requeued.sequenceId().equals(item.metadata().get(WorkItem.FAILED_DEPENDENCY_KEY)))
                .map(item -> save(item.requeued(now)))
                .toList();
        if (!restored.isEmpty()) {
            log.info("DEPENDENTS_RESTORED: workItemId={}, workflowId={}, restored={}",
                    requeued.id(), requeued.workflowId(), restored.size());
        }
    }

    private void blockOnStrandedItem(WorkItem stranded, WorkItem cause, Instant now) {
        Map<String, Object> failure = new LinkedHashMap<>();
        failure.put("workItemId", stranded.id());
        failure.put("error", WorkItem.DEPENDENCY_FAILED);
        failure.put("failedDependency", cause.id());
        failure.put("timestamp", now.toString());
        stateMachine.markBlocked(stranded.workflowId(), String.format(
                "Blocking work item '%s' cannot run: dependency '%s' failed: %s",
                stranded.name(), cause.name(), cause.lastError()), failure);
    }

    private void quarantine(WorkItem item, String errorCode, RetryDecision decision) {
        boolean recoverable = retryService.getPolicy(item.taskType()).isRetryable(errorCode);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("phase", item.phase());
        metadata.put("sequenceId", item.sequenceId());
        metadata.put("reason", decision.reason());

        retryService.moveToDeadLetterQueue(item.id(), item, errorCode, decision.attempt(), recoverable, metadata)
                .subscribe(
                        entry -> log.info("WORK_ITEM_QUARANTINED: workItemId={}, entryId={}, escalated={}",
                                item.id(), entry.id(), entry.escalated()),
                        error -> log.error("DLQ_WRITE_FAILED: workItemId={}, error={}",
                                item.id(), error.getMessage(), error));
    }

    private WorkItemProgress progressFor(String workflowId, String phase) {
        List<WorkItem> inPhase = itemsOf(workflowId).stream()
                .filter(item -> phase.equals(item.phase()))
                .toList();

        Map<String, Integer> byStatus = new LinkedHashMap<>();
        int completed = 0;
        int failed = 0;
        int inFlight = 0;
        for (WorkItem item : inPhase) {
            byStatus.merge(item.status().name(), 1, Integer::sum);
            if (item.status() == WorkItemStatus.COMPLETED) {
                completed++;
            } else if (item.isTerminal()) {
                failed++;
            } else if (item.status().isInFlight()) {
                inFlight++;
            }
        }
        int pending = inPhase.size() - completed - failed - inFlight;
        boolean phaseComplete = !inPhase.isEmpty() && inPhase.stream().allMatch(WorkItem::isResolvedForPhase);
        return new WorkItemProgress(workflowId, phase, inPhase.size(), completed, failed, inFlight, pending,
                byStatus, phaseComplete);
    }

    private boolean dependenciesCompleted(WorkItem item) {
        Map<String, String> index = sequenceIndex.getOrDefault(item.workflowId(), Map.of());
        for (String dependency : item.dependencies()) {
            String dependencyId = index.get(dependency);
            WorkItem resolved = dependencyId != null ? items.get(dependencyId) : null;
            if (resolved == null || resolved.status() != WorkItemStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private static boolean isRetryDue(WorkItem item, Instant now) {
        return item.status() == WorkItemStatus.FAILED
                && item.canRetry()
                && item.nextRetryAt() != null
                && !item.nextRetryAt().isAfter(now);
    }

    private List<WorkItem> itemsOf(String workflowId) {
        return sequenceIndex.getOrDefault(workflowId, Map.of()).values().stream()
                .map(items::get)
                .toList();
    }

    private WorkItem save(WorkItem item) {
        items.put(item.id(), item);
        auditTrail.workItemUpdated(item);
        return item;
    }

    private WorkItem requireItem(String workItemId) {
        WorkItem item = items.get(workItemId);
        if (item == null) {
            throw new WorkItemNotFoundException(workItemId);
        }
        return item;
    }

    private WorkItem toWorkItem(WorkItemSpec spec, String workflowId, String currentPhase, Instant now) {
        return WorkItem.builder()
                .id(UUID.randomUUID().toString())
                .workflowId(workflowId)
                .phase(spec.phase() != null ? spec.phase() : currentPhase)
                .sequenceId(spec.sequenceId())
                .taskType(spec.taskType())
                .name(spec.name())
                .inputs(spec.inputs())
                .dependencies(spec.dependencies())
                .priority(spec.priority())
                .deadline(spec.deadline())
                .status(WorkItemStatus.PENDING)
                .blocking(spec.blocking())
                .metadata(spec.metadata())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private void publish(OrchestrationEventType type, WorkItem item, Map<String, Object> payload) {
        if (eventPublisher != null) {
            eventPublisher.fire(OrchestrationEvent.workItem(
                    type, item.workflowId(), item.id(), item.phase(), payload, clock.instant()));
        }
    }
}
