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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.procurement.concurrent.WorkflowLocks;
import org.fireflyframework.procurement.condition.ConditionResult;
import org.fireflyframework.procurement.event.OrchestrationEvent;
import org.fireflyframework.procurement.event.OrchestrationEventPublisher;
import org.fireflyframework.procurement.event.OrchestrationEventType;
import org.fireflyframework.procurement.exception.NoTransitionDefinitionException;
import org.fireflyframework.procurement.exception.WorkflowNotFoundException;
import org.fireflyframework.procurement.metrics.OrchestrationMetrics;
import org.fireflyframework.procurement.model.PhaseDefinition;
import org.fireflyframework.procurement.model.PhaseTransition;
import org.fireflyframework.procurement.model.PhaseTransitionRecord;
import org.fireflyframework.procurement.model.Phases;
import org.fireflyframework.procurement.model.TransitionKind;
import org.fireflyframework.procurement.model.WorkflowPhaseState;
import org.fireflyframework.procurement.model.WorkflowStatus;
import org.fireflyframework.procurement.persistence.AuditTrail;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns the coarse-grained lifecycle of procurement workflows.
 * <p>
 * A workflow occupies exactly one declared phase at a time and only moves along
 * declared, guarded edges. Every operation runs under the workflow's lock and
 * replaces the workflow's immutable {@link WorkflowPhaseState} in one step, so a
 * transition is observed either completely or not at all.
 * <p>
 * <b>Transition algorithm:</b>
 * <ol>
 *   <li>unknown workflow: {@link TransitionOutcome#WORKFLOW_NOT_FOUND}</li>
 *   <li>target not in {@code canTransitionTo}: {@link TransitionOutcome#INVALID_TRANSITION}</li>
 *   <li>no edge declared: {@link NoTransitionDefinitionException}</li>
 *   <li>edge condition fails: {@code blockedReasons} set, {@link TransitionOutcome#CONDITIONS_NOT_MET}</li>
 *   <li>exit hooks, state swap and audit record, then entry and edge hooks</li>
 *   <li>any failure between condition check and commit restores the previous phase with
 *       status {@code FAILED} and only {@code cancelled} reachable</li>
 * </ol>
 */
@Slf4j
public class PhaseStateMachine {

    public static final String SYSTEM_ACTOR = "system";
    public static final String CHILD_WORKFLOW_IDS_KEY = "childWorkflowIds";

    private final PhaseRegistry phaseRegistry;
    private final PhaseHookRegistry hookRegistry;
    private final WorkflowLocks locks;
    private final AuditTrail auditTrail;
    private final OrchestrationEventPublisher eventPublisher;
    private final OrchestrationMetrics metrics;
    private final Clock clock;

    private final Map<String, WorkflowPhaseState> workflows = new ConcurrentHashMap<>();
    private final List<PhaseTransitionListener> listeners = new CopyOnWriteArrayList<>();

    public PhaseStateMachine(
            PhaseRegistry phaseRegistry,
            PhaseHookRegistry hookRegistry,
            WorkflowLocks locks,
            AuditTrail auditTrail,
            @Nullable OrchestrationEventPublisher eventPublisher,
            @Nullable OrchestrationMetrics metrics,
            Clock clock) {
        this.phaseRegistry = phaseRegistry;
        this.hookRegistry = hookRegistry;
        this.locks = locks;
        this.auditTrail = auditTrail;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void addListener(PhaseTransitionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(PhaseTransitionListener listener) {
        listeners.remove(listener);
    }

    // ==================== Creation ====================

    /**
     * Creates a workflow in the process's initial phase.
     */
    public WorkflowPhaseState create(String workflowId, Map<String, Object> context) {
        return create(workflowId, phaseRegistry.getInitialPhase(), context);
    }

    /**
     * Creates a workflow in status {@code PENDING}.
     *
     * @param workflowId the workflow id
     * @param initialPhase the phase to start in
     * @param context initial metadata; {@code childWorkflowIds} is lifted into the state
     * @return the new state
     * @throws org.fireflyframework.procurement.exception.UnknownPhaseException if the phase is not declared
     * @throws IllegalStateException if the workflow already exists
     */
    public WorkflowPhaseState create(String workflowId, String initialPhase, Map<String, Object> context) {
        PhaseDefinition phase = phaseRegistry.getPhase(initialPhase);
        Map<String, Object> initialContext = context != null ? context : Map.of();

        return locks.withLock(workflowId, () -> {
            if (workflows.containsKey(workflowId)) {
                throw new IllegalStateException("Workflow already exists: " + workflowId);
            }

            Instant now = clock.instant();
            Map<String, Object> metadata = new LinkedHashMap<>(initialContext);
            metadata.put("createdAt", now.toString());

            PhaseTransitionRecord record = PhaseTransitionRecord.of(
                    workflowId, null, initialPhase, null, WorkflowStatus.PENDING,
                    TransitionKind.AUTOMATIC, SYSTEM_ACTOR, "Workflow created", 0, now,
                    Map.of("action", "create"));

            WorkflowPhaseState state = WorkflowPhaseState.builder()
                    .workflowId(workflowId)
                    .currentPhase(initialPhase)
                    .status(WorkflowStatus.PENDING)
                    .phaseHistory(List.of(record))
                    .canTransitionTo(phase.allowedTransitions())
                    .blockedReasons(List.of())
                    .metadata(metadata)
                    .childWorkflowIds(toIdList(initialContext.get(CHILD_WORKFLOW_IDS_KEY)))
                    .phaseEnteredAt(now)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            workflows.put(workflowId, state);
            auditTrail.transitionRecorded(record);

            log.info("WORKFLOW_CREATED: workflowId={}, phase={}", workflowId, initialPhase);
            if (metrics != null) {
                metrics.recordWorkflowCreated(initialPhase);
            }
            publish(OrchestrationEventType.WORKFLOW_CREATED, state, Map.of("phase", initialPhase));
            return state;
        });
    }

    /**
     * Moves a {@code PENDING} workflow to {@code IN_PROGRESS}, typically when its
     * first work is submitted.
     */
    public TransitionResult activate(String workflowId, String triggeredBy) {
        return locks.withLock(workflowId, () -> {
            WorkflowPhaseState current = workflows.get(workflowId);
            if (current == null) {
                return TransitionResult.workflowNotFound(workflowId);
            }
            if (current.status() != WorkflowStatus.PENDING) {
                return TransitionResult.invalidState(current, "Workflow is not pending: " + current.status());
            }
            return applyStatusChange(current, WorkflowStatus.IN_PROGRESS, TransitionKind.AUTOMATIC, triggeredBy,
                    "Work submitted", Map.of("activatedAt", clock.instant().toString()), List.of(),
                    "activate", OrchestrationEventType.WORKFLOW_ACTIVATED);
        });
    }

    // ==================== Transitions ====================

    /**
     * Manual transition with no extra context.
     */
    public TransitionResult transition(String workflowId, String toPhase, String triggeredBy) {
        return transition(workflowId, toPhase, triggeredBy, TransitionKind.MANUAL, null, Map.of());
    }

    /**
     * Attempts to move a workflow to another phase.
     *
     * @param workflowId the workflow
     * @param toPhase the target phase
     * @param triggeredBy the actor
     * @param kind how the transition was triggered
     * @param reason optional reason
     * @param context extra context merged over the workflow metadata for condition evaluation
     * @return the structured result
     * @throws NoTransitionDefinitionException if the target is allowed but no edge is declared
     */
    public TransitionResult transition(String workflowId, String toPhase, String triggeredBy, TransitionKind kind,
                                       @Nullable String reason, @Nullable Map<String, Object> context) {
        Map<String, Object> transitionContext = context != null ? context : Map.of();

        TransitionResult result = locks.withLock(workflowId, () -> {
            WorkflowPhaseState current = workflows.get(workflowId);
            if (current == null) {
                return TransitionResult.workflowNotFound(workflowId);
            }

            if (!current.canTransitionTo().contains(toPhase)) {
                log.info("INVALID_TRANSITION: workflowId={}, from={}, to={}, allowed={}",
                        workflowId, current.currentPhase(), toPhase, current.canTransitionTo());
                recordMetric(current.currentPhase(), toPhase, kind, "invalid_transition");
                return TransitionResult.invalidTransition(current, toPhase);
            }

            if (current.status() == WorkflowStatus.FAILED && Phases.CANCELLED.equals(toPhase)) {
                // a rolled-back workflow can only leave through cancellation, which needs no edge
                return null;
            }
            if (current.status() == WorkflowStatus.SUSPENDED) {
                return TransitionResult.invalidState(current, "Workflow is suspended; resume it before transitioning");
            }

            PhaseTransition edge = phaseRegistry.findTransition(current.currentPhase(), toPhase)
                    .orElseThrow(() -> new NoTransitionDefinitionException(current.currentPhase(), toPhase));

            Map<String, Object> evaluationContext = current.metadataCopy();
            evaluationContext.putAll(transitionContext);
            ConditionResult conditions = edge.condition().evaluate(evaluationContext);

            if (!conditions.satisfied()) {
                WorkflowPhaseState blocked = current.toBuilder()
                        .blockedReasons(conditions.unmetReasons())
                        .updatedAt(clock.instant())
                        .build();
                workflows.put(workflowId, blocked);
                log.info("TRANSITION_CONDITIONS_NOT_MET: workflowId={}, from={}, to={}, unmet={}",
                        workflowId, current.currentPhase(), toPhase, conditions.unmetReasons());
                recordMetric(current.currentPhase(), toPhase, kind, "conditions_not_met");
                return TransitionResult.conditionsNotMet(blocked, conditions.unmetReasons());
            }

            return applyTransition(current, toPhase, triggeredBy, kind, reason, transitionContext,
                    edge.hooks(), Map.of(), Map.of("action", "transition"));
        });

        if (result == null) {
            return cancel(workflowId, triggeredBy, reason != null ? reason : "Cancelled after failed transition", false);
        }
        return result;
    }

    /**
     * Attempts the automatic transition out of the current phase: to the phase's
     * {@code nextPhase}, or to its only successor that is not a failure exit.
     */
    public TransitionResult attemptAutomaticTransition(String workflowId, Map<String, Object> context) {
        return locks.withLock(workflowId, () -> {
            WorkflowPhaseState current = workflows.get(workflowId);
            if (current == null) {
                return TransitionResult.workflowNotFound(workflowId);
            }
            if (current.status() != WorkflowStatus.IN_PROGRESS) {
                return TransitionResult.invalidState(current,
                        "Automatic transitions require an in-progress workflow, was " + current.status());
            }

            Optional<String> target = resolveAutomaticTarget(current);
            if (target.isEmpty()) {
                log.info("NO_AUTOMATIC_SUCCESSOR: workflowId={}, phase={}, allowed={}",
                        workflowId, current.currentPhase(), current.canTransitionTo());
                return TransitionResult.invalidTransition(current, null,
                        "No automatic successor for phase '" + current.currentPhase() + "'");
            }

            return transition(workflowId, target.get(), SYSTEM_ACTOR, TransitionKind.AUTOMATIC,
                    "Phase completed successfully", context);
        });
    }

    /**
     * Forces a workflow into the terminal {@code failed} phase, bypassing edge
     * conditions. Used for critical failures.
     */
    public TransitionResult fail(String workflowId, String triggeredBy, String reason, Map<String, Object> context) {
        return locks.withLock(workflowId, () -> {
            WorkflowPhaseState current = workflows.get(workflowId);
            if (current == null) {
                return TransitionResult.workflowNotFound(workflowId);
            }
            if (Phases.isTerminal(current.currentPhase())) {
                return TransitionResult.invalidState(current, "Workflow already in terminal phase " + current.currentPhase());
            }

            Map<String, Object> failure = new LinkedHashMap<>();
            failure.put("failedAt", clock.instant().toString());
            failure.put("failureReason", reason);
            return applyTransition(current, Phases.FAILED, triggeredBy, TransitionKind.ESCALATION, reason,
                    context != null ? context : Map.of(), List.of(), failure, Map.of("action", "fail"));
        });
    }

    // ==================== Pause / Resume / Cancel ====================

    /**
     * Suspends an in-progress workflow. The phase is unchanged.
     */
    public TransitionResult pause(String workflowId, String triggeredBy, @Nullable String reason) {
        return locks.withLock(workflowId, () -> {
            WorkflowPhaseState current = workflows.get(workflowId);
            if (current == null) {
                return TransitionResult.workflowNotFound(workflowId);
            }
            if (current.status() != WorkflowStatus.IN_PROGRESS) {
                return TransitionResult.invalidState(current, "Only in-progress workflows can be paused, was " + current.status());
            }

            Map<String, Object> updates = new LinkedHashMap<>();
            updates.put("suspendedAt", clock.instant().toString());
            updates.put("suspensionReason", reason);
            updates.put("suspendedBy", triggeredBy);
            return applyStatusChange(current, WorkflowStatus.SUSPENDED, TransitionKind.MANUAL, triggeredBy, reason,
                    updates, List.of(), "pause", OrchestrationEventType.WORKFLOW_PAUSED);
        });
    }

    /**
     * Resumes a suspended workflow. The phase is unchanged.
     */
    public TransitionResult resume(String workflowId, String triggeredBy) {
        return locks.withLock(workflowId, () -> {
            WorkflowPhaseState current = workflows.get(workflowId);
            if (current == null) {
                return TransitionResult.workflowNotFound(workflowId);
            }
            if (current.status() != WorkflowStatus.SUSPENDED) {
                return TransitionResult.invalidState(current, "Only suspended workflows can be resumed, was " + current.status());
            }

            Map<String, Object> updates = new LinkedHashMap<>();
            updates.put("resumedAt", clock.instant().toString());
            updates.put("resumedBy", triggeredBy);
            return applyStatusChange(current, WorkflowStatus.IN_PROGRESS, TransitionKind.MANUAL, triggeredBy,
                    "Workflow resumed", updates, List.of("suspendedAt", "suspensionReason", "suspendedBy"),
                    "resume", OrchestrationEventType.WORKFLOW_RESUMED);
        });
    }

    /**
     * Cancels a workflow and, recursively, its child workflows. Each workflow is
     * visited at most once, and a parent's lock is released before its children
     * are cancelled.
     *
     * @param cascading whether this cancellation was caused by a cancelled parent
     */
    public TransitionResult cancel(String workflowId, String triggeredBy, String reason, boolean cascading) {
        Set<String> visited = new HashSet<>();
        visited.add(workflowId);
        TransitionResult result = cancelOne(workflowId, triggeredBy, reason, cascading);

        if (result.isSuccess()) {
            Deque<String> pending = new ArrayDeque<>(result.state().childWorkflowIds());
            while (!pending.isEmpty()) {
                String childId = pending.poll();
                if (!visited.add(childId)) {
                    continue;
                }
                TransitionResult child = cancelOne(childId, triggeredBy, "Parent workflow cancelled: " + reason, true);
                if (child.isSuccess()) {
                    pending.addAll(child.state().childWorkflowIds());
                } else {
                    log.warn("CASCADE_CANCEL_SKIPPED: parent={}, child={}, outcome={}, message={}",
                            workflowId, childId, child.outcome(), child.message());
                }
            }
        }
        return result;
    }

    private TransitionResult cancelOne(String workflowId, String triggeredBy, String reason, boolean cascading) {
        return locks.withLock(workflowId, () -> {
            WorkflowPhaseState current = workflows.get(workflowId);
            if (current == null) {
                return TransitionResult.workflowNotFound(workflowId);
            }
            if (current.status() == WorkflowStatus.CANCELLED || current.status() == WorkflowStatus.COMPLETED) {
                return TransitionResult.invalidState(current, "Workflow is already " + current.status());
            }

            Map<String, Object> cancellation = new LinkedHashMap<>();
            cancellation.put("cancelledAt", clock.instant().toString());
            cancellation.put("cancelledBy", triggeredBy);
            cancellation.put("cancellationReason", reason);

            Map<String, Object> recordMetadata = new LinkedHashMap<>();
            recordMetadata.put("action", "cancel");
            recordMetadata.put("cascading", cascading);

            return applyTransition(current, Phases.CANCELLED, triggeredBy,
                    cascading ? TransitionKind.AUTOMATIC : TransitionKind.MANUAL, reason,
                    Map.of(), List.of(), cancellation, recordMetadata);
        });
    }

    // ==================== Blocking, metadata, children ====================

    /**
     * Records a failure that blocks the workflow without changing its phase.
     *
     * @param reason the blocked reason to add
     * @param failure entry appended to {@code metadata.blockedByFailures}
     */
    public WorkflowPhaseState markBlocked(String workflowId, String reason, Map<String, Object> failure) {
        return locks.withLock(workflowId, () -> {
            WorkflowPhaseState current = requireState(workflowId);

            List<String> reasons = new ArrayList<>(current.blockedReasons());
            if (!reasons.contains(reason)) {
                reasons.add(reason);
            }
            Map<String, Object> metadata = current.metadataCopy();
            List<Object> failures = new ArrayList<>();
            if (metadata.get("blockedByFailures") instanceof Collection<?> existing) {
                failures.addAll(existing);
            }
            failures.add(Map.copyOf(failure));
            metadata.put("blockedByFailures", failures);

            WorkflowPhaseState blocked = current.toBuilder()
                    .blockedReasons(reasons)
                    .metadata(metadata)
                    .updatedAt(clock.instant())
                    .build();
            workflows.put(workflowId, blocked);

            log.warn("WORKFLOW_BLOCKED: workflowId={}, phase={}, reason={}", workflowId, current.currentPhase(), reason);
            publish(OrchestrationEventType.WORKFLOW_BLOCKED, blocked, Map.of("reason", reason));
            return blocked;
        });
    }

    /**
     * Merges entries into the workflow metadata.
     */
    public WorkflowPhaseState updateMetadata(String workflowId, Map<String, Object> updates) {
        return locks.withLock(workflowId, () -> {
            WorkflowPhaseState current = requireState(workflowId);
            Map<String, Object> metadata = current.metadataCopy();
            metadata.putAll(updates);
            WorkflowPhaseState updated = current.toBuilder().metadata(metadata).updatedAt(clock.instant()).build();
            workflows.put(workflowId, updated);
            return updated;
        });
    }

    /**
     * Links a child workflow so that it is cancelled together with its parent.
     *
     * @throws IllegalArgumentException if the link would create a cancellation cycle
     */
    public WorkflowPhaseState addChildWorkflow(String parentId, String childId) {
        requireState(childId);
        if (parentId.equals(childId) || descendantsOf(childId).contains(parentId)) {
            throw new IllegalArgumentException(String.format(
                    "Workflow %s is an ancestor of %s and cannot become its child", childId, parentId));
        }

        return locks.withLock(parentId, () -> {
            WorkflowPhaseState current = requireState(parentId);
            if (current.childWorkflowIds().contains(childId)) {
                return current;
            }
            List<String> children = new ArrayList<>(current.childWorkflowIds());
            children.add(childId);
            Map<String, Object> metadata = current.metadataCopy();
            metadata.put(CHILD_WORKFLOW_IDS_KEY, List.copyOf(children));
            WorkflowPhaseState updated = current.toBuilder()
                    .childWorkflowIds(children)
                    .metadata(metadata)
                    .updatedAt(clock.instant())
                    .build();
            workflows.put(parentId, updated);
            log.info("CHILD_WORKFLOW_LINKED: parent={}, child={}", parentId, childId);
            return updated;
        });
    }

    // ==================== Timeouts ====================

    /**
     * Flags in-progress workflows that have stayed in their phase longer than the
     * phase's timeout. Advisory: the phase is not changed. Each phase entry is
     * flagged once.
     *
     * @return ids of the workflows flagged by this call
     */
    public List<String> checkPhaseTimeouts(Instant now) {
        List<String> flagged = new ArrayList<>();
        for (WorkflowPhaseState snapshot : List.copyOf(workflows.values())) {
            if (isTimedOut(snapshot, now)) {
                boolean marked = locks.withLock(snapshot.workflowId(), () -> markTimedOut(snapshot.workflowId(), now));
                if (marked) {
                    flagged.add(snapshot.workflowId());
                }
            }
        }
        return flagged;
    }

    private boolean isTimedOut(WorkflowPhaseState state, Instant now) {
        if (state.status() != WorkflowStatus.IN_PROGRESS) {
            return false;
        }
        if (state.currentPhase().equals(state.metadata().get("timedOutPhase"))) {
            return false;
        }
        return phaseRegistry.getPhase(state.currentPhase()).getTimeout()
                .map(timeout -> now.isAfter(state.phaseEnteredAt().plus(timeout)))
                .orElse(false);
    }

    private boolean markTimedOut(String workflowId, Instant now) {
        WorkflowPhaseState current = workflows.get(workflowId);
        if (current == null || !isTimedOut(current, now)) {
            return false;
        }

        Duration timeout = phaseRegistry.getPhase(current.currentPhase()).timeout();
        String reason = String.format("Phase '%s' exceeded its timeout of %d minutes",
                current.currentPhase(), timeout.toMinutes());

        List<String> reasons = new ArrayList<>(current.blockedReasons());
        reasons.add(reason);
        Map<String, Object> metadata = current.metadataCopy();
        metadata.put("timedOutPhase", current.currentPhase());
        metadata.put("phaseTimedOutAt", now.toString());

        WorkflowPhaseState updated = current.toBuilder()
                .blockedReasons(reasons)
                .metadata(metadata)
                .updatedAt(now)
                .build();
        workflows.put(workflowId, updated);

        log.warn("PHASE_TIMED_OUT: workflowId={}, phase={}, timeoutMinutes={}",
                workflowId, current.currentPhase(), timeout.toMinutes());
        publish(OrchestrationEventType.PHASE_TIMED_OUT, updated, Map.of("timeoutMinutes", timeout.toMinutes()));
        return true;
    }

    // ==================== Queries ====================

    /**
     * Gets the state of a workflow.
     *
     * @throws WorkflowNotFoundException if the workflow is unknown
     */
    public WorkflowPhaseState getState(String workflowId) {
        return requireState(workflowId);
    }

    public Optional<WorkflowPhaseState> findState(String workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    /**
     * Gets all workflows that have not reached a terminal status.
     */
    public List<WorkflowPhaseState> getActiveWorkflows() {
        return workflows.values().stream()
                .filter(state -> !state.status().isTerminal())
                .toList();
    }

    public List<WorkflowPhaseState> getAllWorkflows() {
        return List.copyOf(workflows.values());
    }

    public PhaseRegistry getPhaseRegistry() {
        return phaseRegistry;
    }

    // ==================== Internals ====================

    private TransitionResult applyTransition(
            WorkflowPhaseState current,
            String toPhase,
            String triggeredBy,
            TransitionKind kind,
            String reason,
            Map<String, Object> context,
            List<String> edgeHooks,
            Map<String, Object> metadataUpdates,
            Map<String, Object> recordMetadata) {

        String workflowId = current.workflowId();
        Instant now = clock.instant();
        PhaseDefinition fromPhase = phaseRegistry.getPhase(current.currentPhase());
        PhaseDefinition targetPhase = phaseRegistry.getPhase(toPhase);

        WorkflowPhaseState next;
        PhaseTransitionRecord record;
        try {
            Map<String, Object> metadata = current.metadataCopy();
            metadata.putAll(context);
            metadata.putAll(metadataUpdates);
            metadata.putAll(hookRegistry.runHooks(fromPhase.exitHooks(), HookStage.EXIT,
                    workflowId, fromPhase.name(), metadata));
            metadata.put("lastTransitionAt", now.toString());
            metadata.put(toPhase + "StartedAt", now.toString());

            WorkflowStatus toStatus = WorkflowStatus.forPhase(toPhase);
            Duration inPhase = Duration.between(current.phaseEnteredAt(), now);
            record = PhaseTransitionRecord.of(
                    workflowId, current.currentPhase(), toPhase, current.status(), toStatus,
                    kind, triggeredBy, reason, inPhase.toSeconds(), now, recordMetadata);

            next = current.toBuilder()
                    .currentPhase(toPhase)
                    .status(toStatus)
                    .canTransitionTo(targetPhase.allowedTransitions())
                    .blockedReasons(List.of())
                    .metadata(metadata)
                    .phaseHistory(current.historyWith(record))
                    .phaseEnteredAt(now)
                    .updatedAt(now)
                    .build();

            for (PhaseTransitionListener listener : listeners) {
                listener.beforeCommit(current, next);
            }
            workflows.put(workflowId, next);
            auditTrail.transitionRecorded(record);
            if (metrics != null) {
                metrics.recordPhaseDuration(current.currentPhase(), inPhase);
            }
        } catch (RuntimeException e) {
            return rollback(current, toPhase, triggeredBy, e);
        }

        log.info("PHASE_TRANSITION: workflowId={}, from={}, to={}, kind={}, triggeredBy={}",
                workflowId, current.currentPhase(), toPhase, kind, triggeredBy);
        recordMetric(current.currentPhase(), toPhase, kind, "success");

        Map<String, Object> hookUpdates = new LinkedHashMap<>();
        hookUpdates.putAll(hookRegistry.runHooks(targetPhase.entryHooks(), HookStage.ENTRY,
                workflowId, toPhase, next.metadata()));
        hookUpdates.putAll(hookRegistry.runHooks(edgeHooks, HookStage.TRANSITION,
                workflowId, toPhase, next.metadata()));
        WorkflowPhaseState committed = next;
        if (!hookUpdates.isEmpty()) {
            Map<String, Object> metadata = next.metadataCopy();
            metadata.putAll(hookUpdates);
            committed = next.toBuilder().metadata(metadata).build();
            workflows.put(workflowId, committed);
        }

        if (Phases.isTerminal(toPhase) && metrics != null) {
            metrics.recordWorkflowTerminated(toPhase);
        }
        publish(eventTypeFor(toPhase), committed, transitionPayload(record));
        notifyAfterCommit(current, committed);
        return TransitionResult.success(committed, record);
    }

    private TransitionResult rollback(WorkflowPhaseState current, String toPhase, String triggeredBy, RuntimeException error) {
        Instant now = clock.instant();
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        log.error("TRANSITION_ROLLED_BACK: workflowId={}, phase={}, attempted={}, error={}",
                current.workflowId(), current.currentPhase(), toPhase, message, error);

        Map<String, Object> metadata = current.metadataCopy();
        metadata.put("lastTransitionError", message);
        metadata.put("failedTransitionTo", toPhase);
        metadata.put("transitionFailedAt", now.toString());

        Map<String, Object> recordMetadata = new LinkedHashMap<>();
        recordMetadata.put("action", "rollback");
        recordMetadata.put("attemptedPhase", toPhase);
        recordMetadata.put("error", message);

        PhaseTransitionRecord record = PhaseTransitionRecord.of(
                current.workflowId(), current.currentPhase(), current.currentPhase(), current.status(),
                WorkflowStatus.FAILED, TransitionKind.ROLLBACK, triggeredBy,
                "Transition to '" + toPhase + "' failed: " + message, 0, now, recordMetadata);

        WorkflowPhaseState failed = current.toBuilder()
                .status(WorkflowStatus.FAILED)
                .canTransitionTo(List.of(Phases.CANCELLED))
                .metadata(metadata)
                .phaseHistory(current.historyWith(record))
                .updatedAt(now)
                .build();
        workflows.put(current.workflowId(), failed);
        auditTrail.transitionRecorded(record);

        recordMetric(current.currentPhase(), toPhase, TransitionKind.ROLLBACK, "rolled_back");
        publish(OrchestrationEventType.TRANSITION_ROLLED_BACK, failed, transitionPayload(record));
        notifyAfterCommit(current, failed);
        return TransitionResult.failed(failed, record, message);
    }

    private TransitionResult applyStatusChange(
            WorkflowPhaseState current,
            WorkflowStatus newStatus,
            TransitionKind kind,
            String triggeredBy,
            String reason,
            Map<String, Object> metadataUpdates,
            List<String> removedKeys,
            String action,
            OrchestrationEventType eventType) {

        Instant now = clock.instant();
        Map<String, Object> metadata = current.metadataCopy();
        removedKeys.forEach(metadata::remove);
        metadata.putAll(metadataUpdates);

        PhaseTransitionRecord record = PhaseTransitionRecord.of(
                current.workflowId(), current.currentPhase(), current.currentPhase(), current.status(), newStatus,
                kind, triggeredBy, reason, 0, now, Map.of("action", action));

        WorkflowPhaseState updated = current.toBuilder()
                .status(newStatus)
                .metadata(metadata)
                .phaseHistory(current.historyWith(record))
                .updatedAt(now)
                .build();
        workflows.put(current.workflowId(), updated);
        auditTrail.transitionRecorded(record);

        log.info("WORKFLOW_STATUS_CHANGED: workflowId={}, phase={}, from={}, to={}, action={}, triggeredBy={}",
                current.workflowId(), current.currentPhase(), current.status(), newStatus, action, triggeredBy);
        publish(eventType, updated, transitionPayload(record));
        notifyAfterCommit(current, updated);
        return TransitionResult.success(updated, record);
    }

    private Optional<String> resolveAutomaticTarget(WorkflowPhaseState state) {
        PhaseDefinition phase = phaseRegistry.getPhase(state.currentPhase());
        if (phase.nextPhase() != null && state.canTransitionTo().contains(phase.nextPhase())) {
            return Optional.of(phase.nextPhase());
        }
        List<String> candidates = state.canTransitionTo().stream()
                .filter(target -> !Phases.CANCELLED.equals(target) && !Phases.FAILED.equals(target))
                .toList();
        return candidates.size() == 1 ? Optional.of(candidates.get(0)) : Optional.empty();
    }

    private Set<String> descendantsOf(String workflowId) {
        Set<String> seen = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(List.of(workflowId));
        while (!pending.isEmpty()) {
            WorkflowPhaseState state = workflows.get(pending.poll());
            if (state == null) {
                continue;
            }
            for (String child : state.childWorkflowIds()) {
                if (seen.add(child)) {
                    pending.add(child);
                }
            }
        }
        return seen;
    }

    private WorkflowPhaseState requireState(String workflowId) {
        WorkflowPhaseState state = workflows.get(workflowId);
        if (state == null) {
            throw new WorkflowNotFoundException(workflowId);
        }
        return state;
    }

    private void notifyAfterCommit(WorkflowPhaseState previous, WorkflowPhaseState current) {
        for (PhaseTransitionListener listener : listeners) {
            try {
                listener.afterCommit(previous, current);
            } catch (RuntimeException e) {
                log.error("LISTENER_FAILED: workflowId={}, listener={}, error={}",
                        current.workflowId(), listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    private void recordMetric(String from, String to, TransitionKind kind, String outcome) {
        if (metrics != null) {
            metrics.recordTransition(from, to, kind, outcome);
        }
    }

    private void publish(OrchestrationEventType type, WorkflowPhaseState state, Map<String, Object> payload) {
        if (eventPublisher != null) {
            eventPublisher.fire(OrchestrationEvent.workflow(
                    type, state.workflowId(), state.currentPhase(), payload, clock.instant()));
        }
    }

    private static OrchestrationEventType eventTypeFor(String toPhase) {
        return switch (toPhase) {
            case Phases.CANCELLED -> OrchestrationEventType.WORKFLOW_CANCELLED;
            case Phases.FAILED -> OrchestrationEventType.WORKFLOW_FAILED;
            default -> OrchestrationEventType.PHASE_TRANSITIONED;
        };
    }

    private static Map<String, Object> transitionPayload(PhaseTransitionRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("fromPhase", record.fromPhase());
        payload.put("toPhase", record.toPhase());
        payload.put("toStatus", record.toStatus());
        payload.put("kind", record.kind());
        payload.put("triggeredBy", record.triggeredBy());
        payload.put("reason", record.reason());
        return payload;
    }

    private static List<String> toIdList(Object value) {
        if (value instanceof Collection<?> ids) {
            return ids.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
