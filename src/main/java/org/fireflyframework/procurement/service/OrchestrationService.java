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

package org.fireflyframework.procurement.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.procurement.dlq.DeadLetterEntry;
import org.fireflyframework.procurement.dlq.DeadLetterService;
import org.fireflyframework.procurement.dlq.DeadLetterStatistics;
import org.fireflyframework.procurement.model.TransitionKind;
import org.fireflyframework.procurement.model.WorkItem;
import org.fireflyframework.procurement.model.WorkflowPhaseState;
import org.fireflyframework.procurement.phase.PhaseStateMachine;
import org.fireflyframework.procurement.phase.TransitionResult;
import org.fireflyframework.procurement.scheduler.FailureReport;
import org.fireflyframework.procurement.scheduler.WorkItemProgress;
import org.fireflyframework.procurement.scheduler.WorkItemScheduler;
import org.fireflyframework.procurement.scheduler.WorkItemSequence;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Reactive facade over the orchestration core for the application's outer
 * layers. Every call is deferred until subscription; exceptions thrown by the
 * core surface as error signals.
 */
@Slf4j
@RequiredArgsConstructor
public class OrchestrationService {

    private final PhaseStateMachine stateMachine;
    private final WorkItemScheduler scheduler;
    private final DeadLetterService deadLetterService;

    // ==================== Workflows ====================

    public Mono<WorkflowPhaseState> createWorkflow(String workflowId, Map<String, Object> context) {
        return Mono.fromCallable(() -> stateMachine.create(workflowId, context));
    }

    public Mono<WorkflowPhaseState> createWorkflow(String workflowId, String initialPhase, Map<String, Object> context) {
        return Mono.fromCallable(() -> stateMachine.create(workflowId, initialPhase, context));
    }

    public Mono<WorkflowPhaseState> getWorkflow(String workflowId) {
        return Mono.fromCallable(() -> stateMachine.getState(workflowId));
    }

    public Flux<WorkflowPhaseState> getActiveWorkflows() {
        return Flux.defer(() -> Flux.fromIterable(stateMachine.getActiveWorkflows()));
    }

    public Mono<TransitionResult> transition(String workflowId, String toPhase, String triggeredBy,
                                             String reason, Map<String, Object> context) {
        return Mono.fromCallable(() -> stateMachine.transition(
                workflowId, toPhase, triggeredBy, TransitionKind.MANUAL, reason, context));
    }

    public Mono<TransitionResult> pause(String workflowId, String triggeredBy, String reason) {
        return Mono.fromCallable(() -> stateMachine.pause(workflowId, triggeredBy, reason));
    }

    public Mono<TransitionResult> resume(String workflowId, String triggeredBy) {
        return Mono.fromCallable(() -> stateMachine.resume(workflowId, triggeredBy));
    }

    public Mono<TransitionResult> cancel(String workflowId, String triggeredBy, String reason) {
        return Mono.fromCallable(() -> stateMachine.cancel(workflowId, triggeredBy, reason, false))
                .doOnNext(result -> log.info("Cancel requested: workflowId={}, outcome={}",
                        workflowId, result.outcome()));
    }

    // ==================== Work items ====================

    public Flux<WorkItem> submit(WorkItemSequence sequence) {
        return Mono.fromCallable(() -> scheduler.submit(sequence)).flatMapIterable(items -> items);
    }

    public Mono<WorkItem> reportStarted(String workItemId, String executorId) {
        return Mono.fromCallable(() -> scheduler.onItemStarted(workItemId, executorId));
    }

    public Mono<WorkItem> reportCompleted(String workItemId, Map<String, Object> result) {
        return Mono.fromCallable(() -> scheduler.onItemCompleted(workItemId, result));
    }

    public Mono<FailureReport> reportFailed(String workItemId, String errorCode, String message) {
        return Mono.fromCallable(() -> scheduler.onItemFailed(workItemId, errorCode, message));
    }

    public Mono<WorkItemProgress> getProgress(String workflowId) {
        return Mono.fromCallable(() -> scheduler.getProgress(workflowId));
    }

    public Flux<WorkItem> getWorkItems(String workflowId) {
        return Flux.defer(() -> Flux.fromIterable(scheduler.getWorkItems(workflowId)));
    }

    // ==================== Dead letters ====================

    public Flux<DeadLetterEntry> getDeadLetters(String workflowId) {
        return workflowId != null
                ? deadLetterService.getEntriesByWorkflowId(workflowId)
                : deadLetterService.getAllEntries();
    }

    public Mono<DeadLetterStatistics> getDeadLetterStatistics() {
        return deadLetterService.getStatistics();
    }

    public Mono<DeadLetterEntry> escalateDeadLetter(String entryId, String reason) {
        return deadLetterService.escalate(entryId, reason);
    }

    public Mono<WorkItem> reprocessDeadLetter(String entryId, String triggeredBy, String reason) {
        return scheduler.reprocessDeadLetter(entryId, triggeredBy, reason);
    }
}
