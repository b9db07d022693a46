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

package org.fireflyframework.procurement.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.procurement.properties.OrchestrationProperties;
import org.fireflyframework.procurement.resilience.DispatchResilience;
import org.springframework.beans.factory.DisposableBean;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One bounded hand-off queue per workflow.
 * <p>
 * Offers never block: when a workflow's queue is full the offer is refused and
 * the caller leaves the item waiting for assignment, so a burst of completions
 * cannot release an unbounded amount of work at once. Offers for a workflow must
 * be serialized by the caller, which the scheduler does through the workflow
 * lock.
 */
@Slf4j
public class DispatchQueues implements DisposableBean {

    private final TaskDispatcher dispatcher;
    private final DispatchResilience resilience;
    private final OrchestrationProperties.DispatchConfig config;
    private final Scheduler scheduler;
    private final Map<String, WorkflowQueue> queues = new ConcurrentHashMap<>();

    private volatile DispatchFailureHandler failureHandler = (assignment, error) -> log.warn(
            "DISPATCH_FAILURE_UNHANDLED: workItemId={}, error={}", assignment.workItemId(), error.getMessage());

    public DispatchQueues(TaskDispatcher dispatcher, DispatchResilience resilience,
                          OrchestrationProperties.DispatchConfig config, Scheduler scheduler) {
        this.dispatcher = dispatcher;
        this.resilience = resilience;
        this.config = config;
        this.scheduler = scheduler;
    }

    public void onFailure(DispatchFailureHandler handler) {
        this.failureHandler = handler;
    }

    /**
     * Queues a hand-off.
     *
     * @return {@code false} if the workflow's queue is full or closed
     */
    public boolean offer(TaskAssignment assignment) {
        WorkflowQueue queue = queues.computeIfAbsent(assignment.workflowId(), this::open);
        Sinks.EmitResult result = queue.sink().tryEmitNext(assignment);
        if (result.isFailure()) {
            log.warn("DISPATCH_QUEUE_REJECTED: workflowId={}, workItemId={}, result={}",
                    assignment.workflowId(), assignment.workItemId(), result);
            return false;
        }
        return true;
    }

    /**
     * Closes a workflow's queue. Hand-offs still queued are dropped.
     */
    public void close(String workflowId) {
        WorkflowQueue queue = queues.remove(workflowId);
        if (queue != null) {
            queue.sink().tryEmitComplete();
            queue.subscription().dispose();
            log.debug("DISPATCH_QUEUE_CLOSED: workflowId={}", workflowId);
        }
    }

    public int openQueues() {
        return queues.size();
    }

    @Override
    public void destroy() {
        queues.keySet().forEach(this::close);
    }

    private WorkflowQueue open(String workflowId) {
        Sinks.Many<TaskAssignment> sink = Sinks.many().unicast()
                .onBackpressureBuffer(new ArrayBlockingQueue<>(config.getQueueCapacity()));
        Disposable subscription = sink.asFlux()
                .publishOn(scheduler, 1)
                .flatMap(this::handOff, config.getConcurrency())
                .subscribe(
                        assignment -> { },
                        error -> log.error("DISPATCH_QUEUE_TERMINATED: workflowId={}, error={}",
                                workflowId, error.getMessage(), error));
        log.debug("DISPATCH_QUEUE_OPENED: workflowId={}, capacity={}", workflowId, config.getQueueCapacity());
        return new WorkflowQueue(sink, subscription);
    }

    private Mono<TaskAssignment> handOff(TaskAssignment assignment) {
        return resilience.decorate(assignment, Mono.defer(() -> dispatcher.dispatch(assignment)))
                .timeout(config.getHandOffTimeout())
                .thenReturn(assignment)
                .onErrorResume(error -> {
                    log.warn("DISPATCH_FAILED: workItemId={}, executorId={}, error={}",
                            assignment.workItemId(), assignment.executorId(), error.getMessage());
                    try {
                        failureHandler.onDispatchFailed(assignment, error);
                    } catch (RuntimeException e) {
                        log.error("DISPATCH_FAILURE_HANDLER_FAILED: workItemId={}, error={}",
                                assignment.workItemId(), e.getMessage(), e);
                    }
                    return Mono.empty();
                });
    }

    private record WorkflowQueue(Sinks.Many<TaskAssignment> sink, Disposable subscription) {
    }
}
