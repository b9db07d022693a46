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
import reactor.core.publisher.Mono;

/**
 * Default dispatcher used when the application provides none. It only logs the
 * hand-off; executors are expected to poll for their assignments elsewhere.
 */
@Slf4j
public class LoggingTaskDispatcher implements TaskDispatcher {

    @Override
    public Mono<Void> dispatch(TaskAssignment assignment) {
        return Mono.fromRunnable(() -> log.info(
                "TASK_DISPATCHED: workItemId={}, workflowId={}, taskType={}, executorId={}, attempt={}",
                assignment.workItemId(), assignment.workflowId(), assignment.taskType(),
                assignment.executorId(), assignment.attempt()));
    }
}
