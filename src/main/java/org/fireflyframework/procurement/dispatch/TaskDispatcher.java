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

import reactor.core.publisher.Mono;

/**
 * Hands work to external executors.
 * <p>
 * The returned Mono completes once the executor has accepted the task, not when
 * the task is done; results come back through the scheduler's completion and
 * failure callbacks.
 */
public interface TaskDispatcher {

    Mono<Void> dispatch(TaskAssignment assignment);
}
