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

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Mono;

/**
 * Publishes orchestration notifications through Spring's application event bus.
 * <p>
 * Delivery is best-effort: listener failures are logged and never reach the
 * orchestration code that emitted the event.
 */
@Slf4j
public class OrchestrationEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final boolean enabled;

    public OrchestrationEventPublisher(ApplicationEventPublisher applicationEventPublisher, boolean enabled) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.enabled = enabled;
        log.info("OrchestrationEventPublisher initialized: enabled={}", enabled);
    }

    /**
     * Publishes an event.
     *
     * @param event the event
     * @return a Mono that completes once listeners have been invoked; never errors
     */
    public Mono<Void> publish(OrchestrationEvent event) {
        if (!enabled) {
            return Mono.empty();
        }

        return Mono.fromRunnable(() -> applicationEventPublisher.publishEvent(event))
                .doOnSuccess(v -> log.debug("Published {} for workflow {}", event.type(), event.workflowId()))
                .onErrorResume(e -> {
                    log.error("Failed to publish {} for workflow {}: {}",
                            event.type(), event.workflowId(), e.getMessage(), e);
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Publishes an event without waiting for the result.
     */
    public void fire(OrchestrationEvent event) {
        publish(event).subscribe();
    }
}
