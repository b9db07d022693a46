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

package org.fireflyframework.procurement.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.procurement.dlq.DeadLetterService;
import org.fireflyframework.procurement.persistence.OrchestrationStore;
import org.fireflyframework.procurement.phase.PhaseStateMachine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Health indicator for the procurement orchestration core.
 * <p>
 * Reports the health status based on:
 * <ul>
 *   <li>Number of active workflows</li>
 *   <li>Dead-letter queue size</li>
 *   <li>Orchestration store connectivity</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class OrchestrationHealthIndicator implements ReactiveHealthIndicator {

    private final PhaseStateMachine stateMachine;
    private final DeadLetterService deadLetterService;
    private final OrchestrationStore store;

    @Override
    public Mono<Health> health() {
        return Mono.zip(checkStore(), deadLetterService.getCount().defaultIfEmpty(0L))
                .map(tuple -> {
                    boolean storeHealthy = tuple.getT1();
                    Health.Builder builder = storeHealthy ? Health.up() : Health.down();
                    return builder
                            .withDetail("activeWorkflows", stateMachine.getActiveWorkflows().size())
                            .withDetail("deadLetterEntries", tuple.getT2())
                            .withDetail("store", storeHealthy ? "connected" : "disconnected")
                            .build();
                })
                .onErrorResume(e -> {
                    log.warn("Orchestration health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", String.valueOf(e.getMessage()))
                            .build());
                });
    }

    private Mono<Boolean> checkStore() {
        return store.isHealthy()
                .defaultIfEmpty(false)
                .timeout(Duration.ofSeconds(5))
                .onErrorReturn(false);
    }
}
