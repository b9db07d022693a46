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

import org.fireflyframework.procurement.dlq.DeadLetterService;
import org.fireflyframework.procurement.model.WorkflowPhaseState;
import org.fireflyframework.procurement.persistence.OrchestrationStore;
import org.fireflyframework.procurement.phase.PhaseStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link OrchestrationHealthIndicator}.
 */
@ExtendWith(MockitoExtension.class)
class OrchestrationHealthIndicatorTest {

    @Mock
    private PhaseStateMachine stateMachine;

    @Mock
    private DeadLetterService deadLetterService;

    @Mock
    private OrchestrationStore store;

    private OrchestrationHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        indicator = new OrchestrationHealthIndicator(stateMachine, deadLetterService, store);
    }

    @Test
    @DisplayName("should report UP with workflow and dead-letter counts")
    void health_shouldBeUpWhenStoreIsHealthy() {
        when(store.isHealthy()).thenReturn(Mono.just(true));
        when(deadLetterService.getCount()).thenReturn(Mono.just(4L));
        when(stateMachine.getActiveWorkflows())
                .thenReturn(List.of(WorkflowPhaseState.builder().workflowId("wf-1").build()));

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("activeWorkflows", 1)
                            .containsEntry("deadLetterEntries", 4L)
                            .containsEntry("store", "connected");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should report DOWN when the store is unreachable")
    void health_shouldBeDownWhenStoreFails() {
        when(store.isHealthy()).thenReturn(Mono.error(new IllegalStateException("connection refused")));
        when(deadLetterService.getCount()).thenReturn(Mono.just(0L));
        when(stateMachine.getActiveWorkflows()).thenReturn(List.of());

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("store", "disconnected");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should report DOWN with the error when the dead-letter count fails")
    void health_shouldBeDownWhenCountFails() {
        when(store.isHealthy()).thenReturn(Mono.just(true));
        when(deadLetterService.getCount()).thenReturn(Mono.error(new IllegalStateException("dlq unavailable")));

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("error", "dlq unavailable");
                })
                .verifyComplete();
    }
}
