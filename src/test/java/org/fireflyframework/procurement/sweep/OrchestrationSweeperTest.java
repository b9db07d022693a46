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

package org.fireflyframework.procurement.sweep;

import org.fireflyframework.procurement.dlq.DeadLetterService;
import org.fireflyframework.procurement.dlq.DeadLetterStatistics;
import org.fireflyframework.procurement.phase.PhaseStateMachine;
import org.fireflyframework.procurement.scheduler.WorkItemScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link OrchestrationSweeper}.
 */
@ExtendWith(MockitoExtension.class)
class OrchestrationSweeperTest {

    private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");

    @Mock
    private WorkItemScheduler scheduler;

    @Mock
    private PhaseStateMachine stateMachine;

    @Mock
    private DeadLetterService deadLetterService;

    private OrchestrationSweeper sweeper;

    @BeforeEach
    void setUp() {
        sweeper = new OrchestrationSweeper(scheduler, stateMachine, deadLetterService,
                Duration.ofMillis(20), Duration.ofMillis(20), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        sweeper.stop();
    }

    @Test
    @DisplayName("should run every sweep step and report what each did")
    void sweep_shouldRunAllSteps() {
        when(scheduler.processScheduledRetries(NOW)).thenReturn(2);
        when(scheduler.retryPendingAssignments()).thenReturn(1);
        when(stateMachine.checkPhaseTimeouts(NOW)).thenReturn(List.of("wf-1"));

        OrchestrationSweeper.SweepResult result = sweeper.sweep(NOW);

        assertThat(result.retriesRequeued()).isEqualTo(2);
        assertThat(result.itemsAssigned()).isEqualTo(1);
        assertThat(result.timedOutWorkflows()).containsExactly("wf-1");
    }

    @Test
    @DisplayName("should keep sweeping when one step fails")
    void sweep_shouldIsolateFailingSteps() {
        when(scheduler.processScheduledRetries(NOW)).thenThrow(new IllegalStateException("boom"));
        when(scheduler.retryPendingAssignments()).thenReturn(3);
        when(stateMachine.checkPhaseTimeouts(NOW)).thenThrow(new IllegalStateException("boom"));

        OrchestrationSweeper.SweepResult result = sweeper.sweep(NOW);

        assertThat(result.retriesRequeued()).isZero();
        assertThat(result.itemsAssigned()).isEqualTo(3);
        assertThat(result.timedOutWorkflows()).isEmpty();
    }

    @Test
    @DisplayName("should poll until stopped and survive monitor errors")
    void start_shouldPollPeriodically() {
        when(scheduler.processScheduledRetries(any())).thenReturn(0);
        when(scheduler.retryPendingAssignments()).thenReturn(0);
        when(stateMachine.checkPhaseTimeouts(any())).thenReturn(List.of());
        when(deadLetterService.monitor(any()))
                .thenReturn(Mono.error(new IllegalStateException("store down")))
                .thenReturn(Mono.just(new DeadLetterStatistics(0, 0, 0, Map.of(), Map.of())));

        sweeper.start();
        sweeper.start();

        verify(scheduler, timeout(2000).atLeast(2)).retryPendingAssignments();
        verify(deadLetterService, timeout(2000).atLeast(2)).monitor(NOW);
        assertThat(sweeper.isRunning()).isTrue();

        sweeper.stop();
        sweeper.stop();
        assertThat(sweeper.isRunning()).isFalse();
    }
}
