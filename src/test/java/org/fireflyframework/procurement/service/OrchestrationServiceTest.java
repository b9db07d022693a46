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

import org.fireflyframework.procurement.exception.WorkflowNotFoundException;
import org.fireflyframework.procurement.model.WorkItem;
import org.fireflyframework.procurement.model.WorkItemStatus;
import org.fireflyframework.procurement.model.WorkflowStatus;
import org.fireflyframework.procurement.phase.TransitionOutcome;
import org.fireflyframework.procurement.retry.FailureDisposition;
import org.fireflyframework.procurement.scheduler.WorkItemSequence;
import org.fireflyframework.procurement.scheduler.WorkItemSpec;
import org.fireflyframework.procurement.support.OrchestrationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link OrchestrationService}.
 */
class OrchestrationServiceTest {

    private OrchestrationFixture fixture;
    private OrchestrationService service;

    @BeforeEach
    void setUp() {
        fixture = new OrchestrationFixture();
        fixture.registerGeneralist("agent-1", 10);
        service = new OrchestrationService(fixture.stateMachine, fixture.scheduler, fixture.deadLetterService);
    }

    @Test
    @DisplayName("should drive a discovery phase from submission to the next phase")
    void shouldRunDiscoveryPhase() {
        StepVerifier.create(service.createWorkflow("rfp-1", Map.of("agency", "GSA")))
                .assertNext(state -> assertThat(state.currentPhase()).isEqualTo("discovery"))
                .verifyComplete();

        WorkItem scan = service.submit(WorkItemSequence.of("rfp-1", WorkItemSpec.of("scan", "portal_scan")))
                .blockFirst();
        assertThat(scan).isNotNull();

        StepVerifier.create(service.reportStarted(scan.id(), "agent-1"))
                .assertNext(item -> assertThat(item.status()).isEqualTo(WorkItemStatus.RUNNING))
                .verifyComplete();
        StepVerifier.create(service.reportCompleted(scan.id(), Map.of("rfpCount", 4)))
                .assertNext(item -> assertThat(item.status()).isEqualTo(WorkItemStatus.COMPLETED))
                .verifyComplete();

        StepVerifier.create(service.getWorkflow("rfp-1"))
                .assertNext(state -> assertThat(state.currentPhase()).isEqualTo("analysis"))
                .verifyComplete();
    }

    @Test
    @DisplayName("should surface failures and dead letters through the facade")
    void shouldReportFailures() {
        service.createWorkflow("rfp-1", Map.of()).block();
        WorkItem scan = service.submit(WorkItemSequence.of("rfp-1", WorkItemSpec.of("scan", "portal_scan")))
                .blockFirst();

        StepVerifier.create(service.reportFailed(scan.id(), "SESSION_EXPIRED", "portal session lost"))
                .assertNext(report -> assertThat(report.decision().disposition())
                        .isEqualTo(FailureDisposition.DEAD_LETTER))
                .verifyComplete();

        StepVerifier.create(service.getDeadLetters("rfp-1"))
                .assertNext(entry -> assertThat(entry.failureReason()).isEqualTo("SESSION_EXPIRED"))
                .verifyComplete();
        StepVerifier.create(service.getDeadLetterStatistics())
                .assertNext(stats -> assertThat(stats.total()).isEqualTo(1))
                .verifyComplete();
    }

    @Test
    @DisplayName("should pause, resume and cancel workflows")
    void shouldControlLifecycle() {
        service.createWorkflow("rfp-1", Map.of()).block();
        service.submit(WorkItemSequence.of("rfp-1", WorkItemSpec.of("scan", "portal_scan"))).blockLast();

        StepVerifier.create(service.pause("rfp-1", "ops", "maintenance"))
                .assertNext(result -> assertThat(result.state().status()).isEqualTo(WorkflowStatus.SUSPENDED))
                .verifyComplete();
        StepVerifier.create(service.resume("rfp-1", "ops"))
                .assertNext(result -> assertThat(result.state().status()).isEqualTo(WorkflowStatus.IN_PROGRESS))
                .verifyComplete();
        StepVerifier.create(service.cancel("rfp-1", "ops", "withdrawn"))
                .assertNext(result -> assertThat(result.outcome()).isEqualTo(TransitionOutcome.SUCCESS))
                .verifyComplete();
        StepVerifier.create(service.getActiveWorkflows()).verifyComplete();
    }

    @Test
    @DisplayName("should signal unknown workflows as errors")
    void shouldErrorForUnknownWorkflow() {
        StepVerifier.create(service.getWorkflow("missing"))
                .expectError(WorkflowNotFoundException.class)
                .verify();
        StepVerifier.create(service.getProgress("missing"))
                .expectError(WorkflowNotFoundException.class)
                .verify();
    }
}
