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

package org.fireflyframework.procurement.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.procurement.assignment.AgentRegistry;
import org.fireflyframework.procurement.dispatch.TaskDispatcher;
import org.fireflyframework.procurement.health.OrchestrationHealthIndicator;
import org.fireflyframework.procurement.metrics.OrchestrationMetrics;
import org.fireflyframework.procurement.phase.PhaseHook;
import org.fireflyframework.procurement.phase.PhaseRegistry;
import org.fireflyframework.procurement.phase.PhaseStateMachine;
import org.fireflyframework.procurement.retry.RetryPolicyRegistry;
import org.fireflyframework.procurement.scheduler.WorkItemScheduler;
import org.fireflyframework.procurement.service.OrchestrationService;
import org.fireflyframework.procurement.sweep.OrchestrationSweeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ProcurementOrchestrationAutoConfiguration}.
 */
class ProcurementOrchestrationAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ProcurementOrchestrationAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfiguration.class)
            .withPropertyValues("firefly.procurement.sweep.enabled=false");

    @Test
    @DisplayName("should create the orchestration core with in-memory defaults")
    void shouldCreateCoreBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(PhaseRegistry.class);
            assertThat(context).hasSingleBean(PhaseStateMachine.class);
            assertThat(context).hasSingleBean(WorkItemScheduler.class);
            assertThat(context).hasSingleBean(OrchestrationService.class);
            assertThat(context).hasSingleBean(OrchestrationMetrics.class);
            assertThat(context).hasSingleBean(OrchestrationHealthIndicator.class);
            assertThat(context).doesNotHaveBean(OrchestrationSweeper.class);
            assertThat(context.getBean(PhaseRegistry.class).getInitialPhase()).isEqualTo("discovery");
            assertThat(context.getBean(RetryPolicyRegistry.class).hasPolicy("portal_scan")).isTrue();
        });
    }

    @Test
    @DisplayName("should run a workflow end to end through the configured beans")
    void shouldWireCollaborators() {
        contextRunner.run(context -> {
            OrchestrationService service = context.getBean(OrchestrationService.class);
            service.createWorkflow("rfp-1", Map.of()).block();

            assertThat(context.getBean(PhaseStateMachine.class).getState("rfp-1").currentPhase())
                    .isEqualTo("discovery");
            assertThat(context.getBean(MeterRegistry.class).find("procurement.workflows.created").counter())
                    .isNotNull();
        });
    }

    @Test
    @DisplayName("should back off when the application declares its own collaborators")
    void shouldRespectUserBeans() {
        contextRunner.withUserConfiguration(CustomCollaborators.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(TaskDispatcher.class);
                    assertThat(context.getBean(TaskDispatcher.class))
                            .isSameAs(context.getBean("customDispatcher"));
                    assertThat(context).hasSingleBean(AgentRegistry.class);
                });
    }

    @Test
    @DisplayName("should load an alternative process definition")
    void shouldLoadConfiguredProcess() {
        contextRunner.withPropertyValues(
                        "firefly.procurement.process.definition-location=classpath:procurement/test-process.json")
                .run(context -> assertThat(context.getBean(PhaseRegistry.class).getInitialPhase())
                        .isEqualTo("intake"));
    }

    @Test
    @DisplayName("should create nothing when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("firefly.procurement.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(PhaseStateMachine.class);
                    assertThat(context).doesNotHaveBean(WorkItemScheduler.class);
                });
    }

    @Test
    @DisplayName("should start the sweeper when sweeping is enabled")
    void shouldStartSweeper() {
        contextRunner.withPropertyValues("firefly.procurement.sweep.enabled=true")
                .run(context -> assertThat(context.getBean(OrchestrationSweeper.class).isRunning()).isTrue());
    }

    @Configuration(proxyBeanMethods = false)
    static class MeterRegistryConfiguration {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomCollaborators {

        @Bean
        TaskDispatcher customDispatcher() {
            return assignment -> Mono.empty();
        }

        @Bean("on_intake_entry")
        PhaseHook intakeEntryHook() {
            return context -> Map.of("intakeSeen", true);
        }
    }
}
