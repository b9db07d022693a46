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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.procurement.assignment.AgentRegistry;
import org.fireflyframework.procurement.assignment.InMemoryAgentRegistry;
import org.fireflyframework.procurement.assignment.WorkItemAssigner;
import org.fireflyframework.procurement.concurrent.WorkflowLocks;
import org.fireflyframework.procurement.dispatch.DispatchQueues;
import org.fireflyframework.procurement.dispatch.LoggingTaskDispatcher;
import org.fireflyframework.procurement.dispatch.TaskDispatcher;
import org.fireflyframework.procurement.dlq.DeadLetterService;
import org.fireflyframework.procurement.dlq.DeadLetterStore;
import org.fireflyframework.procurement.dlq.InMemoryDeadLetterStore;
import org.fireflyframework.procurement.event.OrchestrationEventPublisher;
import org.fireflyframework.procurement.health.OrchestrationHealthIndicator;
import org.fireflyframework.procurement.metrics.OrchestrationMetrics;
import org.fireflyframework.procurement.persistence.AuditTrail;
import org.fireflyframework.procurement.persistence.InMemoryOrchestrationStore;
import org.fireflyframework.procurement.persistence.OrchestrationStore;
import org.fireflyframework.procurement.phase.PhaseHook;
import org.fireflyframework.procurement.phase.PhaseHookRegistry;
import org.fireflyframework.procurement.phase.PhaseRegistry;
import org.fireflyframework.procurement.phase.PhaseStateMachine;
import org.fireflyframework.procurement.phase.ProcessDefinition;
import org.fireflyframework.procurement.phase.ProcessDefinitionLoader;
import org.fireflyframework.procurement.properties.OrchestrationProperties;
import org.fireflyframework.procurement.resilience.DispatchResilience;
import org.fireflyframework.procurement.retry.RetryBackoffService;
import org.fireflyframework.procurement.retry.RetryPolicy;
import org.fireflyframework.procurement.retry.RetryPolicyRegistry;
import org.fireflyframework.procurement.scheduler.WorkItemScheduler;
import org.fireflyframework.procurement.service.OrchestrationService;
import org.fireflyframework.procurement.sweep.OrchestrationSweeper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ResourceLoader;
import org.springframework.lang.Nullable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Map;

/**
 * Auto-configuration for the procurement orchestration core.
 * <p>
 * This configuration provides:
 * <ul>
 *   <li>PhaseRegistry - the process definition loaded from {@code firefly.procurement.process.definition-location}</li>
 *   <li>PhaseStateMachine - workflow lifecycle and guarded transitions</li>
 *   <li>WorkItemScheduler - dependency-aware release of work items</li>
 *   <li>RetryBackoffService and DeadLetterService - failure classification and quarantine</li>
 *   <li>DispatchQueues - bounded, resilient hand-off to executors</li>
 *   <li>OrchestrationSweeper - retries, pending assignments, phase timeouts and DLQ monitoring</li>
 *   <li>OrchestrationHealthIndicator - health monitoring</li>
 * </ul>
 * <p>
 * Persistence, the agent registry and the task dispatcher default to in-memory or
 * logging implementations; applications replace them by declaring their own beans.
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration"})
@EnableConfigurationProperties(OrchestrationProperties.class)
@ConditionalOnProperty(prefix = "firefly.procurement", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ProcurementOrchestrationAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock orchestrationClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowLocks workflowLocks() {
        return new WorkflowLocks();
    }

    // ==================== Process definition ====================

    @Bean
    @ConditionalOnMissingBean
    public ProcessDefinitionLoader processDefinitionLoader(ObjectProvider<ObjectMapper> objectMapper,
                                                           ResourceLoader resourceLoader) {
        return new ProcessDefinitionLoader(objectMapper.getIfAvailable(ObjectMapper::new), resourceLoader);
    }

    @Bean
    @ConditionalOnMissingBean
    public PhaseRegistry phaseRegistry(ProcessDefinitionLoader loader, OrchestrationProperties properties) {
        String location = properties.getProcess().getDefinitionLocation();
        ProcessDefinition definition = loader.load(location);
        log.info("Creating PhaseRegistry from {} with {} phases, initial phase: {}",
                location, definition.phases().size(), definition.initialPhase());
        return new PhaseRegistry(definition);
    }

    @Bean
    @ConditionalOnMissingBean
    public PhaseHookRegistry phaseHookRegistry(@Nullable Map<String, PhaseHook> phaseHooks) {
        Map<String, PhaseHook> hooks = phaseHooks != null ? phaseHooks : Map.of();
        log.info("Creating PhaseHookRegistry with hooks: {}", hooks.keySet());
        return new PhaseHookRegistry(hooks);
    }

    // ==================== Persistence and notifications ====================

    @Bean
    @ConditionalOnMissingBean
    public OrchestrationStore orchestrationStore() {
        log.info("Creating InMemoryOrchestrationStore");
        return new InMemoryOrchestrationStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditTrail auditTrail(OrchestrationStore orchestrationStore) {
        return new AuditTrail(orchestrationStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public OrchestrationEventPublisher orchestrationEventPublisher(ApplicationEventPublisher applicationEventPublisher,
                                                                   OrchestrationProperties properties) {
        return new OrchestrationEventPublisher(applicationEventPublisher, properties.getEvents().isEnabled());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "firefly.procurement", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public OrchestrationMetrics orchestrationMetrics(MeterRegistry meterRegistry) {
        log.info("Configuring OrchestrationMetrics with Micrometer MeterRegistry");
        return new OrchestrationMetrics(meterRegistry);
    }

    // ==================== Retry and dead letters ====================

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterStore deadLetterStore() {
        log.info("Creating InMemoryDeadLetterStore");
        return new InMemoryDeadLetterStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterService deadLetterService(DeadLetterStore deadLetterStore,
                                               AuditTrail auditTrail,
                                               OrchestrationProperties properties,
                                               @Nullable OrchestrationEventPublisher eventPublisher,
                                               @Nullable OrchestrationMetrics metrics,
                                               Clock clock) {
        log.info("Creating DeadLetterService with escalation threshold: {}, auto-escalate after: {}",
                properties.getDlq().getEscalationFailureCount(), properties.getDlq().getAutoEscalateAfter());
        return new DeadLetterService(deadLetterStore, auditTrail, properties.getDlq(), eventPublisher, metrics, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicyRegistry retryPolicyRegistry(OrchestrationProperties properties) {
        OrchestrationProperties.RetryConfig retry = properties.getRetry();
        RetryPolicy fallback = new RetryPolicy(RetryPolicy.DEFAULT.taskType(), retry.getMaxRetries(),
                retry.getInitialDelay(), retry.getMaxDelay(), retry.getMultiplier(), null, null);
        log.info("Creating RetryPolicyRegistry with default maxRetries: {}, initialDelay: {}, multiplier: {}",
                retry.getMaxRetries(), retry.getInitialDelay(), retry.getMultiplier());
        return RetryPolicyRegistry.withDefaults(fallback);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryBackoffService retryBackoffService(RetryPolicyRegistry retryPolicyRegistry,
                                                   DeadLetterService deadLetterService,
                                                   OrchestrationProperties properties,
                                                   Clock clock) {
        return new RetryBackoffService(retryPolicyRegistry, deadLetterService,
                properties.getRetry().getAdditionalPermanentErrors(),
                properties.getDlq().getMaxReprocessAttempts(), clock);
    }

    // ==================== Phase state machine ====================

    @Bean
    @ConditionalOnMissingBean
    public PhaseStateMachine phaseStateMachine(PhaseRegistry phaseRegistry,
                                               PhaseHookRegistry phaseHookRegistry,
                                               WorkflowLocks workflowLocks,
                                               AuditTrail auditTrail,
                                               @Nullable OrchestrationEventPublisher eventPublisher,
                                               @Nullable OrchestrationMetrics metrics,
                                               Clock clock) {
        log.info("Creating PhaseStateMachine with metrics: {}", metrics != null);
        return new PhaseStateMachine(phaseRegistry, phaseHookRegistry, workflowLocks, auditTrail,
                eventPublisher, metrics, clock);
    }

    // ==================== Assignment and dispatch ====================

    @Bean
    @ConditionalOnMissingBean
    public AgentRegistry agentRegistry(Clock clock) {
        log.info("Creating InMemoryAgentRegistry");
        return new InMemoryAgentRegistry(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkItemAssigner workItemAssigner(AgentRegistry agentRegistry, PhaseRegistry phaseRegistry,
                                             @Nullable OrchestrationMetrics metrics) {
        return new WorkItemAssigner(agentRegistry, phaseRegistry, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskDispatcher taskDispatcher() {
        log.info("Creating LoggingTaskDispatcher; declare a TaskDispatcher bean to reach real executors");
        return new LoggingTaskDispatcher();
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchResilience dispatchResilience(OrchestrationProperties properties) {
        return new DispatchResilience(properties.getResilience());
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean(name = "orchestrationDispatchScheduler")
    public Scheduler orchestrationDispatchScheduler() {
        return Schedulers.boundedElastic();
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchQueues dispatchQueues(TaskDispatcher taskDispatcher,
                                         DispatchResilience dispatchResilience,
                                         OrchestrationProperties properties,
                                         Scheduler orchestrationDispatchScheduler) {
        log.info("Creating DispatchQueues with capacity: {}, concurrency: {}",
                properties.getDispatch().getQueueCapacity(), properties.getDispatch().getConcurrency());
        return new DispatchQueues(taskDispatcher, dispatchResilience, properties.getDispatch(),
                orchestrationDispatchScheduler);
    }

    // ==================== Scheduler and facade ====================

    @Bean
    @ConditionalOnMissingBean
    public WorkItemScheduler workItemScheduler(PhaseStateMachine phaseStateMachine,
                                               WorkflowLocks workflowLocks,
                                               RetryBackoffService retryBackoffService,
                                               DeadLetterService deadLetterService,
                                               WorkItemAssigner workItemAssigner,
                                               DispatchQueues dispatchQueues,
                                               AuditTrail auditTrail,
                                               @Nullable OrchestrationEventPublisher eventPublisher,
                                               @Nullable OrchestrationMetrics metrics,
                                               OrchestrationProperties properties,
                                               Clock clock) {
        log.info("Creating WorkItemScheduler with auto-transition: {}",
                properties.getScheduler().isAutoTransitionEnabled());
        return new WorkItemScheduler(phaseStateMachine, workflowLocks, retryBackoffService, deadLetterService,
                workItemAssigner, dispatchQueues, auditTrail, eventPublisher, metrics,
                properties.getScheduler(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public OrchestrationService orchestrationService(PhaseStateMachine phaseStateMachine,
                                                     WorkItemScheduler workItemScheduler,
                                                     DeadLetterService deadLetterService) {
        log.info("Creating OrchestrationService");
        return new OrchestrationService(phaseStateMachine, workItemScheduler, deadLetterService);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.procurement.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
    public OrchestrationSweeper orchestrationSweeper(WorkItemScheduler workItemScheduler,
                                                     PhaseStateMachine phaseStateMachine,
                                                     DeadLetterService deadLetterService,
                                                     OrchestrationProperties properties,
                                                     Clock clock) {
        OrchestrationSweeper sweeper = new OrchestrationSweeper(workItemScheduler, phaseStateMachine,
                deadLetterService, properties.getSweep().getInterval(),
                properties.getSweep().getDlqMonitorInterval(), clock);
        sweeper.start();
        log.info("Created and started OrchestrationSweeper with interval={}", properties.getSweep().getInterval());
        return sweeper;
    }

    /**
     * Health indicator for orchestration monitoring.
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.ReactiveHealthIndicator")
    @ConditionalOnProperty(prefix = "firefly.procurement", name = "health-enabled", havingValue = "true", matchIfMissing = true)
    public OrchestrationHealthIndicator orchestrationHealthIndicator(PhaseStateMachine phaseStateMachine,
                                                                     DeadLetterService deadLetterService,
                                                                     OrchestrationStore orchestrationStore) {
        log.info("Creating OrchestrationHealthIndicator");
        return new OrchestrationHealthIndicator(phaseStateMachine, deadLetterService, orchestrationStore);
    }
}
