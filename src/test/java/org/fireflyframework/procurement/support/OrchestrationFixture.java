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

package org.fireflyframework.procurement.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.procurement.assignment.InMemoryAgentRegistry;
import org.fireflyframework.procurement.assignment.WorkItemAssigner;
import org.fireflyframework.procurement.concurrent.WorkflowLocks;
import org.fireflyframework.procurement.dispatch.DispatchQueues;
import org.fireflyframework.procurement.dlq.DeadLetterService;
import org.fireflyframework.procurement.dlq.InMemoryDeadLetterStore;
import org.fireflyframework.procurement.event.OrchestrationEvent;
import org.fireflyframework.procurement.event.OrchestrationEventPublisher;
import org.fireflyframework.procurement.event.OrchestrationEventType;
import org.fireflyframework.procurement.metrics.OrchestrationMetrics;
import org.fireflyframework.procurement.persistence.AuditTrail;
import org.fireflyframework.procurement.persistence.InMemoryOrchestrationStore;
import org.fireflyframework.procurement.phase.PhaseHookRegistry;
import org.fireflyframework.procurement.phase.PhaseRegistry;
import org.fireflyframework.procurement.phase.PhaseStateMachine;
import org.fireflyframework.procurement.phase.ProcessDefinitionLoader;
import org.fireflyframework.procurement.properties.OrchestrationProperties;
import org.fireflyframework.procurement.resilience.DispatchResilience;
import org.fireflyframework.procurement.retry.RetryBackoffService;
import org.fireflyframework.procurement.retry.RetryPolicy;
import org.fireflyframework.procurement.retry.RetryPolicyRegistry;
import org.fireflyframework.procurement.scheduler.WorkItemScheduler;
import org.springframework.core.io.DefaultResourceLoader;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Wires the orchestration core from its real in-memory collaborators, the way
 * the auto-configuration does, with a controllable clock and a synchronous
 * dispatch scheduler.
 */
public class OrchestrationFixture {

    public static final String DEFAULT_PROCESS = "classpath:procurement/default-process.json";
    public static final Instant START = Instant.parse("2026-01-05T10:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final OrchestrationProperties properties = new OrchestrationProperties();
    public final List<OrchestrationEvent> events = new CopyOnWriteArrayList<>();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    public final InMemoryOrchestrationStore store = new InMemoryOrchestrationStore();
    public final AuditTrail auditTrail = new AuditTrail(store);
    public final OrchestrationEventPublisher eventPublisher = new OrchestrationEventPublisher(
            event -> events.add((OrchestrationEvent) event), true);
    public final OrchestrationMetrics metrics = new OrchestrationMetrics(meterRegistry);
    public final WorkflowLocks locks = new WorkflowLocks();

    public final PhaseRegistry phaseRegistry;
    public final PhaseHookRegistry hookRegistry = new PhaseHookRegistry();
    public final PhaseStateMachine stateMachine;

    public final InMemoryDeadLetterStore deadLetterStore = new InMemoryDeadLetterStore();
    public final DeadLetterService deadLetterService;
    public final RetryPolicyRegistry retryPolicies = RetryPolicyRegistry.withDefaults(RetryPolicy.DEFAULT);
    public final RetryBackoffService retryService;

    public final InMemoryAgentRegistry agents = new InMemoryAgentRegistry(Duration.ofDays(365), clock);
    public final WorkItemAssigner assigner;
    public final RecordingTaskDispatcher dispatcher = new RecordingTaskDispatcher();
    public final DispatchQueues dispatchQueues;
    public final WorkItemScheduler scheduler;

    public OrchestrationFixture() {
        this(DEFAULT_PROCESS);
    }

    public OrchestrationFixture(String processLocation) {
        phaseRegistry = new PhaseRegistry(
                new ProcessDefinitionLoader(new ObjectMapper(), new DefaultResourceLoader()).load(processLocation));
        stateMachine = new PhaseStateMachine(
                phaseRegistry, hookRegistry, locks, auditTrail, eventPublisher, metrics, clock);
        deadLetterService = new DeadLetterService(
                deadLetterStore, auditTrail, properties.getDlq(), eventPublisher, metrics, clock);
        retryService = new RetryBackoffService(
                retryPolicies, deadLetterService, properties.getRetry().getAdditionalPermanentErrors(),
                properties.getDlq().getMaxReprocessAttempts(), clock);
        assigner = new WorkItemAssigner(agents, phaseRegistry, metrics);
        dispatchQueues = new DispatchQueues(
                dispatcher, new DispatchResilience(properties.getResilience()), properties.getDispatch(),
                Schedulers.immediate());
        scheduler = new WorkItemScheduler(
                stateMachine, locks, retryService, deadLetterService, assigner, dispatchQueues, auditTrail,
                eventPublisher, metrics, properties.getScheduler(), clock);
    }

    /**
     * Registers an agent able to run every task type of the default process.
     */
    public void registerGeneralist(String executorId, int maxConcurrentItems) {
        agents.register(executorId, Set.of(
                "document_processing", "validation",
                "text_extraction", "ocr_processing",
                "requirement_extraction", "data_parsing",
                "compliance_analysis", "risk_assessment",
                "portal_scanning", "rfp_discovery",
                "portal_scraping", "rfp_parsing"), maxConcurrentItems);
    }

    public List<OrchestrationEventType> eventTypes() {
        return events.stream().map(OrchestrationEvent::type).toList();
    }

    public double counter(String name, String... tags) {
        Counter counter = meterRegistry.find(name).tags(tags).counter();
        return counter != null ? counter.count() : 0.0;
    }
}
