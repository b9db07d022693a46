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

package org.fireflyframework.procurement.assignment;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link AgentRegistry}.
 * <p>
 * Among live executors with the required capabilities and spare capacity, the
 * one assigned least recently wins; ties break on the executor id. An executor
 * whose last heartbeat is older than the staleness window is skipped.
 */
@Slf4j
public class InMemoryAgentRegistry implements AgentRegistry {

    private static final Comparator<AgentRegistration> SELECTION_ORDER = Comparator
            .comparing(AgentRegistration::lastAssignedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(AgentRegistration::executorId);

    private final Map<String, AgentRegistration> agents = new ConcurrentHashMap<>();
    private final Duration heartbeatTimeout;
    private final Clock clock;

    public InMemoryAgentRegistry(Duration heartbeatTimeout, Clock clock) {
        this.heartbeatTimeout = heartbeatTimeout;
        this.clock = clock;
    }

    public InMemoryAgentRegistry(Clock clock) {
        this(Duration.ofMinutes(5), clock);
    }

    public AgentRegistration register(String executorId, Set<String> capabilities, int maxConcurrentItems) {
        if (maxConcurrentItems < 1) {
            throw new IllegalArgumentException("maxConcurrentItems must be at least 1");
        }
        AgentRegistration registration = new AgentRegistration(
                executorId, capabilities, maxConcurrentItems, 0, clock.instant(), null);
        agents.put(executorId, registration);
        log.info("AGENT_REGISTERED: executorId={}, capabilities={}, maxConcurrentItems={}",
                executorId, registration.capabilities(), maxConcurrentItems);
        return registration;
    }

    public void heartbeat(String executorId) {
        agents.computeIfPresent(executorId, (id, agent) -> agent.withHeartbeat(clock.instant()));
    }

    @Override
    public void release(String executorId) {
        agents.computeIfPresent(executorId, (id, agent) -> agent.withRelease());
    }

    public void deregister(String executorId) {
        if (agents.remove(executorId) != null) {
            log.info("AGENT_DEREGISTERED: executorId={}", executorId);
        }
    }

    public Optional<AgentRegistration> getAgent(String executorId) {
        return Optional.ofNullable(agents.get(executorId));
    }

    public List<AgentRegistration> getAgents() {
        return List.copyOf(agents.values());
    }

    @Override
    public synchronized Optional<ExecutorCandidate> findExecutor(AssignmentRequest request) {
        Instant now = clock.instant();
        Optional<AgentRegistration> chosen = agents.values().stream()
                .filter(agent -> agent.canHandle(request.requiredCapabilities()))
                .filter(AgentRegistration::hasCapacity)
                .filter(agent -> !agent.lastHeartbeatAt().plus(heartbeatTimeout).isBefore(now))
                .min(SELECTION_ORDER);

        return chosen.map(agent -> {
            agents.put(agent.executorId(), agent.withAssignment(now));
            log.debug("AGENT_SELECTED: executorId={}, workItemId={}, taskType={}",
                    agent.executorId(), request.workItemId(), request.taskType());
            return new ExecutorCandidate(agent.executorId(), agent.capabilities());
        });
    }
}
