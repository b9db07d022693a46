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

import org.fireflyframework.procurement.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryAgentRegistry}.
 */
class InMemoryAgentRegistryTest {

    private MutableClock clock;
    private InMemoryAgentRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-05T10:00:00Z"));
        registry = new InMemoryAgentRegistry(Duration.ofMinutes(5), clock);
    }

    private AssignmentRequest request(String... capabilities) {
        return new AssignmentRequest("wf-1", "item-1", "document_validation", Set.of(capabilities));
    }

    @Test
    @DisplayName("should only select executors holding every required capability")
    void shouldMatchAllCapabilities() {
        registry.register("ocr-only", Set.of("ocr_processing"), 5);
        registry.register("validator", Set.of("document_processing", "validation", "ocr_processing"), 5);

        Optional<ExecutorCandidate> candidate = registry.findExecutor(request("document_processing", "validation"));

        assertThat(candidate).map(ExecutorCandidate::executorId).contains("validator");
        assertThat(registry.findExecutor(request("legal_review"))).isEmpty();
    }

    @Test
    @DisplayName("should rotate between capable executors, least recently assigned first")
    void shouldPreferLeastRecentlyAssigned() {
        registry.register("agent-b", Set.of("validation"), 5);
        registry.register("agent-a", Set.of("validation"), 5);

        String first = registry.findExecutor(request("validation")).orElseThrow().executorId();
        clock.advance(Duration.ofSeconds(1));
        String second = registry.findExecutor(request("validation")).orElseThrow().executorId();
        clock.advance(Duration.ofSeconds(1));
        String third = registry.findExecutor(request("validation")).orElseThrow().executorId();

        assertThat(first).isEqualTo("agent-a");
        assertThat(second).isEqualTo("agent-b");
        assertThat(third).isEqualTo("agent-a");
    }

    @Test
    @DisplayName("should respect the concurrency limit until a slot is released")
    void shouldRespectCapacity() {
        registry.register("agent-1", Set.of("validation"), 1);

        assertThat(registry.findExecutor(request("validation"))).isPresent();
        assertThat(registry.findExecutor(request("validation"))).isEmpty();

        registry.release("agent-1");

        assertThat(registry.getAgent("agent-1")).get()
                .satisfies(agent -> assertThat(agent.activeItems()).isZero());
        assertThat(registry.findExecutor(request("validation"))).isPresent();
    }

    @Test
    @DisplayName("should skip executors whose heartbeat went stale")
    void shouldSkipStaleExecutors() {
        registry.register("agent-1", Set.of("validation"), 3);
        clock.advance(Duration.ofMinutes(6));

        assertThat(registry.findExecutor(request("validation"))).isEmpty();

        registry.heartbeat("agent-1");

        assertThat(registry.findExecutor(request("validation"))).isPresent();
    }

    @Test
    @DisplayName("should never drop active items below zero on repeated releases")
    void shouldClampReleases() {
        registry.register("agent-1", Set.of("validation"), 3);

        registry.release("agent-1");
        registry.release("unknown");

        assertThat(registry.getAgent("agent-1")).get()
                .satisfies(agent -> assertThat(agent.activeItems()).isZero());
    }

    @Test
    @DisplayName("should forget deregistered executors and reject invalid limits")
    void shouldDeregister() {
        registry.register("agent-1", Set.of("validation"), 3);
        registry.deregister("agent-1");

        assertThat(registry.getAgents()).isEmpty();
        assertThat(registry.findExecutor(request("validation"))).isEmpty();
        assertThatThrownBy(() -> registry.register("agent-2", Set.of("validation"), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
