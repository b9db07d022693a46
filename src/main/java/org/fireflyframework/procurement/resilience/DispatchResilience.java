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

package org.fireflyframework.procurement.resilience;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.procurement.dispatch.TaskAssignment;
import org.fireflyframework.procurement.properties.OrchestrationProperties;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Guards the hand-off of work items to executors with Resilience4j.
 * <p>
 * Each task type gets its own guard, so an executor pool that keeps failing for
 * one kind of work is cut off without stalling hand-offs of other kinds. A
 * rejected hand-off surfaces as the Resilience4j exception and is treated by
 * the caller like any other dispatch failure.
 */
@Slf4j
public class DispatchResilience {

    private final OrchestrationProperties.ResilienceConfig config;
    private final CircuitBreakerConfig circuitBreakerConfig;
    private final BulkheadConfig bulkheadConfig;
    private final RateLimiterConfig rateLimiterConfig;

    private final Map<String, TaskTypeGuard> guards = new ConcurrentHashMap<>();

    public DispatchResilience(OrchestrationProperties.ResilienceConfig config) {
        this.config = config;

        var breaker = config.getCircuitBreaker();
        this.circuitBreakerConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(breaker.getFailureRateThreshold())
                .slidingWindowSize(breaker.getSlidingWindowSize())
                .minimumNumberOfCalls(breaker.getMinimumNumberOfCalls())
                .waitDurationInOpenState(breaker.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(breaker.getPermittedNumberOfCallsInHalfOpenState())
                .build();
        var bulkhead = config.getBulkhead();
        this.bulkheadConfig = BulkheadConfig.custom()
                .maxConcurrentCalls(bulkhead.getMaxConcurrentCalls())
                .maxWaitDuration(bulkhead.getMaxWaitDuration())
                .build();
        var limiter = config.getRateLimiter();
        this.rateLimiterConfig = RateLimiterConfig.custom()
                .limitForPeriod(limiter.getLimitForPeriod())
                .limitRefreshPeriod(limiter.getLimitRefreshPeriod())
                .timeoutDuration(limiter.getTimeoutDuration())
                .build();

        log.info("DISPATCH_GUARDS_CONFIGURED: enabled={}, circuitBreaker={}, bulkhead={}, rateLimiter={}",
                config.isEnabled(), breaker.isEnabled(), bulkhead.isEnabled(), limiter.isEnabled());
    }

    /**
     * Wraps a hand-off in the guard of its task type. The circuit breaker is
     * the outermost layer, so bulkhead and rate-limiter rejections count as
     * failures of the task type.
     *
     * @param assignment the assignment being handed off
     * @param handOff the hand-off
     * @param <T> the result type
     * @return the guarded hand-off
     */
    public <T> Mono<T> decorate(TaskAssignment assignment, Mono<T> handOff) {
        if (!config.isEnabled()) {
            return handOff;
        }

        TaskTypeGuard guard = guards.computeIfAbsent(assignment.taskType(), this::createGuard);
        Mono<T> guarded = handOff;
        if (guard.bulkhead() != null) {
            guarded = guarded.transformDeferred(BulkheadOperator.of(guard.bulkhead()));
        }
        if (guard.rateLimiter() != null) {
            guarded = guarded.transformDeferred(RateLimiterOperator.of(guard.rateLimiter()));
        }
        if (guard.circuitBreaker() != null) {
            guarded = guarded.transformDeferred(CircuitBreakerOperator.of(guard.circuitBreaker()));
        }
        return guarded.doOnError(error -> logRejection(assignment, error));
    }

    /**
     * Gets the circuit breaker state for a task type, or {@code null} if no
     * hand-off of that type has happened yet or circuit breaking is off.
     */
    @Nullable
    public CircuitBreaker.State getCircuitBreakerState(String taskType) {
        TaskTypeGuard guard = guards.get(taskType);
        return guard != null && guard.circuitBreaker() != null ? guard.circuitBreaker().getState() : null;
    }

    private TaskTypeGuard createGuard(String taskType) {
        String name = "dispatch:" + taskType;
        CircuitBreaker circuitBreaker = null;
        if (config.getCircuitBreaker().isEnabled()) {
            circuitBreaker = CircuitBreaker.of(name, circuitBreakerConfig);
            circuitBreaker.getEventPublisher().onStateTransition(event -> log.warn(
                    "DISPATCH_CIRCUIT_STATE: taskType={}, from={}, to={}", taskType,
                    event.getStateTransition().getFromState(), event.getStateTransition().getToState()));
        }
        Bulkhead bulkhead = config.getBulkhead().isEnabled() ? Bulkhead.of(name, bulkheadConfig) : null;
        RateLimiter rateLimiter = config.getRateLimiter().isEnabled() ? RateLimiter.of(name, rateLimiterConfig) : null;
        log.debug("DISPATCH_GUARD_CREATED: taskType={}", taskType);
        return new TaskTypeGuard(circuitBreaker, bulkhead, rateLimiter);
    }

    private static void logRejection(TaskAssignment assignment, Throwable error) {
        String rejectedBy;
        if (error instanceof CallNotPermittedException) {
            rejectedBy = "circuit_open";
        } else if (error instanceof BulkheadFullException) {
            rejectedBy = "bulkhead_full";
        } else if (error instanceof RequestNotPermitted) {
            rejectedBy = "rate_limited";
        } else {
            return;
        }
        log.warn("DISPATCH_REJECTED: taskType={}, workItemId={}, executorId={}, rejectedBy={}",
                assignment.taskType(), assignment.workItemId(), assignment.executorId(), rejectedBy);
    }

    private record TaskTypeGuard(
            @Nullable CircuitBreaker circuitBreaker,
            @Nullable Bulkhead bulkhead,
            @Nullable RateLimiter rateLimiter) {
    }
}
