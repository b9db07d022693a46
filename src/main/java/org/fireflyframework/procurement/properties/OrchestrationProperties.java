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

package org.fireflyframework.procurement.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the procurement orchestration core.
 */
@ConfigurationProperties(prefix = "firefly.procurement")
@Validated
@Data
public class OrchestrationProperties {

    /**
     * Whether the orchestration core is enabled.
     */
    private boolean enabled = true;

    /**
     * Whether to enable metrics collection.
     */
    private boolean metricsEnabled = true;

    /**
     * Whether to enable the health indicator.
     */
    private boolean healthEnabled = true;

    /**
     * Process definition configuration.
     */
    @Valid
    @NotNull
    private ProcessConfig process = new ProcessConfig();

    /**
     * Default retry policy for task types without a registered policy.
     */
    @Valid
    @NotNull
    private RetryConfig retry = new RetryConfig();

    /**
     * Work-item scheduling configuration.
     */
    @Valid
    @NotNull
    private SchedulerConfig scheduler = new SchedulerConfig();

    /**
     * Executor hand-off configuration.
     */
    @Valid
    @NotNull
    private DispatchConfig dispatch = new DispatchConfig();

    /**
     * Background sweep configuration.
     */
    @Valid
    @NotNull
    private SweepConfig sweep = new SweepConfig();

    /**
     * Dead Letter Queue (DLQ) configuration.
     */
    @Valid
    @NotNull
    private DlqConfig dlq = new DlqConfig();

    /**
     * Resilience configuration applied to executor hand-off.
     */
    @Valid
    @NotNull
    private ResilienceConfig resilience = new ResilienceConfig();

    /**
     * Notification event configuration.
     */
    @Valid
    @NotNull
    private EventConfig events = new EventConfig();

    /**
     * Process definition configuration.
     */
    @Data
    public static class ProcessConfig {

        /**
         * Location of the JSON process definition.
         */
        @NotBlank
        private String definitionLocation = "classpath:procurement/default-process.json";
    }

    /**
     * Default retry policy configuration.
     */
    @Data
    public static class RetryConfig {

        /**
         * Maximum number of retries before an item is dead-lettered.
         */
        @Min(0)
        private int maxRetries = 3;

        /**
         * Delay before the first retry.
         */
        @NotNull
        private Duration initialDelay = Duration.ofSeconds(1);

        /**
         * Upper bound for the backoff delay.
         */
        @NotNull
        private Duration maxDelay = Duration.ofMinutes(5);

        /**
         * Multiplier for exponential backoff.
         */
        @DecimalMin("1.0")
        private double multiplier = 2.0;

        /**
         * Error codes that never retry for any task type, in addition to the built-in list.
         */
        @NotNull
        private List<String> additionalPermanentErrors = new ArrayList<>();
    }

    /**
     * Work-item scheduling configuration.
     */
    @Data
    public static class SchedulerConfig {

        /**
         * Failure categories that force a workflow into the failed phase when
         * reported for a blocking item.
         */
        @NotNull
        private List<String> criticalFailureCodes = new ArrayList<>(List.of(
                "AUTHENTICATION_FAILED",
                "AUTHORIZATION_DENIED",
                "COMPLIANCE_VIOLATION",
                "DEADLINE_EXCEEDED"));

        /**
         * Whether a completed phase triggers the automatic transition.
         */
        private boolean autoTransitionEnabled = true;
    }

    /**
     * Executor hand-off configuration.
     */
    @Data
    public static class DispatchConfig {

        /**
         * Capacity of each workflow's dispatch queue.
         */
        @Min(1)
        private int queueCapacity = 256;

        /**
         * Maximum concurrent hand-offs per workflow.
         */
        @Min(1)
        private int concurrency = 16;

        /**
         * Maximum time a single hand-off may take.
         */
        @NotNull
        private Duration handOffTimeout = Duration.ofSeconds(30);
    }

    /**
     * Background sweep configuration.
     */
    @Data
    public static class SweepConfig {

        /**
         * Whether the sweeper starts with the application context.
         */
        private boolean enabled = true;

        /**
         * Interval between sweeps.
         */
        @NotNull
        private Duration interval = Duration.ofSeconds(5);

        /**
         * Interval between dead-letter monitoring runs.
         */
        @NotNull
        private Duration dlqMonitorInterval = Duration.ofSeconds(30);
    }

    /**
     * Dead Letter Queue (DLQ) configuration.
     */
    @Data
    public static class DlqConfig {

        /**
         * Failure count at which an entry is escalated immediately.
         */
        @Min(1)
        private int escalationFailureCount = 10;

        /**
         * Age after which an unresolved entry is escalated.
         */
        @NotNull
        private Duration autoEscalateAfter = Duration.ofHours(48);

        /**
         * Queue size above which a high-volume warning is logged.
         */
        @Min(1)
        private int highVolumeThreshold = 100;

        /**
         * Maximum operator reprocess attempts for a recoverable entry.
         */
        @Min(0)
        private int maxReprocessAttempts = 5;

        /**
         * Failure reasons that are escalated immediately.
         */
        @NotNull
        private List<String> highPriorityReasons = new ArrayList<>(List.of(
                "SECURITY_VIOLATION",
                "DATA_CORRUPTION",
                "SYSTEM_CRITICAL",
                "DEADLINE_MISSED",
                "COMPLIANCE_VIOLATION"));
    }

    /**
     * Resilience configuration.
     */
    @Data
    public static class ResilienceConfig {

        /**
         * Whether resilience patterns are applied to hand-offs.
         */
        private boolean enabled = true;

        @Valid
        @NotNull
        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

        @Valid
        @NotNull
        private BulkheadConfig bulkhead = new BulkheadConfig();

        @Valid
        @NotNull
        private RateLimiterConfig rateLimiter = new RateLimiterConfig();
    }

    @Data
    public static class CircuitBreakerConfig {

        private boolean enabled = true;

        @Min(1)
        private int failureRateThreshold = 50;

        @Min(1)
        private int slidingWindowSize = 20;

        @Min(1)
        private int minimumNumberOfCalls = 10;

        @NotNull
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);

        @Min(1)
        private int permittedNumberOfCallsInHalfOpenState = 3;
    }

    @Data
    public static class BulkheadConfig {

        private boolean enabled = true;

        @Min(1)
        private int maxConcurrentCalls = 50;

        @NotNull
        private Duration maxWaitDuration = Duration.ZERO;
    }

    @Data
    public static class RateLimiterConfig {

        private boolean enabled = false;

        @Min(1)
        private int limitForPeriod = 100;

        @NotNull
        private Duration limitRefreshPeriod = Duration.ofSeconds(1);

        @NotNull
        private Duration timeoutDuration = Duration.ofSeconds(5);
    }

    /**
     * Notification event configuration.
     */
    @Data
    public static class EventConfig {

        /**
         * Whether orchestration events are published.
         */
        private boolean enabled = true;
    }
}
