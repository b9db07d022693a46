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

package org.fireflyframework.procurement.retry;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Retry policies keyed by task type, with a fallback for unknown task types.
 */
@Slf4j
public class RetryPolicyRegistry {

    private final Map<String, RetryPolicy> policies = new ConcurrentHashMap<>();
    private final RetryPolicy fallback;

    public RetryPolicyRegistry(RetryPolicy fallback) {
        this.fallback = fallback;
    }

    /**
     * Creates a registry pre-populated with {@link #procurementDefaults()}.
     */
    public static RetryPolicyRegistry withDefaults(RetryPolicy fallback) {
        RetryPolicyRegistry registry = new RetryPolicyRegistry(fallback);
        procurementDefaults().forEach(registry::register);
        return registry;
    }

    public void register(RetryPolicy policy) {
        RetryPolicy previous = policies.put(policy.taskType(), policy);
        if (previous != null) {
            log.info("RETRY_POLICY_UPDATED: taskType={}, maxRetries={}, initialDelay={}, multiplier={}",
                    policy.taskType(), policy.maxRetries(), policy.initialDelay(), policy.multiplier());
        } else {
            log.debug("Registered retry policy for task type {}", policy.taskType());
        }
    }

    /**
     * Returns the policy for a task type, or the fallback bound to that task type.
     */
    public RetryPolicy getPolicy(String taskType) {
        RetryPolicy policy = policies.get(taskType);
        if (policy != null) {
            return policy;
        }
        log.debug("No retry policy for task type {}, using fallback", taskType);
        return fallback.forTaskType(taskType != null ? taskType : fallback.taskType());
    }

    public boolean hasPolicy(String taskType) {
        return policies.containsKey(taskType);
    }

    public Collection<RetryPolicy> getAllPolicies() {
        return List.copyOf(policies.values());
    }

    public RetryPolicy getFallback() {
        return fallback;
    }

    /**
     * Policies for the procurement task types.
     */
    public static List<RetryPolicy> procurementDefaults() {
        return List.of(
                new RetryPolicy("portal_scan", 5, Duration.ofSeconds(2), Duration.ofMinutes(5), 2.0,
                        List.of("NETWORK_ERROR", "TIMEOUT", "RATE_LIMITED", "PORTAL_UNAVAILABLE", "CAPTCHA_REQUIRED"),
                        List.of("AUTHENTICATION_FAILED", "AUTHORIZATION_DENIED", "PORTAL_NOT_FOUND", "MALFORMED_URL")),
                new RetryPolicy("rfp_parsing", 3, Duration.ofSeconds(1), Duration.ofMinutes(1), 1.5,
                        List.of("PARSE_ERROR", "INCOMPLETE_DATA", "DOCUMENT_CORRUPT"),
                        List.of("UNSUPPORTED_FORMAT", "DOCUMENT_ENCRYPTED", "DOCUMENT_EMPTY")),
                new RetryPolicy("compliance_check", 4, Duration.ofSeconds(5), Duration.ofMinutes(10), 1.8,
                        List.of("AI_SERVICE_ERROR", "ANALYSIS_TIMEOUT", "REFERENCE_DATA_UNAVAILABLE"),
                        List.of("INSUFFICIENT_RFP_DATA", "COMPLIANCE_RULES_MISSING", "ANALYSIS_IMPOSSIBLE")),
                new RetryPolicy("proposal_generation", 3, Duration.ofSeconds(10), Duration.ofMinutes(30), 2.5,
                        List.of("AI_GENERATION_ERROR", "TEMPLATE_UNAVAILABLE", "CONTENT_GENERATION_FAILED"),
                        List.of("REQUIREMENTS_INSUFFICIENT", "TEMPLATE_CORRUPT", "GENERATION_IMPOSSIBLE")),
                new RetryPolicy("portal_submission", 6, Duration.ofSeconds(3), Duration.ofMinutes(15), 1.6,
                        List.of("SUBMISSION_TIMEOUT", "PORTAL_BUSY", "TEMPORARY_ERROR", "NETWORK_INTERRUPTION"),
                        List.of("DEADLINE_PASSED", "SUBMISSION_REJECTED", "INVALID_CREDENTIALS", "PROPOSAL_INVALID")),
                new RetryPolicy("document_processing", 4, Duration.ofMillis(2500), Duration.ofMinutes(8), 2.2,
                        List.of("PROCESSING_ERROR", "CONVERSION_FAILED", "STORAGE_UNAVAILABLE"),
                        List.of("DOCUMENT_CORRUPTED", "FORMAT_UNSUPPORTED", "SIZE_EXCEEDED")),
                new RetryPolicy("ai_service", 7, Duration.ofMillis(1500), Duration.ofMinutes(2), 1.4,
                        List.of("API_RATE_LIMITED", "SERVICE_BUSY", "TEMPORARY_UNAVAILABLE", "TOKEN_LIMIT_EXCEEDED"),
                        List.of("API_KEY_INVALID", "QUOTA_EXCEEDED", "REQUEST_TOO_LARGE", "MODEL_UNAVAILABLE"))
        );
    }
}
