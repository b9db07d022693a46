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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RetryPolicy}.
 */
class RetryPolicyTest {

    @Test
    void shouldGrowDelayExponentiallyUpToMaxDelay() {
        RetryPolicy policy = new RetryPolicy("portal_scan", 10, Duration.ofSeconds(2), Duration.ofSeconds(20), 2.0,
                List.of(), List.of());

        assertThat(policy.getDelayForAttempt(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.getDelayForAttempt(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.getDelayForAttempt(3)).isEqualTo(Duration.ofSeconds(8));
        assertThat(policy.getDelayForAttempt(4)).isEqualTo(Duration.ofSeconds(16));
        assertThat(policy.getDelayForAttempt(5)).isEqualTo(Duration.ofSeconds(20));
        assertThat(policy.getDelayForAttempt(9)).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    void shouldNeverShrinkDelayBetweenAttempts() {
        for (RetryPolicy policy : RetryPolicyRegistry.procurementDefaults()) {
            Duration previous = Duration.ZERO;
            for (int attempt = 1; attempt <= policy.maxRetries() + 3; attempt++) {
                Duration delay = policy.getDelayForAttempt(attempt);
                assertThat(delay).as("%s attempt %d", policy.taskType(), attempt)
                        .isGreaterThanOrEqualTo(previous)
                        .isLessThanOrEqualTo(policy.maxDelay());
                previous = delay;
            }
        }
    }

    @Test
    void shouldReturnZeroDelayForNonPositiveAttempts() {
        assertThat(RetryPolicy.DEFAULT.getDelayForAttempt(0)).isEqualTo(Duration.ZERO);
    }

    @Test
    void shouldAllowRetriesBelowMaxRetries() {
        RetryPolicy policy = RetryPolicy.DEFAULT;

        assertThat(policy.allowsRetry(0)).isTrue();
        assertThat(policy.allowsRetry(2)).isTrue();
        assertThat(policy.allowsRetry(3)).isFalse();
        assertThat(RetryPolicy.NO_RETRY.allowsRetry(0)).isFalse();
    }

    @Test
    void shouldTreatEveryErrorAsRetryableWithoutAList() {
        assertThat(RetryPolicy.DEFAULT.isRetryable("ANYTHING")).isTrue();
    }

    @Test
    void shouldMatchErrorCodesBySubstring() {
        RetryPolicy policy = new RetryPolicy("rfp_parsing", 3, Duration.ofSeconds(1), Duration.ofMinutes(1), 1.5,
                List.of("PARSE_ERROR"), List.of("DOCUMENT_EMPTY"));

        assertThat(policy.isRetryable("PARSE_ERROR: unexpected token")).isTrue();
        assertThat(policy.isRetryable("NETWORK_ERROR")).isFalse();
        assertThat(policy.isPermanent("DOCUMENT_EMPTY")).isTrue();
        assertThat(policy.isPermanent(null)).isFalse();
    }

    @Test
    void shouldRejectInvalidPolicies() {
        assertThatThrownBy(() -> new RetryPolicy(" ", 1, Duration.ZERO, Duration.ZERO, 1.0, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy("t", -1, Duration.ZERO, Duration.ZERO, 1.0, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy("t", 1, Duration.ofSeconds(5), Duration.ofSeconds(1), 1.0, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy("t", 1, Duration.ZERO, Duration.ZERO, 0.5, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFallBackForUnknownTaskTypes() {
        RetryPolicyRegistry registry = RetryPolicyRegistry.withDefaults(RetryPolicy.DEFAULT);

        RetryPolicy policy = registry.getPolicy("unknown_task");

        assertThat(policy.taskType()).isEqualTo("unknown_task");
        assertThat(policy.maxRetries()).isEqualTo(RetryPolicy.DEFAULT.maxRetries());
        assertThat(registry.hasPolicy("portal_scan")).isTrue();
        assertThat(registry.getPolicy("portal_scan").maxRetries()).isEqualTo(5);
    }
}
