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

import java.time.Duration;
import java.util.List;

/**
 * Retry behaviour for one task type.
 *
 * @param taskType the task type the policy applies to
 * @param maxRetries number of retries before the item is dead-lettered
 * @param initialDelay delay before the first retry
 * @param maxDelay upper bound for the delay
 * @param multiplier exponential backoff multiplier, at least 1
 * @param retryableErrors error codes that are retried; empty means any non-permanent error
 * @param permanentErrors error codes that are never retried
 */
public record RetryPolicy(
        String taskType,
        int maxRetries,
        Duration initialDelay,
        Duration maxDelay,
        double multiplier,
        List<String> retryableErrors,
        List<String> permanentErrors
) {

    /**
     * Default retry policy.
     */
    public static final RetryPolicy DEFAULT = new RetryPolicy(
            "default",
            3,
            Duration.ofSeconds(1),
            Duration.ofMinutes(5),
            2.0,
            List.of(),
            List.of()
    );

    /**
     * No retry policy - dead-letter on the first failure.
     */
    public static final RetryPolicy NO_RETRY = new RetryPolicy(
            "no-retry",
            0,
            Duration.ZERO,
            Duration.ZERO,
            1.0,
            List.of(),
            List.of()
    );

    public RetryPolicy {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType must not be blank");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least initialDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0: " + multiplier);
        }
        retryableErrors = retryableErrors != null ? List.copyOf(retryableErrors) : List.of();
        permanentErrors = permanentErrors != null ? List.copyOf(permanentErrors) : List.of();
    }

    /**
     * Calculates the delay for a given retry number.
     * <p>
     * {@code initialDelay * multiplier^(attempt - 1)}, capped at {@code maxDelay}.
     * No jitter is applied, so the delay is a pure function of the attempt.
     *
     * @param attempt the retry number (1-based)
     * @return the delay duration
     */
    public Duration getDelayForAttempt(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }

        double delayMs = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        return Duration.ofMillis((long) Math.min(delayMs, maxDelay.toMillis()));
    }

    /**
     * Checks if another retry is allowed after {@code previousRetries} retries.
     */
    public boolean allowsRetry(int previousRetries) {
        return previousRetries < maxRetries;
    }

    public boolean isPermanent(String errorCode) {
        return ErrorCodes.matchesAny(errorCode, permanentErrors);
    }

    public boolean isRetryable(String errorCode) {
        return retryableErrors.isEmpty() || ErrorCodes.matchesAny(errorCode, retryableErrors);
    }

    /**
     * Returns a copy of this policy bound to another task type.
     */
    public RetryPolicy forTaskType(String otherTaskType) {
        return new RetryPolicy(otherTaskType, maxRetries, initialDelay, maxDelay, multiplier,
                retryableErrors, permanentErrors);
    }
}
