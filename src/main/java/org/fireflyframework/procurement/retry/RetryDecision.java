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
import java.time.Instant;

/**
 * Result of classifying one task failure.
 *
 * @param disposition what happens to the item
 * @param attempt the attempt number the failure belongs to (1-based)
 * @param delay backoff delay, zero unless retrying
 * @param nextRetryAt when the retry is due, null unless retrying
 * @param reason human-readable explanation
 */
public record RetryDecision(
        FailureDisposition disposition,
        int attempt,
        Duration delay,
        Instant nextRetryAt,
        String reason
) {

    public static RetryDecision retry(int attempt, Duration delay, Instant nextRetryAt, String reason) {
        return new RetryDecision(FailureDisposition.RETRY, attempt, delay, nextRetryAt, reason);
    }

    public static RetryDecision permanent(int attempt, String reason) {
        return new RetryDecision(FailureDisposition.PERMANENT, attempt, Duration.ZERO, null, reason);
    }

    public static RetryDecision deadLetter(int attempt, String reason) {
        return new RetryDecision(FailureDisposition.DEAD_LETTER, attempt, Duration.ZERO, null, reason);
    }

    public boolean shouldRetry() {
        return disposition == FailureDisposition.RETRY;
    }

    public boolean moveToDeadLetter() {
        return disposition == FailureDisposition.DEAD_LETTER;
    }
}
