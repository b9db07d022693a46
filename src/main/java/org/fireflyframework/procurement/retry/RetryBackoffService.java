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
import org.fireflyframework.procurement.dlq.DeadLetterEntry;
import org.fireflyframework.procurement.dlq.DeadLetterService;
import org.fireflyframework.procurement.model.RetryAttempt;
import org.fireflyframework.procurement.model.WorkItem;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Classifies task failures into retry, permanent failure or dead-letter, and
 * computes the backoff delay.
 * <p>
 * Classification order:
 * <ol>
 *   <li>an error matching a global or policy-level permanent code is never retried</li>
 *   <li>an item that used up its retries is dead-lettered</li>
 *   <li>an error outside the policy's retryable list is dead-lettered</li>
 *   <li>anything else is retried after {@link RetryPolicy#getDelayForAttempt(int)}</li>
 * </ol>
 * The retries scheduled for an item are remembered and attached to its
 * dead-letter entry.
 */
@Slf4j
public class RetryBackoffService {

    /**
     * Error codes that never retry, whatever the task type.
     */
    public static final List<String> GLOBAL_PERMANENT_ERRORS = List.of(
            "AUTHENTICATION_FAILED",
            "AUTHORIZATION_DENIED",
            "DEADLINE_PASSED",
            "MALFORMED_DATA",
            "QUOTA_EXCEEDED",
            "UNSUPPORTED_FORMAT",
            "DOCUMENT_CORRUPTED");

    private final RetryPolicyRegistry policyRegistry;
    private final DeadLetterService deadLetterService;
    private final List<String> permanentErrors;
    private final int maxReprocessAttempts;
    private final Clock clock;
    private final Map<String, List<RetryAttempt>> retryHistory = new ConcurrentHashMap<>();

    public RetryBackoffService(
            RetryPolicyRegistry policyRegistry,
            DeadLetterService deadLetterService,
            Collection<String> additionalPermanentErrors,
            int maxReprocessAttempts,
            Clock clock) {
        this.policyRegistry = policyRegistry;
        this.deadLetterService = deadLetterService;
        List<String> codes = new ArrayList<>(GLOBAL_PERMANENT_ERRORS);
        codes.addAll(additionalPermanentErrors);
        this.permanentErrors = List.copyOf(codes);
        this.maxReprocessAttempts = maxReprocessAttempts;
        this.clock = clock;
    }

    /**
     * Decides the fate of a failed work item.
     *
     * @param workItemId the failed item
     * @param taskType the item's task type
     * @param error the reported error code
     * @param attemptCount retries already scheduled for the item
     * @param context diagnostic context, recorded with a scheduled retry
     * @return the decision
     */
    public RetryDecision shouldRetry(String workItemId, String taskType, String error, int attemptCount,
                                     Map<String, Object> context) {
        RetryPolicy policy = policyRegistry.getPolicy(taskType);
        int attempt = attemptCount + 1;

        if (ErrorCodes.matchesAny(error, permanentErrors) || policy.isPermanent(error)) {
            log.info("RETRY_PERMANENT: workItemId={}, taskType={}, error={}", workItemId, taskType, error);
            retryHistory.remove(workItemId);
            return RetryDecision.permanent(attempt, "Permanent failure detected: " + error);
        }

        if (!policy.allowsRetry(attemptCount)) {
            log.warn("RETRY_EXHAUSTED: workItemId={}, taskType={}, error={}, maxRetries={}",
                    workItemId, taskType, error, policy.maxRetries());
            return RetryDecision.deadLetter(attempt, "Max retries exceeded (" + policy.maxRetries() + ")");
        }

        if (!policy.isRetryable(error)) {
            log.warn("RETRY_UNRECOGNIZED_ERROR: workItemId={}, taskType={}, error={}", workItemId, taskType, error);
            return RetryDecision.deadLetter(attempt, "Error is not retryable: " + error);
        }

        Duration delay = policy.getDelayForAttempt(attempt);
        Instant now = clock.instant();
        Instant nextRetryAt = now.plus(delay);
        retryHistory.computeIfAbsent(workItemId, id -> new CopyOnWriteArrayList<>())
                .add(new RetryAttempt(attempt, now, delay, error, context));

        log.info("RETRY_SCHEDULED: workItemId={}, taskType={}, attempt={}/{}, delayMs={}",
                workItemId, taskType, attempt, policy.maxRetries(), delay.toMillis());
        return RetryDecision.retry(attempt, delay, nextRetryAt,
                String.format("Retryable error, attempt %d/%d", attempt, policy.maxRetries()));
    }

    /**
     * Quarantines a work item. The item itself is left untouched; the entry
     * carries a snapshot of it together with its retry history, which is no
     * longer kept here once the entry is built.
     *
     * @param workItemId the item id
     * @param item the item snapshot
     * @param error the error code
     * @param attempts failed attempts so far
     * @param recoverable whether an operator may reprocess the item
     * @param metadata diagnostic metadata
     * @return the stored entry
     */
    public Mono<DeadLetterEntry> moveToDeadLetterQueue(String workItemId, WorkItem item, String error, int attempts,
                                                       boolean recoverable, Map<String, Object> metadata) {
        return Mono.defer(() -> {
            List<RetryAttempt> history = retryHistory.remove(workItemId);
            DeadLetterEntry entry = DeadLetterEntry.forWorkItem(
                    item,
                    error,
                    item.lastErrorMessage(),
                    attempts,
                    history != null ? List.copyOf(history) : List.of(),
                    recoverable,
                    maxReprocessAttempts,
                    metadata,
                    clock.instant());
            return deadLetterService.quarantine(entry);
        });
    }

    public List<RetryAttempt> getRetryHistory(String workItemId) {
        return List.copyOf(retryHistory.getOrDefault(workItemId, List.of()));
    }

    /**
     * Forgets the retry history of an item that completed or is requeued with a
     * fresh budget.
     */
    public void clearRetryHistory(String workItemId) {
        retryHistory.remove(workItemId);
    }

    public RetryPolicy getPolicy(String taskType) {
        return policyRegistry.getPolicy(taskType);
    }

    public void updateRetryPolicy(RetryPolicy policy) {
        policyRegistry.register(policy);
    }

    public Collection<RetryPolicy> getAllRetryPolicies() {
        return policyRegistry.getAllPolicies();
    }
}
