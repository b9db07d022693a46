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

package org.fireflyframework.procurement.dlq;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.procurement.event.OrchestrationEvent;
import org.fireflyframework.procurement.event.OrchestrationEventPublisher;
import org.fireflyframework.procurement.event.OrchestrationEventType;
import org.fireflyframework.procurement.metrics.OrchestrationMetrics;
import org.fireflyframework.procurement.persistence.AuditTrail;
import org.fireflyframework.procurement.properties.OrchestrationProperties;
import org.fireflyframework.procurement.retry.ErrorCodes;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for managing Dead Letter Queue (DLQ) entries.
 * <p>
 * Provides functionality to:
 * <ul>
 *   <li>Quarantine failed work items, escalating high-priority failures immediately</li>
 *   <li>List and query DLQ entries</li>
 *   <li>Track operator reprocess attempts</li>
 *   <li>Escalate entries that stay unresolved for too long</li>
 * </ul>
 */
@Slf4j
public class DeadLetterService {

    private final DeadLetterStore deadLetterStore;
    private final AuditTrail auditTrail;
    private final OrchestrationProperties.DlqConfig config;
    private final OrchestrationEventPublisher eventPublisher;
    private final OrchestrationMetrics metrics;
    private final Clock clock;

    public DeadLetterService(
            DeadLetterStore deadLetterStore,
            AuditTrail auditTrail,
            OrchestrationProperties.DlqConfig config,
            @Nullable OrchestrationEventPublisher eventPublisher,
            @Nullable OrchestrationMetrics metrics,
            Clock clock) {
        this.deadLetterStore = deadLetterStore;
        this.auditTrail = auditTrail;
        this.config = config;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Stores a new DLQ entry and escalates it right away if its failure count or
     * failure reason calls for it.
     *
     * @param entry the entry to save
     * @return the saved, possibly escalated, entry
     */
    public Mono<DeadLetterEntry> quarantine(DeadLetterEntry entry) {
        return deadLetterStore.save(entry)
                .doOnSuccess(saved -> {
                    log.info("DLQ_ENTRY_SAVED: id={}, workflowId={}, workItemId={}, reason={}, failures={}",
                            saved.id(), saved.workflowId(), saved.workItemId(),
                            saved.failureReason(), saved.failureCount());
                    auditTrail.deadLetterRecorded(saved);
                    if (metrics != null) {
                        metrics.recordDeadLettered(saved.taskType());
                    }
                    publish(OrchestrationEventType.WORK_ITEM_DEAD_LETTERED, saved,
                            Map.of("dlqEntryId", saved.id(),
                                    "failureReason", String.valueOf(saved.failureReason()),
                                    "recoverable", saved.recoverable()));
                })
                .flatMap(saved -> escalationReason(saved)
                        .map(reason -> escalate(saved, reason))
                        .orElseGet(() -> Mono.just(saved)));
    }

    /**
     * Gets all DLQ entries.
     *
     * @return flux of all entries
     */
    public Flux<DeadLetterEntry> getAllEntries() {
        return deadLetterStore.findAll();
    }

    /**
     * Gets a DLQ entry by ID.
     *
     * @param id the entry ID
     * @return the entry if found
     */
    public Mono<DeadLetterEntry> getEntry(String id) {
        return deadLetterStore.findById(id);
    }

    /**
     * Gets DLQ entries by workflow ID.
     *
     * @param workflowId the workflow ID
     * @return flux of entries
     */
    public Flux<DeadLetterEntry> getEntriesByWorkflowId(String workflowId) {
        return deadLetterStore.findByWorkflowId(workflowId);
    }

    /**
     * Gets the count of DLQ entries.
     *
     * @return the count
     */
    public Mono<Long> getCount() {
        return deadLetterStore.count();
    }

    /**
     * Deletes a DLQ entry once an operator has resolved it.
     *
     * @param id the entry ID
     * @return true if deleted
     */
    public Mono<Boolean> delete(String id) {
        return deadLetterStore.delete(id)
                .doOnSuccess(deleted -> {
                    if (Boolean.TRUE.equals(deleted)) {
                        log.info("DLQ_ENTRY_DELETED: id={}", id);
                    }
                });
    }

    /**
     * Escalates a DLQ entry. Escalating an already escalated entry is a no-op.
     *
     * @param id the entry ID
     * @param reason why the entry is escalated
     * @return the escalated entry
     */
    public Mono<DeadLetterEntry> escalate(String id, String reason) {
        return deadLetterStore.findById(id)
                .switchIfEmpty(Mono.error(new IllegalArgumentException("DLQ entry not found: " + id)))
                .flatMap(entry -> escalate(entry, reason));
    }

    /**
     * Records an operator reprocess attempt.
     *
     * @param id the entry ID
     * @param triggeredBy the operator
     * @return the updated entry
     * @throws IllegalStateException (as error signal) if the entry is not recoverable
     *         or has used up its reprocess attempts
     */
    public Mono<DeadLetterEntry> markReprocessed(String id, String triggeredBy) {
        return deadLetterStore.findById(id)
                .switchIfEmpty(Mono.error(new IllegalArgumentException("DLQ entry not found: " + id)))
                .flatMap(entry -> {
                    if (!entry.canReprocess()) {
                        return Mono.error(new IllegalStateException(String.format(
                                "DLQ entry %s cannot be reprocessed (recoverable=%s, attempts=%d/%d)",
                                id, entry.recoverable(), entry.reprocessAttempts(), entry.maxReprocessAttempts())));
                    }
                    return deadLetterStore.save(entry.withReprocessAttempt(triggeredBy, clock.instant()));
                })
                .doOnSuccess(entry -> log.info("DLQ_REPROCESS: id={}, workItemId={}, attempt={}/{}, by={}",
                        id, entry.workItemId(), entry.reprocessAttempts(), entry.maxReprocessAttempts(), triggeredBy));
    }

    /**
     * Computes DLQ statistics.
     *
     * @return the statistics
     */
    public Mono<DeadLetterStatistics> getStatistics() {
        return deadLetterStore.findAll()
                .collectList()
                .map(DeadLetterService::toStatistics);
    }

    /**
     * Periodic DLQ maintenance: escalates entries older than the configured age
     * and warns when the queue grows beyond the high-volume threshold.
     *
     * @param now the current time
     * @return the statistics after maintenance
     */
    public Mono<DeadLetterStatistics> monitor(Instant now) {
        Instant cutoff = now.minus(config.getAutoEscalateAfter());
        return deadLetterStore.findAll()
                .filter(entry -> !entry.escalated() && !entry.createdAt().isAfter(cutoff))
                .concatMap(entry -> escalate(entry,
                        "Unresolved for more than " + config.getAutoEscalateAfter()))
                .then(getStatistics())
                .doOnNext(stats -> {
                    if (stats.total() > config.getHighVolumeThreshold()) {
                        log.warn("DLQ_HIGH_VOLUME: total={}, threshold={}, byTaskType={}",
                                stats.total(), config.getHighVolumeThreshold(), stats.byTaskType());
                    } else {
                        log.debug("DLQ_MONITOR: total={}, escalated={}", stats.total(), stats.escalated());
                    }
                });
    }

    Optional<String> escalationReason(DeadLetterEntry entry) {
        if (entry.failureCount() >= config.getEscalationFailureCount()) {
            return Optional.of(String.format("Failure count %d reached escalation threshold %d",
                    entry.failureCount(), config.getEscalationFailureCount()));
        }
        return config.getHighPriorityReasons().stream()
                .filter(code -> ErrorCodes.matches(entry.failureReason(), code))
                .findFirst()
                .map(code -> "High-priority failure: " + code);
    }

    private Mono<DeadLetterEntry> escalate(DeadLetterEntry entry, String reason) {
        if (entry.escalated()) {
            return Mono.just(entry);
        }
        return deadLetterStore.save(entry.withEscalation(reason, clock.instant()))
                .doOnSuccess(escalated -> {
                    log.warn("DLQ_ESCALATED: id={}, workflowId={}, workItemId={}, reason={}",
                            escalated.id(), escalated.workflowId(), escalated.workItemId(), reason);
                    if (metrics != null) {
                        metrics.recordEscalated(escalated.taskType());
                    }
                    publish(OrchestrationEventType.DEAD_LETTER_ESCALATED, escalated,
                            Map.of("dlqEntryId", escalated.id(), "escalationReason", reason));
                });
    }

    private void publish(OrchestrationEventType type, DeadLetterEntry entry, Map<String, Object> payload) {
        if (eventPublisher == null) {
            return;
        }
        String phase = entry.workItem() != null ? entry.workItem().phase() : null;
        eventPublisher.fire(OrchestrationEvent.workItem(
                type, entry.workflowId(), entry.workItemId(), phase, payload, clock.instant()));
    }

    private static DeadLetterStatistics toStatistics(List<DeadLetterEntry> entries) {
        return new DeadLetterStatistics(
                entries.size(),
                entries.stream().filter(DeadLetterEntry::recoverable).count(),
                entries.stream().filter(DeadLetterEntry::escalated).count(),
                countBy(entries, DeadLetterEntry::taskType),
                countBy(entries, DeadLetterEntry::failureReason));
    }

    private static Map<String, Long> countBy(List<DeadLetterEntry> entries, Function<DeadLetterEntry, String> key) {
        return entries.stream()
                .collect(Collectors.groupingBy(
                        entry -> Optional.ofNullable(key.apply(entry)).orElse("unknown"),
                        Collectors.counting()));
    }
}
