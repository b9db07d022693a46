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

package org.fireflyframework.procurement.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.procurement.dlq.DeadLetterEntry;
import org.fireflyframework.procurement.model.PhaseTransitionRecord;
import org.fireflyframework.procurement.model.WorkItem;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

/**
 * Writes the audit trail to the {@link OrchestrationStore} without letting
 * store failures reach the caller.
 * <p>
 * Every write is subscribed immediately; failures are logged with the
 * {@code AUDIT_WRITE_FAILED} key.
 */
@Slf4j
@RequiredArgsConstructor
public class AuditTrail {

    private final OrchestrationStore store;

    public void workItemCreated(WorkItem item) {
        write(() -> store.createWorkItem(item), "createWorkItem", item.id());
    }

    public void workItemUpdated(WorkItem item) {
        write(() -> store.updateWorkItem(item), "updateWorkItem", item.id());
    }

    public void transitionRecorded(PhaseTransitionRecord record) {
        write(() -> store.createPhaseTransitionRecord(record), "createPhaseTransitionRecord", record.workflowId());
    }

    public void deadLetterRecorded(DeadLetterEntry entry) {
        write(() -> store.createDeadLetterEntry(entry), "createDeadLetterEntry", entry.workItemId());
    }

    private void write(Supplier<Mono<?>> operation, String operationName, String subjectId) {
        Mono.defer(operation)
                .subscribe(
                        written -> log.trace("AUDIT_WRITE: op={}, id={}", operationName, subjectId),
                        error -> log.error("AUDIT_WRITE_FAILED: op={}, id={}, error={}",
                                operationName, subjectId, error.getMessage(), error));
    }
}
