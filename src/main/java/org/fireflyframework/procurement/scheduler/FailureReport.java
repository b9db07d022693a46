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

package org.fireflyframework.procurement.scheduler;

import org.fireflyframework.procurement.model.WorkItem;
import org.fireflyframework.procurement.retry.RetryDecision;

/**
 * What a failure report did to a work item.
 *
 * @param item the item after the report
 * @param decision the retry decision, {@code null} when the report was ignored
 *                 or the workflow was already cancelled
 * @param ignored whether the report was a no-op for an item that was not in flight
 */
public record FailureReport(WorkItem item, RetryDecision decision, boolean ignored) {

    static FailureReport ignored(WorkItem item) {
        return new FailureReport(item, null, true);
    }

    static FailureReport applied(WorkItem item, RetryDecision decision) {
        return new FailureReport(item, decision, false);
    }
}
