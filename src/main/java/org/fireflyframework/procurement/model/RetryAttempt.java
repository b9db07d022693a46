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

package org.fireflyframework.procurement.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One scheduled retry of a work item, kept as part of its failure history.
 *
 * @param attempt the 1-based retry number
 * @param timestamp when the retry was scheduled
 * @param delay the backoff delay applied
 * @param errorCode the error that triggered the retry
 * @param context diagnostic context supplied with the failure
 */
public record RetryAttempt(
        int attempt,
        Instant timestamp,
        Duration delay,
        String errorCode,
        Map<String, Object> context
) {

    public RetryAttempt {
        context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
    }
}
