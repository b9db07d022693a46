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

package org.fireflyframework.procurement.assignment;

import java.util.Set;

/**
 * Outcome of an assignment attempt.
 *
 * @param executor the chosen executor, {@code null} when no capacity was available
 * @param requiredCapabilities the capabilities that were requested
 */
public record AssignmentResult(ExecutorCandidate executor, Set<String> requiredCapabilities) {

    public static AssignmentResult assigned(ExecutorCandidate executor, Set<String> required) {
        return new AssignmentResult(executor, required);
    }

    public static AssignmentResult noCapacity(Set<String> required) {
        return new AssignmentResult(null, required);
    }

    public boolean isAssigned() {
        return executor != null;
    }
}
