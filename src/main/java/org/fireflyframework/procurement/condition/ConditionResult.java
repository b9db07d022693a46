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

package org.fireflyframework.procurement.condition;

import java.util.List;

/**
 * Outcome of evaluating a {@link TransitionCondition}.
 *
 * @param satisfied whether the condition holds
 * @param unmetReasons why it does not hold; empty when satisfied
 */
public record ConditionResult(boolean satisfied, List<String> unmetReasons) {

    public static final ConditionResult SATISFIED = new ConditionResult(true, List.of());

    public ConditionResult {
        unmetReasons = unmetReasons != null ? List.copyOf(unmetReasons) : List.of();
    }

    public static ConditionResult unmet(List<String> reasons) {
        return new ConditionResult(false, reasons);
    }

    public static ConditionResult unmet(String reason) {
        return new ConditionResult(false, List.of(reason));
    }
}
