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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Conjunction. Every child is evaluated so that all unmet reasons are reported.
 *
 * @param conditions the conditions that must all hold
 */
public record AllOf(List<TransitionCondition> conditions) implements TransitionCondition {

    public AllOf {
        conditions = List.copyOf(conditions);
    }

    @Override
    public ConditionResult evaluate(Map<String, Object> context) {
        List<String> unmet = new ArrayList<>();
        for (TransitionCondition condition : conditions) {
            ConditionResult result = condition.evaluate(context);
            if (!result.satisfied()) {
                unmet.addAll(result.unmetReasons());
            }
        }
        return unmet.isEmpty() ? ConditionResult.SATISFIED : ConditionResult.unmet(unmet);
    }
}
