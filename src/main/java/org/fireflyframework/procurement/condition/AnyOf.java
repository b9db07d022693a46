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
 * Disjunction, produced by the reserved {@code or} key.
 *
 * @param alternatives the alternatives, at least one of which must hold
 */
public record AnyOf(List<TransitionCondition> alternatives) implements TransitionCondition {

    public AnyOf {
        alternatives = List.copyOf(alternatives);
    }

    @Override
    public ConditionResult evaluate(Map<String, Object> context) {
        List<String> reasons = new ArrayList<>();
        for (TransitionCondition alternative : alternatives) {
            ConditionResult result = alternative.evaluate(context);
            if (result.satisfied()) {
                return ConditionResult.SATISFIED;
            }
            reasons.add(String.join(" and ", result.unmetReasons()));
        }
        return ConditionResult.unmet("none of the alternatives matched: [" + String.join("; ", reasons) + "]");
    }
}
