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
 * Numeric or ordinal comparison of one context value against a set of bounds.
 * <p>
 * Numbers compare numerically regardless of their boxed type. Strings compare
 * by their position in {@code ordinalScale} when the process declares a scale
 * for the key, and lexicographically otherwise.
 *
 * @param key the context key
 * @param bounds bound value per operator
 * @param ordinalScale ordered string values for the key, empty if none
 */
public record Comparison(String key, Map<ComparisonOperator, Object> bounds, List<String> ordinalScale)
        implements TransitionCondition {

    public Comparison {
        bounds = Map.copyOf(bounds);
        ordinalScale = ordinalScale != null ? List.copyOf(ordinalScale) : List.of();
    }

    @Override
    public ConditionResult evaluate(Map<String, Object> context) {
        Object actual = context.get(key);
        List<String> unmet = new ArrayList<>();

        for (Map.Entry<ComparisonOperator, Object> bound : bounds.entrySet()) {
            ComparisonOperator operator = bound.getKey();
            if (actual == null) {
                if (!operator.passesWhenAbsent()) {
                    unmet.add(String.format("%s is required (%s %s)", key, operator.symbol(), bound.getValue()));
                }
                continue;
            }

            Integer comparison = Values.compare(actual, bound.getValue(), ordinalScale);
            if (comparison == null) {
                unmet.add(String.format("%s value %s is not comparable with %s", key, actual, bound.getValue()));
            } else if (!operator.accepts(comparison)) {
                unmet.add(String.format("%s must be %s %s (was %s)",
                        key, operator.symbol(), bound.getValue(), actual));
            }
        }

        return unmet.isEmpty() ? ConditionResult.SATISFIED : ConditionResult.unmet(unmet);
    }
}
