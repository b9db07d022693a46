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

import org.fireflyframework.procurement.exception.ProcessDefinitionException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link TransitionCondition} trees from the map form used in process definitions.
 * <p>
 * Grammar, per entry of the condition map:
 * <ul>
 *   <li>{@code "key": literal} - equality, see {@link ValueEquals}</li>
 *   <li>{@code "key": {"min": 1, "lt": 5}} - bounds, see {@link Comparison}</li>
 *   <li>{@code "key": [a, b]} - inclusion, see {@link ContainsAll}</li>
 *   <li>{@code "or": [{...}, {...}]} - alternatives, AND-ed with the sibling entries</li>
 * </ul>
 * Malformed input is rejected with {@link ProcessDefinitionException} so that a
 * broken process fails at startup rather than at transition time.
 */
public class ConditionParser {

    static final String OR_KEY = "or";

    private final Map<String, List<String>> ordinalScales;

    public ConditionParser() {
        this(Map.of());
    }

    /**
     * @param ordinalScales ordered values per context key, used for string comparisons
     */
    public ConditionParser(Map<String, List<String>> ordinalScales) {
        this.ordinalScales = Map.copyOf(ordinalScales);
    }

    /**
     * Parses a condition map. A null or empty map yields {@link TransitionCondition#always()}.
     *
     * @param raw the condition map
     * @return the parsed condition
     * @throws ProcessDefinitionException if the map is malformed
     */
    public TransitionCondition parse(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return TransitionCondition.always();
        }

        List<TransitionCondition> conditions = new ArrayList<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            conditions.add(parseEntry(entry.getKey(), entry.getValue()));
        }
        return conditions.size() == 1 ? conditions.get(0) : new AllOf(conditions);
    }

    private TransitionCondition parseEntry(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new ProcessDefinitionException("Condition key must not be blank");
        }
        if (value == null) {
            throw new ProcessDefinitionException("Condition '" + key + "' has no value");
        }

        if (OR_KEY.equals(key)) {
            return parseAlternatives(value);
        }
        if (value instanceof Map<?, ?> bounds) {
            return parseComparison(key, bounds);
        }
        if (value instanceof List<?> elements) {
            return new ContainsAll(key, new ArrayList<>(elements));
        }
        return new ValueEquals(key, value);
    }

    private TransitionCondition parseAlternatives(Object value) {
        if (!(value instanceof List<?> alternatives) || alternatives.isEmpty()) {
            throw new ProcessDefinitionException("'or' must map to a non-empty list of conditions");
        }

        List<TransitionCondition> parsed = new ArrayList<>();
        for (Object alternative : alternatives) {
            if (!(alternative instanceof Map<?, ?> map)) {
                throw new ProcessDefinitionException("'or' alternatives must be condition objects, got: " + alternative);
            }
            parsed.add(parse(asConditionMap(map)));
        }
        return new AnyOf(parsed);
    }

    private TransitionCondition parseComparison(String key, Map<?, ?> raw) {
        if (raw.isEmpty()) {
            throw new ProcessDefinitionException("Comparison for '" + key + "' declares no operator");
        }

        Map<ComparisonOperator, Object> bounds = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            String operatorKey = String.valueOf(entry.getKey());
            ComparisonOperator operator = ComparisonOperator.fromKey(operatorKey)
                    .orElseThrow(() -> new ProcessDefinitionException(String.format(
                            "Unknown comparison operator '%s' for '%s'", operatorKey, key)));
            Object bound = entry.getValue();
            if (!(bound instanceof Number) && !(bound instanceof String)) {
                throw new ProcessDefinitionException(String.format(
                        "Bound for '%s.%s' must be a number or string, got: %s", key, operatorKey, bound));
            }
            bounds.put(operator, bound);
        }
        return new Comparison(key, bounds, ordinalScales.get(key));
    }

    private static Map<String, Object> asConditionMap(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }
}
