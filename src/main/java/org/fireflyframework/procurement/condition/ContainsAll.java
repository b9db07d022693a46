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
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Requires a collection-valued context entry to contain every listed element.
 * <p>
 * Values that are absent or not collections are not constrained.
 *
 * @param key the context key
 * @param required the elements that must be present
 */
public record ContainsAll(String key, List<Object> required) implements TransitionCondition {

    public ContainsAll {
        required = List.copyOf(required);
    }

    @Override
    public ConditionResult evaluate(Map<String, Object> context) {
        if (!(context.get(key) instanceof Collection<?> actual)) {
            return ConditionResult.SATISFIED;
        }

        List<Object> missing = new ArrayList<>();
        for (Object element : required) {
            boolean present = actual.stream().anyMatch(candidate -> Values.areEqual(candidate, element));
            if (!present) {
                missing.add(element);
            }
        }

        if (missing.isEmpty()) {
            return ConditionResult.SATISFIED;
        }
        return ConditionResult.unmet(String.format("%s is missing %s", key, missing));
    }
}
