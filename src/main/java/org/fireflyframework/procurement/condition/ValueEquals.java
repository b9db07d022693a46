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

import java.util.Map;

/**
 * Literal equality against a context value.
 * <p>
 * An absent context key does not block: the condition only constrains values
 * that are actually present.
 *
 * @param key the context key
 * @param expected the expected literal
 */
public record ValueEquals(String key, Object expected) implements TransitionCondition {

    @Override
    public ConditionResult evaluate(Map<String, Object> context) {
        Object actual = context.get(key);
        if (actual == null || Values.areEqual(actual, expected)) {
            return ConditionResult.SATISFIED;
        }
        return ConditionResult.unmet(String.format("%s must equal %s (was %s)", key, expected, actual));
    }
}
