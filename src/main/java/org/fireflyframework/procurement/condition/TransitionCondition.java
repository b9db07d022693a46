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
 * Guard expression attached to a phase transition edge.
 * <p>
 * Conditions are parsed once, when the process definition is loaded, into a
 * tree of immutable nodes:
 * <ul>
 *   <li>{@link ValueEquals} - literal equality, permissive when the key is absent</li>
 *   <li>{@link Comparison} - {@code min/max/lt/lte/gt/gte/eq} bounds</li>
 *   <li>{@link ContainsAll} - list literal that a collection value must contain</li>
 *   <li>{@link AllOf} / {@link AnyOf} - conjunction and the reserved {@code or} key</li>
 *   <li>{@link Always} - the empty condition</li>
 * </ul>
 * Evaluation never throws; failures are reported as human-readable reasons
 * that end up in the workflow's {@code blockedReasons}.
 *
 * @see ConditionParser
 */
public interface TransitionCondition {

    /**
     * Evaluates this condition against the merged workflow metadata and caller context.
     *
     * @param context the evaluation context, never null
     * @return the evaluation result
     */
    ConditionResult evaluate(Map<String, Object> context);

    /**
     * Returns the condition that is always satisfied.
     */
    static TransitionCondition always() {
        return Always.INSTANCE;
    }
}
