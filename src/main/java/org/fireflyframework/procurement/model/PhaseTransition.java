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

import org.fireflyframework.procurement.condition.TransitionCondition;

import java.util.List;

/**
 * A guarded edge between two phases.
 *
 * @param fromPhase the source phase
 * @param toPhase the target phase
 * @param condition the guard, evaluated against workflow metadata merged with the caller context
 * @param hooks hooks run once the transition has been applied
 */
public record PhaseTransition(
        String fromPhase,
        String toPhase,
        TransitionCondition condition,
        List<String> hooks
) {

    public PhaseTransition {
        condition = condition != null ? condition : TransitionCondition.always();
        hooks = hooks != null ? List.copyOf(hooks) : List.of();
    }

    public String key() {
        return key(fromPhase, toPhase);
    }

    public static String key(String fromPhase, String toPhase) {
        return fromPhase + "->" + toPhase;
    }
}
