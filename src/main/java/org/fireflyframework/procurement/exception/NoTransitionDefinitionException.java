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

package org.fireflyframework.procurement.exception;

/**
 * Exception thrown when a phase lists a successor but the process declares no
 * transition edge for it. Indicates a broken process definition.
 */
public class NoTransitionDefinitionException extends OrchestrationException {

    private final String fromPhase;
    private final String toPhase;

    public NoTransitionDefinitionException(String fromPhase, String toPhase) {
        super(String.format("No transition defined from '%s' to '%s'", fromPhase, toPhase));
        this.fromPhase = fromPhase;
        this.toPhase = toPhase;
    }

    public String getFromPhase() {
        return fromPhase;
    }

    public String getToPhase() {
        return toPhase;
    }
}
