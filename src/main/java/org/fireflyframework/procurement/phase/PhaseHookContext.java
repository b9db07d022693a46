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

package org.fireflyframework.procurement.phase;

import java.util.Map;

/**
 * Input handed to a {@link PhaseHook}.
 *
 * @param workflowId the workflow
 * @param phase the phase being left or entered
 * @param hookName the name the hook was registered under
 * @param stage when the hook runs
 * @param metadata read-only snapshot of the workflow metadata
 */
public record PhaseHookContext(
        String workflowId,
        String phase,
        String hookName,
        HookStage stage,
        Map<String, Object> metadata
) {
}
