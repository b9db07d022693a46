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

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of named phase hooks.
 * <p>
 * Process definitions refer to hooks by name. Names without a registered hook
 * are skipped, so a process can declare hooks the host application has not
 * implemented yet.
 */
@Slf4j
public class PhaseHookRegistry {

    private final Map<String, PhaseHook> hooks = new ConcurrentHashMap<>();

    public PhaseHookRegistry() {
    }

    public PhaseHookRegistry(Map<String, PhaseHook> initialHooks) {
        initialHooks.forEach(this::register);
    }

    public void register(String name, PhaseHook hook) {
        hooks.put(name, hook);
        log.info("Registered phase hook: {}", name);
    }

    public boolean isRegistered(String name) {
        return hooks.containsKey(name);
    }

    public Set<String> getRegisteredNames() {
        return Collections.unmodifiableSet(hooks.keySet());
    }

    /**
     * Runs hooks in order. A failing hook is logged and the remaining hooks still run.
     *
     * @return the merged metadata updates of all hooks that succeeded
     */
    public Map<String, Object> runHooks(List<String> names, HookStage stage, String workflowId, String phase,
                                        Map<String, Object> metadata) {
        if (names.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        Map<String, Object> updates = new LinkedHashMap<>();
        for (String name : names) {
            PhaseHook hook = hooks.get(name);
            if (hook == null) {
                log.debug("HOOK_NOT_REGISTERED: name={}, stage={}, workflowId={}", name, stage, workflowId);
                continue;
            }
            try {
                Map<String, Object> result = hook.execute(new PhaseHookContext(workflowId, phase, name, stage, snapshot));
                if (result != null) {
                    updates.putAll(result);
                }
                log.debug("HOOK_EXECUTED: name={}, stage={}, workflowId={}, phase={}", name, stage, workflowId, phase);
            } catch (RuntimeException e) {
                log.error("HOOK_FAILED: name={}, stage={}, workflowId={}, phase={}, error={}",
                        name, stage, workflowId, phase, e.getMessage(), e);
            }
        }
        return updates;
    }
}
