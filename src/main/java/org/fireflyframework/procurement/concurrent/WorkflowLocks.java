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

package org.fireflyframework.procurement.concurrent;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per workflow id.
 * <p>
 * All mutations of a workflow's phase state and of its work items run under
 * that workflow's lock, so unrelated workflows never contend. The lock is
 * reentrant because the scheduler calls into the state machine while holding it.
 * <p>
 * Locks of finished workflows are retired: the entry is dropped when the
 * outermost holder releases it, and a caller that acquired a dropped lock
 * retries with the current one.
 */
public class WorkflowLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<String> retired = ConcurrentHashMap.newKeySet();

    /**
     * Runs an action while holding the workflow's lock.
     */
    public <T> T withLock(String workflowId, Supplier<T> action) {
        ReentrantLock lock = acquire(workflowId);
        try {
            return action.get();
        } finally {
            if (lock.getHoldCount() == 1 && retired.remove(workflowId)) {
                locks.remove(workflowId, lock);
            }
            lock.unlock();
        }
    }

    /**
     * Runs an action while holding the workflow's lock.
     */
    public void runLocked(String workflowId, Runnable action) {
        withLock(workflowId, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Drops the workflow's lock once it is next fully released. Later calls for
     * the workflow get a fresh lock.
     */
    public void retire(String workflowId) {
        retired.add(workflowId);
    }

    public boolean isHeldByCurrentThread(String workflowId) {
        ReentrantLock lock = locks.get(workflowId);
        return lock != null && lock.isHeldByCurrentThread();
    }

    public int size() {
        return locks.size();
    }

    private ReentrantLock acquire(String workflowId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(workflowId, id -> new ReentrantLock());
            lock.lock();
            if (locks.get(workflowId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }
}
