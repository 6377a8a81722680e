/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.gantry.workflow.run;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks which job instance currently holds each concurrency group. One registry is
 * shared by every run of an engine, so groups also apply across runs.
 *
 * <p>With cancel-in-progress the newcomer takes the group and the previous holder is
 * cancelled before {@link #acquire} returns. Otherwise the newcomer waits and its
 * scheduler is woken when the group is released.</p>
 */
public class ConcurrencyGroupRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConcurrencyGroupRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Holder> holders = new HashMap<>();
    private final Map<String, Set<Holder>> waiters = new HashMap<>();

    /**
     * Tries to take {@code group} for an instance.
     *
     * @return {@code true} if the instance now holds the group
     */
    boolean acquire(String group, JobScheduler scheduler, String instanceId, boolean cancelInProgress) {
        Holder candidate = new Holder(scheduler, instanceId);
        Holder superseded;

        lock.lock();
        try {
            Holder current = holders.get(group);
            if (current == null || current.equals(candidate)) {
                holders.put(group, candidate);
                removeWaiter(group, candidate);
                return true;
            }
            if (!cancelInProgress) {
                waiters.computeIfAbsent(group, key -> new LinkedHashSet<>()).add(candidate);
                logger.debug("'{}' waits for concurrency group '{}' held by '{}'", instanceId, group, current.instanceId);
                return false;
            }
            holders.put(group, candidate);
            removeWaiter(group, candidate);
            superseded = current;
        } finally {
            lock.unlock();
        }

        logger.info("'{}' supersedes '{}' in concurrency group '{}'", instanceId, superseded.instanceId, group);
        superseded.scheduler.cancelInstance(superseded.instanceId,
                "Superseded by '" + instanceId + "' in concurrency group '" + group + "'");
        return true;
    }

    /**
     * Releases {@code group} if the instance holds it, and forgets the instance as a
     * waiter. Safe to call more than once.
     */
    void release(String group, JobScheduler scheduler, String instanceId) {
        Holder holder = new Holder(scheduler, instanceId);
        List<Holder> toWake = new ArrayList<>();

        lock.lock();
        try {
            removeWaiter(group, holder);
            if (holder.equals(holders.get(group))) {
                holders.remove(group);
                Set<Holder> waiting = waiters.get(group);
                if (waiting != null) {
                    toWake.addAll(waiting);
                }
            }
        } finally {
            lock.unlock();
        }

        for (Holder waiter : toWake) {
            waiter.scheduler.wake();
        }
    }

    /**
     * Instance id of the current holder, or {@code null}.
     */
    public String holderOf(String group) {
        lock.lock();
        try {
            Holder holder = holders.get(group);
            return holder != null ? holder.instanceId : null;
        } finally {
            lock.unlock();
        }
    }

    private void removeWaiter(String group, Holder holder) {
        Set<Holder> waiting = waiters.get(group);
        if (waiting != null) {
            waiting.remove(holder);
            if (waiting.isEmpty()) {
                waiters.remove(group);
            }
        }
    }

    private static final class Holder {
        final JobScheduler scheduler;
        final String instanceId;

        Holder(JobScheduler scheduler, String instanceId) {
            this.scheduler = scheduler;
            this.instanceId = instanceId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Holder that = (Holder) o;
            return scheduler == that.scheduler && instanceId.equals(that.instanceId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(System.identityHashCode(scheduler), instanceId);
        }
    }
}
