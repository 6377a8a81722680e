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

package dev.mars.gantry.core;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation signal threaded through a run, its job instances and their
 * in-flight sandbox processes.
 *
 * <p>Tokens form a tree: cancelling a parent cancels every child created from it, while
 * cancelling a child leaves the parent untouched. Callbacks registered with
 * {@link #onCancel(Runnable)} run exactly once, on the cancelling thread, or immediately
 * if the token is already cancelled.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Lock lock = new ReentrantLock();
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile String reason;

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Creates a token that is cancelled whenever this one is.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        onCancel(() -> child.cancel(reason));
        return child;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }

    /**
     * Cancels the token. Returns {@code false} if it was already cancelled, in which
     * case no callback runs again.
     */
    public boolean cancel(String reason) {
        List<Runnable> toRun;
        lock.lock();
        try {
            if (!cancelled.compareAndSet(false, true)) {
                return false;
            }
            this.reason = reason;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        } finally {
            lock.unlock();
        }

        for (Runnable callback : toRun) {
            runCallback(callback);
        }
        return true;
    }

    public void onCancel(Runnable callback) {
        lock.lock();
        try {
            if (!cancelled.get()) {
                callbacks.add(callback);
                return;
            }
        } finally {
            lock.unlock();
        }
        runCallback(callback);
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.warn("Cancellation callback failed: {}", e.getMessage());
            logger.debug("Cancellation callback failure details", e);
        }
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + cancelled.get() + ", reason='" + reason + "'}";
    }
}
