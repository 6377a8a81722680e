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


package dev.mars.gantry.workflow;

import dev.mars.gantry.sandbox.Sandbox;
import dev.mars.gantry.sandbox.SandboxException;
import dev.mars.gantry.sandbox.SandboxProcess;
import dev.mars.gantry.sandbox.SandboxRequest;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test implementation of Sandbox for use in unit tests.
 * This is a real implementation (not a mock) that plays back scripted processes.
 *
 * <p>Commands without a script succeed immediately with no output.</p>
 */
public class ScriptedSandbox implements Sandbox {

    static final int TERMINATED_EXIT_CODE = 143;

    private final Map<String, Script> scripts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> starts = new ConcurrentHashMap<>();
    private final List<SandboxRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger terminateCount = new AtomicInteger();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();
    private volatile String unavailableMessage;

    /**
     * Configure a command to print the given lines and exit with the given code.
     */
    public ScriptedSandbox respond(String command, int exitCode, String... stdout) {
        scripts.put(command, new Script(exitCode, List.of(stdout), List.of(), null, 0, false));
        return this;
    }

    /**
     * Configure a command to print to stderr and exit with the given code.
     */
    public ScriptedSandbox respondOnStderr(String command, int exitCode, String... stderr) {
        scripts.put(command, new Script(exitCode, List.of(), List.of(stderr), null, 0, false));
        return this;
    }

    /**
     * Configure a command to run for a while before exiting successfully.
     */
    public ScriptedSandbox sleep(String command, Duration duration) {
        scripts.put(command, new Script(0, List.of(), List.of(), duration, 0, false));
        return this;
    }

    /**
     * Configure a command that never exits until it is terminated.
     */
    public ScriptedSandbox hang(String command, String... stdout) {
        scripts.put(command, new Script(0, List.of(stdout), List.of(), null, 0, true));
        return this;
    }

    /**
     * Configure a command to exit with code 1 on its first {@code attempts} starts and
     * succeed afterwards.
     */
    public ScriptedSandbox failFirst(String command, int attempts) {
        scripts.put(command, new Script(0, List.of(), List.of(), null, attempts, false));
        return this;
    }

    /**
     * Configure the sandbox to refuse every start.
     */
    public ScriptedSandbox simulateUnavailable(String message) {
        this.unavailableMessage = message;
        return this;
    }

    @Override
    public SandboxProcess start(SandboxRequest request) throws SandboxException {
        if (unavailableMessage != null) {
            throw new SandboxException(unavailableMessage);
        }
        requests.add(request);
        String key = request.isAction() ? request.getUses() : request.getCommand().trim();
        int attempt = starts.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        Script script = scripts.getOrDefault(key, Script.SUCCESS);

        int exitCode = attempt <= script.failingAttempts ? 1 : script.exitCode;
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
        return new ScriptedProcess(script, exitCode);
    }

    public List<SandboxRequest> getRequests() {
        return List.copyOf(requests);
    }

    public int getStartCount(String command) {
        AtomicInteger count = starts.get(command);
        return count != null ? count.get() : 0;
    }

    public int getTerminateCount() {
        return terminateCount.get();
    }

    public int getMaxRunning() {
        return maxRunning.get();
    }

    private static final class Script {
        static final Script SUCCESS = new Script(0, List.of(), List.of(), null, 0, false);

        final int exitCode;
        final List<String> stdout;
        final List<String> stderr;
        final Duration duration;
        final int failingAttempts;
        final boolean hang;

        Script(int exitCode, List<String> stdout, List<String> stderr, Duration duration,
               int failingAttempts, boolean hang) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderr = stderr;
            this.duration = duration;
            this.failingAttempts = failingAttempts;
            this.hang = hang;
        }
    }

    private final class ScriptedProcess implements SandboxProcess {
        private final CountDownLatch exited = new CountDownLatch(1);
        private final AtomicBoolean finished = new AtomicBoolean(false);
        private final int exitCode;
        private final InputStream stdout;
        private final InputStream stderr;
        private volatile boolean terminated;

        ScriptedProcess(Script script, int exitCode) {
            this.exitCode = exitCode;
            this.stdout = new SequenceInputStream(lines(script.stdout), new OpenUntilExit());
            this.stderr = new SequenceInputStream(lines(script.stderr), new OpenUntilExit());
            if (script.duration != null) {
                CompletableFuture.runAsync(this::exit,
                        CompletableFuture.delayedExecutor(script.duration.toMillis(), TimeUnit.MILLISECONDS));
            } else if (!script.hang) {
                exit();
            }
        }

        @Override
        public InputStream getStdout() {
            return stdout;
        }

        @Override
        public InputStream getStderr() {
            return stderr;
        }

        @Override
        public boolean waitFor(Duration timeout) throws InterruptedException {
            return exited.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int exitCode() {
            if (exited.getCount() > 0) {
                throw new IllegalStateException("Process is still running");
            }
            return terminated ? TERMINATED_EXIT_CODE : exitCode;
        }

        @Override
        public void terminate() {
            terminateCount.incrementAndGet();
            exit(true);
        }

        private void exit() {
            exit(false);
        }

        private void exit(boolean byTerminate) {
            if (finished.compareAndSet(false, true)) {
                terminated = byTerminate;
                running.decrementAndGet();
                exited.countDown();
            }
        }

        private InputStream lines(List<String> lines) {
            StringBuilder text = new StringBuilder();
            for (String line : lines) {
                text.append(line).append('\n');
            }
            return new ByteArrayInputStream(text.toString().getBytes(StandardCharsets.UTF_8));
        }

        /**
         * Reaches end of stream once the process has exited.
         */
        private final class OpenUntilExit extends InputStream {
            @Override
            public int read() {
                try {
                    exited.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return -1;
            }
        }
    }
}
