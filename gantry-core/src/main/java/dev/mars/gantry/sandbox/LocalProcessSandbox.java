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

package dev.mars.gantry.sandbox;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.mars.gantry.config.GantryConfiguration;

/**
 * Runs {@code run} steps as child processes of the executor through a local shell.
 *
 * <p>This adapter provides no isolation beyond a separate process. It exists so that
 * workflows can be executed end to end without a container runtime. Action references
 * ({@code uses}) are not supported and fail the step.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class LocalProcessSandbox implements Sandbox {

    private static final Logger logger = LoggerFactory.getLogger(LocalProcessSandbox.class);

    private final String shell;
    private final long terminateGraceMs;

    public LocalProcessSandbox() {
        this(new GantryConfiguration());
    }

    public LocalProcessSandbox(GantryConfiguration configuration) {
        this(configuration.getSandboxShell(), configuration.getSandboxTerminateGraceMs());
    }

    public LocalProcessSandbox(String shell, long terminateGraceMs) {
        if (shell == null || shell.isBlank()) {
            throw new IllegalArgumentException("Shell cannot be empty");
        }
        this.shell = shell;
        this.terminateGraceMs = Math.max(0, terminateGraceMs);
    }

    @Override
    public SandboxProcess start(SandboxRequest request) throws SandboxException {
        if (request.isAction()) {
            throw new SandboxException("Action '" + request.getUses() + "' is not supported by the local sandbox");
        }

        List<String> command = new ArrayList<>();
        command.add(shell);
        command.add("-c");
        command.add(request.getCommand());

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.environment().clear();
        pb.environment().putAll(request.getEnvironment());
        if (request.getWorkingDirectory() != null) {
            pb.directory(request.getWorkingDirectory().toFile());
        }

        try {
            Process process = pb.start();
            // No stdin for steps
            process.getOutputStream().close();
            logger.debug("Started step '{}' as pid {}", request.getStepName(), process.pid());
            return new LocalSandboxProcess(process, terminateGraceMs);
        } catch (IOException e) {
            throw new SandboxException("Failed to start step '" + request.getStepName() + "': " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "LocalProcessSandbox{shell='" + shell + "', terminateGraceMs=" + terminateGraceMs + '}';
    }

    static final class LocalSandboxProcess implements SandboxProcess {

        private final Process process;
        private final long terminateGraceMs;

        LocalSandboxProcess(Process process, long terminateGraceMs) {
            this.process = process;
            this.terminateGraceMs = terminateGraceMs;
        }

        @Override
        public InputStream getStdout() {
            return process.getInputStream();
        }

        @Override
        public InputStream getStderr() {
            return process.getErrorStream();
        }

        @Override
        public boolean waitFor(Duration timeout) throws InterruptedException {
            return process.waitFor(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
        }

        @Override
        public int exitCode() {
            try {
                return process.exitValue();
            } catch (IllegalThreadStateException e) {
                throw new IllegalStateException("Process " + process.pid() + " has not exited", e);
            }
        }

        @Override
        public void terminate() {
            if (!process.isAlive()) {
                return;
            }
            logger.debug("Terminating pid {}", process.pid());
            process.descendants().forEach(ProcessHandle::destroy);
            process.destroy();
            CompletableFuture.runAsync(this::forceIfAlive,
                    CompletableFuture.delayedExecutor(terminateGraceMs, TimeUnit.MILLISECONDS));
        }

        private void forceIfAlive() {
            if (process.isAlive()) {
                logger.warn("Process {} ignored termination request, killing it", process.pid());
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        }
    }
}
