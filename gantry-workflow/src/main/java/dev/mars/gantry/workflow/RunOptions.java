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

import dev.mars.gantry.artifact.ArtifactStore;
import dev.mars.gantry.artifact.LocalArtifactStore;
import dev.mars.gantry.config.GantryConfiguration;
import dev.mars.gantry.sandbox.LocalProcessSandbox;
import dev.mars.gantry.sandbox.Sandbox;
import dev.mars.gantry.secrets.SecretMasker;
import dev.mars.gantry.secrets.SecretResolver;
import dev.mars.gantry.workflow.run.RunListener;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Everything a single run needs besides the workflow itself: collaborators, limits and
 * run-level variables.
 */
public class RunOptions {

    private final String runId;
    private final int maxParallelJobs;
    private final Duration defaultStepTimeout;
    private final Map<String, String> ambientEnv;
    private final Map<String, String> pipelineVariables;
    private final SecretResolver secretResolver;
    private final Sandbox sandbox;
    private final ArtifactStore artifactStore;
    private final boolean failFast;
    private final List<RunListener> listeners;
    private final Path workingDirectory;
    private final Duration retryDelay;
    private final Duration pollInterval;
    private final Duration terminateGrace;
    private final String logMask;

    private RunOptions(Builder builder) {
        this.runId = builder.runId != null ? builder.runId : UUID.randomUUID().toString();
        if (builder.maxParallelJobs < 1) {
            throw new IllegalArgumentException("maxParallelJobs must be at least 1");
        }
        this.maxParallelJobs = builder.maxParallelJobs;
        this.defaultStepTimeout = Objects.requireNonNull(builder.defaultStepTimeout, "Default step timeout cannot be null");
        this.ambientEnv = Collections.unmodifiableMap(new LinkedHashMap<>(builder.ambientEnv));
        this.pipelineVariables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.pipelineVariables));
        this.secretResolver = builder.secretResolver != null ? builder.secretResolver : SecretResolver.empty();
        this.sandbox = builder.sandbox != null ? builder.sandbox : new LocalProcessSandbox();
        this.artifactStore = builder.artifactStore;
        this.failFast = builder.failFast;
        this.listeners = List.copyOf(builder.listeners);
        this.workingDirectory = builder.workingDirectory;
        this.retryDelay = Objects.requireNonNull(builder.retryDelay, "Retry delay cannot be null");
        this.pollInterval = Objects.requireNonNull(builder.pollInterval, "Poll interval cannot be null");
        this.terminateGrace = Objects.requireNonNull(builder.terminateGrace, "Terminate grace cannot be null");
        this.logMask = builder.logMask != null ? builder.logMask : SecretMasker.DEFAULT_MASK;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Run defaults taken from configuration: limits, timeouts, sandbox and a local
     * artifact store under the configured directory.
     */
    public static Builder fromConfiguration(GantryConfiguration configuration) {
        return new Builder()
                .maxParallelJobs(configuration.getMaxParallelJobs())
                .defaultStepTimeout(configuration.getDefaultStepTimeout())
                .retryDelay(Duration.ofMillis(configuration.getRetryDelayMs()))
                .pollInterval(Duration.ofMillis(configuration.getSandboxPollIntervalMs()))
                .terminateGrace(Duration.ofMillis(configuration.getSandboxTerminateGraceMs()))
                .logMask(configuration.getLogMask())
                .sandbox(new LocalProcessSandbox(configuration))
                .artifactStore(new LocalArtifactStore(configuration));
    }

    public String getRunId() {
        return runId;
    }

    public int getMaxParallelJobs() {
        return maxParallelJobs;
    }

    public Duration getDefaultStepTimeout() {
        return defaultStepTimeout;
    }

    public Map<String, String> getAmbientEnv() {
        return ambientEnv;
    }

    public Map<String, String> getPipelineVariables() {
        return pipelineVariables;
    }

    public SecretResolver getSecretResolver() {
        return secretResolver;
    }

    public Sandbox getSandbox() {
        return sandbox;
    }

    /**
     * Store used by artifact actions; {@code null} when none is configured.
     */
    public ArtifactStore getArtifactStore() {
        return artifactStore;
    }

    public boolean isFailFast() {
        return failFast;
    }

    public List<RunListener> getListeners() {
        return listeners;
    }

    /**
     * Base directory for steps; {@code null} means the executor's working directory.
     */
    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getTerminateGrace() {
        return terminateGrace;
    }

    public String getLogMask() {
        return logMask;
    }

    @Override
    public String toString() {
        return "RunOptions{" +
               "runId='" + runId + '\'' +
               ", maxParallelJobs=" + maxParallelJobs +
               ", defaultStepTimeout=" + defaultStepTimeout +
               ", failFast=" + failFast +
               ", pipelineVariables=" + pipelineVariables.keySet() +
               '}';
    }

    public static class Builder {
        private String runId;
        private int maxParallelJobs = 4;
        private Duration defaultStepTimeout = Duration.ofMinutes(360);
        private Map<String, String> ambientEnv = System.getenv();
        private Map<String, String> pipelineVariables = Map.of();
        private SecretResolver secretResolver;
        private Sandbox sandbox;
        private ArtifactStore artifactStore;
        private boolean failFast;
        private final List<RunListener> listeners = new ArrayList<>();
        private Path workingDirectory;
        private Duration retryDelay = Duration.ofSeconds(1);
        private Duration pollInterval = Duration.ofMillis(50);
        private Duration terminateGrace = Duration.ofSeconds(2);
        private String logMask;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder maxParallelJobs(int maxParallelJobs) {
            this.maxParallelJobs = maxParallelJobs;
            return this;
        }

        public Builder defaultStepTimeout(Duration defaultStepTimeout) {
            this.defaultStepTimeout = defaultStepTimeout;
            return this;
        }

        public Builder ambientEnv(Map<String, String> ambientEnv) {
            this.ambientEnv = ambientEnv != null ? ambientEnv : Map.of();
            return this;
        }

        public Builder pipelineVariables(Map<String, String> pipelineVariables) {
            this.pipelineVariables = pipelineVariables != null ? pipelineVariables : Map.of();
            return this;
        }

        /**
         * Pipeline variables in {@code KEY1=val1; KEY2=val2} form.
         */
        public Builder pipelineVariables(String pipelineVariables) {
            this.pipelineVariables = PipelineVariables.parse(pipelineVariables);
            return this;
        }

        public Builder secretResolver(SecretResolver secretResolver) {
            this.secretResolver = secretResolver;
            return this;
        }

        public Builder sandbox(Sandbox sandbox) {
            this.sandbox = sandbox;
            return this;
        }

        public Builder artifactStore(ArtifactStore artifactStore) {
            this.artifactStore = artifactStore;
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public Builder listener(RunListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder terminateGrace(Duration terminateGrace) {
            this.terminateGrace = terminateGrace;
            return this;
        }

        public Builder logMask(String logMask) {
            this.logMask = logMask;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(this);
        }
    }
}
