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

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything a sandbox needs to start one step: either a shell command or an opaque
 * action reference with its inputs, plus the fully merged environment.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class SandboxRequest {

    private final String stepName;
    private final String command;
    private final String uses;
    private final Map<String, String> with;
    private final Map<String, String> environment;
    private final Path workingDirectory;
    private final Duration timeout;

    private SandboxRequest(Builder builder) {
        this.stepName = builder.stepName;
        this.command = builder.command;
        this.uses = builder.uses;
        this.with = Collections.unmodifiableMap(new LinkedHashMap<>(builder.with));
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(builder.environment));
        this.workingDirectory = builder.workingDirectory;
        this.timeout = builder.timeout;
    }

    public String getStepName() {
        return stepName;
    }

    /**
     * Shell command for {@code run} steps, {@code null} for {@code uses} steps.
     */
    public String getCommand() {
        return command;
    }

    public String getUses() {
        return uses;
    }

    public boolean isAction() {
        return uses != null;
    }

    public Map<String, String> getWith() {
        return with;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    /**
     * Informational; the caller enforces the timeout.
     */
    public Duration getTimeout() {
        return timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "SandboxRequest{" +
                "stepName='" + stepName + '\'' +
                ", " + (uses != null ? "uses='" + uses + '\'' : "run") +
                ", workingDirectory=" + workingDirectory +
                ", timeout=" + timeout +
                '}';
    }

    public static class Builder {
        private String stepName;
        private String command;
        private String uses;
        private Map<String, String> with = new LinkedHashMap<>();
        private Map<String, String> environment = new LinkedHashMap<>();
        private Path workingDirectory;
        private Duration timeout;

        public Builder stepName(String stepName) {
            this.stepName = stepName;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder uses(String uses) {
            this.uses = uses;
            return this;
        }

        public Builder with(Map<String, String> with) {
            this.with = with != null ? new LinkedHashMap<>(with) : new LinkedHashMap<>();
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment != null ? new LinkedHashMap<>(environment) : new LinkedHashMap<>();
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public SandboxRequest build() {
            if ((command == null) == (uses == null)) {
                throw new IllegalArgumentException("Exactly one of command or uses must be set");
            }
            return new SandboxRequest(this);
        }
    }
}
