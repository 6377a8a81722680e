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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One step of a job: either a shell command ({@code run}) or a delegated action
 * ({@code uses}) with its {@code with} inputs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class StepDefinition {

    private final int index;
    private final String id;
    private final String name;
    private final String run;
    private final String uses;
    private final Map<String, String> with;
    private final Map<String, String> env;
    private final String condition;
    private final boolean continueOnError;
    private final Duration timeout;
    private final String workingDirectory;
    private final int retries;

    private StepDefinition(Builder builder) {
        if ((builder.run == null) == (builder.uses == null)) {
            throw new IllegalArgumentException("A step must declare exactly one of 'run' or 'uses'");
        }
        this.index = builder.index;
        this.id = builder.id;
        this.name = builder.name;
        this.run = builder.run;
        this.uses = builder.uses;
        this.with = Collections.unmodifiableMap(new LinkedHashMap<>(builder.with));
        this.env = Collections.unmodifiableMap(new LinkedHashMap<>(builder.env));
        this.condition = builder.condition;
        this.continueOnError = builder.continueOnError;
        this.timeout = builder.timeout;
        this.workingDirectory = builder.workingDirectory;
        this.retries = Math.max(0, builder.retries);
    }

    /**
     * Zero-based position within the job.
     */
    public int getIndex() {
        return index;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getRun() {
        return run;
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

    public Map<String, String> getEnv() {
        return env;
    }

    public String getCondition() {
        return condition;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public int getRetries() {
        return retries;
    }

    /**
     * Name used in logs and reports: the declared name, else the id, else the action
     * reference or the first line of the command.
     */
    public String getDisplayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        if (id != null) {
            return id;
        }
        if (uses != null) {
            return uses;
        }
        String firstLine = run.strip().split("\\R", 2)[0];
        return firstLine.isEmpty() ? "step " + (index + 1) : firstLine;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepDefinition that = (StepDefinition) o;
        return index == that.index &&
               continueOnError == that.continueOnError &&
               retries == that.retries &&
               Objects.equals(id, that.id) &&
               Objects.equals(name, that.name) &&
               Objects.equals(run, that.run) &&
               Objects.equals(uses, that.uses) &&
               Objects.equals(with, that.with) &&
               Objects.equals(env, that.env) &&
               Objects.equals(condition, that.condition) &&
               Objects.equals(timeout, that.timeout) &&
               Objects.equals(workingDirectory, that.workingDirectory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, id, name, run, uses, with, env, condition, continueOnError,
                timeout, workingDirectory, retries);
    }

    @Override
    public String toString() {
        return "StepDefinition{" +
               "index=" + index +
               ", id='" + id + '\'' +
               ", name='" + getDisplayName() + '\'' +
               (uses != null ? ", uses='" + uses + '\'' : "") +
               ", continueOnError=" + continueOnError +
               ", retries=" + retries +
               '}';
    }

    public static class Builder {
        private int index;
        private String id;
        private String name;
        private String run;
        private String uses;
        private Map<String, String> with = new LinkedHashMap<>();
        private Map<String, String> env = new LinkedHashMap<>();
        private String condition;
        private boolean continueOnError;
        private Duration timeout;
        private String workingDirectory;
        private int retries;

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder run(String run) {
            this.run = run;
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

        public Builder env(Map<String, String> env) {
            this.env = env != null ? new LinkedHashMap<>(env) : new LinkedHashMap<>();
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder workingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(this);
        }
    }
}
