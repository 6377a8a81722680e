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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A job as declared in the workflow. A job with a matrix strategy expands into several
 * {@link JobInstance}s when the execution plan is built.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class JobDefinition {

    private final String id;
    private final String name;
    private final List<String> needs;
    private final String condition;
    private final List<StepDefinition> steps;
    private final Map<String, String> env;
    private final Map<String, String> outputs;
    private final MatrixStrategy strategy;
    private final String concurrencyGroup;
    private final boolean cancelInProgress;
    private final boolean continueOnError;
    private final Duration timeout;

    private JobDefinition(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Job id cannot be null");
        this.name = builder.name;
        this.needs = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(builder.needs)));
        this.condition = builder.condition;
        this.steps = List.copyOf(builder.steps);
        this.env = Collections.unmodifiableMap(new LinkedHashMap<>(builder.env));
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputs));
        this.strategy = builder.strategy;
        this.concurrencyGroup = builder.concurrencyGroup;
        this.cancelInProgress = builder.cancelInProgress;
        this.continueOnError = builder.continueOnError;
        this.timeout = builder.timeout;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return name != null && !name.isBlank() ? name : id;
    }

    public List<String> getNeeds() {
        return needs;
    }

    public String getCondition() {
        return condition;
    }

    public List<StepDefinition> getSteps() {
        return steps;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    /**
     * Output name to expression, evaluated when an instance of the job finishes.
     */
    public Map<String, String> getOutputs() {
        return outputs;
    }

    public MatrixStrategy getStrategy() {
        return strategy;
    }

    public boolean hasMatrix() {
        return strategy != null && strategy.hasMatrix();
    }

    /**
     * Concurrency group key; may contain {@code ${{ }}} expressions resolved per instance.
     */
    public String getConcurrencyGroup() {
        return concurrencyGroup;
    }

    public boolean isCancelInProgress() {
        return cancelInProgress;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobDefinition that = (JobDefinition) o;
        return cancelInProgress == that.cancelInProgress &&
               continueOnError == that.continueOnError &&
               Objects.equals(id, that.id) &&
               Objects.equals(name, that.name) &&
               Objects.equals(needs, that.needs) &&
               Objects.equals(condition, that.condition) &&
               Objects.equals(steps, that.steps) &&
               Objects.equals(env, that.env) &&
               Objects.equals(outputs, that.outputs) &&
               Objects.equals(strategy, that.strategy) &&
               Objects.equals(concurrencyGroup, that.concurrencyGroup) &&
               Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, needs, condition, steps, env, outputs, strategy,
                concurrencyGroup, cancelInProgress, continueOnError, timeout);
    }

    @Override
    public String toString() {
        return "JobDefinition{" +
               "id='" + id + '\'' +
               ", needs=" + needs +
               ", steps=" + steps.size() +
               ", matrix=" + (hasMatrix() ? strategy.getDimensions().keySet() : "none") +
               ", concurrencyGroup='" + concurrencyGroup + '\'' +
               ", continueOnError=" + continueOnError +
               ", timeout=" + timeout +
               '}';
    }

    public static class Builder {
        private final String id;
        private String name;
        private List<String> needs = new ArrayList<>();
        private String condition;
        private List<StepDefinition> steps = new ArrayList<>();
        private Map<String, String> env = new LinkedHashMap<>();
        private Map<String, String> outputs = new LinkedHashMap<>();
        private MatrixStrategy strategy;
        private String concurrencyGroup;
        private boolean cancelInProgress = true;
        private boolean continueOnError;
        private Duration timeout;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder needs(List<String> needs) {
            this.needs = needs != null ? new ArrayList<>(needs) : new ArrayList<>();
            return this;
        }

        public Builder needs(String... needs) {
            return needs(List.of(needs));
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder steps(List<StepDefinition> steps) {
            this.steps = steps != null ? new ArrayList<>(steps) : new ArrayList<>();
            return this;
        }

        public Builder step(StepDefinition step) {
            this.steps.add(step);
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env != null ? new LinkedHashMap<>(env) : new LinkedHashMap<>();
            return this;
        }

        public Builder outputs(Map<String, String> outputs) {
            this.outputs = outputs != null ? new LinkedHashMap<>(outputs) : new LinkedHashMap<>();
            return this;
        }

        public Builder strategy(MatrixStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder concurrency(String group, boolean cancelInProgress) {
            this.concurrencyGroup = group;
            this.cancelInProgress = cancelInProgress;
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

        public JobDefinition build() {
            return new JobDefinition(this);
        }
    }
}
