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

import dev.mars.gantry.core.ErrorDetail;
import dev.mars.gantry.core.ExecutionStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of running one step, including all attempts.
 */
public final class StepResult {

    private final ExecutionStatus status;
    private final ExecutionStatus conclusion;
    private final Integer exitCode;
    private final Map<String, String> outputs;
    private final ErrorDetail error;
    private final int attempts;
    private final List<LogLine> log;

    private StepResult(Builder builder) {
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        this.conclusion = builder.conclusion != null ? builder.conclusion : builder.status;
        this.exitCode = builder.exitCode;
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputs));
        this.error = builder.error;
        this.attempts = builder.attempts;
        this.log = List.copyOf(builder.log);
    }

    public static Builder builder(ExecutionStatus status) {
        return new Builder(status);
    }

    static StepResult skipped() {
        return builder(ExecutionStatus.SKIPPED).build();
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public ExecutionStatus getConclusion() {
        return conclusion;
    }

    public Integer getExitCode() {
        return exitCode;
    }

    public Map<String, String> getOutputs() {
        return outputs;
    }

    public ErrorDetail getError() {
        return error;
    }

    public int getAttempts() {
        return attempts;
    }

    public List<LogLine> getLog() {
        return log;
    }

    public String getStdout() {
        return join(LogLine.Stream.STDOUT);
    }

    public String getStderr() {
        return join(LogLine.Stream.STDERR);
    }

    private String join(LogLine.Stream stream) {
        StringBuilder sb = new StringBuilder();
        for (LogLine line : log) {
            if (line.getStream() == stream) {
                sb.append(line.getText()).append('\n');
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "StepResult{status=" + status + ", conclusion=" + conclusion + ", exitCode=" + exitCode
                + ", attempts=" + attempts + ", error=" + error + '}';
    }

    public static class Builder {
        private final ExecutionStatus status;
        private ExecutionStatus conclusion;
        private Integer exitCode;
        private Map<String, String> outputs = Map.of();
        private ErrorDetail error;
        private int attempts;
        private List<LogLine> log = new ArrayList<>();

        private Builder(ExecutionStatus status) {
            this.status = status;
        }

        public Builder conclusion(ExecutionStatus conclusion) {
            this.conclusion = conclusion;
            return this;
        }

        public Builder exitCode(Integer exitCode) {
            this.exitCode = exitCode;
            return this;
        }

        public Builder outputs(Map<String, String> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder error(ErrorDetail error) {
            this.error = error;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder log(List<LogLine> log) {
            this.log = log;
            return this;
        }

        public StepResult build() {
            return new StepResult(this);
        }
    }
}
