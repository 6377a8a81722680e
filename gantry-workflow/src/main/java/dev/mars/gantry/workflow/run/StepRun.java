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

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final state of one step, as reported in a {@link WorkflowRun}.
 */
public final class StepRun {

    private final int index;
    private final String id;
    private final String name;
    private final ExecutionStatus status;
    private final ExecutionStatus conclusion;
    private final Map<String, String> outputs;
    private final Integer exitCode;
    private final int attempts;
    private final ErrorDetail error;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final List<LogLine> log;

    StepRun(int index, String id, String name, ExecutionStatus status, ExecutionStatus conclusion,
            Map<String, String> outputs, Integer exitCode, int attempts, ErrorDetail error,
            Instant startedAt, Instant finishedAt, List<LogLine> log) {
        this.index = index;
        this.id = id;
        this.name = name;
        this.status = status;
        this.conclusion = conclusion;
        this.outputs = Map.copyOf(outputs);
        this.exitCode = exitCode;
        this.attempts = attempts;
        this.error = error;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.log = List.copyOf(log);
    }

    public int getIndex() {
        return index;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public ExecutionStatus getConclusion() {
        return conclusion;
    }

    public Map<String, String> getOutputs() {
        return outputs;
    }

    public Integer getExitCode() {
        return exitCode;
    }

    public int getAttempts() {
        return attempts;
    }

    public ErrorDetail getError() {
        return error;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public List<LogLine> getLog() {
        return log;
    }

    @Override
    public String toString() {
        return "StepRun{" + name + ", status=" + status + ", conclusion=" + conclusion + '}';
    }
}
