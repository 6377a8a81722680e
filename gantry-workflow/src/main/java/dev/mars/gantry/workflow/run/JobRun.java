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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final state of one job instance, as reported in a {@link WorkflowRun}.
 */
public final class JobRun {

    private final String instanceId;
    private final String jobId;
    private final Map<String, Object> matrix;
    private final ExecutionStatus status;
    private final ExecutionStatus conclusion;
    private final Map<String, String> outputs;
    private final ErrorDetail error;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final List<StepRun> steps;

    JobRun(String instanceId, String jobId, Map<String, Object> matrix, ExecutionStatus status,
           ExecutionStatus conclusion, Map<String, String> outputs, ErrorDetail error,
           Instant startedAt, Instant finishedAt, List<StepRun> steps) {
        this.instanceId = instanceId;
        this.jobId = jobId;
        this.matrix = Collections.unmodifiableMap(new LinkedHashMap<>(matrix));
        this.status = status;
        this.conclusion = conclusion;
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        this.error = error;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.steps = List.copyOf(steps);
    }

    public String getInstanceId() {
        return instanceId;
    }

    public String getJobId() {
        return jobId;
    }

    public Map<String, Object> getMatrix() {
        return matrix;
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

    public ErrorDetail getError() {
        return error;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public List<StepRun> getSteps() {
        return steps;
    }

    @Override
    public String toString() {
        return "JobRun{" + instanceId + ", status=" + status + ", conclusion=" + conclusion + '}';
    }
}
