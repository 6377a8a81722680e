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
import dev.mars.gantry.workflow.JobInstance;
import dev.mars.gantry.workflow.StepDefinition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run state of one job instance. Read-only to everyone but the owning task until it is
 * terminal, and read-only to everyone afterwards.
 */
public final class JobRecord {

    private final JobInstance instance;
    private final List<StepRecord> steps;

    private volatile ExecutionStatus status = ExecutionStatus.PENDING;
    private volatile ExecutionStatus conclusion;
    private volatile Map<String, String> outputs = Map.of();
    private volatile ErrorDetail error;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    JobRecord(JobInstance instance) {
        this.instance = instance;
        List<StepRecord> records = new ArrayList<>();
        for (StepDefinition step : instance.getJob().getSteps()) {
            records.add(new StepRecord(step));
        }
        this.steps = Collections.unmodifiableList(records);
    }

    public JobInstance getInstance() {
        return instance;
    }

    public String getInstanceId() {
        return instance.getId();
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    /**
     * Status after {@code continue-on-error}; this is what dependents see. {@code null}
     * until terminal.
     */
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

    public List<StepRecord> getSteps() {
        return steps;
    }

    public StepRecord getStep(int index) {
        return steps.get(index);
    }

    /**
     * The step with the given {@code id}, or {@code null}.
     */
    public StepRecord findStep(String stepId) {
        for (StepRecord step : steps) {
            if (stepId.equals(step.getStepId())) {
                return step;
            }
        }
        return null;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    void started(Instant at) {
        this.startedAt = at;
    }

    void finished(ExecutionStatus conclusion, Map<String, String> outputs, ErrorDetail error, Instant at) {
        this.conclusion = conclusion;
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        this.error = error;
        this.finishedAt = at;
    }

    JobRun snapshot() {
        List<StepRun> stepRuns = new ArrayList<>();
        for (StepRecord step : steps) {
            stepRuns.add(step.snapshot());
        }
        return new JobRun(instance.getId(), instance.getJobId(), instance.getMatrix(), status, conclusion,
                outputs, error, startedAt, finishedAt, stepRuns);
    }
}
