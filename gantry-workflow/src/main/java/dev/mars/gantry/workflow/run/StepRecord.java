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
import dev.mars.gantry.workflow.StepDefinition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Run state of one step of one job instance. Status fields are written only through
 * {@link RunContext}; the log is appended by the step's output readers.
 */
public final class StepRecord {

    private final StepDefinition step;
    private final Queue<LogLine> log = new ConcurrentLinkedQueue<>();

    private volatile ExecutionStatus status = ExecutionStatus.PENDING;
    private volatile ExecutionStatus conclusion;
    private volatile Map<String, String> outputs = Map.of();
    private volatile Integer exitCode;
    private volatile int attempts;
    private volatile ErrorDetail error;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    StepRecord(StepDefinition step) {
        this.step = step;
    }

    public StepDefinition getStep() {
        return step;
    }

    public int getIndex() {
        return step.getIndex();
    }

    public String getStepId() {
        return step.getId();
    }

    public String getDisplayName() {
        return step.getDisplayName();
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    /**
     * Status after {@code continue-on-error}; {@code null} until terminal.
     */
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

    void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    void started(Instant at) {
        this.startedAt = at;
    }

    void finished(ExecutionStatus conclusion, Map<String, String> outputs, Integer exitCode,
                  int attempts, ErrorDetail error, Instant at) {
        this.conclusion = conclusion;
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        this.exitCode = exitCode;
        this.attempts = attempts;
        this.error = error;
        this.finishedAt = at;
    }

    void append(LogLine line) {
        log.add(line);
    }

    StepRun snapshot() {
        return new StepRun(step.getIndex(), step.getId(), step.getDisplayName(), status, conclusion,
                outputs, exitCode, attempts, error, startedAt, finishedAt, new ArrayList<>(log));
    }
}
