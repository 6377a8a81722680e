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
import dev.mars.gantry.core.ErrorKind;
import dev.mars.gantry.core.ExecutionStatus;
import dev.mars.gantry.core.exceptions.InvalidTransitionException;
import dev.mars.gantry.workflow.ExecutionPlan;
import dev.mars.gantry.workflow.JobInstance;
import dev.mars.gantry.workflow.MatrixStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Status and outputs of every job instance and step of one run.
 *
 * <p>All status transitions go through a single lock, which also guards admission, so
 * the running count used for admission can never be stale. A transition out of a
 * terminal state is refused: the {@code try}/{@code finish} methods return
 * {@code false} when the record is already terminal and throw
 * {@link InvalidTransitionException} for any other illegal move.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class RunContext {

    private static final Logger logger = LoggerFactory.getLogger(RunContext.class);

    private final String runId;
    private final ExecutionPlan plan;
    private final Map<String, JobRecord> jobs;
    private final List<RunListener> listeners;
    private final ReentrantLock lock = new ReentrantLock();
    private final Instant startTime = Instant.now();

    public RunContext(String runId, ExecutionPlan plan, List<RunListener> listeners) {
        this.runId = Objects.requireNonNull(runId, "Run ID cannot be null");
        this.plan = Objects.requireNonNull(plan, "Execution plan cannot be null");
        this.listeners = listeners != null ? List.copyOf(listeners) : List.of();

        Map<String, JobRecord> records = new LinkedHashMap<>();
        for (JobInstance instance : plan.getInstances()) {
            records.put(instance.getId(), new JobRecord(instance));
        }
        this.jobs = Collections.unmodifiableMap(records);
    }

    public String getRunId() {
        return runId;
    }

    public ExecutionPlan getPlan() {
        return plan;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public JobRecord getJob(String instanceId) {
        JobRecord record = jobs.get(instanceId);
        if (record == null) {
            throw new IllegalArgumentException("Unknown job instance: " + instanceId);
        }
        return record;
    }

    /**
     * All records in plan order.
     */
    public Collection<JobRecord> getJobs() {
        return jobs.values();
    }

    public Set<String> terminalInstanceIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (JobRecord record : jobs.values()) {
            if (record.isTerminal()) {
                ids.add(record.getInstanceId());
            }
        }
        return ids;
    }

    public boolean isComplete() {
        for (JobRecord record : jobs.values()) {
            if (!record.isTerminal()) {
                return false;
            }
        }
        return true;
    }

    public int runningCount() {
        lock.lock();
        try {
            int count = 0;
            for (JobRecord record : jobs.values()) {
                if (record.getStatus() == ExecutionStatus.RUNNING) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    public boolean transitionJob(String instanceId, ExecutionStatus to) {
        lock.lock();
        try {
            JobRecord record = getJob(instanceId);
            if (!move(instanceId, record.getStatus(), to)) {
                return false;
            }
            apply(record, to);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves a READY instance to RUNNING if the run-level limit and the job's
     * {@code max-parallel} both leave room.
     *
     * @return {@code false} if there is no capacity or the instance is no longer READY
     */
    public boolean tryAdmit(String instanceId, int maxParallelJobs) {
        lock.lock();
        try {
            JobRecord record = getJob(instanceId);
            if (record.getStatus() != ExecutionStatus.READY || !hasCapacity(record, maxParallelJobs)) {
                return false;
            }
            apply(record, ExecutionStatus.RUNNING);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasCapacity(String instanceId, int maxParallelJobs) {
        lock.lock();
        try {
            return hasCapacity(getJob(instanceId), maxParallelJobs);
        } finally {
            lock.unlock();
        }
    }

    private boolean hasCapacity(JobRecord record, int maxParallelJobs) {
        int running = 0;
        int runningSiblings = 0;
        String jobId = record.getInstance().getJobId();
        for (JobRecord other : jobs.values()) {
            if (other.getStatus() == ExecutionStatus.RUNNING) {
                running++;
                if (other.getInstance().getJobId().equals(jobId)) {
                    runningSiblings++;
                }
            }
        }
        if (running >= maxParallelJobs) {
            return false;
        }
        MatrixStrategy strategy = record.getInstance().getJob().getStrategy();
        Integer maxParallel = strategy != null ? strategy.getMaxParallel() : null;
        return maxParallel == null || runningSiblings < maxParallel;
    }

    /**
     * Publishes the terminal state of an instance.
     *
     * @return {@code false} if the instance was already terminal
     */
    public boolean finishJob(String instanceId, ExecutionStatus status, ExecutionStatus conclusion,
                             Map<String, String> outputs, ErrorDetail error) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        lock.lock();
        try {
            JobRecord record = getJob(instanceId);
            if (!move(instanceId, record.getStatus(), status)) {
                return false;
            }
            record.finished(conclusion, outputs, error, Instant.now());
            apply(record, status);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the steps of an instance that will not run them: a running step becomes
     * CANCELLED, a pending one SKIPPED.
     */
    public void closeSteps(String instanceId) {
        lock.lock();
        try {
            for (StepRecord step : getJob(instanceId).getSteps()) {
                if (step.getStatus() == ExecutionStatus.RUNNING) {
                    step.finished(ExecutionStatus.CANCELLED, step.getOutputs(), null, step.getAttempts(),
                            ErrorDetail.of(ErrorKind.CANCELLED, "The job was cancelled"),
                            Instant.now());
                    applyStep(instanceId, step, ExecutionStatus.CANCELLED);
                } else if (step.getStatus() == ExecutionStatus.PENDING) {
                    step.finished(ExecutionStatus.SKIPPED, Map.of(), null, 0, null, Instant.now());
                    applyStep(instanceId, step, ExecutionStatus.SKIPPED);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code false} if the step was already closed
     */
    public boolean startStep(String instanceId, int stepIndex) {
        lock.lock();
        try {
            StepRecord step = getJob(instanceId).getStep(stepIndex);
            if (!move(instanceId + "#" + stepIndex, step.getStatus(), ExecutionStatus.RUNNING)) {
                return false;
            }
            step.started(Instant.now());
            applyStep(instanceId, step, ExecutionStatus.RUNNING);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code false} if the step was already terminal
     */
    public boolean finishStep(String instanceId, int stepIndex, StepResult result) {
        lock.lock();
        try {
            StepRecord step = getJob(instanceId).getStep(stepIndex);
            if (!move(instanceId + "#" + stepIndex, step.getStatus(), result.getStatus())) {
                return false;
            }
            step.finished(result.getConclusion(), result.getOutputs(), result.getExitCode(),
                    result.getAttempts(), result.getError(), Instant.now());
            applyStep(instanceId, step, result.getStatus());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void appendLog(String instanceId, int stepIndex, LogLine line) {
        getJob(instanceId).getStep(stepIndex).append(line);
        for (RunListener listener : listeners) {
            try {
                listener.onLogLine(runId, instanceId, stepIndex, line);
            } catch (RuntimeException e) {
                logger.warn("Run listener failed on log line: {}", e.getMessage());
            }
        }
    }

    void notifyRunStarted() {
        for (RunListener listener : listeners) {
            try {
                listener.onRunStarted(runId, plan.getWorkflow().getName());
            } catch (RuntimeException e) {
                logger.warn("Run listener failed on run start: {}", e.getMessage());
            }
        }
    }

    void notifyRunCompleted(WorkflowRun run) {
        for (RunListener listener : listeners) {
            try {
                listener.onRunCompleted(run);
            } catch (RuntimeException e) {
                logger.warn("Run listener failed on run completion: {}", e.getMessage());
            }
        }
    }

    /**
     * Snapshots of every instance, in plan order.
     */
    public List<JobRun> snapshot() {
        lock.lock();
        try {
            List<JobRun> runs = new ArrayList<>();
            for (JobRecord record : jobs.values()) {
                runs.add(record.snapshot());
            }
            return runs;
        } finally {
            lock.unlock();
        }
    }

    private boolean move(String entityId, ExecutionStatus from, ExecutionStatus to) {
        if (from.isTerminal()) {
            return false;
        }
        if (!from.canTransitionTo(to)) {
            throw new InvalidTransitionException(entityId, from, to, from.getValidTransitions());
        }
        return true;
    }

    private void apply(JobRecord record, ExecutionStatus to) {
        ExecutionStatus from = record.getStatus();
        if (to == ExecutionStatus.RUNNING) {
            record.started(Instant.now());
        }
        record.setStatus(to);
        logger.debug("Job instance '{}' {} -> {}", record.getInstanceId(), from, to);
        for (RunListener listener : listeners) {
            try {
                listener.onJobStatusChanged(runId, record.getInstanceId(), from, to);
            } catch (RuntimeException e) {
                logger.warn("Run listener failed on job status change: {}", e.getMessage());
            }
        }
    }

    private void applyStep(String instanceId, StepRecord step, ExecutionStatus to) {
        ExecutionStatus from = step.getStatus();
        step.setStatus(to);
        for (RunListener listener : listeners) {
            try {
                listener.onStepStatusChanged(runId, instanceId, step.getIndex(), step.getDisplayName(), from, to);
            } catch (RuntimeException e) {
                logger.warn("Run listener failed on step status change: {}", e.getMessage());
            }
        }
    }
}
