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

import dev.mars.gantry.core.ExecutionStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Observable result of a run: the status of every job instance and step, their
 * masked logs, and the overall status.
 *
 * <p>The run succeeds iff no instance concluded in failure. An externally cancelled
 * run with cancelled instances reports CANCELLED.</p>
 */
public final class WorkflowRun {

    private final String runId;
    private final String workflowName;
    private final RunStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final boolean externallyCancelled;
    private final List<JobRun> jobs;

    public WorkflowRun(String runId, String workflowName, RunStatus status, Instant startTime, Instant endTime,
                       boolean externallyCancelled, List<JobRun> jobs) {
        this.runId = Objects.requireNonNull(runId, "Run ID cannot be null");
        this.workflowName = workflowName;
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.endTime = Objects.requireNonNull(endTime, "End time cannot be null");
        this.externallyCancelled = externallyCancelled;
        this.jobs = List.copyOf(jobs);
    }

    public String getRunId() {
        return runId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public RunStatus getStatus() {
        return status;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    public boolean isExternallyCancelled() {
        return externallyCancelled;
    }

    public boolean isSuccessful() {
        return status == RunStatus.SUCCESS;
    }

    /**
     * Process exit code: 0 for success, 1 for failure, 130 for a cancelled run.
     */
    public int getExitCode() {
        return status.getExitCode();
    }

    /**
     * Job instances in plan order.
     */
    public List<JobRun> getJobs() {
        return jobs;
    }

    /**
     * The instance with the given id.
     *
     * @throws IllegalArgumentException if there is none
     */
    public JobRun getJob(String instanceId) {
        for (JobRun job : jobs) {
            if (job.getInstanceId().equals(instanceId)) {
                return job;
            }
        }
        throw new IllegalArgumentException("Unknown job instance: " + instanceId);
    }

    /**
     * Human-readable summary. Failed, skipped and cancelled instances are listed
     * separately, each failure with the steps that caused it.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Workflow '").append(workflowName).append("' run ").append(runId)
                .append(": ").append(status).append(" (exit code ").append(getExitCode()).append(")\n");

        int succeeded = 0;
        for (JobRun job : jobs) {
            if (job.getStatus() == ExecutionStatus.SUCCESS) {
                succeeded++;
            }
        }
        sb.append("  Succeeded: ").append(succeeded).append(" of ").append(jobs.size()).append('\n');

        appendSection(sb, "Failed", ExecutionStatus.FAILURE);
        appendSection(sb, "Skipped", ExecutionStatus.SKIPPED);
        appendSection(sb, "Cancelled", ExecutionStatus.CANCELLED);
        return sb.toString();
    }

    private void appendSection(StringBuilder sb, String title, ExecutionStatus status) {
        boolean header = false;
        for (JobRun job : jobs) {
            if (job.getStatus() != status) {
                continue;
            }
            if (!header) {
                sb.append("  ").append(title).append(":\n");
                header = true;
            }
            sb.append("    - ").append(job.getInstanceId());
            if (job.getConclusion() != null && job.getConclusion() != status) {
                sb.append(" (continue-on-error)");
            }
            if (job.getError() != null) {
                sb.append(": ").append(job.getError());
            }
            sb.append('\n');
            if (status == ExecutionStatus.FAILURE) {
                for (StepRun step : job.getSteps()) {
                    if (step.getStatus() == ExecutionStatus.FAILURE) {
                        sb.append("        step '").append(step.getName()).append("'");
                        if (step.getError() != null) {
                            sb.append(": ").append(step.getError());
                        }
                        sb.append('\n');
                    }
                }
            }
        }
    }

    @Override
    public String toString() {
        return "WorkflowRun{runId='" + runId + "', workflow='" + workflowName + "', status=" + status
                + ", jobs=" + jobs.size() + '}';
    }
}
