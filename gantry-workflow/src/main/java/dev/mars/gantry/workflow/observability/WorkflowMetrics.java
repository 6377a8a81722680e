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

package dev.mars.gantry.workflow.observability;

import dev.mars.gantry.core.ExecutionStatus;
import dev.mars.gantry.workflow.run.RunStatus;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the workflow engine.
 *
 * Provides:
 * - gantry.runs.active (gauge) - Currently executing runs
 * - gantry.runs.total (counter) - Runs started
 * - gantry.runs.completed (counter) - Runs that succeeded
 * - gantry.runs.failed (counter) - Runs that failed
 * - gantry.runs.cancelled (counter) - Runs cancelled externally
 * - gantry.jobs.finished (counter) - Job instances finished, by status
 * - gantry.steps.total (counter) - Steps executed, by status
 * - gantry.steps.failed (counter) - Failed steps
 * - gantry.runs.duration.seconds (histogram) - Run duration distribution
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "gantry-workflow";

    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> STATUS_KEY = AttributeKey.stringKey("status");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    private final LongCounter runsTotal;
    private final LongCounter runsCompleted;
    private final LongCounter runsFailed;
    private final LongCounter runsCancelled;
    private final LongCounter jobsFinished;
    private final LongCounter stepsTotal;
    private final LongCounter stepsFailed;
    private final DoubleHistogram runDuration;

    private final AtomicLong activeRuns = new AtomicLong(0);

    public WorkflowMetrics() {
        this(GlobalOpenTelemetry.getMeter(METER_NAME));
    }

    public WorkflowMetrics(Meter meter) {
        runsTotal = meter.counterBuilder("gantry.runs.total")
                .setDescription("Total number of workflow runs started")
                .setUnit("1")
                .build();

        runsCompleted = meter.counterBuilder("gantry.runs.completed")
                .setDescription("Number of workflow runs that succeeded")
                .setUnit("1")
                .build();

        runsFailed = meter.counterBuilder("gantry.runs.failed")
                .setDescription("Number of workflow runs that failed")
                .setUnit("1")
                .build();

        runsCancelled = meter.counterBuilder("gantry.runs.cancelled")
                .setDescription("Number of workflow runs cancelled")
                .setUnit("1")
                .build();

        jobsFinished = meter.counterBuilder("gantry.jobs.finished")
                .setDescription("Number of job instances that reached a terminal status")
                .setUnit("1")
                .build();

        stepsTotal = meter.counterBuilder("gantry.steps.total")
                .setDescription("Total number of steps executed")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("gantry.steps.failed")
                .setDescription("Number of failed steps")
                .setUnit("1")
                .build();

        runDuration = meter.histogramBuilder("gantry.runs.duration.seconds")
                .setDescription("Workflow run duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("gantry.runs.active")
                .setDescription("Number of currently executing workflow runs")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeRuns.get()));

        logger.debug("WorkflowMetrics initialized");
    }

    public void recordRunStarted(String workflowName) {
        runsTotal.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
        activeRuns.incrementAndGet();
    }

    /**
     * Record the end of a run that was reported through {@link #recordRunStarted}.
     */
    public void recordRunFinished(String workflowName, RunStatus status, double durationSeconds) {
        activeRuns.decrementAndGet();
        Attributes attrs = Attributes.of(WORKFLOW_NAME_KEY, workflowName);

        switch (status) {
            case SUCCESS:
                runsCompleted.add(1, attrs);
                break;
            case FAILURE:
                runsFailed.add(1, attrs);
                break;
            default:
                runsCancelled.add(1, attrs);
                break;
        }
        runDuration.record(durationSeconds, attrs);
    }

    public void recordJobFinished(String workflowName, ExecutionStatus status) {
        jobsFinished.add(1, Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(STATUS_KEY, status.getLabel())
                .build());
    }

    public void recordStepExecuted(String workflowName, ExecutionStatus status) {
        stepsTotal.add(1, Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(STATUS_KEY, status.getLabel())
                .build());
    }

    public void recordStepFailed(String workflowName, String failureReason) {
        stepsFailed.add(1, Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build());
    }

    public long getActiveRuns() {
        return activeRuns.get();
    }
}
