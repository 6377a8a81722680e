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
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WorkflowMetrics.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
class WorkflowMetricsTest {

    private WorkflowMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = new WorkflowMetrics(OpenTelemetry.noop().getMeter("test"));
    }

    @Test
    void testInitialState() {
        assertEquals(0L, metrics.getActiveRuns());
    }

    @Test
    void testActiveRunsFollowStartAndFinish() {
        metrics.recordRunStarted("build");
        metrics.recordRunStarted("deploy");
        assertEquals(2L, metrics.getActiveRuns());

        metrics.recordRunFinished("build", RunStatus.SUCCESS, 1.5);
        assertEquals(1L, metrics.getActiveRuns());

        metrics.recordRunFinished("deploy", RunStatus.CANCELLED, 0.2);
        assertEquals(0L, metrics.getActiveRuns());
    }

    @Test
    void testRecordingJobsAndSteps() {
        assertDoesNotThrow(() -> {
            metrics.recordJobFinished("build", ExecutionStatus.SKIPPED);
            metrics.recordStepExecuted("build", ExecutionStatus.FAILURE);
            metrics.recordStepFailed("build", null);
            metrics.recordStepFailed("build", "TIMEOUT");
        });
    }

    @Test
    void testGlobalMeterConstructor() {
        WorkflowMetrics global = new WorkflowMetrics();
        global.recordRunStarted("build");
        global.recordRunFinished("build", RunStatus.FAILURE, 3.0);

        assertEquals(0L, global.getActiveRuns());
    }
}
