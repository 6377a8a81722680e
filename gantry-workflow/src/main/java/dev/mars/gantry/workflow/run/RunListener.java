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

/**
 * Receives run progress as it happens. Status callbacks are delivered in transition
 * order while the run state lock is held, so implementations must return quickly and
 * must not call back into the engine.
 */
public interface RunListener {

    default void onRunStarted(String runId, String workflowName) {
    }

    default void onJobStatusChanged(String runId, String instanceId, ExecutionStatus from, ExecutionStatus to) {
    }

    default void onStepStatusChanged(String runId, String instanceId, int stepIndex, String stepName,
                                     ExecutionStatus from, ExecutionStatus to) {
    }

    /**
     * A live, masked output line of a running step.
     */
    default void onLogLine(String runId, String instanceId, int stepIndex, LogLine line) {
    }

    default void onRunCompleted(WorkflowRun run) {
    }
}
