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

package dev.mars.gantry.workflow;

import dev.mars.gantry.core.ExecutionStatus;
import dev.mars.gantry.workflow.run.WorkflowRun;

import java.util.concurrent.CompletableFuture;

/**
 * Executes workflow definitions.
 *
 * <p>Malformed workflows and invalid dependency graphs are reported before anything
 * runs: the returned future completes exceptionally with a
 * {@link WorkflowParseException} or {@link DependencyGraphException}. Every other
 * failure is part of the {@link WorkflowRun}.</p>
 */
public interface WorkflowEngine {

    /**
     * Executes a workflow definition.
     *
     * @param definition the workflow to run
     * @param options    collaborators, limits and run-level variables
     * @return future completing with the run result once every job instance is terminal
     */
    CompletableFuture<WorkflowRun> execute(WorkflowDefinition definition, RunOptions options);

    /**
     * Parses a YAML workflow and executes it.
     */
    CompletableFuture<WorkflowRun> execute(String workflowYaml, RunOptions options);

    /**
     * Builds the execution plan and reports every job instance and step as skipped,
     * without touching the sandbox.
     */
    CompletableFuture<WorkflowRun> dryRun(WorkflowDefinition definition, RunOptions options);

    /**
     * Cancels an active run. Every non-terminal job instance becomes cancelled and
     * running steps are terminated.
     *
     * @return {@code true} if the run was active
     */
    boolean cancel(String runId);

    /**
     * Status of an active run, or {@code null} if no run with that id is active.
     */
    ExecutionStatus getStatus(String runId);

    /**
     * Shuts down the workflow engine. Runs already started continue to completion.
     */
    void shutdown();
}
