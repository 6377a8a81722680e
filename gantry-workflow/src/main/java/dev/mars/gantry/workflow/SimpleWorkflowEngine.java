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
import dev.mars.gantry.workflow.observability.WorkflowMetrics;
import dev.mars.gantry.workflow.run.ConcurrencyGroupRegistry;
import dev.mars.gantry.workflow.run.JobRecord;
import dev.mars.gantry.workflow.run.JobScheduler;
import dev.mars.gantry.workflow.run.RunContext;
import dev.mars.gantry.workflow.run.RunStatus;
import dev.mars.gantry.workflow.run.WorkflowRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Workflow engine running on a cached thread pool: one coordinator task per run plus
 * one task per running job instance.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SimpleWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(SimpleWorkflowEngine.class);

    private final WorkflowDefinitionParser parser;
    private final WorkflowMetrics metrics;
    private final ExecutorService executorService;
    private final ConcurrencyGroupRegistry concurrencyGroups;
    private final Map<String, JobScheduler> activeRuns;
    private volatile boolean shutdown = false;

    public SimpleWorkflowEngine() {
        this(new WorkflowMetrics());
    }

    public SimpleWorkflowEngine(WorkflowMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.parser = new YamlWorkflowDefinitionParser();
        this.executorService = Executors.newCachedThreadPool();
        this.concurrencyGroups = new ConcurrencyGroupRegistry();
        this.activeRuns = new ConcurrentHashMap<>();
    }

    @Override
    public CompletableFuture<WorkflowRun> execute(WorkflowDefinition definition, RunOptions options) {
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }

        ExecutionPlan plan;
        try {
            plan = prepare(definition);
        } catch (WorkflowParseException | DependencyGraphException e) {
            logger.warn("Workflow '{}' rejected: {}", definition.getName(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }

        RunContext context = new RunContext(options.getRunId(), plan, options.getListeners());
        JobScheduler scheduler = new JobScheduler(context, options, concurrencyGroups, executorService, metrics);
        if (activeRuns.putIfAbsent(options.getRunId(), scheduler) != null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("A run with id '" + options.getRunId() + "' is already active"));
        }

        return CompletableFuture.supplyAsync(() -> {
            try {
                return scheduler.execute();
            } finally {
                activeRuns.remove(options.getRunId());
            }
        }, executorService);
    }

    @Override
    public CompletableFuture<WorkflowRun> execute(String workflowYaml, RunOptions options) {
        try {
            return execute(parser.parseFromString(workflowYaml), options);
        } catch (WorkflowParseException e) {
            logger.warn("Workflow rejected: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<WorkflowRun> dryRun(WorkflowDefinition definition, RunOptions options) {
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }

        ExecutionPlan plan;
        try {
            plan = prepare(definition);
        } catch (WorkflowParseException | DependencyGraphException e) {
            return CompletableFuture.failedFuture(e);
        }

        return CompletableFuture.supplyAsync(() -> {
            logger.info("Performing dry run of workflow '{}'", definition.getName());
            RunContext context = new RunContext(options.getRunId(), plan, options.getListeners());
            for (JobRecord record : context.getJobs()) {
                context.closeSteps(record.getInstanceId());
                context.finishJob(record.getInstanceId(), ExecutionStatus.SKIPPED, ExecutionStatus.SKIPPED,
                        Map.of(), null);
                logger.info("Dry run validated job instance: {}", record.getInstanceId());
            }
            return new WorkflowRun(options.getRunId(), definition.getName(), RunStatus.SUCCESS,
                    context.getStartTime(), Instant.now(), false, context.snapshot());
        }, executorService);
    }

    @Override
    public boolean cancel(String runId) {
        JobScheduler scheduler = activeRuns.get(runId);
        if (scheduler == null) {
            return false;
        }
        logger.info("Cancelling workflow run: {}", runId);
        scheduler.cancel("The run was cancelled");
        return true;
    }

    @Override
    public ExecutionStatus getStatus(String runId) {
        return activeRuns.containsKey(runId) ? ExecutionStatus.RUNNING : null;
    }

    @Override
    public void shutdown() {
        shutdown = true;
        executorService.shutdown();
        logger.info("SimpleWorkflowEngine shutdown initiated");
    }

    /**
     * Rejects invalid graphs first, then anything else the parser's validation finds.
     */
    private ExecutionPlan prepare(WorkflowDefinition definition)
            throws WorkflowParseException, DependencyGraphException {
        ExecutionPlan plan = ExecutionPlan.build(definition);
        ValidationResult validation = parser.validate(definition);
        if (!validation.isValid()) {
            ValidationResult.ValidationIssue first = validation.getErrors().get(0);
            throw new WorkflowParseException(first.getFieldPath(), first.getMessage());
        }
        for (ValidationResult.ValidationIssue warning : validation.getWarnings()) {
            logger.warn("Workflow '{}': {}", definition.getName(), warning);
        }
        return plan;
    }
}
