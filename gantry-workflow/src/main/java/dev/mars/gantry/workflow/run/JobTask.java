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

import dev.mars.gantry.core.CancellationToken;
import dev.mars.gantry.core.ErrorDetail;
import dev.mars.gantry.core.ErrorKind;
import dev.mars.gantry.core.ExecutionStatus;
import dev.mars.gantry.secrets.SecretMasker;
import dev.mars.gantry.workflow.JobDefinition;
import dev.mars.gantry.workflow.JobInstance;
import dev.mars.gantry.workflow.RunOptions;
import dev.mars.gantry.workflow.StepDefinition;
import dev.mars.gantry.workflow.expression.ExpressionEvaluator;
import dev.mars.gantry.workflow.expression.ExpressionException;
import dev.mars.gantry.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Executes the steps of one admitted job instance, strictly in declared order, then
 * publishes the instance's terminal state.
 *
 * <p>A job timeout is a budget for the whole job: each step gets the smaller of its own
 * timeout and what remains of the budget.</p>
 */
class JobTask implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(JobTask.class);

    private final RunContext run;
    private final JobInstance instance;
    private final RunOptions options;
    private final StepRunner stepRunner;
    private final ExpressionEvaluator evaluator;
    private final SecretMasker masker;
    private final CancellationToken token;
    private final WorkflowMetrics metrics;
    private final Consumer<String> onFinished;

    JobTask(RunContext run, JobInstance instance, RunOptions options, StepRunner stepRunner,
            ExpressionEvaluator evaluator, SecretMasker masker, CancellationToken token,
            WorkflowMetrics metrics, Consumer<String> onFinished) {
        this.run = run;
        this.instance = instance;
        this.options = options;
        this.stepRunner = stepRunner;
        this.evaluator = evaluator;
        this.masker = masker;
        this.token = token;
        this.metrics = metrics;
        this.onFinished = onFinished;
    }

    @Override
    public void run() {
        MDC.put("runId", run.getRunId());
        MDC.put("job", instance.getId());
        try {
            execute();
        } catch (RuntimeException e) {
            logger.error("Job '{}' failed unexpectedly: {}", instance.getId(), e.getMessage(), e);
            run.closeSteps(instance.getId());
            finish(ExecutionStatus.FAILURE, Map.of(), ErrorDetail.of(ErrorKind.EXECUTION, masker.mask(
                    "Unexpected error: " + e.getMessage())));
        } finally {
            MDC.remove("job");
            MDC.remove("runId");
            onFinished.accept(instance.getId());
        }
    }

    private void execute() {
        JobDefinition job = instance.getJob();
        JobExpressionContext context = new JobExpressionContext(run, instance, options.getSecretResolver(), masker,
                token, JobExpressionContext.Mode.STEP);
        String workflowName = run.getPlan().getWorkflow().getName();
        logger.info("Starting job '{}'", instance.getId());

        Map<String, String> env;
        try {
            env = environment(context);
        } catch (ExpressionException e) {
            run.closeSteps(instance.getId());
            finish(ExecutionStatus.FAILURE, Map.of(), ErrorDetail.of(ErrorKind.EVALUATION, masker.mask(e.getMessage())));
            return;
        }

        long started = System.nanoTime();
        Duration budget = job.getTimeout();
        Long deadline = budget != null ? started + budget.toNanos() : null;
        ErrorDetail failure = null;

        for (StepDefinition step : job.getSteps()) {
            if (token.isCancelled()) {
                break;
            }

            Duration timeout = step.getTimeout() != null ? step.getTimeout()
                    : budget != null ? budget : options.getDefaultStepTimeout();
            if (budget != null) {
                Duration remaining = budget.minusNanos(System.nanoTime() - started);
                if (remaining.isNegative() || remaining.isZero()) {
                    if (failure == null) {
                        failure = ErrorDetail.of(ErrorKind.TIMEOUT, "The job exceeded its timeout of " + budget);
                    }
                    break;
                }
                if (remaining.compareTo(timeout) < 0) {
                    timeout = remaining;
                }
            }

            StepResult result = stepRunner.run(instance, step, context, env, timeout, deadline, token);
            if (result.getStatus() != ExecutionStatus.SKIPPED) {
                metrics.recordStepExecuted(workflowName, result.getStatus());
            }
            if (result.getStatus() == ExecutionStatus.FAILURE) {
                metrics.recordStepFailed(workflowName,
                        result.getError() != null ? result.getError().getKind().name() : null);
            }
            if (failure == null && result.getConclusion() == ExecutionStatus.FAILURE) {
                ErrorDetail cause = result.getError();
                failure = ErrorDetail.of(cause != null ? cause.getKind() : ErrorKind.EXECUTION,
                        "Step '" + step.getDisplayName() + "' failed"
                                + (cause != null ? ": " + cause.getMessage() : ""));
            }
        }

        if (token.isCancelled()) {
            run.closeSteps(instance.getId());
            finish(ExecutionStatus.CANCELLED, Map.of(), ErrorDetail.of(ErrorKind.CANCELLED,
                    token.getReason() != null ? token.getReason() : "The job was cancelled"));
            return;
        }
        run.closeSteps(instance.getId());

        Map<String, String> outputs = new LinkedHashMap<>();
        try {
            JobExpressionContext outputContext = context.withEnv(env);
            for (Map.Entry<String, String> output : instance.getJob().getOutputs().entrySet()) {
                outputs.put(output.getKey(), masker.mask(evaluator.interpolate(output.getValue(), outputContext)));
            }
        } catch (ExpressionException e) {
            if (failure == null) {
                failure = ErrorDetail.of(ErrorKind.EVALUATION, masker.mask("Invalid job output: " + e.getMessage()));
            }
        }

        finish(failure == null ? ExecutionStatus.SUCCESS : ExecutionStatus.FAILURE, outputs, failure);
    }

    /**
     * Ambient env, then workflow env, pipeline variables and job env, each layer
     * overriding the one before.
     */
    private Map<String, String> environment(JobExpressionContext context) throws ExpressionException {
        Map<String, String> env = new LinkedHashMap<>(options.getAmbientEnv());
        for (Map.Entry<String, String> entry : run.getPlan().getWorkflow().getEnv().entrySet()) {
            env.put(entry.getKey(), evaluator.interpolate(entry.getValue(), context.withEnv(env)));
        }
        env.putAll(options.getPipelineVariables());
        for (Map.Entry<String, String> entry : instance.getJob().getEnv().entrySet()) {
            env.put(entry.getKey(), evaluator.interpolate(entry.getValue(), context.withEnv(env)));
        }
        return env;
    }

    private void finish(ExecutionStatus status, Map<String, String> outputs, ErrorDetail error) {
        ExecutionStatus conclusion = status == ExecutionStatus.FAILURE && instance.getJob().isContinueOnError()
                ? ExecutionStatus.SUCCESS
                : status;
        if (run.finishJob(instance.getId(), status, conclusion, outputs, error)) {
            logger.info("Job '{}' finished with {}", instance.getId(), status);
        }
    }
}
