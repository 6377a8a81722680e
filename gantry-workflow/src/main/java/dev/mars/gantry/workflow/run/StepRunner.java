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

import dev.mars.gantry.artifact.ArtifactException;
import dev.mars.gantry.artifact.ArtifactStore;
import dev.mars.gantry.core.CancellationToken;
import dev.mars.gantry.core.ErrorDetail;
import dev.mars.gantry.core.ErrorKind;
import dev.mars.gantry.core.ExecutionStatus;
import dev.mars.gantry.sandbox.SandboxException;
import dev.mars.gantry.sandbox.SandboxProcess;
import dev.mars.gantry.sandbox.SandboxRequest;
import dev.mars.gantry.secrets.SecretMasker;
import dev.mars.gantry.workflow.JobInstance;
import dev.mars.gantry.workflow.RunOptions;
import dev.mars.gantry.workflow.StepDefinition;
import dev.mars.gantry.workflow.expression.ExpressionEvaluator;
import dev.mars.gantry.workflow.expression.ExpressionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one step of a job instance and records it in the {@link RunContext}.
 *
 * <p>The runner evaluates the step condition, builds the step environment, then runs
 * the step through the sandbox (or the artifact store for artifact actions), retrying
 * failed attempts as configured. While the process runs it forwards masked output
 * lines, picks up workflow commands and enforces the timeout and the cancellation
 * token. Termination is requested at most once per attempt.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class StepRunner {

    private static final Logger logger = LoggerFactory.getLogger(StepRunner.class);

    static final String UPLOAD_ARTIFACT = "actions/upload-artifact@";
    static final String DOWNLOAD_ARTIFACT = "actions/download-artifact@";
    private static final String DEFAULT_ARTIFACT_NAME = "artifact";

    private final RunContext run;
    private final RunOptions options;
    private final ExpressionEvaluator evaluator;
    private final SecretMasker masker;

    public StepRunner(RunContext run, RunOptions options, ExpressionEvaluator evaluator, SecretMasker masker) {
        this.run = run;
        this.options = options;
        this.evaluator = evaluator;
        this.masker = masker;
    }

    /**
     * Runs a step to completion with no job deadline.
     */
    public StepResult run(JobInstance instance, StepDefinition step, JobExpressionContext context,
                          Map<String, String> jobEnv, Duration timeout, CancellationToken token) {
        return run(instance, step, context, jobEnv, timeout, null, token);
    }

    /**
     * Runs a step to completion.
     *
     * @param context     expression context of the owning instance
     * @param jobEnv      environment of the job before the step's own {@code env}
     * @param timeout     time allowed for each attempt
     * @param jobDeadline {@link System#nanoTime()} value at which the job budget runs out,
     *                    or {@code null}; every attempt is capped by it and no retry
     *                    starts after it
     */
    public StepResult run(JobInstance instance, StepDefinition step, JobExpressionContext context,
                          Map<String, String> jobEnv, Duration timeout, Long jobDeadline, CancellationToken token) {
        String instanceId = instance.getId();
        int index = step.getIndex();
        MDC.put("step", step.getDisplayName());
        try {
            JobExpressionContext jobContext = context.withEnv(jobEnv);

            boolean proceed;
            try {
                proceed = evaluator.evaluateCondition(step.getCondition(), jobContext);
            } catch (ExpressionException e) {
                return fail(instanceId, step, ErrorDetail.of(ErrorKind.EVALUATION,
                        masker.mask("Invalid condition: " + e.getMessage())), 0);
            }
            if (!proceed) {
                StepResult skipped = StepResult.skipped();
                run.finishStep(instanceId, index, skipped);
                logger.debug("Step '{}' skipped by its condition", step.getDisplayName());
                return skipped;
            }

            if (!run.startStep(instanceId, index)) {
                return closed(instanceId, index);
            }

            Map<String, String> env = new LinkedHashMap<>(jobEnv);
            String command;
            Map<String, String> with = new LinkedHashMap<>();
            Path workingDirectory;
            try {
                for (Map.Entry<String, String> entry : step.getEnv().entrySet()) {
                    env.put(entry.getKey(), evaluator.interpolate(entry.getValue(), context.withEnv(env)));
                }
                JobExpressionContext stepContext = context.withEnv(env);
                command = evaluator.interpolate(step.getRun(), stepContext);
                for (Map.Entry<String, String> entry : step.getWith().entrySet()) {
                    with.put(entry.getKey(), evaluator.interpolate(entry.getValue(), stepContext));
                }
                workingDirectory = workingDirectory(evaluator.interpolate(step.getWorkingDirectory(), stepContext));
            } catch (ExpressionException e) {
                return finish(instanceId, step, new Attempt(ExecutionStatus.FAILURE, null,
                        ErrorDetail.of(ErrorKind.EVALUATION, masker.mask(e.getMessage())), Map.of()), 1, List.of());
            }

            logger.info("Running step '{}' of '{}'", step.getDisplayName(), instanceId);
            List<LogLine> collected = Collections.synchronizedList(new ArrayList<>());
            int maxAttempts = step.getRetries() + 1;
            int attempts = 0;
            Attempt attempt;
            while (true) {
                attempts++;
                if (attempts > 1) {
                    append(instanceId, index, collected, LogLine.system(
                            "Retrying step (attempt " + attempts + " of " + maxAttempts + ")"));
                }
                attempt = execute(instance, step, command, with, env, workingDirectory,
                        attemptTimeout(timeout, jobDeadline), token, collected);
                if (attempt.status != ExecutionStatus.FAILURE || attempts >= maxAttempts || token.isCancelled()) {
                    break;
                }
                if (budgetExhausted(jobDeadline)) {
                    append(instanceId, index, collected, LogLine.system("Not retrying: the job timeout ran out"));
                    attempt = attempt.outOfBudget(attempts);
                    break;
                }
                logger.info("Step '{}' failed on attempt {} of {}: {}", step.getDisplayName(), attempts, maxAttempts,
                        attempt.error != null ? attempt.error.getMessage() : "unknown error");
                if (!pause(options.getRetryDelay(), token)) {
                    attempt = Attempt.cancelled(attempt.outputs);
                    break;
                }
                if (budgetExhausted(jobDeadline)) {
                    append(instanceId, index, collected, LogLine.system("Not retrying: the job timeout ran out"));
                    attempt = attempt.outOfBudget(attempts);
                    break;
                }
            }
            return finish(instanceId, step, attempt, attempts, collected);
        } finally {
            MDC.remove("step");
        }
    }

    private Attempt execute(JobInstance instance, StepDefinition step, String command, Map<String, String> with,
                            Map<String, String> env, Path workingDirectory, Duration timeout,
                            CancellationToken token, List<LogLine> collected) {
        if (token.isCancelled()) {
            return Attempt.cancelled(Map.of());
        }
        String uses = step.getUses();
        if (uses != null && (uses.startsWith(UPLOAD_ARTIFACT) || uses.startsWith(DOWNLOAD_ARTIFACT))) {
            return artifact(instance.getId(), step, with, workingDirectory, collected);
        }

        SandboxRequest request = SandboxRequest.builder()
                .stepName(step.getDisplayName())
                .command(command)
                .uses(uses)
                .with(with)
                .environment(env)
                .workingDirectory(workingDirectory)
                .timeout(timeout)
                .build();

        SandboxProcess process;
        try {
            process = options.getSandbox().start(request);
        } catch (SandboxException e) {
            return Attempt.failed(ErrorDetail.of(ErrorKind.EXECUTION, masker.mask(e.getMessage())), Map.of());
        }

        Map<String, String> outputs = Collections.synchronizedMap(new LinkedHashMap<>());
        Thread stdout = reader(instance.getId(), step.getIndex(), process.getStdout(), LogLine.Stream.STDOUT,
                outputs, collected);
        Thread stderr = reader(instance.getId(), step.getIndex(), process.getStderr(), LogLine.Stream.STDERR,
                outputs, collected);

        AtomicBoolean terminated = new AtomicBoolean(false);
        long deadline = System.nanoTime() + timeout.toNanos();
        ErrorDetail interruption = null;
        ExecutionStatus forced = null;
        try {
            while (!process.waitFor(options.getPollInterval())) {
                if (token.isCancelled()) {
                    forced = ExecutionStatus.CANCELLED;
                    interruption = ErrorDetail.of(ErrorKind.CANCELLED, "The step was cancelled");
                    break;
                }
                if (System.nanoTime() - deadline >= 0) {
                    forced = ExecutionStatus.FAILURE;
                    interruption = ErrorDetail.of(ErrorKind.TIMEOUT,
                            "The step exceeded its timeout of " + format(timeout));
                    break;
                }
            }
            if (forced != null) {
                terminate(process, terminated, step);
                if (!process.waitFor(options.getTerminateGrace())) {
                    logger.warn("Process of step '{}' did not exit within {} of termination",
                            step.getDisplayName(), format(options.getTerminateGrace()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminate(process, terminated, step);
            forced = ExecutionStatus.CANCELLED;
            interruption = ErrorDetail.of(ErrorKind.CANCELLED, "The step was interrupted");
        }

        join(stdout, step);
        join(stderr, step);

        if (forced != null) {
            append(instance.getId(), step.getIndex(), collected, LogLine.system(interruption.getMessage()));
            return new Attempt(forced, null, interruption, outputs);
        }

        int exitCode = process.exitCode();
        if (exitCode != 0) {
            return new Attempt(ExecutionStatus.FAILURE, exitCode,
                    ErrorDetail.of(ErrorKind.EXECUTION, "Process completed with exit code " + exitCode), outputs);
        }
        return new Attempt(ExecutionStatus.SUCCESS, 0, null, outputs);
    }

    private Attempt artifact(String instanceId, StepDefinition step, Map<String, String> with,
                             Path workingDirectory, List<LogLine> collected) {
        ArtifactStore store = options.getArtifactStore();
        if (store == null) {
            return Attempt.failed(ErrorDetail.of(ErrorKind.EXECUTION,
                    "No artifact store is configured for '" + step.getUses() + "'"), Map.of());
        }
        Path base = workingDirectory != null ? workingDirectory : Paths.get("").toAbsolutePath();
        String name = with.getOrDefault("name", DEFAULT_ARTIFACT_NAME);
        String path = with.get("path");

        try {
            if (step.getUses().startsWith(UPLOAD_ARTIFACT)) {
                if (path == null || path.isBlank()) {
                    return Attempt.failed(ErrorDetail.of(ErrorKind.EXECUTION,
                            "Input required and not supplied: path"), Map.of());
                }
                Path source = base.resolve(path);
                store.upload(name, source);
                append(instanceId, step.getIndex(), collected,
                        LogLine.system("Uploaded artifact '" + name + "' from " + source));
            } else {
                Path destination = base.resolve(path != null && !path.isBlank() ? path : ".");
                store.download(name, destination);
                append(instanceId, step.getIndex(), collected,
                        LogLine.system("Downloaded artifact '" + name + "' to " + destination));
            }
            return new Attempt(ExecutionStatus.SUCCESS, 0, null, Map.of());
        } catch (ArtifactException e) {
            return Attempt.failed(ErrorDetail.of(ErrorKind.EXECUTION, masker.mask(e.getMessage())), Map.of());
        }
    }

    private Thread reader(String instanceId, int stepIndex, InputStream stream, LogLine.Stream kind,
                          Map<String, String> outputs, List<LogLine> collected) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Thread thread = new Thread(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    handleLine(instanceId, stepIndex, kind, line, outputs, collected);
                }
            } catch (IOException e) {
                logger.debug("Output stream {} closed: {}", kind, e.getMessage());
            } finally {
                MDC.clear();
            }
        }, "gantry-" + kind.name().toLowerCase() + "-" + instanceId + "-" + stepIndex);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private void handleLine(String instanceId, int stepIndex, LogLine.Stream kind, String raw,
                            Map<String, String> outputs, List<LogLine> collected) {
        if (kind == LogLine.Stream.STDOUT) {
            WorkflowCommandParser.Command command = WorkflowCommandParser.parse(raw);
            if (command != null) {
                if (command.getType() == WorkflowCommandParser.CommandType.ADD_MASK) {
                    masker.register(command.getValue());
                } else {
                    outputs.put(command.getName(), command.getValue());
                }
                return;
            }
        }
        append(instanceId, stepIndex, collected, new LogLine(kind, masker.mask(raw), Instant.now()));
    }

    private void append(String instanceId, int stepIndex, List<LogLine> collected, LogLine line) {
        collected.add(line);
        run.appendLog(instanceId, stepIndex, line);
        logger.debug("{}", line.getText());
    }

    private void terminate(SandboxProcess process, AtomicBoolean terminated, StepDefinition step) {
        if (terminated.compareAndSet(false, true)) {
            logger.info("Terminating process of step '{}'", step.getDisplayName());
            process.terminate();
        }
    }

    private void join(Thread reader, StepDefinition step) {
        try {
            reader.join(Math.max(options.getTerminateGrace().toMillis(), 1000));
            if (reader.isAlive()) {
                logger.warn("Output of step '{}' is still open after the process ended", step.getDisplayName());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Sleeps between attempts, waking early on cancellation.
     *
     * @return {@code false} if the token was cancelled
     */
    private boolean pause(Duration delay, CancellationToken token) {
        long end = System.nanoTime() + delay.toNanos();
        long slice = Math.max(1, options.getPollInterval().toMillis());
        try {
            while (!token.isCancelled()) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(end - System.nanoTime());
                if (remaining <= 0) {
                    return true;
                }
                Thread.sleep(Math.min(slice, remaining));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private static Duration attemptTimeout(Duration timeout, Long jobDeadline) {
        if (jobDeadline == null) {
            return timeout;
        }
        Duration remaining = Duration.ofNanos(Math.max(1_000_000L, jobDeadline - System.nanoTime()));
        return remaining.compareTo(timeout) < 0 ? remaining : timeout;
    }

    private static boolean budgetExhausted(Long jobDeadline) {
        return jobDeadline != null && jobDeadline - System.nanoTime() <= 0;
    }

    private Path workingDirectory(String stepDirectory) {
        Path base = options.getWorkingDirectory();
        if (stepDirectory == null || stepDirectory.isBlank()) {
            return base;
        }
        return base != null ? base.resolve(stepDirectory) : Paths.get(stepDirectory).toAbsolutePath();
    }

    private StepResult fail(String instanceId, StepDefinition step, ErrorDetail error, int attempts) {
        if (!run.startStep(instanceId, step.getIndex())) {
            return closed(instanceId, step.getIndex());
        }
        return finish(instanceId, step, Attempt.failed(error, Map.of()), attempts, List.of());
    }

    private StepResult finish(String instanceId, StepDefinition step, Attempt attempt, int attempts,
                              List<LogLine> collected) {
        Map<String, String> outputs = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : attempt.outputs.entrySet()) {
            outputs.put(entry.getKey(), masker.mask(entry.getValue()));
        }

        ExecutionStatus conclusion = attempt.status == ExecutionStatus.FAILURE && step.isContinueOnError()
                ? ExecutionStatus.SUCCESS
                : attempt.status;

        StepResult result = StepResult.builder(attempt.status)
                .conclusion(conclusion)
                .exitCode(attempt.exitCode)
                .outputs(outputs)
                .error(attempt.error)
                .attempts(attempts)
                .log(new ArrayList<>(collected))
                .build();

        if (!run.finishStep(instanceId, step.getIndex(), result)) {
            return closed(instanceId, step.getIndex());
        }
        if (attempt.status == ExecutionStatus.SUCCESS) {
            logger.info("Step '{}' of '{}' succeeded", step.getDisplayName(), instanceId);
        } else {
            logger.info("Step '{}' of '{}' finished with {}: {}", step.getDisplayName(), instanceId,
                    attempt.status, attempt.error != null ? attempt.error.getMessage() : "no error detail");
        }
        return result;
    }

    /**
     * Result for a step that was closed by the scheduler while this runner worked on it.
     */
    private StepResult closed(String instanceId, int index) {
        StepRecord record = run.getJob(instanceId).getStep(index);
        return StepResult.builder(record.getStatus())
                .conclusion(record.getConclusion())
                .error(record.getError())
                .attempts(record.getAttempts())
                .build();
    }

    private static String format(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 60_000 == 0) {
            return (millis / 60_000) + "m";
        }
        if (millis % 1000 == 0) {
            return (millis / 1000) + "s";
        }
        return millis + "ms";
    }

    private static final class Attempt {
        final ExecutionStatus status;
        final Integer exitCode;
        final ErrorDetail error;
        final Map<String, String> outputs;

        Attempt(ExecutionStatus status, Integer exitCode, ErrorDetail error, Map<String, String> outputs) {
            this.status = status;
            this.exitCode = exitCode;
            this.error = error;
            this.outputs = new LinkedHashMap<>(outputs);
        }

        static Attempt failed(ErrorDetail error, Map<String, String> outputs) {
            return new Attempt(ExecutionStatus.FAILURE, null, error, outputs);
        }

        /**
         * This failed attempt, reported as a timeout because the job budget leaves no
         * room for another one.
         */
        Attempt outOfBudget(int attempts) {
            if (error != null && error.getKind() == ErrorKind.TIMEOUT) {
                return this;
            }
            return new Attempt(status, exitCode, ErrorDetail.of(ErrorKind.TIMEOUT,
                    "The job timeout ran out after attempt " + attempts
                            + (error != null ? " (" + error.getMessage() + ")" : "")), outputs);
        }

        static Attempt cancelled(Map<String, String> outputs) {
            return new Attempt(ExecutionStatus.CANCELLED, null,
                    ErrorDetail.of(ErrorKind.CANCELLED, "The step was cancelled"), outputs);
        }
    }
}
