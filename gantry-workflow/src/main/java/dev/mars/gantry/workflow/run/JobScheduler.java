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
import dev.mars.gantry.workflow.ExecutionPlan;
import dev.mars.gantry.workflow.JobDefinition;
import dev.mars.gantry.workflow.JobInstance;
import dev.mars.gantry.workflow.RunOptions;
import dev.mars.gantry.workflow.expression.ExpressionEvaluator;
import dev.mars.gantry.workflow.expression.ExpressionException;
import dev.mars.gantry.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Drives one run: a single coordinator loop consumes scheduler events and, after each
 * one, moves instances from the ready set through gating and admission into job tasks
 * on the shared executor.
 *
 * <p>Per instance the coordinator applies, in order: the dependency rule (a failed,
 * cancelled or skipped dependency skips the instance unless its {@code if} calls a
 * status function), the {@code if} condition, the run-level and {@code max-parallel}
 * limits and finally the concurrency group.</p>
 *
 * <p>{@link #cancel} and {@link #cancelInstance} may be called from any thread; they
 * publish CANCELLED immediately and leave process termination to the job task.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class JobScheduler {

    private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);
    private static final long IDLE_POLL_MS = 500;

    private enum EventType {
        JOB_FINISHED, CANCEL_REQUESTED, WAKE
    }

    private static final class Event {
        final EventType type;
        final String instanceId;

        Event(EventType type, String instanceId) {
            this.type = type;
            this.instanceId = instanceId;
        }
    }

    private final RunContext run;
    private final ExecutionPlan plan;
    private final RunOptions options;
    private final ConcurrencyGroupRegistry groups;
    private final ExecutorService executor;
    private final WorkflowMetrics metrics;
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
    private final SecretMasker masker;
    private final StepRunner stepRunner;
    private final CancellationToken runToken = CancellationToken.create();

    private final BlockingQueue<Event> events = new LinkedBlockingQueue<>();
    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();
    private final Map<String, String> groupKeys = new ConcurrentHashMap<>();
    private final Set<String> gated = new HashSet<>();
    private final Set<String> handled = new HashSet<>();
    private final List<CompletableFuture<Void>> tasks = new ArrayList<>();
    private volatile boolean externallyCancelled;

    public JobScheduler(RunContext run, RunOptions options, ConcurrencyGroupRegistry groups,
                        ExecutorService executor, WorkflowMetrics metrics) {
        this.run = run;
        this.plan = run.getPlan();
        this.options = options;
        this.groups = groups;
        this.executor = executor;
        this.metrics = metrics;
        this.masker = new SecretMasker(options.getLogMask());
        this.stepRunner = new StepRunner(run, options, evaluator, masker);
    }

    public String getRunId() {
        return run.getRunId();
    }

    public RunContext getRunContext() {
        return run;
    }

    public boolean isExternallyCancelled() {
        return externallyCancelled;
    }

    /**
     * Runs the workflow to completion on the calling thread.
     */
    public WorkflowRun execute() {
        MDC.put("runId", run.getRunId());
        String workflowName = plan.getWorkflow().getName();
        try {
            logger.info("Starting run '{}' of workflow '{}' with {} job instance(s)",
                    run.getRunId(), workflowName, plan.size());
            metrics.recordRunStarted(workflowName);
            run.notifyRunStarted();

            schedule();
            while (!run.isComplete()) {
                Event event;
                try {
                    event = events.poll(IDLE_POLL_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancel("The run was interrupted");
                    break;
                }
                while (event != null) {
                    handle(event);
                    event = events.poll();
                }
                schedule();
            }

            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
            handleFinishedInstances();

            WorkflowRun result = new WorkflowRun(run.getRunId(), workflowName, status(), run.getStartTime(),
                    Instant.now(), externallyCancelled, run.snapshot());
            for (JobRun job : result.getJobs()) {
                metrics.recordJobFinished(workflowName, job.getStatus());
            }
            metrics.recordRunFinished(workflowName, result.getStatus(), result.getDuration().toMillis() / 1000.0);
            logger.info("Run '{}' finished with {}", run.getRunId(), result.getStatus());
            run.notifyRunCompleted(result);
            return result;
        } finally {
            MDC.remove("runId");
        }
    }

    /**
     * Cancels the whole run: every non-terminal instance becomes CANCELLED and running
     * job tasks are asked to stop.
     */
    public void cancel(String reason) {
        externallyCancelled = true;
        if (runToken.cancel(reason)) {
            logger.info("Cancelling run '{}': {}", run.getRunId(), reason);
        }
        cancelRemaining(reason);
        events.offer(new Event(EventType.CANCEL_REQUESTED, null));
    }

    /**
     * Cancels one instance. Returns {@code false} if it was already terminal.
     */
    public boolean cancelInstance(String instanceId, String reason) {
        CancellationToken token = tokens.get(instanceId);
        if (token != null) {
            token.cancel(reason);
        }
        boolean changed = run.finishJob(instanceId, ExecutionStatus.CANCELLED, ExecutionStatus.CANCELLED,
                Map.of(), ErrorDetail.of(ErrorKind.CANCELLED, reason));
        run.closeSteps(instanceId);
        if (changed) {
            logger.info("Cancelled '{}': {}", instanceId, reason);
            releaseGroup(instanceId);
            wake();
        }
        return changed;
    }

    void wake() {
        events.offer(new Event(EventType.WAKE, null));
    }

    private void jobFinished(String instanceId) {
        releaseGroup(instanceId);
        events.offer(new Event(EventType.JOB_FINISHED, instanceId));
    }

    private void handle(Event event) {
        switch (event.type) {
            case JOB_FINISHED:
                tokens.remove(event.instanceId);
                break;
            case CANCEL_REQUESTED:
                cancelRemaining(runToken.getReason());
                break;
            default:
                break;
        }
        handleFinishedInstances();
    }

    /**
     * Applies fail-fast for every instance that failed since the last call.
     */
    private void handleFinishedInstances() {
        for (JobRecord record : run.getJobs()) {
            if (!record.isTerminal() || !handled.add(record.getInstanceId())) {
                continue;
            }
            if (record.getStatus() != ExecutionStatus.FAILURE || record.getConclusion() != ExecutionStatus.FAILURE) {
                continue;
            }
            JobInstance instance = record.getInstance();
            if (options.isFailFast()) {
                cancelRemaining("Cancelled by fail-fast after '" + instance.getId() + "' failed");
            } else if (instance.getJob().hasMatrix() && instance.getJob().getStrategy().isFailFast()) {
                for (String sibling : plan.instancesOf(instance.getJobId())) {
                    if (!run.getJob(sibling).isTerminal()) {
                        cancelInstance(sibling, "Cancelled by fail-fast after '" + instance.getId() + "' failed");
                    }
                }
            }
        }
    }

    private void cancelRemaining(String reason) {
        for (JobRecord record : run.getJobs()) {
            if (!record.isTerminal()) {
                cancelInstance(record.getInstanceId(), reason);
            }
        }
    }

    private void schedule() {
        boolean progressed;
        do {
            progressed = schedulePass();
            handleFinishedInstances();
        } while (progressed);
    }

    private boolean schedulePass() {
        boolean progressed = false;
        for (String instanceId : plan.readySet(run.terminalInstanceIds())) {
            JobRecord record = run.getJob(instanceId);
            if (record.getStatus() == ExecutionStatus.PENDING) {
                if (!run.transitionJob(instanceId, ExecutionStatus.READY)) {
                    continue;
                }
                progressed = true;
            }
            if (record.getStatus() != ExecutionStatus.READY) {
                continue;
            }
            if (runToken.isCancelled()) {
                cancelInstance(instanceId, runToken.getReason());
                progressed = true;
                continue;
            }
            if (gated.add(instanceId) && !gate(record)) {
                progressed = true;
                continue;
            }
            if (admit(record)) {
                progressed = true;
            }
        }
        return progressed;
    }

    /**
     * Applies the dependency rule and the {@code if} condition, and resolves the
     * concurrency group key.
     *
     * @return {@code true} if the instance may be admitted
     */
    private boolean gate(JobRecord record) {
        JobInstance instance = record.getInstance();
        JobDefinition job = instance.getJob();
        JobExpressionContext context = new JobExpressionContext(run, instance, options.getSecretResolver(), masker,
                runToken, JobExpressionContext.Mode.JOB).withEnv(plan.getWorkflow().getEnv());
        try {
            boolean statusFunction = evaluator.referencesStatusFunction(job.getCondition());
            if (!statusFunction && blockedByDependency(instance)) {
                skip(instance.getId(), "a dependency did not succeed");
                return false;
            }
            if (!evaluator.evaluateCondition(job.getCondition(), context)) {
                skip(instance.getId(), "its condition is false");
                return false;
            }
            if (job.getConcurrencyGroup() != null) {
                groupKeys.put(instance.getId(), evaluator.interpolate(job.getConcurrencyGroup(), context));
            }
            return true;
        } catch (ExpressionException e) {
            logger.warn("Job '{}' failed to evaluate: {}", instance.getId(), masker.mask(e.getMessage()));
            run.closeSteps(instance.getId());
            ExecutionStatus conclusion = job.isContinueOnError() ? ExecutionStatus.SUCCESS : ExecutionStatus.FAILURE;
            run.finishJob(instance.getId(), ExecutionStatus.FAILURE, conclusion, Map.of(),
                    ErrorDetail.of(ErrorKind.EVALUATION, masker.mask(e.getMessage())));
            return false;
        }
    }

    /**
     * A skipped upstream counts as completed; only a failed or cancelled one blocks.
     */
    private boolean blockedByDependency(JobInstance instance) {
        for (String upstream : instance.getUpstream()) {
            ExecutionStatus conclusion = run.getJob(upstream).getConclusion();
            if (conclusion == ExecutionStatus.FAILURE || conclusion == ExecutionStatus.CANCELLED) {
                return true;
            }
        }
        return false;
    }

    private void skip(String instanceId, String why) {
        logger.info("Skipping '{}' because {}", instanceId, why);
        run.closeSteps(instanceId);
        run.finishJob(instanceId, ExecutionStatus.SKIPPED, ExecutionStatus.SKIPPED, Map.of(), null);
    }

    private boolean admit(JobRecord record) {
        String instanceId = record.getInstanceId();
        String group = groupKeys.get(instanceId);
        boolean cancelInProgress = record.getInstance().getJob().isCancelInProgress();

        // a superseding instance takes its group first, so the slot its holder frees counts
        if (group != null && cancelInProgress) {
            groups.acquire(group, this, instanceId, true);
        }
        if (!run.hasCapacity(instanceId, options.getMaxParallelJobs())) {
            if (group != null && cancelInProgress) {
                groups.release(group, this, instanceId);
            }
            return false;
        }
        if (group != null && !cancelInProgress && !groups.acquire(group, this, instanceId, false)) {
            return false;
        }

        CancellationToken token = runToken.child();
        tokens.put(instanceId, token);
        if (!run.tryAdmit(instanceId, options.getMaxParallelJobs())) {
            tokens.remove(instanceId);
            if (group != null) {
                groups.release(group, this, instanceId);
            }
            return false;
        }

        JobTask task = new JobTask(run, record.getInstance(), options, stepRunner, evaluator, masker, token,
                metrics, this::jobFinished);
        tasks.add(CompletableFuture.runAsync(task, executor));
        return true;
    }

    private void releaseGroup(String instanceId) {
        String group = groupKeys.get(instanceId);
        if (group != null) {
            groups.release(group, this, instanceId);
        }
    }

    private RunStatus status() {
        boolean anyCancelled = false;
        boolean anyFailure = false;
        for (JobRecord record : run.getJobs()) {
            anyCancelled |= record.getStatus() == ExecutionStatus.CANCELLED;
            anyFailure |= record.getConclusion() == ExecutionStatus.FAILURE;
        }
        if (externallyCancelled && anyCancelled) {
            return RunStatus.CANCELLED;
        }
        return anyFailure ? RunStatus.FAILURE : RunStatus.SUCCESS;
    }
}
