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
import dev.mars.gantry.core.ExecutionStatus;
import dev.mars.gantry.secrets.SecretMasker;
import dev.mars.gantry.secrets.SecretNotFoundException;
import dev.mars.gantry.secrets.SecretResolver;
import dev.mars.gantry.workflow.JobInstance;
import dev.mars.gantry.workflow.expression.ExpressionContext;
import dev.mars.gantry.workflow.expression.ExpressionException;
import dev.mars.gantry.workflow.expression.ExpressionValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Expression context of one job instance, backed by the live {@link RunContext}.
 *
 * <p>In {@link Mode#JOB} the status functions look at the instance's dependencies; in
 * {@link Mode#STEP} they look at the steps of the instance that already finished.</p>
 */
public class JobExpressionContext implements ExpressionContext {

    private static final Logger logger = LoggerFactory.getLogger(JobExpressionContext.class);

    public enum Mode {
        JOB, STEP
    }

    private final RunContext run;
    private final JobInstance instance;
    private final SecretResolver secrets;
    private final SecretMasker masker;
    private final CancellationToken token;
    private final Mode mode;
    private final Map<String, String> env;

    public JobExpressionContext(RunContext run, JobInstance instance, SecretResolver secrets, SecretMasker masker,
                                CancellationToken token, Mode mode) {
        this(run, instance, secrets, masker, token, mode, Map.of());
    }

    private JobExpressionContext(RunContext run, JobInstance instance, SecretResolver secrets, SecretMasker masker,
                                 CancellationToken token, Mode mode, Map<String, String> env) {
        this.run = run;
        this.instance = instance;
        this.secrets = secrets;
        this.masker = masker;
        this.token = token;
        this.mode = mode;
        this.env = env;
    }

    /**
     * Same context with {@code env} bound to the given variables.
     */
    public JobExpressionContext withEnv(Map<String, String> env) {
        return new JobExpressionContext(run, instance, secrets, masker, token, mode, new LinkedHashMap<>(env));
    }

    @Override
    public ExpressionValue resolve(List<String> path) throws ExpressionException {
        if (path.isEmpty()) {
            return ExpressionValue.EMPTY_STRING;
        }
        switch (path.get(0).toLowerCase(Locale.ROOT)) {
            case "env":
                return ExpressionContext.walk(ExpressionValue.from(env), path, 1);
            case "matrix":
                return ExpressionContext.walk(ExpressionValue.from(instance.getMatrix()), path, 1);
            case "secrets":
                return secret(path);
            case "run":
                return ExpressionContext.walk(ExpressionValue.from(Map.of("id", run.getRunId())), path, 1);
            case "workflow":
                return ExpressionContext.walk(
                        ExpressionValue.from(Map.of("name", run.getPlan().getWorkflow().getName())), path, 1);
            case "steps":
                return steps(path);
            case "needs":
                if (path.size() < 2 || !instance.getJob().getNeeds().contains(path.get(1))) {
                    return ExpressionValue.EMPTY_STRING;
                }
                return ExpressionContext.walk(aggregate(path.get(1)), path, 2);
            case "job":
                if (path.size() < 2 || run.getPlan().instancesOf(path.get(1)).isEmpty()) {
                    return ExpressionValue.EMPTY_STRING;
                }
                return ExpressionContext.walk(aggregate(path.get(1)), path, 2);
            default:
                return ExpressionValue.EMPTY_STRING;
        }
    }

    @Override
    public boolean anyFailure() {
        if (mode == Mode.JOB) {
            for (String upstream : instance.getUpstream()) {
                if (run.getJob(upstream).getConclusion() == ExecutionStatus.FAILURE) {
                    return true;
                }
            }
            return false;
        }
        for (StepRecord step : run.getJob(instance.getId()).getSteps()) {
            if (step.getStatus().isTerminal() && step.getConclusion() == ExecutionStatus.FAILURE) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean isCancelled() {
        return token.isCancelled();
    }

    private ExpressionValue secret(List<String> path) {
        if (path.size() < 2) {
            return ExpressionValue.EMPTY_STRING;
        }
        String name = path.get(1);
        try {
            String value = secrets.resolve(name);
            masker.register(value);
            return ExpressionValue.of(value);
        } catch (SecretNotFoundException e) {
            logger.debug("Secret '{}' is not defined, reading it as empty", name);
            return ExpressionValue.EMPTY_STRING;
        }
    }

    private ExpressionValue steps(List<String> path) {
        if (path.size() < 2) {
            return ExpressionValue.EMPTY_STRING;
        }
        StepRecord step = run.getJob(instance.getId()).findStep(path.get(1));
        if (step == null || !step.getStatus().isTerminal()) {
            return ExpressionValue.EMPTY_STRING;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("outputs", step.getOutputs());
        data.put("outcome", step.getStatus().getLabel());
        data.put("conclusion", step.getConclusion().getLabel());
        return ExpressionContext.walk(ExpressionValue.from(data), path, 2);
    }

    /**
     * Combined view of all instances of a job: the worst conclusion wins (failure, then
     * cancelled, then success, then skipped) and outputs merge in plan order.
     */
    private ExpressionValue aggregate(String jobId) throws ExpressionException {
        ExecutionStatus result = null;
        ExecutionStatus outcome = null;
        Map<String, String> outputs = new LinkedHashMap<>();

        for (String instanceId : run.getPlan().instancesOf(jobId)) {
            JobRecord record = run.getJob(instanceId);
            if (!record.isTerminal()) {
                throw new ExpressionException("Job '" + jobId + "' has not finished; instance '"
                        + instanceId + "' is " + record.getStatus());
            }
            result = worse(result, record.getConclusion());
            outcome = worse(outcome, record.getStatus());
            outputs.putAll(record.getOutputs());
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("result", result != null ? result.getLabel() : "");
        data.put("outcome", outcome != null ? outcome.getLabel() : "");
        data.put("outputs", outputs);
        return ExpressionValue.from(data);
    }

    private static ExecutionStatus worse(ExecutionStatus current, ExecutionStatus candidate) {
        if (current == null) {
            return candidate;
        }
        return rank(candidate) > rank(current) ? candidate : current;
    }

    private static int rank(ExecutionStatus status) {
        switch (status) {
            case FAILURE:
                return 3;
            case CANCELLED:
                return 2;
            case SUCCESS:
                return 1;
            default:
                return 0;
        }
    }
}
