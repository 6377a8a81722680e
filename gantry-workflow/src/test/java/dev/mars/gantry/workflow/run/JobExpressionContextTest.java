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
import dev.mars.gantry.core.ErrorKind;
import dev.mars.gantry.core.ExecutionStatus;
import dev.mars.gantry.secrets.SecretMasker;
import dev.mars.gantry.secrets.SecretResolver;
import dev.mars.gantry.workflow.ExecutionPlan;
import dev.mars.gantry.workflow.RunOptions;
import dev.mars.gantry.workflow.ScriptedSandbox;
import dev.mars.gantry.workflow.YamlWorkflowDefinitionParser;
import dev.mars.gantry.workflow.expression.ExpressionEvaluator;
import dev.mars.gantry.workflow.expression.ExpressionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobExpressionContextTest {

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
    private RunContext run;
    private JobExpressionContext reader;

    @BeforeEach
    void setUp() throws Exception {
        ExecutionPlan plan = ExecutionPlan.build(new YamlWorkflowDefinitionParser().parseFromString("""
                name: lookups
                jobs:
                  other:
                    steps:
                      - run: produce
                  reader:
                    steps:
                      - run: echo ${{ job.other.outputs.x }}
                  after:
                    needs: other
                    steps:
                      - run: after
                """));
        run = new RunContext("run-3", plan, List.of());
        reader = new JobExpressionContext(run, plan.getInstance("reader"), SecretResolver.empty(),
                new SecretMasker(), CancellationToken.create(), JobExpressionContext.Mode.STEP);

        run.transitionJob("other", ExecutionStatus.READY);
        run.tryAdmit("other", 4);
    }

    @Test
    void testOutputsOfRunningJobAreAnError() {
        ExpressionException e = assertThrows(ExpressionException.class,
                () -> evaluator.evaluate("job.other.outputs.x", reader));
        assertTrue(e.getMessage().contains("has not finished"));
        assertTrue(e.getMessage().contains("running"));
    }

    @Test
    void testResultOfRunningNeedIsAnError() {
        JobExpressionContext after = new JobExpressionContext(run, run.getPlan().getInstance("after"),
                SecretResolver.empty(), new SecretMasker(), CancellationToken.create(), JobExpressionContext.Mode.JOB);

        assertThrows(ExpressionException.class, () -> evaluator.evaluate("needs.other.result", after));
    }

    @Test
    void testOutputsOfFinishedJobResolve() throws Exception {
        run.finishJob("other", ExecutionStatus.SUCCESS, ExecutionStatus.SUCCESS, Map.of("x", "42"), null);

        assertEquals("42", evaluator.evaluate("job.other.outputs.x", reader).asString());
        assertEquals("success", evaluator.evaluate("job.other.result", reader).asString());
    }

    @Test
    void testStepReadingRunningJobFailsWithEvaluationError() {
        run.transitionJob("reader", ExecutionStatus.READY);
        run.tryAdmit("reader", 4);
        ScriptedSandbox sandbox = new ScriptedSandbox();
        StepRunner runner = new StepRunner(run, RunOptions.builder().sandbox(sandbox)
                .pollInterval(Duration.ofMillis(10)).build(), evaluator, new SecretMasker());

        JobRecord record = run.getJob("reader");
        StepResult result = runner.run(record.getInstance(), record.getInstance().getJob().getSteps().get(0),
                reader, Map.of(), Duration.ofSeconds(5), CancellationToken.create());

        assertEquals(ExecutionStatus.FAILURE, result.getStatus());
        assertEquals(ErrorKind.EVALUATION, result.getError().getKind());
        assertTrue(sandbox.getRequests().isEmpty());
        assertEquals(ExecutionStatus.FAILURE, run.getJob("reader").getStep(0).getStatus());
    }
}
