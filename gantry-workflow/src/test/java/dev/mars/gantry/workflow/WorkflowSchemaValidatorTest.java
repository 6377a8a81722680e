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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the WorkflowSchemaValidator.
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 1.0
 */
class WorkflowSchemaValidatorTest {

    private WorkflowSchemaValidator validator;

    @BeforeEach
    void setUp() {
        validator = new WorkflowSchemaValidator();
    }

    private ValidationResult validate(String yaml) {
        Map<?, ?> document = new Yaml().load(yaml);
        return validator.validateWorkflowSchema(document);
    }

    private boolean hasError(ValidationResult result, String fieldPath) {
        return result.getErrors().stream().anyMatch(e -> fieldPath.equals(e.getFieldPath()));
    }

    @Test
    void testValidWorkflow() {
        ValidationResult result = validate("""
                name: valid
                on: push
                jobs:
                  build:
                    runs-on: ubuntu-latest
                    steps:
                      - id: compile
                        run: make
                """);

        assertTrue(result.isValid(), "Valid workflow should pass validation: " + result);
        assertEquals(0, result.getWarningCount());
    }

    @Test
    void testMissingJobs() {
        ValidationResult result = validate("name: nothing\n");

        assertFalse(result.isValid());
        assertTrue(hasError(result, "jobs"));
    }

    @Test
    void testEmptyJobs() {
        ValidationResult result = validate("jobs: {}\n");

        assertFalse(result.isValid());
        assertEquals("At least one job is required", result.getErrors().get(0).getMessage());
    }

    @Test
    void testNullDocument() {
        assertFalse(validator.validateWorkflowSchema(null).isValid());
    }

    @Test
    void testInvalidJobId() {
        ValidationResult result = validate("""
                jobs:
                  1build:
                    steps:
                      - id: x
                        run: make
                """);

        assertTrue(hasError(result, "jobs.1build"));
    }

    @Test
    void testStepShape() {
        ValidationResult result = validate("""
                jobs:
                  build:
                    steps:
                      - id: a
                        run: make
                      - id: a
                        run: make again
                      - id: bad id
                        uses: actions/checkout@v4
                      - id: neither
                      - just a string
                      - id: retry
                        run: make
                        retries: -1
                """);

        assertTrue(hasError(result, "jobs.build.steps[1].id"), "duplicate step id");
        assertTrue(hasError(result, "jobs.build.steps[2].id"), "invalid step id");
        assertTrue(hasError(result, "jobs.build.steps[3]"), "no run and no uses");
        assertTrue(hasError(result, "jobs.build.steps[4]"), "not a mapping");
        assertTrue(hasError(result, "jobs.build.steps[5].retries"), "negative retries");
    }

    @Test
    void testStrategyRules() {
        ValidationResult result = validate("""
                jobs:
                  test:
                    strategy:
                      max-parallel: 0
                      matrix:
                        os: []
                        include:
                          - os: windows
                        nested: [[1, 2]]
                    steps:
                      - id: t
                        run: test
                """);

        assertTrue(hasError(result, "jobs.test.strategy.max-parallel"));
        assertTrue(hasError(result, "jobs.test.strategy.matrix.os"));
        assertTrue(hasError(result, "jobs.test.strategy.matrix.include"));
        assertTrue(hasError(result, "jobs.test.strategy.matrix.nested[0]"));
    }

    @Test
    void testTimeoutRules() {
        ValidationResult result = validate("""
                jobs:
                  both:
                    timeout-minutes: 5
                    timeout: 5m
                    steps:
                      - id: s
                        run: s
                  negative:
                    timeout-minutes: 0
                    steps:
                      - id: s
                        run: s
                  garbage:
                    timeout: soon
                    steps:
                      - id: s
                        run: s
                """);

        assertTrue(hasError(result, "jobs.both.timeout"));
        assertTrue(hasError(result, "jobs.negative.timeout-minutes"));
        assertTrue(hasError(result, "jobs.garbage.timeout"));
    }

    @Test
    void testEnvAndOutputRules() {
        ValidationResult result = validate("""
                env:
                  1BAD: x
                jobs:
                  build:
                    env:
                      NESTED:
                        a: b
                    outputs:
                      result: [1, 2]
                    concurrency:
                      cancel-in-progress: true
                    continue-on-error: maybe
                    steps:
                      - id: s
                        run: s
                """);

        assertTrue(hasError(result, "env.1BAD"));
        assertTrue(hasError(result, "jobs.build.env.NESTED"));
        assertTrue(hasError(result, "jobs.build.outputs.result"));
        assertTrue(hasError(result, "jobs.build.concurrency.group"));
        assertTrue(hasError(result, "jobs.build.continue-on-error"));
    }

    @Test
    void testUnknownKeysAreWarnings() {
        ValidationResult result = validate("""
                flavour: vanilla
                jobs:
                  build:
                    colour: blue
                    steps:
                      - run: make
                        size: large
                """);

        assertTrue(result.isValid());
        assertTrue(result.getWarnings().stream().anyMatch(w -> "flavour".equals(w.getFieldPath())));
        assertTrue(result.getWarnings().stream().anyMatch(w -> "jobs.build.colour".equals(w.getFieldPath())));
        assertTrue(result.getWarnings().stream().anyMatch(w -> "jobs.build.steps[0].size".equals(w.getFieldPath())));
        assertTrue(result.getWarnings().stream().anyMatch(w -> "jobs.build.steps[0]".equals(w.getFieldPath())));
    }
}
