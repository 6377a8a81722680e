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
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
/**
 * Description for YamlWorkflowDefinitionParserTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 1.0
 */

class YamlWorkflowDefinitionParserTest {

    private YamlWorkflowDefinitionParser parser;

    @BeforeEach
    void setUp() {
        parser = new YamlWorkflowDefinitionParser();
    }

    @Test
    void testParseSimpleWorkflow() throws WorkflowParseException {
        String yaml = """
                name: CI
                on: [push, pull_request]
                env:
                  GREETING: hello

                jobs:
                  build:
                    name: Build the project
                    runs-on: ubuntu-latest
                    steps:
                      - name: Compile
                        run: mvn -B compile
                      - id: package
                        run: |
                          mvn -B package
                          ls target
                """;

        WorkflowDefinition definition = parser.parseFromString(yaml);

        assertEquals("CI", definition.getName());
        assertEquals(Map.of("GREETING", "hello"), definition.getEnv());
        assertTrue(definition.getTriggers().containsKey("push"));
        assertTrue(definition.getTriggers().containsKey("pull_request"));

        JobDefinition build = definition.getJob("build");
        assertEquals("Build the project", build.getDisplayName());
        assertEquals(2, build.getSteps().size());

        StepDefinition compile = build.getSteps().get(0);
        assertEquals(0, compile.getIndex());
        assertEquals("Compile", compile.getDisplayName());
        assertEquals("mvn -B compile", compile.getRun());

        StepDefinition pack = build.getSteps().get(1);
        assertEquals(1, pack.getIndex());
        assertEquals("package", pack.getId());
        assertEquals("mvn -B package\nls target\n", pack.getRun());
    }

    @Test
    void testParseJobFeatures() throws WorkflowParseException {
        String yaml = """
                name: features
                jobs:
                  lint:
                    steps:
                      - run: lint
                  test:
                    needs: lint
                    if: github.ref == 'main'
                    continue-on-error: true
                    timeout-minutes: 10
                    env:
                      LEVEL: 3
                    outputs:
                      report: ${{ steps.run.outputs.report }}
                    strategy:
                      fail-fast: false
                      max-parallel: 2
                      matrix:
                        os: [linux, windows]
                        jdk: [11, 17]
                    concurrency:
                      group: test-${{ matrix.os }}
                      cancel-in-progress: false
                    steps:
                      - id: run
                        run: test
                        timeout: 90s
                        retries: 2
                        continue-on-error: true
                        working-directory: module
                        env:
                          DEBUG: true
                  deploy:
                    needs: [lint, test]
                    concurrency: production
                    steps:
                      - uses: actions/upload-artifact@v4
                        with:
                          name: dist
                          path: target
                """;

        WorkflowDefinition definition = parser.parseFromString(yaml);

        JobDefinition test = definition.getJob("test");
        assertEquals(List.of("lint"), test.getNeeds());
        assertEquals("github.ref == 'main'", test.getCondition());
        assertTrue(test.isContinueOnError());
        assertEquals(Duration.ofMinutes(10), test.getTimeout());
        assertEquals(Map.of("LEVEL", "3"), test.getEnv());
        assertEquals("${{ steps.run.outputs.report }}", test.getOutputs().get("report"));
        assertEquals("test-${{ matrix.os }}", test.getConcurrencyGroup());
        assertFalse(test.isCancelInProgress());

        MatrixStrategy strategy = test.getStrategy();
        assertTrue(test.hasMatrix());
        assertFalse(strategy.isFailFast());
        assertEquals(2, strategy.getMaxParallel());
        assertEquals(4, strategy.size());
        assertEquals(List.of(11, 17), strategy.getDimensions().get("jdk"));

        StepDefinition step = test.getSteps().get(0);
        assertEquals(Duration.ofSeconds(90), step.getTimeout());
        assertEquals(2, step.getRetries());
        assertTrue(step.isContinueOnError());
        assertEquals("module", step.getWorkingDirectory());
        assertEquals(Map.of("DEBUG", "true"), step.getEnv());

        JobDefinition deploy = definition.getJob("deploy");
        assertEquals(List.of("lint", "test"), deploy.getNeeds());
        assertEquals("production", deploy.getConcurrencyGroup());
        assertTrue(deploy.isCancelInProgress());
        StepDefinition upload = deploy.getSteps().get(0);
        assertEquals("actions/upload-artifact@v4", upload.getUses());
        assertEquals(Map.of("name", "dist", "path", "target"), upload.getWith());
        assertEquals("actions/upload-artifact@v4", upload.getDisplayName());
    }

    @Test
    void testParseFromFileUsesFileNameAsDefaultName(@TempDir Path directory) throws Exception {
        Path file = directory.resolve("nightly.yml");
        Files.writeString(file, """
                jobs:
                  build:
                    steps:
                      - run: build
                """);

        WorkflowDefinition definition = parser.parse(file);

        assertEquals("nightly", definition.getName());
        assertEquals(1, definition.getJobs().size());
    }

    @Test
    void testParseMissingFile(@TempDir Path directory) {
        WorkflowParseException e = assertThrows(WorkflowParseException.class,
                () -> parser.parse(directory.resolve("missing.yml")));
        assertTrue(e.getMessage().startsWith("Failed to read workflow file"));
    }

    @Test
    void testInvalidYamlSyntax() {
        String yaml = """
                name: broken
                jobs:
                  build:
                    steps: [
                """;

        WorkflowParseException e = assertThrows(WorkflowParseException.class, () -> parser.parseFromString(yaml));
        assertTrue(e.getLineNumber() > 0);
        assertTrue(e.getMessage().startsWith("Line "));
    }

    @Test
    void testEmptyDocument() {
        WorkflowParseException e = assertThrows(WorkflowParseException.class, () -> parser.parseFromString(""));
        assertEquals("Empty workflow document", e.getMessage());
    }

    @Test
    void testDocumentMustBeMapping() {
        assertThrows(WorkflowParseException.class, () -> parser.parseFromString("- just\n- a list\n"));
    }

    @Test
    void testStepWithRunAndUsesIsRejected() {
        String yaml = """
                name: both
                jobs:
                  build:
                    steps:
                      - run: build
                        uses: actions/checkout@v4
                """;

        WorkflowParseException e = assertThrows(WorkflowParseException.class, () -> parser.parseFromString(yaml));
        assertEquals("jobs.build.steps[0]", e.getFieldPath());
        assertEquals("Step must declare exactly one of 'run' or 'uses'", e.getProblem());
    }

    @Test
    void testErrorCountIsReported() {
        String yaml = """
                name: many
                jobs:
                  build:
                    timeout-minutes: -1
                    steps:
                      - name: nothing
                """;

        WorkflowParseException e = assertThrows(WorkflowParseException.class, () -> parser.parseFromString(yaml));
        assertTrue(e.getProblem().endsWith("(and 1 more error(s))"));
    }

    @Test
    void testDuplicateKeysAreRejected() {
        String yaml = """
                name: dup
                jobs:
                  build:
                    steps:
                      - run: a
                  build:
                    steps:
                      - run: b
                """;

        assertThrows(WorkflowParseException.class, () -> parser.parseFromString(yaml));
    }

    @Test
    void testValidateDefinition() throws WorkflowParseException {
        WorkflowDefinition definition = parser.parseFromString("""
                name: graph
                jobs:
                  a:
                    needs: b
                    steps:
                      - run: a
                  b:
                    needs: a
                  c:
                    needs: ghost
                    steps:
                      - run: c
                """);

        ValidationResult result = parser.validate(definition);

        assertFalse(result.isValid());
        assertTrue(result.hasWarnings());
        assertTrue(result.getWarnings().stream().anyMatch(w -> w.getFieldPath().equals("jobs.b.steps")));
        assertTrue(result.getErrors().stream().anyMatch(e -> e.getMessage().contains("ghost")));
        assertTrue(result.getErrors().stream().anyMatch(e -> e.getMessage().contains("Circular dependency")));
    }

    @Test
    void testValidateSchemaReportsWithoutThrowing() {
        ValidationResult syntax = parser.validateSchema("jobs: [");
        assertFalse(syntax.isValid());
        assertTrue(syntax.getErrors().get(0).getMessage().startsWith("YAML syntax error"));

        ValidationResult schema = parser.validateSchema("""
                name: ok
                unknown: value
                jobs:
                  build:
                    steps:
                      - run: build
                """);
        assertTrue(schema.isValid());
        assertTrue(schema.getWarnings().stream().anyMatch(w -> w.getFieldPath().equals("unknown")));
    }

    @Test
    void testIssuesListErrorsBeforeWarnings() {
        ValidationResult result = parser.validateSchema("""
                name: mixed
                flavour: vanilla
                jobs:
                  build:
                    steps: oops
                """);

        List<ValidationResult.ValidationIssue> issues = result.getIssues();
        assertEquals(result.getErrorCount() + result.getWarningCount(), issues.size());
        assertFalse(result.isValid());
        assertEquals(ValidationResult.ValidationIssue.Severity.ERROR, issues.get(0).getSeverity());
        assertEquals(ValidationResult.ValidationIssue.Severity.WARNING, issues.get(issues.size() - 1).getSeverity());
        assertTrue(issues.stream().anyMatch(issue -> "flavour".equals(issue.getFieldPath())
                && issue.getSeverity() == ValidationResult.ValidationIssue.Severity.WARNING));
    }
}
