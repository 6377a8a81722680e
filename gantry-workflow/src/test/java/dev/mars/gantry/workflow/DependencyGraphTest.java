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

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
/**
 * Description for DependencyGraphTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 1.0
 */

class DependencyGraphTest {

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
    }

    @Test
    void testEmptyGraph() throws DependencyGraphException {
        assertTrue(graph.getJobs().isEmpty());
        assertTrue(graph.topologicalSort().isEmpty());
        assertFalse(graph.hasCycles());
        assertTrue(graph.validate().isValid());
    }

    @Test
    void testLinearDependency() throws DependencyGraphException {
        graph.addJob(createJob("build"));
        graph.addJob(createJob("test", "build"));
        graph.addJob(createJob("deploy", "test"));

        List<JobDefinition> sorted = graph.topologicalSort();
        assertEquals(List.of("build", "test", "deploy"), ids(sorted));
        assertFalse(graph.hasCycles());
    }

    @Test
    void testDiamondDependency() throws DependencyGraphException {
        // lint -> test -> release
        // compile -> test
        // docs -> release
        graph.addJob(createJob("release", "test", "docs"));
        graph.addJob(createJob("test", "lint", "compile"));
        graph.addJob(createJob("lint"));
        graph.addJob(createJob("compile"));
        graph.addJob(createJob("docs"));

        List<String> sorted = ids(graph.topologicalSort());
        assertEquals(5, sorted.size());
        assertTrue(sorted.indexOf("lint") < sorted.indexOf("test"));
        assertTrue(sorted.indexOf("compile") < sorted.indexOf("test"));
        assertTrue(sorted.indexOf("test") < sorted.indexOf("release"));
        assertTrue(sorted.indexOf("docs") < sorted.indexOf("release"));
    }

    @Test
    void testCircularDependency() {
        graph.addJob(createJob("a", "c"));
        graph.addJob(createJob("b", "a"));
        graph.addJob(createJob("c", "b"));
        graph.addJob(createJob("standalone"));

        assertTrue(graph.hasCycles());
        DependencyGraphException e = assertThrows(DependencyGraphException.class, () -> graph.topologicalSort());
        assertEquals(Set.of("a", "b", "c"), Set.copyOf(e.getJobIds()));

        ValidationResult result = graph.validate();
        assertFalse(result.isValid());
        assertTrue(result.getErrors().get(0).getMessage().contains("Circular dependency"));
    }

    @Test
    void testSelfDependency() {
        graph.addJob(createJob("build", "build"));

        ValidationResult result = graph.validate();
        assertFalse(result.isValid());
        assertEquals(1, result.getErrorCount());
        assertEquals("jobs.build.needs", result.getErrors().get(0).getFieldPath());
        assertTrue(result.getErrors().get(0).getMessage().contains("cannot depend on itself"));
    }

    @Test
    void testMissingDependency() {
        graph.addJob(createJob("deploy", "ghost"));

        ValidationResult result = graph.validate();
        assertFalse(result.isValid());
        assertTrue(result.getErrors().stream()
                .anyMatch(error -> error.getMessage().equals("Dependency 'ghost' not found")));
    }

    @Test
    void testGetDependencies() {
        graph.addJob(createJob("build"));
        graph.addJob(createJob("test", "build"));

        assertTrue(graph.getDependencies("build").isEmpty());
        assertEquals(Set.of("build"), graph.getDependencies("test"));
        assertTrue(graph.getDependencies("nonexistent").isEmpty());
    }

    @Test
    void testParallelExecutionBatches() throws DependencyGraphException {
        graph.addJob(createJob("lint"));
        graph.addJob(createJob("compile"));
        graph.addJob(createJob("unit", "compile"));
        graph.addJob(createJob("style", "lint"));
        graph.addJob(createJob("release", "unit", "style"));

        List<List<JobDefinition>> batches = graph.getParallelExecutionBatches();

        assertEquals(3, batches.size());
        assertEquals(Set.of("lint", "compile"), Set.copyOf(ids(batches.get(0))));
        assertEquals(Set.of("unit", "style"), Set.copyOf(ids(batches.get(1))));
        assertEquals(List.of("release"), ids(batches.get(2)));
    }

    @Test
    void testParallelExecutionBatchesWithCycle() {
        graph.addJob(createJob("a", "b"));
        graph.addJob(createJob("b", "a"));

        assertThrows(DependencyGraphException.class, () -> graph.getParallelExecutionBatches());
    }

    @Test
    void testOfWorkflowDefinition() {
        WorkflowDefinition definition = new WorkflowDefinition("ci", null, null,
                List.of(createJob("build"), createJob("test", "build")));

        DependencyGraph fromDefinition = DependencyGraph.of(definition);

        assertEquals(2, fromDefinition.getJobs().size());
        assertTrue(fromDefinition.validate().isValid());
        assertTrue(fromDefinition.toString().contains("DependencyGraph"));
    }

    private JobDefinition createJob(String id, String... needs) {
        return JobDefinition.builder(id)
                .needs(needs)
                .step(StepDefinition.builder().run("echo " + id).build())
                .build();
    }

    private List<String> ids(List<JobDefinition> jobs) {
        return jobs.stream().map(JobDefinition::getId).collect(Collectors.toList());
    }
}
