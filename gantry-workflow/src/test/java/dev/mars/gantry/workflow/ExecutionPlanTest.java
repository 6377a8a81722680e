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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionPlanTest {

    private final YamlWorkflowDefinitionParser parser = new YamlWorkflowDefinitionParser();

    @Test
    void testMatrixExpansionOrder() throws Exception {
        ExecutionPlan plan = ExecutionPlan.build(parser.parseFromString("""
                name: matrix
                jobs:
                  test:
                    strategy:
                      matrix:
                        os: [linux, mac]
                        jdk: [11, 17]
                    steps:
                      - run: test
                """));

        assertEquals(List.of("test (linux, 11)", "test (linux, 17)", "test (mac, 11)", "test (mac, 17)"),
                plan.instancesOf("test"));
        JobInstance instance = plan.getInstance("test (mac, 11)");
        assertEquals("test", instance.getJobId());
        assertEquals(Map.of("os", "mac", "jdk", 11), instance.getMatrix());
        assertTrue(instance.getUpstream().isEmpty());
    }

    @Test
    void testDownstreamWaitsForEveryMatrixInstance() throws Exception {
        ExecutionPlan plan = ExecutionPlan.build(parser.parseFromString("""
                name: fan-in
                jobs:
                  publish:
                    needs: build
                    steps:
                      - run: publish
                  build:
                    strategy:
                      matrix:
                        arch: [x64, arm64]
                    steps:
                      - run: build
                """));

        assertEquals(3, plan.size());
        assertEquals(List.of("build (x64)", "build (arm64)"), plan.upstream("publish"));
        assertEquals(Set.of("build (x64)", "build (arm64)"), plan.readySet(Set.of()));
        assertEquals(Set.of("build (arm64)"), plan.readySet(Set.of("build (x64)")));
        assertEquals(Set.of("publish"), plan.readySet(Set.of("build (x64)", "build (arm64)")));
        assertEquals(List.of(), plan.upstream("unknown"));
    }

    @Test
    void testReadySetSequenceIsTopological() throws Exception {
        ExecutionPlan plan = ExecutionPlan.build(parser.parseFromString("""
                name: pipeline
                jobs:
                  release:
                    needs: [test, docs]
                    steps:
                      - run: release
                  test:
                    needs: [compile, lint]
                    steps:
                      - run: test
                  compile:
                    steps:
                      - run: compile
                  lint:
                    steps:
                      - run: lint
                  docs:
                    needs: compile
                    steps:
                      - run: docs
                """));

        Set<String> completed = new HashSet<>();
        List<String> order = new ArrayList<>();
        while (completed.size() < plan.size()) {
            Set<String> ready = plan.readySet(completed);
            assertFalse(ready.isEmpty());
            for (String id : ready) {
                assertTrue(completed.containsAll(plan.upstream(id)));
            }
            order.addAll(ready);
            completed.addAll(ready);
        }
        assertEquals(5, order.size());
        assertTrue(order.indexOf("compile") < order.indexOf("docs"));
        assertTrue(order.indexOf("docs") < order.indexOf("release"));
        assertTrue(order.indexOf("test") < order.indexOf("release"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "a: [b]\nb: [a]",
            "a: [a]",
            "a: [c]\nb: [a]\nc: [b]",
            "a: [missing]"
    })
    void testInvalidGraphsAreRejected(String edges) {
        StringBuilder yaml = new StringBuilder("name: broken\njobs:\n");
        for (String edge : edges.split("\n")) {
            String[] parts = edge.split(": ");
            yaml.append("  ").append(parts[0]).append(":\n")
                .append("    needs: ").append(parts[1]).append('\n')
                .append("    steps:\n      - run: x\n");
        }

        DependencyGraphException e = assertThrows(DependencyGraphException.class,
                () -> ExecutionPlan.build(parser.parseFromString(yaml.toString())));
        assertFalse(e.getJobIds().isEmpty());
        assertTrue(e.getMessage().startsWith("Dependency graph validation failed"));
    }

    @Test
    void testDuplicateMatrixInstanceIsRejected() throws Exception {
        WorkflowDefinition definition = parser.parseFromString("""
                name: duplicate
                jobs:
                  test:
                    strategy:
                      matrix:
                        os: [linux, linux]
                    steps:
                      - run: test
                """);

        DependencyGraphException e = assertThrows(DependencyGraphException.class,
                () -> ExecutionPlan.build(definition));
        assertEquals(List.of("test"), e.getJobIds());
    }
}
