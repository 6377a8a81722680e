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

package dev.mars.gantry.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parameterized tests for ExecutionStatus transition validation.
 * Covers every (source, target) pair so the monotonic status law is pinned down.
 */
class ExecutionStatusTransitionTest {

    private static final EnumSet<ExecutionStatus> FROM_PENDING =
            EnumSet.of(ExecutionStatus.READY, ExecutionStatus.RUNNING,
                       ExecutionStatus.SKIPPED, ExecutionStatus.CANCELLED);

    private static final EnumSet<ExecutionStatus> FROM_READY =
            EnumSet.of(ExecutionStatus.RUNNING, ExecutionStatus.SKIPPED,
                       ExecutionStatus.FAILURE, ExecutionStatus.CANCELLED);

    private static final EnumSet<ExecutionStatus> FROM_RUNNING =
            EnumSet.of(ExecutionStatus.SUCCESS, ExecutionStatus.FAILURE, ExecutionStatus.CANCELLED);

    private static EnumSet<ExecutionStatus> validTargets(ExecutionStatus from) {
        return switch (from) {
            case PENDING -> FROM_PENDING;
            case READY -> FROM_READY;
            case RUNNING -> FROM_RUNNING;
            case SUCCESS, FAILURE, SKIPPED, CANCELLED -> EnumSet.noneOf(ExecutionStatus.class);
        };
    }

    static Stream<Arguments> allStatusPairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (ExecutionStatus from : ExecutionStatus.values()) {
            Set<ExecutionStatus> valid = validTargets(from);
            for (ExecutionStatus to : ExecutionStatus.values()) {
                pairs.add(Arguments.of(from, to, valid.contains(to)));
            }
        }
        return pairs.stream();
    }

    static Stream<ExecutionStatus> allStatuses() {
        return Arrays.stream(ExecutionStatus.values());
    }

    @ParameterizedTest(name = "{0} → {1} should be {2}")
    @MethodSource("allStatusPairs")
    void canTransitionTo_coversAllPairs(ExecutionStatus from, ExecutionStatus to, boolean expected) {
        assertEquals(expected, from.canTransitionTo(to),
                () -> String.format("%s → %s should be %s", from, to, expected ? "valid" : "invalid"));
    }

    @ParameterizedTest(name = "getValidTransitions consistent for {0}")
    @MethodSource("allStatuses")
    void getValidTransitions_matchesCanTransitionTo(ExecutionStatus from) {
        Set<ExecutionStatus> fromMethod = EnumSet.noneOf(ExecutionStatus.class);
        fromMethod.addAll(Arrays.asList(from.getValidTransitions()));

        Set<ExecutionStatus> fromCanTransition = EnumSet.noneOf(ExecutionStatus.class);
        for (ExecutionStatus to : ExecutionStatus.values()) {
            if (from.canTransitionTo(to)) {
                fromCanTransition.add(to);
            }
        }

        assertEquals(fromCanTransition, fromMethod);
    }

    @ParameterizedTest(name = "{0} → {0} self-transition should be invalid")
    @MethodSource("allStatuses")
    void selfTransition_isNeverValid(ExecutionStatus status) {
        assertFalse(status.canTransitionTo(status));
    }

    @Test
    void terminalStates_neverTransition() {
        for (ExecutionStatus status : ExecutionStatus.values()) {
            if (!status.isTerminal()) {
                continue;
            }
            assertEquals(0, status.getValidTransitions().length);
            for (ExecutionStatus target : ExecutionStatus.values()) {
                assertFalse(status.canTransitionTo(target),
                        () -> String.format("Terminal state %s should not transition to %s", status, target));
            }
        }
    }

    @Test
    void labelsAreLowerCase() {
        assertEquals("success", ExecutionStatus.SUCCESS.getLabel());
        assertEquals("cancelled", ExecutionStatus.CANCELLED.toString());
        assertTrue(ExecutionStatus.RUNNING.isActive());
        assertFalse(ExecutionStatus.PENDING.isActive());
    }
}
