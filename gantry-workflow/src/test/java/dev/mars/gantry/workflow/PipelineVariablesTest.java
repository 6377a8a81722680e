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

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineVariablesTest {

    @Test
    void testParse() {
        Map<String, String> variables = PipelineVariables.parse("ENV=prod; REGION = eu-west-1 ;DEBUG=");

        assertEquals(List.of("ENV", "REGION", "DEBUG"), List.copyOf(variables.keySet()));
        assertEquals("prod", variables.get("ENV"));
        assertEquals("eu-west-1", variables.get("REGION"));
        assertEquals("", variables.get("DEBUG"));
    }

    @Test
    void testValueMayContainEquals() {
        assertEquals("a=b", PipelineVariables.parse("QUERY=a=b").get("QUERY"));
    }

    @Test
    void testLaterEntryWins() {
        assertEquals("2", PipelineVariables.parse("X=1;X=2").get("X"));
    }

    @Test
    void testEmptyInput() {
        assertTrue(PipelineVariables.parse(null).isEmpty());
        assertTrue(PipelineVariables.parse("  ").isEmpty());
        assertTrue(PipelineVariables.parse(";;").isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"NOVALUE", "1ABC=x", "=x", "BAD-NAME=x", "A=1; B"})
    void testInvalidEntries(String text) {
        assertThrows(IllegalArgumentException.class, () -> PipelineVariables.parse(text));
    }
}
