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

package dev.mars.gantry.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class GantryConfigurationTest {

    @Test
    void testDefaults() {
        GantryConfiguration config = new GantryConfiguration(new Properties());

        assertEquals(4, config.getMaxParallelJobs());
        assertEquals(Duration.ofMinutes(360), config.getDefaultStepTimeout());
        assertEquals(1000, config.getRetryDelayMs());
        assertEquals("***", config.getLogMask());
        assertEquals("sh", config.getSandboxShell());
        assertEquals(2000, config.getSandboxTerminateGraceMs());
        assertEquals(50, config.getSandboxPollIntervalMs());
        assertTrue(config.getArtifactDirectory().endsWith("gantry-artifacts"));
    }

    @Test
    void testOverrides() {
        Properties props = new Properties();
        props.setProperty(GantryConfiguration.MAX_PARALLEL_JOBS, "8");
        props.setProperty(GantryConfiguration.DEFAULT_STEP_TIMEOUT, "90s");
        props.setProperty(GantryConfiguration.ARTIFACT_DIR, "/var/tmp/artifacts");

        GantryConfiguration config = new GantryConfiguration(props);

        assertEquals(8, config.getMaxParallelJobs());
        assertEquals(Duration.ofSeconds(90), config.getDefaultStepTimeout());
        assertEquals(Path.of("/var/tmp/artifacts"), config.getArtifactDirectory());
    }

    @Test
    void testInvalidValuesFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty(GantryConfiguration.MAX_PARALLEL_JOBS, "lots");
        props.setProperty(GantryConfiguration.RETRY_DELAY_MS, "soon");
        props.setProperty(GantryConfiguration.DEFAULT_STEP_TIMEOUT, "forever");

        GantryConfiguration config = new GantryConfiguration(props);

        assertEquals(4, config.getMaxParallelJobs());
        assertEquals(1000, config.getRetryDelayMs());
        assertEquals(Duration.ofMinutes(360), config.getDefaultStepTimeout());
    }

    @Test
    void testZeroParallelismRejected() {
        Properties props = new Properties();
        props.setProperty(GantryConfiguration.MAX_PARALLEL_JOBS, "0");

        assertEquals(4, new GantryConfiguration(props).getMaxParallelJobs());
    }

    @ParameterizedTest
    @CsvSource({
            "500ms, 500",
            "30s, 30000",
            "5m, 300000",
            "2h, 7200000",
            "1.5m, 90000",
            "45, 45000"
    })
    void testParseDuration(String text, long expectedMillis) {
        assertEquals(Duration.ofMillis(expectedMillis), GantryConfiguration.parseDuration(text));
    }

    @Test
    void testParseDurationRejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> GantryConfiguration.parseDuration(""));
        assertThrows(IllegalArgumentException.class, () -> GantryConfiguration.parseDuration("-5m"));
        assertThrows(IllegalArgumentException.class, () -> GantryConfiguration.parseDuration("tenm"));
    }
}
