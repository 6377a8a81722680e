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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration management for Gantry.
 * Layers built-in defaults, the first readable {@code gantry.properties} and
 * {@code gantry.*} system properties, in that order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class GantryConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(GantryConfiguration.class);

    public static final String MAX_PARALLEL_JOBS = "gantry.run.max.parallel.jobs";
    public static final String DEFAULT_STEP_TIMEOUT = "gantry.step.timeout.default";
    public static final String RETRY_DELAY_MS = "gantry.step.retry.delay.ms";
    public static final String LOG_MASK = "gantry.log.mask";
    public static final String SANDBOX_SHELL = "gantry.sandbox.shell";
    public static final String SANDBOX_TERMINATE_GRACE_MS = "gantry.sandbox.terminate.grace.ms";
    public static final String SANDBOX_POLL_INTERVAL_MS = "gantry.sandbox.poll.interval.ms";
    public static final String ARTIFACT_DIR = "gantry.artifact.dir";

    // Default configuration values
    private static final int DEFAULT_MAX_PARALLEL_JOBS = 4;
    private static final String DEFAULT_STEP_TIMEOUT_VALUE = "360m";
    private static final long DEFAULT_RETRY_DELAY_MS = 1000;
    private static final String DEFAULT_LOG_MASK = "***";
    private static final String DEFAULT_SANDBOX_SHELL = "sh";
    private static final long DEFAULT_TERMINATE_GRACE_MS = 2000;
    private static final long DEFAULT_POLL_INTERVAL_MS = 50;
    private static final String DEFAULT_ARTIFACT_DIR =
            Paths.get(System.getProperty("java.io.tmpdir"), "gantry-artifacts").toString();

    private final Properties properties;

    public GantryConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public GantryConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Scheduler
    public int getMaxParallelJobs() {
        int value = getIntProperty(MAX_PARALLEL_JOBS, DEFAULT_MAX_PARALLEL_JOBS);
        if (value < 1) {
            logger.warn("Property {} must be at least 1, got {}. Using default: {}",
                    MAX_PARALLEL_JOBS, value, DEFAULT_MAX_PARALLEL_JOBS);
            return DEFAULT_MAX_PARALLEL_JOBS;
        }
        return value;
    }

    // Steps
    public Duration getDefaultStepTimeout() {
        String value = properties.getProperty(DEFAULT_STEP_TIMEOUT, DEFAULT_STEP_TIMEOUT_VALUE);
        try {
            return parseDuration(value);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid duration for property {}: {}. Using default: {}",
                    DEFAULT_STEP_TIMEOUT, value, DEFAULT_STEP_TIMEOUT_VALUE);
            return parseDuration(DEFAULT_STEP_TIMEOUT_VALUE);
        }
    }

    public long getRetryDelayMs() {
        return getLongProperty(RETRY_DELAY_MS, DEFAULT_RETRY_DELAY_MS);
    }

    public String getLogMask() {
        return getStringProperty(LOG_MASK, DEFAULT_LOG_MASK);
    }

    // Sandbox
    public String getSandboxShell() {
        return getStringProperty(SANDBOX_SHELL, DEFAULT_SANDBOX_SHELL);
    }

    public long getSandboxTerminateGraceMs() {
        return getLongProperty(SANDBOX_TERMINATE_GRACE_MS, DEFAULT_TERMINATE_GRACE_MS);
    }

    public long getSandboxPollIntervalMs() {
        return getLongProperty(SANDBOX_POLL_INTERVAL_MS, DEFAULT_POLL_INTERVAL_MS);
    }

    // Artifacts
    public Path getArtifactDirectory() {
        return Paths.get(getStringProperty(ARTIFACT_DIR, DEFAULT_ARTIFACT_DIR));
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    /**
     * Parses a duration written as a number with an optional unit suffix:
     * {@code ms}, {@code s}, {@code m} or {@code h}. A bare number means seconds.
     *
     * @throws IllegalArgumentException if the text is not a non-negative duration
     */
    public static Duration parseDuration(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Duration cannot be empty");
        }
        String value = text.trim().toLowerCase(Locale.ROOT);
        String number;
        double multiplierMs;
        if (value.endsWith("ms")) {
            number = value.substring(0, value.length() - 2);
            multiplierMs = 1;
        } else if (value.endsWith("s")) {
            number = value.substring(0, value.length() - 1);
            multiplierMs = 1000;
        } else if (value.endsWith("m")) {
            number = value.substring(0, value.length() - 1);
            multiplierMs = 60_000;
        } else if (value.endsWith("h")) {
            number = value.substring(0, value.length() - 1);
            multiplierMs = 3_600_000;
        } else {
            number = value;
            multiplierMs = 1000;
        }

        double amount;
        try {
            amount = Double.parseDouble(number.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration: " + text, e);
        }
        if (amount < 0 || Double.isNaN(amount) || Double.isInfinite(amount)) {
            throw new IllegalArgumentException("Invalid duration: " + text);
        }
        return Duration.ofMillis(Math.round(amount * multiplierMs));
    }

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(MAX_PARALLEL_JOBS, String.valueOf(DEFAULT_MAX_PARALLEL_JOBS));
        properties.setProperty(DEFAULT_STEP_TIMEOUT, DEFAULT_STEP_TIMEOUT_VALUE);
        properties.setProperty(RETRY_DELAY_MS, String.valueOf(DEFAULT_RETRY_DELAY_MS));
        properties.setProperty(LOG_MASK, DEFAULT_LOG_MASK);
        properties.setProperty(SANDBOX_SHELL, DEFAULT_SANDBOX_SHELL);
        properties.setProperty(SANDBOX_TERMINATE_GRACE_MS, String.valueOf(DEFAULT_TERMINATE_GRACE_MS));
        properties.setProperty(SANDBOX_POLL_INTERVAL_MS, String.valueOf(DEFAULT_POLL_INTERVAL_MS));
        properties.setProperty(ARTIFACT_DIR, DEFAULT_ARTIFACT_DIR);
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "gantry.properties",
                "config/gantry.properties",
                System.getProperty("user.home") + "/.gantry/gantry.properties",
                "/etc/gantry/gantry.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("gantry.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("gantry."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "GantryConfiguration{" +
                "maxParallelJobs=" + getMaxParallelJobs() +
                ", defaultStepTimeout=" + getDefaultStepTimeout() +
                ", retryDelayMs=" + getRetryDelayMs() +
                ", sandboxShell='" + getSandboxShell() + '\'' +
                '}';
    }
}
