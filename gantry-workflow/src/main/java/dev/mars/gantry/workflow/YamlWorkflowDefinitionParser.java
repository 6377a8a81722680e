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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.mars.gantry.config.GantryConfiguration;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 * Parses workflow documents using SnakeYAML's safe constructor, validates their
 * structure and builds the immutable model.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private static final Logger logger = LoggerFactory.getLogger(YamlWorkflowDefinitionParser.class);

    static final String DEFAULT_WORKFLOW_NAME = "workflow";

    private final Yaml yaml;
    private final WorkflowSchemaValidator schemaValidator;

    public YamlWorkflowDefinitionParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.schemaValidator = new WorkflowSchemaValidator();
    }

    @Override
    public WorkflowDefinition parse(Path workflowFile) throws WorkflowParseException {
        String content;
        try {
            content = Files.readString(workflowFile);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read workflow file: " + workflowFile, e);
        }
        String fileName = workflowFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return parse(content, dot > 0 ? fileName.substring(0, dot) : fileName);
    }

    @Override
    public WorkflowDefinition parseFromString(String content) throws WorkflowParseException {
        return parse(content, DEFAULT_WORKFLOW_NAME);
    }

    @Override
    public ValidationResult validate(WorkflowDefinition definition) {
        ValidationResult result = new ValidationResult();

        if (definition.getName().trim().isEmpty()) {
            result.addError("name", "Workflow name cannot be empty");
        }
        if (definition.getJobs().isEmpty()) {
            result.addError("jobs", "At least one job is required");
        }

        for (JobDefinition job : definition.getJobList()) {
            if (job.getSteps().isEmpty()) {
                result.addWarning("jobs." + job.getId() + ".steps", "Job defines no steps");
            }
            List<String> stepIds = new ArrayList<>();
            for (StepDefinition step : job.getSteps()) {
                if (step.getId() == null) {
                    continue;
                }
                if (stepIds.contains(step.getId())) {
                    result.addError("jobs." + job.getId() + ".steps[" + step.getIndex() + "].id",
                            "Duplicate step id '" + step.getId() + "'");
                }
                stepIds.add(step.getId());
            }
        }

        DependencyGraph graph = new DependencyGraph();
        for (JobDefinition job : definition.getJobList()) {
            graph.addJob(job);
        }
        result.merge(graph.validate());

        return result;
    }

    @Override
    public ValidationResult validateSchema(String content) {
        ValidationResult result = new ValidationResult();
        try {
            Object data = yaml.load(content);
            if (!(data instanceof Map)) {
                result.addError("Workflow document must be a mapping");
                return result;
            }
            result.merge(schemaValidator.validateWorkflowSchema((Map<?, ?>) data));
        } catch (YAMLException e) {
            result.addError("YAML syntax error: " + e.getMessage());
        }
        return result;
    }

    private WorkflowDefinition parse(String content, String defaultName) throws WorkflowParseException {
        Object data;
        try {
            data = yaml.load(content);
        } catch (MarkedYAMLException e) {
            int line = e.getProblemMark() != null ? e.getProblemMark().getLine() + 1 : -1;
            throw new WorkflowParseException(line, null, "YAML syntax error: " + e.getProblem(), e);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (data == null) {
            throw new WorkflowParseException("Empty workflow document");
        }
        if (!(data instanceof Map)) {
            throw new WorkflowParseException("Workflow document must be a mapping");
        }
        Map<?, ?> root = (Map<?, ?>) data;

        ValidationResult validation = schemaValidator.validateWorkflowSchema(root);
        for (ValidationResult.ValidationIssue issue : validation.getIssues()) {
            if (issue.getSeverity() == ValidationResult.ValidationIssue.Severity.ERROR) {
                logger.error("Workflow validation error: {}", issue);
            } else {
                logger.warn("Workflow validation warning: {}", issue);
            }
        }
        if (!validation.isValid()) {
            ValidationResult.ValidationIssue first = validation.getErrors().get(0);
            String message = first.getMessage();
            if (validation.getErrorCount() > 1) {
                message += " (and " + (validation.getErrorCount() - 1) + " more error(s))";
            }
            throw new WorkflowParseException(first.getFieldPath(), message);
        }

        return parseWorkflowDefinition(root, defaultName);
    }

    private WorkflowDefinition parseWorkflowDefinition(Map<?, ?> data, String defaultName) throws WorkflowParseException {
        String name = getStringValue(data, "name", defaultName);
        Map<String, String> env = parseStringMap(data.get("env"));
        Map<String, Object> triggers = parseTriggers(data.containsKey("on") ? data.get("on") : data.get(Boolean.TRUE));

        List<JobDefinition> jobs = new ArrayList<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) data.get("jobs")).entrySet()) {
            String jobId = String.valueOf(entry.getKey());
            try {
                jobs.add(parseJob(jobId, (Map<?, ?>) entry.getValue()));
            } catch (WorkflowParseException e) {
                throw new WorkflowParseException(prefix("jobs." + jobId, e.getFieldPath()), e.getProblem());
            } catch (IllegalArgumentException e) {
                throw new WorkflowParseException("jobs." + jobId, e.getMessage());
            }
        }

        return new WorkflowDefinition(name, env, triggers, jobs);
    }

    private JobDefinition parseJob(String jobId, Map<?, ?> data) throws WorkflowParseException {
        JobDefinition.Builder builder = JobDefinition.builder(jobId)
                .name(getStringValue(data, "name", null))
                .needs(parseStringList(data.get("needs")))
                .condition(getStringValue(data, "if", null))
                .env(parseStringMap(data.get("env")))
                .outputs(parseStringMap(data.get("outputs")))
                .continueOnError(getBooleanValue(data, "continue-on-error", false))
                .timeout(parseTimeout(data));

        Object concurrency = data.get("concurrency");
        if (concurrency instanceof String) {
            builder.concurrency((String) concurrency, true);
        } else if (concurrency instanceof Map) {
            Map<?, ?> concurrencyMap = (Map<?, ?>) concurrency;
            builder.concurrency(getStringValue(concurrencyMap, "group", null),
                    getBooleanValue(concurrencyMap, "cancel-in-progress", true));
        }

        Object strategy = data.get("strategy");
        if (strategy instanceof Map) {
            builder.strategy(parseStrategy((Map<?, ?>) strategy));
        }

        Object steps = data.get("steps");
        if (steps instanceof List) {
            List<?> stepList = (List<?>) steps;
            for (int i = 0; i < stepList.size(); i++) {
                try {
                    builder.step(parseStep(i, (Map<?, ?>) stepList.get(i)));
                } catch (IllegalArgumentException e) {
                    throw new WorkflowParseException("steps[" + i + "]", e.getMessage());
                }
            }
        }

        return builder.build();
    }

    private MatrixStrategy parseStrategy(Map<?, ?> data) {
        Map<String, List<Object>> dimensions = new LinkedHashMap<>();
        Object matrix = data.get("matrix");
        if (matrix instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) matrix).entrySet()) {
                dimensions.put(String.valueOf(entry.getKey()), new ArrayList<>((List<?>) entry.getValue()));
            }
        }
        Object maxParallel = data.get("max-parallel");
        return new MatrixStrategy(dimensions,
                getBooleanValue(data, "fail-fast", true),
                maxParallel instanceof Integer ? (Integer) maxParallel : null);
    }

    private StepDefinition parseStep(int index, Map<?, ?> data) {
        Object retries = data.get("retries");
        return StepDefinition.builder()
                .index(index)
                .id(getStringValue(data, "id", null))
                .name(getStringValue(data, "name", null))
                .run(getStringValue(data, "run", null))
                .uses(getStringValue(data, "uses", null))
                .with(parseStringMap(data.get("with")))
                .env(parseStringMap(data.get("env")))
                .condition(getStringValue(data, "if", null))
                .continueOnError(getBooleanValue(data, "continue-on-error", false))
                .timeout(parseTimeout(data))
                .workingDirectory(getStringValue(data, "working-directory", null))
                .retries(retries instanceof Integer ? (Integer) retries : 0)
                .build();
    }

    /**
     * Accepts {@code on: push}, {@code on: [push, pull_request]} and the mapping form.
     */
    private Map<String, Object> parseTriggers(Object value) {
        Map<String, Object> triggers = new LinkedHashMap<>();
        if (value instanceof String) {
            triggers.put((String) value, null);
        } else if (value instanceof List) {
            for (Object item : (List<?>) value) {
                triggers.put(String.valueOf(item), null);
            }
        } else if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                triggers.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        return triggers;
    }

    private Duration parseTimeout(Map<?, ?> data) {
        Object minutes = data.get("timeout-minutes");
        if (minutes instanceof Number) {
            return Duration.ofMillis(Math.round(((Number) minutes).doubleValue() * 60_000));
        }
        Object timeout = data.get("timeout");
        if (timeout != null) {
            return GantryConfiguration.parseDuration(String.valueOf(timeout));
        }
        return null;
    }

    // Utility methods for safe type conversion
    private String getStringValue(Map<?, ?> data, String key, String defaultValue) {
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private boolean getBooleanValue(Map<?, ?> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return defaultValue;
    }

    private Map<String, String> parseStringMap(Object value) {
        Map<String, String> result = new LinkedHashMap<>();
        if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                result.put(String.valueOf(entry.getKey()), entry.getValue() != null ? entry.getValue().toString() : "");
            }
        }
        return result;
    }

    private List<String> parseStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof String) {
            result.add((String) value);
        } else if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }

    private static String prefix(String parent, String child) {
        if (child == null || child.isEmpty()) {
            return parent;
        }
        return child.startsWith("[") ? parent + child : parent + "." + child;
    }
}
