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

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import dev.mars.gantry.config.GantryConfiguration;

/**
 * Structural validator for raw workflow documents, as loaded by SnakeYAML.
 * Checks required fields, identifier syntax, value shapes and reports unknown keys
 * as warnings.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowSchemaValidator {

    static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_-]*$");
    static final Pattern ENV_KEY_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private static final Set<String> ROOT_KEYS = Set.of(
        "name", "run-name", "on", "env", "jobs", "concurrency", "defaults", "permissions"
    );

    // runs-on and friends describe placement, which the executor does not act on
    private static final Set<String> JOB_KEYS = Set.of(
        "name", "needs", "if", "steps", "env", "outputs", "strategy", "concurrency",
        "continue-on-error", "timeout-minutes", "timeout",
        "runs-on", "permissions", "environment", "defaults", "services", "container"
    );

    private static final Set<String> STEP_KEYS = Set.of(
        "id", "name", "run", "uses", "with", "env", "if", "continue-on-error",
        "timeout-minutes", "timeout", "working-directory", "retries", "shell"
    );

    private static final Set<String> STRATEGY_KEYS = Set.of("matrix", "fail-fast", "max-parallel");

    /**
     * Validates a whole document.
     */
    public ValidationResult validateWorkflowSchema(Map<?, ?> data) {
        ValidationResult result = new ValidationResult();
        if (data == null) {
            result.addError("Workflow document is empty");
            return result;
        }

        validateRootStructure(data, result);

        Object jobs = data.get("jobs");
        if (jobs instanceof Map) {
            Map<?, ?> jobMap = (Map<?, ?>) jobs;
            if (jobMap.isEmpty()) {
                result.addError("jobs", "At least one job is required");
            }
            for (Map.Entry<?, ?> entry : jobMap.entrySet()) {
                validateJob(String.valueOf(entry.getKey()), entry.getValue(), result);
            }
        }

        return result;
    }

    private void validateRootStructure(Map<?, ?> data, ValidationResult result) {
        if (!data.containsKey("jobs")) {
            result.addError("jobs", "Required field 'jobs' is missing");
        } else if (!(data.get("jobs") instanceof Map)) {
            result.addError("jobs", "Field 'jobs' must be a mapping of job id to job");
        }

        Object name = data.get("name");
        if (name != null && !(name instanceof String)) {
            result.addError("name", "Workflow name must be a string");
        }

        validateEnv("env", data.get("env"), result);

        for (Object key : data.keySet()) {
            // YAML 1.1 reads a bare 'on' key as boolean true
            if (Boolean.TRUE.equals(key)) {
                continue;
            }
            if (!ROOT_KEYS.contains(String.valueOf(key))) {
                result.addWarning(String.valueOf(key), "Unknown workflow key '" + key + "' is ignored");
            }
        }
    }

    private void validateJob(String jobId, Object value, ValidationResult result) {
        String path = "jobs." + jobId;
        if (!IDENTIFIER_PATTERN.matcher(jobId).matches()) {
            result.addError(path, "Job id '" + jobId + "' must start with a letter or '_' and contain only letters, digits, '-' and '_'");
        }
        if (!(value instanceof Map)) {
            result.addError(path, "Job must be a mapping");
            return;
        }
        Map<?, ?> job = (Map<?, ?>) value;

        for (Object key : job.keySet()) {
            if (!JOB_KEYS.contains(String.valueOf(key))) {
                result.addWarning(path + "." + key, "Unknown job key '" + key + "' is ignored");
            }
        }

        validateStringOrStringList(path + ".needs", job.get("needs"), result);
        validateScalar(path + ".if", job.get("if"), result);
        validateBoolean(path + ".continue-on-error", job.get("continue-on-error"), result);
        validateTimeout(path, job, result);
        validateEnv(path + ".env", job.get("env"), result);
        validateOutputs(path + ".outputs", job.get("outputs"), result);
        validateConcurrency(path + ".concurrency", job.get("concurrency"), result);
        validateStrategy(path + ".strategy", job.get("strategy"), result);

        Object steps = job.get("steps");
        if (steps == null) {
            result.addWarning(path + ".steps", "Job defines no steps");
        } else if (!(steps instanceof List)) {
            result.addError(path + ".steps", "Steps must be a list");
        } else {
            validateSteps(path + ".steps", (List<?>) steps, result);
        }
    }

    private void validateSteps(String path, List<?> steps, ValidationResult result) {
        if (steps.isEmpty()) {
            result.addWarning(path, "Job defines no steps");
        }
        Set<String> ids = new HashSet<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < steps.size(); i++) {
            String stepPath = path + "[" + i + "]";
            Object value = steps.get(i);
            if (!(value instanceof Map)) {
                result.addError(stepPath, "Step must be a mapping");
                continue;
            }
            Map<?, ?> step = (Map<?, ?>) value;

            for (Object key : step.keySet()) {
                if (!STEP_KEYS.contains(String.valueOf(key))) {
                    result.addWarning(stepPath + "." + key, "Unknown step key '" + key + "' is ignored");
                }
            }

            boolean hasRun = step.get("run") != null;
            boolean hasUses = step.get("uses") != null;
            if (hasRun == hasUses) {
                result.addError(stepPath, "Step must declare exactly one of 'run' or 'uses'");
            }
            if (hasRun && !(step.get("run") instanceof String)) {
                result.addError(stepPath + ".run", "Field 'run' must be a string");
            }
            if (hasUses && !(step.get("uses") instanceof String)) {
                result.addError(stepPath + ".uses", "Field 'uses' must be a string");
            }

            Object id = step.get("id");
            if (id != null) {
                String idText = String.valueOf(id);
                if (!IDENTIFIER_PATTERN.matcher(idText).matches()) {
                    result.addError(stepPath + ".id", "Step id '" + idText + "' is not a valid identifier");
                } else if (!ids.add(idText)) {
                    result.addError(stepPath + ".id", "Duplicate step id '" + idText + "'");
                }
            }

            Object name = step.get("name");
            if (name != null && !names.add(String.valueOf(name))) {
                result.addWarning(stepPath + ".name", "Duplicate step name '" + name + "'");
            }
            if (name == null && id == null) {
                result.addWarning(stepPath, "Step has neither 'name' nor 'id'");
            }

            validateScalar(stepPath + ".if", step.get("if"), result);
            validateBoolean(stepPath + ".continue-on-error", step.get("continue-on-error"), result);
            validateTimeout(stepPath, step, result);
            validateEnv(stepPath + ".env", step.get("env"), result);
            validateScalarMap(stepPath + ".with", step.get("with"), result);

            Object workingDirectory = step.get("working-directory");
            if (workingDirectory != null && !(workingDirectory instanceof String)) {
                result.addError(stepPath + ".working-directory", "Working directory must be a string");
            }

            Object retries = step.get("retries");
            if (retries != null && (!(retries instanceof Integer) || (Integer) retries < 0)) {
                result.addError(stepPath + ".retries", "Retries must be a non-negative integer");
            }
        }
    }

    private void validateStrategy(String path, Object value, ValidationResult result) {
        if (value == null) {
            return;
        }
        if (!(value instanceof Map)) {
            result.addError(path, "Strategy must be a mapping");
            return;
        }
        Map<?, ?> strategy = (Map<?, ?>) value;
        for (Object key : strategy.keySet()) {
            if (!STRATEGY_KEYS.contains(String.valueOf(key))) {
                result.addWarning(path + "." + key, "Unknown strategy key '" + key + "' is ignored");
            }
        }

        validateBoolean(path + ".fail-fast", strategy.get("fail-fast"), result);

        Object maxParallel = strategy.get("max-parallel");
        if (maxParallel != null && (!(maxParallel instanceof Integer) || (Integer) maxParallel < 1)) {
            result.addError(path + ".max-parallel", "Max-parallel must be a positive integer");
        }

        Object matrix = strategy.get("matrix");
        if (matrix == null) {
            return;
        }
        if (!(matrix instanceof Map)) {
            result.addError(path + ".matrix", "Matrix must be a mapping of dimension to values");
            return;
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) matrix).entrySet()) {
            String dimension = String.valueOf(entry.getKey());
            String dimensionPath = path + ".matrix." + dimension;
            if ("include".equals(dimension) || "exclude".equals(dimension)) {
                result.addError(dimensionPath, "Matrix '" + dimension + "' is not supported");
                continue;
            }
            if (!IDENTIFIER_PATTERN.matcher(dimension).matches()) {
                result.addError(dimensionPath, "Matrix dimension '" + dimension + "' is not a valid identifier");
            }
            if (!(entry.getValue() instanceof List)) {
                result.addError(dimensionPath, "Matrix dimension must be a list of values");
                continue;
            }
            List<?> values = (List<?>) entry.getValue();
            if (values.isEmpty()) {
                result.addError(dimensionPath, "Matrix dimension must not be empty");
            }
            for (int i = 0; i < values.size(); i++) {
                if (!isScalar(values.get(i))) {
                    result.addError(dimensionPath + "[" + i + "]", "Matrix values must be scalars");
                }
            }
        }
    }

    private void validateConcurrency(String path, Object value, ValidationResult result) {
        if (value == null || value instanceof String) {
            return;
        }
        if (!(value instanceof Map)) {
            result.addError(path, "Concurrency must be a string or a mapping");
            return;
        }
        Map<?, ?> concurrency = (Map<?, ?>) value;
        Object group = concurrency.get("group");
        if (!(group instanceof String) || ((String) group).isBlank()) {
            result.addError(path + ".group", "Concurrency group is required");
        }
        validateBoolean(path + ".cancel-in-progress", concurrency.get("cancel-in-progress"), result);
    }

    private void validateTimeout(String path, Map<?, ?> data, ValidationResult result) {
        Object minutes = data.get("timeout-minutes");
        Object timeout = data.get("timeout");
        if (minutes != null && timeout != null) {
            result.addError(path + ".timeout", "Only one of 'timeout-minutes' and 'timeout' may be given");
        }
        if (minutes != null && (!(minutes instanceof Number) || ((Number) minutes).doubleValue() <= 0)) {
            result.addError(path + ".timeout-minutes", "Timeout must be a positive number of minutes");
        }
        if (timeout != null) {
            try {
                if (GantryConfiguration.parseDuration(String.valueOf(timeout)).isZero()) {
                    result.addError(path + ".timeout", "Timeout must be positive");
                }
            } catch (IllegalArgumentException e) {
                result.addError(path + ".timeout", e.getMessage());
            }
        }
    }

    private void validateEnv(String path, Object value, ValidationResult result) {
        if (value == null) {
            return;
        }
        if (!(value instanceof Map)) {
            result.addError(path, "Environment must be a mapping");
            return;
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (!ENV_KEY_PATTERN.matcher(key).matches()) {
                result.addError(path + "." + key, "Environment variable name '" + key + "' is not a valid identifier");
            }
            if (entry.getValue() != null && !isScalar(entry.getValue())) {
                result.addError(path + "." + key, "Environment values must be scalars");
            }
        }
    }

    private void validateOutputs(String path, Object value, ValidationResult result) {
        if (value == null) {
            return;
        }
        if (!(value instanceof Map)) {
            result.addError(path, "Outputs must be a mapping");
            return;
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (!IDENTIFIER_PATTERN.matcher(key).matches()) {
                result.addError(path + "." + key, "Output name '" + key + "' is not a valid identifier");
            }
            if (entry.getValue() != null && !isScalar(entry.getValue())) {
                result.addError(path + "." + key, "Output values must be strings");
            }
        }
    }

    private void validateScalarMap(String path, Object value, ValidationResult result) {
        if (value == null) {
            return;
        }
        if (!(value instanceof Map)) {
            result.addError(path, "Field must be a mapping");
            return;
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            if (entry.getValue() != null && !isScalar(entry.getValue())) {
                result.addError(path + "." + entry.getKey(), "Values must be scalars");
            }
        }
    }

    private void validateStringOrStringList(String path, Object value, ValidationResult result) {
        if (value == null || value instanceof String) {
            return;
        }
        if (!(value instanceof List)) {
            result.addError(path, "Field must be a string or a list of strings");
            return;
        }
        List<?> values = (List<?>) value;
        for (int i = 0; i < values.size(); i++) {
            if (!(values.get(i) instanceof String)) {
                result.addError(path + "[" + i + "]", "Value must be a string");
            }
        }
    }

    private void validateBoolean(String path, Object value, ValidationResult result) {
        if (value == null || value instanceof Boolean) {
            return;
        }
        if (value instanceof String && ("true".equalsIgnoreCase((String) value) || "false".equalsIgnoreCase((String) value))) {
            return;
        }
        result.addError(path, "Field must be a boolean");
    }

    private void validateScalar(String path, Object value, ValidationResult result) {
        if (value != null && !isScalar(value)) {
            result.addError(path, "Field must be a scalar expression");
        }
    }

    static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }
}
