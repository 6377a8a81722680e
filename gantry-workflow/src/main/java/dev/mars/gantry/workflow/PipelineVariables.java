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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses run-level variables given as {@code KEY1=val1; KEY2=val2}.
 */
public final class PipelineVariables {

    private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private PipelineVariables() {
    }

    /**
     * @throws IllegalArgumentException if an entry has no {@code =} or an invalid key
     */
    public static Map<String, String> parse(String text) {
        Map<String, String> variables = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return variables;
        }
        for (String entry : text.split(";")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq < 0) {
                throw new IllegalArgumentException("Pipeline variable '" + trimmed + "' must have the form KEY=value");
            }
            String key = trimmed.substring(0, eq).trim();
            if (!KEY_PATTERN.matcher(key).matches()) {
                throw new IllegalArgumentException("Invalid pipeline variable name '" + key + "'");
            }
            variables.put(key, trimmed.substring(eq + 1).trim());
        }
        return variables;
    }
}
