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

import dev.mars.gantry.core.exceptions.GantryException;

/**
 * Thrown when a workflow document is malformed. Nothing is executed for a workflow that
 * fails to parse.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowParseException extends GantryException {

    private final int lineNumber;
    private final String fieldPath;

    public WorkflowParseException(String message) {
        this(-1, null, message, null);
    }

    public WorkflowParseException(String message, Throwable cause) {
        this(-1, null, message, cause);
    }

    public WorkflowParseException(String fieldPath, String message) {
        this(-1, fieldPath, message, null);
    }

    public WorkflowParseException(int lineNumber, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = lineNumber;
        this.fieldPath = fieldPath;
    }

    /**
     * One-based line of a YAML syntax error, or -1 when unknown.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    /**
     * The message without line and field decoration.
     */
    public String getProblem() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (lineNumber > 0) {
            sb.append("Line ").append(lineNumber).append(": ");
        }

        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
