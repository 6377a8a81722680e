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

package dev.mars.gantry.workflow.expression;

import dev.mars.gantry.core.exceptions.GantryException;

/**
 * An expression could not be parsed or evaluated. Fails the owning step or job; never
 * aborts the run.
 */
public class ExpressionException extends GantryException {

    private final String expression;

    public ExpressionException(String message) {
        this(message, null, null);
    }

    public ExpressionException(String message, String expression) {
        this(message, expression, null);
    }

    public ExpressionException(String message, String expression, Throwable cause) {
        super(expression != null ? message + " in expression '" + expression + "'" : message, cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
