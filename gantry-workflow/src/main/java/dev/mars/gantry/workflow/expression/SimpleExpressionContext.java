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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Context backed by fixed namespace values. Used where no run state is involved, such
 * as resolving workflow-level env.
 */
public class SimpleExpressionContext implements ExpressionContext {

    private final Map<String, ExpressionValue> namespaces;
    private final boolean failure;
    private final boolean cancelled;

    private SimpleExpressionContext(Builder builder) {
        this.namespaces = new LinkedHashMap<>(builder.namespaces);
        this.failure = builder.failure;
        this.cancelled = builder.cancelled;
    }

    public static SimpleExpressionContext empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public ExpressionValue resolve(List<String> path) {
        if (path.isEmpty()) {
            return ExpressionValue.EMPTY_STRING;
        }
        ExpressionValue root = namespaces.get(path.get(0).toLowerCase(Locale.ROOT));
        if (root == null) {
            return ExpressionValue.EMPTY_STRING;
        }
        return ExpressionContext.walk(root, path, 1);
    }

    @Override
    public boolean anyFailure() {
        return failure;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    public static class Builder {
        private final Map<String, ExpressionValue> namespaces = new LinkedHashMap<>();
        private boolean failure;
        private boolean cancelled;

        /**
         * Registers a namespace from plain data: scalars, lists and maps.
         */
        public Builder namespace(String name, Object value) {
            namespaces.put(name.toLowerCase(Locale.ROOT), ExpressionValue.from(value));
            return this;
        }

        public Builder failure(boolean failure) {
            this.failure = failure;
            return this;
        }

        public Builder cancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public SimpleExpressionContext build() {
            return new SimpleExpressionContext(this);
        }
    }
}
