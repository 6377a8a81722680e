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

import java.util.List;

/**
 * Data visible to expressions: named namespaces ({@code env}, {@code steps},
 * {@code matrix}, ...) plus the status aggregate used by {@code success()},
 * {@code failure()} and {@code cancelled()}.
 *
 * <p>Implementations must not change state as a side effect of resolution, apart from
 * registering resolved secrets for masking.</p>
 */
public interface ExpressionContext {

    /**
     * Resolves a property path such as {@code [steps, build, outputs, version]}. The first
     * element names the namespace. References into an undefined namespace or to a missing
     * property resolve to the empty string.
     *
     * @throws ExpressionException if the reference is defined but cannot be read yet
     */
    ExpressionValue resolve(List<String> path) throws ExpressionException;

    /**
     * Whether anything this evaluation depends on has failed.
     */
    boolean anyFailure();

    boolean isCancelled();

    /**
     * Walks {@code path} from index {@code from} inside {@code root}. A missing property
     * anywhere along the way yields the empty string.
     */
    static ExpressionValue walk(ExpressionValue root, List<String> path, int from) {
        ExpressionValue current = root;
        for (int i = from; i < path.size(); i++) {
            if (current.getType() != ExpressionValue.Type.OBJECT && current.getType() != ExpressionValue.Type.ARRAY) {
                return ExpressionValue.EMPTY_STRING;
            }
            ExpressionValue next = current.get(path.get(i));
            if (next.isNull() && current.getType() == ExpressionValue.Type.OBJECT && !containsKey(current, path.get(i))) {
                return ExpressionValue.EMPTY_STRING;
            }
            if (next.isNull() && current.getType() == ExpressionValue.Type.ARRAY) {
                return ExpressionValue.EMPTY_STRING;
            }
            current = next;
        }
        return current;
    }

    private static boolean containsKey(ExpressionValue object, String key) {
        for (String candidate : object.asMap().keySet()) {
            if (candidate.equalsIgnoreCase(key)) {
                return true;
            }
        }
        return false;
    }
}
