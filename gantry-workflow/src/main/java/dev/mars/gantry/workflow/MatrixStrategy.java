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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The {@code strategy} block of a job: matrix dimensions in declaration order plus the
 * fail-fast and max-parallel policies that apply to the expanded instances.
 */
public class MatrixStrategy {

    private final Map<String, List<Object>> dimensions;
    private final boolean failFast;
    private final Integer maxParallel;

    public MatrixStrategy(Map<String, List<Object>> dimensions, boolean failFast, Integer maxParallel) {
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        if (dimensions != null) {
            for (Map.Entry<String, List<Object>> entry : dimensions.entrySet()) {
                copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
            }
        }
        this.dimensions = Collections.unmodifiableMap(copy);
        this.failFast = failFast;
        this.maxParallel = maxParallel;
    }

    public Map<String, List<Object>> getDimensions() {
        return dimensions;
    }

    public boolean hasMatrix() {
        return !dimensions.isEmpty();
    }

    public boolean isFailFast() {
        return failFast;
    }

    /**
     * Upper bound on concurrently running instances of the job, or {@code null} when unbounded.
     */
    public Integer getMaxParallel() {
        return maxParallel;
    }

    /**
     * Number of combinations the matrix expands to.
     */
    public int size() {
        int size = 1;
        for (List<Object> values : dimensions.values()) {
            size *= values.size();
        }
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MatrixStrategy that = (MatrixStrategy) o;
        return failFast == that.failFast &&
               Objects.equals(dimensions, that.dimensions) &&
               Objects.equals(maxParallel, that.maxParallel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimensions, failFast, maxParallel);
    }

    @Override
    public String toString() {
        return "MatrixStrategy{" +
               "dimensions=" + dimensions +
               ", failFast=" + failFast +
               ", maxParallel=" + maxParallel +
               '}';
    }
}
