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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A job bound to one matrix combination. Created when the execution plan is built and
 * never modified afterwards; its runtime state lives in the run context.
 */
public final class JobInstance {

    private final String id;
    private final JobDefinition job;
    private final Map<String, Object> matrix;
    private final List<String> upstream;

    JobInstance(String id, JobDefinition job, Map<String, Object> matrix, List<String> upstream) {
        this.id = Objects.requireNonNull(id, "Instance id cannot be null");
        this.job = Objects.requireNonNull(job, "Job cannot be null");
        this.matrix = Collections.unmodifiableMap(new LinkedHashMap<>(matrix));
        this.upstream = List.copyOf(upstream);
    }

    /**
     * Builds the instance id: the job id for a job without a matrix, otherwise
     * {@code jobId (v1, v2, ...)} with the values in dimension order.
     */
    static String instanceId(String jobId, Map<String, Object> matrix) {
        if (matrix.isEmpty()) {
            return jobId;
        }
        return matrix.values().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", jobId + " (", ")"));
    }

    public String getId() {
        return id;
    }

    public String getJobId() {
        return job.getId();
    }

    public JobDefinition getJob() {
        return job;
    }

    public Map<String, Object> getMatrix() {
        return matrix;
    }

    /**
     * Ids of every instance this one waits for.
     */
    public List<String> getUpstream() {
        return upstream;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((JobInstance) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "JobInstance{id='" + id + "', upstream=" + upstream + '}';
    }
}
