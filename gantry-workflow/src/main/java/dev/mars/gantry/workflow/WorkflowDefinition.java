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
 * Parsed workflow document: a name, global environment, trigger metadata and the jobs
 * in declaration order. Immutable after parsing.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowDefinition {

    private final String name;
    private final Map<String, String> env;
    private final Map<String, Object> triggers;
    private final Map<String, JobDefinition> jobs;

    public WorkflowDefinition(String name, Map<String, String> env, Map<String, Object> triggers,
                              List<JobDefinition> jobs) {
        this.name = Objects.requireNonNull(name, "Workflow name cannot be null");
        this.env = env != null ? Collections.unmodifiableMap(new LinkedHashMap<>(env)) : Map.of();
        this.triggers = triggers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(triggers)) : Map.of();

        Map<String, JobDefinition> byId = new LinkedHashMap<>();
        if (jobs != null) {
            for (JobDefinition job : jobs) {
                if (byId.put(job.getId(), job) != null) {
                    throw new IllegalArgumentException("Duplicate job id: " + job.getId());
                }
            }
        }
        this.jobs = Collections.unmodifiableMap(byId);
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    /**
     * Trigger metadata from the {@code on} key. Passed through untouched; event names map
     * to their configuration, or to {@code null} when none was given.
     */
    public Map<String, Object> getTriggers() {
        return triggers;
    }

    public Map<String, JobDefinition> getJobs() {
        return jobs;
    }

    public List<JobDefinition> getJobList() {
        return new ArrayList<>(jobs.values());
    }

    public JobDefinition getJob(String id) {
        return jobs.get(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(env, that.env) &&
               Objects.equals(triggers, that.triggers) &&
               Objects.equals(jobs, that.jobs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, env, triggers, jobs);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "name='" + name + '\'' +
               ", triggers=" + triggers.keySet() +
               ", jobs=" + jobs.keySet() +
               '}';
    }
}
