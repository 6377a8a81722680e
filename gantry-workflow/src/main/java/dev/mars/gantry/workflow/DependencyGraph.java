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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;

/**
 * Dependency graph of the jobs of a workflow, built from their {@code needs} lists.
 * Provides methods for topological sorting and cycle detection. Iteration follows job
 * declaration order, so every ordering it produces is deterministic.
 */
public class DependencyGraph {

    private final Map<String, Set<String>> dependencies;
    private final Map<String, JobDefinition> jobs;

    public DependencyGraph() {
        this.dependencies = new LinkedHashMap<>();
        this.jobs = new LinkedHashMap<>();
    }

    public static DependencyGraph of(WorkflowDefinition definition) {
        DependencyGraph graph = new DependencyGraph();
        for (JobDefinition job : definition.getJobList()) {
            graph.addJob(job);
        }
        return graph;
    }

    /**
     * Adds a job to the dependency graph.
     *
     * @param job the job to add
     */
    public void addJob(JobDefinition job) {
        Objects.requireNonNull(job, "Job cannot be null");

        jobs.put(job.getId(), job);
        dependencies.put(job.getId(), new LinkedHashSet<>(job.getNeeds()));
    }

    public Map<String, JobDefinition> getJobs() {
        return Map.copyOf(jobs);
    }

    /**
     * Gets the declared dependencies of a job.
     *
     * @param jobId the id of the job
     * @return set of job ids it needs
     */
    public Set<String> getDependencies(String jobId) {
        return dependencies.getOrDefault(jobId, Set.of());
    }

    /**
     * Orders the jobs so that every job follows all of its dependencies.
     *
     * @return jobs in execution order
     * @throws DependencyGraphException if the graph has a cycle
     */
    public List<JobDefinition> topologicalSort() throws DependencyGraphException {
        // Kahn's algorithm
        Map<String, Integer> inDegree = calculateInDegree();
        Queue<String> queue = new ArrayDeque<>();
        List<JobDefinition> result = new ArrayList<>();

        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            result.add(jobs.get(current));

            for (String dependent : findDependents(current)) {
                inDegree.put(dependent, inDegree.get(dependent) - 1);
                if (inDegree.get(dependent) == 0) {
                    queue.offer(dependent);
                }
            }
        }

        if (result.size() != jobs.size()) {
            List<String> remaining = new ArrayList<>();
            for (String jobId : jobs.keySet()) {
                if (result.stream().noneMatch(j -> j.getId().equals(jobId))) {
                    remaining.add(jobId);
                }
            }
            throw new DependencyGraphException("Circular dependency detected among jobs: " + remaining, remaining);
        }

        return result;
    }

    public boolean hasCycles() {
        try {
            topologicalSort();
            return false;
        } catch (DependencyGraphException e) {
            return true;
        }
    }

    /**
     * Validates the dependency graph for consistency: unknown dependencies,
     * self-dependencies and cycles.
     *
     * @return validation result
     */
    public ValidationResult validate() {
        ValidationResult result = new ValidationResult();

        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            String jobId = entry.getKey();
            for (String dependency : entry.getValue()) {
                if (dependency.equals(jobId)) {
                    result.addError("jobs." + jobId + ".needs", "Job cannot depend on itself");
                } else if (!jobs.containsKey(dependency)) {
                    result.addError("jobs." + jobId + ".needs",
                                    "Dependency '" + dependency + "' not found");
                }
            }
        }

        try {
            topologicalSort();
        } catch (DependencyGraphException e) {
            // self-dependencies are already reported
            if (!onlySelfLoops(e.getJobIds())) {
                result.addError("jobs", e.getMessage());
            }
        }

        return result;
    }

    /**
     * Groups jobs into batches whose members do not depend on each other. Used for
     * dry-run previews; the scheduler itself works from ready sets.
     *
     * @return list of parallel execution batches
     */
    public List<List<JobDefinition>> getParallelExecutionBatches() throws DependencyGraphException {
        List<List<JobDefinition>> batches = new ArrayList<>();
        Map<String, Integer> inDegree = calculateInDegree();
        Set<String> processed = new LinkedHashSet<>();

        while (processed.size() < jobs.size()) {
            List<JobDefinition> currentBatch = new ArrayList<>();

            for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
                String jobId = entry.getKey();
                if (entry.getValue() == 0 && !processed.contains(jobId)) {
                    currentBatch.add(jobs.get(jobId));
                }
            }

            if (currentBatch.isEmpty()) {
                List<String> remaining = new ArrayList<>(jobs.keySet());
                remaining.removeAll(processed);
                throw new DependencyGraphException("Circular dependency detected - cannot create execution batches", remaining);
            }

            batches.add(currentBatch);

            for (JobDefinition job : currentBatch) {
                processed.add(job.getId());
                for (String dependent : findDependents(job.getId())) {
                    inDegree.put(dependent, inDegree.get(dependent) - 1);
                }
            }
        }

        return batches;
    }

    private boolean onlySelfLoops(List<String> cycleMembers) {
        for (String jobId : cycleMembers) {
            Set<String> deps = new LinkedHashSet<>(getDependencies(jobId));
            deps.remove(jobId);
            deps.retainAll(cycleMembers);
            if (!deps.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private Map<String, Integer> calculateInDegree() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();

        for (String jobId : jobs.keySet()) {
            inDegree.put(jobId, 0);
        }

        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            String dependent = entry.getKey();
            for (String dependency : entry.getValue()) {
                if (jobs.containsKey(dependency)) {
                    inDegree.put(dependent, inDegree.get(dependent) + 1);
                }
            }
        }

        return inDegree;
    }

    private Set<String> findDependents(String jobId) {
        Set<String> dependents = new LinkedHashSet<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            if (entry.getValue().contains(jobId)) {
                dependents.add(entry.getKey());
            }
        }
        return dependents;
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "jobs=" + jobs.keySet() +
               ", dependencies=" + dependencies +
               '}';
    }
}
