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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The executable DAG of job instances for one workflow.
 *
 * <p>Matrix jobs are expanded into the cross-product of their dimensions, with the first
 * dimension varying slowest. Every instance depends on all instances of every job it
 * needs. The plan does not fix an execution order; the scheduler asks for the
 * {@linkplain #readySet(Set) ready set} each time an instance reaches a terminal state.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ExecutionPlan {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionPlan.class);

    private final WorkflowDefinition workflow;
    private final Map<String, JobInstance> instances;
    private final Map<String, List<String>> instancesByJob;

    private ExecutionPlan(WorkflowDefinition workflow, Map<String, JobInstance> instances,
                          Map<String, List<String>> instancesByJob) {
        this.workflow = workflow;
        this.instances = Collections.unmodifiableMap(instances);
        this.instancesByJob = Collections.unmodifiableMap(instancesByJob);
    }

    /**
     * Builds the plan, rejecting cycles and unresolved dependencies.
     *
     * @throws DependencyGraphException if the job graph is not a valid DAG
     */
    public static ExecutionPlan build(WorkflowDefinition workflow) throws DependencyGraphException {
        DependencyGraph graph = DependencyGraph.of(workflow);
        ValidationResult validation = graph.validate();
        if (!validation.isValid()) {
            StringBuilder sb = new StringBuilder("Dependency graph validation failed:");
            List<String> jobIds = new ArrayList<>();
            for (ValidationResult.ValidationIssue error : validation.getErrors()) {
                sb.append("\n  - ").append(error);
            }
            for (JobDefinition job : workflow.getJobList()) {
                for (String need : job.getNeeds()) {
                    if (need.equals(job.getId()) || workflow.getJob(need) == null) {
                        jobIds.add(job.getId());
                    }
                }
            }
            if (jobIds.isEmpty()) {
                try {
                    graph.topologicalSort();
                } catch (DependencyGraphException e) {
                    jobIds.addAll(e.getJobIds());
                }
            }
            throw new DependencyGraphException(sb.toString(), jobIds);
        }

        Map<String, JobInstance> instances = new LinkedHashMap<>();
        Map<String, List<String>> byJob = new LinkedHashMap<>();

        for (JobDefinition job : graph.topologicalSort()) {
            List<String> upstream = new ArrayList<>();
            for (String need : job.getNeeds()) {
                upstream.addAll(byJob.get(need));
            }

            List<String> ids = new ArrayList<>();
            for (Map<String, Object> combination : expand(job)) {
                String id = JobInstance.instanceId(job.getId(), combination);
                if (instances.containsKey(id)) {
                    throw new DependencyGraphException("Matrix of job '" + job.getId()
                            + "' produces duplicate instance '" + id + "'", List.of(job.getId()));
                }
                instances.put(id, new JobInstance(id, job, combination, upstream));
                ids.add(id);
            }
            byJob.put(job.getId(), Collections.unmodifiableList(ids));
        }

        logger.debug("Built execution plan for '{}' with {} job instance(s)", workflow.getName(), instances.size());
        return new ExecutionPlan(workflow, instances, byJob);
    }

    /**
     * Matrix combinations of a job in lexicographic order over dimension declaration
     * order. A job without a matrix yields a single empty combination.
     */
    static List<Map<String, Object>> expand(JobDefinition job) {
        List<Map<String, Object>> combinations = new ArrayList<>();
        combinations.add(new LinkedHashMap<>());
        if (!job.hasMatrix()) {
            return combinations;
        }
        for (Map.Entry<String, List<Object>> dimension : job.getStrategy().getDimensions().entrySet()) {
            List<Map<String, Object>> next = new ArrayList<>();
            for (Map<String, Object> prefix : combinations) {
                for (Object value : dimension.getValue()) {
                    Map<String, Object> combination = new LinkedHashMap<>(prefix);
                    combination.put(dimension.getKey(), value);
                    next.add(combination);
                }
            }
            combinations = next;
        }
        return combinations;
    }

    public WorkflowDefinition getWorkflow() {
        return workflow;
    }

    /**
     * All instances in plan order: topological over jobs, matrix order within a job.
     */
    public Collection<JobInstance> getInstances() {
        return instances.values();
    }

    public JobInstance getInstance(String instanceId) {
        return instances.get(instanceId);
    }

    public List<String> instancesOf(String jobId) {
        return instancesByJob.getOrDefault(jobId, List.of());
    }

    public List<String> upstream(String instanceId) {
        JobInstance instance = instances.get(instanceId);
        return instance != null ? instance.getUpstream() : List.of();
    }

    public int size() {
        return instances.size();
    }

    /**
     * Instances that have not completed and whose upstream instances all have. Skipped
     * and failed instances count as completed.
     *
     * @param completed ids of instances in a terminal state
     * @return ready instance ids in plan order
     */
    public Set<String> readySet(Set<String> completed) {
        Set<String> ready = new LinkedHashSet<>();
        for (JobInstance instance : instances.values()) {
            if (!completed.contains(instance.getId()) && completed.containsAll(instance.getUpstream())) {
                ready.add(instance.getId());
            }
        }
        return ready;
    }

    @Override
    public String toString() {
        return "ExecutionPlan{workflow='" + workflow.getName() + "', instances=" + instances.keySet() + '}';
    }
}
