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

import java.util.List;

import dev.mars.gantry.core.exceptions.GantryException;

/**
 * The job dependency graph contains a cycle or an unresolved {@code needs} reference.
 * Raised before any job instance executes.
 */
public class DependencyGraphException extends GantryException {

    private final List<String> jobIds;

    public DependencyGraphException(String message, List<String> jobIds) {
        super(message);
        this.jobIds = jobIds != null ? List.copyOf(jobIds) : List.of();
    }

    /**
     * Jobs involved in the problem: the members of a cycle, or the jobs with bad references.
     */
    public List<String> getJobIds() {
        return jobIds;
    }
}
