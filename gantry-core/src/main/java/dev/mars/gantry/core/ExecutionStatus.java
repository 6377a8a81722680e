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

package dev.mars.gantry.core;

/**
 * Lifecycle of a job instance or a step within a workflow run.
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * PENDING → READY → RUNNING → {SUCCESS | FAILURE | CANCELLED}
 *    ↓        ↓
 * CANCELLED  {SKIPPED | FAILURE | CANCELLED}
 * </pre>
 *
 * <p>Steps never pass through {@link #READY}; they move from PENDING straight to
 * RUNNING, SKIPPED or CANCELLED. Terminal states never transition again, which is what
 * makes the run context safe to read without locks once a record is published.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum ExecutionStatus {

    PENDING("pending", false),

    /**
     * All dependencies are terminal; waiting for its condition to be evaluated and
     * for admission under the concurrency limits.
     */
    READY("ready", false),

    RUNNING("running", false),

    SUCCESS("success", true),

    FAILURE("failure", true),

    SKIPPED("skipped", true),

    CANCELLED("cancelled", true);

    private final String label;
    private final boolean terminal;

    ExecutionStatus(String label, boolean terminal) {
        this.label = label;
        this.terminal = terminal;
    }

    /**
     * Lower-case name as exposed to workflow expressions ({@code needs.build.result}).
     */
    public String getLabel() {
        return label;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isActive() {
        return this == READY || this == RUNNING;
    }

    public boolean isSuccessful() {
        return this == SUCCESS;
    }

    public boolean canTransitionTo(ExecutionStatus target) {
        if (this.isTerminal()) {
            return false;
        }

        switch (this) {
            case PENDING:
                return target == READY || target == RUNNING ||
                       target == SKIPPED || target == CANCELLED;

            case READY:
                return target == RUNNING || target == SKIPPED ||
                       target == FAILURE || target == CANCELLED;

            case RUNNING:
                return target == SUCCESS || target == FAILURE ||
                       target == CANCELLED;

            default:
                return false;
        }
    }

    public ExecutionStatus[] getValidTransitions() {
        switch (this) {
            case PENDING:
                return new ExecutionStatus[]{READY, RUNNING, SKIPPED, CANCELLED};
            case READY:
                return new ExecutionStatus[]{RUNNING, SKIPPED, FAILURE, CANCELLED};
            case RUNNING:
                return new ExecutionStatus[]{SUCCESS, FAILURE, CANCELLED};
            default:
                return new ExecutionStatus[0];
        }
    }

    @Override
    public String toString() {
        return label;
    }
}
