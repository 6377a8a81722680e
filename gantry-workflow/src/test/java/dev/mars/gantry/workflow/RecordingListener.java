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

import dev.mars.gantry.core.ExecutionStatus;
import dev.mars.gantry.workflow.run.LogLine;
import dev.mars.gantry.workflow.run.RunListener;
import dev.mars.gantry.workflow.run.WorkflowRun;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run listener that keeps every event it sees, for assertions on ordering.
 */
class RecordingListener implements RunListener {

    /**
     * One status change of a job instance or a step. Step events carry the step index,
     * job events carry -1.
     */
    static final class Transition {
        final String runId;
        final String instanceId;
        final int stepIndex;
        final ExecutionStatus from;
        final ExecutionStatus to;

        Transition(String runId, String instanceId, int stepIndex, ExecutionStatus from, ExecutionStatus to) {
            this.runId = runId;
            this.instanceId = instanceId;
            this.stepIndex = stepIndex;
            this.from = from;
            this.to = to;
        }

        String entity() {
            return runId + "/" + instanceId + (stepIndex >= 0 ? "#" + stepIndex : "");
        }

        @Override
        public String toString() {
            return entity() + ": " + from + " -> " + to;
        }
    }

    private final List<Transition> transitions = new CopyOnWriteArrayList<>();
    private final List<String> logLines = new CopyOnWriteArrayList<>();
    private final List<WorkflowRun> completed = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicInteger> running = new ConcurrentHashMap<>();
    private final AtomicInteger maxRunning = new AtomicInteger();

    @Override
    public void onJobStatusChanged(String runId, String instanceId, ExecutionStatus from, ExecutionStatus to) {
        transitions.add(new Transition(runId, instanceId, -1, from, to));
        AtomicInteger count = running.computeIfAbsent(runId, id -> new AtomicInteger());
        if (to == ExecutionStatus.RUNNING) {
            maxRunning.accumulateAndGet(count.incrementAndGet(), Math::max);
        } else if (from == ExecutionStatus.RUNNING) {
            count.decrementAndGet();
        }
    }

    @Override
    public void onStepStatusChanged(String runId, String instanceId, int stepIndex, String stepName,
                                    ExecutionStatus from, ExecutionStatus to) {
        transitions.add(new Transition(runId, instanceId, stepIndex, from, to));
    }

    @Override
    public void onLogLine(String runId, String instanceId, int stepIndex, LogLine line) {
        logLines.add(line.getText());
    }

    @Override
    public void onRunCompleted(WorkflowRun run) {
        completed.add(run);
    }

    List<Transition> getTransitions() {
        return new ArrayList<>(transitions);
    }

    /**
     * Position of the first job event matching the instance and target status, or -1.
     */
    int indexOf(String runId, String instanceId, ExecutionStatus to) {
        List<Transition> snapshot = getTransitions();
        for (int i = 0; i < snapshot.size(); i++) {
            Transition t = snapshot.get(i);
            if (t.stepIndex < 0 && t.runId.equals(runId) && t.instanceId.equals(instanceId) && t.to == to) {
                return i;
            }
        }
        return -1;
    }

    boolean reached(String runId, String instanceId, ExecutionStatus to) {
        return indexOf(runId, instanceId, to) >= 0;
    }

    List<String> getLogLines() {
        return new ArrayList<>(logLines);
    }

    List<WorkflowRun> getCompleted() {
        return new ArrayList<>(completed);
    }

    int getMaxRunning() {
        return maxRunning.get();
    }
}
