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
 * Classification of everything that can go wrong in a workflow run.
 *
 * <p>{@link #PARSE} and {@link #GRAPH} abort a run before anything executes. The others
 * are local to a step or job instance and are recorded alongside its terminal status.</p>
 */
public enum ErrorKind {

    /** Malformed workflow document. */
    PARSE,

    /** Dependency cycle or unresolved {@code needs} reference. */
    GRAPH,

    /** Expression evaluation failure. */
    EVALUATION,

    /** The sandbox or an artifact collaborator could not run the step. */
    EXECUTION,

    /** The step or job exceeded its time budget. */
    TIMEOUT,

    /** Run-level cancellation, fail-fast or concurrency-group supersession. */
    CANCELLED
}
