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

package dev.mars.gantry.sandbox;

/**
 * Isolated execution environment for a single step.
 *
 * <p>Implementations start the process and return immediately. The caller consumes
 * the output streams incrementally while the process runs, and is responsible for
 * enforcing timeouts and cancellation through {@link SandboxProcess#terminate()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface Sandbox {

    /**
     * Starts the step described by the request.
     *
     * @param request what to run and in which environment
     * @return a handle to the running process
     * @throws SandboxException if the process cannot be started
     */
    SandboxProcess start(SandboxRequest request) throws SandboxException;
}
