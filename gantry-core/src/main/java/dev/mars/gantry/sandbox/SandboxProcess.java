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

import java.io.InputStream;
import java.time.Duration;

/**
 * Handle to a process started by a {@link Sandbox}.
 */
public interface SandboxProcess {

    /**
     * Standard output. Readable while the process runs; reaches end of stream when it exits.
     */
    InputStream getStdout();

    InputStream getStderr();

    /**
     * Waits up to {@code timeout} for the process to exit.
     *
     * @return {@code true} if the process has exited
     */
    boolean waitFor(Duration timeout) throws InterruptedException;

    /**
     * Exit code of a finished process.
     *
     * @throws IllegalStateException if the process is still running
     */
    int exitCode();

    /**
     * Requests best-effort termination. May return before the process is gone.
     */
    void terminate();
}
