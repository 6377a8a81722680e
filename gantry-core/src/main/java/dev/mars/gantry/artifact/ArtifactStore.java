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

package dev.mars.gantry.artifact;

import java.nio.file.Path;

/**
 * Storage for files passed between steps and jobs by the
 * {@code upload-artifact}/{@code download-artifact} actions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface ArtifactStore {

    /**
     * Stores a file or directory tree under {@code key}, replacing any previous content.
     */
    void upload(String key, Path source) throws ArtifactException;

    /**
     * Copies the artifact stored under {@code key} into {@code destination}.
     *
     * @return the path the artifact was written to
     * @throws ArtifactNotFoundException if nothing was uploaded under that key
     */
    Path download(String key, Path destination) throws ArtifactException;

    boolean exists(String key);
}
