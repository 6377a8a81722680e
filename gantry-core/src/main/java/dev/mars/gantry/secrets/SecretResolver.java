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

package dev.mars.gantry.secrets;

/**
 * Source of secret values referenced as {@code secrets.<name>} in workflow expressions.
 *
 * <p>Resolved values are only ever placed into step environments and must be registered
 * with the run's {@link SecretMasker} before any output is logged.</p>
 */
public interface SecretResolver {

    /**
     * @throws SecretNotFoundException if no secret with that name exists
     */
    String resolve(String name) throws SecretNotFoundException;

    static SecretResolver empty() {
        return name -> {
            throw new SecretNotFoundException(name);
        };
    }
}
