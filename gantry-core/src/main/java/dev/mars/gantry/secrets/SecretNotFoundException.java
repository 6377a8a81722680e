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

import dev.mars.gantry.core.exceptions.GantryException;

public class SecretNotFoundException extends GantryException {

    private final String secretName;

    public SecretNotFoundException(String secretName) {
        super("Secret not found: " + secretName);
        this.secretName = secretName;
    }

    public String getSecretName() {
        return secretName;
    }
}
