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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory secret store, mainly for tests and embedded use.
 */
public class MapSecretResolver implements SecretResolver {

    private final Map<String, String> secrets = new ConcurrentHashMap<>();

    public MapSecretResolver() {
    }

    public MapSecretResolver(Map<String, String> secrets) {
        if (secrets != null) {
            this.secrets.putAll(secrets);
        }
    }

    public MapSecretResolver put(String name, String value) {
        secrets.put(name, value);
        return this;
    }

    @Override
    public String resolve(String name) throws SecretNotFoundException {
        String value = secrets.get(name);
        if (value == null) {
            throw new SecretNotFoundException(name);
        }
        return value;
    }

    @Override
    public String toString() {
        // names only
        return "MapSecretResolver{names=" + secrets.keySet() + '}';
    }
}
