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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Replaces every registered secret value in a piece of text with a fixed mask.
 *
 * <p>One masker exists per run. Values are matched as literal substrings, longest first,
 * so that a secret which contains another secret is masked as a whole. Multi-line values
 * are also registered line by line because step output is processed one line at a time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SecretMasker {

    public static final String DEFAULT_MASK = "***";

    private final String mask;
    private final Set<String> values = ConcurrentHashMap.newKeySet();
    private volatile List<String> ordered = List.of();

    public SecretMasker() {
        this(DEFAULT_MASK);
    }

    public SecretMasker(String mask) {
        this.mask = mask != null ? mask : DEFAULT_MASK;
    }

    public String getMask() {
        return mask;
    }

    public void register(String value) {
        if (value == null || value.isEmpty()) {
            return;
        }
        boolean changed = values.add(value);
        if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            for (String line : value.split("\\r?\\n|\\r")) {
                if (!line.trim().isEmpty()) {
                    changed |= values.add(line);
                }
            }
        }
        if (changed) {
            refresh();
        }
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public String mask(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (String value : ordered) {
            if (result.contains(value)) {
                result = result.replace(value, mask);
            }
        }
        return result;
    }

    private synchronized void refresh() {
        List<String> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        ordered = List.copyOf(sorted);
    }
}
