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

package dev.mars.gantry.workflow.run;

import java.time.Instant;
import java.util.Objects;

/**
 * One line of step output, already masked.
 */
public final class LogLine {

    public enum Stream {
        STDOUT, STDERR, SYSTEM
    }

    private final Stream stream;
    private final String text;
    private final Instant timestamp;

    public LogLine(Stream stream, String text, Instant timestamp) {
        this.stream = Objects.requireNonNull(stream, "Stream cannot be null");
        this.text = Objects.requireNonNull(text, "Text cannot be null");
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
    }

    public static LogLine system(String text) {
        return new LogLine(Stream.SYSTEM, text, Instant.now());
    }

    public Stream getStream() {
        return stream;
    }

    public String getText() {
        return text;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "[" + stream + "] " + text;
    }
}
