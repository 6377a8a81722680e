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

import java.util.Objects;

/**
 * Error recorded against a step or job instance. Messages are masked before an
 * instance is created, so they are safe to log and report.
 */
public final class ErrorDetail {

    private final ErrorKind kind;
    private final String message;

    public ErrorDetail(ErrorKind kind, String message) {
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
        this.message = message != null ? message : "";
    }

    public static ErrorDetail of(ErrorKind kind, String message) {
        return new ErrorDetail(kind, message);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ErrorDetail that = (ErrorDetail) o;
        return kind == that.kind && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
