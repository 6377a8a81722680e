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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LocalArtifactStoreTest {

    @TempDir
    Path tempDir;

    private LocalArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new LocalArtifactStore(tempDir.resolve("store"));
    }

    @Test
    void testUploadAndDownloadFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("report.txt"), "all green");

        store.upload("reports", file);
        assertTrue(store.exists("reports"));

        Path destination = tempDir.resolve("out");
        Path result = store.download("reports", destination);

        assertEquals(destination, result);
        assertEquals("all green", Files.readString(destination.resolve("report.txt")));
    }

    @Test
    void testUploadDirectoryTree() throws Exception {
        Path dir = tempDir.resolve("dist");
        Files.createDirectories(dir.resolve("lib"));
        Files.writeString(dir.resolve("lib/app.jar"), "jar");

        store.upload("dist", dir);
        Path destination = store.download("dist", tempDir.resolve("restore"));

        assertEquals("jar", Files.readString(destination.resolve("dist/lib/app.jar")));
    }

    @Test
    void testReuploadReplacesContent() throws Exception {
        Path first = Files.writeString(tempDir.resolve("a.txt"), "1");
        Path second = Files.writeString(tempDir.resolve("b.txt"), "2");

        store.upload("data", first);
        store.upload("data", second);
        Path destination = store.download("data", tempDir.resolve("out"));

        assertFalse(Files.exists(destination.resolve("a.txt")));
        assertTrue(Files.exists(destination.resolve("b.txt")));
    }

    @Test
    void testDownloadMissingArtifact() {
        ArtifactNotFoundException e = assertThrows(ArtifactNotFoundException.class,
                () -> store.download("nope", tempDir.resolve("out")));
        assertEquals("nope", e.getKey());
    }

    @Test
    void testRejectsPathTraversalKeys() {
        assertThrows(ArtifactException.class, () -> store.upload("../escape", tempDir));
        assertFalse(store.exists("../escape"));
    }

    @Test
    void testRejectsMissingSource() {
        assertThrows(ArtifactException.class, () -> store.upload("ghost", tempDir.resolve("missing")));
    }
}
