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

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Iterator;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.mars.gantry.config.GantryConfiguration;

/**
 * Directory-backed artifact store. Each key maps to a sub-directory of the root that
 * holds the uploaded file or tree.
 */
public class LocalArtifactStore implements ArtifactStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalArtifactStore.class);

    private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path root;

    public LocalArtifactStore(GantryConfiguration configuration) {
        this(configuration.getArtifactDirectory());
    }

    public LocalArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public void upload(String key, Path source) throws ArtifactException {
        Path target = keyPath(key);
        if (source == null || !Files.exists(source)) {
            throw new ArtifactException("Artifact source does not exist: " + source);
        }
        try {
            if (Files.exists(target)) {
                deleteTree(target);
            }
            Files.createDirectories(target);
            Path landing = target.resolve(source.getFileName().toString());
            copyTree(source, landing);
            logger.info("Uploaded artifact '{}' from {}", key, source);
        } catch (IOException e) {
            throw new ArtifactException("Failed to upload artifact '" + key + "': " + e.getMessage(), e);
        }
    }

    @Override
    public Path download(String key, Path destination) throws ArtifactException {
        Path stored = keyPath(key);
        if (!Files.isDirectory(stored)) {
            throw new ArtifactNotFoundException(key);
        }
        try {
            Files.createDirectories(destination);
            try (Stream<Path> entries = Files.list(stored)) {
                Iterator<Path> it = entries.iterator();
                while (it.hasNext()) {
                    Path entry = it.next();
                    copyTree(entry, destination.resolve(entry.getFileName().toString()));
                }
            }
            logger.info("Downloaded artifact '{}' to {}", key, destination);
            return destination;
        } catch (IOException e) {
            throw new ArtifactException("Failed to download artifact '" + key + "': " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String key) {
        return KEY_PATTERN.matcher(key == null ? "" : key).matches() && Files.isDirectory(root.resolve(key));
    }

    private Path keyPath(String key) throws ArtifactException {
        if (key == null || !KEY_PATTERN.matcher(key).matches()) {
            throw new ArtifactException("Invalid artifact name: " + key);
        }
        return root.resolve(key);
    }

    private static void copyTree(Path source, Path target) throws IOException {
        if (!Files.isDirectory(source)) {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            return;
        }
        Files.walkFileTree(source, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file).toString()),
                        StandardCopyOption.REPLACE_EXISTING);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static void deleteTree(Path path) throws IOException {
        Files.walkFileTree(path, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
