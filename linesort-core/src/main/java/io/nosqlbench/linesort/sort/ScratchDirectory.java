package io.nosqlbench.linesort.sort;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

/// A private working directory for the intermediate files of one sort run.
///
/// Every chunk file lives directly under it, named by stage:
///
/// - `<n>.unsorted` for split output,
/// - `<n>.sorted` for sorted chunks,
/// - `<position>_<token>.merged` for merge pass output, where `token` is unique per pass.
///
/// Closing deletes the directory and everything in it, whether the run succeeded or not.
public final class ScratchDirectory implements Closeable {
    private static final Logger logger = LogManager.getLogger(ScratchDirectory.class);

    private static final String PREFIX = "linesort-";

    private final Path root;
    private volatile boolean closed;

    private ScratchDirectory(Path root) {
        this.root = root;
    }

    /// Creates a new scratch directory.
    /// @param parent the directory to create it in, or null for the system temporary directory
    public static ScratchDirectory create(Path parent) throws IOException {
        Path root;
        if (parent == null) {
            root = Files.createTempDirectory(PREFIX);
        } else {
            Files.createDirectories(parent);
            root = Files.createTempDirectory(parent, PREFIX);
        }
        logger.debug("Created scratch directory {}", root);
        return new ScratchDirectory(root);
    }

    public Path path() {
        return root;
    }

    public Path unsortedChunk(int index) {
        return root.resolve(index + ".unsorted");
    }

    public Path sortedChunk(int index) {
        return root.resolve(index + ".sorted");
    }

    public Path mergedChunk(int position, String passToken) {
        return root.resolve(position + "_" + passToken + ".merged");
    }

    /// @return a token that no other merge pass of any run will use
    public String newPassToken() {
        return UUID.randomUUID().toString();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder())
                .forEach(path -> {
                    try {
                        Files.delete(path);
                    } catch (IOException e) {
                        logger.warn("Could not delete: " + path, e);
                    }
                });
        }
        logger.debug("Removed scratch directory {}", root);
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
