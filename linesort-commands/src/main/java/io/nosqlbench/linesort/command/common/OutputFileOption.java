/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.linesort.command.common;

import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared output file option with force overwrite flag.
 */
public class OutputFileOption {

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "FILE",
        description = "The sorted output file",
        required = true
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Force overwrite if output file already exists"
    )
    private boolean force = false;

    public Path getOutputPath() {
        return outputPath;
    }

    public Path getNormalizedOutputPath() {
        return outputPath != null ? outputPath.normalize().toAbsolutePath() : null;
    }

    public boolean isForce() {
        return force;
    }

    /**
     * Checks if the output file already exists and force is not enabled.
     */
    public boolean outputExistsWithoutForce() {
        return outputPath != null && Files.exists(outputPath) && !force;
    }

    /**
     * Creates the output file's parent directories if they are missing.
     */
    public void createParentDirectories() throws IOException {
        Path parent = getNormalizedOutputPath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    /**
     * Validates the output file, checking for existence without force flag.
     */
    public void validate() {
        if (outputExistsWithoutForce()) {
            throw new IllegalStateException(
                "Output file already exists: " + outputPath + ". Use --force to overwrite."
            );
        }
        if (outputPath != null && Files.isDirectory(outputPath)) {
            throw new IllegalStateException("Output path is a directory: " + outputPath);
        }
    }

    @Override
    public String toString() {
        return force ? outputPath + " (force)" : String.valueOf(outputPath);
    }
}
