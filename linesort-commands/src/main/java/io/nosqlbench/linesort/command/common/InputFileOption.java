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

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Shared input file option for commands that read one record file.
 */
public class InputFileOption {

    /**
     * Input file selection.
     *
     * @param path the input file path (never null)
     */
    public record InputFile(Path path) {

        public InputFile {
            if (path == null) {
                throw new IllegalArgumentException("Input path cannot be null");
            }
        }

        /**
         * Gets the normalized absolute path.
         */
        public Path normalizedPath() {
            return path.normalize().toAbsolutePath();
        }

        /**
         * Validates that the input is an existing, readable regular file.
         */
        public void validate() {
            if (!Files.exists(path)) {
                throw new IllegalStateException("Input file does not exist: " + path);
            }
            if (!Files.isRegularFile(path)) {
                throw new IllegalStateException("Input is not a regular file: " + path);
            }
            if (!Files.isReadable(path)) {
                throw new IllegalStateException("Input file is not readable: " + path);
            }
        }

        @Override
        public String toString() {
            return path.toString();
        }
    }

    /**
     * Picocli type converter for {@link InputFile}. Blank values are rejected here so the
     * error is reported as a usage error.
     */
    public static class InputFileConverter implements CommandLine.ITypeConverter<InputFile> {

        @Override
        public InputFile convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new CommandLine.TypeConversionException("Input file path cannot be empty");
            }
            return new InputFile(Paths.get(value));
        }
    }

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "FILE",
        description = "The record file to sort",
        required = true,
        converter = InputFileConverter.class
    )
    private InputFile inputFile;

    public InputFile getInputFile() {
        return inputFile;
    }

    public Path getInputPath() {
        return inputFile != null ? inputFile.path() : null;
    }

    public Path getNormalizedInputPath() {
        return inputFile != null ? inputFile.normalizedPath() : null;
    }

    /**
     * Validates the input file exists and can be read.
     */
    public void validate() {
        if (inputFile == null) {
            throw new IllegalStateException("Input file is required");
        }
        inputFile.validate();
    }

    @Override
    public String toString() {
        return inputFile != null ? inputFile.toString() : "null";
    }
}
