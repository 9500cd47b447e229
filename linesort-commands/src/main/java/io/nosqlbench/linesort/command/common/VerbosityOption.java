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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides standard {@code -v/--verbose} and {@code -q/--quiet} flags, applied to the
 * log level of the {@code io.nosqlbench.linesort} loggers.
 */
public class VerbosityOption {

    static final String LOGGER_NAME = "io.nosqlbench.linesort";

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress all output except errors"
    )
    private boolean quiet = false;

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public boolean showNormalOutput() {
        return !quiet;
    }

    public boolean showVerbose() {
        return verbose && !quiet;
    }

    /**
     * The log level these flags stand for: DEBUG when verbose, WARN when quiet, otherwise
     * null to keep the configured level.
     */
    public Level getLevel() {
        if (quiet) {
            return Level.WARN;
        }
        if (verbose) {
            return Level.DEBUG;
        }
        return null;
    }

    /**
     * Applies {@link #getLevel()} to the sorter loggers.
     */
    public void apply() {
        Level level = getLevel();
        if (level != null) {
            Configurator.setLevel(LOGGER_NAME, level);
        }
    }

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException(
                "Cannot specify both --verbose and --quiet options"
            );
        }
    }
}
