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

/**
 * Shared parallel execution options.
 * Provides standard {@code --parallel} and {@code --threads} options. The selected count
 * is the number of chunks sorted at once and, unless overridden, the merge fan-in.
 */
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"-p", "--parallel"},
        description = "Sort with all but one of the available CPU cores"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"--threads"},
        paramLabel = "N",
        description = "Number of sort and merge threads (overrides --parallel and the config file)"
    )
    private Integer explicitThreads;

    public boolean isParallel() {
        return parallel;
    }

    /**
     * @return the thread count, or null if none was given
     */
    public Integer getExplicitThreads() {
        return explicitThreads;
    }

    /**
     * Resolves the thread count requested on the command line.
     *
     * @return the requested count, or null when neither option was given and the config
     *         file or the sorter default should decide
     */
    public Integer getRequestedThreads() {
        if (explicitThreads != null) {
            return explicitThreads;
        }
        if (parallel) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        }
        return null;
    }

    /**
     * Checks if the user explicitly specified more threads than available cores.
     */
    public boolean exceedsAvailableCores() {
        if (explicitThreads == null) {
            return false;
        }
        return explicitThreads >= Runtime.getRuntime().availableProcessors();
    }

    /**
     * @throws IllegalStateException if the explicit thread count is not positive
     */
    public void validate() {
        if (explicitThreads != null && explicitThreads < 1) {
            throw new IllegalStateException("--threads must be at least 1: " + explicitThreads);
        }
    }
}
