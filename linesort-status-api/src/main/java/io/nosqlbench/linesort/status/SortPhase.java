/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.linesort.status;

/**
 * The three externally observable phases of an external merge sort. Each phase owns an
 * independent progress channel, so a caller can show split, sort and merge progress
 * side by side.
 *
 * <p>Phases always run in declaration order. A run that takes the single-chunk fast path
 * still reports all three phases, each completing immediately.</p>
 *
 * @see PhaseProgress
 */
public enum SortPhase {
    /** Sequential pass over the input, cutting it into record-aligned chunk files. */
    SPLIT("split"),

    /** Parallel in-memory sort of each chunk file. */
    SORT("sort"),

    /** Multi-pass k-way merge of sorted chunks into the output file. */
    MERGE("merge");

    private final String label;

    SortPhase(String label) {
        this.label = label;
    }

    /**
     * @return the lowercase label used in log lines and console output
     */
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
