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

import java.nio.file.Path;
import java.util.Locale;

/// A chunk of records on disk.
///
/// @param kind where in the pipeline the chunk was produced
/// @param index the 1-based sequence index for split and sorted chunks, or the run
///              position within its pass for merged chunks
/// @param path the chunk file
/// @param rows the number of records in the chunk
public record ChunkFile(Kind kind, int index, Path path, long rows) {

    /// Chunk lifecycle stage.
    public enum Kind {
        /// Raw slice of the input, as cut by the splitter.
        UNSORTED,
        /// An unsorted chunk after its in-memory sort.
        SORTED,
        /// The merge of one run of sorted or merged chunks.
        MERGED
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + "#" + index + " (" + rows + " rows)";
    }
}
