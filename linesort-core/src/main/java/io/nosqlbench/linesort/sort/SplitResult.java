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

import java.util.List;

/// Output of [ChunkSplitter#split].
///
/// @param chunks the unsorted chunks in input order, indexed from 1
/// @param maxRowsPerChunk the largest row count of any chunk, used to size sort buffers
/// @param totalRows the number of records across all chunks
/// @param totalBytes the number of input bytes consumed
public record SplitResult(List<ChunkFile> chunks, long maxRowsPerChunk, long totalRows, long totalBytes) {

    public SplitResult {
        chunks = List.copyOf(chunks);
    }
}
