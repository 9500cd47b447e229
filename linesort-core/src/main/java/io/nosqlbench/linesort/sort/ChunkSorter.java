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

import io.nosqlbench.linesort.sort.io.RecordReader;
import io.nosqlbench.linesort.sort.io.RecordWriter;
import io.nosqlbench.linesort.status.PhaseProgress;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/// Sorts each unsorted chunk in memory and writes it back as a sorted chunk.
///
/// Chunks are sorted independently on a fixed pool of `parallelism` workers. Each worker
/// borrows a row buffer from a shared [RowBufferPool] sized to the largest chunk, loads
/// the chunk, sorts the filled range, writes `<n>.sorted` and deletes `<n>.unsorted`.
/// The sort is stable, so equal records keep their input order within a chunk.
public final class ChunkSorter {
    private static final Logger logger = LogManager.getLogger(ChunkSorter.class);

    private final SorterOptions.SortOptions options;
    private final Charset charset;
    private final byte separator;
    private final ScratchDirectory scratch;
    private final PhaseProgress progress;

    public ChunkSorter(SorterOptions.SortOptions options, Charset charset, byte separator,
                       ScratchDirectory scratch, PhaseProgress progress) {
        this.options = Objects.requireNonNull(options, "options");
        this.charset = Objects.requireNonNull(charset, "charset");
        this.separator = separator;
        this.scratch = Objects.requireNonNull(scratch, "scratch");
        this.progress = Objects.requireNonNull(progress, "progress");
    }

    /// Sorts every chunk of `split`. Cancellation is observed only before a chunk starts;
    /// a chunk already being sorted runs to completion.
    ///
    /// @return the sorted chunks, in the same sequence order as the input chunks
    public List<ChunkFile> sort(SplitResult split, CancellationToken token) throws IOException {
        List<ChunkFile> chunks = split.chunks();
        if (chunks.isEmpty()) {
            progress.complete();
            return List.of();
        }

        int workers = Math.min(options.parallelism(), chunks.size());
        RowBufferPool buffers = new RowBufferPool(split.maxRowsPerChunk(), workers);
        AtomicInteger completed = new AtomicInteger();
        ExecutorService executor = WorkerPool.newFixedPool("linesort-sort", workers);
        try {
            List<Future<ChunkFile>> futures = new ArrayList<>(chunks.size());
            for (ChunkFile chunk : chunks) {
                futures.add(executor.submit(() -> {
                    token.throwIfCancellationRequested();
                    ChunkFile sorted = sortChunk(chunk, buffers);
                    progress.report(completed.incrementAndGet(), chunks.size());
                    return sorted;
                }));
            }
            List<ChunkFile> sorted = WorkerPool.awaitAll(futures, "parallel chunk sorting");
            logger.debug("Sorted {} chunks with {} workers, {} row buffers allocated",
                sorted.size(), workers, buffers.getAllocations());
            progress.complete();
            return sorted;
        } finally {
            WorkerPool.shutdown(executor);
        }
    }

    private ChunkFile sortChunk(ChunkFile chunk, RowBufferPool buffers) throws IOException {
        String[] rows = buffers.acquire();
        int count = 0;
        try {
            try (RecordReader reader = RecordReader.open(chunk.path(), separator, charset, options.readBufferSize())) {
                String record;
                while ((record = reader.readRecord()) != null) {
                    if (count == rows.length) {
                        throw new IOException("Chunk " + chunk.path().getFileName() + " holds more than the "
                            + rows.length + " rows counted while splitting");
                    }
                    rows[count++] = record;
                }
            }

            Arrays.sort(rows, 0, count, options.comparator());

            Path sortedPath = scratch.sortedChunk(chunk.index());
            try (RecordWriter writer = RecordWriter.create(sortedPath, separator, charset, options.writeBufferSize())) {
                for (int i = 0; i < count; i++) {
                    writer.write(rows[i]);
                }
            }
            Files.delete(chunk.path());
            logger.debug("Sorted chunk {} ({} rows)", chunk.index(), count);
            return new ChunkFile(ChunkFile.Kind.SORTED, chunk.index(), sortedPath, count);
        } finally {
            Arrays.fill(rows, 0, count, null);
            buffers.release(rows);
        }
    }
}
