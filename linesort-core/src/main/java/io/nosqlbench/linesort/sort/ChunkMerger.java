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

import io.nosqlbench.linesort.status.PhaseProgress;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/// Multi-pass k-way merge of sorted chunks into the final output.
///
/// Each pass cuts the current chunk list, in order, into runs of at most `fanIn` chunks
/// and merges every run into one `<position>_<token>.merged` file, running up to `fanIn`
/// merges at once. A run with a single chunk is moved into place instead of merged. Once
/// no more than two chunks remain they are merged straight into the output; a pass that
/// leaves exactly one chunk moves it onto the output.
public final class ChunkMerger {
    private static final Logger logger = LogManager.getLogger(ChunkMerger.class);

    /// @param rows records written to the output
    /// @param passes merge passes executed, counting the final merge into the output
    public record MergeResult(long rows, int passes) {
    }

    private final SorterOptions.MergeOptions options;
    private final ScratchDirectory scratch;
    private final PhaseProgress progress;
    private final KWayMerge kWayMerge;

    public ChunkMerger(SorterOptions.MergeOptions options, Comparator<String> comparator, Charset charset,
                       byte separator, ScratchDirectory scratch, PhaseProgress progress) {
        this.options = Objects.requireNonNull(options, "options");
        this.scratch = Objects.requireNonNull(scratch, "scratch");
        this.progress = Objects.requireNonNull(progress, "progress");
        this.kWayMerge = new KWayMerge(Objects.requireNonNull(comparator, "comparator"),
            separator, Objects.requireNonNull(charset, "charset"),
            options.readBufferSize(), options.writeBufferSize());
    }

    /// Merges `sorted` into `output`, deleting every intermediate chunk as soon as the
    /// pass that consumed it is done.
    ///
    /// @param sorted sorted chunks in sequence order
    /// @param output the destination, replaced if it exists
    /// @param token checked before every record written
    public MergeResult merge(List<ChunkFile> sorted, Path output, CancellationToken token) throws IOException {
        int fanIn = options.fanIn();
        long total = totalChunksToMerge(sorted.size(), fanIn);
        long processed = 0;
        int passes = 0;
        List<ChunkFile> current = sorted;

        ExecutorService executor = null;
        try {
            while (true) {
                token.throwIfCancellationRequested();
                if (current.size() <= 2) {
                    long rows = kWayMerge.merge(paths(current), output, token);
                    deleteAll(current);
                    progress.complete();
                    logger.debug("Final merge of {} chunks into {} ({} rows)", current.size(), output, rows);
                    return new MergeResult(rows, passes + 1);
                }

                if (executor == null) {
                    executor = WorkerPool.newFixedPool("linesort-merge", fanIn);
                }
                List<ChunkFile> produced = mergePass(executor, current, token);
                deleteAll(current);
                passes++;
                processed += current.size();
                progress.report(processed, total);
                logger.debug("Merge pass {} reduced {} chunks to {}", passes, current.size(), produced.size());

                produced.sort(Comparator.comparingInt(ChunkFile::index));
                current = produced;

                if (current.size() == 1) {
                    ChunkFile last = current.get(0);
                    Files.move(last.path(), output, StandardCopyOption.REPLACE_EXISTING);
                    progress.complete();
                    return new MergeResult(last.rows(), passes);
                }
            }
        } finally {
            if (executor != null) {
                WorkerPool.shutdown(executor);
            }
        }
    }

    private List<ChunkFile> mergePass(ExecutorService executor, List<ChunkFile> chunks, CancellationToken token)
        throws IOException {
        String passToken = scratch.newPassToken();
        List<List<ChunkFile>> runs = partition(chunks, options.fanIn());
        List<Future<ChunkFile>> futures = new ArrayList<>(runs.size());
        for (int i = 0; i < runs.size(); i++) {
            int position = i + 1;
            List<ChunkFile> run = runs.get(i);
            futures.add(executor.submit(() -> mergeRun(run, position, passToken, token)));
        }
        return new ArrayList<>(WorkerPool.awaitAll(futures, "merge pass"));
    }

    private ChunkFile mergeRun(List<ChunkFile> run, int position, String passToken, CancellationToken token)
        throws IOException {
        Path target = scratch.mergedChunk(position, passToken);
        if (run.size() == 1) {
            ChunkFile only = run.get(0);
            Files.move(only.path(), target, StandardCopyOption.REPLACE_EXISTING);
            return new ChunkFile(ChunkFile.Kind.MERGED, position, target, only.rows());
        }
        long rows = kWayMerge.merge(paths(run), target, token);
        return new ChunkFile(ChunkFile.Kind.MERGED, position, target, rows);
    }

    private static List<Path> paths(List<ChunkFile> chunks) {
        List<Path> paths = new ArrayList<>(chunks.size());
        for (ChunkFile chunk : chunks) {
            paths.add(chunk.path());
        }
        return paths;
    }

    private static void deleteAll(List<ChunkFile> chunks) throws IOException {
        for (ChunkFile chunk : chunks) {
            Files.deleteIfExists(chunk.path());
        }
    }

    /// Cuts `chunks` into consecutive groups of at most `size`, preserving order.
    static <T> List<List<T>> partition(List<T> chunks, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("partition size must be positive: " + size);
        }
        List<List<T>> groups = new ArrayList<>((chunks.size() + size - 1) / size);
        for (int from = 0; from < chunks.size(); from += size) {
            groups.add(List.copyOf(chunks.subList(from, Math.min(from + size, chunks.size()))));
        }
        return groups;
    }

    /// The number of chunk merges the whole merge phase is expected to perform, used as
    /// the merge progress denominator: `n + n/k + n/k² + ...` until the quotient reaches 0.
    /// It is an estimate, so reported progress is clamped.
    static long totalChunksToMerge(long chunks, int fanIn) {
        long total = chunks;
        long quotient = chunks / fanIn;
        while (quotient > 0) {
            total += quotient;
            quotient /= fanIn;
        }
        return total;
    }
}
