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
import io.nosqlbench.linesort.status.SortPhase;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Sorts a separator-delimited record file that may be far larger than memory.
///
/// The input is split into record-aligned chunks of about `chunkSize` bytes, each chunk
/// is sorted in memory on a pool of workers, and the sorted chunks are merged k ways at a
/// time, pass after pass, until one file remains and becomes the output. An input no
/// larger than one chunk is sorted in memory directly.
///
/// All intermediate files live in a private [ScratchDirectory] that is removed when the
/// run ends, whether it succeeded, failed or was cancelled. The output holds the same
/// records as the input, each terminated by the separator, in non-decreasing order under
/// the configured comparator; equal records keep their input order.
///
/// ```java
/// SorterOptions options = SorterOptions.builder()
///     .chunkSize(ByteSize.parse("256m"))
///     .order(RecordOrder.IGNORE_CASE)
///     .build();
/// SortResult result = new ExternalMergeSorter(options).sort(input, output);
/// ```
public final class ExternalMergeSorter {
    private static final Logger logger = LogManager.getLogger(ExternalMergeSorter.class);

    private final SorterOptions options;

    public ExternalMergeSorter(SorterOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public SorterOptions getOptions() {
        return options;
    }

    /// Sorts `input` into `output` without a way to cancel.
    public SortResult sort(Path input, Path output) throws IOException {
        return sort(input, output, CancellationToken.NONE);
    }

    /// Sorts `input` into `output`, replacing `output` if it exists.
    ///
    /// @throws SortCancelledException if `token` was cancelled before the run finished
    /// @throws IOException on any read, write or worker failure
    public SortResult sort(Path input, Path output, CancellationToken token) throws IOException {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(token, "token");

        long started = System.nanoTime();
        long inputBytes = Files.size(input);
        PhaseProgress split = new PhaseProgress(SortPhase.SPLIT, options.split().progress(), options.sinks());
        PhaseProgress sort = new PhaseProgress(SortPhase.SORT, options.sort().progress(), options.sinks());
        PhaseProgress merge = new PhaseProgress(SortPhase.MERGE, options.merge().progress(), options.sinks());
        List<PhaseProgress> phases = List.of(split, sort, merge);

        logger.info("Sorting {} ({} bytes) into {}", input, inputBytes, output);
        logger.debug("Options: {}", options);
        try {
            token.throwIfCancellationRequested();
            SortResult result;
            if (inputBytes <= options.split().chunkSize()) {
                result = sortInMemory(input, output, inputBytes, phases, token, started);
            } else {
                result = sortExternally(input, output, inputBytes, phases, token, started);
            }
            logger.info("Sorted {} rows in {} ms ({} chunks, {} merge passes{})",
                result.rows(), result.elapsed().toMillis(), result.chunks(), result.mergePasses(),
                result.fastPath() ? ", in memory" : "");
            return result;
        } catch (SortCancelledException e) {
            phases.forEach(PhaseProgress::cancel);
            logger.info("Sort of {} cancelled: {}", input, e.getMessage());
            throw e;
        } catch (IOException | RuntimeException | Error e) {
            phases.forEach(PhaseProgress::fail);
            throw e;
        }
    }

    private SortResult sortInMemory(Path input, Path output, long inputBytes, List<PhaseProgress> phases,
                                    CancellationToken token, long started) throws IOException {
        byte separator = options.split().separator();
        List<String> rows = new ArrayList<>();
        try (RecordReader reader = RecordReader.open(input, separator, options.charset(), options.split().readBufferSize())) {
            String record;
            while ((record = reader.readRecord()) != null) {
                rows.add(record);
            }
        }
        phases.get(0).complete();

        token.throwIfCancellationRequested();
        rows.sort(options.sort().comparator());
        phases.get(1).complete();

        token.throwIfCancellationRequested();
        try (RecordWriter writer = RecordWriter.create(output, separator, options.charset(), options.merge().writeBufferSize())) {
            for (String row : rows) {
                writer.write(row);
            }
        }
        phases.get(2).complete();
        return new SortResult(inputBytes, rows.size(), 1, 0, true, Duration.ofNanos(System.nanoTime() - started));
    }

    private SortResult sortExternally(Path input, Path output, long inputBytes, List<PhaseProgress> phases,
                                      CancellationToken token, long started) throws IOException {
        try (ScratchDirectory scratch = ScratchDirectory.create(options.scratchParent())) {
            logger.debug("Using scratch directory {}", scratch);

            SplitResult split;
            try (InputStream in = Files.newInputStream(input)) {
                split = new ChunkSplitter(options.split(), scratch, phases.get(0)).split(in, inputBytes, token);
            }
            logger.info("Split into {} chunks, at most {} rows each", split.chunks().size(), split.maxRowsPerChunk());

            List<ChunkFile> sorted = new ChunkSorter(options.sort(), options.charset(), options.split().separator(),
                scratch, phases.get(1)).sort(split, token);
            logger.info("Sorted {} chunks with parallelism {}", sorted.size(), options.sort().parallelism());

            ChunkMerger merger = new ChunkMerger(options.merge(), options.sort().comparator(), options.charset(),
                options.split().separator(), scratch, phases.get(2));
            ChunkMerger.MergeResult merged = merger.merge(sorted, output, token);
            logger.info("Merged {} chunks in {} passes with fan-in {}", sorted.size(), merged.passes(), options.merge().fanIn());

            return new SortResult(inputBytes, merged.rows(), split.chunks().size(), merged.passes(), false,
                Duration.ofNanos(System.nanoTime() - started));
        }
    }
}
