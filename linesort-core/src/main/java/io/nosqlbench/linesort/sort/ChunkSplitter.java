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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Cuts an input stream into record-aligned chunk files.
///
/// The stream is read once, front to back, on the calling thread. Each chunk takes
/// `chunkSize` bytes; when the last of them is not the separator, bytes are read one at a
/// time into an overflow buffer until the separator (or the end of input) completes the
/// record, so no record ever straddles two chunks.
public final class ChunkSplitter {
    private static final Logger logger = LogManager.getLogger(ChunkSplitter.class);

    private final SorterOptions.SplitOptions options;
    private final ScratchDirectory scratch;
    private final PhaseProgress progress;

    public ChunkSplitter(SorterOptions.SplitOptions options, ScratchDirectory scratch, PhaseProgress progress) {
        this.options = Objects.requireNonNull(options, "options");
        this.scratch = Objects.requireNonNull(scratch, "scratch");
        this.progress = Objects.requireNonNull(progress, "progress");
    }

    /// Splits `input` into `<n>.unsorted` files in the scratch directory.
    ///
    /// @param input the record stream; read to the end but not closed
    /// @param totalBytes the expected input size, used only for progress
    /// @param token checked before each chunk
    /// @return the chunks in input order with their row statistics
    public SplitResult split(InputStream input, long totalBytes, CancellationToken token) throws IOException {
        int chunkSize = Math.toIntExact(options.chunkSize());
        byte separator = options.separator();
        byte[] buffer = new byte[chunkSize];
        ByteArrayOutputStream overflow = new ByteArrayOutputStream();
        InputStream in = new BufferedInputStream(input, options.readBufferSize());

        List<ChunkFile> chunks = new ArrayList<>();
        long maxRows = 0;
        long totalRows = 0;
        long consumed = 0;
        int index = 0;

        while (true) {
            token.throwIfCancellationRequested();
            int read = in.readNBytes(buffer, 0, chunkSize);
            if (read == 0) {
                break;
            }

            overflow.reset();
            byte last = buffer[read - 1];
            if (read == chunkSize && last != separator) {
                int next;
                while ((next = in.read()) != -1) {
                    overflow.write(next);
                    last = (byte) next;
                    if (last == separator) {
                        break;
                    }
                }
            }

            long rows = countSeparators(buffer, read, separator) + (overflow.size() > 0 && last == separator ? 1 : 0);
            if (last != separator) {
                rows++;
            }

            Path chunkPath = scratch.unsortedChunk(++index);
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(chunkPath), options.writeBufferSize())) {
                out.write(buffer, 0, read);
                overflow.writeTo(out);
            }

            chunks.add(new ChunkFile(ChunkFile.Kind.UNSORTED, index, chunkPath, rows));
            maxRows = Math.max(maxRows, rows);
            totalRows += rows;
            consumed += read + overflow.size();
            progress.report(consumed, totalBytes);
            logger.debug("Wrote chunk {} with {} bytes ({} overflow) and {} rows",
                index, read + overflow.size(), overflow.size(), rows);

            if (read < chunkSize) {
                break;
            }
        }

        progress.complete();
        return new SplitResult(chunks, maxRows, totalRows, consumed);
    }

    static long countSeparators(byte[] bytes, int length, byte separator) {
        long count = 0;
        for (int i = 0; i < length; i++) {
            if (bytes[i] == separator) {
                count++;
            }
        }
        return count;
    }
}
