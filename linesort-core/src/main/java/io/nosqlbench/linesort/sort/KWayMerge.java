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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/// Merges sorted record files into one sorted file.
///
/// One [RowCursor] per input sits in a priority queue ordered by the record comparator
/// and, for equal records, by input position. The smallest cursor is written, its reader
/// advanced, and the cursor re-queued or retired once its input is exhausted. Because
/// ties go to the earlier input, merging chunks that are in input order keeps equal
/// records in input order.
final class KWayMerge {
    private static final Logger logger = LogManager.getLogger(KWayMerge.class);

    private final Comparator<RowCursor> cursorOrder;
    private final byte separator;
    private final Charset charset;
    private final int readBufferSize;
    private final int writeBufferSize;

    KWayMerge(Comparator<String> comparator, byte separator, Charset charset, int readBufferSize, int writeBufferSize) {
        this.cursorOrder = (a, b) -> {
            int byValue = comparator.compare(a.value(), b.value());
            return byValue != 0 ? byValue : Integer.compare(a.source(), b.source());
        };
        this.separator = separator;
        this.charset = charset;
        this.readBufferSize = readBufferSize;
        this.writeBufferSize = writeBufferSize;
    }

    /// @param inputs sorted record files, in input order
    /// @param output the file to create or truncate
    /// @param token checked before every record written
    /// @return the number of records written
    long merge(List<Path> inputs, Path output, CancellationToken token) throws IOException {
        List<RecordReader> readers = new ArrayList<>(inputs.size());
        try {
            for (Path input : inputs) {
                readers.add(RecordReader.open(input, separator, charset, readBufferSize));
            }

            PriorityQueue<RowCursor> active = new PriorityQueue<>(Math.max(1, readers.size()), cursorOrder);
            for (int i = 0; i < readers.size(); i++) {
                String first = readers.get(i).readRecord();
                if (first != null) {
                    active.add(new RowCursor(i, first));
                }
            }

            try (RecordWriter writer = RecordWriter.create(output, separator, charset, writeBufferSize)) {
                while (!active.isEmpty()) {
                    RowCursor cursor = active.poll();
                    token.throwIfCancellationRequested();
                    writer.write(cursor.value());
                    String next = readers.get(cursor.source()).readRecord();
                    if (next != null) {
                        cursor.advance(next);
                        active.add(cursor);
                    }
                }
                logger.debug("Merged {} files into {} ({} rows)", inputs.size(), output.getFileName(), writer.getWritten());
                return writer.getWritten();
            }
        } finally {
            for (RecordReader reader : readers) {
                try {
                    reader.close();
                } catch (IOException e) {
                    logger.warn("Error closing merge input", e);
                }
            }
        }
    }
}
