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

import io.nosqlbench.linesort.status.eventing.ProgressListener;
import io.nosqlbench.linesort.status.eventing.ProgressSink;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/// Immutable configuration of an [ExternalMergeSorter] run, grouped by phase the way the
/// sorter consumes it. Build instances with [#builder()]; [Builder#build()] validates.
public final class SorterOptions {

    public static final long DEFAULT_CHUNK_SIZE = 64L * 1024 * 1024;
    /// Chunks are read into a single byte array, which bounds their size.
    public static final long MAX_CHUNK_SIZE = Integer.MAX_VALUE - 8;
    public static final byte DEFAULT_SEPARATOR = '\n';
    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;
    /// Maps every byte to one char, so any input round-trips unchanged. Natural order over
    /// these chars is unsigned byte order, which for UTF-8 text is code point order.
    public static final Charset DEFAULT_CHARSET = StandardCharsets.ISO_8859_1;

    /// @param chunkSize target chunk size in bytes; chunks exceed it only by the tail of
    ///                  the record that straddles the boundary
    /// @param separator the record separator byte
    /// @param readBufferSize buffer for reading the input stream
    /// @param writeBufferSize buffer for writing chunk files
    /// @param progress split progress callback
    public record SplitOptions(long chunkSize, byte separator, int readBufferSize, int writeBufferSize,
                               ProgressListener progress) {
    }

    /// @param parallelism maximum number of chunks sorted at once
    /// @param comparator the record order
    /// @param readBufferSize buffer for reading unsorted chunks
    /// @param writeBufferSize buffer for writing sorted chunks
    /// @param progress sort progress callback
    public record SortOptions(int parallelism, Comparator<String> comparator, int readBufferSize,
                              int writeBufferSize, ProgressListener progress) {
    }

    /// @param fanIn maximum number of chunks merged by one merge task, which is also the
    ///              number of merge tasks run at once
    /// @param readBufferSize buffer per open chunk reader
    /// @param writeBufferSize buffer for the merged output
    /// @param progress merge progress callback
    public record MergeOptions(int fanIn, int readBufferSize, int writeBufferSize, ProgressListener progress) {
    }

    private final SplitOptions split;
    private final SortOptions sort;
    private final MergeOptions merge;
    private final Charset charset;
    private final Path scratchParent;
    private final List<ProgressSink> sinks;

    private SorterOptions(Builder builder) {
        this.split = new SplitOptions(builder.chunkSize, builder.separator, builder.splitReadBufferSize,
            builder.splitWriteBufferSize, builder.splitProgress);
        this.sort = new SortOptions(builder.parallelism, builder.comparator, builder.sortReadBufferSize,
            builder.sortWriteBufferSize, builder.sortProgress);
        int fanIn = builder.fanIn > 0 ? builder.fanIn : Math.max(2, builder.parallelism);
        this.merge = new MergeOptions(fanIn, builder.mergeReadBufferSize, builder.mergeWriteBufferSize,
            builder.mergeProgress);
        this.charset = builder.charset;
        this.scratchParent = builder.scratchParent;
        this.sinks = List.copyOf(builder.sinks);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// All defaults: 64 MiB chunks, newline separated records in natural byte order.
    public static SorterOptions defaults() {
        return builder().build();
    }

    public SplitOptions split() {
        return split;
    }

    public SortOptions sort() {
        return sort;
    }

    public MergeOptions merge() {
        return merge;
    }

    public Charset charset() {
        return charset;
    }

    /// @return the directory under which the scratch directory is created, or null for the
    ///         system temporary directory
    public Path scratchParent() {
        return scratchParent;
    }

    public List<ProgressSink> sinks() {
        return sinks;
    }

    /// Default parallelism: all cores but one, at least 1.
    public static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    @Override
    public String toString() {
        return "SorterOptions{chunkSize=" + split.chunkSize()
            + ", separator=0x" + String.format(Locale.ROOT, "%02X", split.separator() & 0xFF)
            + ", charset=" + charset
            + ", parallelism=" + sort.parallelism()
            + ", fanIn=" + merge.fanIn()
            + ", scratchParent=" + scratchParent + "}";
    }

    public static final class Builder {
        private long chunkSize = DEFAULT_CHUNK_SIZE;
        private byte separator = DEFAULT_SEPARATOR;
        private Charset charset = DEFAULT_CHARSET;
        private int parallelism = defaultParallelism();
        private int fanIn = 0;
        private Comparator<String> comparator = RecordOrder.NATURAL.comparator();
        private int splitReadBufferSize = DEFAULT_BUFFER_SIZE;
        private int splitWriteBufferSize = DEFAULT_BUFFER_SIZE;
        private int sortReadBufferSize = DEFAULT_BUFFER_SIZE;
        private int sortWriteBufferSize = DEFAULT_BUFFER_SIZE;
        private int mergeReadBufferSize = DEFAULT_BUFFER_SIZE;
        private int mergeWriteBufferSize = DEFAULT_BUFFER_SIZE;
        private ProgressListener splitProgress = ProgressListener.NONE;
        private ProgressListener sortProgress = ProgressListener.NONE;
        private ProgressListener mergeProgress = ProgressListener.NONE;
        private Path scratchParent;
        private final List<ProgressSink> sinks = new ArrayList<>();

        private Builder() {
        }

        public Builder chunkSize(long chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder separator(byte separator) {
            this.separator = separator;
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        /// Overrides the merge fan-in, which otherwise follows parallelism (minimum 2).
        public Builder fanIn(int fanIn) {
            this.fanIn = fanIn;
            return this;
        }

        public Builder comparator(Comparator<String> comparator) {
            this.comparator = comparator;
            return this;
        }

        public Builder order(RecordOrder order) {
            this.comparator = Objects.requireNonNull(order, "order").comparator();
            return this;
        }

        /// Sets every read and write buffer to the same size.
        public Builder ioBufferSize(int size) {
            this.splitReadBufferSize = size;
            this.splitWriteBufferSize = size;
            this.sortReadBufferSize = size;
            this.sortWriteBufferSize = size;
            this.mergeReadBufferSize = size;
            this.mergeWriteBufferSize = size;
            return this;
        }

        public Builder splitReadBufferSize(int size) {
            this.splitReadBufferSize = size;
            return this;
        }

        public Builder splitWriteBufferSize(int size) {
            this.splitWriteBufferSize = size;
            return this;
        }

        public Builder sortReadBufferSize(int size) {
            this.sortReadBufferSize = size;
            return this;
        }

        public Builder sortWriteBufferSize(int size) {
            this.sortWriteBufferSize = size;
            return this;
        }

        public Builder mergeReadBufferSize(int size) {
            this.mergeReadBufferSize = size;
            return this;
        }

        public Builder mergeWriteBufferSize(int size) {
            this.mergeWriteBufferSize = size;
            return this;
        }

        public Builder splitProgress(ProgressListener listener) {
            this.splitProgress = listener != null ? listener : ProgressListener.NONE;
            return this;
        }

        public Builder sortProgress(ProgressListener listener) {
            this.sortProgress = listener != null ? listener : ProgressListener.NONE;
            return this;
        }

        public Builder mergeProgress(ProgressListener listener) {
            this.mergeProgress = listener != null ? listener : ProgressListener.NONE;
            return this;
        }

        public Builder sink(ProgressSink sink) {
            this.sinks.add(Objects.requireNonNull(sink, "sink"));
            return this;
        }

        public Builder sinks(List<ProgressSink> sinks) {
            sinks.forEach(this::sink);
            return this;
        }

        public Builder scratchParent(Path scratchParent) {
            this.scratchParent = scratchParent;
            return this;
        }

        /// @throws IllegalArgumentException if any setting is out of range
        public SorterOptions build() {
            if (chunkSize <= 0 || chunkSize > MAX_CHUNK_SIZE) {
                throw new IllegalArgumentException("chunk size must be between 1 and " + MAX_CHUNK_SIZE + " bytes: " + chunkSize);
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
            }
            if (fanIn != 0 && fanIn < 2) {
                throw new IllegalArgumentException("merge fan-in must be at least 2: " + fanIn);
            }
            requirePositive("split read buffer", splitReadBufferSize);
            requirePositive("split write buffer", splitWriteBufferSize);
            requirePositive("sort read buffer", sortReadBufferSize);
            requirePositive("sort write buffer", sortWriteBufferSize);
            requirePositive("merge read buffer", mergeReadBufferSize);
            requirePositive("merge write buffer", mergeWriteBufferSize);
            if (comparator == null) {
                throw new IllegalArgumentException("comparator is required");
            }
            if (charset == null) {
                throw new IllegalArgumentException("charset is required");
            }
            requireSingleByteSeparator(charset, separator);
            return new SorterOptions(this);
        }

        /// Records are delimited on the raw separator byte, so the charset must encode that
        /// byte alone as one character and back. This rejects UTF-16 and UTF-32, and
        /// separators above 0x7F with UTF-8.
        private static void requireSingleByteSeparator(Charset charset, byte separator) {
            String hex = String.format(Locale.ROOT, "0x%02X", separator & 0xFF);
            if (!charset.canEncode()) {
                throw new IllegalArgumentException("charset " + charset.name() + " cannot encode records");
            }
            byte[] single = {separator};
            String decoded = new String(single, charset);
            if (decoded.length() != 1 || !Arrays.equals(single, decoded.getBytes(charset))) {
                throw new IllegalArgumentException("separator " + hex + " is not a single-byte character in "
                    + charset.name() + "; use an ASCII compatible charset such as UTF-8 or ISO-8859-1");
            }
        }

        private static void requirePositive(String what, int size) {
            if (size <= 0) {
                throw new IllegalArgumentException(what + " size must be positive: " + size);
            }
        }
    }
}
