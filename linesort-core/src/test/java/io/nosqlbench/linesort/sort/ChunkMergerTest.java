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
import io.nosqlbench.linesort.status.SortPhase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class ChunkMergerTest {

    @TempDir
    Path tempDir;

    private ScratchDirectory scratch;

    @BeforeEach
    public void setUp() throws IOException {
        scratch = ScratchDirectory.create(tempDir.resolve("scratch"));
    }

    @AfterEach
    public void tearDown() throws IOException {
        scratch.close();
    }

    private List<ChunkFile> sortedChunks(int count, int rowsEach) throws IOException {
        List<ChunkFile> chunks = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            StringBuilder sb = new StringBuilder();
            for (int r = 0; r < rowsEach; r++) {
                sb.append(String.format(Locale.ROOT, "%04d", r * count + i)).append('\n');
            }
            Path path = scratch.sortedChunk(i);
            Files.writeString(path, sb.toString());
            chunks.add(new ChunkFile(ChunkFile.Kind.SORTED, i, path, rowsEach));
        }
        return chunks;
    }

    private ChunkMerger merger(int fanIn, PhaseProgress progress) {
        SorterOptions options = SorterOptions.builder().fanIn(fanIn).ioBufferSize(64).build();
        return new ChunkMerger(options.merge(), Comparator.naturalOrder(), StandardCharsets.UTF_8, (byte) '\n',
            scratch, progress);
    }

    private List<Path> scratchFiles() throws IOException {
        try (Stream<Path> files = Files.list(scratch.path())) {
            return files.toList();
        }
    }

    @Test
    public void testTotalChunksToMerge() {
        assertEquals(15, ChunkMerger.totalChunksToMerge(8, 2));
        assertEquals(12, ChunkMerger.totalChunksToMerge(10, 4));
        assertEquals(5, ChunkMerger.totalChunksToMerge(5, 8));
        assertEquals(0, ChunkMerger.totalChunksToMerge(0, 2));
        assertEquals(3, ChunkMerger.totalChunksToMerge(2, 2));
    }

    @Test
    public void testPartitionKeepsOrderAndBoundsSize() {
        List<List<Integer>> groups = ChunkMerger.partition(List.of(1, 2, 3, 4, 5, 6, 7), 3);

        assertEquals(List.of(List.of(1, 2, 3), List.of(4, 5, 6), List.of(7)), groups);
        assertTrue(ChunkMerger.partition(List.of(), 3).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> ChunkMerger.partition(List.of(1), 0));
    }

    @Test
    public void testTwoChunksMergeStraightIntoOutput() throws IOException {
        Path output = tempDir.resolve("out.txt");

        ChunkMerger.MergeResult result = merger(4, PhaseProgress.silent(SortPhase.MERGE))
            .merge(sortedChunks(2, 3), output, CancellationToken.NONE);

        assertEquals("0001\n0002\n0003\n0004\n0005\n0006\n", Files.readString(output));
        assertEquals(6, result.rows());
        assertEquals(1, result.passes());
        assertThat(scratchFiles()).isEmpty();
    }

    @Test
    public void testMultiPassMergeWithSingletonRuns() throws IOException {
        Path output = tempDir.resolve("out.txt");
        List<Double> seen = new ArrayList<>();

        ChunkMerger.MergeResult result = merger(2, PhaseProgress.of(SortPhase.MERGE, seen::add))
            .merge(sortedChunks(5, 4), output, CancellationToken.NONE);

        List<String> expected = new ArrayList<>();
        for (int i = 1; i <= 20; i++) {
            expected.add(String.format(Locale.ROOT, "%04d", i));
        }
        assertThat(Files.readAllLines(output, StandardCharsets.UTF_8)).containsExactlyElementsOf(expected);
        assertEquals(20, result.rows());
        // 5 -> 3 -> 2 -> output
        assertEquals(3, result.passes());
        assertThat(scratchFiles()).isEmpty();
        assertThat(seen).isSorted().last().isEqualTo(1.0);
    }

    @Test
    public void testPassLeavingOneChunkIsMovedToOutput() throws IOException {
        Path output = tempDir.resolve("out.txt");
        Files.writeString(output, "old\n");

        ChunkMerger.MergeResult result = merger(4, PhaseProgress.silent(SortPhase.MERGE))
            .merge(sortedChunks(3, 2), output, CancellationToken.NONE);

        assertEquals("0001\n0002\n0003\n0004\n0005\n0006\n", Files.readString(output));
        assertEquals(1, result.passes());
        assertThat(scratchFiles()).isEmpty();
    }

    @Test
    public void testCancellationMidMerge() throws IOException {
        CancellationToken token = new CancellationToken();
        List<Double> seen = Collections.synchronizedList(new ArrayList<>());
        PhaseProgress progress = PhaseProgress.of(SortPhase.MERGE, v -> {
            seen.add(v);
            token.cancel();
        });
        Path output = tempDir.resolve("out.txt");

        assertThrows(SortCancelledException.class,
            () -> merger(2, progress).merge(sortedChunks(8, 3), output, token));

        assertEquals(1, seen.size());
        assertFalse(Files.exists(output));
        assertThat(scratchFiles()).allSatisfy(p -> assertThat(p.getFileName().toString()).endsWith(".merged"));
    }
}
