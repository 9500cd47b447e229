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

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class SorterOptionsTest {

    @Test
    public void testDefaults() {
        SorterOptions options = SorterOptions.defaults();

        assertEquals(SorterOptions.DEFAULT_CHUNK_SIZE, options.split().chunkSize());
        assertEquals((byte) '\n', options.split().separator());
        assertEquals(StandardCharsets.ISO_8859_1, options.charset());
        assertEquals(SorterOptions.defaultParallelism(), options.sort().parallelism());
        assertEquals(Math.max(2, options.sort().parallelism()), options.merge().fanIn());
        assertEquals(SorterOptions.DEFAULT_BUFFER_SIZE, options.merge().readBufferSize());
        assertNull(options.scratchParent());
        assertTrue(options.sinks().isEmpty());
    }

    @Test
    public void testCharsetMustKeepSeparatorSingleByte() {
        assertEquals(StandardCharsets.UTF_8,
            SorterOptions.builder().charset(StandardCharsets.UTF_8).build().charset());
        assertEquals((byte) 0xFE,
            SorterOptions.builder().separator((byte) 0xFE).build().split().separator());

        IllegalArgumentException utf16 = assertThrows(IllegalArgumentException.class,
            () -> SorterOptions.builder().charset(StandardCharsets.UTF_16LE).build());
        assertTrue(utf16.getMessage().contains("UTF-16LE"), utf16.getMessage());
        assertThrows(IllegalArgumentException.class,
            () -> SorterOptions.builder().charset(StandardCharsets.UTF_16).build());
        assertThrows(IllegalArgumentException.class,
            () -> SorterOptions.builder().charset(StandardCharsets.UTF_8).separator((byte) 0xFF).build());
    }

    @Test
    public void testFanInFollowsParallelismWithFloorOfTwo() {
        assertEquals(2, SorterOptions.builder().parallelism(1).build().merge().fanIn());
        assertEquals(6, SorterOptions.builder().parallelism(6).build().merge().fanIn());
        assertEquals(3, SorterOptions.builder().parallelism(6).fanIn(3).build().merge().fanIn());
    }

    @Test
    public void testBufferSizesAreIndependent() {
        SorterOptions options = SorterOptions.builder()
            .ioBufferSize(4096)
            .sortWriteBufferSize(1024)
            .mergeReadBufferSize(2048)
            .build();

        assertEquals(4096, options.split().readBufferSize());
        assertEquals(4096, options.sort().readBufferSize());
        assertEquals(1024, options.sort().writeBufferSize());
        assertEquals(2048, options.merge().readBufferSize());
        assertEquals(4096, options.merge().writeBufferSize());
    }

    @Test
    public void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> SorterOptions.builder().chunkSize(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> SorterOptions.builder().chunkSize(SorterOptions.MAX_CHUNK_SIZE + 1).build());
        assertThrows(IllegalArgumentException.class, () -> SorterOptions.builder().parallelism(0).build());
        assertThrows(IllegalArgumentException.class, () -> SorterOptions.builder().fanIn(1).build());
        assertThrows(IllegalArgumentException.class, () -> SorterOptions.builder().mergeWriteBufferSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> SorterOptions.builder().comparator(null).build());
    }
}
