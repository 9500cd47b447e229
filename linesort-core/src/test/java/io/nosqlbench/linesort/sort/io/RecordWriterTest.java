package io.nosqlbench.linesort.sort.io;

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
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class RecordWriterTest {

    @TempDir
    Path tempDir;

    @Test
    public void testEveryRecordIsTerminated() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (RecordWriter writer = new RecordWriter(bytes, (byte) ';', StandardCharsets.UTF_8, 4)) {
            writer.write("one");
            writer.write("");
            writer.write("drei");
            assertEquals(3, writer.getWritten());
        }
        assertEquals("one;;drei;", bytes.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testCreateTruncatesExistingFile() throws IOException {
        Path file = tempDir.resolve("records.txt");
        Files.writeString(file, "a much longer previous content\n");

        try (RecordWriter writer = RecordWriter.create(file, (byte) '\n', StandardCharsets.UTF_8, 16)) {
            writer.write("new");
        }

        assertEquals("new\n", Files.readString(file));
    }

    @Test
    public void testUnencodableRecordIsReported() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (RecordWriter writer = new RecordWriter(bytes, (byte) '\n', StandardCharsets.ISO_8859_1, 16)) {
            writer.write("caf\u00e9");
            IOException e = assertThrows(IOException.class, () -> writer.write("\u20ac5"));
            assertTrue(e.getMessage().contains("ISO-8859-1"), e.getMessage());
            assertEquals(1, writer.getWritten());
        }
        assertArrayEquals(new byte[]{'c', 'a', 'f', (byte) 0xE9, '\n'}, bytes.toByteArray());
    }
}
