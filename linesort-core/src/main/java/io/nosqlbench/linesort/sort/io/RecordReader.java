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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/// Streaming reader of separator-delimited records.
///
/// Records are returned without their separator and decoded with the configured charset.
/// A final record that is not followed by a separator is still returned; an input ending
/// in a separator does not produce a trailing empty record.
///
/// Decoding is strict: a record that is not valid in the charset fails with an
/// [IOException] instead of being altered. ISO-8859-1 maps every byte to one char, so
/// with that charset every input decodes and re-encodes to the same bytes.
public final class RecordReader implements Closeable {

    private final InputStream in;
    private final byte separator;
    private final Charset charset;
    private final CharsetDecoder decoder;
    private final byte[] buffer;
    private int position;
    private int limit;
    private boolean eof;
    private long records;

    private byte[] record = new byte[256];

    public RecordReader(InputStream in, byte separator, Charset charset, int bufferSize) {
        this.in = Objects.requireNonNull(in, "in");
        this.separator = separator;
        this.charset = Objects.requireNonNull(charset, "charset");
        this.decoder = charset.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("buffer size must be positive: " + bufferSize);
        }
        this.buffer = new byte[bufferSize];
    }

    public static RecordReader open(Path path, byte separator, Charset charset, int bufferSize) throws IOException {
        return new RecordReader(Files.newInputStream(path), separator, charset, bufferSize);
    }

    /// @return the next record, or null when the input is exhausted
    public String readRecord() throws IOException {
        int length = 0;
        boolean any = false;
        while (true) {
            if (position == limit && !fill()) {
                return any ? decode(length) : null;
            }
            any = true;
            int start = position;
            int end = start;
            while (end < limit && buffer[end] != separator) {
                end++;
            }
            int span = end - start;
            if (length + span > record.length) {
                record = Arrays.copyOf(record, Math.max(record.length * 2, length + span));
            }
            System.arraycopy(buffer, start, record, length, span);
            length += span;
            if (end < limit) {
                position = end + 1;
                return decode(length);
            }
            position = limit;
        }
    }

    private String decode(int length) throws IOException {
        records++;
        if (StandardCharsets.ISO_8859_1.equals(charset)) {
            return new String(record, 0, length, charset);
        }
        try {
            return decoder.decode(ByteBuffer.wrap(record, 0, length)).toString();
        } catch (CharacterCodingException e) {
            throw new IOException("Record " + records + " is not valid " + charset.name()
                + " text; use ISO-8859-1 to sort arbitrary bytes", e);
        }
    }

    private boolean fill() throws IOException {
        if (eof) {
            return false;
        }
        int read = in.read(buffer, 0, buffer.length);
        while (read == 0) {
            read = in.read(buffer, 0, buffer.length);
        }
        if (read < 0) {
            eof = true;
            return false;
        }
        position = 0;
        limit = read;
        return true;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
