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

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/// Streaming writer of separator-terminated records. Every record, including the last,
/// is followed by the separator byte. A record the charset cannot encode fails with an
/// [IOException] rather than being written with replacement bytes.
public final class RecordWriter implements Closeable {

    private final OutputStream out;
    private final byte separator;
    private final Charset charset;
    private final CharsetEncoder encoder;
    private long written;

    public RecordWriter(OutputStream out, byte separator, Charset charset, int bufferSize) {
        Objects.requireNonNull(out, "out");
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("buffer size must be positive: " + bufferSize);
        }
        this.out = new BufferedOutputStream(out, bufferSize);
        this.separator = separator;
        this.charset = Objects.requireNonNull(charset, "charset");
        this.encoder = charset.newEncoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    /// Creates or truncates the file at `path`.
    public static RecordWriter create(Path path, byte separator, Charset charset, int bufferSize) throws IOException {
        return new RecordWriter(Files.newOutputStream(path), separator, charset, bufferSize);
    }

    public void write(String record) throws IOException {
        ByteBuffer encoded;
        try {
            encoded = encoder.encode(CharBuffer.wrap(record));
        } catch (CharacterCodingException e) {
            throw new IOException("Record " + (written + 1) + " cannot be encoded as " + charset.name(), e);
        }
        out.write(encoded.array(), encoded.arrayOffset() + encoded.position(), encoded.remaining());
        out.write(separator);
        written++;
    }

    /// @return the number of records written so far
    public long getWritten() {
        return written;
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
