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

/// The record currently at the head of one merge input, together with the index of the
/// reader it came from. Cursors are reused as their reader advances.
final class RowCursor {

    private final int source;
    private String value;

    RowCursor(int source, String value) {
        this.source = source;
        this.value = value;
    }

    int source() {
        return source;
    }

    String value() {
        return value;
    }

    void advance(String next) {
        this.value = next;
    }

    @Override
    public String toString() {
        return source + ":" + value;
    }
}
