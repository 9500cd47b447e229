package io.nosqlbench.linesort.sort.config;

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

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Parses and formats byte quantities such as `64m`, `512KiB` or `1g`.
/// Suffixes are binary multiples; a bare number is a byte count.
public final class ByteSize {

    private static final Pattern SIZE = Pattern.compile("^\\s*(\\d+)\\s*([kmgt]?)(i?b)?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final String UNITS = "kmgt";

    private ByteSize() {
    }

    /// @throws IllegalArgumentException if the text is not a size or overflows a long
    public static long parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("size must not be null");
        }
        Matcher matcher = SIZE.matcher(text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid size '" + text + "'. Expected e.g. 4096, 512k, 64m, 1g");
        }
        long value;
        try {
            value = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Size out of range: " + text, e);
        }
        String unit = matcher.group(2).toLowerCase(Locale.ROOT);
        int shift = unit.isEmpty() ? 0 : (UNITS.indexOf(unit.charAt(0)) + 1) * 10;
        if (shift > 0 && value > (Long.MAX_VALUE >> shift)) {
            throw new IllegalArgumentException("Size out of range: " + text);
        }
        return value << shift;
    }

    /// Formats a byte count with the largest exact binary unit, e.g. `65536` as `64k`.
    public static String format(long bytes) {
        if (bytes <= 0) {
            return Long.toString(bytes);
        }
        int unit = 0;
        long value = bytes;
        while (unit < UNITS.length() && value % 1024 == 0) {
            value /= 1024;
            unit++;
        }
        return unit == 0 ? Long.toString(value) : value + String.valueOf(UNITS.charAt(unit - 1));
    }
}
