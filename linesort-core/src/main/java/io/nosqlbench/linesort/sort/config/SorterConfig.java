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

import io.nosqlbench.linesort.sort.RecordOrder;
import io.nosqlbench.linesort.sort.SorterOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Sorter settings read from a YAML document:
///
/// ```yaml
/// chunk-size: 256m
/// separator: "\n"
/// charset: UTF-8
/// parallelism: 6
/// fan-in: 8
/// order: ignore-case
/// scratch-dir: /data/tmp
/// buffers:
///   split-read: 1m
///   merge-read: 256k
/// ```
///
/// `buffers` may also be a single size applied to every buffer. Unknown keys are
/// rejected so typos do not silently fall back to defaults.
/// @param values the top level mapping, keys normalized to lower case
public record SorterConfig(Map<String, Object> values) {

    private static final Logger logger = LogManager.getLogger(SorterConfig.class);

    private static final Set<String> KEYS = Set.of(
        "chunk-size", "separator", "charset", "parallelism", "fan-in", "order", "scratch-dir", "buffers");
    private static final Set<String> BUFFER_KEYS = Set.of(
        "split-read", "split-write", "sort-read", "sort-write", "merge-read", "merge-write");

    public SorterConfig {
        if (values == null) {
            throw new IllegalArgumentException("sorter config values must not be null");
        }
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (entry.getKey() == null || !KEYS.contains(entry.getKey())) {
                throw new IllegalArgumentException("Unknown sorter config key '" + entry.getKey() + "'. Expected one of: " + KEYS);
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Missing value for sorter config key '" + entry.getKey() + "'");
            }
        }
        values = Map.copyOf(values);
    }

    /// load the config from a YAML file
    /// @param file the YAML file
    /// @return the parsed config
    public static SorterConfig load(Path file) throws IOException {
        logger.debug("Loading sorter config from {}", file);
        return parse(Files.readString(file));
    }

    /// parse a YAML document; an empty document is an empty config
    /// @throws IllegalArgumentException if the document is not valid YAML or not a valid config
    public static SorterConfig parse(String yaml) {
        LoadSettings loadSettings = LoadSettings.builder().setLabel("sorter config").build();
        Load load = new Load(loadSettings);
        Object document;
        try {
            document = load.loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new IllegalArgumentException("Invalid sorter config YAML: " + e.getMessage(), e);
        }
        if (document == null) {
            return new SorterConfig(Map.of());
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("sorter config must be a mapping, found " + document.getClass().getSimpleName());
        }
        return new SorterConfig(normalize(map));
    }

    /// Applies every configured value onto `builder`, leaving other settings untouched.
    public SorterOptions.Builder applyTo(SorterOptions.Builder builder) {
        if (values.containsKey("chunk-size")) {
            builder.chunkSize(size("chunk-size", values.get("chunk-size")));
        }
        if (values.containsKey("separator")) {
            builder.separator(parseSeparator(String.valueOf(values.get("separator"))));
        }
        if (values.containsKey("charset")) {
            builder.charset(Charset.forName(String.valueOf(values.get("charset"))));
        }
        if (values.containsKey("parallelism")) {
            builder.parallelism(integer("parallelism", values.get("parallelism")));
        }
        if (values.containsKey("fan-in")) {
            builder.fanIn(integer("fan-in", values.get("fan-in")));
        }
        if (values.containsKey("order")) {
            builder.order(RecordOrder.fromString(String.valueOf(values.get("order"))));
        }
        if (values.containsKey("scratch-dir")) {
            builder.scratchParent(Path.of(String.valueOf(values.get("scratch-dir"))));
        }
        if (values.containsKey("buffers")) {
            applyBuffers(builder, values.get("buffers"));
        }
        return builder;
    }

    private static void applyBuffers(SorterOptions.Builder builder, Object buffers) {
        if (!(buffers instanceof Map<?, ?> map)) {
            builder.ioBufferSize(integer("buffers", buffers));
            return;
        }
        for (Map.Entry<String, Object> entry : normalize(map).entrySet()) {
            int size = integer("buffers." + entry.getKey(), entry.getValue());
            switch (entry.getKey()) {
                case "split-read" -> builder.splitReadBufferSize(size);
                case "split-write" -> builder.splitWriteBufferSize(size);
                case "sort-read" -> builder.sortReadBufferSize(size);
                case "sort-write" -> builder.sortWriteBufferSize(size);
                case "merge-read" -> builder.mergeReadBufferSize(size);
                case "merge-write" -> builder.mergeWriteBufferSize(size);
                default -> throw new IllegalArgumentException(
                    "Unknown buffer key '" + entry.getKey() + "'. Expected one of: " + BUFFER_KEYS);
            }
        }
    }

    /// Parses a record separator given as a single character, an escape (`\n`, `\t`,
    /// `\r`, `\0`), a name (`newline`, `tab`, `comma`, `nul`), a hex byte (`0x1E`) or a
    /// decimal byte value.
    /// @throws IllegalArgumentException if the value does not denote a single byte
    public static byte parseSeparator(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("separator must not be empty");
        }
        if (value.length() == 1) {
            char c = value.charAt(0);
            if (c > 0xFF) {
                throw new IllegalArgumentException("separator must be a single byte: '" + value + "'");
            }
            return (byte) c;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "\\n":
            case "lf":
            case "newline":
                return '\n';
            case "\\r":
            case "cr":
                return '\r';
            case "\\t":
            case "tab":
                return '\t';
            case "\\0":
            case "nul":
                return 0;
            case "comma":
                return ',';
            default:
                break;
        }
        try {
            int code = normalized.startsWith("0x")
                ? Integer.parseInt(normalized.substring(2), 16)
                : Integer.parseInt(normalized);
            if (code < 0 || code > 0xFF) {
                throw new IllegalArgumentException("separator byte out of range: " + value);
            }
            return (byte) code;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid separator '" + value + "'", e);
        }
    }

    private static Map<String, Object> normalize(Map<?, ?> map) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            String key = String.valueOf(k).trim().toLowerCase(Locale.ROOT).replace('_', '-');
            if (v == null) {
                throw new IllegalArgumentException("Missing value for sorter config key '" + key + "'");
            }
            normalized.put(key, v);
        });
        return normalized;
    }

    private static long size(String key, Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return ByteSize.parse(String.valueOf(value));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + e.getMessage(), e);
        }
    }

    private static int integer(String key, Object value) {
        long size = size(key, value);
        if (size > Integer.MAX_VALUE || size < Integer.MIN_VALUE) {
            throw new IllegalArgumentException("Value for '" + key + "' out of range: " + value);
        }
        return (int) size;
    }
}
