/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.linesort.command.sort;

import io.nosqlbench.linesort.sort.RecordOrder;
import io.nosqlbench.linesort.sort.SorterOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class CMD_sortTest {

    @TempDir
    Path tempDir;

    private int run(String... args) {
        return new CommandLine(new CMD_sort()).execute(args);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }

    @Test
    public void testSortsSmallFile() throws IOException {
        Path input = write("in.txt", "banana\napple\ncherry\n");
        Path output = tempDir.resolve("out.txt");

        int exitCode = run("-i", input.toString(), "-o", output.toString(), "--status", "off");

        assertEquals(CMD_sort.EXIT_SUCCESS, exitCode, "Command should exit with code 0");
        assertEquals("apple\nbanana\ncherry\n", Files.readString(output));
    }

    @Test
    public void testExternalSortWithSmallChunks() throws IOException {
        Random random = new Random(11);
        List<String> records = new ArrayList<>();
        StringBuilder content = new StringBuilder();
        for (int i = 0; i < 500; i++) {
            String record = Integer.toString(random.nextInt(100_000));
            records.add(record);
            content.append(record).append('\n');
        }
        Path input = write("numbers.txt", content.toString());
        Path output = tempDir.resolve("nested/dir/out.txt");
        Path scratch = tempDir.resolve("scratch");

        int exitCode = run("-i", input.toString(), "-o", output.toString(),
            "--chunk-size", "256", "--threads", "3", "--fan-in", "2", "--order", "numeric",
            "--temp-dir", scratch.toString(), "--buffer-size", "1k", "--status", "log", "-q");

        assertEquals(CMD_sort.EXIT_SUCCESS, exitCode);
        records.sort(RecordOrder.NUMERIC.comparator());
        assertEquals(records, Files.readAllLines(output));
        try (Stream<Path> left = Files.list(scratch)) {
            assertEquals(0, left.count(), "scratch directories should be removed");
        }
    }

    @Test
    public void testExistingOutputWithoutForce() throws IOException {
        Path input = write("in.txt", "b\na\n");
        Path output = write("out.txt", "keep\n");

        assertEquals(CMD_sort.EXIT_FILE_EXISTS, run("-i", input.toString(), "-o", output.toString()));
        assertEquals("keep\n", Files.readString(output));

        assertEquals(CMD_sort.EXIT_SUCCESS,
            run("-i", input.toString(), "-o", output.toString(), "--force", "--status", "off"));
        assertEquals("a\nb\n", Files.readString(output));
    }

    @Test
    public void testSortInPlaceWithForce() throws IOException {
        Path file = write("data.txt", "delta\nalpha\ncharlie\nbravo\necho\n");

        int exitCode = run("-i", file.toString(), "-o", file.toString(), "-f", "--chunk-size", "8", "--status", "off");

        assertEquals(CMD_sort.EXIT_SUCCESS, exitCode);
        assertEquals("alpha\nbravo\ncharlie\ndelta\necho\n", Files.readString(file));
    }

    @Test
    public void testMissingInputIsAnError() {
        assertEquals(CMD_sort.EXIT_ERROR,
            run("-i", tempDir.resolve("absent.txt").toString(), "-o", tempDir.resolve("out.txt").toString()));
    }

    @Test
    public void testInvalidOptionValuesAreUsageErrors() throws IOException {
        Path input = write("in.txt", "a\n");
        String out = tempDir.resolve("out.txt").toString();

        assertNotEquals(0, run("-i", input.toString(), "-o", out, "--chunk-size", "lots"));
        assertNotEquals(0, run("-i", input.toString(), "-o", out, "--order", "random"));
        assertNotEquals(0, run("-i", input.toString(), "-o", out, "--separator", "0x100"));
        assertEquals(CMD_sort.EXIT_ERROR, run("-i", input.toString(), "-o", out, "--chunk-size", "0"));
        assertEquals(CMD_sort.EXIT_ERROR, run("-i", input.toString(), "-o", out, "-v", "-q"));
        assertFalse(Files.exists(tempDir.resolve("out.txt")));
    }

    @Test
    public void testDryRunWritesNothing() throws IOException {
        Path input = write("in.txt", "b\na\n");
        Path output = tempDir.resolve("out.txt");

        assertEquals(CMD_sort.EXIT_SUCCESS, run("-i", input.toString(), "-o", output.toString(), "--dry-run"));
        assertFalse(Files.exists(output));
    }

    @Test
    public void testConfigFileWithCommandLineOverride() throws IOException {
        Path config = write("sort.yaml", "separator: comma\norder: reverse\nchunk-size: 4\n");
        Path input = write("in.csv", "b,c,a,d,");
        Path output = tempDir.resolve("out.csv");

        int exitCode = run("-i", input.toString(), "-o", output.toString(), "--config", config.toString(),
            "--order", "natural", "--status", "off");

        assertEquals(CMD_sort.EXIT_SUCCESS, exitCode);
        assertEquals("a,b,c,d,", Files.readString(output));
    }

    @Test
    public void testBadConfigFileIsAnError() throws IOException {
        Path config = write("sort.yaml", "chunk_sise: 4\n");
        Path input = write("in.txt", "a\n");

        assertEquals(CMD_sort.EXIT_ERROR, run("-i", input.toString(), "-o", tempDir.resolve("out.txt").toString(),
            "--config", config.toString()));
        assertEquals(CMD_sort.EXIT_ERROR, run("-i", input.toString(), "-o", tempDir.resolve("out.txt").toString(),
            "--config", tempDir.resolve("missing.yaml").toString()));
    }

    @Test
    public void testEmptyOrMalformedConfigValueIsAnError() throws IOException {
        Path input = write("in.txt", "a\n");
        Path empty = write("empty.yaml", "chunk-size:\n");
        Path malformed = write("malformed.yaml", "order: [reverse\n");

        assertEquals(CMD_sort.EXIT_ERROR, run("-i", input.toString(), "-o", tempDir.resolve("out.txt").toString(),
            "--config", empty.toString()));
        assertEquals(CMD_sort.EXIT_ERROR, run("-i", input.toString(), "-o", tempDir.resolve("out.txt").toString(),
            "--config", malformed.toString()));
        assertFalse(Files.exists(tempDir.resolve("out.txt")));
    }

    @Test
    public void testCharsetWithoutSingleByteSeparatorIsAnError() throws IOException {
        Path input = write("in.txt", "b\na\n");

        assertEquals(CMD_sort.EXIT_ERROR, run("-i", input.toString(), "-o", tempDir.resolve("out.txt").toString(),
            "--charset", "UTF-16LE"));
        assertFalse(Files.exists(tempDir.resolve("out.txt")));
    }

    @Test
    public void testOptionPrecedence() throws IOException {
        Path config = write("sort.yaml", "parallelism: 5\nfan-in: 7\nbuffers: 4k\n");
        CMD_sort cmd = new CMD_sort();
        new CommandLine(cmd).parseArgs("-i", "in.txt", "-o", "out.txt", "--config", config.toString(),
            "--threads", "2", "--read-buffer-size", "8k", "-q");

        SorterOptions options = cmd.buildOptions();

        assertEquals(2, options.sort().parallelism());
        assertEquals(7, options.merge().fanIn());
        assertEquals(8192, options.merge().readBufferSize());
        assertEquals(4096, options.merge().writeBufferSize());
        assertTrue(options.sinks().isEmpty(), "quiet mode registers no progress sinks");
    }
}
