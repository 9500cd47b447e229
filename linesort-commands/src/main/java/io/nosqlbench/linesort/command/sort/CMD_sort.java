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

import io.nosqlbench.linesort.command.common.InputFileOption;
import io.nosqlbench.linesort.command.common.OutputFileOption;
import io.nosqlbench.linesort.command.common.ParallelExecutionOption;
import io.nosqlbench.linesort.command.common.ProgressModeOption;
import io.nosqlbench.linesort.command.common.VerbosityOption;
import io.nosqlbench.linesort.sort.CancellationToken;
import io.nosqlbench.linesort.sort.ExternalMergeSorter;
import io.nosqlbench.linesort.sort.RecordOrder;
import io.nosqlbench.linesort.sort.SortCancelledException;
import io.nosqlbench.linesort.sort.SortResult;
import io.nosqlbench.linesort.sort.SorterOptions;
import io.nosqlbench.linesort.sort.config.ByteSize;
import io.nosqlbench.linesort.sort.config.SorterConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/// Command to sort a separator-delimited record file of any size with an external merge sort
///
/// The input is cut into record-aligned chunks of `--chunk-size` bytes, the chunks are
/// sorted in memory on `--threads` workers, and the sorted chunks are merged k ways at a
/// time until one file remains. Inputs no larger than one chunk are sorted in memory.
/// Settings can come from a YAML `--config` file; options given on the command line
/// override it.
///
/// Exit codes: 0 success, 1 output exists without `--force`, 2 error, 3 cancelled.
@CommandLine.Command(name = "sort",
    mixinStandardHelpOptions = true,
    description = "Sort a line (or other separator) delimited record file using a parallel external merge sort")
public class CMD_sort implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_sort.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FILE_EXISTS = 1;
    static final int EXIT_ERROR = 2;
    static final int EXIT_CANCELLED = 3;

    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    @CommandLine.Mixin
    private InputFileOption inputFileOption = new InputFileOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Option(names = {"-c", "--chunk-size"},
        paramLabel = "SIZE",
        description = "Target chunk size in bytes, with optional k/m/g suffix (default: 64m)",
        converter = ByteSizeConverter.class)
    private Long chunkSize;

    @CommandLine.Option(names = {"-s", "--separator"},
        paramLabel = "SEP",
        description = "Record separator: a character, \\n, \\t, newline, tab, nul, 0xNN (default: newline)",
        converter = SeparatorConverter.class)
    private Byte separator;

    @CommandLine.Option(names = {"--charset"},
        description = "Charset used to decode records for comparison (default: ISO-8859-1, byte order; must be ASCII compatible)",
        converter = CharsetConverter.class)
    private Charset charset;

    @CommandLine.Option(names = {"--order"},
        paramLabel = "ORDER",
        description = "Record order: natural, ignore-case, reverse, numeric, length (default: natural)",
        converter = RecordOrderConverter.class)
    private RecordOrder order;

    @CommandLine.Option(names = {"--fan-in"},
        paramLabel = "K",
        description = "Chunks merged per merge task (default: thread count, at least 2)")
    private Integer fanIn;

    @CommandLine.Option(names = {"-t", "--temp-dir"},
        description = "Directory in which the scratch directory is created (default: system temp)")
    private Path tempDir;

    @CommandLine.Option(names = {"--config"},
        paramLabel = "FILE",
        description = "YAML file with sorter settings")
    private Path configFile;

    @CommandLine.Option(names = {"--buffer-size"},
        paramLabel = "SIZE",
        description = "Size of every read and write buffer (default: 64k)",
        converter = ByteSizeConverter.class)
    private Long bufferSize;

    @CommandLine.Option(names = {"--read-buffer-size"},
        paramLabel = "SIZE",
        description = "Size of the split, sort and merge read buffers",
        converter = ByteSizeConverter.class)
    private Long readBufferSize;

    @CommandLine.Option(names = {"--write-buffer-size"},
        paramLabel = "SIZE",
        description = "Size of the split, sort and merge write buffers",
        converter = ByteSizeConverter.class)
    private Long writeBufferSize;

    @CommandLine.Mixin
    private ParallelExecutionOption parallelExecutionOption = new ParallelExecutionOption();

    @CommandLine.Mixin
    private ProgressModeOption progressModeOption = new ProgressModeOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(names = {"--dry-run", "-n"},
        description = "Show what would be done without actually doing it")
    private boolean dryRun = false;

    private void printMessage(String message) {
        if (verbosityOption.showNormalOutput()) {
            logger.info(message);
        }
    }

    private void validateOptions() {
        verbosityOption.validate();
        parallelExecutionOption.validate();
        inputFileOption.validate();
        if (configFile != null && !Files.isRegularFile(configFile)) {
            throw new IllegalStateException("Config file does not exist: " + configFile);
        }
        if (parallelExecutionOption.exceedsAvailableCores()) {
            logger.warn("Specified thread count ({}) >= available cores ({}). This may cause contention.",
                parallelExecutionOption.getExplicitThreads(), Runtime.getRuntime().availableProcessors());
        }
    }

    /// Defaults, then the config file, then explicit command line options.
    SorterOptions buildOptions() throws IOException {
        SorterOptions.Builder builder = SorterOptions.builder();
        if (configFile != null) {
            SorterConfig.load(configFile).applyTo(builder);
        }
        if (chunkSize != null) {
            builder.chunkSize(chunkSize);
        }
        if (separator != null) {
            builder.separator(separator);
        }
        if (charset != null) {
            builder.charset(charset);
        }
        if (order != null) {
            builder.order(order);
        }
        Integer threads = parallelExecutionOption.getRequestedThreads();
        if (threads != null) {
            builder.parallelism(threads);
        }
        if (fanIn != null) {
            builder.fanIn(fanIn);
        }
        if (tempDir != null) {
            builder.scratchParent(tempDir.normalize());
        }
        if (bufferSize != null) {
            builder.ioBufferSize(toBufferSize("--buffer-size", bufferSize));
        }
        if (readBufferSize != null) {
            int size = toBufferSize("--read-buffer-size", readBufferSize);
            builder.splitReadBufferSize(size).sortReadBufferSize(size).mergeReadBufferSize(size);
        }
        if (writeBufferSize != null) {
            int size = toBufferSize("--write-buffer-size", writeBufferSize);
            builder.splitWriteBufferSize(size).sortWriteBufferSize(size).mergeWriteBufferSize(size);
        }
        if (verbosityOption.showNormalOutput()) {
            builder.sinks(progressModeOption.createSinks(System.err));
        }
        return builder.build();
    }

    private static int toBufferSize(String option, long size) {
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(option + " is too large: " + size);
        }
        return (int) size;
    }

    @Override
    public Integer call() {
        try (ProgressModeOption.Scope ignored = progressModeOption.scopedProperty()) {
            SorterOptions options;
            try {
                validateOptions();
                verbosityOption.apply();
                if (outputFileOption.outputExistsWithoutForce()) {
                    logger.error("Error: Output file already exists. Use --force to overwrite.");
                    return EXIT_FILE_EXISTS;
                }
                outputFileOption.validate();
                options = buildOptions();
            } catch (IllegalStateException | IllegalArgumentException e) {
                logger.error(e.getMessage());
                return EXIT_ERROR;
            } catch (IOException e) {
                logger.error("Error reading config file " + configFile + ": " + e.getMessage(), e);
                return EXIT_ERROR;
            }

            Path inputPath = inputFileOption.getNormalizedInputPath();
            Path outputPath = outputFileOption.getNormalizedOutputPath();

            if (dryRun) {
                printMessage("DRY RUN MODE - no files will be modified");
                printMessage("Input: " + inputPath);
                printMessage("Output: " + outputPath);
                printPlan(options, inputPath);
                printMessage("Force overwrite: " + outputFileOption.isForce());
                printMessage("Dry run complete - no actions taken");
                return EXIT_SUCCESS;
            }

            return runSort(options, inputPath, outputPath);
        }
    }

    private void printPlan(SorterOptions options, Path inputPath) {
        try {
            long inputBytes = Files.size(inputPath);
            long chunk = options.split().chunkSize();
            if (inputBytes <= chunk) {
                printMessage("Plan: " + ByteSize.format(inputBytes) + " bytes fit in one chunk, sorting in memory");
            } else {
                long chunks = (inputBytes + chunk - 1) / chunk;
                printMessage("Plan: about " + chunks + " chunks of " + ByteSize.format(chunk)
                    + ", merged " + options.merge().fanIn() + " at a time");
            }
        } catch (IOException e) {
            logger.warn("Could not read input size: {}", e.getMessage());
        }
        printMessage("Chunk size: " + ByteSize.format(options.split().chunkSize()));
        printMessage("Separator: 0x" + String.format(Locale.ROOT, "%02X", options.split().separator() & 0xFF));
        printMessage("Charset: " + options.charset());
        printMessage("Threads: " + options.sort().parallelism());
        printMessage("Fan-in: " + options.merge().fanIn());
        printMessage("Temp directory: " + (options.scratchParent() != null ? options.scratchParent() : "system temp"));
    }

    private int runSort(SorterOptions options, Path inputPath, Path outputPath) {
        CancellationToken token = new CancellationToken();
        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            token.cancel("interrupted");
            try {
                finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "linesort-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            outputFileOption.createParentDirectories();
            printMessage("Starting external merge sort...");
            printMessage("Input: " + inputPath);
            printMessage("Output: " + outputPath);
            if (verbosityOption.showVerbose()) {
                logger.debug("Options: {}", options);
            }

            SortResult result = new ExternalMergeSorter(options).sort(inputPath, outputPath, token);

            printMessage(String.format(Locale.ROOT, "Sorted %d records (%s) in %.3f s%s",
                result.rows(), ByteSize.format(result.inputBytes()), result.elapsed().toMillis() / 1000.0d,
                result.fastPath() ? " in memory" : ", " + result.chunks() + " chunks, " + result.mergePasses() + " merge passes"));
            printMessage("Sort completed successfully!");
            return EXIT_SUCCESS;
        } catch (SortCancelledException e) {
            logger.warn("Sort cancelled: {}", e.getMessage());
            return EXIT_CANCELLED;
        } catch (IOException e) {
            logger.error("I/O error during sort: " + e.getMessage(), e);
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            logger.error("Error sorting records: " + e.getMessage(), e);
            return EXIT_ERROR;
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                logger.debug("JVM is shutting down, shutdown hook stays registered");
            }
        }
    }

    /**
     * Picocli converter for byte sizes such as {@code 64m}.
     */
    public static final class ByteSizeConverter implements CommandLine.ITypeConverter<Long> {
        @Override
        public Long convert(String value) {
            try {
                return ByteSize.parse(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    /**
     * Picocli converter for record separators.
     */
    public static final class SeparatorConverter implements CommandLine.ITypeConverter<Byte> {
        @Override
        public Byte convert(String value) {
            try {
                return SorterConfig.parseSeparator(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    /**
     * Picocli converter for {@link RecordOrder} labels and aliases.
     */
    public static final class RecordOrderConverter implements CommandLine.ITypeConverter<RecordOrder> {
        @Override
        public RecordOrder convert(String value) {
            try {
                return RecordOrder.fromString(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    /**
     * Picocli converter for charset names.
     */
    public static final class CharsetConverter implements CommandLine.ITypeConverter<Charset> {
        @Override
        public Charset convert(String value) {
            try {
                return Charset.forName(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException("Unsupported charset '" + value + "'");
            }
        }
    }

    public static void main(String[] args) {
        CMD_sort cmd = new CMD_sort();
        int exitCode = new CommandLine(cmd).execute(args);
        System.exit(exitCode);
    }
}
