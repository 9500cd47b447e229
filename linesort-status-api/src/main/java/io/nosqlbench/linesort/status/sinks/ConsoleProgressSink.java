/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.linesort.status.sinks;

import io.nosqlbench.linesort.status.SortPhase;
import io.nosqlbench.linesort.status.eventing.ProgressSink;
import io.nosqlbench.linesort.status.eventing.ProgressUpdate;
import io.nosqlbench.linesort.status.eventing.RunState;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Human-readable progress output with a text progress bar per update:
 *
 * <pre>
 * [12:00:01.250] ▶ Started: sort
 * [12:00:02.113]   sort [██████████░░░░░░░░░░] 50.0% - RUNNING
 * [12:00:03.870] ✅ Finished: sort
 * </pre>
 *
 * <p>Output is written line by line; methods are synchronized so concurrent workers never
 * interleave partial lines.</p>
 */
public class ConsoleProgressSink implements ProgressSink {

    private static final int BAR_LENGTH = 20;

    private final PrintStream output;
    private final boolean showTimestamp;
    private final DateTimeFormatter timeFormatter = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    public ConsoleProgressSink() {
        this(System.err, true);
    }

    public ConsoleProgressSink(PrintStream output) {
        this(output, true);
    }

    public ConsoleProgressSink(PrintStream output, boolean showTimestamp) {
        this.output = output;
        this.showTimestamp = showTimestamp;
    }

    @Override
    public synchronized void phaseStarted(SortPhase phase) {
        output.println(timestamp() + "▶ Started: " + phase);
    }

    @Override
    public synchronized void phaseUpdate(ProgressUpdate update) {
        output.println(timestamp() + "  " + update.phase + " " + createProgressBar(update.progress)
            + String.format(Locale.ROOT, " %.1f%%", update.progress * 100) + " - " + update.runstate);
    }

    @Override
    public synchronized void phaseFinished(SortPhase phase, RunState state) {
        output.println(timestamp() + state.getGlyph() + " Finished: " + phase + " - " + state);
    }

    private String timestamp() {
        return showTimestamp ? "[" + LocalDateTime.now().format(timeFormatter) + "] " : "";
    }

    static String createProgressBar(double progress) {
        int filled = (int) (BAR_LENGTH * Math.max(0.0d, Math.min(1.0d, progress)));
        StringBuilder bar = new StringBuilder("[");
        bar.append("█".repeat(filled));
        bar.append("░".repeat(BAR_LENGTH - filled));
        bar.append("]");
        return bar.toString();
    }
}
