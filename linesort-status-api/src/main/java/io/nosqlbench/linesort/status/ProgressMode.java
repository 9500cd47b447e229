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

package io.nosqlbench.linesort.status;

import io.nosqlbench.linesort.status.eventing.ProgressSink;
import io.nosqlbench.linesort.status.sinks.ConsoleProgressSink;
import io.nosqlbench.linesort.status.sinks.LoggerProgressSink;
import io.nosqlbench.linesort.status.sinks.NoopProgressSink;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Display modes for sort progress, selected with the {@code --status} option or the
 * {@code linesort.status} system property.
 *
 * <ul>
 *   <li><strong>AUTO</strong> - console bars when a console is attached, log lines otherwise</li>
 *   <li><strong>CONSOLE</strong> - progress bars written to a print stream</li>
 *   <li><strong>LOG</strong> - progress written through Log4j 2</li>
 *   <li><strong>OFF</strong> - no progress output</li>
 * </ul>
 */
public enum ProgressMode {
    AUTO("auto"),
    CONSOLE("console"),
    LOG("log"),
    OFF("off");

    /** System property consulted when no mode is given explicitly. */
    public static final String PROPERTY = "linesort.status";

    private final String propertyValue;

    ProgressMode(String propertyValue) {
        this.propertyValue = propertyValue;
    }

    public String getPropertyValue() {
        return propertyValue;
    }

    /**
     * Parses a mode name, accepting the same aliases as the rest of the tool chain.
     *
     * <ul>
     *   <li><strong>AUTO:</strong> "auto", "" (empty string)</li>
     *   <li><strong>CONSOLE:</strong> "console", "bar", "panel", "tui"</li>
     *   <li><strong>LOG:</strong> "log", "logger", "text"</li>
     *   <li><strong>OFF:</strong> "off", "none", "disable", "disabled", "false"</li>
     * </ul>
     *
     * @param value the name to parse (may be null)
     * @return the mode, or null if the input is null
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static ProgressMode fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "console":
            case "bar":
            case "panel":
            case "tui":
                return CONSOLE;
            case "log":
            case "logger":
            case "text":
                return LOG;
            case "off":
            case "none":
            case "disable":
            case "disabled":
            case "false":
                return OFF;
            case "auto":
            case "":
                return AUTO;
            default:
                throw new IllegalArgumentException(
                    "Unrecognized status mode '" + value + "'. Expected one of: auto, console, log, off.");
        }
    }

    /**
     * Resolves the mode from the {@value #PROPERTY} system property, defaulting to AUTO.
     */
    public static ProgressMode fromSystemProperty() {
        ProgressMode mode = fromString(System.getProperty(PROPERTY));
        return mode != null ? mode : AUTO;
    }

    /**
     * Builds the sinks this mode stands for.
     *
     * @param console stream used by the console mode
     * @return the sinks for this mode
     */
    public List<ProgressSink> createSinks(PrintStream console) {
        switch (this) {
            case CONSOLE:
                return List.of(new ConsoleProgressSink(console));
            case LOG:
                return List.of(new LoggerProgressSink());
            case OFF:
                return List.of(NoopProgressSink.getInstance());
            case AUTO:
            default:
                return System.console() != null
                    ? List.of(new ConsoleProgressSink(console))
                    : List.of(new LoggerProgressSink());
        }
    }

    @Override
    public String toString() {
        return propertyValue;
    }
}
