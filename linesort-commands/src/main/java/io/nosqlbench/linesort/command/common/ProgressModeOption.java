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

package io.nosqlbench.linesort.command.common;

import io.nosqlbench.linesort.status.ProgressMode;
import io.nosqlbench.linesort.status.eventing.ProgressSink;
import picocli.CommandLine;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Shared {@code --status} CLI option that controls the {@value ProgressMode#PROPERTY} system
 * property understood by {@link ProgressMode#fromSystemProperty()}.
 *
 * <p>The property is applied only when the user specifies {@code --status}. It is restored to its
 * previous value automatically when the returned {@link Scope} is closed.</p>
 */
public final class ProgressModeOption {

    @CommandLine.Option(
        names = {"--status"},
        paramLabel = "MODE",
        description = {
            "Progress output mode. Valid values: ${COMPLETION-CANDIDATES}.",
            "Omit to inherit the linesort.status system property (default: auto)."
        },
        converter = ProgressModeConverter.class
    )
    private ProgressMode progressMode;

    /**
     * Applies the requested mode, returning a scope that restores the original
     * configuration when closed. If {@code --status} was not provided, this is a no-op scope.
     */
    public Scope scopedProperty() {
        if (progressMode == null) {
            return Scope.noop();
        }

        String desired = progressMode.getPropertyValue();
        String previous = System.getProperty(ProgressMode.PROPERTY);
        boolean hadPrevious = previous != null;

        if (!Objects.equals(previous, desired)) {
            System.setProperty(ProgressMode.PROPERTY, desired);
            return new Scope(true, hadPrevious, previous);
        }

        return new Scope(false, hadPrevious, previous);
    }

    /**
     * @return the selected mode, or {@code null} when not provided
     */
    public ProgressMode getProgressMode() {
        return progressMode;
    }

    /**
     * The mode in effect: the explicit selection, else the system property, else AUTO.
     */
    public ProgressMode getEffectiveMode() {
        return progressMode != null ? progressMode : ProgressMode.fromSystemProperty();
    }

    /**
     * Creates the progress sinks of the effective mode.
     *
     * @param console stream for console progress bars
     */
    public List<ProgressSink> createSinks(PrintStream console) {
        return getEffectiveMode().createSinks(console);
    }

    /**
     * Picocli converter that maps user-provided values to {@link ProgressMode}.
     */
    public static final class ProgressModeConverter implements CommandLine.ITypeConverter<ProgressMode> {
        @Override
        public ProgressMode convert(String value) {
            try {
                return ProgressMode.fromString(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    /**
     * Scope returned by {@link #scopedProperty()} that restores the prior system property when closed.
     */
    public static final class Scope implements AutoCloseable {
        private static final Scope NOOP = new Scope(false, false, null);

        private final boolean modified;
        private final boolean hadPrevious;
        private final String previousValue;

        private Scope(boolean modified, boolean hadPrevious, String previousValue) {
            this.modified = modified;
            this.hadPrevious = hadPrevious;
            this.previousValue = previousValue;
        }

        static Scope noop() {
            return NOOP;
        }

        @Override
        public void close() {
            if (!modified) {
                return;
            }
            if (hadPrevious) {
                System.setProperty(ProgressMode.PROPERTY, previousValue);
            } else {
                System.clearProperty(ProgressMode.PROPERTY);
            }
        }
    }
}
