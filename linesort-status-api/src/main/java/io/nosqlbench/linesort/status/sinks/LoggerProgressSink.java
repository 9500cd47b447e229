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
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A progress sink that writes phase events through Log4j 2, for batch environments where
 * progress belongs in the same log as everything else.
 *
 * <h2>Log Message Format</h2>
 * <ul>
 *   <li><strong>Phase Started:</strong> "Phase started: [phase]"</li>
 *   <li><strong>Phase Update:</strong> "Phase update: [phase] [XX.X%] - [run-state]"</li>
 *   <li><strong>Phase Finished:</strong> "Phase finished: [phase] - [run-state]"</li>
 * </ul>
 *
 * <p>Merge and sort workers can publish many small steps. Updates are only logged when
 * they advance the phase by at least {@code minStep} since the last logged update, so a
 * long run logs a bounded number of lines per phase. Completion is always logged.</p>
 */
public class LoggerProgressSink implements ProgressSink {

    private static final double DEFAULT_MIN_STEP = 0.05d;

    private final Logger logger;
    private final Level level;
    private final double minStep;
    private final Map<SortPhase, Double> lastLogged = new ConcurrentHashMap<>();

    public LoggerProgressSink() {
        this(LogManager.getLogger(LoggerProgressSink.class));
    }

    public LoggerProgressSink(Logger logger) {
        this(logger, Level.INFO, DEFAULT_MIN_STEP);
    }

    public LoggerProgressSink(String loggerName, Level level) {
        this(LogManager.getLogger(loggerName), level, DEFAULT_MIN_STEP);
    }

    public LoggerProgressSink(Logger logger, Level level, double minStep) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNullElse(level, Level.INFO);
        this.minStep = Math.max(0.0d, minStep);
    }

    @Override
    public void phaseStarted(SortPhase phase) {
        lastLogged.remove(phase);
        log("Phase started: " + phase);
    }

    @Override
    public void phaseUpdate(ProgressUpdate update) {
        double previous = lastLogged.getOrDefault(update.phase, -1.0d);
        boolean finalValue = update.progress >= 1.0d;
        if (!finalValue && previous >= 0 && update.progress - previous < minStep) {
            return;
        }
        lastLogged.put(update.phase, update.progress);
        log(String.format(Locale.ROOT, "Phase update: %s [%.1f%%] - %s", update.phase, update.progress * 100, update.runstate));
    }

    @Override
    public void phaseFinished(SortPhase phase, RunState state) {
        log("Phase finished: " + phase + " - " + state);
    }

    private void log(String message) {
        if (logger.isEnabled(level)) {
            logger.log(level, message);
        }
    }
}
