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

package io.nosqlbench.linesort.status.eventing;

import io.nosqlbench.linesort.status.SortPhase;
import io.nosqlbench.linesort.status.sinks.ConsoleProgressSink;
import io.nosqlbench.linesort.status.sinks.LoggerProgressSink;
import io.nosqlbench.linesort.status.sinks.MetricsProgressSink;
import io.nosqlbench.linesort.status.sinks.NoopProgressSink;

/**
 * A contract for objects that observe sort phases. Where a {@link ProgressListener} is a
 * bare numeric callback owned by the caller of the sorter, a sink receives the full
 * lifecycle of each phase and is meant for display and bookkeeping.
 *
 * <h2>Lifecycle Events</h2>
 * <ol>
 *   <li><strong>phaseStarted:</strong> once, before the first update of a phase</li>
 *   <li><strong>phaseUpdate:</strong> zero or more times, with non-decreasing progress</li>
 *   <li><strong>phaseFinished:</strong> once, with the terminal {@link RunState}</li>
 * </ol>
 *
 * <h2>Built-in Implementations</h2>
 * <ul>
 *   <li>{@link ConsoleProgressSink} - progress bars on a print stream</li>
 *   <li>{@link LoggerProgressSink} - Log4j 2 integration</li>
 *   <li>{@link MetricsProgressSink} - per-phase timings and update counts</li>
 *   <li>{@link NoopProgressSink} - discards everything</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Sort and merge workers publish updates concurrently. Implementations must be
 * thread-safe and should return quickly, since they run on the worker that made the
 * progress.</p>
 *
 * @see ProgressUpdate
 * @see io.nosqlbench.linesort.status.PhaseProgress
 */
public interface ProgressSink {

    /**
     * Called once when a phase begins reporting.
     *
     * @param phase the phase that started
     */
    void phaseStarted(SortPhase phase);

    /**
     * Called for each accepted progress value.
     *
     * @param update the progress snapshot
     */
    void phaseUpdate(ProgressUpdate update);

    /**
     * Called once when a phase reaches a terminal state.
     *
     * @param phase the phase that finished
     * @param state the terminal state
     */
    void phaseFinished(SortPhase phase, RunState state);
}
