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

import java.util.Locale;
import java.util.Objects;

/**
 * An immutable snapshot of one phase's progress, handed to every
 * {@link ProgressSink} registered with a {@link io.nosqlbench.linesort.status.PhaseProgress}.
 *
 * <h2>Progress Values</h2>
 * <p>Progress is a fraction between 0.0 and 1.0. Within one phase the published values
 * never decrease; the reporter drops any value lower than one it already published.
 * A successful phase always ends with exactly 1.0.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Instances are immutable and may be shared freely between the sort workers that
 * produce them and the sinks that consume them.</p>
 *
 * @see ProgressSink
 * @see RunState
 */
public final class ProgressUpdate {
    public final SortPhase phase;
    public final double progress;
    public final RunState runstate;
    public final long timestamp;

    /**
     * Creates an update stamped with the current wall clock time.
     *
     * @param phase the phase this update belongs to
     * @param progress the phase progress (0.0 to 1.0)
     * @param runstate the phase's current state
     */
    public ProgressUpdate(SortPhase phase, double progress, RunState runstate) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.progress = progress;
        this.runstate = Objects.requireNonNull(runstate, "runstate");
        this.timestamp = System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s [%.1f%%] - %s", phase, progress * 100, runstate);
    }
}
