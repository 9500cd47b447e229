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

import io.nosqlbench.linesort.status.eventing.ProgressListener;
import io.nosqlbench.linesort.status.eventing.ProgressSink;
import io.nosqlbench.linesort.status.eventing.ProgressUpdate;
import io.nosqlbench.linesort.status.eventing.RunState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Progress reporter for a single {@link SortPhase}. The sorter creates one per phase and
 * hands it to the component doing the work; the component reports raw fractions or
 * done/total counts and this class turns them into a well-behaved channel:
 *
 * <ul>
 *   <li>values are clamped into [0, 1] and NaN is dropped,</li>
 *   <li>a value lower than the last published one is dropped, so the channel never moves
 *       backwards even when parallel workers finish out of order,</li>
 *   <li>{@link #complete()} publishes exactly 1.0 and closes the channel,</li>
 *   <li>after a terminal state nothing is published.</li>
 * </ul>
 *
 * <p>Each accepted value goes to the caller's {@link ProgressListener} and then to every
 * registered {@link ProgressSink}. Publication is serialized, so a listener sees values in
 * the same non-decreasing order as the sinks.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * PhaseProgress split = PhaseProgress.of(SortPhase.SPLIT, f -> bar.set(f), new LoggerProgressSink());
 * for (int chunk = 1; chunk <= chunks; chunk++) {
 *     writeChunk(chunk);
 *     split.report(bytesRead, totalBytes);
 * }
 * split.complete();
 * }</pre>
 */
public final class PhaseProgress {

    private final SortPhase phase;
    private final ProgressListener listener;
    private final List<ProgressSink> sinks;

    private double progress = 0.0d;
    private RunState state = RunState.PENDING;

    /**
     * @param phase the phase this reporter belongs to
     * @param listener the caller's callback, or null for none
     * @param sinks the display sinks to notify
     */
    public PhaseProgress(SortPhase phase, ProgressListener listener, List<ProgressSink> sinks) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.listener = listener != null ? listener : ProgressListener.NONE;
        this.sinks = Collections.unmodifiableList(new ArrayList<>(sinks));
    }

    public static PhaseProgress of(SortPhase phase, ProgressListener listener, ProgressSink... sinks) {
        return new PhaseProgress(phase, listener, Arrays.asList(sinks));
    }

    /**
     * A reporter that publishes to nobody but still tracks its own state.
     */
    public static PhaseProgress silent(SortPhase phase) {
        return new PhaseProgress(phase, ProgressListener.NONE, List.of());
    }

    /**
     * Reports {@code done / total}. A non-positive total counts as no progress.
     */
    public void report(long done, long total) {
        if (total <= 0) {
            report(0.0d);
            return;
        }
        report((double) done / (double) total);
    }

    /**
     * Reports a fraction of the phase. Values outside [0, 1] are clamped, values below the
     * last published one are ignored.
     *
     * @param fraction the completed fraction
     */
    public synchronized void report(double fraction) {
        if (Double.isNaN(fraction) || state.isTerminal()) {
            return;
        }
        double clamped = Math.max(0.0d, Math.min(1.0d, fraction));
        if (state == RunState.PENDING) {
            start();
        } else if (clamped <= progress) {
            return;
        }
        progress = Math.max(progress, clamped);
        publish(progress);
    }

    /**
     * Publishes exactly 1.0 and moves the phase to {@link RunState#SUCCESS}.
     */
    public synchronized void complete() {
        if (state.isTerminal()) {
            return;
        }
        if (state == RunState.PENDING) {
            start();
        }
        progress = 1.0d;
        state = RunState.SUCCESS;
        publish(progress);
        for (ProgressSink sink : sinks) {
            sink.phaseFinished(phase, RunState.SUCCESS);
        }
    }

    /**
     * Marks the phase as aborted by an error.
     */
    public void fail() {
        finish(RunState.FAILED);
    }

    /**
     * Marks the phase as aborted by cancellation.
     */
    public void cancel() {
        finish(RunState.CANCELLED);
    }

    private synchronized void finish(RunState terminal) {
        if (state.isTerminal()) {
            return;
        }
        if (state == RunState.PENDING) {
            for (ProgressSink sink : sinks) {
                sink.phaseStarted(phase);
            }
        }
        state = terminal;
        for (ProgressSink sink : sinks) {
            sink.phaseFinished(phase, terminal);
        }
    }

    private void start() {
        state = RunState.RUNNING;
        for (ProgressSink sink : sinks) {
            sink.phaseStarted(phase);
        }
    }

    private void publish(double value) {
        listener.report(value);
        ProgressUpdate update = new ProgressUpdate(phase, value, state);
        for (ProgressSink sink : sinks) {
            sink.phaseUpdate(update);
        }
    }

    public SortPhase getPhase() {
        return phase;
    }

    public synchronized double getProgress() {
        return progress;
    }

    public synchronized RunState getState() {
        return state;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s [%.1f%%] %s", phase, getProgress() * 100, getState());
    }
}
