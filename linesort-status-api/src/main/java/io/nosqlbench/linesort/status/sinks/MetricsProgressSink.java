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

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects timing and update statistics per phase, for the run summary printed by the
 * command line in verbose mode and for tests that need to check what a run reported.
 */
public class MetricsProgressSink implements ProgressSink {

    public static class PhaseMetrics {
        private final AtomicLong startTime = new AtomicLong();
        private final AtomicLong endTime = new AtomicLong();
        private final AtomicLong updateCount = new AtomicLong();
        private volatile double lastProgress = 0.0d;
        private volatile boolean monotonic = true;
        private volatile RunState finalState = RunState.PENDING;

        public long getDuration() {
            long end = endTime.get();
            if (end == 0) {
                return System.currentTimeMillis() - startTime.get();
            }
            return end - startTime.get();
        }

        public long getUpdateCount() {
            return updateCount.get();
        }

        public double getLastProgress() {
            return lastProgress;
        }

        /**
         * @return false if any update was lower than the one before it
         */
        public boolean isMonotonic() {
            return monotonic;
        }

        public RunState getFinalState() {
            return finalState;
        }

        public boolean isFinished() {
            return endTime.get() > 0;
        }
    }

    private final Map<SortPhase, PhaseMetrics> metrics = new EnumMap<>(SortPhase.class);

    @Override
    public synchronized void phaseStarted(SortPhase phase) {
        PhaseMetrics phaseMetrics = new PhaseMetrics();
        phaseMetrics.startTime.set(System.currentTimeMillis());
        phaseMetrics.finalState = RunState.RUNNING;
        metrics.put(phase, phaseMetrics);
    }

    @Override
    public synchronized void phaseUpdate(ProgressUpdate update) {
        PhaseMetrics phaseMetrics = metrics.get(update.phase);
        if (phaseMetrics == null) {
            return;
        }
        if (update.progress < phaseMetrics.lastProgress) {
            phaseMetrics.monotonic = false;
        }
        phaseMetrics.updateCount.incrementAndGet();
        phaseMetrics.lastProgress = update.progress;
    }

    @Override
    public synchronized void phaseFinished(SortPhase phase, RunState state) {
        PhaseMetrics phaseMetrics = metrics.get(phase);
        if (phaseMetrics != null) {
            phaseMetrics.endTime.set(System.currentTimeMillis());
            phaseMetrics.finalState = state;
        }
    }

    public synchronized PhaseMetrics getMetrics(SortPhase phase) {
        return metrics.get(phase);
    }

    public synchronized String generateReport() {
        StringBuilder report = new StringBuilder();
        report.append("=== Sort Phase Report ===\n");
        for (SortPhase phase : SortPhase.values()) {
            PhaseMetrics phaseMetrics = metrics.get(phase);
            if (phaseMetrics == null) {
                report.append("  - ").append(phase).append(": not started\n");
                continue;
            }
            report.append("  - ").append(phase).append(":\n");
            report.append("    Duration: ").append(phaseMetrics.getDuration()).append(" ms\n");
            report.append("    Updates: ").append(phaseMetrics.getUpdateCount()).append("\n");
            report.append("    Progress: ").append(String.format(Locale.ROOT, "%.1f%%", phaseMetrics.getLastProgress() * 100)).append("\n");
            report.append("    Status: ").append(phaseMetrics.getFinalState()).append("\n");
        }
        return report.toString();
    }
}
