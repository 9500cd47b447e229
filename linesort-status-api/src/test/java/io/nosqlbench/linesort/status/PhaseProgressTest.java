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

import io.nosqlbench.linesort.status.eventing.RunState;
import io.nosqlbench.linesort.status.sinks.MetricsProgressSink;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PhaseProgress}, the per-phase reporter that turns raw worker fractions
 * into a monotonic, clamped channel.
 *
 * <h2>Test Coverage Areas:</h2>
 * <ul>
 *   <li>Clamping and NaN handling</li>
 *   <li>Dropping of regressions</li>
 *   <li>Completion with exactly 1.0 and terminal-state behavior</li>
 *   <li>Monotonicity under concurrent reporting</li>
 * </ul>
 */
@Tag("Core")
public class PhaseProgressTest {

    @Test
    public void testValuesAreClampedAndNaNDropped() {
        List<Double> seen = new ArrayList<>();
        PhaseProgress progress = PhaseProgress.of(SortPhase.SPLIT, seen::add);

        progress.report(-0.5);
        progress.report(Double.NaN);
        progress.report(1.7);

        assertEquals(List.of(0.0, 1.0), seen);
        assertEquals(RunState.RUNNING, progress.getState());
    }

    @Test
    public void testRegressionsAreIgnored() {
        List<Double> seen = new ArrayList<>();
        PhaseProgress progress = PhaseProgress.of(SortPhase.SORT, seen::add);

        progress.report(0.25);
        progress.report(0.75);
        progress.report(0.5);
        progress.report(0.75);
        progress.report(3, 4);

        assertEquals(List.of(0.25, 0.75), seen);
        assertEquals(0.75, progress.getProgress(), 0.0);
    }

    @Test
    public void testDoneOverTotal() {
        List<Double> seen = new ArrayList<>();
        PhaseProgress progress = PhaseProgress.of(SortPhase.MERGE, seen::add);

        progress.report(0, 0);
        progress.report(1, 4);
        progress.report(2, 4);

        assertEquals(List.of(0.0, 0.25, 0.5), seen);
    }

    @Test
    public void testCompleteEndsWithExactlyOne() {
        List<Double> seen = new ArrayList<>();
        MetricsProgressSink metrics = new MetricsProgressSink();
        PhaseProgress progress = PhaseProgress.of(SortPhase.MERGE, seen::add, metrics);

        progress.report(0.4);
        progress.complete();
        progress.report(0.9);
        progress.complete();

        assertEquals(List.of(0.4, 1.0), seen);
        assertEquals(RunState.SUCCESS, progress.getState());
        assertEquals(RunState.SUCCESS, metrics.getMetrics(SortPhase.MERGE).getFinalState());
        assertEquals(2, metrics.getMetrics(SortPhase.MERGE).getUpdateCount());
    }

    @Test
    public void testCompleteWithoutPriorUpdates() {
        List<Double> seen = new ArrayList<>();
        MetricsProgressSink metrics = new MetricsProgressSink();
        PhaseProgress progress = PhaseProgress.of(SortPhase.SPLIT, seen::add, metrics);

        progress.complete();

        assertEquals(List.of(1.0), seen);
        assertTrue(metrics.getMetrics(SortPhase.SPLIT).isFinished());
    }

    @Test
    public void testCancelStopsPublication() {
        List<Double> seen = new ArrayList<>();
        MetricsProgressSink metrics = new MetricsProgressSink();
        PhaseProgress progress = PhaseProgress.of(SortPhase.MERGE, seen::add, metrics);

        progress.report(0.3);
        progress.cancel();
        progress.report(0.6);
        progress.complete();
        progress.fail();

        assertEquals(List.of(0.3), seen);
        assertEquals(RunState.CANCELLED, progress.getState());
        assertEquals(RunState.CANCELLED, metrics.getMetrics(SortPhase.MERGE).getFinalState());
    }

    @Test
    public void testFailBeforeStartStillNotifiesSinks() {
        MetricsProgressSink metrics = new MetricsProgressSink();
        PhaseProgress progress = PhaseProgress.of(SortPhase.SORT, null, metrics);

        progress.fail();

        assertEquals(RunState.FAILED, progress.getState());
        assertNotNull(metrics.getMetrics(SortPhase.SORT));
        assertEquals(RunState.FAILED, metrics.getMetrics(SortPhase.SORT).getFinalState());
    }

    @Test
    public void testConcurrentReportsStayMonotonic() throws InterruptedException {
        List<Double> seen = Collections.synchronizedList(new ArrayList<>());
        MetricsProgressSink metrics = new MetricsProgressSink();
        PhaseProgress progress = PhaseProgress.of(SortPhase.SORT, seen::add, metrics);

        int threads = 8;
        int perThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            final int offset = t;
            executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    progress.report(i * threads + offset, (long) threads * perThread);
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
        progress.complete();

        for (int i = 1; i < seen.size(); i++) {
            assertTrue(seen.get(i) >= seen.get(i - 1), "progress went backwards at " + i);
        }
        assertEquals(1.0, seen.get(seen.size() - 1), 0.0);
        assertTrue(metrics.getMetrics(SortPhase.SORT).isMonotonic());
    }
}
