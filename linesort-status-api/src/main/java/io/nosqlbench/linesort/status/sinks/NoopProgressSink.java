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

/**
 * A sink that discards every event.
 */
public class NoopProgressSink implements ProgressSink {

    private static final NoopProgressSink INSTANCE = new NoopProgressSink();

    private NoopProgressSink() {
    }

    public static NoopProgressSink getInstance() {
        return INSTANCE;
    }

    @Override
    public void phaseStarted(SortPhase phase) {
    }

    @Override
    public void phaseUpdate(ProgressUpdate update) {
    }

    @Override
    public void phaseFinished(SortPhase phase, RunState state) {
    }
}
