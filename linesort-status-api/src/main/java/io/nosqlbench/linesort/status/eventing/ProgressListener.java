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

/**
 * Caller-supplied callback for one progress channel. The sorter holds one listener per
 * {@link io.nosqlbench.linesort.status.SortPhase} and invokes it synchronously from
 * whichever thread made progress, so implementations must tolerate concurrent calls.
 *
 * <p>Values are non-decreasing within one run and lie in [0, 1]; a successful run always
 * ends a channel with exactly {@code 1.0}.</p>
 */
@FunctionalInterface
public interface ProgressListener {

    /** A listener that ignores every value. */
    ProgressListener NONE = fraction -> {
    };

    /**
     * @param fraction completed fraction of the phase, in [0, 1]
     */
    void report(double fraction);
}
