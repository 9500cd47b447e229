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

/**
 * Progress reporting for the external line sorter.
 *
 * <p>A sort runs in three phases ({@link io.nosqlbench.linesort.status.SortPhase}). Each
 * phase is given a {@link io.nosqlbench.linesort.status.PhaseProgress} that accepts raw
 * fractions from the worker threads and republishes them as a monotonic channel to:</p>
 *
 * <ul>
 *   <li>the caller's {@link io.nosqlbench.linesort.status.eventing.ProgressListener}, a
 *       bare {@code double} callback, and</li>
 *   <li>any number of {@link io.nosqlbench.linesort.status.eventing.ProgressSink}s, which
 *       see phase start, updates and the terminal
 *       {@link io.nosqlbench.linesort.status.eventing.RunState}.</li>
 * </ul>
 *
 * <p>{@link io.nosqlbench.linesort.status.ProgressMode} maps the user's display choice onto
 * a set of sinks from {@link io.nosqlbench.linesort.status.sinks}.</p>
 */
package io.nosqlbench.linesort.status;
