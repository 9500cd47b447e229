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
 * Built-in {@link io.nosqlbench.linesort.status.eventing.ProgressSink} implementations.
 *
 * <ul>
 *   <li>{@link io.nosqlbench.linesort.status.sinks.ConsoleProgressSink} - progress bars</li>
 *   <li>{@link io.nosqlbench.linesort.status.sinks.LoggerProgressSink} - Log4j 2 output</li>
 *   <li>{@link io.nosqlbench.linesort.status.sinks.MetricsProgressSink} - per-phase statistics</li>
 *   <li>{@link io.nosqlbench.linesort.status.sinks.NoopProgressSink} - discards events</li>
 * </ul>
 */
package io.nosqlbench.linesort.status.sinks;
