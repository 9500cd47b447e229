package io.nosqlbench.linesort.sort;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.time.Duration;

/// Summary of a completed sort run.
///
/// @param inputBytes size of the input file
/// @param rows records written to the output
/// @param chunks chunks the input was split into, 1 for the fast path
/// @param mergePasses merge passes executed, 0 for the fast path
/// @param fastPath whether the input was sorted in memory without splitting
/// @param elapsed wall clock time of the run
public record SortResult(long inputBytes, long rows, int chunks, int mergePasses, boolean fastPath, Duration elapsed) {
}
