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

import java.util.concurrent.CancellationException;

/// The cancelled outcome of a sort run. Thrown once a [CancellationToken] is observed;
/// intermediate files are left to the scratch directory's cleanup and the output file may
/// be missing or incomplete.
public class SortCancelledException extends CancellationException {

    public SortCancelledException(String message) {
        super(message);
    }
}
