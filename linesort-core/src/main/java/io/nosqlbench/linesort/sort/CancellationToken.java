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

import java.util.concurrent.atomic.AtomicReference;

/// Cooperative cancellation signal shared by every phase of one sort run.
///
/// The splitter checks it before each chunk, sort workers before they pick up a chunk,
/// and merge tasks before every record they write. A requested cancellation surfaces as
/// a [SortCancelledException] from whichever check observes it first.
public final class CancellationToken {

    /// A token that is never cancelled.
    public static final CancellationToken NONE = new CancellationToken(false);

    private static final String DEFAULT_REASON = "cancellation requested";

    private final boolean cancellable;
    /// Null until cancelled; the reason doubles as the cancelled flag.
    private final AtomicReference<String> reason = new AtomicReference<>();

    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /// Requests cancellation. Only the first call's reason is kept.
    /// @param reason a short description for logs and the resulting exception
    public void cancel(String reason) {
        if (!cancellable) {
            throw new UnsupportedOperationException("The NONE token cannot be cancelled");
        }
        this.reason.compareAndSet(null, reason != null ? reason : DEFAULT_REASON);
    }

    public void cancel() {
        cancel(DEFAULT_REASON);
    }

    public boolean isCancellationRequested() {
        return reason.get() != null;
    }

    /// @throws SortCancelledException if cancellation has been requested
    public void throwIfCancellationRequested() {
        String observed = reason.get();
        if (observed != null) {
            throw new SortCancelledException(observed);
        }
    }

    public String getReason() {
        return reason.get();
    }
}
