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

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/// Reusable row arrays for the chunk sort workers.
///
/// Every buffer holds `rowCapacity` rows, the largest row count of any chunk, so any
/// buffer fits any chunk. [#acquire()] takes an idle buffer or allocates one on a miss;
/// [#release(String[])] parks it for the next worker. At most `maxPooled` buffers are kept,
/// and since a worker releases its buffer before taking its next chunk, a pool shared by
/// `P` workers never allocates more than `P` buffers.
///
/// Both operations are lock-free with respect to I/O: the queue lock is held only for
/// the hand-over itself.
public final class RowBufferPool {

    private final int rowCapacity;
    private final BlockingQueue<String[]> idle;
    private final AtomicInteger allocations = new AtomicInteger();

    /// @param rowCapacity rows per buffer
    /// @param maxPooled maximum number of idle buffers retained
    public RowBufferPool(long rowCapacity, int maxPooled) {
        if (rowCapacity < 0 || rowCapacity > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("row capacity out of range for an array buffer: " + rowCapacity);
        }
        if (maxPooled < 1) {
            throw new IllegalArgumentException("pool must retain at least one buffer: " + maxPooled);
        }
        this.rowCapacity = (int) rowCapacity;
        this.idle = new ArrayBlockingQueue<>(maxPooled);
    }

    public String[] acquire() {
        String[] buffer = idle.poll();
        if (buffer == null) {
            allocations.incrementAndGet();
            buffer = new String[rowCapacity];
        }
        return buffer;
    }

    /// Returns a buffer to the pool. The caller clears the rows it used beforehand.
    /// Buffers beyond the pool's capacity are dropped.
    public void release(String[] buffer) {
        if (buffer.length != rowCapacity) {
            throw new IllegalArgumentException("buffer of " + buffer.length + " rows does not belong to a pool of " + rowCapacity);
        }
        idle.offer(buffer);
    }

    public int getRowCapacity() {
        return rowCapacity;
    }

    /// @return the number of buffers allocated so far
    public int getAllocations() {
        return allocations.get();
    }

    /// @return the number of idle buffers currently held
    public int getIdleCount() {
        return idle.size();
    }
}
