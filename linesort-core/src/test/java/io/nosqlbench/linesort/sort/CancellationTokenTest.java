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

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class CancellationTokenTest {

    @Test
    public void testFirstReasonWins() {
        CancellationToken token = new CancellationToken();
        assertFalse(token.isCancellationRequested());
        token.throwIfCancellationRequested();

        token.cancel("first");
        token.cancel("second");

        assertTrue(token.isCancellationRequested());
        assertEquals("first", token.getReason());
        SortCancelledException e = assertThrows(SortCancelledException.class, token::throwIfCancellationRequested);
        assertEquals("first", e.getMessage());
        assertInstanceOf(CancellationException.class, e);
    }

    @Test
    public void testNoneCannotBeCancelled() {
        assertThrows(UnsupportedOperationException.class, CancellationToken.NONE::cancel);
        assertFalse(CancellationToken.NONE.isCancellationRequested());
    }

    @Test
    public void testNullReasonFallsBackToDefault() {
        CancellationToken token = new CancellationToken();
        token.cancel(null);
        assertEquals("cancellation requested", token.getReason());
    }

    @Test
    public void testObserversNeverSeeCancellationWithoutReason() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 500; round++) {
                CancellationToken token = new CancellationToken();
                String reason = "round " + round;
                Future<String> observer = executor.submit(() -> {
                    while (true) {
                        try {
                            token.throwIfCancellationRequested();
                        } catch (SortCancelledException e) {
                            return e.getMessage();
                        }
                    }
                });
                executor.submit(() -> token.cancel(reason)).get();
                assertEquals(reason, observer.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
