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
 * Lifecycle state of one sort phase.
 *
 * <p>State Transitions:
 * <ul>
 *   <li><strong>PENDING → RUNNING:</strong> the phase reports its first progress value</li>
 *   <li><strong>RUNNING → SUCCESS:</strong> the phase completes and reports exactly 1.0</li>
 *   <li><strong>RUNNING → FAILED:</strong> an I/O or comparison error aborts the run</li>
 *   <li><strong>RUNNING → CANCELLED:</strong> the cancellation token was observed</li>
 *   <li><strong>PENDING → CANCELLED / FAILED:</strong> an earlier phase aborted the run</li>
 * </ul>
 *
 * <p>{@link #SUCCESS}, {@link #FAILED} and {@link #CANCELLED} are terminal. Once a phase
 * reaches one of them no further updates are published for it.
 *
 * @see ProgressUpdate
 */
public enum RunState {
    /** The phase has not reported anything yet. */
    PENDING("⏳"),

    /** The phase is moving; progress lies in [0, 1). */
    RUNNING("🔄"),

    /** The phase finished; progress is 1.0. */
    SUCCESS("✅"),

    /** The phase was aborted by an error. */
    FAILED("❌"),

    /** The phase was aborted through the cooperative cancellation signal. */
    CANCELLED("🚫");

    private final String glyph;

    RunState(String glyph) {
        this.glyph = glyph;
    }

    /**
     * @return a glyph for console display
     */
    public String getGlyph() {
        return glyph;
    }

    /**
     * @return true when no further transitions are allowed
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED;
    }
}
