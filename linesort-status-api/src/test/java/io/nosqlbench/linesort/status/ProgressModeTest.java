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

package io.nosqlbench.linesort.status;

import io.nosqlbench.linesort.status.sinks.ConsoleProgressSink;
import io.nosqlbench.linesort.status.sinks.LoggerProgressSink;
import io.nosqlbench.linesort.status.sinks.NoopProgressSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class ProgressModeTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(ProgressMode.PROPERTY);
    }

    @Test
    public void testAliases() {
        assertEquals(ProgressMode.CONSOLE, ProgressMode.fromString("tui"));
        assertEquals(ProgressMode.CONSOLE, ProgressMode.fromString(" Bar "));
        assertEquals(ProgressMode.LOG, ProgressMode.fromString("logger"));
        assertEquals(ProgressMode.OFF, ProgressMode.fromString("disabled"));
        assertEquals(ProgressMode.AUTO, ProgressMode.fromString(""));
        assertNull(ProgressMode.fromString(null));
    }

    @Test
    public void testUnknownModeIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ProgressMode.fromString("fancy"));
        assertTrue(e.getMessage().contains("fancy"));
    }

    @Test
    public void testSystemPropertyDefaultsToAuto() {
        assertEquals(ProgressMode.AUTO, ProgressMode.fromSystemProperty());
        System.setProperty(ProgressMode.PROPERTY, "off");
        assertEquals(ProgressMode.OFF, ProgressMode.fromSystemProperty());
    }

    @Test
    public void testSinksPerMode() {
        PrintStream console = new PrintStream(new ByteArrayOutputStream());
        assertThat(ProgressMode.CONSOLE.createSinks(console)).singleElement().isInstanceOf(ConsoleProgressSink.class);
        assertThat(ProgressMode.LOG.createSinks(console)).singleElement().isInstanceOf(LoggerProgressSink.class);
        assertThat(ProgressMode.OFF.createSinks(console)).containsExactly(NoopProgressSink.getInstance());
        assertThat(ProgressMode.AUTO.createSinks(console)).hasSize(1);
    }
}
