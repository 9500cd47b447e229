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

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class RecordOrderTest {

    private static List<String> sorted(RecordOrder order, String... records) {
        List<String> list = new ArrayList<>(List.of(records));
        list.sort(order.comparator());
        return list;
    }

    @Test
    public void testOrders() {
        assertThat(sorted(RecordOrder.NATURAL, "b", "B", "a")).containsExactly("B", "a", "b");
        assertThat(sorted(RecordOrder.IGNORE_CASE, "b", "B", "a")).containsExactly("a", "B", "b");
        assertThat(sorted(RecordOrder.REVERSE, "a", "c", "b")).containsExactly("c", "b", "a");
        assertThat(sorted(RecordOrder.LENGTH, "ccc", "b", "aa", "a")).containsExactly("a", "b", "aa", "ccc");
        assertThat(sorted(RecordOrder.NUMERIC, "10", "x", "9", " 2 ", "1e1", "-3.5", "")).containsExactly(
            "-3.5", " 2 ", "9", "10", "1e1", "", "x");
    }

    @Test
    public void testFromStringAcceptsLabelsAndAliases() {
        for (RecordOrder order : RecordOrder.values()) {
            assertEquals(order, RecordOrder.fromString(order.getLabel()));
            assertEquals(order, RecordOrder.fromString(order.name()));
        }
        assertEquals(RecordOrder.IGNORE_CASE, RecordOrder.fromString("ci"));
        assertEquals(RecordOrder.REVERSE, RecordOrder.fromString(" Desc "));
        assertEquals(RecordOrder.NUMERIC, RecordOrder.fromString("num"));
        assertThrows(IllegalArgumentException.class, () -> RecordOrder.fromString("random"));
        assertThrows(IllegalArgumentException.class, () -> RecordOrder.fromString(null));
    }
}
