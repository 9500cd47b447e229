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

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Locale;

/// Named record orderings selectable from configuration and the command line.
///
/// Every ordering is a total order over strings: where the primary key can rank two
/// different records equal, natural string order breaks the tie.
public enum RecordOrder {

    /// UTF-16 code unit order, as [String#compareTo].
    NATURAL("natural", Comparator.naturalOrder()),

    /// Case-insensitive order, then natural order.
    IGNORE_CASE("ignore-case", String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder())),

    /// Descending natural order.
    REVERSE("reverse", Comparator.reverseOrder()),

    /// Records that parse as decimal numbers (surrounding whitespace ignored) in numeric
    /// order, ahead of all other records, which follow in natural order.
    NUMERIC("numeric", RecordOrder::compareNumeric),

    /// Shorter records first, then natural order.
    LENGTH("length", Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder()));

    private final String label;
    private final Comparator<String> comparator;

    RecordOrder(String label, Comparator<String> comparator) {
        this.label = label;
        this.comparator = comparator;
    }

    public Comparator<String> comparator() {
        return comparator;
    }

    public String getLabel() {
        return label;
    }

    /// Parses an ordering by label, accepting a few aliases ("lexical", "ci", "desc", "num", "len").
    /// @throws IllegalArgumentException if the name is not recognized
    public static RecordOrder fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("record order must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        switch (normalized) {
            case "natural":
            case "lexical":
            case "lexicographic":
                return NATURAL;
            case "ignore-case":
            case "ignorecase":
            case "ci":
                return IGNORE_CASE;
            case "reverse":
            case "desc":
            case "descending":
                return REVERSE;
            case "numeric":
            case "num":
            case "number":
                return NUMERIC;
            case "length":
            case "len":
                return LENGTH;
            default:
                throw new IllegalArgumentException("Unrecognized record order '" + value
                    + "'. Expected one of: natural, ignore-case, reverse, numeric, length.");
        }
    }

    private static int compareNumeric(String a, String b) {
        BigDecimal left = parseNumber(a);
        BigDecimal right = parseNumber(b);
        if (left != null && right != null) {
            int byValue = left.compareTo(right);
            return byValue != 0 ? byValue : a.compareTo(b);
        }
        if (left != null) {
            return -1;
        }
        if (right != null) {
            return 1;
        }
        return a.compareTo(b);
    }

    private static BigDecimal parseNumber(String record) {
        String trimmed = record.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return label;
    }
}
