/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.frame;

import dev.tabula.metadata.Policy;
import dev.tabula.vector.ColumnVector;

/**
 * Shared test frames.
 */
final class Fixtures {

    static final int LETTER_COUNT = 26;

    private Fixtures() {
    }

    /**
     * 26 rows: {@code letters_lower} (a-z), {@code letters_upper} (A-Z), {@code values} (1-26).
     */
    static Frame letters(Policy policy) {
        String[] lower = new String[LETTER_COUNT];
        String[] upper = new String[LETTER_COUNT];
        long[] values = new long[LETTER_COUNT];
        for (int i = 0; i < LETTER_COUNT; i++) {
            lower[i] = String.valueOf((char) ('a' + i));
            upper[i] = String.valueOf((char) ('A' + i));
            values[i] = i + 1;
        }
        return Frame.builder(policy)
                .add("letters_lower", ColumnVector.ofText(lower))
                .add("letters_upper", ColumnVector.ofText(upper))
                .add("values", ColumnVector.ofIntegers(values))
                .build();
    }

    /**
     * 3 rows: {@code id} (10, 20, 30), {@code score} (1.5, 2.5, 3.5), {@code flag} (true, false, true).
     */
    static Frame small(Policy policy) {
        return Frame.builder(policy)
                .add("id", ColumnVector.ofIntegers(10, 20, 30))
                .add("score", ColumnVector.ofDoubles(1.5, 2.5, 3.5))
                .add("flag", ColumnVector.ofBooleans(true, false, true))
                .build();
    }

    /**
     * 2 rows: {@code col_99} (1, 2) and {@code col_990} (3, 4); the first name is a prefix of the second.
     */
    static Frame overlapping(Policy policy) {
        return Frame.builder(policy)
                .add("col_99", ColumnVector.ofIntegers(1, 2))
                .add("col_990", ColumnVector.ofIntegers(3, 4))
                .build();
    }
}
