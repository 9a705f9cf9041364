/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.frame;

import java.util.Arrays;

import dev.tabula.IndexOutOfRangeException;

/**
 * Specifies which rows two-argument subsetting keeps.
 * Applied the same way under both policies.
 *
 * <pre>{@code
 * RowSelector.all()          // every row, unchanged
 * RowSelector.of(0, 2, 2)    // rows 0, 2 and 2 again, in that order
 * RowSelector.range(10, 20)  // rows 10 (inclusive) to 20 (exclusive)
 * }</pre>
 */
public final class RowSelector {

    private static final RowSelector ALL = new RowSelector(null);

    private final int[] positions;

    private RowSelector(int[] positions) {
        this.positions = positions;
    }

    public static RowSelector all() {
        return ALL;
    }

    /**
     * Selects the given 0-based row positions, in order. Positions may repeat.
     */
    public static RowSelector of(int... positions) {
        return new RowSelector(positions.clone());
    }

    /**
     * Selects the rows from {@code fromInclusive} up to, but excluding, {@code toExclusive}.
     *
     * @throws IllegalArgumentException if the start is negative or the range is inverted
     */
    public static RowSelector range(int fromInclusive, int toExclusive) {
        if (fromInclusive < 0 || fromInclusive > toExclusive) {
            throw new IllegalArgumentException("Invalid row range [" + fromInclusive + ", " + toExclusive + ")");
        }
        int[] positions = new int[toExclusive - fromInclusive];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = fromInclusive + i;
        }
        return new RowSelector(positions);
    }

    public boolean selectsAll() {
        return positions == null;
    }

    /**
     * Returns the selected positions for a frame with the given row count,
     * or null if all rows are selected.
     *
     * @throws IndexOutOfRangeException if a position is outside of {@code [0, rowCount)}
     */
    int[] resolve(int rowCount) {
        if (selectsAll()) {
            return null;
        }
        for (int position : positions) {
            if (position < 0 || position >= rowCount) {
                throw new IndexOutOfRangeException("Row", position, rowCount);
            }
        }
        return positions;
    }

    @Override
    public String toString() {
        return positions == null ? "all rows" : "rows " + Arrays.toString(positions);
    }
}
