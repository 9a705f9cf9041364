/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.internal;

import dev.tabula.metadata.Policy;

/**
 * Length rules for fitting an assigned source vector to a frame's row count.
 */
public final class Recycler {

    private Recycler() {
    }

    /**
     * Whether a source of the given length may be fitted to the target length.
     * <ul>
     *   <li>{@link Policy#LEGACY}: exact length, or a non-zero length dividing the target</li>
     *   <li>{@link Policy#STRICT}: exact length, or length one</li>
     * </ul>
     */
    public static boolean accepts(Policy policy, int sourceLength, int targetLength) {
        if (sourceLength == targetLength) {
            return true;
        }
        return switch (policy) {
            case LEGACY -> sourceLength > 0 && targetLength % sourceLength == 0;
            case STRICT -> sourceLength == 1;
        };
    }

    /**
     * Positions repeating {@code [0, sourceLength)} cyclically until {@code targetLength} is reached.
     */
    public static int[] cyclicPositions(int sourceLength, int targetLength) {
        if (sourceLength <= 0) {
            throw new IllegalArgumentException("Cannot recycle an empty source to length " + targetLength);
        }
        int[] positions = new int[targetLength];
        for (int i = 0; i < targetLength; i++) {
            positions[i] = i % sourceLength;
        }
        return positions;
    }
}
