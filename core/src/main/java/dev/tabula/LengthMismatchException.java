/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula;

/**
 * A column assignment on a strict frame was given a source that is neither
 * of length one nor of the frame's row count.
 */
public class LengthMismatchException extends TabulaException {

    private final int sourceLength;
    private final int targetLength;

    public LengthMismatchException(String column, int sourceLength, int targetLength) {
        super("Assigned column '" + column + "' must have size " + targetLength + " or 1, not " + sourceLength);
        this.sourceLength = sourceLength;
        this.targetLength = targetLength;
    }

    public int getSourceLength() {
        return sourceLength;
    }

    public int getTargetLength() {
        return targetLength;
    }
}
