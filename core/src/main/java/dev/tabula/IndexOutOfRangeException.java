/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula;

/**
 * A positional key (column or element position) lies outside of the valid range.
 */
public class IndexOutOfRangeException extends TabulaException {

    private final int position;
    private final int size;

    public IndexOutOfRangeException(String what, int position, int size) {
        super(what + " position " + position + " out of range [0, " + size + ")");
        this.position = position;
        this.size = size;
    }

    public IndexOutOfRangeException(String message) {
        super(message);
        this.position = -1;
        this.size = -1;
    }

    /**
     * The offending position, or -1 if the error was not caused by a single position.
     */
    public int getPosition() {
        return position;
    }

    public int getSize() {
        return size;
    }
}
