/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula;

/**
 * A selection named the same column more than once; column names within a frame must stay unique.
 */
public class DuplicateColumnException extends TabulaException {

    private final String column;

    public DuplicateColumnException(String column) {
        super("Column '" + column + "' selected more than once");
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
