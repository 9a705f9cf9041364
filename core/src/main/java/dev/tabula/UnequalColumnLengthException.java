/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula;

/**
 * Columns of differing length were passed to a column-major frame constructor.
 */
public class UnequalColumnLengthException extends TabulaException {

    public UnequalColumnLengthException(String column, int length, int expectedLength) {
        super("Column '" + column + "' has " + length + " rows, expected " + expectedLength);
    }
}
