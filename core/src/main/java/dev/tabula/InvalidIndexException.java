/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula;

/**
 * A key of the wrong shape was passed to an operator, e.g. a compound key
 * for element extraction on a strict frame.
 */
public class InvalidIndexException extends TabulaException {

    public InvalidIndexException(String message) {
        super(message);
    }
}
