/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula;

/**
 * A row-major value list cannot be split into rows of the requested width.
 */
public class ShapeException extends TabulaException {

    public ShapeException(String message) {
        super(message);
    }
}
