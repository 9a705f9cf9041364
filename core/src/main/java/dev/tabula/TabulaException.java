/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula;

/**
 * Base class of the hard errors raised by frame construction and column access.
 * A hard error aborts the operation; every frame involved keeps its prior state.
 */
public class TabulaException extends RuntimeException {

    public TabulaException(String message) {
        super(message);
    }
}
