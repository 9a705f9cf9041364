/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.schema;

/**
 * Operator context a key is resolved in.
 */
public enum Arity {
    /** Name access and both bracket forms; legacy frames may match name prefixes. */
    SINGLE,
    /** Element extraction; names always match exactly. */
    DOUBLE
}
