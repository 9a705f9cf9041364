/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.metadata;

import java.util.Objects;

/**
 * Soft signal attached to an operator result. Diagnostics never abort an operation.
 *
 * @param kind what happened
 * @param message human-readable description
 */
public record Diagnostic(Kind kind, String message) {

    public enum Kind {
        /** A strict lookup did not find an exactly matching column. */
        MISSING_COLUMN,
        /** A legacy assignment was rejected because the source length does not divide the row count. */
        RECYCLE_LENGTH,
        /** A legacy lookup was satisfied by a unique name prefix (only reported when enabled). */
        PARTIAL_MATCH
    }

    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static Diagnostic missingColumn(String name) {
        return new Diagnostic(Kind.MISSING_COLUMN, "Unknown or uninitialised column: '" + name + "'");
    }

    public static Diagnostic recycleLength(String name, int sourceLength, int targetLength) {
        return new Diagnostic(Kind.RECYCLE_LENGTH, "Replacement for column '" + name + "' has " + sourceLength
                + " rows, which does not divide the " + targetLength + " rows of the frame; assignment not applied");
    }

    public static Diagnostic partialMatch(String key, String name) {
        return new Diagnostic(Kind.PARTIAL_MATCH, "Partial match of '" + key + "' to '" + name + "'");
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
