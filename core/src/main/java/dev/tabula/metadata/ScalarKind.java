/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.metadata;

/**
 * Scalar kinds a column vector can hold.
 * Kinds are ordered from narrowest to widest; row-major construction
 * widens a column to the widest kind among its values.
 */
public enum ScalarKind {
    BOOLEAN("lgl"),
    INTEGER("int"),
    DOUBLE("dbl"),
    TEXT("chr");

    private final String abbreviation;

    ScalarKind(String abbreviation) {
        this.abbreviation = abbreviation;
    }

    /**
     * Short type annotation used by printers, e.g. {@code <int>}.
     */
    public String getAbbreviation() {
        return abbreviation;
    }

    /**
     * Returns the wider of this kind and the given one.
     */
    public ScalarKind widen(ScalarKind other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
