/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.frame;

import java.util.List;
import java.util.Map;

import dev.tabula.UnequalColumnLengthException;
import dev.tabula.metadata.Policy;
import dev.tabula.vector.ColumnVector;

/**
 * Entry points for creating, describing and converting frames.
 *
 * <pre>{@code
 * Map<String, ColumnVector> columns = new LinkedHashMap<>();
 * columns.put("x", ColumnVector.ofIntegers(1, 2, 3));
 * Frame legacy = Frames.of(columns, Policy.LEGACY);
 *
 * Frame strict = Frames.fromRows(List.of("letters", "numbers"), List.of("a", 1, "b", 2));
 * }</pre>
 */
public final class Frames {

    private Frames() {
    }

    /**
     * Creates a frame from columns, in the iteration order of the map.
     *
     * @throws UnequalColumnLengthException if the columns differ in length
     */
    public static Frame of(Map<String, ? extends ColumnVector> columns, Policy policy) {
        return Frame.builder(policy).addAll(columns).build();
    }

    /**
     * Creates a strict frame from row-major values.
     *
     * @see RowBuilder#build(List, List)
     */
    public static Frame fromRows(List<String> names, List<?> values) {
        return RowBuilder.build(names, values);
    }

    public static FrameDescription describe(Frame frame) {
        return frame.describe();
    }

    /**
     * Rebuilds the frame under the strict policy. Column vectors are shared.
     */
    public static Frame asStrict(Frame frame) {
        return frame.withPolicy(Policy.STRICT);
    }

    /**
     * Rebuilds the frame under the legacy policy. Column vectors are shared.
     */
    public static Frame asLegacy(Frame frame) {
        return frame.withPolicy(Policy.LEGACY);
    }
}
