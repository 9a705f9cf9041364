/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.frame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import dev.tabula.ShapeException;
import dev.tabula.internal.KindInference;
import dev.tabula.metadata.Policy;
import dev.tabula.vector.ColumnVector;

/**
 * Builds a frame from values laid out row by row.
 * <p>
 * Each column gets the narrowest kind holding all of its values: booleans widen to integers,
 * integers to doubles, and any other value turns the column into text. The result is always a
 * {@link Policy#STRICT strict} frame.
 * </p>
 *
 * <pre>{@code
 * Frame frame = RowBuilder.columns("letters", "numbers")
 *         .row("a", 1)
 *         .row("b", 2)
 *         .row("c", 3)
 *         .build();
 * }</pre>
 */
public final class RowBuilder {

    private static final System.Logger LOG = System.getLogger(RowBuilder.class.getName());

    private final List<String> names;
    private final List<Object> values = new ArrayList<>();

    private RowBuilder(List<String> names) {
        this.names = names;
    }

    /**
     * Starts a builder for the given column names.
     *
     * @throws IllegalArgumentException if a name is null, empty or duplicated
     */
    public static RowBuilder columns(String... names) {
        return new RowBuilder(checkNames(Arrays.asList(names)));
    }

    /**
     * Appends one row.
     *
     * @throws ShapeException if the row width differs from the number of columns
     */
    public RowBuilder row(Object... row) {
        if (row.length != names.size()) {
            throw new ShapeException("Row has " + row.length + " values, expected " + names.size());
        }
        values.addAll(Arrays.asList(row));
        return this;
    }

    /**
     * Appends values in row-major order; rows may span several calls.
     */
    public RowBuilder values(Object... flat) {
        values.addAll(Arrays.asList(flat));
        return this;
    }

    /**
     * @throws ShapeException if the values collected so far do not form complete rows
     */
    public Frame build() {
        return build(names, values);
    }

    /**
     * Builds a strict frame from column names and a flat, row-major value list.
     *
     * @param names column names, in column order
     * @param values values of row 0, then row 1, and so on
     * @throws ShapeException if the number of values is not a multiple of the number of names
     * @throws IllegalArgumentException if a name is null, empty or duplicated, or a value is null
     */
    public static Frame build(List<String> names, List<?> values) {
        List<String> columnNames = checkNames(names);
        int width = columnNames.size();
        if (width == 0) {
            if (!values.isEmpty()) {
                throw new ShapeException("Got " + values.size() + " values but no column names");
            }
            return Frame.builder(Policy.STRICT).build();
        }
        if (values.size() % width != 0) {
            throw new ShapeException("Got " + values.size() + " values, which is not a multiple of "
                    + width + " columns");
        }

        int rowCount = values.size() / width;
        Frame.Builder builder = Frame.builder(Policy.STRICT);
        for (int p = 0; p < width; p++) {
            List<Object> gathered = new ArrayList<>(rowCount);
            for (int row = 0; row < rowCount; row++) {
                gathered.add(values.get(row * width + p));
            }
            ColumnVector column = KindInference.toVector(gathered);
            builder.add(columnNames.get(p), column);
        }

        LOG.log(System.Logger.Level.DEBUG, "Built frame of {0} rows from {1} row-major values across {2} columns",
                rowCount, values.size(), width);
        return builder.build();
    }

    private static List<String> checkNames(List<String> names) {
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Column name cannot be null or empty");
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Duplicate column name: " + name);
            }
        }
        return List.copyOf(names);
    }
}
