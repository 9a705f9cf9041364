/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.vector;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import dev.tabula.IndexOutOfRangeException;
import dev.tabula.internal.KindInference;
import dev.tabula.internal.Recycler;
import dev.tabula.metadata.Policy;
import dev.tabula.metadata.ScalarKind;

/**
 * Immutable, homogeneous column of scalar values.
 * <p>
 * Values are kept in typed primitive arrays; one record per {@link ScalarKind}.
 * Arrays are copied on construction and never handed out, so vectors can be shared
 * freely between frames and threads.
 * </p>
 */
public sealed interface ColumnVector
        permits ColumnVector.BooleanVector, ColumnVector.IntegerVector, ColumnVector.DoubleVector, ColumnVector.TextVector {

    ScalarKind kind();

    int size();

    /** Get the value at index, boxing primitives. */
    Object getValue(int index);

    /**
     * Returns a new vector holding the values at the given positions, in order.
     * Positions may repeat.
     *
     * @throws IndexOutOfRangeException if a position is outside of {@code [0, size())}
     */
    ColumnVector take(int[] positions);

    /**
     * Positional element read, returning a vector of length one.
     *
     * @throws IndexOutOfRangeException if the position is outside of {@code [0, size())}
     */
    default ColumnVector element(int position) {
        return take(new int[]{ position });
    }

    /**
     * Fits this vector to the given length for assignment into a frame.
     * <p>
     * Under {@link Policy#LEGACY} any length dividing the target is repeated cyclically.
     * Under {@link Policy#STRICT} only length one (broadcast) and the exact length are accepted.
     * </p>
     *
     * @return the fitted vector, or empty if the policy rejects this length
     */
    default Optional<ColumnVector> recycleTo(int targetLength, Policy policy) {
        if (!Recycler.accepts(policy, size(), targetLength)) {
            return Optional.empty();
        }
        if (size() == targetLength) {
            return Optional.of(this);
        }
        return Optional.of(take(Recycler.cyclicPositions(size(), targetLength)));
    }

    // ==================== Factories ====================

    static BooleanVector ofBooleans(boolean... values) {
        return new BooleanVector(values);
    }

    static IntegerVector ofIntegers(long... values) {
        return new IntegerVector(values);
    }

    static DoubleVector ofDoubles(double... values) {
        return new DoubleVector(values);
    }

    static TextVector ofText(String... values) {
        return new TextVector(values);
    }

    /**
     * Builds a vector of the given kind from boxed values, coercing each value to that kind.
     * Booleans widen to {@code 1}/{@code 0}; any value renders as text.
     *
     * @throws IllegalArgumentException if a value is null or cannot be represented in {@code kind}
     */
    static ColumnVector of(ScalarKind kind, List<?> values) {
        return KindInference.toVector(Objects.requireNonNull(kind, "kind"), values);
    }

    private static void checkPosition(int position, int size) {
        if (position < 0 || position >= size) {
            throw new IndexOutOfRangeException("Element", position, size);
        }
    }

    // ==================== Implementations ====================

    record BooleanVector(boolean[] values) implements ColumnVector {

        public BooleanVector {
            values = Objects.requireNonNull(values, "values").clone();
        }

        @Override
        public boolean[] values() {
            return values.clone();
        }

        public boolean get(int index) {
            return values[index];
        }

        @Override
        public ScalarKind kind() {
            return ScalarKind.BOOLEAN;
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public Object getValue(int index) {
            return get(index);
        }

        @Override
        public BooleanVector take(int[] positions) {
            boolean[] taken = new boolean[positions.length];
            for (int i = 0; i < positions.length; i++) {
                checkPosition(positions[i], values.length);
                taken[i] = values[positions[i]];
            }
            return new BooleanVector(taken);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BooleanVector other && Arrays.equals(values, other.values);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "<lgl> " + Arrays.toString(values);
        }
    }

    record IntegerVector(long[] values) implements ColumnVector {

        public IntegerVector {
            values = Objects.requireNonNull(values, "values").clone();
        }

        @Override
        public long[] values() {
            return values.clone();
        }

        public long get(int index) {
            return values[index];
        }

        @Override
        public ScalarKind kind() {
            return ScalarKind.INTEGER;
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public Object getValue(int index) {
            return get(index);
        }

        @Override
        public IntegerVector take(int[] positions) {
            long[] taken = new long[positions.length];
            for (int i = 0; i < positions.length; i++) {
                checkPosition(positions[i], values.length);
                taken[i] = values[positions[i]];
            }
            return new IntegerVector(taken);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof IntegerVector other && Arrays.equals(values, other.values);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "<int> " + Arrays.toString(values);
        }
    }

    record DoubleVector(double[] values) implements ColumnVector {

        public DoubleVector {
            values = Objects.requireNonNull(values, "values").clone();
        }

        @Override
        public double[] values() {
            return values.clone();
        }

        public double get(int index) {
            return values[index];
        }

        @Override
        public ScalarKind kind() {
            return ScalarKind.DOUBLE;
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public Object getValue(int index) {
            return get(index);
        }

        @Override
        public DoubleVector take(int[] positions) {
            double[] taken = new double[positions.length];
            for (int i = 0; i < positions.length; i++) {
                checkPosition(positions[i], values.length);
                taken[i] = values[positions[i]];
            }
            return new DoubleVector(taken);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof DoubleVector other && Arrays.equals(values, other.values);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "<dbl> " + Arrays.toString(values);
        }
    }

    record TextVector(String[] values) implements ColumnVector {

        public TextVector {
            values = Objects.requireNonNull(values, "values").clone();
            for (String value : values) {
                Objects.requireNonNull(value, "Text vectors cannot hold null values");
            }
        }

        @Override
        public String[] values() {
            return values.clone();
        }

        public String get(int index) {
            return values[index];
        }

        @Override
        public ScalarKind kind() {
            return ScalarKind.TEXT;
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public Object getValue(int index) {
            return get(index);
        }

        @Override
        public TextVector take(int[] positions) {
            String[] taken = new String[positions.length];
            for (int i = 0; i < positions.length; i++) {
                checkPosition(positions[i], values.length);
                taken[i] = values[positions[i]];
            }
            return new TextVector(taken);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TextVector other && Arrays.equals(values, other.values);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "<chr> " + Arrays.toString(values);
        }
    }
}
