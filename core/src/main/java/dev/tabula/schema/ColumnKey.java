/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.schema;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Key selecting columns of a frame, either by name or by 0-based position.
 * <p>
 * {@link Name} and {@link Position} are scalar keys. {@link Names} and {@link Positions}
 * are compound keys, even when they hold a single element.
 * </p>
 *
 * <pre>{@code
 * frame.select(ColumnKey.names("id", "name"));
 * frame.extract(ColumnKey.position(0));
 * }</pre>
 */
public sealed interface ColumnKey permits ColumnKey.Name, ColumnKey.Position, ColumnKey.Names, ColumnKey.Positions {

    boolean isScalar();

    /** Number of elements in this key. */
    int size();

    static Name name(String name) {
        return new Name(name);
    }

    static Position position(int position) {
        return new Position(position);
    }

    static Names names(String... names) {
        return new Names(List.of(names));
    }

    static Positions positions(int... positions) {
        return new Positions(positions);
    }

    record Name(String name) implements ColumnKey {

        public Name {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public boolean isScalar() {
            return true;
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public String toString() {
            return "\"" + name + "\"";
        }
    }

    record Position(int position) implements ColumnKey {

        @Override
        public boolean isScalar() {
            return true;
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public String toString() {
            return Integer.toString(position);
        }
    }

    record Names(List<String> names) implements ColumnKey {

        public Names {
            names = List.copyOf(names);
        }

        @Override
        public boolean isScalar() {
            return false;
        }

        @Override
        public int size() {
            return names.size();
        }

        @Override
        public String toString() {
            return names.toString();
        }
    }

    record Positions(int[] positions) implements ColumnKey {

        public Positions {
            positions = Objects.requireNonNull(positions, "positions").clone();
        }

        @Override
        public int[] positions() {
            return positions.clone();
        }

        public int get(int index) {
            return positions[index];
        }

        @Override
        public boolean isScalar() {
            return false;
        }

        @Override
        public int size() {
            return positions.length;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Positions other && Arrays.equals(positions, other.positions);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(positions);
        }

        @Override
        public String toString() {
            return Arrays.toString(positions);
        }
    }
}
