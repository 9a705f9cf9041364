/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.frame;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import dev.tabula.IndexOutOfRangeException;
import dev.tabula.UnequalColumnLengthException;
import dev.tabula.metadata.Policy;
import dev.tabula.metadata.ScalarKind;
import dev.tabula.schema.ColumnKey;
import dev.tabula.schema.FrameSchema;
import dev.tabula.vector.ColumnVector;

/**
 * Immutable, ordered collection of equally long named columns sharing one {@link Policy}.
 * <p>
 * Every operator returns a new frame (or a column) and leaves the receiver untouched.
 * Columns that do not change are shared by reference between the old and the new frame.
 * </p>
 *
 * <pre>{@code
 * Frame frame = Frame.builder(Policy.STRICT)
 *         .add("id", ColumnVector.ofIntegers(1, 2, 3))
 *         .add("name", ColumnVector.ofText("a", "b", "c"))
 *         .build();
 *
 * Outcome<ColumnVector> ids = frame.column("id");
 * Frame names = frame.select("name").get();
 * frame = frame.withColumn("flag", ColumnVector.ofBooleans(true)).get();
 * }</pre>
 *
 * <p>The instance methods delegate to {@link AccessOperators#defaults()}.</p>
 */
public final class Frame {

    private final FrameSchema schema;
    private final List<ColumnVector> columns;
    private final int rowCount;

    private Frame(FrameSchema schema, List<ColumnVector> columns, int rowCount) {
        this.schema = schema;
        this.columns = columns;
        this.rowCount = rowCount;
    }

    public static Builder builder(Policy policy) {
        return new Builder(policy);
    }

    // ==================== Metadata ====================

    public FrameSchema getSchema() {
        return schema;
    }

    public Policy getPolicy() {
        return schema.getPolicy();
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public List<String> getNames() {
        return schema.getNames();
    }

    /**
     * Positional column access, bypassing name resolution.
     *
     * @throws IndexOutOfRangeException if the position is outside of {@code [0, getColumnCount())}
     */
    public ColumnVector getColumn(int position) {
        if (position < 0 || position >= columns.size()) {
            throw new IndexOutOfRangeException("Column", position, columns.size());
        }
        return columns.get(position);
    }

    public FrameDescription describe() {
        return new FrameDescription(schema.getNames(), schema.getKinds(), rowCount, schema.getPolicy());
    }

    // ==================== Operators ====================

    /**
     * Name access ({@code frame$name}).
     *
     * @see AccessOperators#nameAccess(Frame, String)
     */
    public Outcome<ColumnVector> column(String name) {
        return AccessOperators.defaults().nameAccess(this, name);
    }

    /**
     * Single-bracket subsetting ({@code frame[key]}); always yields a frame.
     *
     * @see AccessOperators#select(Frame, ColumnKey)
     */
    public Outcome<Frame> select(ColumnKey key) {
        return AccessOperators.defaults().select(this, key);
    }

    public Outcome<Frame> select(String... names) {
        return select(ColumnKey.names(names));
    }

    /**
     * Two-argument subsetting ({@code frame[rows, key]}).
     *
     * @see AccessOperators#select(Frame, RowSelector, ColumnKey)
     */
    public Outcome<Selection> select(RowSelector rows, ColumnKey key) {
        return AccessOperators.defaults().select(this, rows, key);
    }

    /**
     * Element extraction ({@code frame[[key]]}).
     *
     * @see AccessOperators#extract(Frame, ColumnKey)
     */
    public Outcome<ColumnVector> extract(ColumnKey key) {
        return AccessOperators.defaults().extract(this, key);
    }

    /**
     * Column assignment ({@code frame$name <- source}).
     *
     * @see AccessOperators#assign(Frame, String, ColumnVector)
     */
    public Outcome<Frame> withColumn(String name, ColumnVector source) {
        return AccessOperators.defaults().assign(this, name, source);
    }

    /**
     * Column removal ({@code frame$name <- NULL}).
     *
     * @see AccessOperators#remove(Frame, String)
     */
    public Frame withoutColumn(String name) {
        return AccessOperators.defaults().remove(this, name);
    }

    // ==================== Derivation ====================

    /**
     * Frame holding the given columns of this one, in order, with the same policy and rows.
     */
    Frame project(int[] positions) {
        List<ColumnVector> selected = new ArrayList<>(positions.length);
        for (int position : positions) {
            selected.add(columns.get(position));
        }
        return new Frame(schema.select(positions), List.copyOf(selected), rowCount);
    }

    /**
     * Frame holding the given rows, or this frame if {@code rowPositions} is null.
     */
    Frame takeRows(int[] rowPositions) {
        if (rowPositions == null) {
            return this;
        }
        List<ColumnVector> taken = new ArrayList<>(columns.size());
        for (ColumnVector column : columns) {
            taken.add(column.take(rowPositions));
        }
        return new Frame(schema, List.copyOf(taken), rowPositions.length);
    }

    /**
     * Frame with the named column replaced in place, or appended if absent.
     * The vector must already have the frame's row count (or establish it on a frame without columns).
     */
    Frame putColumn(String name, ColumnVector vector) {
        List<String> names = new ArrayList<>(schema.getNames());
        List<ScalarKind> kinds = new ArrayList<>(schema.getKinds());
        List<ColumnVector> updated = new ArrayList<>(columns);

        int position = schema.indexOf(name);
        if (position >= 0) {
            kinds.set(position, vector.kind());
            updated.set(position, vector);
        }
        else {
            names.add(name);
            kinds.add(vector.kind());
            updated.add(vector);
        }
        return new Frame(FrameSchema.of(names, kinds, schema.getPolicy()), List.copyOf(updated), vector.size());
    }

    Frame dropColumn(int position) {
        List<String> names = new ArrayList<>(schema.getNames());
        List<ScalarKind> kinds = new ArrayList<>(schema.getKinds());
        List<ColumnVector> remaining = new ArrayList<>(columns);
        names.remove(position);
        kinds.remove(position);
        remaining.remove(position);
        return new Frame(FrameSchema.of(names, kinds, schema.getPolicy()), List.copyOf(remaining), rowCount);
    }

    /**
     * Same columns and rows under another policy.
     */
    Frame withPolicy(Policy policy) {
        if (policy == schema.getPolicy()) {
            return this;
        }
        return new Frame(FrameSchema.of(schema.getNames(), schema.getKinds(), policy), columns, rowCount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Frame other
                && rowCount == other.rowCount
                && schema.equals(other.schema)
                && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, columns, rowCount);
    }

    @Override
    public String toString() {
        return "Frame[" + rowCount + " x " + columns.size() + "] " + schema;
    }

    /**
     * Column-major frame builder. Column order follows insertion order.
     */
    public static final class Builder {

        private final Policy policy;
        private final Map<String, ColumnVector> columns = new LinkedHashMap<>();

        private Builder(Policy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
        }

        /**
         * Adds a column.
         *
         * @throws IllegalArgumentException if the name is null, empty or already present
         */
        public Builder add(String name, ColumnVector column) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Column name cannot be null or empty");
            }
            Objects.requireNonNull(column, "column");
            if (columns.putIfAbsent(name, column) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + name);
            }
            return this;
        }

        public Builder addAll(Map<String, ? extends ColumnVector> columns) {
            columns.forEach(this::add);
            return this;
        }

        /**
         * Builds the frame.
         *
         * @throws UnequalColumnLengthException if the columns differ in length
         */
        public Frame build() {
            List<String> names = new ArrayList<>(columns.size());
            List<ScalarKind> kinds = new ArrayList<>(columns.size());
            List<ColumnVector> vectors = new ArrayList<>(columns.size());
            int rowCount = -1;
            for (Map.Entry<String, ColumnVector> entry : columns.entrySet()) {
                ColumnVector vector = entry.getValue();
                if (rowCount < 0) {
                    rowCount = vector.size();
                }
                else if (vector.size() != rowCount) {
                    throw new UnequalColumnLengthException(entry.getKey(), vector.size(), rowCount);
                }
                names.add(entry.getKey());
                kinds.add(vector.kind());
                vectors.add(vector);
            }
            return new Frame(FrameSchema.of(names, kinds, policy), List.copyOf(vectors), Math.max(rowCount, 0));
        }
    }
}
