/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.frame;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import dev.tabula.IndexOutOfRangeException;
import dev.tabula.DuplicateColumnException;
import dev.tabula.InvalidIndexException;
import dev.tabula.LengthMismatchException;
import dev.tabula.metadata.Diagnostic;
import dev.tabula.metadata.Policy;
import dev.tabula.schema.Arity;
import dev.tabula.schema.ColumnKey;
import dev.tabula.schema.IndexResolver;
import dev.tabula.schema.Resolution;
import dev.tabula.schema.ResolverOptions;
import dev.tabula.vector.ColumnVector;

/**
 * The column access operators of a {@link Frame}.
 * <p>
 * Every operator reads its frame and never modifies it. Policy-dependent behavior is an
 * explicit branch on {@link Frame#getPolicy()}:
 * </p>
 * <table>
 *   <caption>Operator behavior by policy</caption>
 *   <tr><th>Operator</th><th>LEGACY</th><th>STRICT</th></tr>
 *   <tr><td>{@link #nameAccess}</td><td>unique prefixes match silently</td><td>exact names; misses are reported</td></tr>
 *   <tr><td>{@link #select(Frame, ColumnKey)}</td><td>frame</td><td>frame</td></tr>
 *   <tr><td>{@link #select(Frame, RowSelector, ColumnKey)}</td><td>one column drops to a vector</td><td>frame</td></tr>
 *   <tr><td>{@link #extract}</td><td>compound keys chain into elements</td><td>compound keys are rejected</td></tr>
 *   <tr><td>{@link #assign}</td><td>divisor lengths are recycled</td><td>length one or exact only</td></tr>
 * </table>
 */
public final class AccessOperators {

    private static final System.Logger LOG = System.getLogger(AccessOperators.class.getName());

    private final IndexResolver resolver;

    private AccessOperators(IndexResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Operators configured from system properties, see {@link ResolverOptions#fromSystemProperties()}.
     */
    public static AccessOperators defaults() {
        return DefaultHolder.INSTANCE;
    }

    public static AccessOperators create(ResolverOptions options) {
        return new AccessOperators(IndexResolver.create(options));
    }

    // ==================== Name access ====================

    /**
     * Looks up a single column by name.
     *
     * @return the column, or an empty outcome if no column matches; strict misses
     *         carry a {@link Diagnostic.Kind#MISSING_COLUMN} diagnostic
     */
    public Outcome<ColumnVector> nameAccess(Frame frame, String name) {
        Resolution resolution = resolver.resolve(frame.getSchema(), ColumnKey.name(name), Arity.SINGLE);
        if (resolution instanceof Resolution.Found found) {
            return Outcome.of(frame.getColumn(found.index(0)), found.diagnostics());
        }
        return Outcome.empty(resolution.diagnostics());
    }

    // ==================== Single bracket ====================

    /**
     * Selects columns into a new frame with the same policy, in key order.
     * The result is a frame under both policies, whatever the number of selected columns.
     *
     * @throws IndexOutOfRangeException if a position lies outside of the frame
     * @throws DuplicateColumnException if a column is selected more than once
     */
    public Outcome<Frame> select(Frame frame, ColumnKey key) {
        Resolution resolution = resolver.resolve(frame.getSchema(), key, Arity.SINGLE);
        if (resolution instanceof Resolution.Found found) {
            int[] indices = found.indices();
            checkDistinct(frame, indices);
            return Outcome.of(frame.project(indices), found.diagnostics());
        }
        return Outcome.empty(resolution.diagnostics());
    }

    // ==================== Row/column bracket ====================

    /**
     * Selects rows and columns. Rows are applied identically under both policies.
     * <p>
     * A legacy frame returns a single resolved column as a plain vector; a strict frame
     * always returns a frame. Several columns yield a frame under both policies.
     * </p>
     *
     * @throws IndexOutOfRangeException if a row or column position lies outside of the frame
     * @throws DuplicateColumnException if a column is selected more than once
     */
    public Outcome<Selection> select(Frame frame, RowSelector rows, ColumnKey key) {
        int[] rowPositions = rows.resolve(frame.getRowCount());
        Resolution resolution = resolver.resolve(frame.getSchema(), key, Arity.SINGLE);
        if (!(resolution instanceof Resolution.Found found)) {
            return Outcome.empty(resolution.diagnostics());
        }

        int[] indices = found.indices();
        checkDistinct(frame, indices);

        boolean dropDimension = switch (frame.getPolicy()) {
            case LEGACY -> indices.length == 1;
            case STRICT -> false;
        };

        if (dropDimension) {
            ColumnVector column = frame.getColumn(indices[0]);
            if (rowPositions != null) {
                column = column.take(rowPositions);
            }
            return Outcome.of(new Selection.Column(column), found.diagnostics());
        }
        return Outcome.of(new Selection.Table(frame.project(indices).takeRows(rowPositions)), found.diagnostics());
    }

    // ==================== Double bracket ====================

    /**
     * Extracts a single column.
     * <p>
     * Scalar keys return the whole column under both policies; names must match exactly.
     * A compound key is rejected on a strict frame. On a legacy frame its first element selects
     * a column and every further position selects an element of the previous result, e.g.
     * {@code [1, 3]} yields element 3 of column 1 as a vector of length one.
     * </p>
     *
     * @throws InvalidIndexException if the key is compound on a strict frame, or empty
     * @throws IndexOutOfRangeException if a column or element position is out of range
     */
    public Outcome<ColumnVector> extract(Frame frame, ColumnKey key) {
        if (key.isScalar()) {
            return extractColumn(frame, key);
        }
        if (key.size() == 0) {
            throw new InvalidIndexException("Cannot extract a column with an empty key");
        }

        return switch (frame.getPolicy()) {
            case LEGACY -> extractChained(frame, key);
            case STRICT -> throw new InvalidIndexException("Can't extract a column with compound key " + key
                    + "; use a single name or position");
        };
    }

    private Outcome<ColumnVector> extractColumn(Frame frame, ColumnKey key) {
        Resolution resolution = resolver.resolve(frame.getSchema(), key, Arity.DOUBLE);
        if (resolution instanceof Resolution.Found found) {
            return Outcome.of(frame.getColumn(found.index(0)), found.diagnostics());
        }
        return Outcome.empty(resolution.diagnostics());
    }

    private Outcome<ColumnVector> extractChained(Frame frame, ColumnKey key) {
        if (key instanceof ColumnKey.Names names) {
            Outcome<ColumnVector> column = extractColumn(frame, ColumnKey.name(names.names().get(0)));
            if (column.isPresent() && names.size() > 1) {
                throw new IndexOutOfRangeException("Cannot index an unnamed column vector by name '"
                        + names.names().get(1) + "'");
            }
            return column;
        }

        ColumnKey.Positions positions = (ColumnKey.Positions) key;
        Outcome<ColumnVector> column = extractColumn(frame, ColumnKey.position(positions.get(0)));
        ColumnVector current = column.get();
        for (int i = 1; i < positions.size(); i++) {
            current = current.element(positions.get(i));
        }
        if (positions.size() > 1) {
            LOG.log(System.Logger.Level.DEBUG, "Chained extraction {0} resolved to element {1}", positions, current);
        }
        return Outcome.of(current, column.diagnostics());
    }

    // ==================== Assignment ====================

    /**
     * Assigns a column, replacing an existing column of that exact name in place or appending
     * a new one. Names are never prefix-matched here.
     * <p>
     * The target length is the frame's row count, or the source length if the frame has no
     * columns yet. A legacy frame recycles a source whose length divides the target; other
     * lengths are rejected with a {@link Diagnostic.Kind#RECYCLE_LENGTH} diagnostic and the
     * returned outcome holds the unchanged frame. A strict frame accepts length one or the
     * exact target length only.
     * </p>
     *
     * @return the new frame version; the receiver stays unchanged in every case
     * @throws LengthMismatchException if a strict frame rejects the source length
     * @throws IllegalArgumentException if the name is null or empty
     */
    public Outcome<Frame> assign(Frame frame, String name, ColumnVector source) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Column name cannot be null or empty");
        }
        Objects.requireNonNull(source, "source");

        int targetLength = frame.getColumnCount() == 0 ? source.size() : frame.getRowCount();
        Optional<ColumnVector> fitted = source.recycleTo(targetLength, frame.getPolicy());
        if (fitted.isPresent()) {
            return Outcome.of(frame.putColumn(name, fitted.get()));
        }

        return switch (frame.getPolicy()) {
            case LEGACY -> {
                LOG.log(System.Logger.Level.DEBUG, "Rejected assignment of {0} values to column ''{1}'' of {2} rows",
                        source.size(), name, targetLength);
                yield Outcome.of(frame, List.of(Diagnostic.recycleLength(name, source.size(), targetLength)));
            }
            case STRICT -> throw new LengthMismatchException(name, source.size(), targetLength);
        };
    }

    /**
     * Removes the column with exactly this name; returns the same frame if there is none.
     */
    public Frame remove(Frame frame, String name) {
        Objects.requireNonNull(name, "name");
        int position = frame.getSchema().indexOf(name);
        if (position < 0) {
            return frame;
        }
        return frame.dropColumn(position);
    }

    private static void checkDistinct(Frame frame, int[] indices) {
        boolean[] seen = new boolean[frame.getColumnCount()];
        for (int index : indices) {
            if (seen[index]) {
                throw new DuplicateColumnException(frame.getSchema().getName(index));
            }
            seen[index] = true;
        }
    }

    private static final class DefaultHolder {
        static final AccessOperators INSTANCE = new AccessOperators(IndexResolver.create(ResolverOptions.fromSystemProperties()));
    }
}
