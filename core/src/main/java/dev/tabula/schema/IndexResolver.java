/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.schema;

import java.util.ArrayList;
import java.util.List;

import dev.tabula.IndexOutOfRangeException;
import dev.tabula.metadata.Diagnostic;

/**
 * Maps a {@link ColumnKey} to column positions of a frame schema.
 * <p>
 * Names are looked up exactly first. Without an exact match, a {@link dev.tabula.metadata.Policy#LEGACY legacy}
 * schema accepts a name prefix matching exactly one column, in {@link Arity#SINGLE} context only;
 * ambiguous and unknown prefixes resolve to {@link Resolution.NotFound} without any diagnostic.
 * A {@link dev.tabula.metadata.Policy#STRICT strict} schema never matches prefixes and reports
 * every miss with a {@link Diagnostic.Kind#MISSING_COLUMN} diagnostic.
 * </p>
 * <p>
 * Positions are 0-based and resolve the same way under both policies.
 * </p>
 */
public final class IndexResolver {

    private static final System.Logger LOG = System.getLogger(IndexResolver.class.getName());

    private final ResolverOptions options;

    private IndexResolver(ResolverOptions options) {
        this.options = options;
    }

    public static IndexResolver create() {
        return new IndexResolver(ResolverOptions.defaults());
    }

    public static IndexResolver create(ResolverOptions options) {
        return new IndexResolver(options);
    }

    /**
     * Resolves a key against the given schema.
     *
     * @throws IndexOutOfRangeException if a positional key lies outside of the schema
     */
    public Resolution resolve(FrameSchema schema, ColumnKey key, Arity arity) {
        if (key instanceof ColumnKey.Name name) {
            return resolveNames(schema, List.of(name.name()), arity);
        }
        if (key instanceof ColumnKey.Names names) {
            return resolveNames(schema, names.names(), arity);
        }
        if (key instanceof ColumnKey.Position position) {
            return resolvePositions(schema, new int[]{ position.position() });
        }
        return resolvePositions(schema, ((ColumnKey.Positions) key).positions());
    }

    private Resolution resolveNames(FrameSchema schema, List<String> names, Arity arity) {
        int[] indices = new int[names.size()];
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (int i = 0; i < indices.length; i++) {
            int index = resolveName(schema, names.get(i), arity, diagnostics);
            if (index < 0) {
                return new Resolution.NotFound(diagnostics);
            }
            indices[i] = index;
        }
        return new Resolution.Found(indices, diagnostics);
    }

    /**
     * Returns the matching position, or -1 after adding the miss diagnostics (if any).
     */
    private int resolveName(FrameSchema schema, String name, Arity arity, List<Diagnostic> diagnostics) {
        NameIndex index = schema.nameIndex();
        int exact = index.exact(name);
        if (exact >= 0) {
            return exact;
        }

        switch (schema.getPolicy()) {
            case LEGACY -> {
                if (arity == Arity.DOUBLE) {
                    return -1;
                }
                int match = index.uniquePrefix(name);
                if (match >= 0) {
                    LOG.log(System.Logger.Level.DEBUG, "Resolved ''{0}'' to column ''{1}'' by prefix", name, schema.getName(match));
                    if (options.warnPartialMatch()) {
                        diagnostics.add(Diagnostic.partialMatch(name, schema.getName(match)));
                    }
                    return match;
                }
                LOG.log(System.Logger.Level.DEBUG, "No unique column for ''{0}'' ({1})",
                        name, match == NameIndex.AMBIGUOUS ? "ambiguous prefix" : "no match");
                return -1;
            }
            case STRICT -> {
                LOG.log(System.Logger.Level.DEBUG, "Unknown column ''{0}''", name);
                diagnostics.add(Diagnostic.missingColumn(name));
                return -1;
            }
            default -> throw new IllegalStateException("Unexpected policy: " + schema.getPolicy());
        }
    }

    private static Resolution resolvePositions(FrameSchema schema, int[] positions) {
        int columnCount = schema.getColumnCount();
        for (int position : positions) {
            if (position < 0 || position >= columnCount) {
                throw new IndexOutOfRangeException("Column", position, columnCount);
            }
        }
        return new Resolution.Found(positions, List.of());
    }
}
