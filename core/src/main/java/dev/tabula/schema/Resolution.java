/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.schema;

import java.util.List;

import dev.tabula.metadata.Diagnostic;

/**
 * Result of resolving a {@link ColumnKey} against a frame schema.
 */
public sealed interface Resolution permits Resolution.Found, Resolution.NotFound {

    List<Diagnostic> diagnostics();

    /**
     * The key resolved to the given column indices, in key order.
     */
    record Found(int[] indices, List<Diagnostic> diagnostics) implements Resolution {

        public Found {
            indices = indices.clone();
            diagnostics = List.copyOf(diagnostics);
        }

        @Override
        public int[] indices() {
            return indices.clone();
        }

        public int count() {
            return indices.length;
        }

        public int index(int i) {
            return indices[i];
        }
    }

    /**
     * No column matched. Legacy misses carry no diagnostics.
     */
    record NotFound(List<Diagnostic> diagnostics) implements Resolution {

        public NotFound {
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
