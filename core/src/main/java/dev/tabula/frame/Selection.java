/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.frame;

import dev.tabula.vector.ColumnVector;

/**
 * Result of two-argument subsetting: either a single column with its dimension
 * dropped, or a frame.
 */
public sealed interface Selection permits Selection.Column, Selection.Table {

    boolean isColumn();

    /**
     * @throws IllegalStateException if this selection is a frame
     */
    ColumnVector asColumn();

    /**
     * @throws IllegalStateException if this selection is a single column
     */
    Frame asFrame();

    record Column(ColumnVector vector) implements Selection {

        @Override
        public boolean isColumn() {
            return true;
        }

        @Override
        public ColumnVector asColumn() {
            return vector;
        }

        @Override
        public Frame asFrame() {
            throw new IllegalStateException("Selection is a single column, not a frame");
        }
    }

    record Table(Frame frame) implements Selection {

        @Override
        public boolean isColumn() {
            return false;
        }

        @Override
        public ColumnVector asColumn() {
            throw new IllegalStateException("Selection is a frame, not a single column");
        }

        @Override
        public Frame asFrame() {
            return frame;
        }
    }
}
