/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.frame;

import java.util.List;

import dev.tabula.metadata.Policy;
import dev.tabula.metadata.ScalarKind;

/**
 * Metadata view of a frame, as consumed by printers and other collaborators.
 *
 * @param names column names, in column order
 * @param kinds column kinds, parallel to {@code names}
 * @param rowCount number of rows
 * @param policy access policy of the frame
 */
public record FrameDescription(List<String> names, List<ScalarKind> kinds, int rowCount, Policy policy) {

    public FrameDescription {
        names = List.copyOf(names);
        kinds = List.copyOf(kinds);
    }
}
