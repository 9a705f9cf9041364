/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.metadata;

/**
 * Access policy of a frame, fixed when the frame is created.
 * <p>
 * {@link #LEGACY} resolves unique name prefixes, drops a single selected column to a
 * vector on two-argument subsetting, recycles shorter sources on assignment and chains
 * compound keys on element extraction. {@link #STRICT} does none of these.
 * </p>
 */
public enum Policy {
    LEGACY,
    STRICT
}
