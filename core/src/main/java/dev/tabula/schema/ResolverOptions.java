/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.schema;

/**
 * Options of an {@link IndexResolver}.
 *
 * @param warnPartialMatch whether legacy prefix matches are reported as a diagnostic
 */
public record ResolverOptions(boolean warnPartialMatch) {

    public static final String WARN_PARTIAL_MATCH_PROPERTY = "tabula.warnPartialMatch";

    private static final ResolverOptions DEFAULTS = new ResolverOptions(false);

    public static ResolverOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reads options from system properties, falling back to the defaults.
     */
    public static ResolverOptions fromSystemProperties() {
        return new ResolverOptions(Boolean.getBoolean(WARN_PARTIAL_MATCH_PROPERTY));
    }
}
