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
import java.util.Objects;

import dev.tabula.metadata.Policy;
import dev.tabula.metadata.ScalarKind;

/**
 * Column names, kinds and access policy of a frame.
 * Name order is significant: it defines column positions.
 */
public final class FrameSchema {

    private final List<String> names;
    private final List<ScalarKind> kinds;
    private final Policy policy;
    private final NameIndex nameIndex;

    private FrameSchema(List<String> names, List<ScalarKind> kinds, Policy policy) {
        this.names = names;
        this.kinds = kinds;
        this.policy = policy;
        this.nameIndex = new NameIndex(names);
    }

    /**
     * Creates a schema from parallel name and kind lists.
     *
     * @throws IllegalArgumentException if a name is null, empty or duplicated,
     *         or the lists differ in size
     */
    public static FrameSchema of(List<String> names, List<ScalarKind> kinds, Policy policy) {
        Objects.requireNonNull(policy, "policy");
        if (names.size() != kinds.size()) {
            throw new IllegalArgumentException("Got " + names.size() + " names but " + kinds.size() + " kinds");
        }
        for (String name : names) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Column name cannot be null or empty");
            }
        }
        return new FrameSchema(List.copyOf(names), List.copyOf(kinds), policy);
    }

    public List<String> getNames() {
        return names;
    }

    public String getName(int position) {
        return names.get(position);
    }

    public List<ScalarKind> getKinds() {
        return kinds;
    }

    public ScalarKind getKind(int position) {
        return kinds.get(position);
    }

    public Policy getPolicy() {
        return policy;
    }

    public int getColumnCount() {
        return names.size();
    }

    /**
     * Position of the column named exactly {@code name}, or -1. Never matches prefixes.
     */
    public int indexOf(String name) {
        return nameIndex.exact(name);
    }

    public boolean contains(String name) {
        return indexOf(name) >= 0;
    }

    NameIndex nameIndex() {
        return nameIndex;
    }

    /**
     * Schema holding the given positions of this one, in order, with the same policy.
     */
    public FrameSchema select(int[] positions) {
        List<String> selectedNames = new ArrayList<>(positions.length);
        List<ScalarKind> selectedKinds = new ArrayList<>(positions.length);
        for (int position : positions) {
            selectedNames.add(names.get(position));
            selectedKinds.add(kinds.get(position));
        }
        return new FrameSchema(List.copyOf(selectedNames), List.copyOf(selectedKinds), policy);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FrameSchema other
                && policy == other.policy
                && names.equals(other.names)
                && kinds.equals(other.kinds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(names, kinds, policy);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(policy.name().toLowerCase()).append(" frame {");
        for (int i = 0; i < names.size(); i++) {
            sb.append(i == 0 ? " " : ", ");
            sb.append(names.get(i)).append(" <").append(kinds.get(i).getAbbreviation()).append(">");
        }
        sb.append(" }");
        return sb.toString();
    }
}
