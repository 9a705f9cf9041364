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

/**
 * Immutable lookup structure over the column names of a frame.
 * <p>
 * Exact lookups go through an open-addressed hash table with linear probing.
 * Prefix lookups binary-search a sorted copy of the names, so a prefix scan only
 * touches the names sharing that prefix.
 * </p>
 */
final class NameIndex {

    static final int ABSENT = -1;
    static final int AMBIGUOUS = -2;

    private final String[] keys;
    private final int[] slots;
    private final int mask;

    private final String[] sortedNames;
    private final int[] sortedToPosition;

    NameIndex(List<String> names) {
        int size = names.size();
        int capacity = tableSizeFor(size + (size >> 1) + 1);
        this.keys = new String[capacity];
        this.slots = new int[capacity];
        this.mask = capacity - 1;
        Arrays.fill(slots, ABSENT);

        for (int i = 0; i < size; i++) {
            put(names.get(i), i);
        }

        Integer[] order = new Integer[size];
        for (int i = 0; i < size; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> names.get(a).compareTo(names.get(b)));
        this.sortedNames = new String[size];
        this.sortedToPosition = new int[size];
        for (int i = 0; i < size; i++) {
            sortedNames[i] = names.get(order[i]);
            sortedToPosition[i] = order[i];
        }
    }

    private void put(String key, int position) {
        int index = key.hashCode() & mask;
        while (keys[index] != null) {
            if (keys[index].equals(key)) {
                throw new IllegalArgumentException("Duplicate column name: " + key);
            }
            index = (index + 1) & mask;
        }
        keys[index] = key;
        slots[index] = position;
    }

    /**
     * Position of the column with exactly this name, or {@link #ABSENT}.
     */
    int exact(String key) {
        int index = key.hashCode() & mask;
        while (keys[index] != null) {
            if (keys[index].equals(key)) {
                return slots[index];
            }
            index = (index + 1) & mask;
        }
        return ABSENT;
    }

    /**
     * Position of the only column whose name starts with the given prefix,
     * {@link #ABSENT} if there is none, or {@link #AMBIGUOUS} if there are several.
     */
    int uniquePrefix(String prefix) {
        int first = lowerBound(prefix);
        if (first >= sortedNames.length || !sortedNames[first].startsWith(prefix)) {
            return ABSENT;
        }
        if (first + 1 < sortedNames.length && sortedNames[first + 1].startsWith(prefix)) {
            return AMBIGUOUS;
        }
        return sortedToPosition[first];
    }

    private int lowerBound(String key) {
        int low = 0;
        int high = sortedNames.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (sortedNames[mid].compareTo(key) < 0) {
                low = mid + 1;
            }
            else {
                high = mid;
            }
        }
        return low;
    }

    /**
     * Round up to the next power of 2.
     */
    private static int tableSizeFor(int cap) {
        int n = cap - 1;
        n |= n >>> 1;
        n |= n >>> 2;
        n |= n >>> 4;
        n |= n >>> 8;
        n |= n >>> 16;
        return (n < 16) ? 16 : (n >= 1 << 30) ? 1 << 30 : n + 1;
    }
}
