/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.internal;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import dev.tabula.metadata.ScalarKind;
import dev.tabula.vector.ColumnVector;

/**
 * Infers the common kind of loosely typed values and converts them into a column vector.
 * <p>
 * Booleans widen to integers, integers to doubles, and any value that is neither
 * a boolean nor a number turns the whole column into text.
 * </p>
 */
public final class KindInference {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private KindInference() {
    }

    /**
     * Kind of a single value.
     *
     * @throws IllegalArgumentException if the value is null
     */
    public static ScalarKind kindOf(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Null values are not supported");
        }
        if (value instanceof Boolean) {
            return ScalarKind.BOOLEAN;
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return ScalarKind.INTEGER;
        }
        if (value instanceof BigInteger big) {
            return fitsLong(big) ? ScalarKind.INTEGER : ScalarKind.DOUBLE;
        }
        if (value instanceof Float || value instanceof Double || value instanceof BigDecimal) {
            return ScalarKind.DOUBLE;
        }
        return ScalarKind.TEXT;
    }

    /**
     * Widest kind among the given values; {@link ScalarKind#BOOLEAN} for an empty list.
     */
    public static ScalarKind commonKind(List<?> values) {
        ScalarKind kind = ScalarKind.BOOLEAN;
        for (Object value : values) {
            kind = kind.widen(kindOf(value));
            if (kind == ScalarKind.TEXT) {
                break;
            }
        }
        return kind;
    }

    /**
     * Builds a vector of the common kind of the given values.
     */
    public static ColumnVector toVector(List<?> values) {
        return toVector(commonKind(values), values);
    }

    /**
     * Builds a vector of the given kind, coercing every value to it.
     *
     * @throws IllegalArgumentException if a value is wider than the requested kind
     */
    public static ColumnVector toVector(ScalarKind kind, List<?> values) {
        int size = values.size();
        return switch (kind) {
            case BOOLEAN -> {
                boolean[] out = new boolean[size];
                for (int i = 0; i < size; i++) {
                    out[i] = asBoolean(values.get(i));
                }
                yield ColumnVector.ofBooleans(out);
            }
            case INTEGER -> {
                long[] out = new long[size];
                for (int i = 0; i < size; i++) {
                    out[i] = asLong(values.get(i));
                }
                yield ColumnVector.ofIntegers(out);
            }
            case DOUBLE -> {
                double[] out = new double[size];
                for (int i = 0; i < size; i++) {
                    out[i] = asDouble(values.get(i));
                }
                yield ColumnVector.ofDoubles(out);
            }
            case TEXT -> {
                String[] out = new String[size];
                for (int i = 0; i < size; i++) {
                    out[i] = asText(values.get(i));
                }
                yield ColumnVector.ofText(out);
            }
        };
    }

    static boolean asBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IllegalArgumentException("Cannot convert " + describe(value) + " to a boolean");
    }

    static long asLong(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (kindOf(value) == ScalarKind.INTEGER) {
            return ((Number) value).longValue();
        }
        throw new IllegalArgumentException("Cannot convert " + describe(value) + " to an integer");
    }

    static double asDouble(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException("Cannot convert " + describe(value) + " to a double");
    }

    static String asText(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Null values are not supported");
        }
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        if (value instanceof Float || value instanceof Double || value instanceof BigDecimal) {
            return formatDouble(((Number) value).doubleValue());
        }
        return value.toString();
    }

    /**
     * Renders a double, dropping the fraction of integral values ({@code 1.0} becomes {@code "1"}).
     */
    static String formatDouble(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static boolean fitsLong(BigInteger value) {
        return value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " '" + value + "'";
    }
}
