/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.frame;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import dev.tabula.metadata.Diagnostic;

/**
 * Result of a column access: an optional value plus the diagnostics raised while computing it.
 * <p>
 * A failed lookup yields an empty value, never a sentinel; whether it also carries a
 * diagnostic depends on the frame's policy.
 * </p>
 *
 * @param value the result, empty if nothing was found
 * @param diagnostics soft signals, in the order they were raised
 */
public record Outcome<T>(Optional<T> value, List<Diagnostic> diagnostics) {

    public Outcome {
        Objects.requireNonNull(value, "value");
        diagnostics = List.copyOf(diagnostics);
    }

    public static <T> Outcome<T> of(T value) {
        return new Outcome<>(Optional.of(value), List.of());
    }

    public static <T> Outcome<T> of(T value, List<Diagnostic> diagnostics) {
        return new Outcome<>(Optional.of(value), diagnostics);
    }

    public static <T> Outcome<T> empty(List<Diagnostic> diagnostics) {
        return new Outcome<>(Optional.empty(), diagnostics);
    }

    public boolean isPresent() {
        return value.isPresent();
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    /**
     * Returns the value.
     *
     * @throws NoSuchElementException if the outcome is empty
     */
    public T get() {
        return value.orElseThrow(() -> new NoSuchElementException("No value present; diagnostics: " + diagnostics));
    }

    public T orElse(T other) {
        return value.orElse(other);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public boolean hasDiagnostic(Diagnostic.Kind kind) {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.kind() == kind) {
                return true;
            }
        }
        return false;
    }

    public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
        return new Outcome<>(value.map(mapper), diagnostics);
    }
}
