/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.schema;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import dev.tabula.IndexOutOfRangeException;
import dev.tabula.metadata.Diagnostic;
import dev.tabula.metadata.Policy;
import dev.tabula.metadata.ScalarKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class IndexResolverTest {

    private static final IndexResolver RESOLVER = IndexResolver.create();

    private static FrameSchema schema(Policy policy) {
        return FrameSchema.of(
                List.of("letters_lower", "letters_upper", "values"),
                List.of(ScalarKind.TEXT, ScalarKind.TEXT, ScalarKind.INTEGER),
                policy);
    }

    // ==================== Names ====================

    @ParameterizedTest
    @EnumSource(Policy.class)
    void testExactNameResolvesUnderBothPolicies(Policy policy) {
        Resolution resolution = RESOLVER.resolve(schema(policy), ColumnKey.name("values"), Arity.SINGLE);
        assertThat(resolution).isInstanceOf(Resolution.Found.class);
        assertThat(((Resolution.Found) resolution).indices()).containsExactly(2);
        assertThat(resolution.diagnostics()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(Policy.class)
    void testExactNameWinsOverLongerColumnWithSamePrefix(Policy policy) {
        FrameSchema overlapping = FrameSchema.of(
                List.of("col_990", "col_99"),
                List.of(ScalarKind.INTEGER, ScalarKind.INTEGER),
                policy);
        IndexResolver warning = IndexResolver.create(new ResolverOptions(true));

        for (Arity arity : Arity.values()) {
            Resolution resolution = warning.resolve(overlapping, ColumnKey.name("col_99"), arity);
            assertThat(resolution).isInstanceOf(Resolution.Found.class);
            assertThat(((Resolution.Found) resolution).indices()).containsExactly(1);
            assertThat(resolution.diagnostics()).isEmpty();
        }

        Resolution ambiguous = warning.resolve(overlapping, ColumnKey.name("col_9"), Arity.SINGLE);
        assertThat(ambiguous).isInstanceOf(Resolution.NotFound.class);
    }

    @Test
    void testLegacyUniquePrefixResolvesSilently() {
        Resolution resolution = RESOLVER.resolve(schema(Policy.LEGACY), ColumnKey.name("val"), Arity.SINGLE);
        assertThat(resolution).isInstanceOf(Resolution.Found.class);
        assertThat(((Resolution.Found) resolution).indices()).containsExactly(2);
        assertThat(resolution.diagnostics()).isEmpty();
    }

    @Test
    void testLegacyAmbiguousPrefixIsSilentMiss() {
        Resolution resolution = RESOLVER.resolve(schema(Policy.LEGACY), ColumnKey.name("let"), Arity.SINGLE);
        assertThat(resolution).isInstanceOf(Resolution.NotFound.class);
        assertThat(resolution.diagnostics()).isEmpty();
    }

    @Test
    void testLegacyUnknownNameIsSilentMiss() {
        Resolution resolution = RESOLVER.resolve(schema(Policy.LEGACY), ColumnKey.name("nope"), Arity.SINGLE);
        assertThat(resolution).isInstanceOf(Resolution.NotFound.class);
        assertThat(resolution.diagnostics()).isEmpty();
    }

    @Test
    void testStrictNeverMatchesPrefixes() {
        Resolution resolution = RESOLVER.resolve(schema(Policy.STRICT), ColumnKey.name("val"), Arity.SINGLE);
        assertThat(resolution).isInstanceOf(Resolution.NotFound.class);
        assertThat(resolution.diagnostics())
                .extracting(Diagnostic::kind)
                .containsExactly(Diagnostic.Kind.MISSING_COLUMN);
        assertThat(resolution.diagnostics().get(0).message()).contains("'val'");
    }

    @Test
    void testDoubleArityNeverMatchesPrefixes() {
        Resolution legacy = RESOLVER.resolve(schema(Policy.LEGACY), ColumnKey.name("val"), Arity.DOUBLE);
        assertThat(legacy).isInstanceOf(Resolution.NotFound.class);
        assertThat(legacy.diagnostics()).isEmpty();

        Resolution strict = RESOLVER.resolve(schema(Policy.STRICT), ColumnKey.name("val"), Arity.DOUBLE);
        assertThat(strict).isInstanceOf(Resolution.NotFound.class);
        assertThat(strict.diagnostics()).extracting(Diagnostic::kind).containsExactly(Diagnostic.Kind.MISSING_COLUMN);
    }

    @Test
    void testMultipleNamesResolveInKeyOrder() {
        Resolution resolution = RESOLVER.resolve(schema(Policy.STRICT),
                ColumnKey.names("values", "letters_lower"), Arity.SINGLE);
        assertThat(((Resolution.Found) resolution).indices()).containsExactly(2, 0);
    }

    @Test
    void testOneMissingNameFailsWholeKey() {
        Resolution resolution = RESOLVER.resolve(schema(Policy.STRICT),
                ColumnKey.names("values", "nope", "other"), Arity.SINGLE);
        assertThat(resolution).isInstanceOf(Resolution.NotFound.class);
        assertThat(resolution.diagnostics()).hasSize(1);
        assertThat(resolution.diagnostics().get(0).message()).contains("'nope'");
    }

    @Test
    void testPartialMatchWarningWhenEnabled() {
        IndexResolver resolver = IndexResolver.create(new ResolverOptions(true));
        Resolution resolution = resolver.resolve(schema(Policy.LEGACY), ColumnKey.name("val"), Arity.SINGLE);
        assertThat(resolution).isInstanceOf(Resolution.Found.class);
        assertThat(resolution.diagnostics())
                .extracting(Diagnostic::kind)
                .containsExactly(Diagnostic.Kind.PARTIAL_MATCH);
    }

    // ==================== Positions ====================

    @ParameterizedTest
    @EnumSource(Policy.class)
    void testPositionsResolveIdenticallyUnderBothPolicies(Policy policy) {
        Resolution resolution = RESOLVER.resolve(schema(policy), ColumnKey.positions(2, 0), Arity.SINGLE);
        assertThat(((Resolution.Found) resolution).indices()).containsExactly(2, 0);
        assertThat(resolution.diagnostics()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(Policy.class)
    void testPositionOutOfRange(Policy policy) {
        assertThatThrownBy(() -> RESOLVER.resolve(schema(policy), ColumnKey.position(3), Arity.SINGLE))
                .isInstanceOf(IndexOutOfRangeException.class)
                .hasMessageContaining("Column position 3 out of range [0, 3)");
        assertThatThrownBy(() -> RESOLVER.resolve(schema(policy), ColumnKey.positions(0, -1), Arity.DOUBLE))
                .isInstanceOf(IndexOutOfRangeException.class);
    }

    @Test
    void testEmptyCompoundKeyResolvesToNoColumns() {
        Resolution resolution = RESOLVER.resolve(schema(Policy.STRICT), ColumnKey.positions(), Arity.SINGLE);
        assertThat(((Resolution.Found) resolution).count()).isZero();
    }

    @Test
    void testOptionsFromSystemProperties() {
        String previous = System.getProperty(ResolverOptions.WARN_PARTIAL_MATCH_PROPERTY);
        try {
            System.setProperty(ResolverOptions.WARN_PARTIAL_MATCH_PROPERTY, "true");
            assertThat(ResolverOptions.fromSystemProperties().warnPartialMatch()).isTrue();
            System.clearProperty(ResolverOptions.WARN_PARTIAL_MATCH_PROPERTY);
            assertThat(ResolverOptions.fromSystemProperties().warnPartialMatch()).isFalse();
        }
        finally {
            if (previous != null) {
                System.setProperty(ResolverOptions.WARN_PARTIAL_MATCH_PROPERTY, previous);
            }
        }
    }
}
