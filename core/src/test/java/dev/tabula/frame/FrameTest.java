/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.frame;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import dev.tabula.IndexOutOfRangeException;
import dev.tabula.UnequalColumnLengthException;
import dev.tabula.metadata.Policy;
import dev.tabula.metadata.ScalarKind;
import dev.tabula.vector.ColumnVector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for frame construction, metadata and conversions.
 */
public class FrameTest {

    @Test
    void testMakeContainerKeepsColumnOrder() {
        Map<String, ColumnVector> columns = new LinkedHashMap<>();
        columns.put("b", ColumnVector.ofIntegers(1, 2));
        columns.put("a", ColumnVector.ofText("x", "y"));

        Frame frame = Frames.of(columns, Policy.LEGACY);

        assertThat(frame.getNames()).containsExactly("b", "a");
        assertThat(frame.getRowCount()).isEqualTo(2);
        assertThat(frame.getColumnCount()).isEqualTo(2);
        assertThat(frame.getPolicy()).isEqualTo(Policy.LEGACY);
        assertThat(frame.getColumn(1)).isEqualTo(ColumnVector.ofText("x", "y"));
    }

    @Test
    void testUnequalColumnLengthsRejected() {
        Map<String, ColumnVector> columns = new LinkedHashMap<>();
        columns.put("a", ColumnVector.ofIntegers(1, 2, 3));
        columns.put("b", ColumnVector.ofIntegers(1, 2));

        assertThatThrownBy(() -> Frames.of(columns, Policy.STRICT))
                .isInstanceOf(UnequalColumnLengthException.class)
                .hasMessageContaining("Column 'b' has 2 rows, expected 3");
    }

    @Test
    void testInvalidColumnNamesRejected() {
        assertThatThrownBy(() -> Frame.builder(Policy.STRICT).add("", ColumnVector.ofIntegers(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("null or empty");
        assertThatThrownBy(() -> Frame.builder(Policy.STRICT)
                .add("a", ColumnVector.ofIntegers(1))
                .add("a", ColumnVector.ofIntegers(2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate column name: a");
    }

    @Test
    void testEmptyFrame() {
        Frame frame = Frame.builder(Policy.STRICT).build();
        assertThat(frame.getColumnCount()).isZero();
        assertThat(frame.getRowCount()).isZero();
        assertThat(frame.getNames()).isEmpty();
    }

    @Test
    void testDescribe() {
        FrameDescription description = Frames.describe(Fixtures.small(Policy.STRICT));

        assertThat(description.names()).containsExactly("id", "score", "flag");
        assertThat(description.kinds()).containsExactly(ScalarKind.INTEGER, ScalarKind.DOUBLE, ScalarKind.BOOLEAN);
        assertThat(description.rowCount()).isEqualTo(3);
        assertThat(description.policy()).isEqualTo(Policy.STRICT);
    }

    @Test
    void testGetColumnOutOfRange() {
        Frame frame = Fixtures.small(Policy.LEGACY);
        assertThatThrownBy(() -> frame.getColumn(3))
                .isInstanceOf(IndexOutOfRangeException.class);
    }

    @Test
    void testValueEquality() {
        assertThat(Fixtures.small(Policy.STRICT)).isEqualTo(Fixtures.small(Policy.STRICT));
        assertThat(Fixtures.small(Policy.STRICT)).hasSameHashCodeAs(Fixtures.small(Policy.STRICT));
        assertThat(Fixtures.small(Policy.STRICT)).isNotEqualTo(Fixtures.small(Policy.LEGACY));
    }

    @Test
    void testPolicyConversionSharesColumns() {
        Frame legacy = Fixtures.small(Policy.LEGACY);
        Frame strict = Frames.asStrict(legacy);

        assertThat(strict.getPolicy()).isEqualTo(Policy.STRICT);
        assertThat(legacy.getPolicy()).isEqualTo(Policy.LEGACY);
        assertThat(strict.getColumn(0)).isSameAs(legacy.getColumn(0));
        assertThat(Frames.asLegacy(strict)).isEqualTo(legacy);
        assertThat(Frames.asLegacy(legacy)).isSameAs(legacy);
    }

    @Test
    void testToStringShowsShapeAndKinds() {
        assertThat(Fixtures.small(Policy.STRICT).toString())
                .isEqualTo("Frame[3 x 3] strict frame { id <int>, score <dbl>, flag <lgl> }");
    }

    @Test
    void testRowMajorConstructionViaFrames() {
        Frame frame = Frames.fromRows(List.of("letters", "numbers"), List.of("a", 1, "b", 2));
        assertThat(frame.getRowCount()).isEqualTo(2);
        assertThat(frame.getPolicy()).isEqualTo(Policy.STRICT);
    }
}
