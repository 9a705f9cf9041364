/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.internal;

import org.junit.jupiter.api.Test;

import dev.tabula.metadata.Policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RecyclerTest {

    @Test
    void testAcceptedLengths() {
        assertThat(Recycler.accepts(Policy.LEGACY, 2, 26)).isTrue();
        assertThat(Recycler.accepts(Policy.LEGACY, 3, 26)).isFalse();
        assertThat(Recycler.accepts(Policy.LEGACY, 0, 26)).isFalse();
        assertThat(Recycler.accepts(Policy.LEGACY, 0, 0)).isTrue();
        assertThat(Recycler.accepts(Policy.STRICT, 1, 26)).isTrue();
        assertThat(Recycler.accepts(Policy.STRICT, 2, 26)).isFalse();
        assertThat(Recycler.accepts(Policy.STRICT, 26, 26)).isTrue();
    }

    @Test
    void testCyclicPositions() {
        assertThat(Recycler.cyclicPositions(3, 7)).containsExactly(0, 1, 2, 0, 1, 2, 0);
        assertThat(Recycler.cyclicPositions(1, 0)).isEmpty();
        assertThatThrownBy(() -> Recycler.cyclicPositions(0, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
