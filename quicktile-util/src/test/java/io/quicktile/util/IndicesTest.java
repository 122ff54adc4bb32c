package io.quicktile.util;

/*
 * Copyright (c) quicktile
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Indices")
class IndicesTest {

    @ParameterizedTest(name = "clampIdx({0}, {1}, {2}) = {3}")
    @CsvSource({
        "0, 3, true, 0",
        "2, 3, true, 2",
        "3, 3, true, 0",
        "5, 3, true, 2",
        "-1, 3, true, 2",
        "-4, 3, true, 2",
        "7, 1, true, 0",
        "0, 3, false, 0",
        "2, 3, false, 2",
        "5, 3, false, 2",
        "-1, 3, false, 0",
        "-100, 4, false, 0",
    })
    void shouldClampIndex(int idx, int stop, boolean wrap, int expected) {
        assertThat(Indices.clampIdx(idx, stop, wrap)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should wrap by default")
    void shouldWrapByDefault() {
        assertThat(Indices.clampIdx(-1, 4)).isEqualTo(3);
        assertThat(Indices.clampIdx(9, 4)).isEqualTo(1);
    }

    @Test
    @DisplayName("wrapped index is always the floor modulus")
    void wrappedIndexIsFloorModulus() {
        for (int stop = 1; stop <= 7; stop++) {
            for (int idx = -30; idx <= 30; idx++) {
                int clamped = Indices.clampIdx(idx, stop, true);
                assertThat(clamped).isBetween(0, stop - 1);
                assertThat(Math.floorMod(clamped - idx, stop)).isZero();
            }
        }
    }

    @Test
    @DisplayName("saturated index stays put when already in range")
    void saturatedIndexKeepsInRangeValues() {
        for (int stop = 1; stop <= 7; stop++) {
            for (int idx = -30; idx <= 30; idx++) {
                int clamped = Indices.clampIdx(idx, stop, false);
                assertThat(clamped).isBetween(0, stop - 1);
                if (idx >= 0 && idx < stop) {
                    assertThat(clamped).isEqualTo(idx);
                }
            }
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, Integer.MIN_VALUE})
    @DisplayName("should reject non-positive stop")
    void shouldRejectNonPositiveStop(int stop) {
        assertThatThrownBy(() -> Indices.clampIdx(1, stop, true))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be positive");
        assertThatThrownBy(() -> Indices.clampIdx(1, stop, false))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
