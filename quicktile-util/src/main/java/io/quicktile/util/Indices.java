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

/// Index arithmetic helpers for cycling through tiling positions and monitor lists.
public final class Indices {

    private Indices() {
        // Utility class
    }

    /// Ensure a 0-based index is within the half-open range [0, stop), wrapping around.
    /// @param idx The index to clamp, may be negative
    /// @param stop The exclusive upper bound, must be positive
    /// @return `idx` modulo `stop`, always in [0, stop)
    public static int clampIdx(int idx, int stop) {
        return clampIdx(idx, stop, true);
    }

    /// Ensure a 0-based index is within the half-open range [0, stop).
    /// @param idx The index to clamp, may be negative
    /// @param stop The exclusive upper bound, must be positive
    /// @param wrap If true, wrap around rather than saturating at the range ends
    /// @return The wrapped or saturated index
    /// @throws IllegalArgumentException If `stop` is not positive
    public static int clampIdx(int idx, int stop, boolean wrap) {
        if (stop <= 0) {
            throw new IllegalArgumentException("Index range stop must be positive: " + stop);
        }
        if (wrap) {
            return Math.floorMod(idx, stop);
        }
        return Math.max(Math.min(idx, stop - 1), 0);
    }
}
