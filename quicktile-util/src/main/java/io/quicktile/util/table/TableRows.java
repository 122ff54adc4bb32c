package io.quicktile.util.table;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// The row source accepted by {@link TableFormatter}: either an explicit list of rows or
/// a key/value mapping shown as a two-column table.
public sealed interface TableRows permits TableRows.Listed, TableRows.Mapped {

    /// Normalizes this source to an ordered list of rows of text cells.
    /// @return The rows to render, in display order
    List<List<String>> toRows();

    /// @param rows Rows of cells; rows may differ in length
    /// @return A listed row source
    static TableRows of(List<? extends List<String>> rows) {
        return new Listed(rows);
    }

    /// @param entries A mapping whose keys are mutually comparable
    /// @return A mapped row source
    static TableRows of(Map<?, ?> entries) {
        return new Mapped(entries);
    }

    /// Explicit rows, rendered in the given order.
    /// @param rows Rows of cells
    record Listed(List<? extends List<String>> rows) implements TableRows {
        public Listed {
            Objects.requireNonNull(rows, "rows");
        }

        @Override
        public List<List<String>> toRows() {
            List<List<String>> copy = new ArrayList<>(rows.size());
            for (int r = 0; r < rows.size(); r++) {
                List<String> row = rows.get(r);
                if (row == null) {
                    throw new IllegalArgumentException("Row " + r + " is null");
                }
                copy.add(new ArrayList<>(row));
            }
            return copy;
        }
    }

    /// Key/value entries, rendered as `(key, value)` rows sorted by the keys' natural order.
    /// @param entries The mapping to render
    record Mapped(Map<?, ?> entries) implements TableRows {
        public Mapped {
            Objects.requireNonNull(entries, "entries");
        }

        /// @throws ClassCastException If the keys are not mutually comparable
        @Override
        public List<List<String>> toRows() {
            Map<Object, Object> sorted = new TreeMap<>(entries);
            List<List<String>> rows = new ArrayList<>(sorted.size());
            sorted.forEach((key, value) -> {
                List<String> row = new ArrayList<>(2);
                row.add(String.valueOf(key));
                row.add(String.valueOf(value));
                rows.add(row);
            });
            return rows;
        }
    }
}
