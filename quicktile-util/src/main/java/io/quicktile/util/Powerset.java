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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/// Lazily enumerates every subset of a finite collection.
///
/// Subsets come out grouped by size, smallest first. Within one size they follow the
/// usual combination order, so `Powerset.of(List.of(1, 2, 3))` yields
/// `[] [1] [2] [3] [1, 2] [1, 3] [2, 3] [1, 2, 3]`.
///
/// Elements are treated positionally: equal elements at different positions are
/// not merged. The input is copied at construction, and every call to
/// {@link #iterator()} starts a fresh enumeration.
///
/// @param <T> The element type
public final class Powerset<T> implements Iterable<List<T>> {

    private final List<T> items;

    private Powerset(List<T> items) {
        this.items = items;
    }

    /// Creates a powerset view over a snapshot of the given items.
    /// @param items The source elements, in the order subsets should draw from them
    /// @param <T> The element type
    /// @return A restartable powerset sequence
    public static <T> Powerset<T> of(Collection<? extends T> items) {
        return new Powerset<>(new ArrayList<>(items));
    }

    /// Gets the number of subsets this powerset yields.
    /// @return 2 to the power of the item count
    /// @throws ArithmeticException If the count does not fit in a long
    public long count() {
        if (items.size() >= Long.SIZE - 1) {
            throw new ArithmeticException("Powerset of " + items.size() + " items exceeds long range");
        }
        return 1L << items.size();
    }

    /// @return A sequential stream over the subsets, in iteration order
    public Stream<List<T>> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public Iterator<List<T>> iterator() {
        return new SubsetIterator();
    }

    private final class SubsetIterator implements Iterator<List<T>> {
        private final int n = items.size();
        private int size = 0;
        // Positions of the next subset to emit, or null once exhausted
        private int[] indices = new int[0];

        @Override
        public boolean hasNext() {
            return indices != null;
        }

        @Override
        public List<T> next() {
            if (indices == null) {
                throw new NoSuchElementException("Powerset exhausted");
            }
            List<T> subset = new ArrayList<>(indices.length);
            for (int index : indices) {
                subset.add(items.get(index));
            }
            advance();
            return Collections.unmodifiableList(subset);
        }

        private void advance() {
            int i = size - 1;
            while (i >= 0 && indices[i] == i + n - size) {
                i--;
            }
            if (i >= 0) {
                indices[i]++;
                for (int j = i + 1; j < size; j++) {
                    indices[j] = indices[j - 1] + 1;
                }
                return;
            }
            size++;
            if (size > n) {
                indices = null;
                return;
            }
            indices = new int[size];
            for (int j = 0; j < size; j++) {
                indices[j] = j;
            }
        }
    }
}
