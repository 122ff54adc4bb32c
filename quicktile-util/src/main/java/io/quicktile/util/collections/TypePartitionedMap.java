package io.quicktile.util.collections;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/// A map-like container which never compares keys of different runtime types.
///
/// Entries are bucketed into one partition per key class, and lookups only ever
/// consult the partition matching the class of the probe key. Toolkit enum wrappers
/// of different enum types may report equal or warn when compared to each other;
/// keeping them in separate partitions makes such comparisons impossible. An
/// {@link Integer} `1` and a {@link Long} `1L` are likewise independent keys.
///
/// Iteration visits partitions in the order their key class was first inserted, and
/// keys within a partition in insertion order. A partition is dropped as soon as its
/// last entry is removed.
///
/// <h2>Size</h2>
///
/// {@link #size()} reports the number of partitions, not the number of entries. Callers
/// relying on that count are kept working; use {@link #entryCount()} for the number of
/// stored entries.
///
/// This class is not thread-safe. It does not implement {@link Map} because its size
/// semantics would break that interface's contract.
///
/// @param <V> The value type
public class TypePartitionedMap<V> implements Iterable<Object> {

    private static final Logger logger = LogManager.getLogger(TypePartitionedMap.class);

    private final Map<Class<?>, Map<Object, V>> partitions = new LinkedHashMap<>();

    /// Creates an empty map.
    public TypePartitionedMap() {
    }

    /// Creates a map seeded from the given maps, applied in order so that later entries
    /// overwrite earlier ones with an equal key of the same type.
    /// @param seeds The maps to copy entries from
    @SafeVarargs
    public TypePartitionedMap(Map<?, ? extends V>... seeds) {
        for (Map<?, ? extends V> seed : seeds) {
            for (Map.Entry<?, ? extends V> entry : seed.entrySet()) {
                put(entry.getKey(), entry.getValue());
            }
        }
    }

    /// Checks whether an entry exists for the key within its type's partition.
    /// @param key The key to look up
    /// @return true if the key's type has a partition containing the key
    public boolean containsKey(Object key) {
        Map<Object, V> partition = partitions.get(typeOf(key));
        return partition != null && partition.containsKey(key);
    }

    /// Gets the value stored for a key.
    /// @param key The key to look up
    /// @return The stored value, which may be null if null was stored
    /// @throws KeyNotFoundException If no entry exists for the key
    public V get(Object key) {
        Map<Object, V> partition = partitions.get(typeOf(key));
        if (partition == null || !partition.containsKey(key)) {
            throw new KeyNotFoundException(key);
        }
        return partition.get(key);
    }

    /// Gets the value stored for a key, or a fallback when absent.
    /// @param key The key to look up
    /// @param defaultValue The value to return if no entry exists
    /// @return The stored value or `defaultValue`
    public V getOrDefault(Object key, V defaultValue) {
        return containsKey(key) ? get(key) : defaultValue;
    }

    /// Stores a value, creating the partition for the key's type if needed.
    /// @param key The key, must not be null
    /// @param value The value to store
    /// @return The previous value for the key, or null if there was none
    public V put(Object key, V value) {
        Class<?> type = typeOf(key);
        Map<Object, V> partition = partitions.get(type);
        if (partition == null) {
            logger.trace("creating partition for {}", type.getName());
            partition = new LinkedHashMap<>();
            partitions.put(type, partition);
        }
        return partition.put(key, value);
    }

    /// Removes the entry for a key, dropping its partition if it becomes empty.
    /// @param key The key to remove
    /// @return The value that was stored
    /// @throws KeyNotFoundException If no entry exists for the key
    public V remove(Object key) {
        Class<?> type = typeOf(key);
        Map<Object, V> partition = partitions.get(type);
        if (partition == null || !partition.containsKey(key)) {
            throw new KeyNotFoundException(key);
        }
        V removed = partition.remove(key);
        if (partition.isEmpty()) {
            logger.trace("dropping empty partition for {}", type.getName());
            partitions.remove(type);
        }
        return removed;
    }

    /// Gets the number of partitions, which is the number of distinct key types present.
    /// This is not the entry count; see {@link #entryCount()}.
    /// @return The partition count
    public int size() {
        return partitions.size();
    }

    /// @return The total number of stored entries across all partitions
    public int entryCount() {
        int count = 0;
        for (Map<Object, V> partition : partitions.values()) {
            count += partition.size();
        }
        return count;
    }

    /// @return true if no entries are stored
    public boolean isEmpty() {
        return partitions.isEmpty();
    }

    /// @return The key types currently holding at least one entry, in first-insertion order
    public Set<Class<?>> partitionTypes() {
        return Collections.unmodifiableSet(partitions.keySet());
    }

    /// Snapshot of all keys in iteration order.
    /// @return A new list of keys
    public List<Object> keys() {
        List<Object> keys = new ArrayList<>();
        for (Object key : this) {
            keys.add(key);
        }
        return keys;
    }

    /// Snapshot of all entries in iteration order.
    /// @return A new list of immutable key/value pairs
    public List<Map.Entry<Object, V>> items() {
        List<Map.Entry<Object, V>> items = new ArrayList<>();
        for (Map<Object, V> partition : partitions.values()) {
            for (Map.Entry<Object, V> entry : partition.entrySet()) {
                items.add(new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), entry.getValue()));
            }
        }
        return items;
    }

    /// Iterates over every key, partition by partition. The iterator is read-only and
    /// fails fast if the map is structurally modified during iteration.
    @Override
    public Iterator<Object> iterator() {
        Iterator<Map<Object, V>> sections = partitions.values().iterator();
        return new Iterator<>() {
            private Iterator<Object> current = Collections.emptyIterator();

            @Override
            public boolean hasNext() {
                while (!current.hasNext() && sections.hasNext()) {
                    current = sections.next().keySet().iterator();
                }
                return current.hasNext();
            }

            @Override
            public Object next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return current.next();
            }
        };
    }

    @Override
    public String toString() {
        return partitions.values().stream()
            .map(String::valueOf)
            .collect(Collectors.joining(", ", getClass().getSimpleName() + "(", ")"));
    }

    private static Class<?> typeOf(Object key) {
        return Objects.requireNonNull(key, "TypePartitionedMap does not accept null keys").getClass();
    }
}
