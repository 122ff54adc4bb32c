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

import java.util.NoSuchElementException;

/// Exception thrown when a key is looked up or removed from a {@link TypePartitionedMap}
/// which has no entry for it within the partition of the key's runtime type.
public class KeyNotFoundException extends NoSuchElementException {

    private final transient Object key;

    public KeyNotFoundException(Object key) {
        super(String.format("No entry for key %s of type %s", key, key.getClass().getName()));
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
