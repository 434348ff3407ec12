/*
 * MapEntryFilter.java
 *
 * This source file is part of the StructHash open source project
 *
 * Copyright 2026 the StructHash project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.structhash;

import io.structhash.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Implemented by record types that drop individual entries of their map-valued fields from the digest.
 * Only consulted for maps (and multimaps) held directly by a field of the implementing record.
 */
@API(API.Status.STABLE)
public interface MapEntryFilter {
    /**
     * Decide whether one map entry is hashed.
     * @param fieldName the name of the field holding the map
     * @param key the entry key
     * @param value the entry value
     * @return {@code true} to include the entry
     */
    boolean includeMapEntry(@Nonnull String fieldName, @Nullable Object key, @Nullable Object value);
}
