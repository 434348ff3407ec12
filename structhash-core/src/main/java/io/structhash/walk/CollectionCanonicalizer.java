/*
 * CollectionCanonicalizer.java
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

package io.structhash.walk;

import io.structhash.MapEntryFilter;
import com.google.common.hash.Hasher;
import com.google.common.primitives.UnsignedBytes;

import javax.annotation.Nonnull;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes collections in a canonical form. Maps and set-like collections are written as sorted independent
 * sub-digests so that iteration order cannot leak into the result; ordered sequences are visited element by element
 * into the enclosing digest.
 */
final class CollectionCanonicalizer {
    @Nonnull
    private final ValueWalker walker;
    @Nonnull
    private final HashState state;

    CollectionCanonicalizer(@Nonnull ValueWalker walker, @Nonnull HashState state) {
        this.walker = walker;
        this.state = state;
    }

    void visitMap(@Nonnull Map<?, ?> map, @Nonnull Type keyType, @Nonnull Type valueType,
                  @Nonnull VisitContext context) {
        final Object enclosing = context.getEnclosingRecord();
        final String fieldName = context.getFieldName();
        final MapEntryFilter filter = enclosing instanceof MapEntryFilter && fieldName != null
                                      ? (MapEntryFilter)enclosing : null;
        final List<byte[]> keyDigests = new ArrayList<>(map.size());
        final List<byte[]> valueDigests = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (filter != null && !Hooks.includeMapEntry(filter, fieldName, entry.getKey(), entry.getValue())) {
                continue;
            }
            keyDigests.add(walker.digestIndependently(entry.getKey(), keyType));
            valueDigests.add(walker.digestIndependently(entry.getValue(), valueType));
        }
        writeSorted(keyDigests);
        writeSorted(valueDigests);
    }

    void visitSet(@Nonnull Iterable<?> elements, @Nonnull Type elementType) {
        final List<byte[]> digests = new ArrayList<>();
        for (Object element : elements) {
            digests.add(walker.digestIndependently(element, elementType));
        }
        writeSorted(digests);
    }

    void visitSequence(@Nonnull Iterable<?> elements, @Nonnull Type elementType) {
        for (Object element : elements) {
            walker.visit(element, elementType, VisitContext.NONE);
        }
    }

    private void writeSorted(@Nonnull List<byte[]> digests) {
        digests.sort(UnsignedBytes.lexicographicalComparator());
        final Hasher hasher = state.getHasher();
        for (byte[] digest : digests) {
            hasher.putBytes(digest);
        }
    }
}
