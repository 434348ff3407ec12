/*
 * VisitContext.java
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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * What a visit knows about where its value came from. A context describes exactly one visit and is never passed on to
 * the visits of nested values; element, key and value visits start from {@link #NONE}.
 */
final class VisitContext {
    static final VisitContext NONE = new VisitContext(ImmutableSet.of(), null, null);

    @Nonnull
    private final ImmutableSet<VisitFlag> flags;
    @Nullable
    private final Object enclosingRecord;
    @Nullable
    private final String fieldName;

    private VisitContext(@Nonnull ImmutableSet<VisitFlag> flags, @Nullable Object enclosingRecord,
                         @Nullable String fieldName) {
        this.flags = flags;
        this.enclosingRecord = enclosingRecord;
        this.fieldName = fieldName;
    }

    /**
     * Create the context for the value of a record field.
     * @param enclosingRecord the record holding the field; {@code null} while expanding a zero record
     * @param fieldName the field name
     * @param set whether the field is tagged as a set
     * @return the context
     */
    @Nonnull
    static VisitContext forField(@Nullable Object enclosingRecord, @Nonnull String fieldName, boolean set) {
        return new VisitContext(set ? Sets.immutableEnumSet(VisitFlag.SET) : ImmutableSet.of(),
                enclosingRecord, fieldName);
    }

    boolean hasFlag(@Nonnull VisitFlag flag) {
        return flags.contains(flag);
    }

    @Nullable
    Object getEnclosingRecord() {
        return enclosingRecord;
    }

    @Nullable
    String getFieldName() {
        return fieldName;
    }
}
