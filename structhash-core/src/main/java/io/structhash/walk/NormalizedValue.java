/*
 * NormalizedValue.java
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

import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.lang.reflect.Type;

/**
 * The result of {@link ValueNormalizer#normalize}: either a concrete value with the type it is visited as, or an
 * absent value remembering the type it was declared as.
 */
final class NormalizedValue {
    @Nullable
    private final Object value;
    @Nonnull
    private final Type type;

    private NormalizedValue(@Nullable Object value, @Nonnull Type type) {
        this.value = value;
        this.type = type;
    }

    @Nonnull
    static NormalizedValue present(@Nonnull Object value, @Nonnull Type type) {
        return new NormalizedValue(value, type);
    }

    @Nonnull
    static NormalizedValue absent(@Nonnull Type type) {
        return new NormalizedValue(null, type);
    }

    boolean isAbsent() {
        return value == null;
    }

    @Nonnull
    Object getValue() {
        return Preconditions.checkNotNull(value, "absent value has no payload");
    }

    @Nonnull
    Type getType() {
        return type;
    }
}
