/*
 * ValueNormalizer.java
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

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.lang.reflect.Type;
import java.util.Optional;

/**
 * Strips reference wrappers ({@link Optional} and Guava's {@link com.google.common.base.Optional}) and widens numbers
 * to one width per family, so that a value hashes the same however many times it has been wrapped.
 */
final class ValueNormalizer {
    private ValueNormalizer() {
    }

    @Nonnull
    static NormalizedValue normalize(@Nullable Object value, @Nonnull Type declaredType) {
        Object current = value;
        Type type = declaredType;
        while (true) {
            if (current instanceof Optional<?>) {
                type = Types.typeArgument(type, Optional.class, 0);
                current = ((Optional<?>)current).orElse(null);
            } else if (current instanceof com.google.common.base.Optional<?>) {
                type = Types.typeArgument(type, com.google.common.base.Optional.class, 0);
                current = ((com.google.common.base.Optional<?>)current).orNull();
            } else {
                break;
            }
        }
        if (current == null) {
            return NormalizedValue.absent(unwrapDeclared(type));
        }
        return NormalizedValue.present(widen(current), Types.effectiveType(type, current));
    }

    /**
     * A null declared as {@code Optional<Foo>} is an absent {@code Foo}.
     */
    @Nonnull
    private static Type unwrapDeclared(@Nonnull Type declaredType) {
        Type type = declaredType;
        while (true) {
            final Class<?> raw = Types.rawType(type);
            if (raw == Optional.class) {
                type = Types.typeArgument(type, Optional.class, 0);
            } else if (raw == com.google.common.base.Optional.class) {
                type = Types.typeArgument(type, com.google.common.base.Optional.class, 0);
            } else {
                return type;
            }
        }
    }

    @Nonnull
    static Object widen(@Nonnull Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer) {
            return ((Number)value).longValue();
        }
        if (value instanceof Float) {
            return ((Float)value).doubleValue();
        }
        if (value instanceof UnsignedInteger) {
            return UnsignedLong.fromLongBits(((UnsignedInteger)value).longValue());
        }
        return value;
    }
}
