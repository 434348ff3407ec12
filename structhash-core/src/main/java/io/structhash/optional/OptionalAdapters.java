/*
 * OptionalAdapters.java
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

package io.structhash.optional;

import io.structhash.annotation.API;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * The fixed adapter table: values implementing {@link OptionalValue} plus the primitive optionals of the JDK
 * ({@link OptionalInt}, {@link OptionalLong}, {@link OptionalDouble}).
 */
@API(API.Status.INTERNAL)
public final class OptionalAdapters {
    private static final ImmutableMap<Class<?>, OptionalKind> JDK_KINDS = ImmutableMap.of(
            OptionalInt.class, OptionalKind.INT32,
            OptionalLong.class, OptionalKind.INT64,
            OptionalDouble.class, OptionalKind.FLOAT64);

    private OptionalAdapters() {
    }

    /**
     * Get an optional-value view of a value.
     * @param value any value
     * @return the view, or {@code null} if the value is not an optional of a known kind
     */
    @Nullable
    public static OptionalValue adapt(@Nullable Object value) {
        if (value instanceof OptionalValue) {
            return (OptionalValue)value;
        }
        if (value instanceof OptionalInt) {
            final OptionalInt optional = (OptionalInt)value;
            return new View(OptionalKind.INT32, optional.isPresent() ? optional.getAsInt() : null);
        }
        if (value instanceof OptionalLong) {
            final OptionalLong optional = (OptionalLong)value;
            return new View(OptionalKind.INT64, optional.isPresent() ? optional.getAsLong() : null);
        }
        if (value instanceof OptionalDouble) {
            final OptionalDouble optional = (OptionalDouble)value;
            return new View(OptionalKind.FLOAT64, optional.isPresent() ? optional.getAsDouble() : null);
        }
        return null;
    }

    /**
     * Get the kind of an optional class when it can be known without an instance: the JDK primitive optionals and
     * {@link OptionalValue} classes annotated with {@link OptionalType}.
     * @param type a declared type
     * @return the kind, or {@code null} if the class does not declare one
     */
    @Nullable
    public static OptionalKind kindOf(@Nonnull Class<?> type) {
        final OptionalKind jdkKind = JDK_KINDS.get(type);
        if (jdkKind != null) {
            return jdkKind;
        }
        if (!OptionalValue.class.isAssignableFrom(type)) {
            return null;
        }
        final OptionalType declared = type.getAnnotation(OptionalType.class);
        return declared == null ? null : declared.value();
    }

    public static boolean isOptionalType(@Nonnull Class<?> type) {
        return JDK_KINDS.containsKey(type) || OptionalValue.class.isAssignableFrom(type);
    }

    /**
     * Get the absent optional of a kind.
     * @param kind the kind
     * @return an absent view
     */
    @Nonnull
    public static OptionalValue absent(@Nonnull OptionalKind kind) {
        return new View(kind, null);
    }

    private static final class View implements OptionalValue {
        @Nonnull
        private final OptionalKind kind;
        @Nullable
        private final Object value;

        View(@Nonnull OptionalKind kind, @Nullable Object value) {
            this.kind = kind;
            this.value = value;
        }

        @Nonnull
        @Override
        public OptionalKind getOptionalKind() {
            return kind;
        }

        @Override
        public boolean isPresent() {
            return value != null;
        }

        @Nullable
        @Override
        public Object getValue() {
            return value;
        }
    }
}
