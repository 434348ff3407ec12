/*
 * Types.java
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

import com.google.common.reflect.TypeParameter;
import com.google.common.reflect.TypeToken;

import javax.annotation.Nonnull;
import java.lang.reflect.Array;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Declared-type bookkeeping. Declared types travel with values so that a null can be replaced by the zero value of
 * what it was declared as, including element and payload types of generic containers.
 */
final class Types {
    private Types() {
    }

    @Nonnull
    static Class<?> rawType(@Nonnull Type type) {
        return TypeToken.of(type).getRawType();
    }

    /**
     * Keep the declared type when it describes the value, otherwise fall back to the value's class.
     */
    @Nonnull
    static Type effectiveType(@Nonnull Type declared, @Nonnull Object value) {
        return rawType(declared).isInstance(value) ? declared : value.getClass();
    }

    /**
     * Resolve a type argument of a generic supertype, e.g. the {@code V} of {@code Map<K, V>} for a declared
     * {@code HashMap<String, Foo>}.
     * @return the argument, or {@code Object.class} when it cannot be resolved
     */
    @Nonnull
    static Type typeArgument(@Nonnull Type type, @Nonnull Class<?> supertype, int index) {
        final TypeToken<?> token = TypeToken.of(type);
        if (!supertype.isAssignableFrom(token.getRawType())) {
            return Object.class;
        }
        final Type resolved = supertype(token, supertype);
        if (resolved instanceof ParameterizedType) {
            final Type argument = ((ParameterizedType)resolved).getActualTypeArguments()[index];
            // raw declared types leave the supertype's own variables unresolved
            return argument instanceof TypeVariable<?> ? rawType(argument) : argument;
        }
        return Object.class;
    }

    @Nonnull
    static Type componentType(@Nonnull Type declared, @Nonnull Object array) {
        final TypeToken<?> component = TypeToken.of(declared).getComponentType();
        return component != null ? component.getType() : array.getClass().getComponentType();
    }

    @Nonnull
    static List<Object> arrayElements(@Nonnull Object array) {
        final int length = Array.getLength(array);
        final List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(Array.get(array, i));
        }
        return elements;
    }

    /**
     * Build {@code Collection<E>} for the values of a multimap viewed as a map.
     */
    @Nonnull
    static Type collectionOf(@Nonnull Type elementType) {
        if (elementType instanceof Class<?> || elementType instanceof ParameterizedType) {
            return collectionOf(TypeToken.of(elementType));
        }
        return Collection.class;
    }

    @Nonnull
    private static <E> Type collectionOf(@Nonnull TypeToken<E> element) {
        return new TypeToken<Collection<E>>() { }
                .where(new TypeParameter<E>() { }, element)
                .getType();
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    @Nonnull
    private static Type supertype(@Nonnull TypeToken<?> token, @Nonnull Class<?> supertype) {
        return ((TypeToken)token).getSupertype(supertype).getType();
    }
}
