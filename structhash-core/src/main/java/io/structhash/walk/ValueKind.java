/*
 * ValueKind.java
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

import io.structhash.Hashable;
import io.structhash.optional.OptionalAdapters;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multimap;
import com.google.common.collect.Multiset;

import javax.annotation.Nonnull;
import java.lang.reflect.Modifier;
import java.lang.reflect.Proxy;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.stream.BaseStream;

/**
 * How a value (or a declared type) is hashed.
 */
enum ValueKind {
    OPTIONAL,
    SCALAR,
    MAP,
    MULTIMAP,
    SET,
    SEQUENCE,
    ARRAY,
    RECORD,
    /**
     * A declared type that does not pin down a concrete kind: {@code Object}, interfaces, abstract classes.
     */
    DYNAMIC,
    UNSUPPORTED;

    private static final ImmutableList<Class<?>> UNSUPPORTED_TYPES = ImmutableList.of(
            Class.class,
            ClassLoader.class,
            Thread.class,
            BaseStream.class,
            Iterator.class,
            Future.class,
            CompletionStage.class);

    private static final ImmutableList<String> PLATFORM_PACKAGES = ImmutableList.of(
            "java.", "javax.", "jdk.", "sun.", "com.sun.");

    boolean isCollectionLike() {
        return this == MAP || this == MULTIMAP || this == SET || this == SEQUENCE || this == ARRAY;
    }

    @Nonnull
    static ValueKind of(@Nonnull Object value) {
        return ofType(value.getClass());
    }

    @Nonnull
    static ValueKind ofType(@Nonnull Class<?> type) {
        if (OptionalAdapters.isOptionalType(type)) {
            return OPTIONAL;
        }
        if (PrimitiveEncoder.isScalarType(type)) {
            return SCALAR;
        }
        if (Hashable.class.isAssignableFrom(type)) {
            return type.isInterface() ? DYNAMIC : RECORD;
        }
        if (Map.class.isAssignableFrom(type)) {
            return MAP;
        }
        if (Multimap.class.isAssignableFrom(type)) {
            return MULTIMAP;
        }
        if (Set.class.isAssignableFrom(type) || Multiset.class.isAssignableFrom(type)) {
            return SET;
        }
        if (Collection.class.isAssignableFrom(type)) {
            return SEQUENCE;
        }
        if (type.isArray()) {
            return ARRAY;
        }
        if (isUnsupported(type)) {
            return UNSUPPORTED;
        }
        if (type == Object.class || type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            return DYNAMIC;
        }
        return RECORD;
    }

    private static boolean isUnsupported(@Nonnull Class<?> type) {
        for (Class<?> unsupported : UNSUPPORTED_TYPES) {
            if (unsupported.isAssignableFrom(type)) {
                return true;
            }
        }
        if (type.isSynthetic() || type.isHidden() || Proxy.isProxyClass(type)) {
            return true;
        }
        if (type == Object.class || type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            return false;
        }
        final String name = type.getName();
        for (String prefix : PLATFORM_PACKAGES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
