/*
 * TextRendering.java
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

import javax.annotation.Nonnull;

/**
 * Whether a value renders itself as text. A value qualifies when it is a {@link CharSequence} or its class overrides
 * {@link Object#toString()}. Java records always declare {@code toString()}, so they only render as text when a field
 * asks for it explicitly.
 */
final class TextRendering {
    private static final ClassValue<Boolean> OWN_TO_STRING = new ClassValue<Boolean>() {
        @Override
        protected Boolean computeValue(Class<?> type) {
            try {
                return type.getMethod("toString").getDeclaringClass() != Object.class;
            } catch (NoSuchMethodException e) {
                throw new IllegalStateException("every class has toString()", e);
            }
        }
    };

    private TextRendering() {
    }

    static boolean hasOwnText(@Nonnull Object value) {
        return value instanceof CharSequence || OWN_TO_STRING.get(value.getClass());
    }

    /**
     * Whether a value is rendered as text when rendering is enabled for all records rather than requested per field.
     * A record class's {@code toString()} may be the generated one, which lists every component, ignored ones
     * included, so records never qualify here.
     */
    static boolean rendersByDefault(@Nonnull Object value) {
        return !value.getClass().isRecord() && hasOwnText(value);
    }

    @Nonnull
    static String render(@Nonnull Object value) {
        return value.toString();
    }
}
