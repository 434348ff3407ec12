/*
 * OptionalEncoder.java
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

import io.structhash.HashOptions;
import io.structhash.UnsupportedValueKindException;
import io.structhash.logging.LogMessageKeys;
import io.structhash.optional.OptionalKind;
import io.structhash.optional.OptionalValue;
import com.google.common.base.Strings;
import com.google.common.hash.Hasher;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Encodes {@link OptionalValue}s. An absent value is written as the text {@code nil} (or the zero of its kind when
 * nil and zero are equivalent); text kinds carry a prefix naming the kind.
 */
final class OptionalEncoder {
    static final String NIL_TEXT = "nil";
    static final String STRING_PREFIX = "string";
    static final String ERROR_PREFIX = "error";

    private OptionalEncoder() {
    }

    static void encode(@Nonnull Hasher hasher, @Nonnull OptionalValue optional, @Nonnull HashOptions options) {
        final OptionalKind kind = optional.getOptionalKind();
        final Object payload = optional.isPresent() ? optional.getValue() : null;
        if (options.isIgnoreZeroValue() && (payload == null || isZeroPayload(kind, payload))) {
            return;
        }
        if (payload == null) {
            if (options.isZeroNil()) {
                writePayload(hasher, kind, zeroPayload(kind));
            } else {
                PrimitiveEncoder.writeText(hasher, NIL_TEXT);
            }
            return;
        }
        writePayload(hasher, kind, payload);
    }

    @Nonnull
    private static Object zeroPayload(@Nonnull OptionalKind kind) {
        switch (kind.getFamily()) {
            case TEXT:
                return "";
            case BOOLEAN:
                return Boolean.FALSE;
            case FLOATING_POINT:
                return 0.0d;
            default:
                return 0L;
        }
    }

    private static boolean isZeroPayload(@Nonnull OptionalKind kind, @Nonnull Object payload) {
        switch (kind.getFamily()) {
            case TEXT:
                return text(kind, payload).isEmpty();
            case BOOLEAN:
                return !bool(kind, payload);
            case SIGNED:
                return signed(kind, payload) == 0L;
            case UNSIGNED:
                return unsigned(kind, payload) == 0L;
            case FLOATING_POINT:
                return floating(kind, payload) == 0.0d;
            default:
                throw new IllegalStateException("unknown optional kind family " + kind.getFamily());
        }
    }

    private static void writePayload(@Nonnull Hasher hasher, @Nonnull OptionalKind kind, @Nonnull Object payload) {
        switch (kind.getFamily()) {
            case TEXT:
                PrimitiveEncoder.writeText(hasher,
                        (kind == OptionalKind.ERROR ? ERROR_PREFIX : STRING_PREFIX) + text(kind, payload));
                break;
            case BOOLEAN:
                PrimitiveEncoder.writeBoolean(hasher, bool(kind, payload));
                break;
            case SIGNED:
                hasher.putLong(signed(kind, payload));
                break;
            case UNSIGNED:
                hasher.putLong(unsigned(kind, payload));
                break;
            case FLOATING_POINT:
                PrimitiveEncoder.writeDouble(hasher, floating(kind, payload));
                break;
            default:
                throw new IllegalStateException("unknown optional kind family " + kind.getFamily());
        }
    }

    @Nonnull
    private static String text(@Nonnull OptionalKind kind, @Nonnull Object payload) {
        if (kind == OptionalKind.ERROR && payload instanceof Throwable) {
            return Strings.nullToEmpty(((Throwable)payload).getMessage());
        }
        return payload.toString();
    }

    private static boolean bool(@Nonnull OptionalKind kind, @Nonnull Object payload) {
        if (payload instanceof Boolean) {
            return (Boolean)payload;
        }
        throw mismatch(kind, payload);
    }

    private static long signed(@Nonnull OptionalKind kind, @Nonnull Object payload) {
        final long value = number(kind, payload).longValue();
        final int shift = Long.SIZE - kind.getWidth();
        return (value << shift) >> shift;
    }

    private static long unsigned(@Nonnull OptionalKind kind, @Nonnull Object payload) {
        final long value = number(kind, payload).longValue();
        return kind.getWidth() == Long.SIZE ? value : value & ((1L << kind.getWidth()) - 1);
    }

    private static double floating(@Nonnull OptionalKind kind, @Nonnull Object payload) {
        final Number number = number(kind, payload);
        return kind == OptionalKind.FLOAT32 ? (double)number.floatValue() : number.doubleValue();
    }

    @Nonnull
    private static Number number(@Nonnull OptionalKind kind, @Nonnull Object payload) {
        if (payload instanceof Number) {
            return (Number)payload;
        }
        throw mismatch(kind, payload);
    }

    @Nonnull
    private static UnsupportedValueKindException mismatch(@Nonnull OptionalKind kind, @Nullable Object payload) {
        return new UnsupportedValueKindException("optional payload does not match its kind",
                LogMessageKeys.OPTIONAL_KIND, kind,
                LogMessageKeys.PAYLOAD_CLASS, payload == null ? "null" : payload.getClass().getName());
    }
}
