/*
 * ZeroValues.java
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

import io.structhash.optional.OptionalAdapters;
import io.structhash.optional.OptionalValue;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multimap;
import com.google.common.primitives.Primitives;
import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Zero values of scalar types, and the zero test used when zero-valued fields are skipped.
 */
final class ZeroValues {
    private static final ImmutableMap<Class<?>, Object> ZEROS = ImmutableMap.<Class<?>, Object>builder()
            .put(Boolean.class, Boolean.FALSE)
            .put(Byte.class, (byte)0)
            .put(Short.class, (short)0)
            .put(Integer.class, 0)
            .put(Long.class, 0L)
            .put(Float.class, 0.0f)
            .put(Double.class, 0.0d)
            .put(Character.class, '\0')
            .put(String.class, "")
            .put(BigInteger.class, BigInteger.ZERO)
            .put(BigDecimal.class, BigDecimal.ZERO)
            .put(UnsignedInteger.class, UnsignedInteger.ZERO)
            .put(UnsignedLong.class, UnsignedLong.ZERO)
            .put(UUID.class, new UUID(0L, 0L))
            .put(Instant.class, Instant.EPOCH)
            .put(OffsetDateTime.class, OffsetDateTime.ofInstant(Instant.EPOCH, ZoneOffset.UTC))
            .put(ZonedDateTime.class, ZonedDateTime.ofInstant(Instant.EPOCH, ZoneOffset.UTC))
            .put(LocalDate.class, LocalDate.EPOCH)
            .put(LocalTime.class, LocalTime.MIDNIGHT)
            .put(LocalDateTime.class, LocalDateTime.of(LocalDate.EPOCH, LocalTime.MIDNIGHT))
            .put(Duration.class, Duration.ZERO)
            .build();

    private ZeroValues() {
    }

    /**
     * Get the zero value of a scalar type.
     * @param type a scalar type, primitive or boxed
     * @return the zero, or {@code null} if the type has none (enums)
     */
    @Nullable
    static Object zeroOf(@Nonnull Class<?> type) {
        final Class<?> wrapped = Primitives.wrap(type);
        final Object zero = ZEROS.get(wrapped);
        if (zero != null) {
            return zero;
        }
        if (CharSequence.class.isAssignableFrom(wrapped)) {
            return "";
        }
        if (Date.class.isAssignableFrom(wrapped)) {
            return new Date(0L);
        }
        return null;
    }

    /**
     * The value a field of the given type holds in a zero record: primitives have their zero, references are null.
     */
    @Nullable
    static Object zeroFieldValue(@Nonnull Class<?> type) {
        return type.isPrimitive() ? zeroOf(type) : null;
    }

    static boolean isZero(@Nullable Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Optional<?>) {
            return ((Optional<?>)value).isEmpty();
        }
        if (value instanceof com.google.common.base.Optional<?>) {
            return !((com.google.common.base.Optional<?>)value).isPresent();
        }
        final OptionalValue optional = OptionalAdapters.adapt(value);
        if (optional != null) {
            return !optional.isPresent() || optional.getValue() == null;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence)value).length() == 0;
        }
        if (value instanceof Collection<?>) {
            return ((Collection<?>)value).isEmpty();
        }
        if (value instanceof Map<?, ?>) {
            return ((Map<?, ?>)value).isEmpty();
        }
        if (value instanceof Multimap<?, ?>) {
            return ((Multimap<?, ?>)value).isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        final Object zero = zeroOf(value.getClass());
        return zero != null && zero.equals(value);
    }
}
