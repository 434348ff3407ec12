/*
 * PrimitiveEncoder.java
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

import io.structhash.UnsupportedValueKindException;
import io.structhash.logging.LogMessageKeys;
import com.google.common.collect.ImmutableSet;
import com.google.common.hash.Hasher;
import com.google.common.primitives.Primitives;
import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;

import javax.annotation.Nonnull;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.UUID;

/**
 * Fixed-width encodings of scalar values. Guava's {@link Hasher} writes multi-byte primitives little-endian, which is
 * the byte order every encoding here relies on. Text carries no length prefix.
 */
final class PrimitiveEncoder {
    private static final ImmutableSet<Class<?>> SCALAR_TYPES = ImmutableSet.of(
            Boolean.class, Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
            Character.class, String.class, BigInteger.class, BigDecimal.class,
            UnsignedInteger.class, UnsignedLong.class, UUID.class,
            Instant.class, OffsetDateTime.class, ZonedDateTime.class,
            LocalDate.class, LocalTime.class, LocalDateTime.class, Duration.class);

    /**
     * Written where an untyped null stands: the encoding of the signed 64-bit zero.
     */
    private static final long NIL_MARKER = 0L;

    private PrimitiveEncoder() {
    }

    static boolean isScalarType(@Nonnull Class<?> type) {
        final Class<?> wrapped = Primitives.wrap(type);
        return SCALAR_TYPES.contains(wrapped)
               || CharSequence.class.isAssignableFrom(wrapped)
               || Enum.class.isAssignableFrom(wrapped)
               || Date.class.isAssignableFrom(wrapped);
    }

    static void writeNil(@Nonnull Hasher hasher) {
        hasher.putLong(NIL_MARKER);
    }

    static void writeText(@Nonnull Hasher hasher, @Nonnull CharSequence text) {
        hasher.putString(text, StandardCharsets.UTF_8);
    }

    static void writeBoolean(@Nonnull Hasher hasher, boolean value) {
        hasher.putByte(value ? (byte)1 : (byte)0);
    }

    static void writeDouble(@Nonnull Hasher hasher, double value) {
        hasher.putLong(Double.doubleToLongBits(value));
    }

    static void write(@Nonnull Hasher hasher, @Nonnull Object value) {
        if (value instanceof Boolean) {
            writeBoolean(hasher, (Boolean)value);
        } else if (value instanceof Float || value instanceof Double) {
            writeDouble(hasher, ((Number)value).doubleValue());
        } else if (value instanceof Byte || value instanceof Short || value instanceof Integer
                   || value instanceof Long || value instanceof UnsignedInteger || value instanceof UnsignedLong) {
            // UnsignedLong.longValue() returns the raw bits
            hasher.putLong(((Number)value).longValue());
        } else if (value instanceof CharSequence) {
            writeText(hasher, (CharSequence)value);
        } else if (value instanceof Character) {
            writeText(hasher, String.valueOf((char)(Character)value));
        } else if (value instanceof Enum<?>) {
            writeText(hasher, ((Enum<?>)value).name());
        } else if (value instanceof BigInteger) {
            hasher.putBytes(((BigInteger)value).toByteArray());
        } else if (value instanceof BigDecimal) {
            final BigDecimal decimal = (BigDecimal)value;
            hasher.putBytes(decimal.unscaledValue().toByteArray());
            hasher.putLong(decimal.scale());
        } else if (value instanceof UUID) {
            final UUID uuid = (UUID)value;
            hasher.putLong(uuid.getMostSignificantBits());
            hasher.putLong(uuid.getLeastSignificantBits());
        } else if (value instanceof Instant) {
            final Instant instant = (Instant)value;
            writeTimestamp(hasher, instant.getEpochSecond(), instant.getNano(), 0);
        } else if (value instanceof OffsetDateTime) {
            final OffsetDateTime dateTime = (OffsetDateTime)value;
            writeTimestamp(hasher, dateTime.toEpochSecond(), dateTime.getNano(), dateTime.getOffset().getTotalSeconds());
        } else if (value instanceof ZonedDateTime) {
            final ZonedDateTime dateTime = (ZonedDateTime)value;
            writeTimestamp(hasher, dateTime.toEpochSecond(), dateTime.getNano(), dateTime.getOffset().getTotalSeconds());
        } else if (value instanceof Date) {
            // java.sql.Date does not support toInstant()
            final Instant instant = Instant.ofEpochMilli(((Date)value).getTime());
            writeTimestamp(hasher, instant.getEpochSecond(), instant.getNano(), 0);
        } else if (value instanceof LocalDate) {
            hasher.putLong(((LocalDate)value).toEpochDay());
        } else if (value instanceof LocalTime) {
            hasher.putLong(((LocalTime)value).toNanoOfDay());
        } else if (value instanceof LocalDateTime) {
            final LocalDateTime dateTime = (LocalDateTime)value;
            hasher.putLong(dateTime.toLocalDate().toEpochDay());
            hasher.putLong(dateTime.toLocalTime().toNanoOfDay());
        } else if (value instanceof Duration) {
            final Duration duration = (Duration)value;
            hasher.putLong(duration.getSeconds());
            hasher.putInt(duration.getNano());
        } else {
            throw new UnsupportedValueKindException("value is not a scalar",
                    LogMessageKeys.VALUE_CLASS, value.getClass().getName());
        }
    }

    private static void writeTimestamp(@Nonnull Hasher hasher, long epochSecond, int nano, int offsetSeconds) {
        hasher.putLong(epochSecond);
        hasher.putInt(nano);
        hasher.putInt(offsetSeconds);
    }
}
