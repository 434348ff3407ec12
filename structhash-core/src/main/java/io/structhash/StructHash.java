/*
 * StructHash.java
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

package io.structhash;

import io.structhash.annotation.API;
import io.structhash.logging.KeyValueLogMessage;
import io.structhash.logging.LogMessageKeys;
import io.structhash.walk.ValueWalker;
import com.google.common.hash.HashCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Entry point for computing structural hashes.
 *
 * <p>
 * A structural hash depends only on the shape and content of a value graph: two values that are structurally equal
 * produce the same digest even if their maps iterate in a different order. Which fields take part, and how, is
 * controlled by {@link io.structhash.annotation.HashField} annotations and by {@link HashOptions}.
 * </p>
 *
 * <pre>{@code
 * byte[] digest = StructHash.hash(order, HashFormat.SHA_256, HashOptions.newBuilder().setZeroNil(true).build());
 * }</pre>
 *
 * <p>
 * Hashing is synchronous and keeps no state between calls, so this class can be used from any number of threads.
 * Cyclic value graphs are not detected.
 * </p>
 *
 * <p>
 * When nil and zero are equivalent ({@link HashOptions#isZeroNil()}), a {@code null} record is hashed as the zero
 * record of its declared type, except where that type is already being walked: a {@code null} reference from a
 * self-referential type back to itself contributes nothing. Such a reference therefore does not hash like a present
 * zero instance. With {@code Node{long val; Node left}}, {@code left = null} and {@code left = new Node()} differ.
 * </p>
 */
@API(API.Status.STABLE)
public final class StructHash {
    private static final Logger LOGGER = LoggerFactory.getLogger(StructHash.class);

    private StructHash() {
    }

    /**
     * Compute the structural hash of a value.
     * @param value the value to hash; may be {@code null}
     * @param format the digest to compute
     * @param options the options to hash with, or {@code null} for {@link HashOptions#DEFAULT}
     * @return the digest bytes, {@link HashFormat#getDigestLength()} long
     * @throws InvalidFormatException if {@code format} is {@code null}
     * @throws StructHashException if the value cannot be hashed
     */
    @Nonnull
    public static byte[] hash(@Nullable Object value, @Nullable HashFormat format, @Nullable HashOptions options) {
        if (format == null) {
            throw new InvalidFormatException("hash format must be set", LogMessageKeys.FORMAT_CODE, 0);
        }
        final HashOptions resolved = options == null ? HashOptions.DEFAULT : options;
        final byte[] digest = ValueWalker.digest(value, format, resolved);
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace(KeyValueLogMessage.of("computed structural hash",
                    LogMessageKeys.HASH_FORMAT, format,
                    LogMessageKeys.VALUE_CLASS, value == null ? "null" : value.getClass().getName(),
                    LogMessageKeys.DIGEST_LENGTH, digest.length));
        }
        return digest;
    }

    @Nonnull
    public static byte[] hash(@Nullable Object value, @Nullable HashFormat format) {
        return hash(value, format, null);
    }

    /**
     * Compute the structural hash of a value, selecting the digest by its numeric code.
     * @param value the value to hash
     * @param formatCode the {@link HashFormat#getCode() code} of the digest
     * @param options the options to hash with, or {@code null} for the defaults
     * @return the digest bytes
     * @throws InvalidFormatException if no digest has the given code
     */
    @Nonnull
    public static byte[] hash(@Nullable Object value, int formatCode, @Nullable HashOptions options) {
        return hash(value, HashFormat.forCode(formatCode), options);
    }

    @Nonnull
    public static HashCode hashCode(@Nullable Object value, @Nullable HashFormat format,
                                    @Nullable HashOptions options) {
        return HashCode.fromBytes(hash(value, format, options));
    }

    @Nonnull
    public static HashCode hashCode(@Nullable Object value, @Nullable HashFormat format) {
        return hashCode(value, format, null);
    }
}
