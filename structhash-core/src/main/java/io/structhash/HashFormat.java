/*
 * HashFormat.java
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
import io.structhash.logging.LogMessageKeys;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * The digest algorithms a structural hash can be computed with. The set is closed; each format has a stable numeric
 * code for callers that persist or transmit their choice. Code {@code 0} is reserved as "unset" and never valid.
 */
@API(API.Status.STABLE)
public enum HashFormat {
    /**
     * 128-bit MD5. Matches the digests of earlier versions of this algorithm.
     */
    @SuppressWarnings("deprecation") // MD5 is kept for digest compatibility, not for security
    MD5(1, Hashing::md5),
    /**
     * 256-bit SHA-2.
     */
    SHA_256(2, Hashing::sha256),
    /**
     * 128-bit MurmurHash3, seed 0. Much faster, not cryptographic.
     */
    MURMUR3_128(3, Hashing::murmur3_128),
    /**
     * 64-bit FarmHash fingerprint. Fastest, not cryptographic, shortest output.
     */
    FARMHASH_FINGERPRINT_64(4, Hashing::farmHashFingerprint64);

    private final int code;
    @Nonnull
    private final Supplier<HashFunction> hashFunction;

    HashFormat(int code, @Nonnull Supplier<HashFunction> hashFunction) {
        this.code = code;
        this.hashFunction = hashFunction;
    }

    public int getCode() {
        return code;
    }

    @Nonnull
    public HashFunction getHashFunction() {
        return hashFunction.get();
    }

    /**
     * Get the length of the digests produced by this format.
     * @return the digest length in bytes
     */
    public int getDigestLength() {
        return getHashFunction().bits() / Byte.SIZE;
    }

    /**
     * Look up a format by its numeric code.
     * @param code the code
     * @return the format
     * @throws InvalidFormatException if the code is {@code 0} or does not name a format
     */
    @Nonnull
    public static HashFormat forCode(int code) {
        for (HashFormat format : values()) {
            if (format.code == code) {
                return format;
            }
        }
        throw new InvalidFormatException("invalid hash format", LogMessageKeys.FORMAT_CODE, code);
    }
}
