/*
 * OptionalKind.java
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

import javax.annotation.Nonnull;

/**
 * The closed set of optional-value kinds the hashing engine knows how to unbox. The kind fixes how a present payload
 * is encoded and what its zero value is.
 */
@API(API.Status.STABLE)
public enum OptionalKind {
    STRING(Family.TEXT, 0),
    ERROR(Family.TEXT, 0),
    BOOLEAN(Family.BOOLEAN, 1),
    INT8(Family.SIGNED, 8),
    INT16(Family.SIGNED, 16),
    INT32(Family.SIGNED, 32),
    INT64(Family.SIGNED, 64),
    UINT8(Family.UNSIGNED, 8),
    UINT16(Family.UNSIGNED, 16),
    UINT32(Family.UNSIGNED, 32),
    UINT64(Family.UNSIGNED, 64),
    FLOAT32(Family.FLOATING_POINT, 32),
    FLOAT64(Family.FLOATING_POINT, 64);

    /**
     * How payloads of a kind are encoded.
     */
    public enum Family {
        TEXT,
        BOOLEAN,
        SIGNED,
        UNSIGNED,
        FLOATING_POINT
    }

    @Nonnull
    private final Family family;
    private final int width;

    OptionalKind(@Nonnull Family family, int width) {
        this.family = family;
        this.width = width;
    }

    @Nonnull
    public Family getFamily() {
        return family;
    }

    /**
     * Get the width of the payload in bits; {@code 0} for text kinds.
     * @return the width
     */
    public int getWidth() {
        return width;
    }
}
