/*
 * OptionalValue.java
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
import javax.annotation.Nullable;

/**
 * Adapter through which a typed optional value is hashed. Implement it on the optional types of a third-party family
 * (or on a thin view over them) to have them hashed by kind instead of traversed as records.
 *
 * <p>
 * Payload expectations per {@link OptionalKind.Family}: {@code TEXT} kinds accept any value and use its text
 * ({@link Throwable#getMessage()} for {@link OptionalKind#ERROR}); {@code BOOLEAN} expects a {@link Boolean};
 * numeric kinds expect a {@link Number}.
 * </p>
 */
@API(API.Status.STABLE)
public interface OptionalValue {
    @Nonnull
    OptionalKind getOptionalKind();

    boolean isPresent();

    /**
     * Get the payload.
     * @return the payload, or {@code null} when not {@link #isPresent() present}
     */
    @Nullable
    Object getValue();
}
