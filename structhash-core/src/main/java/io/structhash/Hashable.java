/*
 * Hashable.java
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

/**
 * Implemented by record types that compute their own hash. When a value implements this interface its fields are not
 * traversed at all; the digest receives the decimal text of {@link #structHash()} instead.
 *
 * <p>
 * The returned value is treated as an unsigned 64-bit number.
 * </p>
 */
@API(API.Status.STABLE)
public interface Hashable {
    /**
     * Compute the hash that stands in for this value.
     * @return the hash
     * @throws RuntimeException to abort the digest; the exception surfaces as a {@link HookFailedException}
     */
    long structHash();
}
