/*
 * FieldFilter.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Implemented by record types that decide per field whether it takes part in the digest. The filter sees each
 * visible, non-ignored field once, after any string rendering.
 */
@API(API.Status.STABLE)
public interface FieldFilter {
    /**
     * Decide whether a field is hashed.
     * @param fieldName the field name as recorded in the schema
     * @param fieldValue the value about to be hashed
     * @return {@code true} to include the field
     */
    boolean includeField(@Nonnull String fieldName, @Nullable Object fieldValue);
}
