/*
 * NotStringRenderableException.java
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

/**
 * A field tagged {@link io.structhash.annotation.HashFieldOption#STRING} holds a value whose class does not provide
 * its own {@link Object#toString()}.
 */
@API(API.Status.STABLE)
public class NotStringRenderableException extends StructHashException {
    private static final long serialVersionUID = 1;

    @Nonnull
    private final String field;

    public NotStringRenderableException(@Nonnull String field, @Nonnull Object... keyValues) {
        super("field is tagged string but its value cannot be rendered as text", keyValues);
        this.field = field;
    }

    @Nonnull
    public String getField() {
        return field;
    }
}
