/*
 * HookFailedException.java
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
 * A {@link Hashable}, {@link FieldFilter} or {@link MapEntryFilter} implementation threw, or the constructor building
 * the zero instance of such a type did. The original exception is the cause.
 */
@API(API.Status.STABLE)
public class HookFailedException extends StructHashException {
    private static final long serialVersionUID = 1;

    public HookFailedException(@Nonnull String msg, @Nonnull Throwable cause) {
        super(msg, cause);
    }
}
