/*
 * StructHashException.java
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
import io.structhash.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base class of every error raised while computing a digest. An error always aborts the whole
 * {@link StructHash#hash} call; no partial digest is returned.
 */
@API(API.Status.STABLE)
public class StructHashException extends LoggableException {
    private static final long serialVersionUID = 1;

    public StructHashException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public StructHashException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }
}
