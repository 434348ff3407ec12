/*
 * HashState.java
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

import io.structhash.HashFormat;
import io.structhash.HashOptions;
import com.google.common.hash.Hasher;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * The state of one traversal: the live {@link Hasher}, the options it runs with, and the record types on the current
 * path. Never shared; independent sub-digests get a state of their own from {@link #newIndependent()}.
 */
final class HashState {
    @Nonnull
    private final HashFormat format;
    @Nonnull
    private final HashOptions options;
    @Nonnull
    private final Hasher hasher;
    @Nonnull
    private final Deque<Class<?>> recordPath = new ArrayDeque<>();

    HashState(@Nonnull HashFormat format, @Nonnull HashOptions options) {
        this.format = format;
        this.options = options;
        this.hasher = format.getHashFunction().newHasher();
    }

    @Nonnull
    HashState newIndependent() {
        return new HashState(format, options);
    }

    @Nonnull
    HashOptions getOptions() {
        return options;
    }

    @Nonnull
    Hasher getHasher() {
        return hasher;
    }

    void enterRecord(@Nonnull Class<?> recordClass) {
        recordPath.push(recordClass);
    }

    void exitRecord() {
        recordPath.pop();
    }

    boolean isOnRecordPath(@Nonnull Class<?> recordClass) {
        return recordPath.contains(recordClass);
    }

    @Nonnull
    byte[] finish() {
        return hasher.hash().asBytes();
    }
}
