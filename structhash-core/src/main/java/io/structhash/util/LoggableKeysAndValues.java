/*
 * LoggableKeysAndValues.java
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

package io.structhash.util;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Something that carries structured key/value pairs for logging.
 * @param <T> the implementing type, returned from the fluent mutators
 */
public interface LoggableKeysAndValues<T extends LoggableKeysAndValues<T>> {

    /**
     * Get the attached pairs.
     * @return an unmodifiable view of the log information, in insertion order
     */
    @Nonnull
    Map<String, Object> getLogInfo();

    /**
     * Attach one pair.
     * @param description the key
     * @param object the value
     * @return this object
     */
    @Nonnull
    T addLogInfo(@Nonnull String description, Object object);

    /**
     * Attach a flattened list of pairs, keys at even positions and values at odd ones,
     * for example <code>["k0", "v0", "k1", "v1"]</code>.
     * @param keyValue flattened pairs
     * @return this object
     * @throws IllegalArgumentException if <code>keyValue</code> has odd length
     */
    @Nonnull
    T addLogInfo(@Nonnull Object... keyValue);

    /**
     * Flatten the attached pairs into the format accepted by {@link #addLogInfo(Object...)}.
     * @return flattened pairs
     */
    @Nonnull
    Object[] exportLogInfo();
}
