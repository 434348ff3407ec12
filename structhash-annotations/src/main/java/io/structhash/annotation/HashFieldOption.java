/*
 * HashFieldOption.java
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

package io.structhash.annotation;

import java.util.Locale;

/**
 * The closed set of per-field hashing behaviors. Each field of a record carries at most one option per tag name.
 */
@API(API.Status.STABLE)
public enum HashFieldOption {
    /**
     * The field never contributes to the digest. Written {@code ignore} or {@code -} in textual form.
     */
    IGNORE("ignore", "-"),
    /**
     * The field holds a sequence whose element order does not matter.
     */
    SET("set"),
    /**
     * The field is hashed through its {@link Object#toString()} rendering. Hashing fails if the value does not
     * provide one of its own.
     */
    STRING("string");

    private final String[] tags;

    HashFieldOption(String... tags) {
        this.tags = tags;
    }

    /**
     * Get the canonical textual tag of this option.
     * @return the tag, such as {@code "ignore"}
     */
    public String getTag() {
        return tags[0];
    }

    /**
     * Parse a textual field tag.
     * @param tag the tag text; {@code null} or empty means no option
     * @return the matching option or {@code null} if the tag is empty
     * @throws IllegalArgumentException if the tag is not recognized
     */
    public static HashFieldOption fromTag(String tag) {
        if (tag == null || tag.isEmpty()) {
            return null;
        }
        final String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (HashFieldOption option : values()) {
            for (String candidate : option.tags) {
                if (candidate.equals(normalized)) {
                    return option;
                }
            }
        }
        throw new IllegalArgumentException("unknown hash field tag: " + tag);
    }
}
