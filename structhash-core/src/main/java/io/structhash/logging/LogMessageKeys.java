/*
 * LogMessageKeys.java
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

package io.structhash.logging;

import io.structhash.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Keys used in {@link KeyValueLogMessage}s and in the log info of StructHash exceptions.
 * Keeping them in one place makes collisions and spelling drift easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    TITLE("ttl"),
    // orchestration
    HASH_FORMAT,
    FORMAT_CODE,
    DIGEST_LENGTH,
    VALUE_CLASS,
    // schemas
    TYPE_NAME,
    RECORD_CLASS,
    FIELD_NAME,
    FIELD_COUNT,
    TAG_NAME,
    SCHEMA_COUNT,
    // hooks
    HOOK,
    // optional values
    OPTIONAL_KIND,
    PAYLOAD_CLASS;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
