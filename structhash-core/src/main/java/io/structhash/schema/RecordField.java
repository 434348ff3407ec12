/*
 * RecordField.java
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

package io.structhash.schema;

import io.structhash.annotation.API;
import io.structhash.annotation.HashFieldOption;
import com.google.common.reflect.TypeToken;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.lang.reflect.Type;

/**
 * One visible field of a {@link RecordSchema}: its name, declared type, hashing option and accessor.
 */
@API(API.Status.UNSTABLE)
public final class RecordField {
    @Nonnull
    private final String name;
    @Nonnull
    private final Type type;
    @Nullable
    private final HashFieldOption option;
    @Nonnull
    private final FieldAccessor<Object> accessor;

    RecordField(@Nonnull String name, @Nonnull Type type, @Nullable HashFieldOption option,
                @Nonnull FieldAccessor<Object> accessor) {
        this.name = name;
        this.type = type;
        this.option = option;
        this.accessor = accessor;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * Get the declared type, including generic arguments where known.
     * @return the declared type
     */
    @Nonnull
    public Type getType() {
        return type;
    }

    @Nonnull
    public Class<?> getRawType() {
        return TypeToken.of(type).getRawType();
    }

    @Nullable
    public HashFieldOption getOption() {
        return option;
    }

    public boolean hasOption(@Nonnull HashFieldOption candidate) {
        return option == candidate;
    }

    /**
     * Read this field from a record.
     * @param record an instance of the schema's record class
     * @return the field value
     */
    @Nullable
    public Object get(@Nonnull Object record) {
        return accessor.get(record);
    }

    @Override
    public String toString() {
        return option == null ? name : name + "[" + option.getTag() + "]";
    }
}
