/*
 * RecordSchema.java
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
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.lang.reflect.Type;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The hashing view of one record type: the name written into the digest and the ordered list of visible fields with
 * their options. Fields that are not part of the schema never influence a digest.
 *
 * <p>
 * Schemas are normally derived by reflection (see {@link RecordSchemaRegistry}). A schema can also be declared
 * explicitly, which is how types with private state or a stable name independent of the Java class name are hashed:
 * </p>
 *
 * <pre>{@code
 * RecordSchema<Order> schema = RecordSchema.newBuilder(Order.class)
 *         .setTypeName("order")
 *         .addField("id", String.class, Order::getId, HashFieldOption.IGNORE)
 *         .addField("lines", new TypeToken<List<Line>>() { }.getType(), Order::getLines)
 *         .build();
 * }</pre>
 *
 * @param <T> the record type
 */
@API(API.Status.UNSTABLE)
public final class RecordSchema<T> {
    @Nonnull
    private final Class<T> recordClass;
    @Nonnull
    private final String typeName;
    @Nonnull
    private final List<RecordField> fields;

    private RecordSchema(@Nonnull Class<T> recordClass, @Nonnull String typeName, @Nonnull List<RecordField> fields) {
        this.recordClass = recordClass;
        this.typeName = typeName;
        this.fields = fields;
    }

    @Nonnull
    public Class<T> getRecordClass() {
        return recordClass;
    }

    /**
     * Get the name written into the digest ahead of the fields.
     * @return the type name
     */
    @Nonnull
    public String getTypeName() {
        return typeName;
    }

    @Nonnull
    public List<RecordField> getFields() {
        return fields;
    }

    @Override
    public String toString() {
        return typeName + fields;
    }

    @Nonnull
    public static <T> Builder<T> newBuilder(@Nonnull Class<T> recordClass) {
        return new Builder<>(recordClass);
    }

    /**
     * Builder for {@link RecordSchema}. Fields are hashed in the order they are added.
     * @param <T> the record type
     */
    public static class Builder<T> {
        @Nonnull
        private final Class<T> recordClass;
        @Nonnull
        private String typeName;
        @Nonnull
        private final ImmutableList.Builder<RecordField> fields = ImmutableList.builder();
        @Nonnull
        private final Set<String> fieldNames = new HashSet<>();

        private Builder(@Nonnull Class<T> recordClass) {
            this.recordClass = recordClass;
            this.typeName = recordClass.getSimpleName();
        }

        @Nonnull
        public Builder<T> setTypeName(@Nonnull String typeName) {
            this.typeName = typeName;
            return this;
        }

        @Nonnull
        public Builder<T> addField(@Nonnull String name, @Nonnull Type type, @Nonnull FieldAccessor<? super T> accessor) {
            return addField(name, type, accessor, (HashFieldOption)null);
        }

        /**
         * Add a field whose option is given in textual form, one of {@code ignore}, {@code -}, {@code set} or
         * {@code string}.
         * @param name the field name
         * @param type the declared type
         * @param accessor reads the field
         * @param tag the textual option, or {@code null} for none
         * @return this builder
         */
        @Nonnull
        public Builder<T> addField(@Nonnull String name, @Nonnull Type type, @Nonnull FieldAccessor<? super T> accessor,
                                   @Nullable String tag) {
            return addField(name, type, accessor, HashFieldOption.fromTag(tag));
        }

        @Nonnull
        public Builder<T> addField(@Nonnull String name, @Nonnull Type type, @Nonnull FieldAccessor<? super T> accessor,
                                   @Nullable HashFieldOption option) {
            if (!fieldNames.add(name)) {
                throw new IllegalArgumentException("duplicate field " + name + " in schema of " + recordClass.getName());
            }
            fields.add(new RecordField(name, type, option, record -> accessor.get(recordClass.cast(record))));
            return this;
        }

        @Nonnull
        public RecordSchema<T> build() {
            return new RecordSchema<>(recordClass, typeName, fields.build());
        }
    }
}
