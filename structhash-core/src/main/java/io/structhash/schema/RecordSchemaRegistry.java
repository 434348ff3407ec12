/*
 * RecordSchemaRegistry.java
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
import io.structhash.logging.KeyValueLogMessage;
import io.structhash.logging.LogMessageKeys;
import com.google.common.base.Throwables;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the {@link RecordSchema} of a record class. Explicitly registered schemas win; every other class gets a
 * schema derived by reflection, computed once per class and tag name and shared by all registries.
 *
 * <p>
 * Registries are immutable and safe to share between threads.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class RecordSchemaRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecordSchemaRegistry.class);

    private static final LoadingCache<SchemaKey, RecordSchema<?>> DERIVED_SCHEMAS = CacheBuilder.newBuilder()
            .maximumSize(10_000)
            .build(new CacheLoader<SchemaKey, RecordSchema<?>>() {
                @Override
                public RecordSchema<?> load(@Nonnull SchemaKey key) {
                    return ReflectiveSchemas.derive(key.recordClass, key.tagName);
                }
            });

    private static final RecordSchemaRegistry REFLECTIVE = new RecordSchemaRegistry(ImmutableMap.of());

    @Nonnull
    private final ImmutableMap<Class<?>, RecordSchema<?>> registered;

    private RecordSchemaRegistry(@Nonnull ImmutableMap<Class<?>, RecordSchema<?>> registered) {
        this.registered = registered;
    }

    /**
     * Get the registry without explicit schemas.
     * @return a registry that derives every schema reflectively
     */
    @Nonnull
    public static RecordSchemaRegistry reflective() {
        return REFLECTIVE;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Get the schema of a record class.
     * @param recordClass the class of the record being hashed
     * @param tagName the tag name selecting which field annotations apply; ignored for registered schemas
     * @return the schema
     */
    @Nonnull
    public RecordSchema<?> getSchema(@Nonnull Class<?> recordClass, @Nonnull String tagName) {
        final RecordSchema<?> schema = registered.get(recordClass);
        if (schema != null) {
            return schema;
        }
        try {
            return DERIVED_SCHEMAS.getUnchecked(new SchemaKey(recordClass, tagName));
        } catch (UncheckedExecutionException e) {
            Throwables.throwIfUnchecked(e.getCause());
            throw e;
        }
    }

    public boolean isRegistered(@Nonnull Class<?> recordClass) {
        return registered.containsKey(recordClass);
    }

    @Nullable
    public RecordSchema<?> getRegisteredSchema(@Nonnull Class<?> recordClass) {
        return registered.get(recordClass);
    }

    /**
     * Builder for {@link RecordSchemaRegistry}.
     */
    public static class Builder {
        @Nonnull
        private final Map<Class<?>, RecordSchema<?>> schemas = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Register a schema. Registering a second schema for the same class replaces the first.
         * @param schema the schema
         * @return this builder
         */
        @Nonnull
        public Builder register(@Nonnull RecordSchema<?> schema) {
            schemas.put(schema.getRecordClass(), schema);
            return this;
        }

        @Nonnull
        public RecordSchemaRegistry build() {
            if (schemas.isEmpty()) {
                return REFLECTIVE;
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("built record schema registry",
                        LogMessageKeys.SCHEMA_COUNT, schemas.size()));
            }
            return new RecordSchemaRegistry(ImmutableMap.copyOf(schemas));
        }
    }

    private static final class SchemaKey {
        @Nonnull
        private final Class<?> recordClass;
        @Nonnull
        private final String tagName;

        SchemaKey(@Nonnull Class<?> recordClass, @Nonnull String tagName) {
            this.recordClass = recordClass;
            this.tagName = tagName;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof SchemaKey)) {
                return false;
            }
            final SchemaKey that = (SchemaKey) o;
            return recordClass.equals(that.recordClass) && tagName.equals(that.tagName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(recordClass, tagName);
        }
    }
}
