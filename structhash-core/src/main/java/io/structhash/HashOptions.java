/*
 * HashOptions.java
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
import io.structhash.annotation.HashField;
import io.structhash.schema.RecordSchemaRegistry;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Options for a structural hash. Instances are immutable and may be shared between threads and calls.
 *
 * <p>
 * All boolean options default to {@code false}, the tag name defaults to {@value HashField#DEFAULT_TAG}, and record
 * schemas are derived reflectively.
 * </p>
 */
@API(API.Status.STABLE)
public final class HashOptions {
    public static final HashOptions DEFAULT = newBuilder().build();

    @Nonnull
    private final String tagName;
    private final boolean zeroNil;
    private final boolean ignoreZeroValue;
    private final boolean slicesAsSets;
    private final boolean useStringer;
    @Nonnull
    private final RecordSchemaRegistry schemaRegistry;

    private HashOptions(@Nonnull Builder builder) {
        this.tagName = builder.tagName;
        this.zeroNil = builder.zeroNil;
        this.ignoreZeroValue = builder.ignoreZeroValue;
        this.slicesAsSets = builder.slicesAsSets;
        this.useStringer = builder.useStringer;
        this.schemaRegistry = builder.schemaRegistry;
    }

    /**
     * Get the tag name selecting which {@link HashField} annotations apply.
     * @return the tag name
     */
    @Nonnull
    public String getTagName() {
        return tagName;
    }

    /**
     * Whether a null reference hashes the same as the zero value of its declared type.
     * @return {@code true} if null and zero are equivalent
     */
    public boolean isZeroNil() {
        return zeroNil;
    }

    /**
     * Whether record fields holding a zero value are left out of the digest.
     * @return {@code true} if zero-valued fields are skipped
     */
    public boolean isIgnoreZeroValue() {
        return ignoreZeroValue;
    }

    /**
     * Whether every sequence is hashed as if its field were tagged {@link io.structhash.annotation.HashFieldOption#SET}.
     * @return {@code true} if sequence order never matters
     */
    public boolean isSlicesAsSets() {
        return slicesAsSets;
    }

    /**
     * Whether record-like field values are always hashed through their own {@link Object#toString()} when they have
     * one. An explicit {@link io.structhash.annotation.HashFieldOption#STRING} tag still fails on values without one.
     * @return {@code true} if text rendering is preferred
     */
    public boolean isUseStringer() {
        return useStringer;
    }

    @Nonnull
    public RecordSchemaRegistry getSchemaRegistry() {
        return schemaRegistry;
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final HashOptions that = (HashOptions) o;
        return zeroNil == that.zeroNil
               && ignoreZeroValue == that.ignoreZeroValue
               && slicesAsSets == that.slicesAsSets
               && useStringer == that.useStringer
               && tagName.equals(that.tagName)
               && schemaRegistry.equals(that.schemaRegistry);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tagName, zeroNil, ignoreZeroValue, slicesAsSets, useStringer, schemaRegistry);
    }

    @Override
    public String toString() {
        return "HashOptions{tagName=" + tagName
               + ", zeroNil=" + zeroNil
               + ", ignoreZeroValue=" + ignoreZeroValue
               + ", slicesAsSets=" + slicesAsSets
               + ", useStringer=" + useStringer + "}";
    }

    /**
     * Builder for {@link HashOptions}.
     */
    public static class Builder {
        @Nonnull
        private String tagName = HashField.DEFAULT_TAG;
        private boolean zeroNil;
        private boolean ignoreZeroValue;
        private boolean slicesAsSets;
        private boolean useStringer;
        @Nonnull
        private RecordSchemaRegistry schemaRegistry = RecordSchemaRegistry.reflective();

        private Builder() {
        }

        private Builder(@Nonnull HashOptions options) {
            this.tagName = options.tagName;
            this.zeroNil = options.zeroNil;
            this.ignoreZeroValue = options.ignoreZeroValue;
            this.slicesAsSets = options.slicesAsSets;
            this.useStringer = options.useStringer;
            this.schemaRegistry = options.schemaRegistry;
        }

        /**
         * Set the tag name. An empty name restores the default.
         * @param tagName the tag name
         * @return this builder
         */
        @Nonnull
        public Builder setTagName(@Nonnull String tagName) {
            this.tagName = tagName.isEmpty() ? HashField.DEFAULT_TAG : tagName;
            return this;
        }

        @Nonnull
        public Builder setZeroNil(boolean zeroNil) {
            this.zeroNil = zeroNil;
            return this;
        }

        @Nonnull
        public Builder setIgnoreZeroValue(boolean ignoreZeroValue) {
            this.ignoreZeroValue = ignoreZeroValue;
            return this;
        }

        @Nonnull
        public Builder setSlicesAsSets(boolean slicesAsSets) {
            this.slicesAsSets = slicesAsSets;
            return this;
        }

        @Nonnull
        public Builder setUseStringer(boolean useStringer) {
            this.useStringer = useStringer;
            return this;
        }

        @Nonnull
        public Builder setSchemaRegistry(@Nonnull RecordSchemaRegistry schemaRegistry) {
            this.schemaRegistry = schemaRegistry;
            return this;
        }

        @Nonnull
        public HashOptions build() {
            return new HashOptions(this);
        }
    }
}
