/*
 * RecordWalker.java
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

import io.structhash.FieldFilter;
import io.structhash.HashOptions;
import io.structhash.Hashable;
import io.structhash.NotStringRenderableException;
import io.structhash.annotation.HashFieldOption;
import io.structhash.logging.LogMessageKeys;
import io.structhash.schema.RecordField;
import io.structhash.schema.RecordSchema;
import com.google.common.hash.Hasher;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.lang.reflect.Type;

/**
 * Writes records: the type name, then the name and value of every visible field that survives the field options,
 * the zero-value skip and the record's {@link FieldFilter}. A {@link Hashable} record replaces all of that with its
 * own hash.
 */
final class RecordWalker {
    @Nonnull
    private final ValueWalker walker;
    @Nonnull
    private final HashState state;

    RecordWalker(@Nonnull ValueWalker walker, @Nonnull HashState state) {
        this.walker = walker;
        this.state = state;
    }

    void visitRecord(@Nonnull Object record) {
        if (record instanceof Hashable) {
            final long hash = Hooks.structHash((Hashable)record);
            PrimitiveEncoder.writeText(state.getHasher(), Long.toUnsignedString(hash));
            return;
        }
        walkFields(record.getClass(), record);
    }

    /**
     * Write the zero record of a type: every field holds the zero of its declared type. A type with hooks is written
     * through its zero instance so that the hooks see it; without a usable constructor no hooks are consulted.
     */
    void visitZeroRecord(@Nonnull Class<?> recordClass) {
        if (Hashable.class.isAssignableFrom(recordClass) || FieldFilter.class.isAssignableFrom(recordClass)) {
            final Object zero = Hooks.zeroInstance(recordClass);
            if (zero != null) {
                visitRecord(zero);
                return;
            }
        }
        walkFields(recordClass, null);
    }

    private void walkFields(@Nonnull Class<?> recordClass, @Nullable Object record) {
        final HashOptions options = state.getOptions();
        final RecordSchema<?> schema = options.getSchemaRegistry().getSchema(recordClass, options.getTagName());
        final FieldFilter filter = record instanceof FieldFilter ? (FieldFilter)record : null;
        final Hasher hasher = state.getHasher();
        state.enterRecord(recordClass);
        try {
            PrimitiveEncoder.writeText(hasher, schema.getTypeName());
            for (RecordField field : schema.getFields()) {
                if (field.hasOption(HashFieldOption.IGNORE)) {
                    continue;
                }
                Object value = record == null ? ZeroValues.zeroFieldValue(field.getRawType()) : field.get(record);
                if (options.isIgnoreZeroValue() && ZeroValues.isZero(value)) {
                    continue;
                }
                Type type = field.getType();
                if (value != null && field.hasOption(HashFieldOption.STRING)) {
                    if (!TextRendering.hasOwnText(value)) {
                        throw new NotStringRenderableException(field.getName(),
                                LogMessageKeys.TYPE_NAME, schema.getTypeName(),
                                LogMessageKeys.FIELD_NAME, field.getName(),
                                LogMessageKeys.VALUE_CLASS, value.getClass().getName());
                    }
                    value = TextRendering.render(value);
                    type = String.class;
                } else if (value != null && options.isUseStringer() && isRecordLike(value)
                           && TextRendering.rendersByDefault(value)) {
                    value = TextRendering.render(value);
                    type = String.class;
                }
                if (filter != null && !Hooks.includeField(filter, field.getName(), value)) {
                    continue;
                }
                PrimitiveEncoder.writeText(hasher, field.getName());
                walker.visit(value, type,
                        VisitContext.forField(record, field.getName(), field.hasOption(HashFieldOption.SET)));
            }
        } finally {
            state.exitRecord();
        }
    }

    private static boolean isRecordLike(@Nonnull Object value) {
        return ValueKind.of(value) == ValueKind.RECORD;
    }
}
