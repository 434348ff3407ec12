/*
 * ReflectiveSchemas.java
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

import io.structhash.FieldAccessException;
import io.structhash.annotation.HashField;
import io.structhash.annotation.HashFieldOption;
import io.structhash.logging.KeyValueLogMessage;
import io.structhash.logging.LogMessageKeys;
import com.google.common.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Derives {@link RecordSchema}s from class metadata.
 *
 * <p>
 * A Java {@code record} exposes every component, in declaration order. Any other class exposes its {@code public}
 * instance fields that are neither {@code static} nor {@code transient}, superclass fields first. Field metadata comes
 * from {@link HashField} annotations whose tag matches the requested tag name.
 * </p>
 */
final class ReflectiveSchemas {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReflectiveSchemas.class);

    private ReflectiveSchemas() {
    }

    @Nonnull
    static <T> RecordSchema<T> derive(@Nonnull Class<T> recordClass, @Nonnull String tagName) {
        final RecordSchema.Builder<T> builder = RecordSchema.newBuilder(recordClass);
        final TypeToken<T> token = TypeToken.of(recordClass);
        if (recordClass.isRecord()) {
            for (RecordComponent component : recordClass.getRecordComponents()) {
                builder.addField(component.getName(),
                        token.resolveType(component.getGenericType()).getType(),
                        componentAccessor(component),
                        optionFor(backingField(recordClass, component), tagName));
            }
        } else {
            int visibleFields = 0;
            for (Class<?> declaring : hierarchy(recordClass)) {
                for (Field field : declaring.getDeclaredFields()) {
                    if (!isVisible(field)) {
                        continue;
                    }
                    // A subclass may shadow a superclass field; keep both, the shadowed one under a qualified name.
                    final String name = declaresShadowingField(recordClass, declaring, field)
                                        ? declaring.getSimpleName() + "." + field.getName()
                                        : field.getName();
                    builder.addField(name,
                            token.resolveType(field.getGenericType()).getType(),
                            fieldAccessor(field),
                            optionFor(field, tagName));
                    visibleFields++;
                }
            }
            if (LOGGER.isTraceEnabled() && visibleFields == 0) {
                LOGGER.trace(KeyValueLogMessage.of("record class has no visible fields",
                        LogMessageKeys.RECORD_CLASS, recordClass.getName()));
            }
        }
        final RecordSchema<T> schema = builder.build();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("derived record schema",
                    LogMessageKeys.RECORD_CLASS, recordClass.getName(),
                    LogMessageKeys.TAG_NAME, tagName,
                    LogMessageKeys.FIELD_COUNT, schema.getFields().size()));
        }
        return schema;
    }

    static boolean isVisible(@Nonnull Field field) {
        final int modifiers = field.getModifiers();
        return Modifier.isPublic(modifiers)
               && !Modifier.isStatic(modifiers)
               && !Modifier.isTransient(modifiers)
               && !field.isSynthetic();
    }

    @Nullable
    static HashFieldOption optionFor(@Nullable AnnotatedElement element, @Nonnull String tagName) {
        if (element == null) {
            return null;
        }
        for (HashField annotation : element.getAnnotationsByType(HashField.class)) {
            if (annotation.tag().equals(tagName)) {
                return annotation.value();
            }
        }
        return null;
    }

    @Nonnull
    private static Deque<Class<?>> hierarchy(@Nonnull Class<?> recordClass) {
        final Deque<Class<?>> classes = new ArrayDeque<>();
        for (Class<?> current = recordClass; current != null && current != Object.class; current = current.getSuperclass()) {
            classes.addFirst(current);
        }
        return classes;
    }

    private static boolean declaresShadowingField(@Nonnull Class<?> recordClass, @Nonnull Class<?> declaring,
                                                  @Nonnull Field field) {
        for (Class<?> current = recordClass; current != declaring; current = current.getSuperclass()) {
            for (Field candidate : current.getDeclaredFields()) {
                if (candidate.getName().equals(field.getName()) && isVisible(candidate)) {
                    return true;
                }
            }
        }
        return false;
    }

    @Nullable
    private static Field backingField(@Nonnull Class<?> recordClass, @Nonnull RecordComponent component) {
        try {
            return recordClass.getDeclaredField(component.getName());
        } catch (NoSuchFieldException e) {
            return null;
        }
    }

    @Nonnull
    private static FieldAccessor<Object> fieldAccessor(@Nonnull Field field) {
        field.trySetAccessible();
        return record -> {
            try {
                return field.get(record);
            } catch (IllegalAccessException e) {
                throw (FieldAccessException)new FieldAccessException("cannot read field", e)
                        .addLogInfo(LogMessageKeys.RECORD_CLASS, field.getDeclaringClass().getName(),
                                LogMessageKeys.FIELD_NAME, field.getName());
            }
        };
    }

    @Nonnull
    private static FieldAccessor<Object> componentAccessor(@Nonnull RecordComponent component) {
        final Method accessor = component.getAccessor();
        accessor.trySetAccessible();
        return record -> {
            try {
                return accessor.invoke(record);
            } catch (IllegalAccessException | InvocationTargetException e) {
                final Throwable cause = e instanceof InvocationTargetException ? e.getCause() : e;
                throw (FieldAccessException)new FieldAccessException("cannot read record component", cause)
                        .addLogInfo(LogMessageKeys.RECORD_CLASS, component.getDeclaringRecord().getName(),
                                LogMessageKeys.FIELD_NAME, component.getName());
            }
        };
    }
}
