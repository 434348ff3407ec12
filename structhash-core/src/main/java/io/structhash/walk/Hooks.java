/*
 * Hooks.java
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

import io.structhash.FieldAccessException;
import io.structhash.FieldFilter;
import io.structhash.Hashable;
import io.structhash.HookFailedException;
import io.structhash.MapEntryFilter;
import io.structhash.StructHashException;
import io.structhash.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;

/**
 * Calls into user hooks. A {@link StructHashException} thrown by a hook passes through untouched; any other runtime
 * exception is wrapped in a {@link HookFailedException} naming the hook and the record class.
 */
final class Hooks {
    private Hooks() {
    }

    static long structHash(@Nonnull Hashable hashable) {
        try {
            return hashable.structHash();
        } catch (StructHashException e) {
            throw e;
        } catch (RuntimeException e) {
            throw failure("structHash", hashable, null, e);
        }
    }

    static boolean includeField(@Nonnull FieldFilter filter, @Nonnull String fieldName, @Nullable Object value) {
        try {
            return filter.includeField(fieldName, value);
        } catch (StructHashException e) {
            throw e;
        } catch (RuntimeException e) {
            throw failure("includeField", filter, fieldName, e);
        }
    }

    static boolean includeMapEntry(@Nonnull MapEntryFilter filter, @Nonnull String fieldName,
                                   @Nullable Object key, @Nullable Object value) {
        try {
            return filter.includeMapEntry(fieldName, key, value);
        } catch (StructHashException e) {
            throw e;
        } catch (RuntimeException e) {
            throw failure("includeMapEntry", filter, fieldName, e);
        }
    }

    /**
     * Build the zero instance of a record class whose hooks must see it: a Java record is built through its canonical
     * constructor with every component at its zero, any other class through its no-argument constructor.
     * @param recordClass the record class
     * @return the zero instance, or {@code null} if the class has no such constructor
     */
    @Nullable
    static Object zeroInstance(@Nonnull Class<?> recordClass) {
        if (recordClass.isInterface() || Modifier.isAbstract(recordClass.getModifiers())) {
            return null;
        }
        final Constructor<?> constructor;
        final Object[] arguments;
        try {
            if (recordClass.isRecord()) {
                final RecordComponent[] components = recordClass.getRecordComponents();
                final Class<?>[] parameterTypes = new Class<?>[components.length];
                arguments = new Object[components.length];
                for (int i = 0; i < components.length; i++) {
                    parameterTypes[i] = components[i].getType();
                    arguments[i] = ZeroValues.zeroFieldValue(parameterTypes[i]);
                }
                constructor = recordClass.getDeclaredConstructor(parameterTypes);
            } else {
                constructor = recordClass.getDeclaredConstructor();
                arguments = new Object[0];
            }
        } catch (NoSuchMethodException e) {
            return null;
        }
        if (!constructor.trySetAccessible()) {
            return null;
        }
        try {
            return constructor.newInstance(arguments);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof StructHashException) {
                throw (StructHashException)e.getCause();
            }
            throw failure("zeroInstance", recordClass, null, e.getCause());
        } catch (InstantiationException | IllegalAccessException e) {
            throw (FieldAccessException)new FieldAccessException("cannot build zero record", e)
                    .addLogInfo(LogMessageKeys.RECORD_CLASS, recordClass.getName());
        }
    }

    @Nonnull
    private static HookFailedException failure(@Nonnull String hook, @Nonnull Object record,
                                               @Nullable String fieldName, @Nonnull Throwable cause) {
        return failure(hook, record.getClass(), fieldName, cause);
    }

    @Nonnull
    private static HookFailedException failure(@Nonnull String hook, @Nonnull Class<?> recordClass,
                                               @Nullable String fieldName, @Nonnull Throwable cause) {
        final HookFailedException failure = new HookFailedException("hook failed", cause);
        failure.addLogInfo(LogMessageKeys.HOOK, hook, LogMessageKeys.RECORD_CLASS, recordClass.getName());
        if (fieldName != null) {
            failure.addLogInfo(LogMessageKeys.FIELD_NAME, fieldName);
        }
        return failure;
    }
}
