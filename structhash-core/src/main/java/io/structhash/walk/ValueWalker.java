/*
 * ValueWalker.java
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

import io.structhash.HashFormat;
import io.structhash.HashOptions;
import io.structhash.UnsupportedValueKindException;
import io.structhash.annotation.API;
import io.structhash.logging.LogMessageKeys;
import io.structhash.optional.OptionalAdapters;
import io.structhash.optional.OptionalKind;
import io.structhash.optional.OptionalValue;
import com.google.common.collect.Multimap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.lang.reflect.Type;
import java.util.Collection;
import java.util.Map;

/**
 * Depth-first traversal of a value graph into a single digest. Each value is normalized, classified by
 * {@link ValueKind} and handed to the encoder for its kind; nested values come back through {@link #visit}.
 */
@API(API.Status.INTERNAL)
public final class ValueWalker {
    @Nonnull
    private final HashState state;
    @Nonnull
    private final RecordWalker records;
    @Nonnull
    private final CollectionCanonicalizer collections;

    private ValueWalker(@Nonnull HashState state) {
        this.state = state;
        this.records = new RecordWalker(this, state);
        this.collections = new CollectionCanonicalizer(this, state);
    }

    /**
     * Compute the digest of a value.
     * @param value the value to hash
     * @param format the digest to compute
     * @param options the options to hash with
     * @return the digest bytes
     */
    @Nonnull
    public static byte[] digest(@Nullable Object value, @Nonnull HashFormat format, @Nonnull HashOptions options) {
        return new ValueWalker(new HashState(format, options)).walk(value, Object.class);
    }

    @Nonnull
    byte[] digestIndependently(@Nullable Object value, @Nonnull Type declaredType) {
        return new ValueWalker(state.newIndependent()).walk(value, declaredType);
    }

    @Nonnull
    private byte[] walk(@Nullable Object value, @Nonnull Type declaredType) {
        visit(value, declaredType, VisitContext.NONE);
        return state.finish();
    }

    void visit(@Nullable Object value, @Nonnull Type declaredType, @Nonnull VisitContext context) {
        final NormalizedValue normalized = ValueNormalizer.normalize(value, declaredType);
        if (normalized.isAbsent()) {
            visitAbsent(normalized.getType());
            return;
        }
        final Object concrete = normalized.getValue();
        final Type type = normalized.getType();
        final ValueKind kind = ValueKind.of(concrete);
        switch (kind) {
            case OPTIONAL:
                OptionalEncoder.encode(state.getHasher(), OptionalAdapters.adapt(concrete), state.getOptions());
                break;
            case SCALAR:
                PrimitiveEncoder.write(state.getHasher(), concrete);
                break;
            case MAP:
                collections.visitMap((Map<?, ?>)concrete,
                        Types.typeArgument(type, Map.class, 0), Types.typeArgument(type, Map.class, 1), context);
                break;
            case MULTIMAP:
                collections.visitMap(((Multimap<?, ?>)concrete).asMap(),
                        Types.typeArgument(type, Multimap.class, 0),
                        Types.collectionOf(Types.typeArgument(type, Multimap.class, 1)), context);
                break;
            case SET:
                collections.visitSet((Iterable<?>)concrete, Types.typeArgument(type, Iterable.class, 0));
                break;
            case SEQUENCE:
                visitSequence((Collection<?>)concrete, Types.typeArgument(type, Iterable.class, 0), context);
                break;
            case ARRAY:
                visitSequence(Types.arrayElements(concrete), Types.componentType(type, concrete), context);
                break;
            case RECORD:
                records.visitRecord(concrete);
                break;
            default:
                throw new UnsupportedValueKindException("value kind cannot be hashed",
                        LogMessageKeys.VALUE_CLASS, concrete.getClass().getName());
        }
    }

    private void visitSequence(@Nonnull Collection<?> elements, @Nonnull Type elementType,
                               @Nonnull VisitContext context) {
        if (context.hasFlag(VisitFlag.SET) || state.getOptions().isSlicesAsSets()) {
            collections.visitSet(elements, elementType);
        } else {
            collections.visitSequence(elements, elementType);
        }
    }

    /**
     * Write a missing value of the given declared type. Missing collections are empty; other missing values are the
     * nil marker, or the zero of their type when nil and zero are equivalent.
     */
    private void visitAbsent(@Nonnull Type declaredType) {
        final Class<?> raw = Types.rawType(declaredType);
        final ValueKind kind = ValueKind.ofType(raw);
        if (kind.isCollectionLike()) {
            return;
        }
        if (!state.getOptions().isZeroNil()) {
            PrimitiveEncoder.writeNil(state.getHasher());
            return;
        }
        switch (kind) {
            case SCALAR:
                final Object zero = ZeroValues.zeroOf(raw);
                if (zero != null) {
                    PrimitiveEncoder.write(state.getHasher(), zero);
                }
                break;
            case OPTIONAL:
                final OptionalKind optionalKind = OptionalAdapters.kindOf(raw);
                if (optionalKind != null) {
                    final OptionalValue absent = OptionalAdapters.absent(optionalKind);
                    OptionalEncoder.encode(state.getHasher(), absent, state.getOptions());
                } else {
                    PrimitiveEncoder.writeNil(state.getHasher());
                }
                break;
            case RECORD:
                if (!state.isOnRecordPath(raw)) {
                    records.visitZeroRecord(raw);
                }
                break;
            default:
                PrimitiveEncoder.writeNil(state.getHasher());
                break;
        }
    }
}
