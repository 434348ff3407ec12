/*
 * UnsupportedValueTest.java
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

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests that values with no defined encoding are rejected instead of hashed as something else.
 */
public class UnsupportedValueTest {

    public static class Holder {
        public Object payload;

        Holder(Object payload) {
            this.payload = payload;
        }
    }

    static Stream<Arguments> unsupported() {
        final Supplier<String> lambda = () -> "x";
        return Stream.of(
                Arguments.of("class", String.class),
                Arguments.of("stream", Stream.of(1, 2)),
                Arguments.of("iterator", List.of(1).iterator()),
                Arguments.of("future", CompletableFuture.completedFuture("done")),
                Arguments.of("thread", Thread.currentThread()),
                Arguments.of("lambda", lambda),
                Arguments.of("object", new Object()),
                Arguments.of("nested", new Holder(new Object())),
                Arguments.of("in map", ImmutableMap.of("k", String.class)));
    }

    @ParameterizedTest(name = "unsupported [{0}]")
    @MethodSource("unsupported")
    void rejected(String description, Object value) {
        assertThatThrownBy(() -> StructHash.hash(value, HashFormat.MD5))
                .isInstanceOf(UnsupportedValueKindException.class)
                .satisfies(e -> assertThat(((UnsupportedValueKindException)e).getLogInfo())
                        .containsKey("value_class"));
    }
}
