/*
 * ZeroValueTest.java
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

import com.google.common.hash.HashCode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;

/**
 * Tests for nil/zero equivalence and zero-value skipping.
 */
public class ZeroValueTest {
    private static final HashOptions ZERO_NIL = HashOptions.newBuilder().setZeroNil(true).build();
    private static final HashOptions IGNORE_ZERO = HashOptions.newBuilder().setIgnoreZeroValue(true).build();

    public static class Scalars {
        public String name;
        public Long count;
        public Boolean flag;
        public Double ratio;
        public Instant created;
        public UUID id;
        public BigDecimal amount;
        public Optional<String> nickname;
    }

    public static class Inner {
        public long value;
        public String label;
        public List<String> tags;
    }

    public static class Outer {
        public Inner inner;
        public Optional<Inner> maybe;
    }

    public static class Node {
        public String name;
        public Node next;
    }

    public static class Chain {
        public Node head;
    }

    public record Stamp(long value) implements Hashable {
        @Override
        public long structHash() {
            return value * 31 + 7;
        }
    }

    public record Strict(String id) implements Hashable {
        public Strict {
            Objects.requireNonNull(id);
        }

        @Override
        public long structHash() {
            return id.length();
        }
    }

    public static class Tally implements FieldFilter {
        public String name;
        public long count;

        @Override
        public boolean includeField(String fieldName, Object fieldValue) {
            return !"count".equals(fieldName);
        }
    }

    public static class Hooked {
        public Stamp stamp;
        public Tally tally;
    }

    public static class StrictHolder {
        public Strict strict;
    }

    @Test
    void nullScalarsHashAsZero() {
        final Scalars nulls = new Scalars();
        final Scalars zeros = zeros();
        assertThat(hash(nulls, ZERO_NIL), equalTo(hash(zeros, ZERO_NIL)));
        assertThat(hash(nulls, HashOptions.DEFAULT), not(equalTo(hash(zeros, HashOptions.DEFAULT))));
    }

    @Test
    void nullRecordHashesAsZeroRecord() {
        final Outer nulls = new Outer();
        final Outer zeros = new Outer();
        zeros.inner = new Inner();
        zeros.inner.label = "";
        zeros.maybe = Optional.of(new Inner());
        assertThat(hash(nulls, ZERO_NIL), equalTo(hash(zeros, ZERO_NIL)));
        assertThat(hash(nulls, HashOptions.DEFAULT), not(equalTo(hash(zeros, HashOptions.DEFAULT))));
    }

    @Test
    void zeroRecordDiffersFromPopulatedRecord() {
        final Outer populated = new Outer();
        populated.inner = new Inner();
        populated.inner.value = 1;
        assertThat(hash(new Outer(), ZERO_NIL), not(equalTo(hash(populated, ZERO_NIL))));
    }

    @Test
    void selfReferentialTypesTerminate() {
        final Chain empty = new Chain();
        final Chain single = new Chain();
        single.head = new Node();
        assertThat(hash(empty, ZERO_NIL), equalTo(hash(single, ZERO_NIL)));

        single.head.name = "a";
        assertThat(hash(empty, ZERO_NIL), not(equalTo(hash(single, ZERO_NIL))));
    }

    @Test
    void nullHookedRecordsUseZeroInstance() {
        final Hooked zeros = new Hooked();
        zeros.stamp = new Stamp(0);
        zeros.tally = new Tally();
        assertThat(hash(new Hooked(), ZERO_NIL), equalTo(hash(zeros, ZERO_NIL)));
        // the self hash of the zero stamp, then the filtered zero tally without its count
        assertThat(hash(new Hooked(), ZERO_NIL),
                equalTo(StructHash.hashCode("Hookedstamp7tallyTallyname", HashFormat.SHA_256)));
        assertThat(hash(new Hooked(), HashOptions.DEFAULT), not(equalTo(hash(zeros, HashOptions.DEFAULT))));
    }

    @Test
    void zeroInstanceConstructorFailure() {
        assertThatThrownBy(() -> hash(new StrictHolder(), ZERO_NIL))
                .isInstanceOf(HookFailedException.class)
                .hasCauseInstanceOf(NullPointerException.class)
                .satisfies(e -> org.assertj.core.api.Assertions.assertThat(((HookFailedException)e).getLogInfo())
                        .containsEntry("hook", "zeroInstance")
                        .containsEntry("record_class", Strict.class.getName()));
    }

    @Test
    void ignoreZeroValueSkipsFields() {
        final Scalars zeros = zeros();
        zeros.name = "x";
        // a present optional is not zero, even around an empty string
        zeros.nickname = null;
        final Scalars nulls = new Scalars();
        nulls.name = "x";
        assertThat(hash(zeros, IGNORE_ZERO), equalTo(hash(nulls, IGNORE_ZERO)));
        // only name is left
        assertThat(hash(zeros, IGNORE_ZERO), equalTo(StructHash.hashCode("Scalarsnamex", HashFormat.SHA_256)));
    }

    @Test
    void nonZeroRecordsAreNeverSkipped() {
        final Outer outer = new Outer();
        outer.inner = new Inner();
        assertThat(hash(outer, IGNORE_ZERO), not(equalTo(hash(new Outer(), IGNORE_ZERO))));
    }

    private static Scalars zeros() {
        final Scalars zeros = new Scalars();
        zeros.name = "";
        zeros.count = 0L;
        zeros.flag = false;
        zeros.ratio = 0.0;
        zeros.created = Instant.EPOCH;
        zeros.id = new UUID(0L, 0L);
        zeros.amount = BigDecimal.ZERO;
        zeros.nickname = Optional.of("");
        return zeros;
    }

    private static HashCode hash(Object value, HashOptions options) {
        return StructHash.hashCode(value, HashFormat.SHA_256, options);
    }
}
