/*
 * CollectionHashTest.java
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

import io.structhash.annotation.HashField;
import io.structhash.annotation.HashFieldOption;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.Multimap;
import com.google.common.hash.HashCode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for how maps, sets and sequences are hashed.
 */
public class CollectionHashTest {

    public static class Tagged {
        @HashField(HashFieldOption.SET)
        public List<String> members;
        public List<String> ordered;

        Tagged(List<String> members, List<String> ordered) {
            this.members = members;
            this.ordered = ordered;
        }
    }

    public static class Holder {
        public List<Long> values;
        public Map<String, Long> counts;
        public long[] primitives;

        Holder(List<Long> values, Map<String, Long> counts, long[] primitives) {
            this.values = values;
            this.counts = counts;
            this.primitives = primitives;
        }
    }

    @Test
    void mapIterationOrderIsIrrelevant() {
        final Map<String, Long> forward = new LinkedHashMap<>();
        final Map<String, Long> backward = new LinkedHashMap<>();
        final List<String> keys = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            keys.add("key" + i);
        }
        for (String key : keys) {
            forward.put(key, (long)key.length());
        }
        Collections.reverse(keys);
        for (String key : keys) {
            backward.put(key, (long)key.length());
        }
        final HashCode expected = hash(forward, HashOptions.DEFAULT);
        assertEquals(expected, hash(backward, HashOptions.DEFAULT));
        assertEquals(expected, hash(new TreeMap<>(forward), HashOptions.DEFAULT));
        assertEquals(expected, hash(new HashMap<>(backward), HashOptions.DEFAULT));
    }

    @Test
    void mapContentMatters() {
        assertThat(hash(Map.of("a", 1L), HashOptions.DEFAULT), not(equalTo(hash(Map.of("a", 2L), HashOptions.DEFAULT))));
        assertThat(hash(Map.of("a", 1L), HashOptions.DEFAULT), not(equalTo(hash(Map.of("b", 1L), HashOptions.DEFAULT))));
    }

    @Test
    void orderedSequenceIsOrderSensitive() {
        assertThat(hash(List.of("a", "b"), HashOptions.DEFAULT), not(equalTo(hash(List.of("b", "a"), HashOptions.DEFAULT))));
    }

    @Test
    void sequenceElementsAreConcatenated() {
        // ordered elements go straight into the enclosing digest
        assertEquals(hash("ab", HashOptions.DEFAULT), hash(List.of("a", "b"), HashOptions.DEFAULT));
        assertEquals(hash(List.of(1L, 2L, 3L), HashOptions.DEFAULT), hash(new int[] {1, 2, 3}, HashOptions.DEFAULT));
    }

    @Test
    void setTaggedFieldIsOrderInsensitive() {
        final Tagged first = new Tagged(List.of("x", "y", "z"), List.of("1", "2"));
        final Tagged second = new Tagged(List.of("z", "x", "y"), List.of("1", "2"));
        final Tagged reordered = new Tagged(List.of("x", "y", "z"), List.of("2", "1"));
        assertEquals(hash(first, HashOptions.DEFAULT), hash(second, HashOptions.DEFAULT));
        assertThat(hash(first, HashOptions.DEFAULT), not(equalTo(hash(reordered, HashOptions.DEFAULT))));
    }

    @Test
    void setElementsAreNotConcatenated() {
        final Tagged split = new Tagged(List.of("ab", "c"), List.of());
        final Tagged joined = new Tagged(List.of("a", "bc"), List.of());
        assertThat(hash(split, HashOptions.DEFAULT), not(equalTo(hash(joined, HashOptions.DEFAULT))));
    }

    @Test
    void slicesAsSets() {
        final HashOptions options = HashOptions.newBuilder().setSlicesAsSets(true).build();
        final Holder first = new Holder(List.of(1L, 2L, 3L), Map.of(), new long[] {4, 5});
        final Holder second = new Holder(List.of(3L, 1L, 2L), Map.of(), new long[] {5, 4});
        assertEquals(hash(first, options), hash(second, options));
        assertThat(hash(first, HashOptions.DEFAULT), not(equalTo(hash(second, HashOptions.DEFAULT))));
    }

    @Test
    void javaSetsAreAlwaysSets() {
        final List<String> elements = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            elements.add("element" + i);
        }
        final Set<String> ordered = new LinkedHashSet<>(elements);
        Collections.shuffle(elements, new Random(0x5eed));
        final Set<String> shuffled = new LinkedHashSet<>(elements);
        assertEquals(hash(ordered, HashOptions.DEFAULT), hash(shuffled, HashOptions.DEFAULT));
        assertEquals(hash(ordered, HashOptions.DEFAULT), hash(ImmutableSet.copyOf(shuffled), HashOptions.DEFAULT));
    }

    @Test
    void multisetsCountDuplicates() {
        assertEquals(hash(ImmutableMultiset.of("a", "b", "a"), HashOptions.DEFAULT),
                hash(HashMultiset.create(List.of("b", "a", "a")), HashOptions.DEFAULT));
        assertThat(hash(ImmutableMultiset.of("a", "b", "a"), HashOptions.DEFAULT),
                not(equalTo(hash(ImmutableMultiset.of("a", "b"), HashOptions.DEFAULT))));
    }

    @Test
    void multimapsAreMaps() {
        final Multimap<String, Long> first = LinkedHashMultimap.create();
        first.put("a", 1L);
        first.put("a", 2L);
        first.put("b", 3L);
        final Multimap<String, Long> second = LinkedHashMultimap.create();
        second.put("b", 3L);
        second.put("a", 2L);
        second.put("a", 1L);
        // set multimap values are sets
        assertEquals(hash(first, HashOptions.DEFAULT), hash(second, HashOptions.DEFAULT));

        final Multimap<String, Long> list = ArrayListMultimap.create();
        list.put("a", 1L);
        list.put("a", 2L);
        final Multimap<String, Long> reversed = ArrayListMultimap.create();
        reversed.put("a", 2L);
        reversed.put("a", 1L);
        assertThat(hash(list, HashOptions.DEFAULT), not(equalTo(hash(reversed, HashOptions.DEFAULT))));
    }

    @Test
    void missingCollectionsAreEmpty() {
        assertEquals(hash(new Holder(null, null, null), HashOptions.DEFAULT),
                hash(new Holder(List.of(), Map.of(), new long[0]), HashOptions.DEFAULT));
        final HashOptions zeroNil = HashOptions.newBuilder().setZeroNil(true).build();
        assertEquals(hash(new Holder(null, null, null), zeroNil),
                hash(new Holder(List.of(), Map.of(), new long[0]), zeroNil));
    }

    private static HashCode hash(Object value, HashOptions options) {
        return StructHash.hashCode(value, HashFormat.SHA_256, options);
    }
}
