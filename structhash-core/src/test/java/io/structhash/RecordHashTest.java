/*
 * RecordHashTest.java
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
import com.google.common.hash.HashCode;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

/**
 * Tests for hashing records: visibility, field options, hooks and text rendering.
 */
public class RecordHashTest {

    public static class Account {
        public String owner;
        @HashField(HashFieldOption.IGNORE)
        public String sessionId;
        @HashField(value = HashFieldOption.IGNORE, tag = "audit")
        public long balance;
        private String secret;
        public static String shared = "static";
        public transient String cached;

        Account(String owner, String sessionId, long balance, String secret) {
            this.owner = owner;
            this.sessionId = sessionId;
            this.balance = balance;
            this.secret = secret;
            this.cached = secret;
        }
    }

    public static class Label {
        private final String text;
        public final int revision;

        Label(String text, int revision) {
            this.text = text;
            this.revision = revision;
        }

        @Override
        public String toString() {
            return text;
        }
    }

    public static class Opaque {
        private final String text;

        Opaque(String text) {
            this.text = text;
        }
    }

    public static class Coord {
        public long x;

        Coord(long x) {
            this.x = x;
        }
    }

    public static class Labelled {
        @HashField(HashFieldOption.STRING)
        public Object label;

        Labelled(Object label) {
            this.label = label;
        }
    }

    public static class Plain {
        public Object label;

        Plain(Object label) {
            this.label = label;
        }
    }

    public static class SelfHashed implements Hashable {
        public String ignoredByHook;
        private final long hash;

        SelfHashed(String ignoredByHook, long hash) {
            this.ignoredByHook = ignoredByHook;
            this.hash = hash;
        }

        @Override
        public long structHash() {
            return hash;
        }
    }

    public static class Failing implements Hashable {
        private final RuntimeException failure;

        Failing(RuntimeException failure) {
            this.failure = failure;
        }

        @Override
        public long structHash() {
            throw failure;
        }
    }

    public static class Filtered implements FieldFilter, MapEntryFilter {
        public String name;
        public String note;
        public Map<String, String> attributes;

        Filtered(String name, String note, Map<String, String> attributes) {
            this.name = name;
            this.note = note;
            this.attributes = attributes;
        }

        @Override
        public boolean includeField(String fieldName, Object fieldValue) {
            return !"note".equals(fieldName);
        }

        @Override
        public boolean includeMapEntry(String fieldName, Object key, Object value) {
            return !key.toString().startsWith("tmp.");
        }
    }

    public record Badge(@HashField(HashFieldOption.IGNORE) String id, String name) {
    }

    public static class Base {
        public String id;
    }

    public static class Derived extends Base {
        public String name;
    }

    public static class Flat {
        public String id;
        public String name;
    }

    @Test
    void ignoredFieldsNeverMatter() {
        assertEquals(hash(new Account("ann", "s1", 10, "x")), hash(new Account("ann", "s2", 10, "x")));
        assertNotEquals(hash(new Account("ann", "s1", 10, "x")), hash(new Account("bob", "s1", 10, "x")));
    }

    @Test
    void invisibleFieldsNeverMatter() {
        assertEquals(hash(new Account("ann", "s1", 10, "x")), hash(new Account("ann", "s1", 10, "y")));
        assertEquals(StructHash.hashCode(new Opaque("a"), HashFormat.MD5),
                StructHash.hashCode(new Opaque("b"), HashFormat.MD5));
    }

    @Test
    void onlyMatchingTagApplies() {
        // balance is ignored under "audit" only
        assertNotEquals(hash(new Account("ann", "s1", 10, "x")), hash(new Account("ann", "s1", 20, "x")));
        final HashOptions audit = HashOptions.newBuilder().setTagName("audit").build();
        assertEquals(hash(new Account("ann", "s1", 10, "x"), audit), hash(new Account("ann", "s1", 20, "x"), audit));
        // sessionId is no longer ignored
        assertNotEquals(hash(new Account("ann", "s1", 10, "x"), audit),
                hash(new Account("ann", "s2", 10, "x"), audit));
    }

    @Test
    void typeNameIsPartOfDigest() {
        final Derived derived = new Derived();
        derived.id = "1";
        derived.name = "n";
        final Flat flat = new Flat();
        flat.id = "1";
        flat.name = "n";
        // same fields in the same order, different type names
        assertNotEquals(hash(derived), hash(flat));
        assertEquals(StructHash.hashCode("Derivedid1namen", HashFormat.MD5),
                StructHash.hashCode(derived, HashFormat.MD5));
    }

    @Test
    void selfHashReplacesFields() {
        assertEquals(hash(new SelfHashed("a", 42)), hash(new SelfHashed("b", 42)));
        assertEquals(hash("42"), hash(new SelfHashed("a", 42)));
        // negative hashes are unsigned
        assertEquals(hash("18446744073709551615"), hash(new SelfHashed("a", -1)));
    }

    @Test
    void hookFailuresAreWrapped() {
        final IllegalStateException cause = new IllegalStateException("boom");
        assertThatThrownBy(() -> hash(new Failing(cause)))
                .isInstanceOf(HookFailedException.class)
                .hasCause(cause)
                .satisfies(e -> assertThat(((HookFailedException)e).getLogInfo())
                        .containsEntry("hook", "structHash")
                        .containsEntry("record_class", Failing.class.getName()));
    }

    @Test
    void hashingErrorsFromHooksPropagate() {
        final UnsupportedValueKindException failure = new UnsupportedValueKindException("nested");
        assertThatThrownBy(() -> hash(new Failing(failure))).isSameAs(failure);
    }

    @Test
    void filtersSkipFieldsAndEntries() {
        final Map<String, String> attributes = new HashMap<>();
        attributes.put("color", "red");
        final Map<String, String> withTemporary = new HashMap<>(attributes);
        withTemporary.put("tmp.session", "abc");
        assertEquals(hash(new Filtered("n", "one", attributes)), hash(new Filtered("n", "two", withTemporary)));
        assertNotEquals(hash(new Filtered("n", "one", attributes)), hash(new Filtered("m", "one", attributes)));
    }

    @Test
    void stringTagUsesText() {
        assertEquals(hash(new Labelled(new Label("release", 1))), hash(new Labelled(new Label("release", 2))));
        assertEquals(hash(new Labelled("release")), hash(new Labelled(new Label("release", 2))));
        assertNotEquals(hash(new Plain(new Label("release", 1))), hash(new Plain(new Label("release", 2))));
    }

    @Test
    void stringTagWithoutText() {
        assertThatThrownBy(() -> hash(new Labelled(new Opaque("x"))))
                .isInstanceOf(NotStringRenderableException.class)
                .satisfies(e -> assertThat(((NotStringRenderableException)e).getField()).isEqualTo("label"));
        // nothing to render
        assertDoesNotThrow(() -> hash(new Labelled(null)));
    }

    @Test
    void useStringerRendersRecords() {
        final HashOptions stringer = HashOptions.newBuilder().setUseStringer(true).build();
        assertEquals(hash(new Plain(new Label("release", 1)), stringer),
                hash(new Plain(new Label("release", 2)), stringer));
        assertEquals(hash(new Plain("release"), stringer), hash(new Plain(new Label("release", 2)), stringer));
        // records without text are still walked
        assertNotEquals(hash(new Plain(new Coord(1)), stringer), hash(new Plain(new Coord(2)), stringer));
        // text is not substituted for scalars
        assertEquals(hash(new Plain(7L), stringer), hash(new Plain(7L)));
    }

    @Test
    void useStringerWalksJavaRecords() {
        final HashOptions stringer = HashOptions.newBuilder().setUseStringer(true).build();
        // the generated toString() lists the ignored id, so it must not stand in for the record
        assertEquals(hash(new Plain(new Badge("id-1", "n")), stringer),
                hash(new Plain(new Badge("id-2", "n")), stringer));
        assertEquals(hash(new Plain(new Badge("id-1", "n"))), hash(new Plain(new Badge("id-1", "n")), stringer));
        assertNotEquals(hash(new Plain(new Badge("id-1", "n")), stringer),
                hash(new Plain(new Badge("id-1", "m")), stringer));
    }

    @Test
    void stringTagRendersJavaRecords() {
        final Badge badge = new Badge("id-1", "n");
        assertEquals(hash(new Labelled(badge.toString())), hash(new Labelled(badge)));
        assertNotEquals(hash(new Labelled(badge)), hash(new Labelled(new Badge("id-2", "n"))));
    }

    private static HashCode hash(Object value) {
        return hash(value, HashOptions.DEFAULT);
    }

    private static HashCode hash(Object value, HashOptions options) {
        return StructHash.hashCode(value, HashFormat.SHA_256, options);
    }
}
