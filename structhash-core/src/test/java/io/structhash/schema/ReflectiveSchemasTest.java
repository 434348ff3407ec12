/*
 * ReflectiveSchemasTest.java
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

import io.structhash.annotation.HashField;
import io.structhash.annotation.HashFieldOption;
import com.google.common.reflect.TypeToken;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link ReflectiveSchemas}.
 */
public class ReflectiveSchemasTest {

    public record Line(String sku, @HashField(HashFieldOption.IGNORE) String note, long quantity) {
    }

    public static class Base<T> {
        public T value;
        public String shadowed;
        private String hidden;
    }

    public static class Child extends Base<List<Long>> {
        public String name;
        public String shadowed;
        public static String constant;
        public transient String cache;
        protected String guarded;
    }

    public static class Tagged {
        @HashField(HashFieldOption.SET)
        @HashField(value = HashFieldOption.IGNORE, tag = "wire")
        public List<String> members;
    }

    public static class Secretive {
        private String key;
        String packagePrivate;
    }

    @Test
    void recordComponentsInOrder() {
        final RecordSchema<Line> schema = ReflectiveSchemas.derive(Line.class, "hash");
        assertEquals("Line", schema.getTypeName());
        assertThat(names(schema), contains("sku", "note", "quantity"));
        assertThat(schema.getFields().get(1).getOption(), equalTo(HashFieldOption.IGNORE));
        assertEquals(long.class, schema.getFields().get(2).getType());
        assertEquals(7L, schema.getFields().get(2).get(new Line("a", "b", 7)));
    }

    @Test
    void superclassFieldsFirst() {
        final RecordSchema<Child> schema = ReflectiveSchemas.derive(Child.class, "hash");
        assertThat(names(schema), contains("value", "Base.shadowed", "name", "shadowed"));
        assertEquals(new TypeToken<List<Long>>() { }.getType(), schema.getFields().get(0).getType());

        final Child child = new Child();
        child.shadowed = "child";
        ((Base<List<Long>>)child).shadowed = "base";
        assertEquals("base", schema.getFields().get(1).get(child));
        assertEquals("child", schema.getFields().get(3).get(child));
    }

    @Test
    void optionsFollowTag() {
        assertThat(ReflectiveSchemas.derive(Tagged.class, "hash").getFields().get(0).getOption(),
                equalTo(HashFieldOption.SET));
        assertThat(ReflectiveSchemas.derive(Tagged.class, "wire").getFields().get(0).getOption(),
                equalTo(HashFieldOption.IGNORE));
        assertThat(ReflectiveSchemas.derive(Tagged.class, "other").getFields().get(0).getOption(), nullValue());
    }

    @Test
    void noVisibleFields() {
        final RecordSchema<Secretive> schema = ReflectiveSchemas.derive(Secretive.class, "hash");
        assertEquals("Secretive", schema.getTypeName());
        assertThat(schema.getFields().size(), equalTo(0));
    }

    private static List<String> names(RecordSchema<?> schema) {
        return schema.getFields().stream().map(RecordField::getName).collect(Collectors.toList());
    }
}
