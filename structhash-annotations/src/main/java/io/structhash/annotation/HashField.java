/*
 * HashField.java
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

package io.structhash.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Attaches hashing metadata to a field or record component.
 *
 * <p>
 * The {@link #tag()} plays the role of a metadata key. Only annotations whose tag equals the tag name configured for a
 * hashing call are honored, so one type can carry different metadata for different digests:
 * </p>
 *
 * <pre>{@code
 * public class Document {
 *     public String title;
 *     @HashField(HashFieldOption.IGNORE)
 *     public String uuid;
 *     @HashField(HashFieldOption.SET)
 *     @HashField(value = HashFieldOption.IGNORE, tag = "content")
 *     public List<String> labels;
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD})
@Repeatable(HashFields.class)
@API(API.Status.STABLE)
public @interface HashField {
    /**
     * The tag name used when hashing options do not name another one.
     */
    String DEFAULT_TAG = "hash";

    /**
     * The hashing behavior of the field.
     * @return the option
     */
    HashFieldOption value();

    /**
     * The metadata key this annotation belongs to.
     * @return the tag name
     */
    String tag() default DEFAULT_TAG;
}
