/*
 * API.java
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
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares how stable a public type, field or method of StructHash is for code outside the project.
 *
 * <p>
 * Members inherit the status of their enclosing type unless annotated themselves. A status may move towards
 * {@link Status#STABLE} at any time, but it must not move the other way before the next minor release.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * Return the {@link Status} of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability statuses, from least to most stable.
     */
    enum Status {
        /**
         * Public only so that other StructHash packages can reach it, for example the traversal internals in
         * {@code io.structhash.walk}. May change in any release.
         */
        INTERNAL,

        /**
         * Scheduled for removal. Kept until at least the next minor release.
         */
        DEPRECATED,

        /**
         * New and still settling. Callers may use it, but it can change or disappear without notice.
         */
        EXPERIMENTAL,

        /**
         * Will not change before the next minor release.
         */
        UNSTABLE,

        /**
         * Will not change incompatibly before the next major release. Digest output is not covered: the byte
         * layout of a digest may change with any release.
         */
        STABLE
    }
}
