/*
 * package-info.java
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

/**
 * Annotations shared by StructHash and the value types it hashes. This module has no dependencies, so value types can
 * carry {@link io.structhash.annotation.HashField} metadata without depending on the hashing engine.
 */
package io.structhash.annotation;
