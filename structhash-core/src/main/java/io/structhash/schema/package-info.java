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
 * Per-type field lists. A {@link io.structhash.schema.RecordSchema} fixes which fields of a record type are hashed,
 * in which order, and with which {@link io.structhash.annotation.HashFieldOption}. Schemas are derived reflectively
 * by default and can be registered explicitly through a {@link io.structhash.schema.RecordSchemaRegistry}.
 */
package io.structhash.schema;
