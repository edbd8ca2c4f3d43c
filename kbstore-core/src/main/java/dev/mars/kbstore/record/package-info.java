/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
 * Knowledge-base records built on the storage layer.
 * <ul>
 *   <li>{@link dev.mars.kbstore.record.RecordValidator} - Schema checks returning a {@link dev.mars.kbstore.record.ValidationResult}</li>
 *   <li>{@link dev.mars.kbstore.record.KnowledgeUpdater} - Records bugs, requirements and decisions</li>
 *   <li>{@link dev.mars.kbstore.record.ChecksumMap} - File fingerprints for incremental updates</li>
 * </ul>
 */
package dev.mars.kbstore.record;
