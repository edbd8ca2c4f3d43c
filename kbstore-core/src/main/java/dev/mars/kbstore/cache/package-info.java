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
 * Read-through cache for knowledge-base documents.
 * <p>
 * {@link dev.mars.kbstore.cache.IntelligentCache} validates every hit against the file's
 * current content fingerprint and an adaptive TTL, and bounds memory with LRU eviction.
 * {@link dev.mars.kbstore.cache.ContextLoader} composes it with direct JSON loading and
 * decides per {@link dev.mars.kbstore.cache.CacheCategory} whether a document is cached.
 * <p>
 * Not thread-safe: share an instance across threads only under external
 * synchronization.
 */
package dev.mars.kbstore.cache;
