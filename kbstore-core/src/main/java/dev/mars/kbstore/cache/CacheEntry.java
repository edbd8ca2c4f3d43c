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
package dev.mars.kbstore.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A cached document and the facts needed to validate it.
 *
 * @param data        the parsed document
 * @param insertedAt  when the entry was stored
 * @param fingerprint content fingerprint of the file when stored
 * @param accessCount number of times the entry was stored or served
 */
public record CacheEntry(JsonNode data, Instant insertedAt, String fingerprint, int accessCount) {

    /** Same entry with the access counter incremented. */
    CacheEntry touched() {
        return new CacheEntry(data, insertedAt, fingerprint, accessCount + 1);
    }
}
